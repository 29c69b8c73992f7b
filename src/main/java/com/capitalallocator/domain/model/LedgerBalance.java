package com.capitalallocator.domain.model;

import java.math.BigDecimal;

/**
 * Point-in-time cash buckets of one account, as read from the ledger or rebuilt by replay.
 */
public record LedgerBalance(
        String accountId,
        BigDecimal totalCapital,
        BigDecimal availableCash,
        BigDecimal reservedCash,
        BigDecimal deployedCash,
        BigDecimal realizedPnl) {

    public static LedgerBalance of(Account account) {
        return new LedgerBalance(
                account.getId(),
                account.getTotalCapital(),
                account.getAvailableCash(),
                account.getReservedCash(),
                account.getDeployedCash(),
                account.getRealizedPnl());
    }

    /** available + reserved + deployed, which must equal totalCapital + realizedPnl. */
    public BigDecimal cashTotal() {
        return availableCash.add(reservedCash).add(deployedCash);
    }

    public boolean isConsistent() {
        return cashTotal().compareTo(totalCapital.add(realizedPnl)) == 0
                && availableCash.signum() >= 0
                && reservedCash.signum() >= 0
                && deployedCash.signum() >= 0;
    }

    /** Compares amounts by value, ignoring scale. */
    public boolean sameAmounts(LedgerBalance other) {
        return totalCapital.compareTo(other.totalCapital) == 0
                && availableCash.compareTo(other.availableCash) == 0
                && reservedCash.compareTo(other.reservedCash) == 0
                && deployedCash.compareTo(other.deployedCash) == 0
                && realizedPnl.compareTo(other.realizedPnl) == 0;
    }
}
