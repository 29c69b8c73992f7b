package com.capitalallocator.allocation;

import com.capitalallocator.domain.model.Account;
import com.capitalallocator.domain.model.Mandate;
import com.capitalallocator.domain.model.Money;
import com.capitalallocator.exception.InvalidSnapshotException;
import java.math.BigDecimal;
import org.springframework.stereotype.Component;

/**
 * Rejects account and mandate snapshots the engine cannot reason about. The engine refuses to
 * allocate for such an account instead of guessing.
 */
@Component
public class SnapshotValidator {

    public void validate(Account account, Mandate mandate) {
        String id = account.getId();
        if (account.getObjective() == null) {
            throw new InvalidSnapshotException("Account " + id + " has no objective");
        }
        requireNonNegative(account.getTotalCapital(), "totalCapital", id);
        requireNonNegative(account.getAvailableCash(), "availableCash", id);
        requireNonNegative(account.getReservedCash(), "reservedCash", id);
        requireNonNegative(account.getDeployedCash(), "deployedCash", id);
        requirePercent(account.getEmergencyBufferPercent(), "emergencyBufferPercent", id, false);
        requireBalanced(account);

        if (mandate.getMinHorizonDays() < 0 || mandate.getMinHorizonDays() > mandate.getMaxHorizonDays()) {
            throw new InvalidSnapshotException("Mandate v" + mandate.getVersion() + " of account " + id
                    + " has invalid horizon range [" + mandate.getMinHorizonDays() + ", "
                    + mandate.getMaxHorizonDays() + "]");
        }
        if (mandate.getMaxRiskPerTradePercent() == null) {
            throw new InvalidSnapshotException("Mandate of account " + id + " has no maxRiskPerTradePercent");
        }
        requirePercent(mandate.getMaxRiskPerTradePercent(), "maxRiskPerTradePercent", id, true);
        requirePercent(mandate.getMaxSectorExposurePercent(), "maxSectorExposurePercent", id, true);
        if (mandate.getMaxPositionSize() != null) {
            if (mandate.getMaxPositionSize().signum() <= 0) {
                throw new InvalidSnapshotException("Mandate of account " + id + " has non-positive maxPositionSize");
            }
            if (mandate.getMaxPositionSizeType() == null) {
                throw new InvalidSnapshotException("Mandate of account " + id + " has no maxPositionSizeType");
            }
        }
        requirePositive(mandate.getStopLossAtrMultiple(), "stopLossAtrMultiple", id);
        requirePositive(mandate.getTakeProfitAtrMultiple(), "takeProfitAtrMultiple", id);
        if (mandate.getEarningsBlackoutDays() != null && mandate.getEarningsBlackoutDays() < 0) {
            throw new InvalidSnapshotException("Mandate of account " + id + " has negative earningsBlackoutDays");
        }
        if (mandate.getMaxOpenPositions() != null && mandate.getMaxOpenPositions() < 0) {
            throw new InvalidSnapshotException("Mandate of account " + id + " has negative maxOpenPositions");
        }
    }

    private static void requireNonNegative(BigDecimal value, String field, String accountId) {
        if (value == null || value.signum() < 0) {
            throw new InvalidSnapshotException("Account " + accountId + " has invalid " + field + ": " + value);
        }
    }

    /** available + reserved + deployed must equal contributed capital plus booked P&L. */
    private static void requireBalanced(Account account) {
        BigDecimal realizedPnl = account.getRealizedPnl() != null ? account.getRealizedPnl() : BigDecimal.ZERO;
        BigDecimal buckets =
                account.getAvailableCash().add(account.getReservedCash()).add(account.getDeployedCash());
        BigDecimal expected = account.getTotalCapital().add(realizedPnl);
        if (buckets.compareTo(expected) != 0) {
            throw new InvalidSnapshotException("Account " + account.getId() + " cash buckets sum to " + buckets
                    + " but capital plus realized P&L is " + expected);
        }
    }

    private static void requirePositive(BigDecimal value, String field, String accountId) {
        if (value != null && value.signum() <= 0) {
            throw new InvalidSnapshotException("Mandate of account " + accountId + " has invalid " + field + ": "
                    + value);
        }
    }

    /** Null passes; the field then falls back to its default. */
    private static void requirePercent(BigDecimal value, String field, String accountId, boolean strictlyPositive) {
        if (value == null) {
            return;
        }
        boolean belowRange = strictlyPositive ? value.signum() <= 0 : value.signum() < 0;
        if (belowRange || value.compareTo(Money.HUNDRED) > 0) {
            throw new InvalidSnapshotException("Account " + accountId + " has out-of-range " + field + ": " + value);
        }
    }
}
