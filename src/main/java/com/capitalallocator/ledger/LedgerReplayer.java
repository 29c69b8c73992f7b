package com.capitalallocator.ledger;

import com.capitalallocator.domain.model.CapitalTransaction;
import com.capitalallocator.domain.model.LedgerBalance;
import com.capitalallocator.domain.model.Money;
import com.capitalallocator.exception.LedgerContractException;
import java.math.BigDecimal;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Rebuilds an account's balances from its transaction log, starting from zero.
 *
 * <p>Used to audit the live ledger: for any account, replaying
 * {@link CapitalLedger#getTransactions} must give the same amounts as
 * {@link CapitalLedger#getBalance}.
 */
@Component
public class LedgerReplayer {

    public LedgerBalance replay(String accountId, List<CapitalTransaction> transactions) {
        BigDecimal total = BigDecimal.ZERO;
        BigDecimal available = BigDecimal.ZERO;
        BigDecimal reserved = BigDecimal.ZERO;
        BigDecimal deployed = BigDecimal.ZERO;
        BigDecimal realized = BigDecimal.ZERO;

        for (CapitalTransaction tx : transactions) {
            if (!accountId.equals(tx.getAccountId())) {
                throw new LedgerContractException(
                        "Transaction " + tx.getId() + " belongs to " + tx.getAccountId() + ", not " + accountId);
            }
            BigDecimal amount = tx.getAmount();
            switch (tx.getType()) {
                case DEPOSIT, SIP_CONTRIBUTION, TRANSFER_IN -> {
                    total = total.add(amount);
                    available = available.add(amount);
                }
                case TRANSFER_OUT -> {
                    total = total.subtract(amount);
                    available = available.subtract(amount);
                }
                case RESERVE -> {
                    available = available.subtract(amount);
                    reserved = reserved.add(amount);
                }
                case RELEASE -> {
                    reserved = reserved.subtract(amount);
                    available = available.add(amount);
                }
                case DEPLOY -> {
                    reserved = reserved.subtract(amount);
                    deployed = deployed.add(amount);
                }
                case RETURN -> {
                    BigDecimal pnl = tx.getRealizedPnl() == null ? BigDecimal.ZERO : tx.getRealizedPnl();
                    deployed = deployed.subtract(amount);
                    available = available.add(amount).add(pnl);
                    realized = realized.add(pnl);
                }
            }
        }

        return new LedgerBalance(
                accountId, Money.of(total), Money.of(available), Money.of(reserved), Money.of(deployed), Money.of(realized));
    }
}
