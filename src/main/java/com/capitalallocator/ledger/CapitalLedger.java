package com.capitalallocator.ledger;

import com.capitalallocator.domain.enums.TransactionType;
import com.capitalallocator.domain.model.Account;
import com.capitalallocator.domain.model.CapitalTransaction;
import com.capitalallocator.domain.model.LedgerBalance;
import com.capitalallocator.domain.model.Money;
import com.capitalallocator.domain.model.PortfolioSummary;
import com.capitalallocator.event.EventPublisherHelper;
import com.capitalallocator.exception.InsufficientFundsException;
import com.capitalallocator.exception.LedgerContractException;
import com.capitalallocator.exception.ResourceNotFoundException;
import com.capitalallocator.repository.AccountRepository;
import com.capitalallocator.repository.CapitalTransactionRepository;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Per-account capital state machine: available → reserved → deployed → available.
 *
 * <p>Every mutation runs under the account's lock from {@link AccountLockRegistry}, validates
 * before it writes, and appends exactly one {@link CapitalTransaction} per account touched.
 * The transaction log is the audit source of truth; {@link LedgerReplayer} rebuilds balances
 * from it.
 *
 * <p>Only {@link #reserve} fails under normal operation, and it reports insufficient cash as a
 * {@link ReserveResult}. Every other misuse (deploying more than reserved, non-positive
 * amounts) is a caller bug and throws {@link LedgerContractException}.
 */
@Service
public class CapitalLedger {

    private static final Logger log = LoggerFactory.getLogger(CapitalLedger.class);

    private final AccountRepository accountRepository;
    private final CapitalTransactionRepository transactionRepository;
    private final AccountLockRegistry lockRegistry;
    private final EventPublisherHelper eventPublisherHelper;
    private final Clock clock;

    public CapitalLedger(
            AccountRepository accountRepository,
            CapitalTransactionRepository transactionRepository,
            AccountLockRegistry lockRegistry,
            EventPublisherHelper eventPublisherHelper,
            Clock clock) {
        this.accountRepository = accountRepository;
        this.transactionRepository = transactionRepository;
        this.lockRegistry = lockRegistry;
        this.eventPublisherHelper = eventPublisherHelper;
        this.clock = clock;
    }

    // ========================
    // CASH STATE MACHINE
    // ========================

    /**
     * Moves {@code amount} from available to reserved if the account has enough available cash.
     * Atomic with respect to every other mutation on the same account.
     */
    public ReserveResult reserve(String accountId, BigDecimal amount, String reference) {
        BigDecimal value = requirePositive(amount, "reserve");
        return lockRegistry.withLock(accountId, () -> {
            Account account = load(accountId);
            if (value.compareTo(account.getAvailableCash()) > 0) {
                log.debug(
                        "Reserve of {} rejected for account {}: only {} available",
                        value,
                        accountId,
                        account.getAvailableCash());
                return ReserveResult.INSUFFICIENT_FUNDS;
            }
            account.setAvailableCash(account.getAvailableCash().subtract(value));
            account.setReservedCash(account.getReservedCash().add(value));
            commit(account, TransactionType.RESERVE, value, BigDecimal.ZERO, reference, null, null);
            return ReserveResult.OK;
        });
    }

    /** Moves reserved cash to deployed once an order fills. */
    public void deploy(String accountId, BigDecimal amount, String reference) {
        BigDecimal value = requirePositive(amount, "deploy");
        lockRegistry.withLock(accountId, () -> {
            Account account = load(accountId);
            if (value.compareTo(account.getReservedCash()) > 0) {
                throw new LedgerContractException(
                        "Cannot deploy " + value + " from account " + accountId + ": only "
                                + account.getReservedCash() + " reserved",
                        Map.of("accountId", accountId, "amount", value, "reserved", account.getReservedCash()));
            }
            account.setReservedCash(account.getReservedCash().subtract(value));
            account.setDeployedCash(account.getDeployedCash().add(value));
            commit(account, TransactionType.DEPLOY, value, BigDecimal.ZERO, reference, null, null);
        });
    }

    /**
     * Returns a closed position's cost basis to available cash and books its realized P&L.
     *
     * @param amount      cost basis being released from deployed
     * @param realizedPnl gain (positive) or loss (negative); available receives amount + realizedPnl
     */
    public void returnToAvailable(String accountId, BigDecimal amount, BigDecimal realizedPnl, String reference) {
        BigDecimal value = requirePositive(amount, "return");
        BigDecimal pnl = Money.of(realizedPnl);
        lockRegistry.withLock(accountId, () -> {
            Account account = load(accountId);
            if (value.compareTo(account.getDeployedCash()) > 0) {
                throw new LedgerContractException(
                        "Cannot return " + value + " to account " + accountId + ": only "
                                + account.getDeployedCash() + " deployed",
                        Map.of("accountId", accountId, "amount", value, "deployed", account.getDeployedCash()));
            }
            BigDecimal newAvailable = account.getAvailableCash().add(value).add(pnl);
            if (newAvailable.signum() < 0) {
                throw new LedgerContractException(
                        "Realized loss " + pnl + " would drive available cash of account " + accountId
                                + " negative",
                        Map.of("accountId", accountId, "realizedPnl", pnl));
            }
            account.setDeployedCash(account.getDeployedCash().subtract(value));
            account.setAvailableCash(newAvailable);
            account.setRealizedPnl(account.getRealizedPnl().add(pnl));
            commit(account, TransactionType.RETURN, value, pnl, reference, null, null);
        });
    }

    /** Moves reserved cash back to available when a proposal is rejected or expires. */
    public void releaseReservation(String accountId, BigDecimal amount, String reference) {
        BigDecimal value = requirePositive(amount, "release");
        lockRegistry.withLock(accountId, () -> {
            Account account = load(accountId);
            if (value.compareTo(account.getReservedCash()) > 0) {
                throw new LedgerContractException(
                        "Cannot release " + value + " from account " + accountId + ": only "
                                + account.getReservedCash() + " reserved",
                        Map.of("accountId", accountId, "amount", value, "reserved", account.getReservedCash()));
            }
            account.setReservedCash(account.getReservedCash().subtract(value));
            account.setAvailableCash(account.getAvailableCash().add(value));
            commit(account, TransactionType.RELEASE, value, BigDecimal.ZERO, reference, null, null);
        });
    }

    // ========================
    // CAPITAL MOVEMENTS
    // ========================

    /**
     * Moves available cash between two accounts as a linked TRANSFER_OUT / TRANSFER_IN pair.
     * Both accounts are validated before either is written, so both legs commit or neither does.
     *
     * @return the link id shared by the two transactions
     * @throws InsufficientFundsException if the source lacks the available cash
     */
    public String transfer(String fromAccountId, String toAccountId, BigDecimal amount, String reference) {
        BigDecimal value = requirePositive(amount, "transfer");
        if (fromAccountId.equals(toAccountId)) {
            throw new LedgerContractException("Cannot transfer from account " + fromAccountId + " to itself");
        }
        return lockRegistry.withLocks(fromAccountId, toAccountId, () -> {
            Account from = load(fromAccountId);
            Account to = load(toAccountId);
            if (value.compareTo(from.getAvailableCash()) > 0) {
                throw new InsufficientFundsException(fromAccountId, value, from.getAvailableCash());
            }

            from.setAvailableCash(from.getAvailableCash().subtract(value));
            from.setTotalCapital(from.getTotalCapital().subtract(value));
            to.setAvailableCash(to.getAvailableCash().add(value));
            to.setTotalCapital(to.getTotalCapital().add(value));

            String linkId = UUID.randomUUID().toString();
            commit(from, TransactionType.TRANSFER_OUT, value, BigDecimal.ZERO, reference, toAccountId, linkId);
            commit(to, TransactionType.TRANSFER_IN, value, BigDecimal.ZERO, reference, fromAccountId, linkId);

            log.info("Transferred {} from {} to {} (link {})", value, fromAccountId, toAccountId, linkId);
            return linkId;
        });
    }

    /** Adds contributed capital, e.g. an account's opening balance. */
    public void deposit(String accountId, BigDecimal amount, String reference) {
        addCapital(accountId, amount, TransactionType.DEPOSIT, reference);
    }

    /** Adds one systematic investment plan installment to the account's capital. */
    public void contributeSip(String accountId, BigDecimal amount) {
        addCapital(accountId, amount, TransactionType.SIP_CONTRIBUTION, "sip");
        log.info("SIP contribution of {} credited to account {}", Money.of(amount), accountId);
    }

    private void addCapital(String accountId, BigDecimal amount, TransactionType type, String reference) {
        BigDecimal value = requirePositive(amount, type.name().toLowerCase());
        lockRegistry.withLock(accountId, () -> {
            Account account = load(accountId);
            account.setTotalCapital(account.getTotalCapital().add(value));
            account.setAvailableCash(account.getAvailableCash().add(value));
            commit(account, type, value, BigDecimal.ZERO, reference, null, null);
        });
    }

    // ========================
    // QUERIES
    // ========================

    /** Available cash less the account's emergency buffer. Never negative. */
    public BigDecimal getDeployableCash(String accountId) {
        Account account = load(accountId);
        return deployableCash(account);
    }

    static BigDecimal deployableCash(Account account) {
        BigDecimal buffer = account.getEmergencyBufferPercent() == null
                ? BigDecimal.ZERO
                : Money.percentOf(account.getEmergencyBufferPercent(), account.getAvailableCash());
        return Money.of(account.getAvailableCash().subtract(buffer).max(BigDecimal.ZERO));
    }

    public LedgerBalance getBalance(String accountId) {
        return LedgerBalance.of(load(accountId));
    }

    public List<CapitalTransaction> getTransactions(String accountId) {
        return transactionRepository.findByAccount(accountId);
    }

    public PortfolioSummary getPortfolioSummary() {
        List<LedgerBalance> balances =
                accountRepository.findAll().stream().map(LedgerBalance::of).toList();

        BigDecimal total = sum(balances, LedgerBalance::totalCapital);
        BigDecimal deployed = sum(balances, LedgerBalance::deployedCash);
        BigDecimal deployedPercent = total.signum() == 0
                ? Money.of(BigDecimal.ZERO)
                : Money.of(deployed.multiply(Money.HUNDRED).divide(total, 10, Money.ROUNDING));

        return PortfolioSummary.builder()
                .accountCount(balances.size())
                .totalCapital(total)
                .availableCash(sum(balances, LedgerBalance::availableCash))
                .reservedCash(sum(balances, LedgerBalance::reservedCash))
                .deployedCash(deployed)
                .realizedPnl(sum(balances, LedgerBalance::realizedPnl))
                .deployedPercent(deployedPercent)
                .accounts(balances)
                .build();
    }

    private static BigDecimal sum(
            List<LedgerBalance> balances, Function<LedgerBalance, BigDecimal> field) {
        return Money.of(balances.stream().map(field).reduce(BigDecimal.ZERO, BigDecimal::add));
    }

    // ========================
    // INTERNALS
    // ========================

    private Account load(String accountId) {
        return accountRepository
                .findById(accountId)
                .orElseThrow(() -> new ResourceNotFoundException("Account", accountId));
    }

    private void commit(
            Account account,
            TransactionType type,
            BigDecimal amount,
            BigDecimal realizedPnl,
            String reference,
            String counterpartyAccountId,
            String linkId) {
        accountRepository.save(account);

        CapitalTransaction transaction = CapitalTransaction.builder()
                .id(transactionRepository.nextId())
                .accountId(account.getId())
                .type(type)
                .amount(amount)
                .realizedPnl(realizedPnl)
                .timestamp(LocalDateTime.now(clock))
                .reference(reference)
                .counterpartyAccountId(counterpartyAccountId)
                .linkId(linkId)
                .build();
        transactionRepository.append(transaction);

        log.debug(
                "{} {} on account {} (ref {}): available={}, reserved={}, deployed={}",
                type,
                amount,
                account.getId(),
                reference,
                account.getAvailableCash(),
                account.getReservedCash(),
                account.getDeployedCash());

        eventPublisherHelper.publishCapitalTransaction(this, transaction);
    }

    private static BigDecimal requirePositive(BigDecimal amount, String operation) {
        if (amount == null || amount.signum() <= 0) {
            throw new LedgerContractException("Amount for " + operation + " must be positive, got " + amount);
        }
        return Money.of(amount);
    }
}
