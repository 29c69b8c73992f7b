package com.capitalallocator.allocation;

import com.capitalallocator.domain.enums.AllocationOutcome;
import com.capitalallocator.domain.model.Account;
import com.capitalallocator.domain.model.Signal;
import com.capitalallocator.event.EventPublisherHelper;
import com.capitalallocator.event.RiskEventType;
import com.capitalallocator.event.RiskLevel;
import com.capitalallocator.exception.InvalidSnapshotException;
import com.capitalallocator.exception.ResourceNotFoundException;
import com.capitalallocator.repository.AccountRepository;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Entry point for a batch of signals: runs every active account through {@link AccountAllocator}.
 *
 * <p>Accounts are independent, so they run in parallel on the allocation executor. Each account's
 * run holds that account's lock, which keeps concurrent batches for the same account serialized.
 * An account whose snapshot is malformed gets CONFIGURATION_ERROR for every signal and a risk
 * event; the other accounts are unaffected.
 */
@Service
public class AllocationEngine {

    private static final Logger log = LoggerFactory.getLogger(AllocationEngine.class);

    private final AccountRepository accountRepository;
    private final AccountAllocator accountAllocator;
    private final EventPublisherHelper eventPublisherHelper;
    private final AllocationConfig allocationConfig;
    private final Executor allocationExecutor;

    public AllocationEngine(
            AccountRepository accountRepository,
            AccountAllocator accountAllocator,
            EventPublisherHelper eventPublisherHelper,
            AllocationConfig allocationConfig,
            @Qualifier("allocationExecutor") Executor allocationExecutor) {
        this.accountRepository = accountRepository;
        this.accountAllocator = accountAllocator;
        this.eventPublisherHelper = eventPublisherHelper;
        this.allocationConfig = allocationConfig;
        this.allocationExecutor = allocationExecutor;
    }

    /**
     * Allocates a batch across all active accounts.
     *
     * <p>Accounts still running when {@code allocator.allocation.batch-timeout-seconds} elapses are
     * left out of the result. Their runs are not interrupted and still publish their proposals.
     */
    public AllocationBatchResult allocate(List<Signal> signals) {
        List<Account> accounts = accountRepository.findActive();
        if (accounts.isEmpty() || signals.isEmpty()) {
            return new AllocationBatchResult(List.of());
        }

        Map<String, CompletableFuture<List<AllocationDecision>>> futures = new LinkedHashMap<>();
        for (Account account : accounts) {
            futures.put(
                    account.getId(),
                    CompletableFuture.supplyAsync(() -> allocateSafely(account.getId(), signals), allocationExecutor));
        }

        try {
            CompletableFuture.allOf(futures.values().toArray(new CompletableFuture[0]))
                    .get(allocationConfig.getBatchTimeoutSeconds(), TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            log.error("Allocation batch timed out after {}s", allocationConfig.getBatchTimeoutSeconds());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Interrupted waiting for allocation batch");
        } catch (ExecutionException e) {
            log.error("Allocation batch failed: {}", e.getMessage(), e);
        }

        List<AllocationDecision> decisions = new ArrayList<>();
        futures.forEach((accountId, future) -> {
            if (future.isDone() && !future.isCompletedExceptionally()) {
                decisions.addAll(future.join());
            } else {
                log.warn("No allocation result for account {}", accountId);
            }
        });

        AllocationBatchResult result = new AllocationBatchResult(decisions);
        log.info(
                "Allocated {} signals across {} accounts: {}",
                signals.size(),
                accounts.size(),
                result.countByOutcome());
        return result;
    }

    /** Allocates a batch for one account, on the calling thread. */
    public AllocationBatchResult allocate(String accountId, List<Signal> signals) {
        if (accountRepository.findById(accountId).isEmpty()) {
            throw new ResourceNotFoundException("Account", accountId);
        }
        return new AllocationBatchResult(allocateSafely(accountId, signals));
    }

    private List<AllocationDecision> allocateSafely(String accountId, List<Signal> signals) {
        try {
            return accountAllocator.allocateForAccount(accountId, signals);
        } catch (InvalidSnapshotException e) {
            log.error("Skipping account {}: {}", accountId, e.getMessage());
            eventPublisherHelper.publishRiskEvent(
                    this,
                    accountId,
                    RiskEventType.ALLOCATION_CONFIGURATION_ERROR,
                    RiskLevel.CRITICAL,
                    "Account " + accountId + " skipped: " + e.getMessage(),
                    Map.of("errorCode", e.getErrorCode().getCode(), "recoverable", e.isRecoverable()));
            return signals.stream()
                    .map(signal -> AllocationDecision.builder()
                            .accountId(accountId)
                            .signalId(signal.getId())
                            .symbol(signal.getSymbol())
                            .outcome(AllocationOutcome.CONFIGURATION_ERROR)
                            .reasons(List.of(e.getMessage()))
                            .build())
                    .toList();
        }
    }
}
