package com.capitalallocator.account;

import com.capitalallocator.allocation.SnapshotValidator;
import com.capitalallocator.domain.enums.KillSwitchKind;
import com.capitalallocator.domain.enums.ThresholdType;
import com.capitalallocator.domain.model.Account;
import com.capitalallocator.domain.model.KillSwitch;
import com.capitalallocator.domain.model.Mandate;
import com.capitalallocator.exception.BusinessException;
import com.capitalallocator.exception.ResourceNotFoundException;
import com.capitalallocator.ledger.AccountLockRegistry;
import com.capitalallocator.ledger.CapitalLedger;
import com.capitalallocator.repository.AccountRepository;
import com.capitalallocator.repository.KillSwitchRepository;
import com.capitalallocator.repository.MandateRepository;
import com.capitalallocator.risk.KillSwitchConfig;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Account lifecycle: opening an account with its first mandate, capital and kill switches,
 * appending mandate versions, and deactivation.
 *
 * <p>Opening capital goes through {@link CapitalLedger#deposit} so the transaction log alone
 * reproduces the account's balances.
 */
@Service
public class AccountService {

    private static final Logger log = LoggerFactory.getLogger(AccountService.class);

    private final AccountRepository accountRepository;
    private final MandateRepository mandateRepository;
    private final KillSwitchRepository killSwitchRepository;
    private final CapitalLedger capitalLedger;
    private final AccountLockRegistry lockRegistry;
    private final SnapshotValidator snapshotValidator;
    private final KillSwitchConfig killSwitchConfig;

    public AccountService(
            AccountRepository accountRepository,
            MandateRepository mandateRepository,
            KillSwitchRepository killSwitchRepository,
            CapitalLedger capitalLedger,
            AccountLockRegistry lockRegistry,
            SnapshotValidator snapshotValidator,
            KillSwitchConfig killSwitchConfig) {
        this.accountRepository = accountRepository;
        this.mandateRepository = mandateRepository;
        this.killSwitchRepository = killSwitchRepository;
        this.capitalLedger = capitalLedger;
        this.lockRegistry = lockRegistry;
        this.snapshotValidator = snapshotValidator;
        this.killSwitchConfig = killSwitchConfig;
    }

    public Account openAccount(OpenAccountRequest request) {
        if (request.getObjective() == null) {
            throw new BusinessException("Objective is required");
        }
        if (request.getMandate() == null) {
            throw new BusinessException("Initial mandate is required");
        }
        BigDecimal initialCapital = request.getInitialCapital() == null ? BigDecimal.ZERO : request.getInitialCapital();
        if (initialCapital.signum() < 0) {
            throw new BusinessException("Initial capital must not be negative: " + initialCapital);
        }

        String accountId = request.getAccountId() != null ? request.getAccountId() : UUID.randomUUID().toString();
        if (accountRepository.existsById(accountId)) {
            throw new BusinessException("Account already exists: " + accountId);
        }

        Account account = Account.builder()
                .id(accountId)
                .name(request.getName())
                .objective(request.getObjective())
                .emergencyBufferPercent(request.getEmergencyBufferPercent())
                .build();
        Mandate mandate = request.getMandate().toBuilder().accountId(accountId).build();
        snapshotValidator.validate(account, mandate);
        List<KillSwitch> switches = killSwitchTemplates(request.getKillSwitches());

        accountRepository.save(account);
        mandateRepository.appendVersion(mandate);
        if (initialCapital.signum() > 0) {
            capitalLedger.deposit(accountId, initialCapital, "opening-balance");
        }
        for (KillSwitch template : switches) {
            killSwitchRepository.save(template.toBuilder()
                    .id(UUID.randomUUID().toString())
                    .accountId(accountId)
                    .tripped(false)
                    .trippedAt(null)
                    .trippedValue(null)
                    .build());
        }

        log.info("Opened account {} ({}) with capital {} and objective {}", accountId, request.getName(),
                initialCapital, request.getObjective());
        return getAccount(accountId);
    }

    /**
     * Appends a new mandate version. Earlier versions are kept unchanged.
     *
     * @return the stored mandate with its assigned version
     */
    public Mandate updateMandate(String accountId, Mandate mandate) {
        Account account = getAccount(accountId);
        Mandate candidate = mandate.toBuilder().accountId(accountId).build();
        snapshotValidator.validate(account, candidate);
        Mandate stored = mandateRepository.appendVersion(candidate);
        log.info("Mandate for account {} updated to v{}", accountId, stored.getVersion());
        return stored;
    }

    /** Stops the account from taking part in future allocation runs. */
    public void deactivate(String accountId) {
        lockRegistry.withLock(accountId, () -> {
            Account account = getAccount(accountId);
            account.setActive(false);
            accountRepository.save(account);
        });
        log.info("Account {} deactivated", accountId);
    }

    public Account getAccount(String accountId) {
        return accountRepository
                .findById(accountId)
                .orElseThrow(() -> new ResourceNotFoundException("Account", accountId));
    }

    public Mandate getCurrentMandate(String accountId) {
        return mandateRepository
                .findCurrent(accountId)
                .orElseThrow(() -> new ResourceNotFoundException("Mandate", accountId));
    }

    public List<Mandate> getMandateHistory(String accountId) {
        return mandateRepository.findHistory(accountId);
    }

    public List<KillSwitch> getKillSwitches(String accountId) {
        return killSwitchRepository.findByAccount(accountId);
    }

    private List<KillSwitch> killSwitchTemplates(List<KillSwitch> requested) {
        List<KillSwitch> switches = new ArrayList<>();
        if (requested == null || requested.isEmpty()) {
            switches.add(KillSwitch.builder()
                    .kind(KillSwitchKind.MAX_DAILY_LOSS)
                    .threshold(killSwitchConfig.getDefaultDailyLossPercent())
                    .thresholdType(ThresholdType.PERCENT_OF_CAPITAL)
                    .build());
            switches.add(KillSwitch.builder()
                    .kind(KillSwitchKind.MAX_DRAWDOWN)
                    .threshold(killSwitchConfig.getDefaultDrawdownPercent())
                    .thresholdType(ThresholdType.PERCENT_OF_CAPITAL)
                    .build());
        } else {
            switches.addAll(requested);
        }

        for (KillSwitch template : switches) {
            if (template.getKind() == null || template.getThreshold() == null || template.getThreshold().signum() >= 0) {
                throw new BusinessException("Kill switch threshold must be a negative loss floor: " + template);
            }
        }
        return switches;
    }
}
