package com.capitalallocator.allocation;

import com.capitalallocator.domain.model.Account;
import com.capitalallocator.domain.model.Mandate;
import com.capitalallocator.domain.model.Signal;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Pure eligibility test of a signal against one account's mandate.
 *
 * <p>All rules must pass: horizon within [min, max], sector allowed (or unrestricted), strategy
 * allowed (or unrestricted), and the account not paused by a kill switch. Sector and strategy
 * names match case-insensitively. Every failed rule is reported, not just the first.
 */
@Component
public class MandateFilter {

    public boolean eligible(Signal signal, Mandate mandate, Account account) {
        return evaluate(signal, mandate, account).isEligible();
    }

    public MandateCheck evaluate(Signal signal, Mandate mandate, Account account) {
        List<String> reasons = new ArrayList<>();

        if (signal.getHorizonDays() < mandate.getMinHorizonDays()
                || signal.getHorizonDays() > mandate.getMaxHorizonDays()) {
            reasons.add(MandateCheck.HORIZON_OUT_OF_RANGE);
        }
        if (!mandate.isSectorUnrestricted() && !containsIgnoreCase(mandate.getAllowedSectors(), signal.getSector())) {
            reasons.add(MandateCheck.SECTOR_NOT_ALLOWED);
        }
        if (!mandate.isStrategyUnrestricted()
                && !containsIgnoreCase(mandate.getAllowedStrategies(), signal.getStrategy())) {
            reasons.add(MandateCheck.STRATEGY_NOT_ALLOWED);
        }
        if (account.isPaused()) {
            reasons.add(MandateCheck.ACCOUNT_PAUSED);
        }

        return new MandateCheck(reasons);
    }

    private static boolean containsIgnoreCase(Set<String> values, String candidate) {
        if (candidate == null) {
            return false;
        }
        return values.stream().anyMatch(candidate::equalsIgnoreCase);
    }
}
