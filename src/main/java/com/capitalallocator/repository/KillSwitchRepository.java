package com.capitalallocator.repository;

import com.capitalallocator.domain.model.KillSwitch;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Repository;

/**
 * In-memory store of kill switches, keyed by switch id. Entities are copied on the way in and out.
 */
@Repository
public class KillSwitchRepository {

    private final Map<String, KillSwitch> switches = new ConcurrentHashMap<>();

    public void save(KillSwitch killSwitch) {
        switches.put(killSwitch.getId(), killSwitch.toBuilder().build());
    }

    public List<KillSwitch> findByAccount(String accountId) {
        return switches.values().stream()
                .filter(s -> accountId.equals(s.getAccountId()))
                .map(s -> s.toBuilder().build())
                .sorted(Comparator.comparing(KillSwitch::getKind).thenComparing(KillSwitch::getId))
                .toList();
    }
}
