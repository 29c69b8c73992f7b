package com.capitalallocator.repository;

import com.capitalallocator.domain.model.Mandate;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Repository;

/**
 * Append-only, versioned store of account mandates.
 *
 * <p>{@link #appendVersion} assigns the next version number and never touches earlier versions.
 * The current mandate is the latest appended version.
 */
@Repository
public class MandateRepository {

    private final Map<String, List<Mandate>> history = new ConcurrentHashMap<>();
    private final Clock clock;

    public MandateRepository(Clock clock) {
        this.clock = clock;
    }

    /**
     * Stores the mandate as the account's next version.
     *
     * @return the stored mandate, carrying its assigned version and creation time
     */
    public Mandate appendVersion(Mandate mandate) {
        List<Mandate> versions = history.computeIfAbsent(mandate.getAccountId(), k -> new ArrayList<>());
        synchronized (versions) {
            Mandate stored = mandate.toBuilder()
                    .version(versions.size() + 1)
                    .createdAt(LocalDateTime.now(clock))
                    .build();
            versions.add(stored);
            return stored;
        }
    }

    public Optional<Mandate> findCurrent(String accountId) {
        List<Mandate> versions = history.get(accountId);
        if (versions == null) {
            return Optional.empty();
        }
        synchronized (versions) {
            return versions.isEmpty() ? Optional.empty() : Optional.of(versions.get(versions.size() - 1));
        }
    }

    public Optional<Mandate> findVersion(String accountId, int version) {
        List<Mandate> versions = history.get(accountId);
        if (versions == null) {
            return Optional.empty();
        }
        synchronized (versions) {
            if (version < 1 || version > versions.size()) {
                return Optional.empty();
            }
            return Optional.of(versions.get(version - 1));
        }
    }

    /** Every version for the account, oldest first. */
    public List<Mandate> findHistory(String accountId) {
        List<Mandate> versions = history.get(accountId);
        if (versions == null) {
            return List.of();
        }
        synchronized (versions) {
            return List.copyOf(versions);
        }
    }
}
