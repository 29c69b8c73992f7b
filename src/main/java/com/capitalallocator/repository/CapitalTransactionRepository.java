package com.capitalallocator.repository;

import com.capitalallocator.domain.model.CapitalTransaction;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import org.springframework.stereotype.Repository;

/**
 * Append-only capital transaction log. Ids are assigned in append order and never reused.
 */
@Repository
public class CapitalTransactionRepository {

    private final Map<String, List<CapitalTransaction>> byAccount = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    public long nextId() {
        return sequence.incrementAndGet();
    }

    public void append(CapitalTransaction transaction) {
        byAccount
                .computeIfAbsent(transaction.getAccountId(), k -> new CopyOnWriteArrayList<>())
                .add(transaction);
    }

    /** Entries for one account in append order. */
    public List<CapitalTransaction> findByAccount(String accountId) {
        List<CapitalTransaction> entries = byAccount.get(accountId);
        return entries == null ? List.of() : List.copyOf(entries);
    }

    public List<CapitalTransaction> findAll() {
        List<CapitalTransaction> all = new ArrayList<>();
        byAccount.values().forEach(all::addAll);
        all.sort((a, b) -> Long.compare(a.getId(), b.getId()));
        return all;
    }

    public List<CapitalTransaction> findByLinkId(String linkId) {
        return findAll().stream().filter(t -> linkId.equals(t.getLinkId())).toList();
    }
}
