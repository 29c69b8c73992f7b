package com.capitalallocator.repository;

import com.capitalallocator.domain.model.Account;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Repository;

/**
 * In-memory store of accounts.
 *
 * <p>Reads and writes copy the entity, so callers never share a mutable instance with the store.
 * Writers must hold the account's lock from
 * {@link com.capitalallocator.ledger.AccountLockRegistry}; this class does not lock.
 */
@Repository
public class AccountRepository {

    private final Map<String, Account> accounts = new ConcurrentHashMap<>();

    public void save(Account account) {
        accounts.put(account.getId(), account.toBuilder().build());
    }

    public Optional<Account> findById(String id) {
        Account account = accounts.get(id);
        return account == null ? Optional.empty() : Optional.of(account.toBuilder().build());
    }

    public boolean existsById(String id) {
        return accounts.containsKey(id);
    }

    /** All accounts, ordered by id. */
    public List<Account> findAll() {
        return accounts.values().stream()
                .map(a -> a.toBuilder().build())
                .sorted(Comparator.comparing(Account::getId))
                .toList();
    }

    public List<Account> findActive() {
        return findAll().stream().filter(Account::isActive).toList();
    }

    public void deleteAll() {
        accounts.clear();
    }
}
