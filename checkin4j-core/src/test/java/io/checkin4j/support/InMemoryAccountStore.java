package io.checkin4j.support;

import io.checkin4j.core.AccountSpec;
import io.checkin4j.store.AccountStore;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

public class InMemoryAccountStore implements AccountStore {

    private final Map<String, AccountSpec> accounts = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    @Override
    public Optional<AccountSpec> findById(String id) {
        return Optional.ofNullable(accounts.get(id));
    }

    @Override
    public List<AccountSpec> findAllEnabled() {
        List<AccountSpec> enabled = new ArrayList<>();
        for (AccountSpec a : accounts.values()) {
            if (a.enabled()) {
                enabled.add(a);
            }
        }
        return enabled;
    }

    @Override
    public AccountSpec save(AccountSpec account) {
        AccountSpec stored = account.id() == null
                ? account.withId(String.valueOf(sequence.incrementAndGet()))
                : account;
        accounts.put(stored.id(), stored);
        return stored;
    }

    @Override
    public boolean deleteById(String id) {
        return accounts.remove(id) != null;
    }
}
