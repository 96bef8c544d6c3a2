package io.checkin4j.store;

import io.checkin4j.core.AccountSpec;

import java.util.List;
import java.util.Optional;

/**
 * Persistent home of {@link AccountSpec}s.
 *
 * <p>Implementations report failures as {@link io.checkin4j.core.PersistenceException}.
 */
public interface AccountStore {

    Optional<AccountSpec> findById(String id);

    List<AccountSpec> findAllEnabled();

    /**
     * Insert or update. Returns the stored account, with its id assigned when it was new.
     */
    AccountSpec save(AccountSpec account);

    /**
     * @return true if an account was deleted
     */
    boolean deleteById(String id);
}
