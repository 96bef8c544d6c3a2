package io.checkin4j.store;

import java.util.Optional;

/**
 * Key/value configuration written by the administrative layer.
 * Values are read on every use so changes apply without a restart.
 */
public interface ConfigStore {

    Optional<String> get(String key);

    void put(String key, String value);

    default boolean isTrue(String key) {
        return get(key).map("true"::equals).orElse(false);
    }
}
