package com.ledgerengine.common.locking;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Acquires locks on several resources in one global order.
 *
 * Any unit of work that locks more than one resource must go through here. Keys
 * are de-duplicated and sorted by their natural order before locking, so two
 * units of work touching the same set of resources always lock them in the same
 * sequence and cannot wait on each other in a cycle, whatever order the caller
 * names them in.
 */
public final class OrderedLocking {

    private OrderedLocking() {
    }

    /**
     * Lock every key in ascending order.
     *
     * @param keys   identifiers of the resources to lock; duplicates are locked once
     * @param locker acquires the lock for one key and returns the locked resource
     *               (may return {@code null} when the resource does not exist)
     * @return the locked resources, keyed and iterated in lock order
     */
    public static <K extends Comparable<? super K>, R> Map<K, R> acquireInOrder(
            Collection<K> keys, Function<? super K, ? extends R> locker) {
        Objects.requireNonNull(keys, "keys");
        Objects.requireNonNull(locker, "locker");

        Map<K, R> locked = new LinkedHashMap<>();
        keys.stream()
            .map(key -> Objects.requireNonNull(key, "lock key"))
            .distinct()
            .sorted()
            .forEachOrdered(key -> locked.put(key, locker.apply(key)));
        return locked;
    }
}
