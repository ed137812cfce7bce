/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.seqkit.data;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.google.common.base.MoreObjects;
import com.google.common.collect.Maps;

/**
 * A key-value table that computes values on demand and remembers them.
 *
 * <p>Entries are only ever added through {@link #getOrPut} or
 * {@link #getOrInsert}; once a key is stored its value is never replaced or
 * removed, so the compute function supplied for a key runs at most once over
 * the lifetime of the table, no matter which function later requests supply.
 * A compute function that requests its own key re-enters the table; the
 * value stored by the innermost request is the one kept.</p>
 *
 * <p><strong>This class is not thread-safe.</strong> The presence check and
 * the store are separate steps, so concurrent callers must synchronize
 * externally to keep the at-most-once guarantee.</p>
 *
 * @param <K> the type of keys
 * @param <V> the type of memoized values
 */
public class MemoTable<K, V>
{
    private static final Logger logger = Logger.getLogger(MemoTable.class.getName());

    private final Map<K, V> table;

    /**
     * Creates an empty table.
     */
    public MemoTable() {
        this.table = new LinkedHashMap<>();
    }

    /**
     * Creates an empty table sized for the given number of entries.
     *
     * @param expectedSize the number of entries the table is expected to hold
     * @throws IllegalArgumentException if {@code expectedSize} is negative
     */
    public MemoTable(int expectedSize) {
        this.table = Maps.newLinkedHashMapWithExpectedSize(expectedSize);
    }

    /**
     * Returns the value stored for the given key. If the key is absent the
     * compute function is invoked once, its result is stored under the key
     * and returned. An exception thrown by the compute function propagates
     * to the caller and leaves the key absent.
     *
     * @param key the key whose value is requested
     * @param compute the function producing the value for an absent key
     * @return the stored or newly computed value
     */
    public V getOrPut(K key, Supplier<? extends V> compute) {
        return getOrInsert(key, k -> compute.get());
    }

    /**
     * Same as {@link #getOrPut(Object, Supplier)} except that the compute
     * function receives the missing key.
     *
     * <p>If the compute function itself stores a value for the same key
     * through this table, that value is kept and returned, and the outer
     * result is discarded.</p>
     *
     * @param key the key whose value is requested
     * @param compute the function producing the value for an absent key
     * @return the stored or newly computed value
     */
    public V getOrInsert(K key, Function<? super K, ? extends V> compute) {
        V value = table.get(key);
        if (value != null || table.containsKey(key)) {
            return value;
        }

        value = compute.apply(key);
        if (table.containsKey(key)) {
            // stored by a nested call from the compute function
            return table.get(key);
        }
        table.put(key, value);
        if (logger.isLoggable(Level.FINER)) {
            logger.finer("memoized value for key " + key + " (" + table.size() + " entries)");
        }
        return value;
    }

    /**
     * Returns the stored value for the given key without computing it. A key
     * stored with a {@code null} value reports an empty result.
     */
    public Optional<V> get(K key) {
        return Optional.ofNullable(table.get(key));
    }

    public boolean containsKey(K key) {
        return table.containsKey(key);
    }

    public int size() {
        return table.size();
    }

    public boolean isEmpty() {
        return table.isEmpty();
    }

    /**
     * Returns an unmodifiable view of the stored keys, in insertion order.
     */
    public Set<K> keySet() {
        return Collections.unmodifiableSet(table.keySet());
    }

    /**
     * Returns an unmodifiable copy of the current entries, in insertion order.
     * Later insertions are not reflected in the copy.
     */
    public Map<K, V> snapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(table));
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
            .add("size", table.size())
            .add("entries", table)
            .toString();
    }
}
