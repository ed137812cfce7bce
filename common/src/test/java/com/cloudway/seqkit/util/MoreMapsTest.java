/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.seqkit.util;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiFunction;

import com.google.common.collect.ImmutableMap;
import org.junit.Before;
import org.junit.Test;
import static org.junit.Assert.*;

import com.cloudway.seqkit.data.Tuple;
import static com.cloudway.seqkit.util.MoreMaps.*;

public class MoreMapsTest
{
    private Map<String, Integer> scores;

    @Before
    public void prepareData() {
        scores = new LinkedHashMap<>();
        scores.put("alice", 3);
        scores.put("bob", 1);
        scores.put("carol", 2);
    }

    @Test
    public void getOrPutComputesOnlyMissingKeys() {
        AtomicInteger calls = new AtomicInteger();
        assertEquals(3, (int)getOrPut(scores, "alice", () -> calls.incrementAndGet() * 100));
        assertEquals(0, calls.get());
        assertEquals(100, (int)getOrPut(scores, "dave", () -> calls.incrementAndGet() * 100));
        assertEquals(100, (int)getOrPut(scores, "dave", () -> calls.incrementAndGet() * 100));
        assertEquals(1, calls.get());
        assertEquals(100, (int)scores.get("dave"));
    }

    @Test
    public void getOrPutAccumulatesIntoStoredList() {
        Map<String, List<Integer>> index = new HashMap<>();
        getOrPut(index, "even", ArrayList::new).add(2);
        getOrPut(index, "odd", ArrayList::new).add(1);
        getOrPut(index, "even", ArrayList::new).add(4);
        assertEquals(Arrays.asList(2, 4), index.get("even"));
        assertEquals(Arrays.asList(1), index.get("odd"));
    }

    @Test
    public void getOrInsertPassesKey() {
        Map<Integer, String> names = new HashMap<>();
        assertEquals("7", getOrInsert(names, 7, String::valueOf));
        assertEquals("7", getOrInsert(names, 7, k -> "seven"));
    }

    @Test
    public void nullValueIsNotRecomputed() {
        Map<String, String> map = new HashMap<>();
        map.put("k", null);
        assertNull(getOrPut(map, "k", () -> "v"));
    }

    @Test
    public void entriesInIterationOrder() {
        assertEquals(Arrays.asList(Tuple.of("alice", 3), Tuple.of("bob", 1), Tuple.of("carol", 2)), entries(scores));
        assertTrue(entries(new HashMap<String, String>()).isEmpty());
    }

    @Test
    public void foldEntriesVisitsEveryEntry() {
        int total = foldEntries(scores, 0, (acc, k, v) -> acc + k.length() * v);
        assertEquals(5 * 3 + 3 * 1 + 5 * 2, total);
        assertEquals("x", foldEntries(new HashMap<String, Integer>(), "x", (acc, k, v) -> acc + k));
    }

    @Test
    public void transformEntriesRekeysAndDrops() {
        Map<String, Integer> result = transformEntries(scores, (k, v) ->
            v > 1 ? Optional.of(Tuple.of(k.toUpperCase(), v * 10)) : Optional.empty());
        assertEquals(ImmutableMap.of("ALICE", 30, "CAROL", 20), result);
    }

    @Test
    public void transformEntriesLaterKeyWins() {
        Map<Integer, String> result = transformEntries(scores, (k, v) -> Optional.of(Tuple.of(k.length(), k)));
        assertEquals(ImmutableMap.of(5, "carol", 3, "bob"), result);
    }

    @Test
    public void nestedGetOrInsertKeepsInnerValue() {
        Map<String, Integer> map = new HashMap<>();
        Integer value = getOrInsert(map, "k", k -> {
            getOrInsert(map, k, x -> 1);
            return 2;
        });
        assertEquals(Integer.valueOf(1), value);
        assertEquals(Integer.valueOf(1), map.get("k"));
    }

    @Test
    public void transformEntriesAcceptsDeclaredFunction() {
        BiFunction<String, Integer, Optional<Tuple<String, Integer>>> f =
            (k, v) -> v > 2 ? Optional.of(Tuple.of(k, v)) : Optional.empty();
        Map<String, Integer> result = transformEntries(scores, f);
        assertEquals(ImmutableMap.of("alice", 3), result);
    }
}
