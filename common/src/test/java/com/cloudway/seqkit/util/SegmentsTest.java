/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.seqkit.util;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import org.junit.Test;
import static org.junit.Assert.*;

import static com.cloudway.seqkit.util.Segments.*;

public class SegmentsTest
{
    private static List<Integer> range(int from, int to) {
        return IntStream.rangeClosed(from, to).boxed().collect(Collectors.toList());
    }

    @Test
    public void chunkedKeepsRemainderInLastChunk() {
        assertEquals(Arrays.asList(Arrays.asList(1, 2), Arrays.asList(3, 4), Arrays.asList(5, 6),
                                   Arrays.asList(7, 8), Arrays.asList(9)),
                     chunked(range(1, 9), 2));
        assertEquals(Arrays.asList(Arrays.asList(1, 2, 3), Arrays.asList(4, 5, 6)), chunked(range(1, 6), 3));
        assertEquals(Arrays.asList(range(1, 3)), chunked(range(1, 3), 10));
    }

    @Test
    public void chunkedEmpty() {
        assertEquals(Collections.emptyList(), chunked(Collections.emptyList(), 3));
    }

    @Test(expected = IllegalArgumentException.class)
    public void chunkedZeroSizeFails() {
        chunked(range(1, 9), 0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void chunkedNegativeSizeFailsOnEmptyInput() {
        chunked(Collections.emptyList(), -1);
    }

    @Test
    public void chunkedFlattensBackToInput() {
        List<Integer> source = range(1, 23);
        for (int size = 1; size <= 25; size++) {
            List<List<Integer>> chunks = chunked(source, size);
            List<Integer> flat = new ArrayList<>();
            chunks.forEach(flat::addAll);
            assertEquals(source, flat);
            for (int i = 0; i < chunks.size() - 1; i++) {
                assertEquals(size, chunks.get(i).size());
            }
            int last = chunks.get(chunks.size() - 1).size();
            assertTrue(last >= 1 && last <= size);
        }
    }

    @Test
    public void chunksAreDetached() {
        List<Integer> source = range(1, 4);
        List<List<Integer>> chunks = chunked(source, 2);
        chunks.get(0).set(0, 99);
        assertEquals(1, (int)source.get(0));
    }

    @Test
    public void chunkedByIncreasingRuns() {
        List<Integer> input = Arrays.asList(10, 20, 30, 40, 31, 31, 33, 34, 21, 22, 23, 24, 11, 12, 13, 14);
        List<List<Integer>> runs = chunkedBy(input, (a, b) -> a < b);
        assertEquals(Arrays.asList(
            Arrays.asList(10, 20, 30, 40),
            Arrays.asList(31),
            Arrays.asList(31, 33, 34),
            Arrays.asList(21, 22, 23, 24),
            Arrays.asList(11, 12, 13, 14)), runs);
    }

    @Test
    public void chunkedByComparesWithLastOfRun() {
        List<List<Integer>> runs = chunkedBy(Arrays.asList(1, 2, 3, 2, 3, 4), (prev, next) -> next == prev + 1);
        assertEquals(Arrays.asList(Arrays.asList(1, 2, 3), Arrays.asList(2, 3, 4)), runs);
    }

    @Test
    public void chunkedByEdgeCases() {
        assertEquals(Collections.emptyList(), chunkedBy(Collections.<Integer>emptyList(), (a, b) -> true));
        assertEquals(Arrays.asList(Arrays.asList(7)), chunkedBy(Arrays.asList(7), (a, b) -> false));
        assertEquals(Arrays.asList(Arrays.asList(1), Arrays.asList(1), Arrays.asList(1)),
                     chunkedBy(Arrays.asList(1, 1, 1), (a, b) -> false));
        assertEquals(Arrays.asList(Arrays.asList("a", null, "b")),
                     chunkedBy(Arrays.asList("a", null, "b"), (a, b) -> true));
    }

    @Test
    public void windowedWithStep() {
        assertEquals(Arrays.asList(
            Arrays.asList(1, 2, 3, 4, 5),
            Arrays.asList(4, 5, 6, 7, 8),
            Arrays.asList(7, 8, 9, 10),
            Arrays.asList(10)), windowed(range(1, 10), 5, 3));
    }

    @Test
    public void windowedStepLargerThanSize() {
        assertEquals(Arrays.asList(Arrays.asList(1, 2), Arrays.asList(4, 5), Arrays.asList(7)),
                     windowed(range(1, 7), 2, 3));
    }

    @Test
    public void windowedDefaultStep() {
        assertEquals(Arrays.asList(Arrays.asList(1, 2), Arrays.asList(2, 3), Arrays.asList(3)),
                     windowed(range(1, 3), 2));
    }

    @Test
    public void windowedSizeLargerThanInput() {
        assertEquals(Arrays.asList(range(1, 3)), windowed(range(1, 3), 10, 5));
    }

    @Test
    public void windowedEmpty() {
        assertEquals(Collections.emptyList(), windowed(Collections.emptyList(), 3, 1));
    }

    @Test(expected = IllegalArgumentException.class)
    public void windowedZeroSizeFails() {
        windowed(range(1, 5), 0, 1);
    }

    @Test(expected = IllegalArgumentException.class)
    public void windowedZeroStepFails() {
        windowed(range(1, 5), 2, 0);
    }

    @Test
    public void windowLengthsAndCount() {
        for (int len = 0; len <= 12; len++) {
            List<Integer> source = range(1, len);
            for (int size = 1; size <= 6; size++) {
                for (int step = 1; step <= 6; step++) {
                    List<List<Integer>> windows = windowed(source, size, step);
                    assertEquals(ceilDiv(len, step), windows.size());
                    for (int i = 0; i < windows.size(); i++) {
                        int start = i * step;
                        assertEquals(source.subList(start, Math.min(start + size, len)), windows.get(i));
                    }
                }
            }
        }
    }

    @Test
    public void ceilDivRoundsUp() {
        assertEquals(0, ceilDiv(0, 3));
        assertEquals(1, ceilDiv(3, 3));
        assertEquals(2, ceilDiv(4, 3));
    }
}
