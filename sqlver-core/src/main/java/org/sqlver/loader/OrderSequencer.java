package org.sqlver.loader;

import org.sqlver.model.Order;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Hands out declaration orders: {@code (file rank, nesting depth, sequence)}. Files are ranked in
 * the order they are first seen; sequences count per file and depth.
 */
public class OrderSequencer {

    private final Map<String, Integer> sourceRanks = new HashMap<>();
    private final Map<String, List<Integer>> counters = new HashMap<>();

    public Order next(String source, int depth) {
        List<Integer> c = countersFor(source, depth);
        int seq = c.get(depth) + 1;
        c.set(depth, seq);
        return Order.of(sourceRanks.get(source), depth, seq);
    }

    /**
     * Explicitly placed element. Later implicit elements at the same depth continue after it.
     */
    public Order explicit(String source, int depth, int sequence) {
        List<Integer> c = countersFor(source, depth);
        if (c.get(depth) < sequence) {
            c.set(depth, sequence);
        }
        return Order.of(sourceRanks.get(source), depth, sequence);
    }

    public int sourceRank(String source) {
        return sourceRanks.computeIfAbsent(source, s -> sourceRanks.size());
    }

    private List<Integer> countersFor(String source, int depth) {
        if (depth < 0) {
            throw new IllegalArgumentException("depth must not be negative: " + depth);
        }
        sourceRank(source);
        List<Integer> c = counters.computeIfAbsent(source, s -> new ArrayList<>());
        while (c.size() <= depth) {
            c.add(-1);
        }
        return c;
    }
}
