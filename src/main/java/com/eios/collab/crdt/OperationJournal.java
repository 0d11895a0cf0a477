package com.eios.collab.crdt;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * In-memory record of the sequenced operations a room applied since the snapshot it
 * was built from.
 *
 * <p>The watermark is the highest sequence up to which nothing is missing. Entries
 * beyond a gap are kept (their effect is already merged) and the watermark jumps
 * forward as soon as the gap is filled.
 */
public class OperationJournal {

    private final TreeMap<Long, Operation> entries = new TreeMap<>();
    private long baseline;
    private long watermark;

    public record Gap(long fromInclusive, long toInclusive) {}

    public OperationJournal(long baseline) {
        this.baseline = baseline;
        this.watermark = baseline;
    }

    /**
     * @return {@code false} if the sequence was already covered
     */
    public synchronized boolean record(long sequence, Operation operation) {
        if (sequence <= baseline || entries.containsKey(sequence)) {
            return false;
        }
        entries.put(sequence, operation);
        while (entries.containsKey(watermark + 1)) {
            watermark++;
        }
        return true;
    }

    public synchronized long watermark() {
        return watermark;
    }

    public synchronized long baseline() {
        return baseline;
    }

    public synchronized long highestSequence() {
        return entries.isEmpty() ? baseline : Math.max(baseline, entries.lastKey());
    }

    public synchronized int size() {
        return entries.size();
    }

    /**
     * Operations after {@code from}, or empty when they can no longer be produced from
     * memory (already truncated, or a watermark this journal never reached).
     */
    public synchronized Optional<List<SequencedOperation>> since(long from) {
        if (from < baseline || from > highestSequence()) {
            return Optional.empty();
        }
        List<SequencedOperation> out = new ArrayList<>();
        for (Map.Entry<Long, Operation> e : entries.tailMap(from, false).entrySet()) {
            out.add(new SequencedOperation(e.getKey(), e.getValue()));
        }
        return Optional.of(out);
    }

    public synchronized Optional<Gap> firstGap() {
        if (highestSequence() <= watermark) {
            return Optional.empty();
        }
        long next = entries.higherKey(watermark);
        return Optional.of(new Gap(watermark + 1, next - 1));
    }

    /**
     * Gives up on the first gap: its sequence numbers will never be filled, for example
     * numbers handed out to an operation whose delivery timed out and that was
     * sequenced again later.
     */
    public synchronized void skip(Gap gap) {
        if (gap.fromInclusive() != watermark + 1) {
            return;
        }
        watermark = gap.toInclusive();
        while (entries.containsKey(watermark + 1)) {
            watermark++;
        }
    }

    /**
     * Forgets entries at or below {@code upTo}; never beyond the watermark.
     */
    public synchronized void truncate(long upTo) {
        long limit = Math.min(upTo, watermark);
        if (limit <= baseline) {
            return;
        }
        entries.headMap(limit, true).clear();
        baseline = limit;
    }
}
