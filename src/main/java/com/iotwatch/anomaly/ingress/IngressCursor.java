package com.iotwatch.anomaly.ingress;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Resumption position: next offset to read, per source partition.
 *
 * Immutable; {@link #advance(SourceEntry)} returns a new cursor.
 */
public final class IngressCursor {

    private static final IngressCursor EMPTY = new IngressCursor(Map.of());

    private final Map<Integer, Long> nextOffsets;

    private IngressCursor(Map<Integer, Long> nextOffsets) {
        this.nextOffsets = Collections.unmodifiableMap(new TreeMap<>(nextOffsets));
    }

    public static IngressCursor empty() {
        return EMPTY;
    }

    public static IngressCursor of(Map<Integer, Long> nextOffsets) {
        return nextOffsets.isEmpty() ? EMPTY : new IngressCursor(nextOffsets);
    }

    public Optional<Long> nextOffset(int partition) {
        return Optional.ofNullable(nextOffsets.get(partition));
    }

    public IngressCursor advance(SourceEntry entry) {
        Map<Integer, Long> next = new TreeMap<>(nextOffsets);
        next.merge(entry.getPartition(), entry.getOffset() + 1, Math::max);
        return new IngressCursor(next);
    }

    public Map<Integer, Long> getNextOffsets() {
        return nextOffsets;
    }

    public boolean isEmpty() {
        return nextOffsets.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IngressCursor)) return false;
        return nextOffsets.equals(((IngressCursor) o).nextOffsets);
    }

    @Override
    public int hashCode() {
        return nextOffsets.hashCode();
    }

    @Override
    public String toString() {
        return "IngressCursor" + nextOffsets;
    }
}
