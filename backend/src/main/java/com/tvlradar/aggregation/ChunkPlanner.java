package com.tvlradar.aggregation;

import com.tvlradar.domain.CallDescriptor;
import com.tvlradar.domain.Chunk;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a descriptor list into ordered chunks of at most {@code maxChunkSize}; only the last one may be shorter.
 */
public final class ChunkPlanner {

    private ChunkPlanner() {}

    public static List<Chunk> plan(List<CallDescriptor> descriptors, int maxChunkSize) {
        if (maxChunkSize < 1) {
            throw new IllegalArgumentException("maxChunkSize must be >= 1, got " + maxChunkSize);
        }
        if (descriptors == null || descriptors.isEmpty()) {
            return List.of();
        }
        int total = descriptors.size();
        List<Chunk> chunks = new ArrayList<>((total + maxChunkSize - 1) / maxChunkSize);
        for (int start = 0, index = 0; start < total; start += maxChunkSize, index++) {
            int end = Math.min(start + maxChunkSize, total);
            chunks.add(new Chunk(index, descriptors.subList(start, end)));
        }
        long planned = chunks.stream().mapToLong(Chunk::size).sum();
        if (planned != total) {
            throw new BookkeepingViolationException("Planned " + planned + " calls in " + chunks.size()
                    + " chunks but received " + total);
        }
        return chunks;
    }
}
