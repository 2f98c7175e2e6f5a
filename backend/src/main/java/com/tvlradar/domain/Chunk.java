package com.tvlradar.domain;

import java.util.List;

/**
 * Contiguous slice of a descriptor list, tagged with its position in the planned sequence.
 */
public record Chunk(int index, List<CallDescriptor> calls) {

    public Chunk {
        calls = List.copyOf(calls);
    }

    public int size() {
        return calls.size();
    }
}
