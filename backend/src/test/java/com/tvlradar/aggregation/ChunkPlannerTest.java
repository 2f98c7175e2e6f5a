package com.tvlradar.aggregation;

import com.tvlradar.domain.CallDescriptor;
import com.tvlradar.domain.Chunk;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ChunkPlannerTest {

    static List<CallDescriptor> calls(int n) {
        return IntStream.range(0, n)
                .mapToObj(i -> CallDescriptor.of("0xtoken" + i, "0xpair" + i))
                .toList();
    }

    @Test
    @DisplayName("6000 calls at 2500 per chunk plan as 2500, 2500, 1000")
    void plansBalanceScenario() {
        List<Chunk> chunks = ChunkPlanner.plan(calls(6000), 2500);

        assertThat(chunks).extracting(Chunk::size).containsExactly(2500, 2500, 1000);
        assertThat(chunks).extracting(Chunk::index).containsExactly(0, 1, 2);
    }

    @Test
    @DisplayName("concatenating chunks in order reproduces the input")
    void chunksAreCompleteAndOrdered() {
        List<CallDescriptor> input = calls(17);
        List<Chunk> chunks = ChunkPlanner.plan(input, 5);

        List<CallDescriptor> flattened = new ArrayList<>();
        chunks.forEach(c -> flattened.addAll(c.calls()));
        assertThat(flattened).containsExactlyElementsOf(input);
        assertThat(chunks).hasSize(4);
        assertThat(chunks).allSatisfy(c -> assertThat(c.size()).isBetween(1, 5));
        assertThat(chunks.get(3).size()).isEqualTo(2);
    }

    @Test
    @DisplayName("chunk count is ceil(N / M) for exact multiples and remainders")
    void chunkCountIsCeiling() {
        assertThat(ChunkPlanner.plan(calls(10), 5)).hasSize(2);
        assertThat(ChunkPlanner.plan(calls(11), 5)).hasSize(3);
        assertThat(ChunkPlanner.plan(calls(1), 5000)).hasSize(1);
        assertThat(ChunkPlanner.plan(calls(3), 1)).hasSize(3);
    }

    @Test
    @DisplayName("empty or null input yields no chunks")
    void emptyInput() {
        assertThat(ChunkPlanner.plan(List.of(), 10)).isEmpty();
        assertThat(ChunkPlanner.plan(null, 10)).isEmpty();
    }

    @Test
    @DisplayName("chunk size below 1 is rejected")
    void rejectsInvalidChunkSize() {
        assertThatThrownBy(() -> ChunkPlanner.plan(calls(3), 0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("maxChunkSize");
    }
}
