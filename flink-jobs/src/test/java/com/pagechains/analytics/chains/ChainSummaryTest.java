package com.pagechains.analytics.chains;

import org.junit.jupiter.api.Test;

import com.pagechains.analytics.model.RequestRecord;

import java.util.Collections;
import java.util.List;

import static com.pagechains.analytics.model.RequestPriority.HIGH;
import static com.pagechains.analytics.model.RequestPriority.MEDIUM;
import static com.pagechains.analytics.model.RequestPriority.VERY_HIGH;
import static org.junit.jupiter.api.Assertions.*;

class ChainSummaryTest {

    private final CriticalChainAssembler assembler = new CriticalChainAssembler(MockRecords.rules());

    @Test
    void summarizesLinearChain() {
        ChainForest forest = assembler.assemble(
                MockRecords.build(List.of(HIGH, MEDIUM, VERY_HIGH, HIGH), new int[][] {{0, 1}, {1, 2}, {2, 3}}),
                MockRecords.root());

        ChainSummary summary = ChainSummary.of(forest);

        assertEquals(1, summary.chainCount());
        assertEquals(4, summary.longestChainLength());
        assertEquals(4000.0, summary.longestChainDurationMs(), 1e-9);
        assertEquals(4000L, summary.longestChainTransferSize());
        assertEquals(List.of("0", "1", "2", "3"), summary.longestChainRequestIds());
    }

    @Test
    void picksTheChainThatFinishesLast() {
        ChainForest forest = assembler.assemble(
                MockRecords.build(Collections.nCopies(9, HIGH),
                        new int[][] {{0, 1}, {1, 2}, {1, 3}, {0, 4}, {4, 5}, {5, 7}, {7, 8}, {5, 6}}),
                MockRecords.root());

        ChainSummary summary = ChainSummary.of(forest);

        assertEquals(4, summary.chainCount());
        assertEquals(List.of("0", "4", "5", "7", "8"), summary.longestChainRequestIds());
        assertEquals(5, summary.longestChainLength());
        assertEquals(9000.0, summary.longestChainDurationMs(), 1e-9);
        assertEquals(5000L, summary.longestChainTransferSize());
    }

    @Test
    void tiesKeepTheFirstChain() {
        List<RequestRecord> records = MockRecords.build(List.of(HIGH, HIGH, HIGH), new int[][] {{0, 1}, {0, 2}});
        records.get(1).endTime = 5.0;
        records.get(2).endTime = 5.0;

        ChainSummary summary = ChainSummary.of(assembler.assemble(records, MockRecords.root()));

        assertEquals(2, summary.chainCount());
        assertEquals(List.of("0", "1"), summary.longestChainRequestIds());
    }

    @Test
    void rootOnlyForestIsOneChain() {
        ChainSummary summary = ChainSummary.of(assembler.assemble(
                MockRecords.build(List.of(HIGH), new int[0][]), MockRecords.root()));

        assertEquals(1, summary.chainCount());
        assertEquals(1, summary.longestChainLength());
        assertEquals(1000.0, summary.longestChainDurationMs(), 1e-9);
    }

    @Test
    void emptyForestIsAllZero() {
        ChainSummary summary = ChainSummary.of(ChainForest.empty());

        assertEquals(0, summary.chainCount());
        assertEquals(0, summary.longestChainLength());
        assertEquals(0.0, summary.longestChainDurationMs());
        assertTrue(summary.longestChainRequestIds().isEmpty());
    }
}
