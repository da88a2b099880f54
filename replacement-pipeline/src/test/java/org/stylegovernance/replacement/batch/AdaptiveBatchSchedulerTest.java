package org.stylegovernance.replacement.batch;

import java.time.Duration;
import java.util.List;
import java.util.Random;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import org.stylegovernance.replacement.CatastrophicReplacementException;
import org.stylegovernance.replacement.ReplacementEngineConfig;
import org.stylegovernance.replacement.ir.OperationKind;
import org.stylegovernance.replacement.ledger.FailureLedger;
import org.stylegovernance.replacement.mutation.InMemoryDocument;
import org.stylegovernance.replacement.progress.ProgressReporter;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import reactor.test.StepVerifier;

import static org.junit.jupiter.api.Assertions.*;
import static org.stylegovernance.replacement.mutation.InMemoryDocument.elementId;
import static org.stylegovernance.replacement.mutation.InMemoryDocument.elementIds;

class AdaptiveBatchSchedulerTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(10);

    private static final ReplacementEngineConfig FAST = ReplacementEngineConfig.builder()
        .retryDelaysMillis(List.of(0L))
        .build();

    private static List<BatchReport> run(ReplacementEngineConfig config, InMemoryDocument document,
                                         List<String> ids, FailureLedger ledger) {
        return new AdaptiveBatchScheduler(config)
            .process(ids, id -> document.applyReplacement(OperationKind.STYLE, id, "style-a", "style-b"),
                document::displayName, ledger)
            .collectList()
            .block(TIMEOUT);
    }

    @Test
    void processesCleanRunInFullSizedBatches() {
        var document = new InMemoryDocument().withElements(150, "style-a");
        var ledger = new FailureLedger(150);

        var reports = run(FAST, document, elementIds(150), ledger);

        assertEquals(List.of(100, 50), reports.stream().map(r -> r.result().batchSize()).collect(Collectors.toList()));
        assertEquals(List.of(66, 100), reports.stream()
            .map(r -> ProgressReporter.project(r.state()).percent())
            .collect(Collectors.toList()));
        assertEquals(0, ledger.failedCount());
        assertEquals(150, ledger.updatedCount());
        assertEquals(150, document.totalAttempts());
        for (int i = 0; i < 150; i++) {
            assertEquals("style-b", document.assignmentOf(elementId(i)));
        }
    }

    @Test
    void shrinksToFloorAfterBatchWithFailure() {
        var document = new InMemoryDocument().withElements(120, "style-a")
            .failAlways(elementId(49), "Element is locked");
        var ledger = new FailureLedger(120);

        var reports = run(FAST, document, elementIds(120), ledger);

        assertEquals(2, reports.size());
        var first = reports.get(0);
        assertEquals(100, first.result().batchSize());
        assertEquals(99, first.result().updated());
        assertEquals(1, first.result().failed());
        assertTrue(first.result().hasFailures());
        assertEquals(25, first.state().currentBatchSize());
        assertEquals(0, first.state().consecutiveSuccesses());

        var second = reports.get(1);
        assertEquals(20, second.result().batchSize());
        assertEquals(2, second.result().batchNumber());
        assertFalse(second.result().hasFailures());

        assertEquals(1, ledger.failedCount());
        var failure = ledger.failures().get(0);
        assertEquals(elementId(49), failure.elementId());
        assertEquals("Text 49", failure.elementName());
        assertEquals(3, failure.retryCount());
        assertEquals("Failed after 3 attempts. Last error: Element is locked", failure.reason());
        assertEquals(3, document.attemptsFor(elementId(49)));
        assertEquals("style-a", document.assignmentOf(elementId(49)));
    }

    @Test
    void growsAfterConsecutiveCleanBatchesUpToCeiling() {
        var config = FAST.toBuilder().successThreshold(2).build();
        var document = new InMemoryDocument().withElements(300, "style-a")
            .failAlways(elementId(0), "Element is locked");

        var reports = run(config, document, elementIds(300), new FailureLedger(300));

        assertEquals(List.of(100, 25, 25, 50, 50, 50),
            reports.stream().map(r -> r.result().batchSize()).collect(Collectors.toList()));
        assertEquals(List.of(25, 25, 50, 50, 75, 75),
            reports.stream().map(r -> r.state().currentBatchSize()).collect(Collectors.toList()));
    }

    @Test
    void doesNotGrowPastCeiling() {
        var config = FAST.toBuilder().successThreshold(1).build();
        var document = new InMemoryDocument().withElements(400, "style-a");

        var reports = run(config, document, elementIds(400), new FailureLedger(400));

        reports.forEach(r -> assertEquals(100, r.state().currentBatchSize()));
        assertEquals(4, reports.size());
    }

    @ParameterizedTest
    @ValueSource(longs = {1L, 7L, 42L, 2024L})
    void batchSizeStaysWithinBoundsAndCountsAddUp(long seed) {
        var random = new Random(seed);
        var total = 200 + random.nextInt(300);
        var document = new InMemoryDocument().withElements(total, "style-a");
        var failing = 0;
        for (int i = 0; i < total; i++) {
            if (random.nextInt(20) == 0) {
                document.failAlways(elementId(i), "Element is locked");
                failing++;
            }
        }
        var config = FAST.toBuilder().maxAttempts(1).successThreshold(2).build();
        var ledger = new FailureLedger(total);

        var reports = run(config, document, elementIds(total), ledger);

        var processed = 0;
        for (var report : reports) {
            var state = report.state();
            assertTrue(state.currentBatchSize() >= 25 && state.currentBatchSize() <= 100,
                "batch size " + state.currentBatchSize());
            processed += report.result().batchSize();
            assertEquals(processed, state.processed());
            assertEquals(total, state.processed() + state.remaining());
            assertEquals(report.result().batchSize(), report.result().updated() + report.result().failed());
        }
        assertEquals(total, processed);
        assertEquals(failing, ledger.failedCount());
        assertEquals(total - failing, ledger.updatedCount());
        assertEquals(total, document.totalAttempts());
    }

    @Test
    void dispatchesElementsInInputOrder() {
        var document = new InMemoryDocument().withElements(130, "style-a");

        run(FAST, document, elementIds(130), new FailureLedger(130));

        assertEquals(elementIds(130).stream().map(id -> "mutate:" + id).collect(Collectors.toList()),
            document.getJournal());
    }

    @Test
    void succeedsWhenElementRecoversOnRetry() {
        var document = new InMemoryDocument().withElements(10, "style-a").failTimes(elementId(3), 2);
        var ledger = new FailureLedger(10);

        var reports = run(FAST, document, elementIds(10), ledger);

        assertEquals(1, reports.size());
        assertEquals(0, ledger.failedCount());
        assertEquals(3, document.attemptsFor(elementId(3)));
        assertEquals("style-b", document.assignmentOf(elementId(3)));
    }

    @Test
    void catastrophicFailureAbortsWithoutRetry() {
        var document = new InMemoryDocument().withElements(150, "style-a").failCatastrophically(elementId(120));
        var ledger = new FailureLedger(150);
        var scheduler = new AdaptiveBatchScheduler(FAST);

        StepVerifier.create(scheduler.process(elementIds(150),
                id -> document.applyReplacement(OperationKind.STYLE, id, "style-a", "style-b"),
                document::displayName, ledger))
            .expectNextCount(1)
            .expectError(CatastrophicReplacementException.class)
            .verify(TIMEOUT);

        assertEquals(1, document.attemptsFor(elementId(120)));
        assertEquals(0, ledger.failedCount());
        // the second batch stopped at el-120, after its first 20 elements were already rewritten
        assertEquals(120, ledger.updatedCount());
        assertEquals(120, IntStream.range(0, 150)
            .filter(i -> "style-b".equals(document.assignmentOf(elementId(i))))
            .count());
    }

    @Test
    void emptyInputProducesNoBatches() {
        var document = new InMemoryDocument();

        StepVerifier.create(new AdaptiveBatchScheduler(FAST)
                .process(List.of(), id -> document.applyReplacement(OperationKind.STYLE, id, "a", "b"),
                    document::displayName, new FailureLedger(0)))
            .verifyComplete();

        assertEquals(0, document.totalAttempts());
    }

    @Test
    void unknownElementsAreNamedUnknown() {
        var document = new InMemoryDocument();
        var ledger = new FailureLedger(1);

        run(FAST.toBuilder().maxAttempts(1).build(), document, List.of("ghost"), ledger);

        var failure = ledger.failures().get(0);
        assertEquals("Unknown", failure.elementName());
        assertEquals("Failed after 1 attempts. Last error: Element ghost does not exist", failure.reason());
    }

    @Test
    void rejectsInvalidConfig() {
        var config = ReplacementEngineConfig.builder().minBatchSize(50).initialBatchSize(25).build();
        assertThrows(IllegalArgumentException.class, () -> new AdaptiveBatchScheduler(config));
    }
}
