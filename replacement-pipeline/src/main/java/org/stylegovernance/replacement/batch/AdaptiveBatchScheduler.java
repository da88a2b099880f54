package org.stylegovernance.replacement.batch;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.stream.Collectors;

import org.stylegovernance.replacement.CatastrophicReplacementException;
import org.stylegovernance.replacement.ReplacementEngineConfig;
import org.stylegovernance.replacement.ir.BatchResult;
import org.stylegovernance.replacement.ir.FailedElement;
import org.stylegovernance.replacement.ledger.FailureLedger;
import org.stylegovernance.replacement.retry.Retries;
import org.stylegovernance.replacement.retry.RetryOutcome;
import org.stylegovernance.replacement.retry.RetryPolicy;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Drives a list of element ids through a mutation in batches whose size adapts to how the host behaves.
 *
 * <p>Batches run strictly one after another; each batch boundary waits for every element of the batch to
 * succeed or exhaust its retries. Within a batch, elements are dispatched in order with up to a batch's
 * worth in flight. After a batch with any failure the next batch drops to the floor size; after
 * {@code successThreshold} clean batches in a row it grows by {@code growthStep}, up to the ceiling.
 *
 * <p>Element failures never stop the run. A {@link CatastrophicReplacementException} from the mutation, or
 * a broken invariant, does.
 */
@Slf4j
public class AdaptiveBatchScheduler {

    private final ReplacementEngineConfig config;
    private final RetryPolicy retryPolicy;

    public AdaptiveBatchScheduler(ReplacementEngineConfig config) {
        this(config, config.toRetryPolicy());
    }

    public AdaptiveBatchScheduler(ReplacementEngineConfig config, RetryPolicy retryPolicy) {
        this.config = config.validate();
        this.retryPolicy = retryPolicy.withFatal(CatastrophicReplacementException.class::isInstance);
    }

    /**
     * Process every id, recording each updated element in the ledger as soon as it succeeds and each
     * exhausted element at its batch boundary. Returns a cold Flux with one report per
     * batch, in batch order.
     *
     * @param mutation one attempt at updating the element with the given id
     * @param displayName name used when the element ends up in the ledger
     */
    public Flux<BatchReport> process(List<String> elementIds,
                                     Function<String, Mono<Void>> mutation,
                                     Function<String, String> displayName,
                                     FailureLedger ledger) {
        return Flux.defer(() -> {
            var state = new BatchProcessorState(elementIds, ledger, config.getInitialBatchSize(),
                config.getMinBatchSize(), config.getMaxBatchSize());
            if (!state.hasRemaining()) {
                return Flux.empty();
            }
            log.info("Starting batch processing: {} elements, initial batch size: {}",
                state.getTotal(), state.getCurrentBatchSize());
            return Mono.defer(() -> runNextBatch(state, mutation, displayName))
                .repeat(state::hasRemaining)
                .doOnComplete(() -> log.info("Batch processing complete: {} batches, final size: {}",
                    state.snapshot().batchesCompleted(), state.getCurrentBatchSize()));
        });
    }

    private Mono<BatchReport> runNextBatch(BatchProcessorState state,
                                           Function<String, Mono<Void>> mutation,
                                           Function<String, String> displayName) {
        var batch = state.nextBatch();
        var batchNumber = state.snapshot().batchesCompleted() + 1;
        var startNanos = System.nanoTime();
        log.atDebug().setMessage("Processing batch {}: {} elements ({}/{})")
            .addArgument(batchNumber)
            .addArgument(batch.size())
            .addArgument(state::getProcessed)
            .addArgument(state::getTotal)
            .log();

        List<Supplier<Mono<Void>>> units = batch.stream()
            .map(id -> (Supplier<Mono<Void>>) () -> mutation.apply(id).doOnSuccess(ignored -> state.recordUpdated()))
            .collect(Collectors.toList());

        return Retries.batchRetry(units, retryPolicy, batch.size())
            .map(outcomes -> {
                if (outcomes.size() != batch.size()) {
                    throw new CatastrophicReplacementException("Batch " + batchNumber + " produced "
                        + outcomes.size() + " outcomes for " + batch.size() + " elements");
                }
                var failures = collectFailures(batch, outcomes, displayName);
                state.completeBatch(batch.size(), failures);
                adaptBatchSize(state, failures.size());
                var result = new BatchResult(batchNumber, batch.size(), batch.size() - failures.size(),
                    failures.size(), failures, Duration.ofNanos(System.nanoTime() - startNanos));
                return new BatchReport(result, state.snapshot());
            });
    }

    private static List<FailedElement> collectFailures(List<String> batch,
                                                       List<RetryOutcome<Void>> outcomes,
                                                       Function<String, String> displayName) {
        var failures = new ArrayList<FailedElement>();
        for (int i = 0; i < outcomes.size(); i++) {
            var outcome = outcomes.get(i);
            if (Retries.isRetryFailure(outcome)) {
                var failure = (RetryOutcome.Failure<Void>) outcome;
                var elementId = batch.get(i);
                failures.add(new FailedElement(elementId, displayName.apply(elementId), failure.error(),
                    failure.attempts()));
            }
        }
        return failures;
    }

    private void adaptBatchSize(BatchProcessorState state, int failedInBatch) {
        var oldSize = state.getCurrentBatchSize();
        if (failedInBatch > 0) {
            state.resize(config.getMinBatchSize());
            state.resetConsecutiveSuccesses();
            log.info("Batch errors detected ({} failed), reducing batch size: {} -> {}",
                failedInBatch, oldSize, state.getCurrentBatchSize());
            return;
        }
        state.incrementConsecutiveSuccesses();
        if (state.getConsecutiveSuccesses() >= config.getSuccessThreshold() && oldSize < config.getMaxBatchSize()) {
            state.resize(Math.min(oldSize + config.getGrowthStep(), config.getMaxBatchSize()));
            state.resetConsecutiveSuccesses();
            log.info("{} consecutive clean batches, increasing batch size: {} -> {}",
                config.getSuccessThreshold(), oldSize, state.getCurrentBatchSize());
        }
    }
}
