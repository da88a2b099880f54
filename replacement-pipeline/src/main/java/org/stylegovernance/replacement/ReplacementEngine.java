package org.stylegovernance.replacement;

import java.time.Clock;
import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;

import org.stylegovernance.replacement.batch.AdaptiveBatchScheduler;
import org.stylegovernance.replacement.checkpoint.CheckpointProvider;
import org.stylegovernance.replacement.checkpoint.CheckpointTitles;
import org.stylegovernance.replacement.event.ReplacementEvent;
import org.stylegovernance.replacement.event.ReplacementEventChannel;
import org.stylegovernance.replacement.ir.ErrorKind;
import org.stylegovernance.replacement.ir.OperationKind;
import org.stylegovernance.replacement.ir.ReplacementRequest;
import org.stylegovernance.replacement.ir.ReplacementResult;
import org.stylegovernance.replacement.ledger.FailureLedger;
import org.stylegovernance.replacement.mutation.AssignmentResolver;
import org.stylegovernance.replacement.mutation.MutationApplier;
import org.stylegovernance.replacement.progress.ProgressReporter;
import org.stylegovernance.replacement.state.ReplacementState;
import org.stylegovernance.replacement.state.ReplacementStateMachine;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.SignalType;

/**
 * Runs style and token replacements against one document.
 *
 * <p>Lifecycle: idle, validating, creating_checkpoint, processing, then complete or error. A checkpoint is
 * taken exactly once, before the first mutation; after that the operation is always driven to a terminal
 * state with full accounting. Cancellation is only honoured while validating. Only one operation runs at a
 * time, and a finished operation holds the document until {@link #acknowledge()} is called.
 *
 * <p>Business failures (bad request, checkpoint failure, every element failing, a catastrophic abort) do not
 * error the returned Mono; they settle the operation to {@code error} and are described by the
 * {@link ReplacementResult} and an {@code operation-error} event. The Mono errors only for misuse, such as
 * starting a second operation while one is active.
 *
 * <p>Disposing the returned Mono while validating behaves like {@link #cancel()}. Disposing it later stops
 * the run and settles it to {@code error}, so the document is never left held by an operation nobody
 * watches.
 */
@Slf4j
public class ReplacementEngine implements AutoCloseable {

    private final CheckpointProvider checkpointProvider;
    private final MutationApplier mutationApplier;
    private final AssignmentResolver assignmentResolver;
    private final AdaptiveBatchScheduler scheduler;
    private final ReplacementEventChannel eventChannel = new ReplacementEventChannel();
    private final ReplacementStateMachine stateMachine = new ReplacementStateMachine();
    private final Clock clock;

    private final Object lock = new Object();
    private ReplacementOperation activeOperation;
    private volatile ReplacementResult lastResult;

    public ReplacementEngine(CheckpointProvider checkpointProvider,
                             MutationApplier mutationApplier,
                             AssignmentResolver assignmentResolver) {
        this(checkpointProvider, mutationApplier, assignmentResolver, ReplacementEngineConfig.defaults(),
            Clock.systemUTC());
    }

    public ReplacementEngine(CheckpointProvider checkpointProvider,
                             MutationApplier mutationApplier,
                             AssignmentResolver assignmentResolver,
                             ReplacementEngineConfig config,
                             Clock clock) {
        this(checkpointProvider, mutationApplier, assignmentResolver, new AdaptiveBatchScheduler(config), clock);
    }

    public ReplacementEngine(CheckpointProvider checkpointProvider,
                             MutationApplier mutationApplier,
                             AssignmentResolver assignmentResolver,
                             AdaptiveBatchScheduler scheduler,
                             Clock clock) {
        this.checkpointProvider = checkpointProvider;
        this.mutationApplier = mutationApplier;
        this.assignmentResolver = assignmentResolver;
        this.scheduler = scheduler;
        this.clock = clock;
    }

    /** Ordered event stream covering every operation this engine runs from now on. */
    public Flux<ReplacementEvent> events() {
        return eventChannel.events();
    }

    public ReplacementState getState() {
        return stateMachine.getState();
    }

    /** Result of the most recently settled operation, including one whose caller stopped listening. */
    public Optional<ReplacementResult> getLastResult() {
        return Optional.ofNullable(lastResult);
    }

    public void addStateListener(ReplacementStateMachine.TransitionListener listener) {
        stateMachine.addListener(listener);
    }

    /** Cancellation is possible until a checkpoint is being created. */
    public boolean canCancel() {
        var state = stateMachine.getState();
        return state == ReplacementState.IDLE || state == ReplacementState.VALIDATING;
    }

    /**
     * Ask the running operation to stop. Only honoured while validating, in which case the operation
     * returns to idle with no side effects and its Mono completes empty.
     *
     * @return true if the cancellation will take effect
     */
    public boolean cancel() {
        synchronized (lock) {
            var state = stateMachine.getState();
            if (state == ReplacementState.VALIDATING && activeOperation != null) {
                activeOperation.requestCancel();
                log.info("Cancellation requested for {}", activeOperation);
                return true;
            }
            log.warn("Replacement cannot be cancelled in state {}", state.wireName());
            return false;
        }
    }

    /**
     * Release a finished operation so a new one can start.
     *
     * @return false if there is no finished operation to release
     */
    public boolean acknowledge() {
        synchronized (lock) {
            if (!stateMachine.getState().isTerminal()) {
                return false;
            }
            stateMachine.requireTransition(ReplacementState.IDLE);
            activeOperation = null;
            return true;
        }
    }

    public Mono<ReplacementResult> replaceStyle(String sourceStyleId, String targetStyleId,
                                                List<String> affectedElementIds) {
        return replace(new ReplacementRequest(OperationKind.STYLE, sourceStyleId, targetStyleId, affectedElementIds));
    }

    public Mono<ReplacementResult> replaceToken(String sourceTokenId, String targetTokenId,
                                                List<String> affectedElementIds) {
        return replace(new ReplacementRequest(OperationKind.TOKEN, sourceTokenId, targetTokenId, affectedElementIds));
    }

    /**
     * Run a replacement. Returns a cold Mono; subscribing starts the operation. Emits the terminal result,
     * completes empty if the operation was cancelled while validating, and errors with
     * {@link ReplacementInProgressException} if the document is busy.
     */
    public Mono<ReplacementResult> replace(ReplacementRequest request) {
        return Mono.defer(() -> {
            var operation = begin(request);
            return validate(operation)
                .then(Mono.fromCallable(() -> leaveValidation(operation)))
                .flatMap(proceed -> proceed ? checkpointAndProcess(operation) : Mono.<ReplacementResult>empty())
                .onErrorResume(ReplacementException.class, e -> settleError(operation, e))
                .doFinally(signal -> {
                    if (signal == SignalType.CANCEL) {
                        abandon(operation);
                    }
                });
        });
    }

    @Override
    public void close() {
        eventChannel.close();
    }

    private ReplacementOperation begin(ReplacementRequest request) {
        ReplacementOperation operation;
        synchronized (lock) {
            if (activeOperation != null) {
                throw new ReplacementInProgressException(stateMachine.getState());
            }
            operation = new ReplacementOperation(request, clock.instant());
            stateMachine.requireTransition(ReplacementState.VALIDATING);
            activeOperation = operation;
        }
        log.info("Starting {} replacement {} -> {} on {} elements", wireName(operation.getKind()),
            operation.getSourceId(), operation.getTargetId(), operation.getAffectedElementIds().size());
        eventChannel.emit(new ReplacementEvent.OperationStarted(operation.getKind(), operation.getSourceId(),
            operation.getTargetId(), operation.getAffectedElementIds().size()));
        return operation;
    }

    private Mono<Void> validate(ReplacementOperation operation) {
        return Mono.defer(() -> {
            var kind = operation.getKind();
            if (kind == null) {
                return invalid("Operation kind is required");
            }
            if (isBlank(operation.getSourceId()) || isBlank(operation.getTargetId())) {
                return invalid("Source and target " + kind.wireName() + " ids are required");
            }
            if (operation.getSourceId().equals(operation.getTargetId())) {
                return invalid("Source and target " + kind.wireName() + "s cannot be the same");
            }
            var ids = operation.getAffectedElementIds();
            if (ids.isEmpty()) {
                return invalid("No elements specified for replacement");
            }
            var seen = new HashSet<String>();
            for (var id : ids) {
                if (isBlank(id)) {
                    return invalid("Affected elements contain an empty id");
                }
                if (!seen.add(id)) {
                    return invalid("Affected elements contain duplicate id " + id);
                }
            }
            return requireResolves(kind, operation.getSourceId(), "Source")
                .then(requireResolves(kind, operation.getTargetId(), "Target"));
        });
    }

    private Mono<Void> requireResolves(OperationKind kind, String assignmentId, String role) {
        return Mono.defer(() -> assignmentResolver.resolves(kind, assignmentId))
            .defaultIfEmpty(false)
            .onErrorMap(e -> new ReplacementValidationException(
                "Could not resolve " + role.toLowerCase() + " " + kind.wireName() + " " + assignmentId
                    + ": " + e.getMessage(), e))
            .flatMap(found -> Boolean.TRUE.equals(found)
                ? Mono.<Void>empty()
                : ReplacementEngine.<Void>invalid(role + " " + kind.wireName() + " not found: " + assignmentId));
    }

    /** Moves on to checkpoint creation, or back to idle if a cancellation arrived while validating. */
    private boolean leaveValidation(ReplacementOperation operation) {
        synchronized (lock) {
            if (operation.isCancelRequested()) {
                returnToIdleAfterCancel(operation);
                return false;
            }
            stateMachine.requireTransition(ReplacementState.CREATING_CHECKPOINT);
            return true;
        }
    }

    private void returnToIdleAfterCancel(ReplacementOperation operation) {
        stateMachine.requireTransition(ReplacementState.IDLE);
        activeOperation = null;
        log.info("Replacement cancelled during validation, nothing was changed: {}", operation);
    }

    private Mono<ReplacementResult> checkpointAndProcess(ReplacementOperation operation) {
        var title = CheckpointTitles.titleFor(operation.getKind(), clock);
        return Mono.defer(() -> checkpointProvider.createCheckpoint(title))
            .switchIfEmpty(Mono.error(() -> new IllegalStateException("Checkpoint provider returned no checkpoint")))
            .onErrorMap(e -> new CheckpointCreationException("Checkpoint creation failed: " + e.getMessage()
                + ". No changes were made to the document.", e))
            .flatMap(checkpoint -> {
                operation.setCheckpoint(checkpoint);
                log.info("Created version checkpoint: {}", checkpoint.title());
                eventChannel.emit(new ReplacementEvent.CheckpointCreated(checkpoint.title(), checkpoint.timestamp()));
                stateMachine.requireTransition(ReplacementState.PROCESSING);
                return process(operation);
            });
    }

    private Mono<ReplacementResult> process(ReplacementOperation operation) {
        var ledger = new FailureLedger(operation.getAffectedElementIds().size());
        operation.setLedger(ledger);
        var kind = operation.getKind();
        return scheduler.process(operation.getAffectedElementIds(),
                elementId -> Mono.defer(() -> mutationApplier.applyReplacement(kind, elementId,
                    operation.getSourceId(), operation.getTargetId())),
                mutationApplier::displayName,
                ledger)
            .doOnNext(report -> eventChannel.emit(new ReplacementEvent.Progress(
                ProgressReporter.project(report.state()))))
            .then(Mono.fromCallable(() -> settleProcessed(operation, ledger)))
            .onErrorMap(e -> !(e instanceof ReplacementException),
                e -> new CatastrophicReplacementException("Replacement aborted: " + e.getMessage(), e));
    }

    private ReplacementResult settleProcessed(ReplacementOperation operation, FailureLedger ledger) {
        synchronized (lock) {
            if (operation.isSettled()) {
                return operation.getResult();
            }
            var result = ledger.settle(operation.getKind(), operation.getCheckpointTitle(), elapsed(operation));
            if (result.isError()) {
                stateMachine.requireTransition(ReplacementState.ERROR);
                log.error("Replacement failed for every element ({}): {}", result.errorKind().wireName(),
                    result.errorMessage());
                eventChannel.emit(new ReplacementEvent.OperationError(operation.getKind(), result.errorMessage(),
                    result.errorKind(), result.checkpointTitle()));
            } else {
                stateMachine.requireTransition(ReplacementState.COMPLETE);
                log.info("Replacement complete: {} updated, {} failed, checkpoint '{}'", result.updatedCount(),
                    result.failedCount(), result.checkpointTitle());
                eventChannel.emit(new ReplacementEvent.OperationComplete(operation.getKind(), result.updatedCount(),
                    result.failedElements(), result.duration(), result.hasWarnings()));
            }
            return finish(operation, result);
        }
    }

    private Mono<ReplacementResult> settleError(ReplacementOperation operation, ReplacementException error) {
        if (error.getErrorKind() == ErrorKind.VALIDATION) {
            synchronized (lock) {
                if (operation.isCancelRequested() && stateMachine.getState() == ReplacementState.VALIDATING) {
                    returnToIdleAfterCancel(operation);
                    return Mono.empty();
                }
            }
        }
        var checkpointTitle = operation.getCheckpointTitle();
        var message = error.getMessage();
        if (error.getErrorKind() == ErrorKind.PROCESSING && checkpointTitle != null) {
            message = message + ". Restore checkpoint '" + checkpointTitle + "' to recover.";
        }
        if (error instanceof CatastrophicReplacementException) {
            log.error("Replacement aborted with {} of {} elements updated", updatedSoFar(operation),
                operation.getAffectedElementIds().size(), error);
        } else {
            log.warn("Replacement failed ({}): {}", error.getErrorKind().wireName(), message);
        }
        return Mono.just(settleFailure(operation, error.getErrorKind(), message));
    }

    /**
     * The subscriber went away. While validating nothing has happened yet, so the operation is dropped like
     * a cancellation; from the checkpoint on it is settled to error with whatever was done so far.
     */
    private void abandon(ReplacementOperation operation) {
        synchronized (lock) {
            if (activeOperation != operation || operation.isSettled()) {
                return;
            }
            if (stateMachine.getState() == ReplacementState.VALIDATING) {
                returnToIdleAfterCancel(operation);
                return;
            }
            var checkpointTitle = operation.getCheckpointTitle();
            if (checkpointTitle == null) {
                log.warn("Replacement abandoned while creating the checkpoint: {}", operation);
                settleFailure(operation, ErrorKind.CHECKPOINT,
                    "Replacement abandoned while creating the checkpoint. No changes were made to the document.");
                return;
            }
            var updated = updatedSoFar(operation);
            log.warn("Replacement abandoned during processing after {} updated elements: {}", updated, operation);
            settleFailure(operation, ErrorKind.PROCESSING, "Replacement abandoned after " + updated + " of "
                + operation.getAffectedElementIds().size() + " elements were updated. Restore checkpoint '"
                + checkpointTitle + "' to recover.");
        }
    }

    private ReplacementResult settleFailure(ReplacementOperation operation, ErrorKind errorKind, String message) {
        synchronized (lock) {
            if (operation.isSettled()) {
                return operation.getResult();
            }
            if (!stateMachine.transitionTo(ReplacementState.ERROR)) {
                log.error("Could not move replacement to the error state from {}",
                    stateMachine.getState().wireName());
            }
            var checkpointTitle = operation.getCheckpointTitle();
            var ledger = operation.getLedger() != null
                ? operation.getLedger()
                : new FailureLedger(operation.getAffectedElementIds().size());
            var result = ledger.settleAborted(operation.getKind(), checkpointTitle, elapsed(operation), errorKind,
                message);
            eventChannel.emit(new ReplacementEvent.OperationError(operation.getKind(), message, errorKind,
                checkpointTitle));
            return finish(operation, result);
        }
    }

    private ReplacementResult finish(ReplacementOperation operation, ReplacementResult result) {
        operation.setResult(result);
        lastResult = result;
        return result;
    }

    private static int updatedSoFar(ReplacementOperation operation) {
        return operation.getLedger() != null ? operation.getLedger().updatedCount() : 0;
    }

    private Duration elapsed(ReplacementOperation operation) {
        return Duration.between(operation.getStartedAt(), clock.instant());
    }

    private static <T> Mono<T> invalid(String message) {
        return Mono.error(new ReplacementValidationException(message));
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static String wireName(OperationKind kind) {
        return kind != null ? kind.wireName() : "unknown";
    }
}
