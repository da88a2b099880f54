package org.stylegovernance.replacement.mutation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

import org.stylegovernance.replacement.CatastrophicReplacementException;
import org.stylegovernance.replacement.ir.OperationKind;

import reactor.core.publisher.Mono;

/**
 * A document held in memory for engine tests: elements with a current assignment, known styles and
 * tokens, and scripted failures. Every mutation attempt is appended to a shared journal so tests can check
 * ordering against other collaborators.
 */
public class InMemoryDocument implements MutationApplier, AssignmentResolver {

    private final Map<String, String> assignments = new ConcurrentHashMap<>();
    private final Map<String, String> names = new ConcurrentHashMap<>();
    private final Set<String> styles = ConcurrentHashMap.newKeySet();
    private final Set<String> tokens = ConcurrentHashMap.newKeySet();
    private final Map<String, String> alwaysFailing = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> failuresBeforeSuccess = new ConcurrentHashMap<>();
    private final Set<String> catastrophic = ConcurrentHashMap.newKeySet();
    private final Set<String> hanging = ConcurrentHashMap.newKeySet();
    private final Map<String, AtomicInteger> attempts = new ConcurrentHashMap<>();
    private final List<String> journal;

    public InMemoryDocument(List<String> journal) {
        this.journal = journal;
    }

    public InMemoryDocument() {
        this(Collections.synchronizedList(new ArrayList<>()));
    }

    /** Adds elements {@code el-0 .. el-(count-1)}, all assigned to {@code assignmentId}. */
    public InMemoryDocument withElements(int count, String assignmentId) {
        for (int i = 0; i < count; i++) {
            assignments.put(elementId(i), assignmentId);
            names.put(elementId(i), "Text " + i);
        }
        return this;
    }

    public InMemoryDocument withStyles(String... styleIds) {
        styles.addAll(List.of(styleIds));
        return this;
    }

    public InMemoryDocument withTokens(String... tokenIds) {
        tokens.addAll(List.of(tokenIds));
        return this;
    }

    public InMemoryDocument failAlways(String elementId, String reason) {
        alwaysFailing.put(elementId, reason);
        return this;
    }

    public InMemoryDocument failTimes(String elementId, int times) {
        failuresBeforeSuccess.put(elementId, new AtomicInteger(times));
        return this;
    }

    public InMemoryDocument failCatastrophically(String elementId) {
        catastrophic.add(elementId);
        return this;
    }

    /** Mutations of this element never answer, as if the host stopped responding. */
    public InMemoryDocument hangOn(String elementId) {
        hanging.add(elementId);
        return this;
    }

    public static String elementId(int index) {
        return "el-" + index;
    }

    public static List<String> elementIds(int count) {
        var ids = new ArrayList<String>(count);
        for (int i = 0; i < count; i++) {
            ids.add(elementId(i));
        }
        return ids;
    }

    @Override
    public Mono<Void> applyReplacement(OperationKind kind, String elementId, String sourceId, String targetId) {
        return Mono.defer(() -> {
            attempts.computeIfAbsent(elementId, id -> new AtomicInteger()).incrementAndGet();
            journal.add("mutate:" + elementId);
            if (hanging.contains(elementId)) {
                return Mono.never();
            }
            return Mono.fromRunnable(() -> mutate(elementId, sourceId, targetId));
        });
    }

    private void mutate(String elementId, String sourceId, String targetId) {
        if (catastrophic.contains(elementId)) {
            throw new CatastrophicReplacementException("Document closed while updating " + elementId);
        }
        if (alwaysFailing.containsKey(elementId)) {
            throw new IllegalStateException(alwaysFailing.get(elementId));
        }
        var remaining = failuresBeforeSuccess.get(elementId);
        if (remaining != null && remaining.getAndDecrement() > 0) {
            throw new IllegalStateException("Request timeout");
        }
        if (!assignments.containsKey(elementId)) {
            throw new IllegalStateException("Element " + elementId + " does not exist");
        }
        assignments.replace(elementId, sourceId, targetId);
    }

    @Override
    public String displayName(String elementId) {
        return names.getOrDefault(elementId, UNKNOWN_ELEMENT_NAME);
    }

    @Override
    public Mono<Boolean> resolves(OperationKind kind, String assignmentId) {
        return Mono.fromSupplier(() -> kind == OperationKind.STYLE
            ? styles.contains(assignmentId)
            : tokens.contains(assignmentId));
    }

    public String assignmentOf(String elementId) {
        return assignments.get(elementId);
    }

    public int attemptsFor(String elementId) {
        var count = attempts.get(elementId);
        return count != null ? count.get() : 0;
    }

    public int totalAttempts() {
        return attempts.values().stream().mapToInt(AtomicInteger::get).sum();
    }

    public List<String> getJournal() {
        synchronized (journal) {
            return List.copyOf(journal);
        }
    }
}
