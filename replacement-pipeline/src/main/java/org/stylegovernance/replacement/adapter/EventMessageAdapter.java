package org.stylegovernance.replacement.adapter;

import org.stylegovernance.replacement.event.ReplacementEvent;
import org.stylegovernance.replacement.state.ReplacementState;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Converts engine events into the {@code {"type": ..., "payload": {...}}} messages the presentation layer
 * consumes.
 *
 * The engine never builds JSON itself; this adapter is the only place that knows the wire shape.
 */
public final class EventMessageAdapter {
    private static final ObjectMapper objectMapper = new ObjectMapper();

    private EventMessageAdapter() {}

    public static ObjectNode toMessage(ReplacementEvent event) {
        var message = objectMapper.createObjectNode();
        message.put("type", event.type());
        message.set("payload", payloadOf(event));
        return message;
    }

    public static String toJson(ReplacementEvent event) throws JsonProcessingException {
        return objectMapper.writeValueAsString(toMessage(event));
    }

    private static ObjectNode payloadOf(ReplacementEvent event) {
        var payload = objectMapper.createObjectNode();
        if (event instanceof ReplacementEvent.OperationStarted) {
            var started = (ReplacementEvent.OperationStarted) event;
            payload.put("operationType", started.operationType().wireName());
            payload.put("state", ReplacementState.VALIDATING.wireName());
            payload.put("sourceId", started.sourceId());
            payload.put("targetId", started.targetId());
            payload.put("affectedCount", started.affectedCount());
        } else if (event instanceof ReplacementEvent.CheckpointCreated) {
            var created = (ReplacementEvent.CheckpointCreated) event;
            payload.put("title", created.title());
            payload.put("timestamp", created.timestamp().toString());
        } else if (event instanceof ReplacementEvent.Progress) {
            var progress = ((ReplacementEvent.Progress) event).progress();
            payload.put("state", ReplacementState.PROCESSING.wireName());
            payload.put("progress", progress.percent());
            payload.put("currentBatch", progress.currentBatch());
            payload.put("totalBatches", progress.totalBatchesEstimate());
            payload.put("currentBatchSize", progress.currentBatchSize());
            payload.put("processed", progress.processed());
            payload.put("failed", progress.failedSoFar());
        } else if (event instanceof ReplacementEvent.OperationComplete) {
            var complete = (ReplacementEvent.OperationComplete) event;
            payload.put("operationType", complete.operationType().wireName());
            payload.put("updatedCount", complete.updatedCount());
            if (!complete.failedElements().isEmpty()) {
                payload.set("failedElements", objectMapper.valueToTree(complete.failedElements()));
            }
            payload.put("durationMs", complete.duration().toMillis());
            payload.put("hasWarnings", complete.hasWarnings());
        } else if (event instanceof ReplacementEvent.OperationError) {
            var error = (ReplacementEvent.OperationError) event;
            payload.put("operationType", error.operationType() != null ? error.operationType().wireName() : null);
            payload.put("error", error.error());
            payload.put("errorType", error.errorType().wireName());
            if (error.checkpointTitle() != null) {
                payload.put("checkpointTitle", error.checkpointTitle());
            }
            payload.put("canRollback", error.canRollback());
        } else {
            throw new IllegalArgumentException("Unknown replacement event " + event.getClass().getName());
        }
        return payload;
    }
}
