package org.stylegovernance.replacement.ir;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * An element that could not be updated after its retry policy was exhausted.
 */
public record FailedElement(
    @JsonProperty("elementId") String elementId,
    @JsonProperty("elementName") String elementName,
    @JsonProperty("reason") String reason,
    @JsonProperty("retryCount") int retryCount
) {}
