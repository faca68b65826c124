package com.stagecraft.stagecraft_backend.model.workflow;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.List;

/**
 * Exported workflow: format version plus nodes in execution order.
 * Null-safe: a null node list is treated as empty.
 */
public record WorkflowManifest(
    String version,
    @JsonProperty("exported_at") String exportedAt,
    List<PipelineNode> nodes
) {
    public List<PipelineNode> nodes() {
        return nodes != null ? nodes : Collections.emptyList();
    }
}
