package com.stagecraft.stagecraft_backend.model.dto;

import java.util.Collections;
import java.util.List;

/**
 * Request body for POST /api/v1/workflow/run.
 * Null-safe: null items are treated as empty.
 */
public record RunRequest(List<WorkflowItem> items) {

    public List<WorkflowItem> items() {
        return items != null ? items : Collections.emptyList();
    }
}
