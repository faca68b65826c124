package com.stagecraft.stagecraft_backend.model.dto;

import com.stagecraft.stagecraft_backend.model.workflow.WorkflowManifest;

/**
 * Request body for POST /api/v1/workflow/generate-script.
 * {@code code} is the concatenated component source pasted into the script as-is.
 */
public record GenerateScriptRequest(
    WorkflowManifest workflow,
    String code
) {}
