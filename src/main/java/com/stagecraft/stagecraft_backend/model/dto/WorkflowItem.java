package com.stagecraft.stagecraft_backend.model.dto;

/**
 * One entry of a run request: {@code type} "id" references a stored component,
 * "code" carries raw source in {@code value}.
 */
public record WorkflowItem(String type, String value) {

    public static final String TYPE_ID   = "id";
    public static final String TYPE_CODE = "code";
}
