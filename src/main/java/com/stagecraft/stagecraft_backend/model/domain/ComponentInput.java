package com.stagecraft.stagecraft_backend.model.domain;

/**
 * One declared parameter of a component. Stored inside the component's JSON inputs column.
 */
public record ComponentInput(
    String name,
    String type,          // one of ComponentTypes.INPUT_TYPES
    String description,
    boolean required,
    Object defaultValue
) {}
