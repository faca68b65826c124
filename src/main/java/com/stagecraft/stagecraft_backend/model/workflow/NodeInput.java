package com.stagecraft.stagecraft_backend.model.workflow;

/** Declared parameter of a component callable. Informational only. */
public record NodeInput(String name, String type) {}
