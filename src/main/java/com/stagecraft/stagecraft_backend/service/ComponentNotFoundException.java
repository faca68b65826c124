package com.stagecraft.stagecraft_backend.service;

import java.util.UUID;

public class ComponentNotFoundException extends RuntimeException {

    private final UUID componentId;

    public ComponentNotFoundException(UUID componentId) {
        super("Component not found: " + componentId);
        this.componentId = componentId;
    }

    public UUID getComponentId() {
        return componentId;
    }
}
