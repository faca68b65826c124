package com.stagecraft.stagecraft_backend.engine;

/**
 * Raised when a workflow cannot be turned into a script, e.g. no nodes or a node
 * whose callable name cannot be resolved.
 */
public class ScriptGenerationException extends RuntimeException {

    public ScriptGenerationException(String message) {
        super(message);
    }
}
