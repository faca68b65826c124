package com.stagecraft.stagecraft_backend.engine.emitter;

import com.stagecraft.stagecraft_backend.model.workflow.NodeRole;

public interface InvocationEmitter {

    NodeRole supportedRole();

    // Appends the statements for one node, indented for the body of execute_pipeline()
    void emit(InvocationContext ctx, StringBuilder out);
}
