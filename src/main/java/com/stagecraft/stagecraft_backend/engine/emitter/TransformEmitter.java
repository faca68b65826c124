package com.stagecraft.stagecraft_backend.engine.emitter;

import com.stagecraft.stagecraft_backend.model.workflow.NodeRole;
import org.springframework.stereotype.Component;

/**
 * {@code result = fn(current_data, ...)}; a tuple result contributes its first element.
 */
@Component
public class TransformEmitter extends PreprocessingEmitter {

    @Override
    public NodeRole supportedRole() {
        return NodeRole.TRANSFORM;
    }

    @Override
    protected void emitCall(InvocationContext ctx, StringBuilder out) {
        out.append("        result = ").append(ctx.call("current_data")).append('\n');
        out.append("""
                        if isinstance(result, tuple):
                            current_data = result[0]
                        else:
                            current_data = result
                """);
    }
}
