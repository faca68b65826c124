package com.stagecraft.stagecraft_backend.engine;

import com.stagecraft.stagecraft_backend.engine.emitter.InvocationContext;
import com.stagecraft.stagecraft_backend.engine.emitter.InvocationEmitterRegistry;
import com.stagecraft.stagecraft_backend.model.workflow.NodeRole;
import com.stagecraft.stagecraft_backend.model.workflow.PipelineNode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Turns one node into the Python statements that invoke it inside its stage.
 */
@Component
@RequiredArgsConstructor
public class InvocationSynthesizer {

    private final InvocationEmitterRegistry emitterRegistry;

    /**
     * @param index 1-based position inside the stage
     * @param total number of nodes in the stage
     * @param stage the node's effective stage (1..4)
     */
    public String synthesize(PipelineNode node, int index, int total, int stage) {
        String callableName = CallableNames.resolve(node);
        CallableNames.checkParameterNames(node);
        NodeRole role = NodeRoles.resolve(node, callableName, stage);

        InvocationContext ctx = new InvocationContext(
                node, callableName, CallableNames.label(node), index, total, stage);

        StringBuilder out = new StringBuilder();
        emitterRegistry.find(role)
                .orElseThrow(() -> new ScriptGenerationException(
                        "Node '" + ctx.label() + "' has role " + role + ", which this server cannot generate."))
                .emit(ctx, out);
        return out.toString();
    }
}
