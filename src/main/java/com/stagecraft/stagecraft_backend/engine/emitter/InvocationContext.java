package com.stagecraft.stagecraft_backend.engine.emitter;

import com.stagecraft.stagecraft_backend.engine.PythonArguments;
import com.stagecraft.stagecraft_backend.model.workflow.PipelineNode;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;

/**
 * Everything an emitter needs to write one node's invocation.
 *
 * @param index 1-based position of the node inside its stage
 * @param total number of nodes in the stage
 */
public record InvocationContext(
    PipelineNode node,
    String callableName,
    String label,
    int index,
    int total,
    int stage
) {

    /** {@code fn(positional..., kw=value, ...)} */
    public String call(String... positional) {
        return call(Set.of(), positional);
    }

    /** Same as {@link #call(String...)} but leaves out the given keyword parameters. */
    public String call(Set<String> excludedParams, String... positional) {
        List<String> parts = new ArrayList<>(Arrays.asList(positional));
        String keywords = PythonArguments.render(node.variables(), excludedParams);
        if (!keywords.isEmpty()) {
            parts.add(keywords);
        }
        return callableName + "(" + String.join(", ", parts) + ")";
    }

    public String printableLabel() {
        return PythonArguments.fstringSafe(label);
    }
}
