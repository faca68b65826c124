package com.stagecraft.stagecraft_backend.model.workflow;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * One step of an exported workflow.
 *
 * {@code code} is the explicit callable name; when blank the name is derived from
 * {@code name} ("Train Test Split" becomes {@code train_test_split}).
 * Null collections are treated as empty.
 */
public record PipelineNode(
    String id,
    String name,
    int stage,
    String description,
    String code,
    NodeRole role,
    List<NodeInput> inputs,
    Map<String, Object> output,
    Map<String, BindingValue> variables
) {
    public List<NodeInput> inputs() {
        return inputs != null ? inputs : Collections.emptyList();
    }

    public Map<String, Object> output() {
        return output != null ? output : Collections.emptyMap();
    }

    public Map<String, BindingValue> variables() {
        return variables != null ? variables : Collections.emptyMap();
    }

    public PipelineNode withName(String newName) {
        return new PipelineNode(id, newName, stage, description, code, role, inputs, output, variables);
    }

    public PipelineNode withStage(int newStage) {
        return new PipelineNode(id, name, newStage, description, code, role, inputs, output, variables);
    }
}
