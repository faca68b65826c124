package com.stagecraft.stagecraft_backend.engine;

import com.stagecraft.stagecraft_backend.model.workflow.NodeRole;
import com.stagecraft.stagecraft_backend.model.workflow.PipelineNode;

import java.util.List;

/**
 * Picks the invocation shape for a node in a given stage.
 *
 * An explicit {@link NodeRole} on the node is used as-is (it must be valid for the
 * stage). Without one, the role is guessed from keywords in the callable name.
 */
public final class NodeRoles {

    private static final List<String> SPLIT_KEYWORDS            = List.of("split", "stratified");
    private static final List<String> ROW_FILTER_KEYWORDS       = List.of("outlier", "remove", "drop", "filter");
    private static final List<String> CROSS_VALIDATION_KEYWORDS = List.of("cross", "kfold", "k_fold", "_cv", "crossval");

    private NodeRoles() {}

    public static NodeRole resolve(PipelineNode node, String callableName, int stage) {
        NodeRole explicit = node.role();
        if (explicit == null) {
            return infer(callableName, stage);
        }
        if (!explicit.allowedIn(stage)) {
            throw new ScriptGenerationException(
                    "Node '" + CallableNames.label(node) + "' has role " + explicit + ", which cannot run in stage " + stage + ".");
        }
        return explicit;
    }

    public static NodeRole infer(String callableName, int stage) {
        String name = callableName.toLowerCase();
        return switch (stage) {
            case 3 -> NodeRole.FIT;
            case 4 -> containsAny(name, CROSS_VALIDATION_KEYWORDS) ? NodeRole.CROSS_VALIDATION : NodeRole.METRICS;
            default -> {
                if (containsAny(name, SPLIT_KEYWORDS)) yield NodeRole.SPLIT;
                if (containsAny(name, ROW_FILTER_KEYWORDS)) yield NodeRole.ROW_FILTER;
                yield NodeRole.TRANSFORM;
            }
        };
    }

    private static boolean containsAny(String name, List<String> keywords) {
        return keywords.stream().anyMatch(name::contains);
    }
}
