package com.stagecraft.stagecraft_backend.model.workflow;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Set;

/**
 * How a node's callable is invoked inside its stage.
 * When a node carries no role, one is inferred from the callable name.
 */
public enum NodeRole {
    TRANSFORM(1, 2),        // result = fn(current_data, ...)
    ROW_FILTER(1, 2),       // transform, then re-align y with the surviving rows
    SPLIT(1, 2),            // X_train, X_test, y_train, y_test = fn(df, target_column, ...)
    FIT(3),                 // model = fn(X, y, ...)
    CROSS_VALIDATION(4),    // cv_results = fn(model, X, y, ...)
    METRICS(4);             // metrics = fn(y_true, y_pred, y_pred_proba, ...)

    private final Set<Integer> stages;

    NodeRole(Integer... stages) {
        this.stages = Set.of(stages);
    }

    public boolean allowedIn(int stage) {
        return stages.contains(stage);
    }

    /** Case-insensitive; blank means "infer from the name". */
    @JsonCreator
    public static NodeRole fromJson(String value) {
        if (value == null || value.isBlank()) return null;
        return NodeRole.valueOf(value.trim().toUpperCase().replace('-', '_'));
    }
}
