package com.stagecraft.stagecraft_backend.engine.emitter;

import com.stagecraft.stagecraft_backend.model.workflow.NodeRole;
import org.springframework.stereotype.Component;

import java.util.Set;

/**
 * Train/test split. The label column goes in positionally, so a {@code target_column}
 * variable is dropped from the keywords. Downstream stages read X_train/X_test/y_train/y_test.
 */
@Component
public class SplitEmitter extends PreprocessingEmitter {

    static final String TARGET_COLUMN_PARAM = "target_column";

    @Override
    public NodeRole supportedRole() {
        return NodeRole.SPLIT;
    }

    @Override
    protected void emitCall(InvocationContext ctx, StringBuilder out) {
        String call = ctx.call(Set.of(TARGET_COLUMN_PARAM), "df", "target_column");
        out.append("""
                        if y is not None:
                            X_train, X_test, y_train, y_test = %s
                            current_data = X_train
                            split_performed = True
                            print(f"    ✓ Split into train ({len(X_train)}) and test ({len(X_test)}) sets")
                        else:
                            print(f"    ⚠ No target column, skipping train/test split")
                """.formatted(call));
    }
}
