package com.stagecraft.stagecraft_backend.engine.emitter;

import com.stagecraft.stagecraft_backend.model.workflow.NodeRole;
import org.springframework.stereotype.Component;

/**
 * A transform that may drop rows. Until a split happens, y is re-indexed to the
 * surviving rows so features and labels stay aligned.
 */
@Component
public class RowFilterEmitter extends TransformEmitter {

    @Override
    public NodeRole supportedRole() {
        return NodeRole.ROW_FILTER;
    }

    @Override
    protected void emitCall(InvocationContext ctx, StringBuilder out) {
        super.emitCall(ctx, out);
        out.append("""

                        # Synchronize target variable if rows were removed
                        if y is not None and not split_performed:
                            if isinstance(current_data, pd.DataFrame) and len(current_data) != len(y):
                                y = y.loc[current_data.index]
                                print(f"    ⚠ Synced target variable: {len(y)} samples remaining")
                """);
    }
}
