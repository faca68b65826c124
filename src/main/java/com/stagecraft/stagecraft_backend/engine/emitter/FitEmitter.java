package com.stagecraft.stagecraft_backend.engine.emitter;

import com.stagecraft.stagecraft_backend.model.workflow.NodeRole;
import org.springframework.stereotype.Component;

/**
 * Stage 3: {@code model = fn(X, y_encoded, ...)}.
 *
 * Trains on the split when one was made, otherwise on everything. Object-typed labels
 * are label-encoded first and the encoder is kept in {@code le} for evaluation.
 * A failed fit leaves {@code model = None}; evaluation nodes skip themselves then.
 */
@Component
public class FitEmitter implements InvocationEmitter {

    @Override
    public NodeRole supportedRole() {
        return NodeRole.FIT;
    }

    @Override
    public void emit(InvocationContext ctx, StringBuilder out) {
        out.append("""
                    print(f"  [%d/%d] Training: %s")
                """.formatted(ctx.index(), ctx.total(), ctx.printableLabel()));
        out.append("""
                    if y is not None or y_train is not None:
                        try:
                            # Prepare data for training
                            if split_performed and X_train is not None:
                                X_for_training = X_train.values if isinstance(X_train, pd.DataFrame) else X_train
                                y_for_training = y_train
                                print(f"    ℹ Using training split: {len(X_for_training)} samples")
                            else:
                                X_for_training = current_data.values if isinstance(current_data, pd.DataFrame) else current_data
                                y_for_training = y
                                print(f"    ℹ Using all data: {len(X_for_training)} samples")

                            # Encode labels if needed
                            if hasattr(y_for_training, 'dtype') and y_for_training.dtype == 'object':
                                from sklearn.preprocessing import LabelEncoder
                                le = LabelEncoder()
                                y_encoded = le.fit_transform(y_for_training)
                                print(f"    ✓ Encoded {len(le.classes_)} classes: {list(le.classes_)}")
                            else:
                                y_encoded = y_for_training.values if hasattr(y_for_training, 'values') else y_for_training

                            # Train model
                """);
        out.append("            model = ").append(ctx.call("X_for_training", "y_encoded")).append('\n');
        out.append("""
                            print(f"    ✓ Model trained successfully")
                        except Exception as e:
                            print(f"    ⚠ Training failed: {e}")
                            import traceback
                            traceback.print_exc()
                            model = None
                    else:
                        print(f"    ⚠ No target column, skipping training")
                        model = None

                """);
    }
}
