package com.stagecraft.stagecraft_backend.engine.emitter;

import com.stagecraft.stagecraft_backend.model.workflow.NodeRole;
import org.springframework.stereotype.Component;

/**
 * {@code metrics = fn(y_encoded, y_pred, y_pred_proba, ...)}.
 *
 * Evaluation data, in order of preference: the test split, the train split (warned),
 * all data (warned). Numeric metrics print with 4 decimals, a confusion matrix row by row.
 */
@Component
public class MetricsEmitter extends EvaluationEmitter {

    @Override
    public NodeRole supportedRole() {
        return NodeRole.METRICS;
    }

    @Override
    protected String activity() {
        return "Evaluation";
    }

    @Override
    protected void emitBody(InvocationContext ctx, StringBuilder out) {
        out.append("""
                            # Determine which data to use for evaluation
                            if split_performed and X_test is not None and y_test is not None:
                                X_eval = X_test.values if isinstance(X_test, pd.DataFrame) else X_test
                                y_for_eval = y_test
                                eval_type = "test"
                                print(f"    ℹ Evaluating on test set: {len(X_eval)} samples")
                            elif split_performed and X_train is not None:
                                X_eval = X_train.values if isinstance(X_train, pd.DataFrame) else X_train
                                y_for_eval = y_train
                                eval_type = "training"
                                print(f"    ⚠ Evaluating on training set: {len(X_eval)} samples")
                            else:
                                X_eval = current_data.values if isinstance(current_data, pd.DataFrame) else current_data
                                y_for_eval = y
                                eval_type = "all data"
                                print(f"    ⚠ Evaluating on all data: {len(X_eval)} samples")

                """);
        out.append(encodeLabels("y_for_eval"));
        out.append("""
                            # Make predictions
                            y_pred = model.predict(X_eval)

                            # Get probabilities if available
                            try:
                                y_pred_proba = model.predict_proba(X_eval)
                            except Exception:
                                y_pred_proba = None

                            # Calculate metrics
                """);
        out.append("            metrics = ").append(ctx.call("y_encoded", "y_pred", "y_pred_proba")).append('\n');
        out.append("""

                            # Print metrics
                            if isinstance(metrics, dict):
                                print(f"\\n    Metrics ({eval_type} set):")
                                for key, value in metrics.items():
                                    if isinstance(value, (int, float)):
                                        print(f"      {key}: {value:.4f}")
                                    elif key == 'confusion_matrix':
                                        print(f"      {key}:")
                                        for row in value:
                                            print(f"        {row}")

                            print(f"    ✓ Evaluation completed")
                """);
    }
}
