package com.stagecraft.stagecraft_backend.engine.emitter;

import com.stagecraft.stagecraft_backend.model.workflow.NodeRole;
import org.springframework.stereotype.Component;

/**
 * {@code cv_results = fn(model, X, y_encoded, ...)}. A dict result may carry
 * mean/std test and train scores and the per-fold {@code test_scores}.
 */
@Component
public class CrossValidationEmitter extends EvaluationEmitter {

    @Override
    public NodeRole supportedRole() {
        return NodeRole.CROSS_VALIDATION;
    }

    @Override
    protected String activity() {
        return "Cross-validation";
    }

    @Override
    protected void emitBody(InvocationContext ctx, StringBuilder out) {
        out.append("""
                            # Prepare data for CV
                            if split_performed and X_train is not None:
                                X_for_cv = X_train.values if isinstance(X_train, pd.DataFrame) else X_train
                                y_for_cv = y_train
                            else:
                                X_for_cv = current_data.values if isinstance(current_data, pd.DataFrame) else current_data
                                y_for_cv = y

                """);
        out.append(encodeLabels("y_for_cv"));
        out.append("            # Perform cross-validation\n");
        out.append("            cv_results = ").append(ctx.call("model", "X_for_cv", "y_encoded")).append('\n');
        out.append("""

                            # Print CV results
                            if isinstance(cv_results, dict):
                                print(f"\\n    Cross-Validation Results:")
                                if 'mean_test_score' in cv_results:
                                    print(f"      Mean Test Score: {cv_results['mean_test_score']:.4f} (+/- {cv_results.get('std_test_score', 0):.4f})")
                                if 'mean_train_score' in cv_results:
                                    print(f"      Mean Train Score: {cv_results['mean_train_score']:.4f} (+/- {cv_results.get('std_train_score', 0):.4f})")
                                if 'test_scores' in cv_results:
                                    print(f"      Individual Fold Scores: {[f'{score:.4f}' for score in cv_results['test_scores']]}")

                            print(f"    ✓ Cross-validation completed")
                """);
    }
}
