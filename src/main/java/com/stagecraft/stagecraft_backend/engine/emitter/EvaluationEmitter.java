package com.stagecraft.stagecraft_backend.engine.emitter;

/**
 * Stage 4 nodes. They run only when a model exists and labels are known; any failure
 * is printed with its traceback and the script moves on.
 */
public abstract class EvaluationEmitter implements InvocationEmitter {

    @Override
    public final void emit(InvocationContext ctx, StringBuilder out) {
        out.append("""
                    print(f"  [%d/%d] Evaluating: %s")
                    if model is not None and (y is not None or y_train is not None):
                        try:
                """.formatted(ctx.index(), ctx.total(), ctx.printableLabel()));
        emitBody(ctx, out);
        out.append("""
                        except Exception as e:
                            print(f"    ⚠ %s failed: {e}")
                            import traceback
                            traceback.print_exc()
                    else:
                        print(f"    ⚠ No model or target, skipping %s")

                """.formatted(activity(), activity().toLowerCase()));
    }

    // Statements inside the try block, indented by 12
    protected abstract void emitBody(InvocationContext ctx, StringBuilder out);

    /** "Cross-validation", "Evaluation": used in failure and skip messages. */
    protected abstract String activity();

    /**
     * Leaves the encoded labels of {@code labels} in {@code y_encoded}, reusing the encoder
     * fitted during training when there is one.
     */
    protected static String encodeLabels(String labels) {
        return """
                            # Encode labels if needed
                            if hasattr(%1$s, 'dtype') and %1$s.dtype == 'object':
                                if le is None:
                                    from sklearn.preprocessing import LabelEncoder
                                    le = LabelEncoder()
                                    y_encoded = le.fit_transform(%1$s)
                                else:
                                    y_encoded = le.transform(%1$s)
                            else:
                                y_encoded = %1$s.values if hasattr(%1$s, 'values') else %1$s

                """.formatted(labels);
    }
}
