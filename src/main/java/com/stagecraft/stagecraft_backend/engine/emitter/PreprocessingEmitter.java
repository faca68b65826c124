package com.stagecraft.stagecraft_backend.engine.emitter;

/**
 * Stage 1 and 2 nodes. Each call is wrapped so a failing component is reported and
 * skipped while the pipeline carries on with the data it had before.
 */
public abstract class PreprocessingEmitter implements InvocationEmitter {

    @Override
    public final void emit(InvocationContext ctx, StringBuilder out) {
        out.append("""
                    print(f"  [%d/%d] Executing: %s")
                    try:
                """.formatted(ctx.index(), ctx.total(), ctx.printableLabel()));
        emitCall(ctx, out);
        out.append("""
                        print(f"    ✓ Completed")
                    except Exception as e:
                        print(f"    ⚠ Error: {e}")
                        print(f"    Skipping component...")

                """);
    }

    // Statements inside the try block, indented by 8
    protected abstract void emitCall(InvocationContext ctx, StringBuilder out);
}
