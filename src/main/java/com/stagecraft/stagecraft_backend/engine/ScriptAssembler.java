package com.stagecraft.stagecraft_backend.engine;

import com.stagecraft.stagecraft_backend.model.workflow.PipelineNode;
import com.stagecraft.stagecraft_backend.model.workflow.WorkflowManifest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;

/**
 * Builds the standalone Python pipeline script for a workflow.
 *
 * Layout of the generated file:
 *   1. Header docstring (timestamp, version, component count) and imports
 *   2. Component code, verbatim
 *   3. execute_pipeline(): load CSV, split X/y, then one block per non-empty stage 1..4
 *   4. Validation check (model trained without a split)
 *   5. Output saving (features, plus the test split next to it)
 *   6. CLI entry point: --data, --target, --output, --skip-split-warning
 *
 * Exit codes of the generated script: 2 input file missing, 3 column missing, 1 anything else.
 * Same manifest and code always give the same script, apart from the timestamp.
 */
@Slf4j
@Service
public class ScriptAssembler {

    private final StagePartitioner      partitioner;
    private final InvocationSynthesizer synthesizer;
    private final DefinitionInspector   definitionInspector;
    private final Clock                 clock;

    public ScriptAssembler(StagePartitioner partitioner,
                           InvocationSynthesizer synthesizer,
                           DefinitionInspector definitionInspector,
                           Clock clock) {
        this.partitioner = partitioner;
        this.synthesizer = synthesizer;
        this.definitionInspector = definitionInspector;
        this.clock = clock;
    }

    // ── Public API ────────────────────────────────────────────────────────────

    public String assemble(WorkflowManifest manifest, String componentCode) {
        if (manifest == null || manifest.nodes().isEmpty()) {
            throw new ScriptGenerationException("Workflow has no nodes. Add at least one component before generating a script.");
        }
        List<PipelineNode> nodes = manifest.nodes();

        // Resolves every callable up front so a bad node fails before any text is built
        List<String> callableNames = nodes.stream().map(CallableNames::resolve).toList();
        definitionInspector.check(callableNames, componentCode);

        Map<Integer, List<PipelineNode>> stages = partitioner.partition(nodes);

        StringBuilder sb = new StringBuilder();
        sb.append(header(manifest, componentCode != null ? componentCode : ""));

        for (int stage = StagePartitioner.FIRST_STAGE; stage <= StagePartitioner.LAST_STAGE; stage++) {
            List<PipelineNode> stageNodes = stages.get(stage);
            if (stageNodes.isEmpty()) continue;

            sb.append(stageBanner(stage));
            for (int i = 0; i < stageNodes.size(); i++) {
                sb.append(synthesizer.synthesize(stageNodes.get(i), i + 1, stageNodes.size(), stage));
            }
        }

        sb.append(VALIDATION_CHECK);
        sb.append(FOOTER);

        log.info("Generated pipeline script: version={}, components={}, length={}",
                manifest.version(), nodes.size(), sb.length());
        return sb.toString();
    }

    // ── Sections ──────────────────────────────────────────────────────────────

    private String header(WorkflowManifest manifest, String componentCode) {
        String generatedAt = OffsetDateTime.now(clock)
                .truncatedTo(ChronoUnit.SECONDS)
                .format(DateTimeFormatter.ISO_OFFSET_DATE_TIME);
        String version = manifest.version() != null ? docstringSafe(manifest.version()) : "";

        return """
                #!/usr/bin/env python3
                \"""
                Auto-generated Pipeline Script
                Generated at: %s
                Version: %s
                Total Components: %d
                \"""

                import os
                import sys
                import argparse
                import warnings

                import numpy as np
                import pandas as pd

                warnings.filterwarnings('ignore', category=FutureWarning)

                # ============================================================
                # COMPONENT FUNCTIONS
                # ============================================================

                """.formatted(generatedAt, version, manifest.nodes().size())
                + componentCode
                + """


                # ============================================================
                # PIPELINE EXECUTION
                # ============================================================

                def execute_pipeline(data_file, target_column='target', output_file='output.csv', skip_split_warning=False):
                    \"""Execute the complete pipeline\"""

                    print("=" * 60)
                    print("PIPELINE EXECUTION")
                    print("=" * 60)

                    # Load data
                    print(f"\\n[LOADING DATA]")
                    df = pd.read_csv(data_file)
                    print(f"✓ Loaded {len(df)} samples")
                    print(f"✓ Columns: {list(df.columns)}")

                    # Separate features and target
                    if target_column in df.columns:
                        X = df.drop(columns=[target_column])
                        y = df[target_column]
                        print(f"✓ Target column: {target_column}")
                    else:
                        X = df
                        y = None
                        print(f"⚠ No target column found, processing features only")

                    # Initialize pipeline variables
                    current_data = X
                    model = None
                    le = None
                    X_train, X_test, y_train, y_test = None, None, None, None
                    split_performed = False

                """;
    }

    private static String stageBanner(int stage) {
        return """
                    # ============================================================
                    # STAGE %d
                    # ============================================================
                    print(f"\\n[STAGE %d]")

                """.formatted(stage, stage);
    }

    private static final String VALIDATION_CHECK = """
                # ============================================================
                # VALIDATION CHECK
                # ============================================================
                if model is not None and not split_performed and not skip_split_warning:
                    print(f"\\n⚠ WARNING: Model was trained but no train/test split was performed!")
                    print(f"  Metrics shown are from training data and may be overly optimistic.")
                    print(f"  Consider adding a train/test split component to Stage 1.")

            """;

    private static final String FOOTER = """
                # ============================================================
                # SAVE OUTPUT
                # ============================================================
                print(f"\\n[SAVING OUTPUT]")

                # Save processed features
                if isinstance(current_data, pd.DataFrame):
                    current_data.to_csv(output_file, index=False)
                    print(f"✓ Processed features saved to: {output_file}")
                else:
                    print(f"⚠ Could not save output (unsupported data type)")

                # Save test set if available
                if X_test is not None:
                    root, ext = os.path.splitext(output_file)
                    test_file = f"{root}_test{ext}"
                    if isinstance(X_test, pd.DataFrame):
                        X_test.to_csv(test_file, index=False)
                        print(f"✓ Test features saved to: {test_file}")

                print(f"\\n{'=' * 60}")
                print("PIPELINE COMPLETED")
                print(f"{'=' * 60}")

                return {
                    'data': current_data,
                    'model': model,
                    'label_encoder': le,
                    'X_train': X_train,
                    'X_test': X_test,
                    'y_train': y_train,
                    'y_test': y_test,
                    'split_performed': split_performed
                }

            # ============================================================
            # MAIN ENTRY POINT
            # ============================================================

            EXIT_FILE_NOT_FOUND = 2
            EXIT_MISSING_COLUMN = 3
            EXIT_FAILURE = 1

            if __name__ == "__main__":
                parser = argparse.ArgumentParser(description='Execute ML pipeline')
                parser.add_argument('--data', required=True, help='Input CSV file')
                parser.add_argument('--target', default='target', help='Target column name (default: target)')
                parser.add_argument('--output', default='output.csv', help='Output file (default: output.csv)')
                parser.add_argument('--skip-split-warning', action='store_true', help='Skip train/test split warning')

                args = parser.parse_args()

                try:
                    result = execute_pipeline(args.data, args.target, args.output, args.skip_split_warning)
                    print(f"\\n✓ Pipeline executed successfully!")

                    if result['model'] is not None:
                        print(f"✓ Model trained and ready to use")

                    if result['split_performed']:
                        print(f"✓ Train/test split performed")
                        if result['X_test'] is not None:
                            print(f"  - Training samples: {len(result['X_train'])}")
                            print(f"  - Test samples: {len(result['X_test'])}")

                except FileNotFoundError as e:
                    print(f"\\n❌ Error: File not found - {e}")
                    print(f"Make sure the file '{args.data}' exists")
                    sys.exit(EXIT_FILE_NOT_FOUND)
                except KeyError as e:
                    print(f"\\n❌ Error: Column not found - {e}")
                    print(f"Make sure the target column '{args.target}' exists in your CSV")
                    sys.exit(EXIT_MISSING_COLUMN)
                except Exception as e:
                    print(f"\\n❌ Error: {e}")
                    import traceback
                    traceback.print_exc()
                    sys.exit(EXIT_FAILURE)
            """;

    // ── Helpers ───────────────────────────────────────────────────────────────

    /** Keeps an echoed value from closing the header docstring. */
    private static String docstringSafe(String text) {
        return text.replace("\\", "\\\\").replace("\"\"\"", "\\\"\\\"\\\"");
    }
}
