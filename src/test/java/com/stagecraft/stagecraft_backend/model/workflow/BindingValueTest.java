package com.stagecraft.stagecraft_backend.model.workflow;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BindingValueTest {

    @Nested
    @DisplayName("Python literals")
    class Literals {

        @Test
        void plainTextIsQuoted() {
            assertThat(BindingValue.of("auto").toLiteral()).isEqualTo("'auto'");
        }

        @Test
        void numericTextIsLeftBare() {
            assertThat(BindingValue.of("42").toLiteral()).isEqualTo("42");
            assertThat(BindingValue.of("-0.5").toLiteral()).isEqualTo("-0.5");
            assertThat(BindingValue.of("1e-3").toLiteral()).isEqualTo("1e-3");
        }

        @Test
        void infAndNanTextStayQuoted() {
            assertThat(BindingValue.of("inf").toLiteral()).isEqualTo("'inf'");
            assertThat(BindingValue.of("nan").toLiteral()).isEqualTo("'nan'");
        }

        @Test
        void pythonKeywordsAreLeftBare() {
            assertThat(BindingValue.of("None").toLiteral()).isEqualTo("None");
            assertThat(BindingValue.of("True").toLiteral()).isEqualTo("True");
            assertThat(BindingValue.of("False").toLiteral()).isEqualTo("False");
        }

        @Test
        void preformattedCollectionsAreLeftBare() {
            assertThat(BindingValue.of("(1, 2)").toLiteral()).isEqualTo("(1, 2)");
            assertThat(BindingValue.of("['a']").toLiteral()).isEqualTo("['a']");
            assertThat(BindingValue.of("{'k': 1}").toLiteral()).isEqualTo("{'k': 1}");
        }

        @Test
        void quotesAndBackslashesAreEscaped() {
            assertThat(BindingValue.of("it's").toLiteral()).isEqualTo("'it\\'s'");
            assertThat(BindingValue.of("a\\b").toLiteral()).isEqualTo("'a\\\\b'");
            assertThat(BindingValue.of("line1\nline2").toLiteral()).isEqualTo("'line1\\nline2'");
        }

        @Test
        void emptyTextIsOmitted() {
            assertThat(BindingValue.of("").isOmitted()).isTrue();
            assertThat(BindingValue.of("x").isOmitted()).isFalse();
        }

        @Test
        void integralNumbersRenderWithoutFraction() {
            assertThat(BindingValue.of(100).toLiteral()).isEqualTo("100");
            assertThat(BindingValue.of(-3.0).toLiteral()).isEqualTo("-3");
        }

        @Test
        void fractionalNumbersRenderWithSixDecimals() {
            assertThat(BindingValue.of(0.25).toLiteral()).isEqualTo("0.250000");
        }

        @Test
        void smallOrPreciseNumbersKeepTheirValue() {
            assertThat(BindingValue.of(1e-7).toLiteral()).isEqualTo("0.00000010");
            assertThat(BindingValue.of(0.1234567).toLiteral()).isEqualTo("0.1234567");
            assertThat(BindingValue.of(-2.5e-9).toLiteral()).isEqualTo("-0.0000000025");
        }

        @Test
        void nonFiniteNumbersUseFloatConstructor() {
            assertThat(BindingValue.of(Double.NaN).toLiteral()).isEqualTo("float('nan')");
            assertThat(BindingValue.of(Double.POSITIVE_INFINITY).toLiteral()).isEqualTo("float('inf')");
            assertThat(BindingValue.of(Double.NEGATIVE_INFINITY).toLiteral()).isEqualTo("float('-inf')");
        }

        @Test
        void booleansRenderCapitalised() {
            assertThat(BindingValue.of(true).toLiteral()).isEqualTo("True");
            assertThat(BindingValue.of(false).toLiteral()).isEqualTo("False");
        }

        @Test
        void nullRendersNone() {
            assertThat(BindingValue.none().toLiteral()).isEqualTo("None");
            assertThat(BindingValue.none().isOmitted()).isFalse();
        }

        @Test
        @DisplayName("sequence elements: text always quoted, others as their own literal")
        void sequenceElements() {
            BindingValue seq = BindingValue.of(List.of(
                    BindingValue.of("age"),
                    BindingValue.of("10"),
                    BindingValue.of(3),
                    BindingValue.of(true),
                    BindingValue.none(),
                    BindingValue.of(List.of(BindingValue.of("x")))));

            assertThat(seq.toLiteral()).isEqualTo("['age', '10', 3, True, None, ['x']]");
        }

        @Test
        void emptySequence() {
            assertThat(BindingValue.of(List.<BindingValue>of()).toLiteral()).isEqualTo("[]");
        }
    }

    @Nested
    @DisplayName("JSON mapping")
    class Json {

        private final ObjectMapper mapper = new ObjectMapper();

        @Test
        void readsEveryVariantFromANodeVariablesMap() throws Exception {
            PipelineNode node = mapper.readValue("""
                    {
                      "id": "n1", "name": "Scale", "stage": 1,
                      "variables": {
                        "n": 100, "ratio": 0.5, "mode": "auto", "flag": true,
                        "cols": ["a", 1], "missing": null
                      }
                    }
                    """, PipelineNode.class);

            assertThat(node.variables().get("n")).isEqualTo(BindingValue.of(100));
            assertThat(node.variables().get("ratio")).isEqualTo(BindingValue.of(0.5));
            assertThat(node.variables().get("mode")).isEqualTo(BindingValue.of("auto"));
            assertThat(node.variables().get("flag")).isEqualTo(BindingValue.of(true));
            assertThat(node.variables().get("cols").toLiteral()).isEqualTo("['a', 1]");
            assertThat(node.variables().get("missing")).isSameAs(BindingValue.none());
        }

        @Test
        void rejectsObjects() {
            assertThatThrownBy(() -> mapper.readValue("""
                    { "id": "n1", "stage": 1, "variables": { "cfg": { "a": 1 } } }
                    """, PipelineNode.class))
                    .isInstanceOf(JsonProcessingException.class)
                    .hasMessageContaining("Unsupported variable value");
        }

        @Test
        void readsManifestWithExportedAtAndRole() throws Exception {
            WorkflowManifest manifest = mapper.readValue("""
                    {
                      "version": "1.0",
                      "exported_at": "2024-05-01T10:00:00Z",
                      "nodes": [ { "id": "n1", "name": "Drop Rows", "stage": 2, "role": "row-filter" } ]
                    }
                    """, WorkflowManifest.class);

            assertThat(manifest.exportedAt()).isEqualTo("2024-05-01T10:00:00Z");
            assertThat(manifest.nodes()).singleElement()
                    .satisfies(n -> assertThat(n.role()).isEqualTo(NodeRole.ROW_FILTER));
        }

        @Test
        void missingCollectionsReadAsEmpty() throws Exception {
            WorkflowManifest manifest = mapper.readValue("{\"version\": \"1.0\"}", WorkflowManifest.class);
            assertThat(manifest.nodes()).isEmpty();

            PipelineNode node = mapper.readValue("{\"id\": \"n1\", \"stage\": 3}", PipelineNode.class);
            assertThat(node.variables()).isEmpty();
            assertThat(node.inputs()).isEmpty();
            assertThat(node.output()).isEmpty();
        }
    }

    @Test
    void roleStageCompatibility() {
        assertThat(Arrays.stream(NodeRole.values()).filter(r -> r.allowedIn(3)))
                .containsExactly(NodeRole.FIT);
        assertThat(Arrays.stream(NodeRole.values()).filter(r -> r.allowedIn(4)))
                .containsExactly(NodeRole.CROSS_VALIDATION, NodeRole.METRICS);
        assertThat(NodeRole.SPLIT.allowedIn(2)).isTrue();
        assertThat(NodeRole.fromJson(" ")).isNull();
        assertThat(NodeRole.fromJson("Cross_Validation")).isEqualTo(NodeRole.CROSS_VALIDATION);
    }
}
