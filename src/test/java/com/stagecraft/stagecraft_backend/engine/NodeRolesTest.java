package com.stagecraft.stagecraft_backend.engine;

import com.stagecraft.stagecraft_backend.model.workflow.NodeRole;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static com.stagecraft.stagecraft_backend.engine.PipelineFixtures.node;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NodeRolesTest {

    @Nested
    @DisplayName("inferred from the callable name")
    class Inferred {

        @Test
        void preprocessingKeywords() {
            assertThat(NodeRoles.infer("train_test_split", 1)).isEqualTo(NodeRole.SPLIT);
            assertThat(NodeRoles.infer("stratified_sample", 2)).isEqualTo(NodeRole.SPLIT);
            assertThat(NodeRoles.infer("remove_outliers", 1)).isEqualTo(NodeRole.ROW_FILTER);
            assertThat(NodeRoles.infer("drop_nulls", 2)).isEqualTo(NodeRole.ROW_FILTER);
            assertThat(NodeRoles.infer("standard_scale", 1)).isEqualTo(NodeRole.TRANSFORM);
        }

        @Test
        void splitKeywordBeatsFilterKeyword() {
            assertThat(NodeRoles.infer("filter_and_split", 1)).isEqualTo(NodeRole.SPLIT);
        }

        @Test
        void everyStageThreeNodeFits() {
            assertThat(NodeRoles.infer("train_test_split", 3)).isEqualTo(NodeRole.FIT);
            assertThat(NodeRoles.infer("random_forest", 3)).isEqualTo(NodeRole.FIT);
        }

        @Test
        void stageFourChoosesBetweenCrossValidationAndMetrics() {
            assertThat(NodeRoles.infer("kfold_validate", 4)).isEqualTo(NodeRole.CROSS_VALIDATION);
            assertThat(NodeRoles.infer("Cross_Validate", 4)).isEqualTo(NodeRole.CROSS_VALIDATION);
            assertThat(NodeRoles.infer("score_cv", 4)).isEqualTo(NodeRole.CROSS_VALIDATION);
            assertThat(NodeRoles.infer("classification_metrics", 4)).isEqualTo(NodeRole.METRICS);
        }
    }

    @Nested
    @DisplayName("declared on the node")
    class Declared {

        @Test
        void explicitRoleOverridesName() {
            assertThat(NodeRoles.resolve(node("train_test_split", 2, NodeRole.TRANSFORM), "train_test_split", 2))
                    .isEqualTo(NodeRole.TRANSFORM);
            assertThat(NodeRoles.resolve(node("prune", 1, NodeRole.ROW_FILTER), "prune", 1))
                    .isEqualTo(NodeRole.ROW_FILTER);
        }

        @Test
        void roleOutsideItsStagesFails() {
            assertThatThrownBy(() -> NodeRoles.resolve(node("fit_model", 1, NodeRole.FIT), "fit_model", 1))
                    .isInstanceOf(ScriptGenerationException.class)
                    .hasMessageContaining("stage 1");
            assertThatThrownBy(() -> NodeRoles.resolve(node("scale", 4, NodeRole.TRANSFORM), "scale", 4))
                    .isInstanceOf(ScriptGenerationException.class);
        }
    }
}
