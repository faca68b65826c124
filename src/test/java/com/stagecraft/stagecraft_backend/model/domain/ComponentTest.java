package com.stagecraft.stagecraft_backend.model.domain;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ComponentTest {

    @Test
    void stageNumberFollowsStageName() {
        Component c = new Component();
        c.setStage("stage3");
        assertThat(c.isValidStage()).isTrue();
        assertThat(c.getStageNumber()).isEqualTo(3);

        c.setStage("stage9");
        assertThat(c.isValidStage()).isFalse();
        assertThat(c.getStageNumber()).isZero();
    }

    @Test
    void noneOutputCountsAsNoOutput() {
        Component c = new Component();
        assertThat(c.hasOutput()).isFalse();

        c.setOutput(new ComponentOutput("none", "nothing"));
        assertThat(c.hasOutput()).isFalse();

        c.setOutput(new ComponentOutput("DataFrame", "scaled frame"));
        assertThat(c.hasOutput()).isTrue();
    }

    @Test
    void inputsSplitByRequiredFlag() {
        Component c = new Component();
        ComponentInput df = new ComponentInput("df", "DataFrame", null, true, null);
        ComponentInput factor = new ComponentInput("factor", "float", null, false, 1.0);
        c.setInputs(List.of(df, factor));

        assertThat(c.getRequiredInputs()).containsExactly(df);
        assertThat(c.getOptionalInputs()).containsExactly(factor);
    }
}
