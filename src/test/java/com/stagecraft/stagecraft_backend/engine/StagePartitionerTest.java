package com.stagecraft.stagecraft_backend.engine;

import com.stagecraft.stagecraft_backend.model.workflow.PipelineNode;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.stagecraft.stagecraft_backend.engine.PipelineFixtures.node;
import static org.assertj.core.api.Assertions.assertThat;

class StagePartitionerTest {

    private final StagePartitioner partitioner = new StagePartitioner();

    @Test
    void alwaysReturnsAllFourStagesInOrder() {
        Map<Integer, List<PipelineNode>> stages = partitioner.partition(List.of());

        assertThat(stages.keySet()).containsExactly(1, 2, 3, 4);
        assertThat(stages.values()).allSatisfy(list -> assertThat(list).isEmpty());
    }

    @Test
    void keepsInputOrderInsideEachStage() {
        PipelineNode a = node("a", 2);
        PipelineNode b = node("b", 1);
        PipelineNode c = node("c", 2);
        PipelineNode d = node("d", 4);

        Map<Integer, List<PipelineNode>> stages = partitioner.partition(List.of(a, b, c, d));

        assertThat(stages.get(1)).containsExactly(b);
        assertThat(stages.get(2)).containsExactly(a, c);
        assertThat(stages.get(3)).isEmpty();
        assertThat(stages.get(4)).containsExactly(d);
    }

    @Test
    void outOfRangeStagesFallIntoStageOne() {
        PipelineNode zero = node("zero", 0);
        PipelineNode first = node("first", 1);
        PipelineNode seven = node("seven", 7);

        Map<Integer, List<PipelineNode>> stages = partitioner.partition(List.of(zero, first, seven));

        assertThat(stages.get(1)).containsExactly(zero, first, seven);
        assertThat(StagePartitioner.effectiveStage(-1)).isEqualTo(1);
        assertThat(StagePartitioner.effectiveStage(4)).isEqualTo(4);
    }
}
