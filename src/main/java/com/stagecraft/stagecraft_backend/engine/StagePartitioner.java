package com.stagecraft.stagecraft_backend.engine;

import com.stagecraft.stagecraft_backend.model.workflow.PipelineNode;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Groups workflow nodes into the four fixed stage buckets.
 * All four keys are always present; stages outside 1..4 fall into bucket 1.
 */
@Component
public class StagePartitioner {

    public static final int FIRST_STAGE = 1;
    public static final int LAST_STAGE  = 4;

    public Map<Integer, List<PipelineNode>> partition(List<PipelineNode> nodes) {
        Map<Integer, List<PipelineNode>> stages = new LinkedHashMap<>();
        for (int stage = FIRST_STAGE; stage <= LAST_STAGE; stage++) {
            stages.put(stage, new ArrayList<>());
        }
        for (PipelineNode node : nodes) {
            stages.get(effectiveStage(node.stage())).add(node);
        }
        return stages;
    }

    public static int effectiveStage(int stage) {
        return stage >= FIRST_STAGE && stage <= LAST_STAGE ? stage : FIRST_STAGE;
    }
}
