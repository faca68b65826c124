package com.stagecraft.stagecraft_backend.service;

import com.stagecraft.stagecraft_backend.engine.SandboxRunner;
import com.stagecraft.stagecraft_backend.engine.ScriptAssembler;
import com.stagecraft.stagecraft_backend.engine.StagePartitioner;
import com.stagecraft.stagecraft_backend.model.domain.Component;
import com.stagecraft.stagecraft_backend.model.dto.WorkflowItem;
import com.stagecraft.stagecraft_backend.model.workflow.PipelineNode;
import com.stagecraft.stagecraft_backend.model.workflow.WorkflowManifest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Workflow operations on top of the script generator and the sandbox:
 * generate from supplied code, export from stored components, run concatenated code.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WorkflowService {

    static final String BLOCK_SEPARATOR = "\n\n";

    private final ScriptAssembler  scriptAssembler;
    private final ComponentService componentService;
    private final SandboxRunner    sandboxRunner;

    public String generateScript(WorkflowManifest manifest, String componentCode) {
        return scriptAssembler.assemble(manifest, componentCode);
    }

    /**
     * Generates a script for nodes whose ids reference stored components.
     * Each component's code is included once, in first-use order. A node without a name
     * takes the component's name; a node without a usable stage takes the component's stage.
     */
    public String exportScript(WorkflowManifest manifest) {
        Map<UUID, Component> components = new LinkedHashMap<>();
        List<PipelineNode> resolved = new ArrayList<>();

        for (PipelineNode node : manifest.nodes()) {
            UUID id = parseId(node.id(), "Invalid component id: " + node.id());
            Component component = components.computeIfAbsent(id, componentService::getById);

            PipelineNode effective = node;
            if (effective.name() == null || effective.name().isBlank()) {
                effective = effective.withName(component.getName());
            }
            if (StagePartitioner.effectiveStage(effective.stage()) != effective.stage() && component.isValidStage()) {
                effective = effective.withStage(component.getStageNumber());
            }
            resolved.add(effective);
        }

        String code = components.values().stream()
                .map(Component::getCode)
                .collect(Collectors.joining(BLOCK_SEPARATOR));

        return scriptAssembler.assemble(
                new WorkflowManifest(manifest.version(), manifest.exportedAt(), resolved), code);
    }

    /**
     * Concatenates stored component code and raw code in request order and runs the
     * result in the sandbox. Sandbox failures are reported in the outcome, not thrown.
     */
    public RunOutcome run(List<WorkflowItem> items) {
        if (items.isEmpty()) {
            throw new IllegalArgumentException("At least one item is required");
        }

        List<String> codeBlocks = new ArrayList<>();
        List<Map<String, Object>> details = new ArrayList<>();

        for (int i = 0; i < items.size(); i++) {
            WorkflowItem item = items.get(i);
            String type = item.type() != null ? item.type() : "";
            Map<String, Object> detail = new LinkedHashMap<>();
            detail.put("index", i);

            switch (type) {
                case WorkflowItem.TYPE_ID -> {
                    UUID id = parseId(item.value(), "Invalid ID format at index " + i + ": " + item.value());
                    Component component = componentService.getById(id);
                    codeBlocks.add(component.getCode());
                    detail.put("type", "component");
                    detail.put("id", component.getId().toString());
                    detail.put("name", component.getName());
                    detail.put("description", component.getDescription());
                    detail.put("stage", component.getStage());
                    detail.put("language", component.getLanguage());
                    detail.put("inputs", component.getInputs());
                    detail.put("output", component.getOutput());
                }
                case WorkflowItem.TYPE_CODE -> {
                    String code = item.value() != null ? item.value() : "";
                    codeBlocks.add(code);
                    detail.put("type", "raw_code");
                    detail.put("code", code);
                }
                default -> throw new IllegalArgumentException(
                        "Unknown item type at index " + i + ": '" + type + "'. Use 'id' or 'code'.");
            }
            details.add(detail);
        }

        String concatenated = String.join(BLOCK_SEPARATOR, codeBlocks);
        log.debug("Concatenated code for run ({} items):\n{}", items.size(), concatenated);

        SandboxRunner.SandboxResult result = sandboxRunner.run(concatenated);
        if (!result.success()) {
            log.warn("Workflow run failed: {}", result.error());
        }
        return new RunOutcome(items.size(), concatenated, details, result);
    }

    private static UUID parseId(String value, String errorMessage) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(errorMessage);
        }
        try {
            return UUID.fromString(value.trim());
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException(errorMessage, ex);
        }
    }

    public record RunOutcome(
            int totalItems,
            String concatenatedCode,
            List<Map<String, Object>> components,
            SandboxRunner.SandboxResult execution
    ) {}
}
