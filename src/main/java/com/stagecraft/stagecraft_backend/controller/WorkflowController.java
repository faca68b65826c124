package com.stagecraft.stagecraft_backend.controller;

import com.stagecraft.stagecraft_backend.engine.SandboxRunner;
import com.stagecraft.stagecraft_backend.engine.ScriptGenerationException;
import com.stagecraft.stagecraft_backend.model.dto.GenerateScriptRequest;
import com.stagecraft.stagecraft_backend.model.dto.RunRequest;
import com.stagecraft.stagecraft_backend.model.workflow.WorkflowManifest;
import com.stagecraft.stagecraft_backend.service.ComponentNotFoundException;
import com.stagecraft.stagecraft_backend.service.WorkflowService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/v1/workflow")
@RequiredArgsConstructor
public class WorkflowController {

    static final String EXPORT_FILE_NAME = "pipeline.py";

    private final WorkflowService workflowService;

    /**
     * Body: { "workflow": { "version": "1.0", "nodes": [...] }, "code": "def scale(df): ..." }
     * Returns the generated script as JSON: { "script": "...", "total_components": n }
     */
    @PostMapping("/generate-script")
    public ResponseEntity<Map<String, Object>> generateScript(@RequestBody GenerateScriptRequest request) {
        if (request.workflow() == null) {
            return ResponseEntity.badRequest().body(Map.of("error", "workflow is required"));
        }
        try {
            String script = workflowService.generateScript(request.workflow(), request.code());
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("script", script);
            body.put("total_components", request.workflow().nodes().size());
            return ResponseEntity.ok(body);
        } catch (ScriptGenerationException ex) {
            return ResponseEntity.badRequest().body(Map.of("error", ex.getMessage()));
        }
    }

    /**
     * Body: a workflow whose node ids are stored component ids.
     * Returns the script as a downloadable pipeline.py.
     */
    @PostMapping("/export")
    public ResponseEntity<?> export(@RequestBody WorkflowManifest manifest) {
        try {
            String script = workflowService.exportScript(manifest);
            return ResponseEntity.ok()
                    .contentType(new MediaType("text", "x-python", StandardCharsets.UTF_8))
                    .header(HttpHeaders.CONTENT_DISPOSITION,
                            ContentDisposition.attachment().filename(EXPORT_FILE_NAME).build().toString())
                    .body(script);
        } catch (ScriptGenerationException | IllegalArgumentException ex) {
            return ResponseEntity.badRequest().body(Map.of("error", ex.getMessage()));
        } catch (ComponentNotFoundException ex) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", ex.getMessage()));
        }
    }

    /**
     * Body: { "items": [ { "type": "id", "value": "<uuid>" }, { "type": "code", "value": "print(1)" } ] }
     * Always 200 once the code ran; a failed run carries execution.error.
     */
    @PostMapping("/run")
    public ResponseEntity<Map<String, Object>> run(@RequestBody RunRequest request) {
        WorkflowService.RunOutcome outcome;
        try {
            outcome = workflowService.run(request.items());
        } catch (IllegalArgumentException ex) {
            return ResponseEntity.badRequest().body(Map.of("error", ex.getMessage()));
        } catch (ComponentNotFoundException ex) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", ex.getMessage()));
        }

        SandboxRunner.SandboxResult result = outcome.execution();
        Map<String, Object> execution = new LinkedHashMap<>();
        execution.put("output", result.output());
        if (!result.success()) {
            execution.put("error", result.error());
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("message", result.success() ? "Code executed successfully" : "Code execution failed");
        body.put("total_items", outcome.totalItems());
        body.put("concatenated_code", outcome.concatenatedCode());
        body.put("components", outcome.components());
        body.put("execution", execution);
        return ResponseEntity.ok(body);
    }
}
