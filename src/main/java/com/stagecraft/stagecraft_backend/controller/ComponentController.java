package com.stagecraft.stagecraft_backend.controller;

import com.stagecraft.stagecraft_backend.model.domain.Component;
import com.stagecraft.stagecraft_backend.service.ComponentFilter;
import com.stagecraft.stagecraft_backend.service.ComponentService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1/components")
@RequiredArgsConstructor
public class ComponentController {

    private final ComponentService componentService;

    // GET /api/v1/components?stage=stage1&language=python&output_type=DataFrame&has_output=true
    @GetMapping
    public Map<String, Object> getAll(@RequestParam(required = false) String stage,
                                      @RequestParam(required = false) String language,
                                      @RequestParam(name = "output_type", required = false) String outputType,
                                      @RequestParam(name = "has_output", required = false) String hasOutput) {
        List<Component> components = componentService.list(new ComponentFilter(stage, language, outputType, hasOutput));
        return countAndComponents(components);
    }

    @GetMapping("/{id}")
    public ResponseEntity<Component> getById(@PathVariable UUID id) {
        return componentService.findById(id)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @PostMapping
    public ResponseEntity<Map<String, Object>> create(@RequestBody Component component) {
        String error = componentService.validate(component);
        if (error != null) {
            return ResponseEntity.badRequest().body(Map.of("error", error));
        }
        Component saved = componentService.create(component);
        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of(
                "message", "Component created successfully",
                "component", saved
        ));
    }

    @PutMapping("/{id}")
    public ResponseEntity<Map<String, Object>> update(@PathVariable UUID id, @RequestBody Component component) {
        String error = componentService.validate(component);
        if (error != null) {
            return ResponseEntity.badRequest().body(Map.of("error", error));
        }
        return componentService.update(id, component)
                .map(saved -> ResponseEntity.ok(Map.<String, Object>of(
                        "message", "Component updated successfully",
                        "id", id.toString()
                )))
                .orElse(ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", "Component not found")));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Map<String, Object>> delete(@PathVariable UUID id) {
        if (!componentService.delete(id)) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", "Component not found"));
        }
        return ResponseEntity.ok(Map.of(
                "message", "Component deleted successfully",
                "id", id.toString()
        ));
    }

    // GET /api/v1/components/search?name=scal (case-insensitive substring match)
    @GetMapping("/search")
    public ResponseEntity<Map<String, Object>> searchByName(@RequestParam(required = false) String name) {
        if (name == null || name.isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "Name query parameter is required"));
        }
        return ResponseEntity.ok(countAndComponents(componentService.searchByName(name)));
    }

    @GetMapping("/stats")
    public Map<String, Object> getStageStats() {
        return Map.of("stats", componentService.stageStats());
    }

    @GetMapping("/by-input-type")
    public ResponseEntity<Map<String, Object>> getByInputType(@RequestParam(required = false) String type) {
        if (type == null || type.isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "Type query parameter is required"));
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("input_type", type);
        body.putAll(countAndComponents(componentService.findByInputType(type)));
        return ResponseEntity.ok(body);
    }

    @GetMapping("/by-output-type")
    public ResponseEntity<Map<String, Object>> getByOutputType(@RequestParam(required = false) String type) {
        if (type == null || type.isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "Type query parameter is required"));
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("output_type", type);
        body.putAll(countAndComponents(componentService.findByOutputType(type)));
        return ResponseEntity.ok(body);
    }

    static Map<String, Object> countAndComponents(List<Component> components) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("count", components.size());
        body.put("components", components);
        return body;
    }
}
