package com.stagecraft.stagecraft_backend.controller;

import com.stagecraft.stagecraft_backend.model.domain.Component;
import com.stagecraft.stagecraft_backend.model.domain.ComponentTypes;
import com.stagecraft.stagecraft_backend.service.ComponentService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/stages")
@RequiredArgsConstructor
public class StageController {

    private final ComponentService componentService;

    // GET /api/v1/stages/stage2/components
    @GetMapping("/{stage}/components")
    public Map<String, Object> getByStage(@PathVariable String stage) {
        if (!ComponentTypes.STAGES.contains(stage)) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST,
                    "Invalid stage. Must be stage1, stage2, stage3, or stage4");
        }
        List<Component> components = componentService.findByStage(stage);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("stage", stage);
        body.put("count", components.size());
        body.put("components", components);
        return body;
    }
}
