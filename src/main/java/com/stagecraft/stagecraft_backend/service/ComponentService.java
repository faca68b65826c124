package com.stagecraft.stagecraft_backend.service;

import com.stagecraft.stagecraft_backend.model.domain.Component;
import com.stagecraft.stagecraft_backend.model.domain.ComponentInput;
import com.stagecraft.stagecraft_backend.model.domain.ComponentTypes;
import com.stagecraft.stagecraft_backend.repository.ComponentRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Predicate;

/**
 * Component library: CRUD plus the lookups the script generator needs
 * (fetch by id, fetch all by stage).
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ComponentService {

    private final ComponentRepository componentRepository;

    // ── Queries ───────────────────────────────────────────────────────────────

    public List<Component> list(ComponentFilter filter) {
        Predicate<Component> matches = c -> true;

        if (notBlank(filter.stage())) {
            matches = matches.and(c -> filter.stage().equals(c.getStage()));
        }
        if (notBlank(filter.language())) {
            matches = matches.and(c -> filter.language().equals(c.getLanguage()));
        }
        if (notBlank(filter.outputType())) {
            matches = matches.and(c -> c.getOutput() != null && filter.outputType().equals(c.getOutput().getType()));
        }
        if ("true".equals(filter.hasOutput())) {
            matches = matches.and(Component::hasOutput);
        } else if ("false".equals(filter.hasOutput())) {
            matches = matches.and(c -> !c.hasOutput());
        } else if (notBlank(filter.hasOutput())) {
            log.warn("Ignoring has_output filter value '{}'; expected true or false", filter.hasOutput());
        }

        return componentRepository.findAllByOrderByCreatedAtDesc().stream()
                .filter(matches)
                .toList();
    }

    public Optional<Component> findById(UUID id) {
        return componentRepository.findById(id);
    }

    public Component getById(UUID id) {
        return componentRepository.findById(id)
                .orElseThrow(() -> new ComponentNotFoundException(id));
    }

    public List<Component> findByStage(String stage) {
        return componentRepository.findByStage(stage);
    }

    public List<Component> searchByName(String name) {
        return componentRepository.findByNameContainingIgnoreCase(name.trim());
    }

    public List<Component> findByInputType(String inputType) {
        return componentRepository.findAll().stream()
                .filter(c -> c.getInputs() != null
                        && c.getInputs().stream().anyMatch(i -> inputType.equals(i.type())))
                .toList();
    }

    public List<Component> findByOutputType(String outputType) {
        return componentRepository.findByOutputType(outputType);
    }

    /** Component count per stage, only for stages that have components, in stage order. */
    public List<Map<String, Object>> stageStats() {
        List<Map<String, Object>> stats = new ArrayList<>();
        for (String stage : sorted(ComponentTypes.STAGES)) {
            long count = componentRepository.countByStage(stage);
            if (count == 0) continue;
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("stage", stage);
            entry.put("count", count);
            stats.add(entry);
        }
        return stats;
    }

    // ── Commands ──────────────────────────────────────────────────────────────

    /** Returns the validation error, or null when the component may be saved. */
    public String validate(Component component) {
        if (component.getName() == null || component.getName().isBlank()) {
            return "Name is required";
        }
        if (component.getCode() == null || component.getCode().isBlank()) {
            return "Code is required";
        }
        if (component.getLanguage() == null || component.getLanguage().isBlank()) {
            return "Language is required";
        }
        if (!component.isValidStage()) {
            return "Invalid stage. Must be stage1, stage2, stage3, or stage4";
        }
        if (component.getInputs() == null || component.getInputs().isEmpty()) {
            return "Component must have at least one input";
        }
        for (ComponentInput input : component.getInputs()) {
            if (input == null || !ComponentTypes.INPUT_TYPES.contains(input.type())) {
                String type = input != null ? input.type() : null;
                log.debug("Rejected component '{}': invalid input type {}", component.getName(), type);
                return "Invalid input type '" + type + "'. Must be one of " + sorted(ComponentTypes.INPUT_TYPES);
            }
        }
        if (component.getOutput() != null && !ComponentTypes.OUTPUT_TYPES.contains(component.getOutput().getType())) {
            return "Invalid output type '" + component.getOutput().getType() + "'. Must be one of " + sorted(ComponentTypes.OUTPUT_TYPES);
        }
        return null;
    }

    @Transactional
    public Component create(Component component) {
        component.setId(null);
        component.setCreatedAt(Instant.now());
        component.setUpdatedAt(Instant.now());
        Component saved = componentRepository.save(component);
        log.info("Component created: id={}, name={}, stage={}", saved.getId(), saved.getName(), saved.getStage());
        return saved;
    }

    @Transactional
    public Optional<Component> update(UUID id, Component changes) {
        return componentRepository.findById(id)
                .map(existing -> {
                    existing.setName(changes.getName());
                    existing.setDescription(changes.getDescription());
                    existing.setCode(changes.getCode());
                    existing.setLanguage(changes.getLanguage());
                    existing.setStage(changes.getStage());
                    existing.setTags(changes.getTags());
                    existing.setInputs(changes.getInputs());
                    existing.setOutput(changes.getOutput());
                    existing.setUpdatedAt(Instant.now());
                    return componentRepository.save(existing);
                });
    }

    @Transactional
    public boolean delete(UUID id) {
        if (!componentRepository.existsById(id)) {
            return false;
        }
        componentRepository.deleteById(id);
        log.info("Component deleted: id={}", id);
        return true;
    }

    // ── Helpers ───────────────────────────────────────────────────────────────

    private static boolean notBlank(String s) {
        return s != null && !s.isBlank();
    }

    private static List<String> sorted(Set<String> values) {
        return values.stream().sorted().toList();
    }
}
