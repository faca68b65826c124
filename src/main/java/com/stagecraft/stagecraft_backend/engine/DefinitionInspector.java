package com.stagecraft.stagecraft_backend.engine;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Checks by text search that every function the script calls is defined exactly once
 * in the component code. Component bodies are never parsed or run.
 *
 * Lenient mode logs a warning per problem; strict mode
 * ({@code stagecraft.script.strict-definitions=true}) fails generation instead.
 */
@Slf4j
@Component
public class DefinitionInspector {

    private static final Pattern DEF_PATTERN =
            Pattern.compile("(?m)^[ \\t]*(?:async[ \\t]+)?def[ \\t]+([A-Za-z_][A-Za-z0-9_]*)[ \\t]*\\(");

    private final boolean strict;

    public DefinitionInspector(@Value("${stagecraft.script.strict-definitions:false}") boolean strict) {
        this.strict = strict;
    }

    public Map<String, Integer> countDefinitions(String componentCode) {
        Map<String, Integer> counts = new HashMap<>();
        if (componentCode == null) return counts;
        Matcher matcher = DEF_PATTERN.matcher(componentCode);
        while (matcher.find()) {
            counts.merge(matcher.group(1), 1, Integer::sum);
        }
        return counts;
    }

    /** Returns the problems found; throws instead when strict. */
    public List<String> check(Collection<String> callableNames, String componentCode) {
        Map<String, Integer> counts = countDefinitions(componentCode);
        List<String> problems = new ArrayList<>();
        for (String name : new LinkedHashSet<>(callableNames)) {
            int found = counts.getOrDefault(name, 0);
            if (found == 0) {
                problems.add("Function '" + name + "' is called but not defined in the component code.");
            } else if (found > 1) {
                problems.add("Function '" + name + "' is defined " + found + " times in the component code.");
            }
        }
        if (!problems.isEmpty()) {
            if (strict) {
                throw new ScriptGenerationException(String.join(" ", problems));
            }
            problems.forEach(p -> log.warn("Script definition check: {}", p));
        }
        return problems;
    }
}
