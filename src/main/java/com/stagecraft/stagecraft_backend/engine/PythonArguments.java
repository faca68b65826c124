package com.stagecraft.stagecraft_backend.engine;

import com.stagecraft.stagecraft_backend.model.workflow.BindingValue;

import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Renders node variables as Python keyword arguments: {@code n_estimators=100, mode='auto'}.
 * Parameters are sorted by name so the same node always renders the same way.
 */
public final class PythonArguments {

    private PythonArguments() {}

    public static String render(Map<String, BindingValue> bindings) {
        return render(bindings, Set.of());
    }

    public static String render(Map<String, BindingValue> bindings, Set<String> excluded) {
        return new TreeMap<>(bindings).entrySet().stream()
                .filter(e -> !excluded.contains(e.getKey()))
                .filter(e -> e.getValue() == null || !e.getValue().isOmitted())
                .map(e -> e.getKey() + "=" + (e.getValue() != null ? e.getValue() : BindingValue.none()).toLiteral())
                .collect(Collectors.joining(", "));
    }

    /** Makes text safe inside a double-quoted Python f-string. */
    public static String fstringSafe(String text) {
        return text.replace("\\", "\\\\")
                .replace("\"", "\\\"")
                .replace("{", "{{")
                .replace("}", "}}")
                .replace("\r\n", " ")
                .replace("\r", " ")
                .replace("\n", " ");
    }
}
