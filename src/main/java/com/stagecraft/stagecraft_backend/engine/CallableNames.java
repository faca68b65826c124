package com.stagecraft.stagecraft_backend.engine;

import com.stagecraft.stagecraft_backend.model.workflow.PipelineNode;

import java.util.Set;
import java.util.regex.Pattern;

/**
 * Resolves the Python function a node invokes and the label printed for it.
 */
public final class CallableNames {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    // Hard keywords of Python 3; soft keywords (match, case, type, _) are legal names
    private static final Set<String> PYTHON_KEYWORDS = Set.of(
            "False", "None", "True", "and", "as", "assert", "async", "await", "break", "class",
            "continue", "def", "del", "elif", "else", "except", "finally", "for", "from", "global",
            "if", "import", "in", "is", "lambda", "nonlocal", "not", "or", "pass", "raise",
            "return", "try", "while", "with", "yield");

    private CallableNames() {}

    /** Explicit {@code code} wins; otherwise "Train Test Split" becomes "train_test_split". */
    public static String resolve(PipelineNode node) {
        String name = isBlank(node.code()) ? slugify(node.name()) : node.code().trim();
        if (name.isEmpty()) {
            throw new ScriptGenerationException(
                    "Node '" + node.id() + "' has neither a code identifier nor a name; cannot derive a function to call.");
        }
        if (!isIdentifier(name)) {
            throw new ScriptGenerationException(
                    "Node '" + label(node) + "' resolves to '" + name + "', which is not a valid Python function name.");
        }
        return name;
    }

    /** Every variable name becomes a keyword argument, so it must be a usable Python identifier. */
    public static void checkParameterNames(PipelineNode node) {
        for (String param : node.variables().keySet()) {
            if (param == null || !isIdentifier(param)) {
                throw new ScriptGenerationException(
                        "Node '" + label(node) + "' has variable '" + param + "', which is not a valid Python parameter name.");
            }
        }
    }

    public static boolean isIdentifier(String name) {
        return IDENTIFIER.matcher(name).matches() && !PYTHON_KEYWORDS.contains(name);
    }

    public static String slugify(String displayName) {
        if (displayName == null) return "";
        return displayName.trim().toLowerCase().replace(" ", "_");
    }

    /** Human label used in the progress output of the generated script. */
    public static String label(PipelineNode node) {
        if (!isBlank(node.name())) return node.name();
        return node.code() != null ? node.code() : "";
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
