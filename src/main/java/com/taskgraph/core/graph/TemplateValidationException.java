package com.taskgraph.core.graph;

import java.util.List;

/**
 * Thrown when a task graph template is structurally invalid.
 */
public class TemplateValidationException extends RuntimeException {

    private final List<String> problems;

    public TemplateValidationException(String templateName, List<String> problems) {
        super("Template '" + templateName + "' is invalid: " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    public List<String> problems() {
        return problems;
    }
}
