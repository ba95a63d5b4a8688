package com.cadence.exception;

import java.util.List;

/**
 * Thrown when a workflow graph fails validation. Carries every problem found,
 * not just the first.
 */
public class InvalidWorkflowException extends RuntimeException {

    private final List<String> problems;

    public InvalidWorkflowException(List<String> problems) {
        super("Invalid workflow definition: " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    public List<String> getProblems() {
        return problems;
    }
}
