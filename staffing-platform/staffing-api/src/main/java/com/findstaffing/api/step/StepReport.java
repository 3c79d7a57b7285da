package com.findstaffing.api.step;

import java.util.List;

/**
 * Outcome of a run that did not abort. Warnings are for logs and tests only;
 * they never reach a response body.
 */
public record StepReport(List<String> completed, List<Warning> warnings) {

    public StepReport {
        completed = List.copyOf(completed);
        warnings = List.copyOf(warnings);
    }

    public boolean succeeded(String stepName) {
        return completed.contains(stepName);
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }

    public record Warning(String step, String message) {}
}
