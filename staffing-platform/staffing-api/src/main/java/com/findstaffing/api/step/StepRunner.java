package com.findstaffing.api.step;

import com.findstaffing.api.error.AdminOperationException;
import com.findstaffing.api.error.ErrorKind;
import com.findstaffing.api.error.StorageException;
import com.findstaffing.api.error.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Executes steps strictly in order.
 *
 * A failing critical step runs its compensation, then aborts the run with the
 * step's error kind. A failing best-effort step is logged at WARN and recorded
 * in the report. Steps after a best-effort failure still run.
 */
@Component
public class StepRunner {

    private static final Logger log = LoggerFactory.getLogger(StepRunner.class);

    public StepReport run(String operation, List<Step> steps) {
        List<String> completed = new ArrayList<>();
        List<StepReport.Warning> warnings = new ArrayList<>();

        for (Step step : steps) {
            try {
                step.action().run();
                completed.add(step.name());
            } catch (Exception e) {
                if (step.criticality() == Criticality.BEST_EFFORT) {
                    log.warn("{}: best-effort step '{}' failed: {}", operation, step.name(), e.getMessage());
                    warnings.add(new StepReport.Warning(step.name(), String.valueOf(e.getMessage())));
                    continue;
                }
                log.error("{}: critical step '{}' failed", operation, step.name(), e);
                compensate(operation, step);
                throw toFailure(step, e);
            }
        }
        return new StepReport(completed, warnings);
    }

    private void compensate(String operation, Step step) {
        if (step.compensation() == null) {
            return;
        }
        try {
            step.compensation().run();
        } catch (Exception e) {
            log.warn("{}: compensation for '{}' failed: {}", operation, step.name(), e.getMessage());
        }
    }

    private AdminOperationException toFailure(Step step, Exception cause) {
        if (cause instanceof AdminOperationException known && known.getKind() != ErrorKind.STORAGE_ERROR
                && known.getKind() != ErrorKind.DATABASE_ERROR) {
            return known;
        }
        String message = step.failureMessage() != null ? step.failureMessage() : step.name() + " failed";
        if (step.failureKind() == ErrorKind.STORAGE_ERROR) {
            return new StorageException(message, cause);
        }
        if (step.failureKind() == ErrorKind.DATABASE_ERROR) {
            return new StoreException(message, cause);
        }
        return new AdminOperationException(step.failureKind(), message, cause);
    }
}
