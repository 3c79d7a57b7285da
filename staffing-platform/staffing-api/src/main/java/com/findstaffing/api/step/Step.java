package com.findstaffing.api.step;

import com.findstaffing.api.error.ErrorKind;

import java.util.Objects;

/**
 * One side effect in an ordered admin operation.
 *
 * Critical steps name the error kind and message reported when they fail and may
 * carry a compensation that undoes earlier work (for example removing an object
 * that was stored before the status row could be written).
 */
public final class Step {

    @FunctionalInterface
    public interface Action {
        void run() throws Exception;
    }

    private final String name;
    private final Criticality criticality;
    private final Action action;
    private final ErrorKind failureKind;
    private final String failureMessage;
    private final Action compensation;

    private Step(String name, Criticality criticality, Action action,
                 ErrorKind failureKind, String failureMessage, Action compensation) {
        this.name = Objects.requireNonNull(name, "name");
        this.criticality = criticality;
        this.action = Objects.requireNonNull(action, "action");
        this.failureKind = failureKind;
        this.failureMessage = failureMessage;
        this.compensation = compensation;
    }

    public static Step critical(String name, ErrorKind failureKind, String failureMessage, Action action) {
        return new Step(name, Criticality.CRITICAL, action, failureKind, failureMessage, null);
    }

    public static Step bestEffort(String name, Action action) {
        return new Step(name, Criticality.BEST_EFFORT, action, null, null, null);
    }

    /**
     * Returns a copy that runs {@code compensation} (best-effort) when this step fails.
     */
    public Step compensatedBy(Action compensation) {
        if (criticality != Criticality.CRITICAL) {
            throw new IllegalStateException("Only critical steps can be compensated: " + name);
        }
        return new Step(name, criticality, action, failureKind, failureMessage, compensation);
    }

    public String name() { return name; }
    public Criticality criticality() { return criticality; }
    Action action() { return action; }
    ErrorKind failureKind() { return failureKind; }
    String failureMessage() { return failureMessage; }
    Action compensation() { return compensation; }
}
