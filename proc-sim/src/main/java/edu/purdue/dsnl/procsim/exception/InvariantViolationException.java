package edu.purdue.dsnl.procsim.exception;

/**
 * Thrown when a scheduling invariant breaks, e.g. a request is terminated twice or an event
 * is scheduled in the past. Indicates a bug, not bad input.
 */
public class InvariantViolationException extends SimulationException {

    public InvariantViolationException(String message) {
        super(message);
    }
}
