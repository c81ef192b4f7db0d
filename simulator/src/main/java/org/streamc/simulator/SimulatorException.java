package org.streamc.simulator;

/** Raised when a simulated program performs an operation with undefined behavior,
 * or one the simulator does not support. */
public class SimulatorException extends RuntimeException {
    public SimulatorException(String message) {
        super(message);
    }
}
