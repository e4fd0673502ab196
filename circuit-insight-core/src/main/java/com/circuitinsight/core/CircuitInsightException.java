package com.circuitinsight.core;

/**
 * Thrown when a caller violates the engine's input contract, for example by supplying neither
 * source code nor any profiler output.
 */
public class CircuitInsightException extends RuntimeException {

    public CircuitInsightException(String message) {
        super(message);
    }

    public CircuitInsightException(String message, Throwable cause) {
        super(message, cause);
    }
}
