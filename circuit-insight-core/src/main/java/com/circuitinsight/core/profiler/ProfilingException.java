package com.circuitinsight.core.profiler;

/**
 * Failure reported by the external compiler or profiler.
 *
 * <p>Propagated to callers so that "profiling failed" can be told apart from "no data yet".
 */
public class ProfilingException extends Exception {

    public ProfilingException(String message) {
        super(message);
    }

    public ProfilingException(String message, Throwable cause) {
        super(message, cause);
    }
}
