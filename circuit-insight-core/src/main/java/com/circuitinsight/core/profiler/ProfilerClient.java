package com.circuitinsight.core.profiler;

/**
 * External collaborator that compiles and profiles a circuit.
 *
 * <p>Implementations wrap whatever actually runs the profiler (a local tool, a remote
 * service). The engine only consumes the raw text it returns.
 */
@FunctionalInterface
public interface ProfilerClient {

    /**
     * Profiles a circuit.
     *
     * @param sourceCode circuit source text
     * @param manifest project manifest, passed through untouched (may be null)
     * @param fileName name of the source file
     * @return raw profiler output; domain texts may be absent
     * @throws ProfilingException if compilation or profiling fails
     */
    ProfilerOutput profile(String sourceCode, String manifest, String fileName) throws ProfilingException;
}
