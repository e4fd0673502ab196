package com.circuitinsight.core.profiler;

/**
 * Raw profiler output for one circuit, one text per cost domain.
 *
 * <p>Any of the three texts may be null when the profiler did not produce that domain.
 *
 * @param constrainedText constrained (ACIR) opcode flamegraph or log
 * @param unconstrainedText unconstrained (Brillig) opcode flamegraph or log
 * @param gatesText backend gate flamegraph or log
 * @param sourceCode source text of the profiled file
 * @param fileName name of the profiled file, null for the configured default
 */
public record ProfilerOutput(
    String constrainedText,
    String unconstrainedText,
    String gatesText,
    String sourceCode,
    String fileName
) {
    /**
     * Checks whether the profiler produced any text at all.
     *
     * @return true if every domain text is null or blank
     */
    public boolean hasNoProfileData() {
        return isBlank(constrainedText) && isBlank(unconstrainedText) && isBlank(gatesText);
    }

    public boolean hasSourceCode() {
        return !isBlank(sourceCode);
    }

    private static boolean isBlank(String text) {
        return text == null || text.isBlank();
    }
}
