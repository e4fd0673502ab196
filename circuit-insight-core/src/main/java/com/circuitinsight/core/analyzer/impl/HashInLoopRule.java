package com.circuitinsight.core.analyzer.impl;

import com.circuitinsight.core.analyzer.AbstractAnalyzerRule;
import com.circuitinsight.core.analyzer.AnalysisContext;
import com.circuitinsight.core.model.LineMetric;
import com.circuitinsight.core.model.Severity;
import com.circuitinsight.core.model.Suggestion;
import com.circuitinsight.core.model.SuggestionCategory;

import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Flags hash function calls that sit inside a loop body.
 *
 * <p>A hash call is "inside a loop" when a loop declaration appears within the configured number
 * of lines above it.
 */
public class HashInLoopRule extends AbstractAnalyzerRule {

    public static final String RULE_ID = "hash-operations";

    static final String LEARN_MORE_URL =
        "https://noir-lang.org/docs/noir/standard_library/cryptographic_primitives";

    private static final Pattern HASH_CALL =
        Pattern.compile("(poseidon|pedersen|keccak|blake2s|sha256|mimc)", Pattern.CASE_INSENSITIVE);

    @Override
    public String getId() {
        return RULE_ID;
    }

    @Override
    public String getDisplayName() {
        return "Hash Operations";
    }

    @Override
    public int getPriority() {
        return 50;
    }

    @Override
    public List<Suggestion> analyze(AnalysisContext context) {
        List<Suggestion> suggestions = suggestions();
        int lookback = context.settings().hashLoopLookback();
        double factor = context.savings().hashInLoop();
        long fallback = context.savings().hashInLoopFallback();

        forEachCodeLine(context, (lineNumber, line) -> {
            if (!HASH_CALL.matcher(line).find()
                || !hasMatchWithin(context, lineNumber, lookback, LOOP_DECLARATION)) {
                return;
            }
            Optional<LineMetric> hotspot = context.hotspot(lineNumber);
            suggestions.add(Suggestion.builder("hash-in-loop-" + lineNumber, lineNumber)
                .severity(Severity.HIGH)
                .category(SuggestionCategory.ALGORITHM)
                .title("Hash function inside loop")
                .description("Hash function called inside loop - move hash calls outside loop "
                    + "or batch with Merkle tree structure")
                .impact(scaledSavings(hotspot, factor, fallback), scaledPercent(hotspot, factor))
                .codeSnippet(snippet(context, lineNumber))
                .learnMoreUrl(LEARN_MORE_URL)
                .build());
        });
        return suggestions;
    }
}
