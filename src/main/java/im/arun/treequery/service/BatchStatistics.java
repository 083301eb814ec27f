package im.arun.treequery.service;

import im.arun.treequery.model.Sentence;
import lombok.Value;

import java.util.List;

/**
 * Parse statistics over a batch of sentences.
 */
@Value
public class BatchStatistics {
    int sentences;
    int parsed;
    int tokens;
    long combinations;
    double ambiguity;

    /**
     * Aggregates the given sentences. The ambiguity factor is the token-weighted mean of
     * {@code combinations^(1/tokens)} over parsed sentences, or 1.0 if none parsed.
     */
    public static BatchStatistics of(List<Sentence> batch) {
        int parsed = 0;
        int tokens = 0;
        long combinations = 0;
        double weighted = 0.0;
        int parsedTokens = 0;
        for (Sentence sentence : batch) {
            tokens += sentence.tokenCount();
            if (!sentence.isParsed()) {
                continue;
            }
            parsed++;
            combinations += sentence.getCombinations();
            int length = sentence.tokenCount();
            if (length > 0) {
                weighted += Math.pow(sentence.getCombinations(), 1.0 / length) * length;
                parsedTokens += length;
            }
        }
        double ambiguity = parsedTokens == 0 ? 1.0 : weighted / parsedTokens;
        return new BatchStatistics(batch.size(), parsed, tokens, combinations, ambiguity);
    }

    public double parsedRatio() {
        return sentences == 0 ? 0.0 : (double) parsed / sentences;
    }
}
