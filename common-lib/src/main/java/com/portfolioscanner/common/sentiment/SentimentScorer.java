package com.portfolioscanner.common.sentiment;

import com.portfolioscanner.common.model.SentimentClass;
import com.portfolioscanner.common.model.SentimentResult;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lexicon-based sentiment of a single text.
 *
 * <p>Scoring:
 * <ol>
 *   <li>Tokenise the lower-cased text with {@code \b\w+\b}, Unicode-aware so accented
 *       words stay whole.</li>
 *   <li>A token in the positive word set counts +1 positive; otherwise a token in the
 *       negative set counts +1 negative.</li>
 *   <li>Every market phrase present in the text adds {@value #PHRASE_WEIGHT} to its side,
 *       once per phrase regardless of how often it repeats.</li>
 *   <li>The higher {@code count / tokens} ratio wins; equal ratios are neutral with
 *       confidence 0.5.</li>
 *   <li>Reported scores and confidence are the ratios capped at 1.</li>
 * </ol>
 */
public final class SentimentScorer {

    private static final Pattern TOKEN = Pattern.compile("\\b\\w+\\b", Pattern.UNICODE_CHARACTER_CLASS);

    static final int PHRASE_WEIGHT = 2;

    private final SentimentLexicon lexicon;

    public SentimentScorer(SentimentLexicon lexicon) {
        this.lexicon = lexicon;
    }

    public static SentimentScorer withDefaults() {
        return new SentimentScorer(SentimentLexicon.loadDefault());
    }

    public SentimentResult score(String text) {
        if (text == null || text.isEmpty()) {
            return SentimentResult.empty();
        }
        String lower = text.toLowerCase(Locale.ROOT);
        List<String> tokens = tokenize(lower);
        if (tokens.isEmpty()) {
            return SentimentResult.empty();
        }

        int positiveCount = 0;
        int negativeCount = 0;
        for (String token : tokens) {
            if (lexicon.isPositive(token)) {
                positiveCount++;
            } else if (lexicon.isNegative(token)) {
                negativeCount++;
            }
        }
        for (String phrase : lexicon.positivePhrases()) {
            if (lower.contains(phrase)) positiveCount += PHRASE_WEIGHT;
        }
        for (String phrase : lexicon.negativePhrases()) {
            if (lower.contains(phrase)) negativeCount += PHRASE_WEIGHT;
        }

        double positiveRatio = (double) positiveCount / tokens.size();
        double negativeRatio = (double) negativeCount / tokens.size();
        double positiveScore = Math.min(1.0, positiveRatio);
        double negativeScore = Math.min(1.0, negativeRatio);

        // phrase weight can push a ratio past 1; the side is decided before capping
        SentimentClass classification;
        double confidence;
        if (positiveRatio > negativeRatio) {
            classification = SentimentClass.POSITIVE;
            confidence = positiveScore;
        } else if (negativeRatio > positiveRatio) {
            classification = SentimentClass.NEGATIVE;
            confidence = negativeScore;
        } else {
            classification = SentimentClass.NEUTRAL;
            confidence = SentimentResult.NEUTRAL_CONFIDENCE;
        }
        return new SentimentResult(classification, confidence, positiveScore, negativeScore,
                positiveCount, negativeCount);
    }

    static List<String> tokenize(String lower) {
        List<String> tokens = new ArrayList<>();
        Matcher matcher = TOKEN.matcher(lower);
        while (matcher.find()) {
            tokens.add(matcher.group());
        }
        return tokens;
    }
}
