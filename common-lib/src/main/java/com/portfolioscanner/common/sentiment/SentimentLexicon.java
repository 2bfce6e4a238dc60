package com.portfolioscanner.common.sentiment;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.portfolioscanner.common.exception.LexiconLoadException;
import com.portfolioscanner.common.extraction.LexiconResources;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Positive/negative single words plus weighted multi-word market phrases.
 *
 * <p>Words are matched against tokens; phrases against the lower-cased text, so a
 * phrase must contain a space or hyphen. Everything is stored lower-case.
 */
public final class SentimentLexicon {

    private static final Logger log = LoggerFactory.getLogger(SentimentLexicon.class);

    public static final String DEFAULT_RESOURCE = "lexicon/sentiment.json";

    private final Set<String> positiveWords;
    private final Set<String> negativeWords;
    private final List<String> positivePhrases;
    private final List<String> negativePhrases;

    public SentimentLexicon(Collection<String> positiveWords, Collection<String> negativeWords,
                            Collection<String> positivePhrases, Collection<String> negativePhrases) {
        this("inline", positiveWords, negativeWords, positivePhrases, negativePhrases);
    }

    private SentimentLexicon(String source,
                             Collection<String> positiveWords, Collection<String> negativeWords,
                             Collection<String> positivePhrases, Collection<String> negativePhrases) {
        this.positiveWords = Set.copyOf(normalise(source, "positiveWords", positiveWords, false));
        this.negativeWords = Set.copyOf(normalise(source, "negativeWords", negativeWords, false));
        this.positivePhrases = List.copyOf(normalise(source, "positivePhrases", positivePhrases, true));
        this.negativePhrases = List.copyOf(normalise(source, "negativePhrases", negativePhrases, true));
    }

    public static SentimentLexicon loadDefault() {
        return fromResource(DEFAULT_RESOURCE);
    }

    public static SentimentLexicon fromResource(String resource) {
        LexiconFile file = LexiconResources.readJson(resource, LexiconFile.class);
        SentimentLexicon lexicon = new SentimentLexicon(resource,
                file.positiveWords(), file.negativeWords(), file.positivePhrases(), file.negativePhrases());
        log.info("LEXICON_LOADED resource={} positiveWords={} negativeWords={} phrases={}",
                resource, lexicon.positiveWords.size(), lexicon.negativeWords.size(),
                lexicon.positivePhrases.size() + lexicon.negativePhrases.size());
        return lexicon;
    }

    public boolean isPositive(String token) { return positiveWords.contains(token); }
    public boolean isNegative(String token) { return negativeWords.contains(token); }
    public List<String> positivePhrases()   { return positivePhrases; }
    public List<String> negativePhrases()   { return negativePhrases; }

    private static Set<String> normalise(String source, String field, Collection<String> entries, boolean phrases) {
        if (entries == null) {
            throw new LexiconLoadException(source, field + " is missing");
        }
        Set<String> out = new LinkedHashSet<>();
        for (String entry : entries) {
            if (entry == null || entry.isBlank()) {
                throw new LexiconLoadException(source, field + " contains a blank entry");
            }
            String lower = entry.trim().toLowerCase(Locale.ROOT);
            boolean multiWord = lower.contains(" ") || lower.contains("-");
            if (phrases && !multiWord) {
                throw new LexiconLoadException(source, field + " entry '" + lower + "' is a single word");
            }
            if (!phrases && multiWord) {
                throw new LexiconLoadException(source, field + " entry '" + lower + "' is a phrase");
            }
            out.add(lower);
        }
        return out;
    }

    record LexiconFile(
        @JsonProperty("positiveWords") List<String> positiveWords,
        @JsonProperty("negativeWords") List<String> negativeWords,
        @JsonProperty("positivePhrases") List<String> positivePhrases,
        @JsonProperty("negativePhrases") List<String> negativePhrases
    ) {}
}
