package com.portfolioscanner.common.extraction;

import com.portfolioscanner.common.exception.LexiconLoadException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Upper-case words that look like tickers but are ordinary vocabulary
 * ({@code THE}, {@code CEO}, {@code NIFTY}...). Consulted only for pattern matches.
 */
public final class StopwordList {

    private static final Logger log = LoggerFactory.getLogger(StopwordList.class);

    public static final String DEFAULT_RESOURCE = "lexicon/stopwords.txt";

    private final Set<String> words;

    private StopwordList(String source, Collection<String> words) {
        if (words == null || words.isEmpty()) {
            throw new LexiconLoadException(source, "stopword list is empty");
        }
        Set<String> upper = new LinkedHashSet<>();
        for (String word : words) {
            upper.add(word.trim().toUpperCase(Locale.ROOT));
        }
        this.words = Set.copyOf(upper);
    }

    public static StopwordList loadDefault() {
        return fromResource(DEFAULT_RESOURCE);
    }

    public static StopwordList fromResource(String resource) {
        StopwordList list = new StopwordList(resource, LexiconResources.readLines(resource));
        log.info("LEXICON_LOADED resource={} stopwords={}", resource, list.words.size());
        return list;
    }

    public static StopwordList of(Collection<String> words) {
        return new StopwordList("inline", words);
    }

    public boolean contains(String token) {
        return token != null && words.contains(token.toUpperCase(Locale.ROOT));
    }

    public int size() {
        return words.size();
    }
}
