package com.portfolioscanner.common.extraction;

import com.portfolioscanner.common.model.ConfidenceTier;
import com.portfolioscanner.common.model.SymbolCandidate;
import com.portfolioscanner.common.model.SymbolCount;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds ticker-like symbols in free text.
 *
 * <h3>Extraction rules (applied in order)</h3>
 * <ol>
 *   <li><strong>Dictionary scan</strong>: every alias of every company (declared order)
 *       found as a substring of the upper-cased text yields a candidate; {@code HIGH}
 *       when the alias is longer than 3 characters, {@code MEDIUM} otherwise.</li>
 *   <li><strong>Surface patterns</strong>: {@code \b[A-Z]{2,6}\b} and
 *       {@code \b[A-Z]{1,2}[0-9]{1,4}\b}. Tokens not already found become {@code LOW}
 *       candidates with company {@code "Unknown"} if {@link #isPlausibleSymbol} accepts them.</li>
 *   <li>First occurrence of a symbol wins; the result is stable-sorted HIGH, MEDIUM, LOW.</li>
 * </ol>
 *
 * <p>Stateless after construction and safe for concurrent use.
 */
public final class SymbolExtractor {

    private static final List<Pattern> SURFACE_PATTERNS = List.of(
        Pattern.compile("\\b[A-Z]{2,6}\\b"),
        Pattern.compile("\\b[A-Z]{1,2}[0-9]{1,4}\\b")
    );

    private static final Pattern SYMBOL_CHARSET = Pattern.compile("^[A-Z0-9.\\-]+$");

    private static final int MIN_SYMBOL_LENGTH = 2;
    private static final int MAX_SYMBOL_LENGTH = 10;
    private static final int MIN_LETTER_ONLY_LENGTH = 4;
    private static final int HIGH_ALIAS_LENGTH = 3;

    private final SymbolDictionary dictionary;
    private final StopwordList stopwords;

    public SymbolExtractor(SymbolDictionary dictionary, StopwordList stopwords) {
        this.dictionary = dictionary;
        this.stopwords = stopwords;
    }

    /** Extractor over the bundled dictionary and stopword list. */
    public static SymbolExtractor withDefaults() {
        return new SymbolExtractor(SymbolDictionary.loadDefault(), StopwordList.loadDefault());
    }

    public List<SymbolCandidate> extract(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        String upper = text.toUpperCase(Locale.ROOT);
        Map<String, SymbolCandidate> found = new LinkedHashMap<>();

        // ── dictionary aliases ─────────────────────────────────────
        for (CompanyRecord company : dictionary.companies()) {
            for (String alias : company.aliases()) {
                if (upper.contains(alias)) {
                    ConfidenceTier tier = alias.length() > HIGH_ALIAS_LENGTH
                            ? ConfidenceTier.HIGH : ConfidenceTier.MEDIUM;
                    found.putIfAbsent(alias, new SymbolCandidate(alias, company.name(), tier));
                }
            }
        }

        // ── surface patterns ───────────────────────────────────────
        for (Pattern pattern : SURFACE_PATTERNS) {
            Matcher matcher = pattern.matcher(upper);
            while (matcher.find()) {
                String token = matcher.group();
                if (!found.containsKey(token) && isPlausibleSymbol(token)) {
                    found.put(token, SymbolCandidate.pattern(token));
                }
            }
        }

        List<SymbolCandidate> candidates = new ArrayList<>(found.values());
        candidates.sort(Comparator.comparing(SymbolCandidate::confidence));
        return List.copyOf(candidates);
    }

    /**
     * Candidates per article index. Articles without any candidate are left out.
     */
    public Map<Integer, List<SymbolCandidate>> extractFromArticles(List<String> articles) {
        Map<Integer, List<SymbolCandidate>> byArticle = new LinkedHashMap<>();
        if (articles == null) return byArticle;
        for (int i = 0; i < articles.size(); i++) {
            List<SymbolCandidate> candidates = extract(articles.get(i));
            if (!candidates.isEmpty()) {
                byArticle.put(i, candidates);
            }
        }
        return byArticle;
    }

    /**
     * Number of articles each symbol was extracted from, highest first.
     * Equal counts keep first-seen order.
     */
    public Map<String, Integer> symbolFrequency(List<String> articles) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        if (articles == null) return counts;
        for (String article : articles) {
            for (SymbolCandidate candidate : extract(article)) {
                counts.merge(candidate.symbol(), 1, Integer::sum);
            }
        }
        List<Map.Entry<String, Integer>> entries = new ArrayList<>(counts.entrySet());
        entries.sort(Map.Entry.<String, Integer>comparingByValue().reversed());
        Map<String, Integer> sorted = new LinkedHashMap<>();
        for (Map.Entry<String, Integer> entry : entries) {
            sorted.put(entry.getKey(), entry.getValue());
        }
        return sorted;
    }

    public List<SymbolCount> topSymbols(List<String> articles, int limit) {
        return toCounts(symbolFrequency(articles), limit);
    }

    public static List<SymbolCount> toCounts(Map<String, Integer> frequency, int limit) {
        return frequency.entrySet().stream()
                .limit(Math.max(0, limit))
                .map(e -> new SymbolCount(e.getKey(), e.getValue()))
                .toList();
    }

    public String companyFor(String symbol) {
        return dictionary.companyFor(symbol);
    }

    // ── predicates ─────────────────────────────────────────────────

    /**
     * Accepts a pattern match as a plausible ticker: 2 to 10 characters from
     * {@code [A-Z0-9.-]}, at least one letter, not a stopword, and either containing
     * a digit or at least 4 characters long.
     */
    boolean isPlausibleSymbol(String token) {
        if (token.length() < MIN_SYMBOL_LENGTH || token.length() > MAX_SYMBOL_LENGTH) return false;
        boolean hasLetter = token.chars().anyMatch(Character::isLetter);
        boolean hasDigit = token.chars().anyMatch(Character::isDigit);
        if (!hasLetter) return false;
        if (!SYMBOL_CHARSET.matcher(token).matches()) return false;
        if (stopwords.contains(token)) return false;
        return hasDigit || token.length() >= MIN_LETTER_ONLY_LENGTH;
    }
}
