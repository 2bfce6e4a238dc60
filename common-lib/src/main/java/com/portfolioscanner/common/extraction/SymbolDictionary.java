package com.portfolioscanner.common.extraction;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.portfolioscanner.common.exception.LexiconLoadException;
import com.portfolioscanner.common.model.SymbolCandidate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Immutable company/alias table.
 *
 * <p>Companies and their aliases keep their declared order, which is the order the
 * extractor scans them in. Aliases are normalised to upper case at load time.
 * When two companies share an alias, the reverse lookup resolves to the first one.
 */
public final class SymbolDictionary {

    private static final Logger log = LoggerFactory.getLogger(SymbolDictionary.class);

    public static final String DEFAULT_RESOURCE = "lexicon/companies.json";

    private final List<CompanyRecord> companies;
    private final Map<String, String> aliasToCompany;

    private SymbolDictionary(String source, List<CompanyRecord> raw) {
        if (raw == null || raw.isEmpty()) {
            throw new LexiconLoadException(source, "no companies declared");
        }
        List<CompanyRecord> normalised = new ArrayList<>(raw.size());
        Map<String, String> reverse = new LinkedHashMap<>();
        for (CompanyRecord company : raw) {
            if (company == null || company.name() == null || company.name().isBlank()) {
                throw new LexiconLoadException(source, "company with blank name");
            }
            if (company.aliases() == null || company.aliases().isEmpty()) {
                throw new LexiconLoadException(source, "company '" + company.name() + "' has no aliases");
            }
            List<String> aliases = new ArrayList<>(company.aliases().size());
            for (String alias : company.aliases()) {
                if (alias == null || alias.isBlank()) {
                    throw new LexiconLoadException(source, "company '" + company.name() + "' has a blank alias");
                }
                String upper = alias.trim().toUpperCase(Locale.ROOT);
                aliases.add(upper);
                reverse.putIfAbsent(upper, company.name());
            }
            normalised.add(new CompanyRecord(company.name(), List.copyOf(aliases)));
        }
        this.companies = List.copyOf(normalised);
        this.aliasToCompany = Collections.unmodifiableMap(reverse);
    }

    /** Loads the bundled {@value #DEFAULT_RESOURCE}. */
    public static SymbolDictionary loadDefault() {
        return fromResource(DEFAULT_RESOURCE);
    }

    public static SymbolDictionary fromResource(String resource) {
        CompanyFile file = LexiconResources.readJson(resource, CompanyFile.class);
        SymbolDictionary dictionary = new SymbolDictionary(resource, file.companies());
        log.info("LEXICON_LOADED resource={} companies={} aliases={}",
                resource, dictionary.companies.size(), dictionary.aliasToCompany.size());
        return dictionary;
    }

    public static SymbolDictionary of(List<CompanyRecord> companies) {
        return new SymbolDictionary("inline", companies);
    }

    public List<CompanyRecord> companies() {
        return companies;
    }

    public boolean isKnownAlias(String symbol) {
        return symbol != null && aliasToCompany.containsKey(symbol.toUpperCase(Locale.ROOT));
    }

    /** Canonical company for an alias, or {@code "Unknown"}. */
    public String companyFor(String symbol) {
        if (symbol == null) return SymbolCandidate.UNKNOWN_COMPANY;
        return aliasToCompany.getOrDefault(symbol.toUpperCase(Locale.ROOT), SymbolCandidate.UNKNOWN_COMPANY);
    }

    record CompanyFile(@JsonProperty("companies") List<CompanyRecord> companies) {}
}
