package com.portfolioscanner.common.insight;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.portfolioscanner.common.exception.LexiconLoadException;
import com.portfolioscanner.common.extraction.LexiconResources;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Ordered {@code (key, sector)} pairs. The first key contained in the upper-cased
 * symbol decides the sector, so {@code TATASTEEL} resolves through {@code TATA}
 * and {@code HDFCBANK} through {@code HDFC}.
 */
public final class SectorTable {

    private static final Logger log = LoggerFactory.getLogger(SectorTable.class);

    public static final String DEFAULT_RESOURCE = "lexicon/sectors.json";
    public static final String UNKNOWN_SECTOR = "Unknown";

    private final List<SectorEntry> entries;

    private SectorTable(String source, List<SectorEntry> raw) {
        if (raw == null || raw.isEmpty()) {
            throw new LexiconLoadException(source, "no sectors declared");
        }
        List<SectorEntry> normalised = new ArrayList<>(raw.size());
        for (SectorEntry entry : raw) {
            if (entry == null || isBlank(entry.key()) || isBlank(entry.sector())) {
                throw new LexiconLoadException(source, "sector entry with blank key or sector");
            }
            normalised.add(new SectorEntry(entry.key().trim().toUpperCase(Locale.ROOT), entry.sector().trim()));
        }
        this.entries = List.copyOf(normalised);
    }

    public static SectorTable loadDefault() {
        return fromResource(DEFAULT_RESOURCE);
    }

    public static SectorTable fromResource(String resource) {
        SectorFile file = LexiconResources.readJson(resource, SectorFile.class);
        SectorTable table = new SectorTable(resource, file.sectors());
        log.info("LEXICON_LOADED resource={} sectors={}", resource, table.entries.size());
        return table;
    }

    public static SectorTable of(List<SectorEntry> entries) {
        return new SectorTable("inline", entries);
    }

    public String sectorFor(String symbol) {
        if (symbol == null) return UNKNOWN_SECTOR;
        String upper = symbol.toUpperCase(Locale.ROOT);
        for (SectorEntry entry : entries) {
            if (upper.contains(entry.key())) return entry.sector();
        }
        return UNKNOWN_SECTOR;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    public record SectorEntry(@JsonProperty("key") String key, @JsonProperty("sector") String sector) {}

    record SectorFile(@JsonProperty("sectors") List<SectorEntry> sectors) {}
}
