package com.portfolioscanner.common.extraction;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.portfolioscanner.common.exception.LexiconLoadException;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Classpath access for the bundled lexicon files under {@code lexicon/}.
 * Every failure surfaces as a {@link LexiconLoadException} naming the resource.
 */
public final class LexiconResources {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private LexiconResources() {}

    public static <T> T readJson(String resource, Class<T> type) {
        try (InputStream in = open(resource)) {
            return MAPPER.readValue(in, type);
        } catch (IOException e) {
            throw new LexiconLoadException(resource, "unreadable: " + e.getMessage(), e);
        }
    }

    /** Non-blank lines, trimmed, skipping {@code #} comments. */
    public static List<String> readLines(String resource) {
        List<String> lines = new ArrayList<>();
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(open(resource), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                String trimmed = line.trim();
                if (!trimmed.isEmpty() && !trimmed.startsWith("#")) {
                    lines.add(trimmed);
                }
            }
        } catch (IOException e) {
            throw new LexiconLoadException(resource, "unreadable: " + e.getMessage(), e);
        }
        return lines;
    }

    private static InputStream open(String resource) {
        InputStream in = LexiconResources.class.getClassLoader().getResourceAsStream(resource);
        if (in == null) {
            throw new LexiconLoadException(resource, "resource not found on classpath");
        }
        return in;
    }
}
