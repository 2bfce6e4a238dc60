package com.portfolioscanner.common.exception;

/**
 * Raised while loading declarative lexicon data (company aliases, stopwords,
 * sentiment words, sector table). Always fatal at startup.
 */
public class LexiconLoadException extends RuntimeException {
    private final String resource;

    public LexiconLoadException(String resource, String message) {
        super("[" + resource + "] " + message);
        this.resource = resource;
    }

    public LexiconLoadException(String resource, String message, Throwable cause) {
        super("[" + resource + "] " + message, cause);
        this.resource = resource;
    }

    public String getResource() {
        return resource;
    }
}
