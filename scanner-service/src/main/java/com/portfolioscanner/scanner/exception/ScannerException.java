package com.portfolioscanner.scanner.exception;

/**
 * Invalid scanner request (missing stocks, blank text). Mapped to HTTP 400.
 */
public class ScannerException extends RuntimeException {

    public ScannerException(String message) {
        super(message);
    }
}
