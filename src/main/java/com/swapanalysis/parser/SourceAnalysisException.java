package com.swapanalysis.parser;

/**
 * A source file or directory could not be read or parsed.
 */
public class SourceAnalysisException extends RuntimeException {

    public SourceAnalysisException(String message, Throwable cause) {
        super(message, cause);
    }
}
