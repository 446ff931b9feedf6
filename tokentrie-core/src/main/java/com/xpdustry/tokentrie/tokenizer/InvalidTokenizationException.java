package com.xpdustry.tokentrie.tokenizer;

/**
 * Thrown when a {@link Tokenizer.Custom} function returns an unusable result.
 */
public final class InvalidTokenizationException extends RuntimeException {

    public InvalidTokenizationException(final String message) {
        super(message);
    }
}
