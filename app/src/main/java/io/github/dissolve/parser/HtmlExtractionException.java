package io.github.dissolve.parser;

/**
 * The parser could not run to completion: the input {@link java.io.Reader} failed, or the parser hit an error it
 * treats as fatal. Markup errors never cause this; the HTML5 algorithm recovers from them.
 */
public class HtmlExtractionException extends RuntimeException {
    public HtmlExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
