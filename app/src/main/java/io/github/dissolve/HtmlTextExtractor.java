package io.github.dissolve;

import io.github.dissolve.parser.Html5Parser;
import io.github.dissolve.parser.HtmlExtractionException;
import io.github.dissolve.parser.ParseOptions;
import io.github.dissolve.text.TextOnlySink;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.Charset;

/**
 * Extracts document text with fixed {@link ParseOptions}.
 *
 * <p>Holds no per-parse state: every call builds its own parser and {@link TextOnlySink}, so an instance can be
 * shared between threads and repeated calls on the same input return the same text.
 */
public final class HtmlTextExtractor {
    private final ParseOptions options;

    public HtmlTextExtractor() {
        this(ParseOptions.defaults());
    }

    public HtmlTextExtractor(ParseOptions options) {
        this.options = options;
    }

    /** An extractor configured from {@code dissolve.properties} on the classpath, if there is one. */
    public static HtmlTextExtractor fromClasspathConfig() {
        return new HtmlTextExtractor(ParseOptions.load());
    }

    public ParseOptions options() {
        return options;
    }

    public String extract(String html) {
        return Html5Parser.parse(new TextOnlySink(), html, options);
    }

    /**
     * Reads {@code html} to the end. The reader is not closed.
     *
     * @throws HtmlExtractionException if reading fails
     */
    public String extract(Reader html) {
        return Html5Parser.parse(new TextOnlySink(), html, options);
    }

    /**
     * Decodes {@code html} with {@code charset}; no encoding sniffing takes place. The stream is not closed.
     *
     * @throws HtmlExtractionException if reading fails
     */
    public String extract(InputStream html, Charset charset) {
        return extract(new InputStreamReader(html, charset));
    }
}
