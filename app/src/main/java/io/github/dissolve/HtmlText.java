package io.github.dissolve;

/** One-call text extraction with default {@link io.github.dissolve.parser.ParseOptions}. */
public final class HtmlText {
    private static final HtmlTextExtractor DEFAULT = new HtmlTextExtractor();

    private HtmlText() {}

    /**
     * Returns the text content of an HTML5 document: every run of character data the HTML5 tree-construction
     * algorithm places in the document, concatenated in that order. Tags, attributes, comments and the doctype are
     * dropped. Malformed markup is recovered the way a browser recovers it and never causes a failure.
     *
     * <pre>{@code
     * HtmlText.stripHtmlTags("<html>Hello<div>World!</div></html>"); // "HelloWorld!"
     * }</pre>
     */
    public static String stripHtmlTags(String input) {
        return DEFAULT.extract(input);
    }
}
