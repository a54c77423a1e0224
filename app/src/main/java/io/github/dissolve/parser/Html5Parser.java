package io.github.dissolve.parser;

import io.github.dissolve.sink.TreeSink;
import java.io.FilterReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import nu.validator.htmlparser.common.XmlViolationPolicy;
import nu.validator.htmlparser.impl.ErrorReportingTokenizer;
import nu.validator.htmlparser.impl.Tokenizer;
import nu.validator.htmlparser.io.Driver;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;

/** Runs the validator.nu HTML5 parser over a whole document and feeds a {@link TreeSink}. */
public final class Html5Parser {
    private Html5Parser() {}

    public static <H, O> O parse(TreeSink<H, O> sink, String input, ParseOptions options) {
        return parse(sink, new StringReader(input), options);
    }

    /**
     * Parses {@code input} to the end and returns {@code sink.finish()}.
     *
     * <p>A leading byte order mark is skipped by the driver. {@code input} is left open. Markup errors are reported
     * to {@link TreeSink#parseError} and never abort the parse. Exceptions the sink throws from a callback propagate unchanged.
     *
     * @throws HtmlExtractionException if reading {@code input} fails or the parser reports a fatal error
     */
    public static <H, O> O parse(TreeSink<H, O> sink, Reader input, ParseOptions options) {
        var treeBuilder = new TreeSinkBuilder<>(sink);
        treeBuilder.setScriptingEnabled(options.scriptingEnabled());
        treeBuilder.setIsSrcdocDocument(options.iframeSrcdoc());
        treeBuilder.setIgnoringComments(options.ignoreComments());
        treeBuilder.setNamePolicy(XmlViolationPolicy.ALLOW);

        Tokenizer tokenizer = options.exactErrors()
                ? new ErrorReportingTokenizer(treeBuilder, false)
                : new Tokenizer(treeBuilder, false);
        tokenizer.setCommentPolicy(XmlViolationPolicy.ALLOW);
        tokenizer.setContentNonXmlCharPolicy(XmlViolationPolicy.ALLOW);
        tokenizer.setContentSpacePolicy(XmlViolationPolicy.ALLOW);
        tokenizer.setXmlnsPolicy(XmlViolationPolicy.ALLOW);
        tokenizer.setNamePolicy(XmlViolationPolicy.ALLOW);

        var errorHandler = new SinkErrorHandler(sink, options.exactErrors());
        tokenizer.setErrorHandler(errorHandler);
        treeBuilder.setErrorHandler(errorHandler);

        var driver = new Driver(tokenizer);
        try {
            driver.tokenize(new InputSource(new NonClosingReader(input)));
        } catch (SAXException e) {
            throw new HtmlExtractionException("HTML parser stopped: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new HtmlExtractionException("Failed to read HTML input: " + e.getMessage(), e);
        }
        return sink.finish();
    }

    /** The driver closes its input once tokenizing ends; the caller owns {@code input}, so the close stops here. */
    private static final class NonClosingReader extends FilterReader {
        NonClosingReader(Reader in) {
            super(in);
        }

        @Override
        public void close() {}
    }
}
