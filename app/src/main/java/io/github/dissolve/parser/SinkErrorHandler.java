package io.github.dissolve.parser;

import io.github.dissolve.sink.TreeSink;
import org.xml.sax.ErrorHandler;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

/** Forwards the SAX errors of the tokenizer and tree builder to {@link TreeSink#parseError}. */
final class SinkErrorHandler implements ErrorHandler {
    private final TreeSink<?, ?> sink;
    private final boolean withLocation;

    SinkErrorHandler(TreeSink<?, ?> sink, boolean withLocation) {
        this.sink = sink;
        this.withLocation = withLocation;
    }

    @Override
    public void warning(SAXParseException exception) {
        sink.parseError(describe(exception));
    }

    @Override
    public void error(SAXParseException exception) {
        sink.parseError(describe(exception));
    }

    /** Reported to the sink, then rethrown: the parser stops after a fatal error anyway. */
    @Override
    public void fatalError(SAXParseException exception) throws SAXException {
        sink.parseError(describe(exception));
        throw exception;
    }

    String describe(SAXParseException exception) {
        var message = String.valueOf(exception.getMessage());
        if (!withLocation || exception.getLineNumber() < 0) {
            return message;
        }
        return exception.getLineNumber() + ":" + exception.getColumnNumber() + ": " + message;
    }
}
