package io.github.dissolve.text;

import io.github.dissolve.sink.Attribute;
import io.github.dissolve.sink.ElementFlags;
import io.github.dissolve.sink.NodeOrText;
import io.github.dissolve.sink.QualifiedName;
import io.github.dissolve.sink.QuirksMode;
import io.github.dissolve.sink.TreeSink;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * A {@link TreeSink} that keeps only character data.
 *
 * <p>Every text payload, whichever append callback carries it and whatever parent it is addressed to, goes to the end
 * of one buffer. This is correct because the tree builder hands out text in final document order: once the structure
 * is thrown away, appending under the body, before a table (foster parenting) or into template contents all look the
 * same. Structural callbacks that only move nodes around are therefore no-ops.
 *
 * <p>Not thread-safe. One instance serves one parse and is consumed by {@link #finish()}.
 */
public final class TextOnlySink implements TreeSink<Node, String> {
    private static final Logger logger = LogManager.getLogger(TextOnlySink.class);

    private @Nullable StringBuilder text = new StringBuilder();

    @Override
    public String finish() {
        var result = checkOpen().toString();
        text = null;
        return result;
    }

    @Override
    public void parseError(String message) {
        checkOpen();
        logger.debug("Parse error: {}", message);
    }

    @Override
    public Node getDocument() {
        checkOpen();
        return Node.document();
    }

    @Override
    public QualifiedName elementName(Node target) {
        return target.elementName();
    }

    @Override
    public Node createElement(QualifiedName name, List<Attribute> attributes, ElementFlags flags) {
        checkOpen();
        return Node.element(name);
    }

    @Override
    public Node createComment(String text) {
        checkOpen();
        return Node.comment();
    }

    @Override
    public Node createProcessingInstruction(String target, String data) {
        checkOpen();
        return Node.processingInstruction();
    }

    @Override
    public void appendDoctypeToDocument(String name, String publicId, String systemId) {
        checkOpen();
    }

    @Override
    public void append(Node parent, NodeOrText<Node> child) {
        appendText(child);
    }

    @Override
    public void appendBasedOnParentNode(Node element, Node prevElement, NodeOrText<Node> child) {
        appendText(child);
    }

    /**
     * Never issued by the validator.nu tree builder. Accepting it would put text in the wrong place without anyone
     * noticing, so it fails instead.
     *
     * @throws UnsupportedOperationException always
     */
    @Override
    public void appendBeforeSibling(Node sibling, NodeOrText<Node> newNode) {
        throw new UnsupportedOperationException("Insertion before a sibling is not supported (sibling: " + sibling
                + "); text order could no longer be guaranteed");
    }

    /** A fresh document; its text still lands in the shared buffer, at the point the builder emits it. */
    @Override
    public Node getTemplateContents(Node target) {
        checkOpen();
        return Node.document();
    }

    @Override
    public boolean sameNode(Node x, Node y) {
        return x == y;
    }

    @Override
    public void setQuirksMode(QuirksMode mode) {
        checkOpen();
        logger.debug("Document mode: {}", mode);
    }

    @Override
    public void addAttributesIfMissing(Node target, List<Attribute> attributes) {
        checkOpen();
    }

    @Override
    public void removeFromParent(Node target) {
        checkOpen();
    }

    @Override
    public void reparentChildren(Node node, Node newParent) {
        checkOpen();
    }

    private void appendText(NodeOrText<Node> child) {
        var buffer = checkOpen();
        if (child instanceof NodeOrText.AppendText<Node> run) {
            buffer.append(run.text());
        }
    }

    private StringBuilder checkOpen() {
        var current = text;
        if (current == null) {
            throw new IllegalStateException("Sink already finished");
        }
        return current;
    }
}
