package io.github.dissolve.parser;

import io.github.dissolve.sink.Attribute;
import io.github.dissolve.sink.ElementFlags;
import io.github.dissolve.sink.NodeOrText;
import io.github.dissolve.sink.QualifiedName;
import io.github.dissolve.sink.QuirksMode;
import io.github.dissolve.sink.TreeSink;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import nu.validator.htmlparser.common.DocumentMode;
import nu.validator.htmlparser.impl.HtmlAttributes;
import nu.validator.htmlparser.impl.TreeBuilder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import org.xml.sax.SAXException;

/**
 * Drives a {@link TreeSink} from the validator.nu tree-construction algorithm.
 *
 * <p>validator.nu hands its {@code TreeBuilder} subclasses raw character buffers and keeps template children under
 * the template element. This class turns those callbacks into the {@link TreeSink} protocol: character buffers become
 * {@link NodeOrText.AppendText} payloads, foster-parented insertions go through
 * {@link TreeSink#appendBasedOnParentNode}, and anything inserted under an HTML {@code <template>} is redirected to
 * {@link TreeSink#getTemplateContents}.
 *
 * <p>One instance per parse.
 *
 * @param <H> the sink's node handle type
 */
final class TreeSinkBuilder<H> extends TreeBuilder<H> {
    private static final Logger logger = LogManager.getLogger(TreeSinkBuilder.class);

    private final TreeSink<H, ?> sink;
    private final Map<H, H> templateContents = new IdentityHashMap<>();
    private @Nullable H document;

    TreeSinkBuilder(TreeSink<H, ?> sink) {
        this.sink = sink;
        setDocumentModeHandler(this::documentModeChanged);
    }

    @Override
    protected void start(boolean fragmentMode) throws SAXException {
        if (fragmentMode) {
            throw new IllegalStateException("Fragment parsing is not supported");
        }
        document = sink.getDocument();
        templateContents.clear();
    }

    @Override
    protected H createElement(String ns, String name, HtmlAttributes attributes, H intendedParent)
            throws SAXException {
        var attrs = toAttributes(attributes);
        return sink.createElement(QualifiedName.of(ns, name), attrs, flagsFor(ns, name, attrs));
    }

    @Override
    protected H createHtmlElementSetAsRoot(HtmlAttributes attributes) throws SAXException {
        var root = sink.createElement(QualifiedName.html("html"), toAttributes(attributes), ElementFlags.NONE);
        sink.append(document(), NodeOrText.node(root));
        return root;
    }

    @Override
    protected H createAndInsertFosterParentedElement(
            String ns, String name, HtmlAttributes attributes, H table, H stackParent) throws SAXException {
        var element = createElement(ns, name, attributes, stackParent);
        sink.appendBasedOnParentNode(table, stackParent, NodeOrText.node(element));
        return element;
    }

    @Override
    protected void detachFromParent(H element) throws SAXException {
        sink.removeFromParent(element);
    }

    /** Children are not tracked. The validator.nu tree builder does not ask. */
    @Override
    protected boolean hasChildren(H element) throws SAXException {
        return false;
    }

    @Override
    protected void appendElement(H child, H newParent) throws SAXException {
        sink.append(insertionTarget(newParent), NodeOrText.node(child));
    }

    @Override
    protected void appendChildrenToNewParent(H oldParent, H newParent) throws SAXException {
        if (sink.sameNode(oldParent, newParent)) {
            return;
        }
        sink.reparentChildren(oldParent, insertionTarget(newParent));
    }

    @Override
    protected void insertFosterParentedChild(H child, H table, H stackParent) throws SAXException {
        sink.appendBasedOnParentNode(table, stackParent, NodeOrText.node(child));
    }

    @Override
    protected void insertFosterParentedCharacters(char[] buf, int start, int length, H table, H stackParent)
            throws SAXException {
        sink.appendBasedOnParentNode(table, stackParent, NodeOrText.text(new String(buf, start, length)));
    }

    @Override
    protected void appendCharacters(H parent, char[] buf, int start, int length) throws SAXException {
        sink.append(insertionTarget(parent), NodeOrText.text(new String(buf, start, length)));
    }

    @Override
    protected void appendComment(H parent, char[] buf, int start, int length) throws SAXException {
        var comment = sink.createComment(new String(buf, start, length));
        sink.append(insertionTarget(parent), NodeOrText.node(comment));
    }

    @Override
    protected void appendCommentToDocument(char[] buf, int start, int length) throws SAXException {
        var comment = sink.createComment(new String(buf, start, length));
        sink.append(document(), NodeOrText.node(comment));
    }

    @Override
    protected void addAttributesToElement(H element, HtmlAttributes attributes) throws SAXException {
        sink.addAttributesIfMissing(element, toAttributes(attributes));
    }

    @Override
    protected void appendDoctypeToDocument(String name, String publicIdentifier, String systemIdentifier)
            throws SAXException {
        sink.appendDoctypeToDocument(name, publicIdentifier, systemIdentifier);
    }

    private void documentModeChanged(
            DocumentMode mode, @Nullable String publicIdentifier, @Nullable String systemIdentifier) {
        sink.setQuirksMode(toQuirksMode(mode));
    }

    static QuirksMode toQuirksMode(DocumentMode mode) {
        return switch (mode) {
            case STANDARDS_MODE -> QuirksMode.NO_QUIRKS;
            case ALMOST_STANDARDS_MODE -> QuirksMode.LIMITED_QUIRKS;
            case QUIRKS_MODE -> QuirksMode.QUIRKS;
        };
    }

    /** Where children of {@code parent} really go: template contents for an HTML template, the node itself otherwise. */
    private H insertionTarget(H parent) {
        if (sink.sameNode(parent, document()) || !sink.elementName(parent).isHtml("template")) {
            return parent;
        }
        return templateContents.computeIfAbsent(parent, template -> {
            logger.trace("Allocating template contents for {}", template);
            return sink.getTemplateContents(template);
        });
    }

    private H document() {
        var current = document;
        if (current == null) {
            throw new IllegalStateException("Tree construction has not started");
        }
        return current;
    }

    static List<Attribute> toAttributes(@Nullable HtmlAttributes attributes) {
        if (attributes == null || attributes.getLength() == 0) {
            return List.of();
        }
        var result = new ArrayList<Attribute>(attributes.getLength());
        for (int i = 0; i < attributes.getLength(); i++) {
            var qName = attributes.getQName(i);
            var colon = qName.indexOf(':');
            var prefix = colon > 0 ? qName.substring(0, colon) : null;
            var name = new QualifiedName(prefix, attributes.getURI(i), attributes.getLocalName(i));
            result.add(new Attribute(name, attributes.getValue(i)));
        }
        return List.copyOf(result);
    }

    static ElementFlags flagsFor(String ns, String name, List<Attribute> attributes) {
        if (QualifiedName.HTML_NAMESPACE.equals(ns) && "template".equals(name)) {
            return new ElementFlags(true, false);
        }
        if (QualifiedName.MATHML_NAMESPACE.equals(ns) && "annotation-xml".equals(name)) {
            for (var attribute : attributes) {
                if (attribute.name().isExpanded("", "encoding")) {
                    var encoding = attribute.value().toLowerCase(Locale.ROOT);
                    if (encoding.equals("text/html") || encoding.equals("application/xhtml+xml")) {
                        return new ElementFlags(false, true);
                    }
                }
            }
        }
        return ElementFlags.NONE;
    }
}
