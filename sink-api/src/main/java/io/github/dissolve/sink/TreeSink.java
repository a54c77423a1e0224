package io.github.dissolve.sink;

import java.util.List;

/**
 * Consumer of the structural callbacks issued by an HTML5 tree-construction algorithm.
 *
 * <p>The builder keeps the stack of open elements, the list of active formatting elements and every parent/child
 * relationship itself. A sink is asked to create opaque handles, to report the name of element handles, to compare
 * handles, and is told where nodes and character data end up. Character data always arrives in the order the
 * algorithm places it in the final document, including after foster parenting and error recovery.
 *
 * <p>Callbacks are issued from a single thread, one parse at a time. A sink serves exactly one parse and is consumed
 * by {@link #finish()}.
 *
 * @param <H> node handle type; the builder compares handles only through {@link #sameNode}
 * @param <O> result type produced by {@link #finish()}
 */
public interface TreeSink<H, O> {

    /** Consumes the sink and returns its result. Called once, after the last token has been processed. */
    O finish();

    /** A recoverable markup error. Parsing continues; the sink must not fail because of it. */
    void parseError(String message);

    /** The document node. Called once per parse, before any other node is created. */
    H getDocument();

    /**
     * The name {@code target} was created with.
     *
     * @throws IllegalStateException if {@code target} is not an element; the builder never asks for the name of
     *     anything else
     */
    QualifiedName elementName(H target);

    H createElement(QualifiedName name, List<Attribute> attributes, ElementFlags flags);

    H createComment(String text);

    H createProcessingInstruction(String target, String data);

    void appendDoctypeToDocument(String name, String publicId, String systemId);

    /** Appends {@code child} as the last child of {@code parent}. Adjacent text runs may be merged by the sink. */
    void append(H parent, NodeOrText<H> child);

    /**
     * Foster-parenting insertion: when {@code element} (a table) has a parent, the child goes immediately before it,
     * otherwise it is appended to {@code prevElement}.
     */
    void appendBasedOnParentNode(H element, H prevElement, NodeOrText<H> child);

    /** Inserts {@code newNode} immediately before {@code sibling}. */
    void appendBeforeSibling(H sibling, NodeOrText<H> newNode);

    /** The document fragment that receives the children of the {@code <template>} element {@code target}. */
    H getTemplateContents(H target);

    boolean sameNode(H x, H y);

    void setQuirksMode(QuirksMode mode);

    /** Adds each attribute whose name {@code target} does not already carry. */
    void addAttributesIfMissing(H target, List<Attribute> attributes);

    void removeFromParent(H target);

    /** Moves all children of {@code node} to the end of {@code newParent}'s children. */
    void reparentChildren(H node, H newParent);
}
