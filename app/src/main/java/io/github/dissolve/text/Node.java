package io.github.dissolve.text;

import io.github.dissolve.sink.QualifiedName;
import org.jetbrains.annotations.Nullable;

/**
 * Handle for one construction-time artifact. Carries no links to other nodes; the tree builder owns the topology.
 *
 * <p>Equality is identity. Two elements with the same name are different nodes.
 */
public final class Node {
    public enum Kind {
        DOCUMENT,
        COMMENT,
        PROCESSING_INSTRUCTION,
        ELEMENT
    }

    private final Kind kind;
    private final @Nullable QualifiedName name;

    private Node(Kind kind, @Nullable QualifiedName name) {
        this.kind = kind;
        this.name = name;
    }

    static Node document() {
        return new Node(Kind.DOCUMENT, null);
    }

    static Node comment() {
        return new Node(Kind.COMMENT, null);
    }

    static Node processingInstruction() {
        return new Node(Kind.PROCESSING_INSTRUCTION, null);
    }

    static Node element(QualifiedName name) {
        return new Node(Kind.ELEMENT, name);
    }

    public Kind kind() {
        return kind;
    }

    /**
     * @throws IllegalStateException if this node is not an element
     */
    public QualifiedName elementName() {
        if (kind != Kind.ELEMENT || name == null) {
            throw new IllegalStateException("Not an element: " + kind);
        }
        return name;
    }

    @Override
    public String toString() {
        return kind == Kind.ELEMENT ? "Node[ELEMENT " + name + "]" : "Node[" + kind + "]";
    }
}
