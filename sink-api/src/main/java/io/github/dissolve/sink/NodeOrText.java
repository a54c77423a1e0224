package io.github.dissolve.sink;

/**
 * Payload of the append family of callbacks: either a node the builder created earlier, or a run of character data.
 *
 * @param <H> the sink's node handle type
 */
public sealed interface NodeOrText<H> permits NodeOrText.AppendNode, NodeOrText.AppendText {

    record AppendNode<H>(H node) implements NodeOrText<H> {}

    record AppendText<H>(String text) implements NodeOrText<H> {}

    static <H> NodeOrText<H> node(H node) {
        return new AppendNode<>(node);
    }

    static <H> NodeOrText<H> text(String text) {
        return new AppendText<>(text);
    }
}
