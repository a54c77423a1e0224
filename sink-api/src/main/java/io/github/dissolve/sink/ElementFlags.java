package io.github.dissolve.sink;

/**
 * Facts about a new element that the tree builder has already worked out and a sink may need.
 *
 * @param template the element is an HTML {@code <template>} and owns separate template contents
 * @param mathmlAnnotationXmlIntegrationPoint the element is a MathML {@code annotation-xml} whose {@code encoding}
 *     makes it an HTML integration point
 */
public record ElementFlags(boolean template, boolean mathmlAnnotationXmlIntegrationPoint) {
    public static final ElementFlags NONE = new ElementFlags(false, false);
}
