package io.github.dissolve.sink;

import org.jetbrains.annotations.Nullable;

/**
 * Namespace-qualified name of an element or attribute.
 *
 * @param prefix the source prefix, only present on foreign attributes such as {@code xlink:href}
 * @param namespace the namespace URI, empty for attributes in no namespace
 * @param localName the local name, lower-cased by the tokenizer except for adjusted SVG/MathML names
 */
public record QualifiedName(@Nullable String prefix, String namespace, String localName) {
    public static final String HTML_NAMESPACE = "http://www.w3.org/1999/xhtml";
    public static final String SVG_NAMESPACE = "http://www.w3.org/2000/svg";
    public static final String MATHML_NAMESPACE = "http://www.w3.org/1998/Math/MathML";
    public static final String XLINK_NAMESPACE = "http://www.w3.org/1999/xlink";
    public static final String XML_NAMESPACE = "http://www.w3.org/XML/1998/namespace";
    public static final String XMLNS_NAMESPACE = "http://www.w3.org/2000/xmlns/";

    public static QualifiedName of(String namespace, String localName) {
        return new QualifiedName(null, namespace, localName);
    }

    public static QualifiedName html(String localName) {
        return new QualifiedName(null, HTML_NAMESPACE, localName);
    }

    /** Namespace plus local name, ignoring the prefix; this is the name the tree-construction rules compare. */
    public boolean isExpanded(String namespace, String localName) {
        return this.namespace.equals(namespace) && this.localName.equals(localName);
    }

    public boolean isHtml(String localName) {
        return isExpanded(HTML_NAMESPACE, localName);
    }

    @Override
    public String toString() {
        return prefix == null ? localName : prefix + ":" + localName;
    }
}
