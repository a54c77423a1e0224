package io.github.dissolve.sink;

/** One attribute of a start tag, as handed to {@link TreeSink#createElement}. */
public record Attribute(QualifiedName name, String value) {}
