package io.github.dissolve.sink;

/** Document-wide rendering mode chosen by the tree builder from the doctype (or its absence). */
public enum QuirksMode {
    QUIRKS,
    LIMITED_QUIRKS,
    NO_QUIRKS
}
