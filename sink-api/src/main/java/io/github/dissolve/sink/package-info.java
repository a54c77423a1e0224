/**
 * Callback protocol between an HTML5 tree-construction algorithm and the object that consumes its output.
 *
 * <p>The tree builder owns the document topology. A {@link io.github.dissolve.sink.TreeSink} only answers the identity
 * and naming queries the builder issues and reacts to the structural callbacks it receives.
 */
@NullMarked
package io.github.dissolve.sink;

import org.jspecify.annotations.NullMarked;
