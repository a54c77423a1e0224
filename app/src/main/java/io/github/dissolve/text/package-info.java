/** Text-only sink: keeps the character data a tree builder emits and nothing else. */
@NullMarked
package io.github.dissolve.text;

import org.jspecify.annotations.NullMarked;
