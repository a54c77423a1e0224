@NullMarked
package io.github.dissolve.parser;

import org.jspecify.annotations.NullMarked;
