/**
 * Extracts the text of HTML5 documents.
 *
 * <p>Start with {@link io.github.dissolve.HtmlText#stripHtmlTags(String)}; use
 * {@link io.github.dissolve.HtmlTextExtractor} for non-default {@link io.github.dissolve.parser.ParseOptions} or for
 * {@link java.io.Reader} and byte input.
 */
@NullMarked
package io.github.dissolve;

import org.jspecify.annotations.NullMarked;
