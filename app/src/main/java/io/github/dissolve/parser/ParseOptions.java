package io.github.dissolve.parser;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Tree-builder and tokenizer settings for one parse.
 *
 * @param scriptingEnabled parse as a browser with scripting on; {@code <noscript>} content is then raw text
 * @param iframeSrcdoc parse as an {@code iframe srcdoc} document, which never enters quirks mode
 * @param ignoreComments skip comment callbacks altogether
 * @param exactErrors report the tokenizer's detailed errors and prefix messages with {@code line:column}
 */
public record ParseOptions(boolean scriptingEnabled, boolean iframeSrcdoc, boolean ignoreComments, boolean exactErrors) {
    private static final Logger logger = LogManager.getLogger(ParseOptions.class);

    public static final String RESOURCE_NAME = "dissolve.properties";

    public static final String SCRIPTING_KEY = "dissolve.scripting";
    public static final String IFRAME_SRCDOC_KEY = "dissolve.iframeSrcdoc";
    public static final String IGNORE_COMMENTS_KEY = "dissolve.ignoreComments";
    public static final String EXACT_ERRORS_KEY = "dissolve.exactErrors";

    private static final ParseOptions DEFAULTS = new ParseOptions(true, false, false, false);

    public static ParseOptions defaults() {
        return DEFAULTS;
    }

    /** Reads options from {@code properties}; missing or blank keys keep their default value. */
    public static ParseOptions fromProperties(Properties properties) {
        return new ParseOptions(
                flag(properties, SCRIPTING_KEY, DEFAULTS.scriptingEnabled),
                flag(properties, IFRAME_SRCDOC_KEY, DEFAULTS.iframeSrcdoc),
                flag(properties, IGNORE_COMMENTS_KEY, DEFAULTS.ignoreComments),
                flag(properties, EXACT_ERRORS_KEY, DEFAULTS.exactErrors));
    }

    /**
     * Loads {@value #RESOURCE_NAME} from the classpath. Falls back to {@link #defaults()} when the resource is absent
     * or cannot be read.
     */
    public static ParseOptions load() {
        return load(ParseOptions.class.getClassLoader());
    }

    static ParseOptions load(ClassLoader classLoader) {
        try (InputStream in = classLoader.getResourceAsStream(RESOURCE_NAME)) {
            if (in == null) {
                logger.debug("No {} on the classpath, using default parse options", RESOURCE_NAME);
                return DEFAULTS;
            }
            var properties = new Properties();
            properties.load(in);
            var options = fromProperties(properties);
            logger.debug("Loaded parse options from {}: {}", RESOURCE_NAME, options);
            return options;
        } catch (IOException | IllegalArgumentException e) {
            logger.warn("Failed to read {}, using default parse options: {}", RESOURCE_NAME, e.getMessage());
            return DEFAULTS;
        }
    }

    public ParseOptions withScriptingEnabled(boolean scriptingEnabled) {
        return new ParseOptions(scriptingEnabled, iframeSrcdoc, ignoreComments, exactErrors);
    }

    public ParseOptions withIframeSrcdoc(boolean iframeSrcdoc) {
        return new ParseOptions(scriptingEnabled, iframeSrcdoc, ignoreComments, exactErrors);
    }

    public ParseOptions withIgnoreComments(boolean ignoreComments) {
        return new ParseOptions(scriptingEnabled, iframeSrcdoc, ignoreComments, exactErrors);
    }

    public ParseOptions withExactErrors(boolean exactErrors) {
        return new ParseOptions(scriptingEnabled, iframeSrcdoc, ignoreComments, exactErrors);
    }

    private static boolean flag(Properties properties, String key, boolean defaultValue) {
        var value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        return Boolean.parseBoolean(value.trim());
    }
}
