package org.pragmatica.vfmt.format;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads {@link FormatStyle} from flat {@code key = value} settings.
 *
 * <p>Supported keys:
 * <ul>
 *   <li>{@code column_limit}</li>
 *   <li>{@code indentation_spaces}</li>
 *   <li>{@code wrap_spaces}</li>
 *   <li>{@code spaces_before_comment}</li>
 *   <li>{@code compact_indexing_and_selections}</li>
 *   <li>{@code wrap_end_else_clauses}</li>
 * </ul>
 * Missing keys keep the value of the base style, unknown keys are ignored.
 */
public final class FormatStyleLoader {
    private static final Logger log = LoggerFactory.getLogger(FormatStyleLoader.class);

    public static final String COLUMN_LIMIT = "column_limit";
    public static final String INDENTATION_SPACES = "indentation_spaces";
    public static final String WRAP_SPACES = "wrap_spaces";
    public static final String SPACES_BEFORE_COMMENT = "spaces_before_comment";
    public static final String COMPACT_INDEXING_AND_SELECTIONS = "compact_indexing_and_selections";
    public static final String WRAP_END_ELSE_CLAUSES = "wrap_end_else_clauses";

    private final FormatStyle base;

    private FormatStyleLoader(FormatStyle base) {
        this.base = base;
    }

    public static FormatStyleLoader formatStyleLoader() {
        return new FormatStyleLoader(FormatStyle.defaultStyle());
    }

    public static FormatStyleLoader formatStyleLoader(FormatStyle base) {
        return new FormatStyleLoader(base);
    }

    /**
     * Load style from a properties file.
     */
    public FormatStyle load(Path path) {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            var properties = new Properties();
            properties.load(reader);
            log.debug("Loading format style from {}", path);
            return load(toMap(properties));
        } catch (IOException e) {
            throw FormattingError.styleReadFailed(path.toString(), e)
                                 .exception();
        }
    }

    /**
     * Load style from a properties stream, e.g. a classpath resource.
     */
    public FormatStyle load(InputStream input, String sourceName) {
        try {
            var properties = new Properties();
            properties.load(new InputStreamReader(input, StandardCharsets.UTF_8));
            log.debug("Loading format style from {}", sourceName);
            return load(toMap(properties));
        } catch (IOException e) {
            throw FormattingError.styleReadFailed(sourceName, e)
                                 .exception();
        }
    }

    public FormatStyle load(Map<String, String> settings) {
        settings.forEach(FormatStyleLoader::requireSetting);
        var style = base;
        // Sorted for stable warning order
        for (var entry : new TreeMap<>(settings).entrySet()) {
            var key = entry.getKey()
                           .trim();
            var value = entry.getValue()
                             .trim();
            style = switch (key) {
                case COLUMN_LIMIT -> style.withColumnLimit(parseInt(key, value));
                case INDENTATION_SPACES -> style.withIndentationSpaces(parseInt(key, value));
                case WRAP_SPACES -> style.withWrapSpaces(parseInt(key, value));
                case SPACES_BEFORE_COMMENT -> style.withSpacesBeforeComment(parseInt(key, value));
                case COMPACT_INDEXING_AND_SELECTIONS -> style.withCompactIndexingAndSelections(parseBoolean(key, value));
                case WRAP_END_ELSE_CLAUSES -> style.withWrapEndElseClauses(parseBoolean(key, value));
                default -> {
                    log.warn("Ignoring unknown format style setting: {}", key);
                    yield style;
                }
            };
        }
        return style;
    }

    private static void requireSetting(String key, String value) {
        if (key == null || value == null) {
            throw FormattingError.invalidStyleValue(String.valueOf(key), String.valueOf(value), "keys and values must not be null")
                                 .exception();
        }
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw FormattingError.invalidStyleValue(key, value, "expected an integer")
                                 .exception();
        }
    }

    private static boolean parseBoolean(String key, String value) {
        return switch (value.toLowerCase(Locale.ROOT)) {
            case "true" -> true;
            case "false" -> false;
            default -> throw FormattingError.invalidStyleValue(key, value, "expected true or false")
                                            .exception();
        };
    }

    private static Map<String, String> toMap(Properties properties) {
        var result = new LinkedHashMap<String, String>();
        properties.stringPropertyNames()
                  .forEach(name -> result.put(name, properties.getProperty(name)));
        return result;
    }
}
