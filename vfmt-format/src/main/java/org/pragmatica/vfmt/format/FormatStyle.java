package org.pragmatica.vfmt.format;

/**
 * Formatting style consulted by the annotation rules.
 *
 * @param columnLimit                  maximum line length
 * @param indentationSpaces            spaces per indentation level
 * @param wrapSpaces                   spaces of continuation indentation after a wrap
 * @param spacesBeforeComment          spaces between code and a trailing comment
 * @param compactIndexingAndSelections drop spaces around operators and colons inside indexing
 * @param wrapEndElseClauses           put {@code else} on its own line after {@code end}
 */
public record FormatStyle(
        int columnLimit,
        int indentationSpaces,
        int wrapSpaces,
        int spacesBeforeComment,
        boolean compactIndexingAndSelections,
        boolean wrapEndElseClauses
) {

    /**
     * Default formatting style.
     */
    public static final FormatStyle DEFAULT = new FormatStyle(100, 2, 4, 2, true, false);

    public FormatStyle {
        requirePositive("column_limit", columnLimit);
        requireNonNegative("indentation_spaces", indentationSpaces);
        requireNonNegative("wrap_spaces", wrapSpaces);
        requireNonNegative("spaces_before_comment", spacesBeforeComment);
    }

    /**
     * Factory method for default style.
     */
    public static FormatStyle defaultStyle() {
        return DEFAULT;
    }

    public FormatStyle withColumnLimit(int columnLimit) {
        return new FormatStyle(columnLimit,
                               indentationSpaces,
                               wrapSpaces,
                               spacesBeforeComment,
                               compactIndexingAndSelections,
                               wrapEndElseClauses);
    }

    public FormatStyle withIndentationSpaces(int indentationSpaces) {
        return new FormatStyle(columnLimit,
                               indentationSpaces,
                               wrapSpaces,
                               spacesBeforeComment,
                               compactIndexingAndSelections,
                               wrapEndElseClauses);
    }

    public FormatStyle withWrapSpaces(int wrapSpaces) {
        return new FormatStyle(columnLimit,
                               indentationSpaces,
                               wrapSpaces,
                               spacesBeforeComment,
                               compactIndexingAndSelections,
                               wrapEndElseClauses);
    }

    public FormatStyle withSpacesBeforeComment(int spacesBeforeComment) {
        return new FormatStyle(columnLimit,
                               indentationSpaces,
                               wrapSpaces,
                               spacesBeforeComment,
                               compactIndexingAndSelections,
                               wrapEndElseClauses);
    }

    public FormatStyle withCompactIndexingAndSelections(boolean compactIndexingAndSelections) {
        return new FormatStyle(columnLimit,
                               indentationSpaces,
                               wrapSpaces,
                               spacesBeforeComment,
                               compactIndexingAndSelections,
                               wrapEndElseClauses);
    }

    public FormatStyle withWrapEndElseClauses(boolean wrapEndElseClauses) {
        return new FormatStyle(columnLimit,
                               indentationSpaces,
                               wrapSpaces,
                               spacesBeforeComment,
                               compactIndexingAndSelections,
                               wrapEndElseClauses);
    }

    private static void requirePositive(String key, int value) {
        if (value < 1) {
            throw FormattingError.invalidStyleValue(key, String.valueOf(value), "must be positive")
                                 .exception();
        }
    }

    private static void requireNonNegative(String key, int value) {
        if (value < 0) {
            throw FormattingError.invalidStyleValue(key, String.valueOf(value), "must not be negative")
                                 .exception();
        }
    }
}
