package org.pragmatica.vfmt.format;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FormatStyleLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void load_emptySettingsKeepBase() {
        var base = FormatStyle.defaultStyle()
                              .withColumnLimit(120);

        assertThat(FormatStyleLoader.formatStyleLoader(base)
                                    .load(Map.of())).isEqualTo(base);
    }

    @Test
    void load_appliesAllKnownKeys() {
        var style = FormatStyleLoader.formatStyleLoader()
                                     .load(Map.of("column_limit", "80",
                                                  "indentation_spaces", "4",
                                                  "wrap_spaces", "8",
                                                  "spaces_before_comment", "1",
                                                  "compact_indexing_and_selections", "false",
                                                  "wrap_end_else_clauses", "TRUE"));

        assertThat(style).isEqualTo(new FormatStyle(80, 4, 8, 1, false, true));
    }

    @Test
    void load_trimsKeysAndValues() {
        var style = FormatStyleLoader.formatStyleLoader()
                                     .load(Map.of(" column_limit ", " 72 "));

        assertThat(style.columnLimit()).isEqualTo(72);
    }

    @Test
    void load_ignoresUnknownKeys() {
        var style = FormatStyleLoader.formatStyleLoader()
                                     .load(Map.of("try_wrap_long_lines", "true", "wrap_spaces", "2"));

        assertThat(style).isEqualTo(FormatStyle.defaultStyle()
                                               .withWrapSpaces(2));
    }

    @Test
    void load_rejectsNonIntegerValue() {
        assertThatThrownBy(() -> FormatStyleLoader.formatStyleLoader()
                                                  .load(Map.of("column_limit", "wide")))
                .isInstanceOf(FormattingException.class)
                .hasMessage("Invalid value 'wide' for style setting column_limit: expected an integer");
    }

    @Test
    void load_rejectsNonBooleanValue() {
        assertThatThrownBy(() -> FormatStyleLoader.formatStyleLoader()
                                                  .load(Map.of("wrap_end_else_clauses", "yes")))
                .isInstanceOfSatisfying(FormattingException.class,
                                        e -> assertThat(e.error()).isInstanceOf(FormattingError.InvalidStyleValue.class));
    }

    @Test
    void load_rejectsNullValue() {
        var settings = new HashMap<String, String>();
        settings.put("column_limit", null);

        assertThatThrownBy(() -> FormatStyleLoader.formatStyleLoader()
                                                  .load(settings))
                .isInstanceOfSatisfying(FormattingException.class,
                                        e -> assertThat(e.error()).isInstanceOf(FormattingError.InvalidStyleValue.class))
                .hasMessage("Invalid value 'null' for style setting column_limit: keys and values must not be null");
    }

    @Test
    void load_rejectsNullKey() {
        var settings = new HashMap<String, String>();
        settings.put(null, "80");
        settings.put("column_limit", "100");

        assertThatThrownBy(() -> FormatStyleLoader.formatStyleLoader()
                                                  .load(settings))
                .isInstanceOfSatisfying(FormattingException.class,
                                        e -> assertThat(e.error()).isInstanceOf(FormattingError.InvalidStyleValue.class));
    }

    @Test
    void load_rejectsOutOfRangeValue() {
        assertThatThrownBy(() -> FormatStyleLoader.formatStyleLoader()
                                                  .load(Map.of("indentation_spaces", "-2")))
                .isInstanceOf(FormattingException.class)
                .hasMessageContaining("must not be negative");
    }

    @Test
    void load_readsPropertiesFile() throws IOException {
        var file = tempDir.resolve("vfmt.properties");
        Files.writeString(file, """
                # project style
                column_limit = 90
                spaces_before_comment: 3
                compact_indexing_and_selections=false
                """);

        var style = FormatStyleLoader.formatStyleLoader()
                                     .load(file);

        assertThat(style.columnLimit()).isEqualTo(90);
        assertThat(style.spacesBeforeComment()).isEqualTo(3);
        assertThat(style.compactIndexingAndSelections()).isFalse();
        assertThat(style.wrapSpaces()).isEqualTo(4);
    }

    @Test
    void load_readsStream() {
        var input = new ByteArrayInputStream("wrap_spaces=6\n".getBytes(StandardCharsets.UTF_8));

        var style = FormatStyleLoader.formatStyleLoader()
                                     .load(input, "classpath:style.properties");

        assertThat(style.wrapSpaces()).isEqualTo(6);
    }

    @Test
    void load_reportsMissingFile() {
        var missing = tempDir.resolve("missing.properties");

        assertThatThrownBy(() -> FormatStyleLoader.formatStyleLoader()
                                                  .load(missing))
                .isInstanceOf(FormattingException.class)
                .hasMessageContaining(missing.toString())
                .hasCauseInstanceOf(NoSuchFileException.class);
    }
}
