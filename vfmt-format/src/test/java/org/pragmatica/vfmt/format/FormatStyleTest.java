package org.pragmatica.vfmt.format;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FormatStyleTest {

    @Test
    void defaultStyle_hasDocumentedValues() {
        var style = FormatStyle.defaultStyle();

        assertThat(style.columnLimit()).isEqualTo(100);
        assertThat(style.indentationSpaces()).isEqualTo(2);
        assertThat(style.wrapSpaces()).isEqualTo(4);
        assertThat(style.spacesBeforeComment()).isEqualTo(2);
        assertThat(style.compactIndexingAndSelections()).isTrue();
        assertThat(style.wrapEndElseClauses()).isFalse();
    }

    @Test
    void withMethods_changeOnlyTheirField() {
        var style = FormatStyle.defaultStyle()
                               .withColumnLimit(80)
                               .withSpacesBeforeComment(1)
                               .withWrapEndElseClauses(true);

        assertThat(style).isEqualTo(new FormatStyle(80, 2, 4, 1, true, true));
        assertThat(FormatStyle.defaultStyle()
                              .columnLimit()).isEqualTo(100);
    }

    @Test
    void constructor_rejectsNonPositiveColumnLimit() {
        assertThatThrownBy(() -> FormatStyle.defaultStyle()
                                            .withColumnLimit(0))
                .isInstanceOf(FormattingException.class)
                .hasMessageContaining("column_limit")
                .hasMessageContaining("must be positive");
    }

    @Test
    void constructor_rejectsNegativeSpacing() {
        assertThatThrownBy(() -> FormatStyle.defaultStyle()
                                            .withSpacesBeforeComment(-1))
                .isInstanceOfSatisfying(FormattingException.class,
                                        e -> assertThat(e.error()).isEqualTo(
                                                FormattingError.invalidStyleValue("spaces_before_comment",
                                                                                  "-1",
                                                                                  "must not be negative")));
    }

    @Test
    void constructor_acceptsZeroIndentation() {
        assertThat(FormatStyle.defaultStyle()
                              .withIndentationSpaces(0)
                              .withWrapSpaces(0)
                              .indentationSpaces()).isZero();
    }
}
