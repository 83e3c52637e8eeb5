package org.pragmatica.vfmt.format;

import org.pragmatica.vfmt.text.TextStructure;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Annotates several source units independently. A unit whose input violates the annotation
 * contract is reported as {@link UnitOutcome.Failed}; the remaining units are still annotated.
 */
public final class AnnotationBatch {
    private static final Logger log = LoggerFactory.getLogger(AnnotationBatch.class);

    private final FormattingAnnotator annotator;

    private AnnotationBatch(FormattingAnnotator annotator) {
        this.annotator = annotator;
    }

    public static AnnotationBatch annotationBatch(FormattingAnnotator annotator) {
        return new AnnotationBatch(Objects.requireNonNull(annotator, "annotator"));
    }

    public static AnnotationBatch annotationBatch(FormatStyle style) {
        return new AnnotationBatch(FormattingAnnotator.formattingAnnotator(style));
    }

    /**
     * Named unit of work, typically one source file.
     */
    public record SourceUnit(String name, TextStructure structure) {
        public SourceUnit {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(structure, "structure");
        }

        public static SourceUnit sourceUnit(String name, TextStructure structure) {
            return new SourceUnit(name, structure);
        }
    }

    /**
     * Result of annotating one unit.
     */
    public sealed interface UnitOutcome {
        String name();

        record Annotated(String name, List<FormatToken> tokens) implements UnitOutcome {
            public Annotated {
                tokens = List.copyOf(tokens);
            }
        }

        record Failed(String name, FormattingError error) implements UnitOutcome {}

        default boolean isAnnotated() {
            return this instanceof Annotated;
        }
    }

    /**
     * Annotate all units in order.
     *
     * @return one outcome per unit, in the same order
     */
    public List<UnitOutcome> annotateAll(List<SourceUnit> units) {
        var outcomes = new ArrayList<UnitOutcome>(units.size());
        for (var unit : units) {
            outcomes.add(annotate(unit));
        }
        var failed = outcomes.stream()
                             .filter(outcome -> !outcome.isAnnotated())
                             .count();
        log.debug("Annotated {} units, {} failed", units.size(), failed);
        return outcomes;
    }

    public UnitOutcome annotate(SourceUnit unit) {
        try {
            return new UnitOutcome.Annotated(unit.name(), annotator.annotate(unit.structure()));
        } catch (FormattingException e) {
            log.warn("Unit {} cannot be annotated: {}", unit.name(), e.getMessage());
            return new UnitOutcome.Failed(unit.name(), e.error());
        }
    }
}
