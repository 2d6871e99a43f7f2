package com.attribute.resolution.decision;

import com.attribute.resolution.aggregation.CandidateSet;
import com.attribute.resolution.core.model.AttributeDescriptor;
import com.attribute.resolution.core.model.EntityId;
import com.attribute.resolution.core.model.ReferenceVocabulary;
import com.attribute.resolution.core.model.ResolutionMode;
import com.attribute.resolution.core.model.ResolvedRecord;
import com.attribute.resolution.core.model.UncertaintyCondition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class UncertaintyClassifierTest {

    private static final EntityId ANIMAL = EntityId.of("S1", "A1");

    private UncertaintyClassifier classifier;
    private AttributeResolver resolver;

    @BeforeEach
    void setUp() {
        ReferenceVocabulary routes = ReferenceVocabulary.of("ROUTE", List.of("ORAL", "DERMAL", "SUBCUTANEOUS"));
        classifier = new UncertaintyClassifier(AttributeDescriptor.ROUTE, routes);
        resolver = new AttributeResolver(ResolutionMode.ENTITY_AND_GROUP_LEVEL);
    }

    private List<UncertaintyCondition> classify(List<String> fine, List<String> coarse) {
        CandidateSet candidates = new CandidateSet(ANIMAL, fine, coarse);
        return classifier.classify(candidates, resolver.resolve(candidates));
    }

    @Nested
    @DisplayName("Unresolved entities")
    class Unresolved {

        @Test
        @DisplayName("Should report multiple fine values before anything else")
        void multipleFineValues() {
            assertEquals(List.of(UncertaintyCondition.MULTIPLE_FINE_VALUES),
                    classify(List.of("ORAL", "DERMAL"), List.of("ORAL", "DERMAL")));
        }

        @Test
        @DisplayName("Should report multiple coarse values without fine values")
        void multipleCoarseValues() {
            assertEquals(List.of(UncertaintyCondition.MULTIPLE_COARSE_VALUES),
                    classify(List.of(), List.of("ORAL", "DERMAL")));
        }

        @Test
        @DisplayName("Should report missing values")
        void noValues() {
            assertEquals(List.of(UncertaintyCondition.NO_VALUES), classify(List.of(), List.of()));
        }
    }

    @Nested
    @DisplayName("Resolved entities")
    class Resolved {

        @Test
        @DisplayName("Should report nothing for a valid consistent value")
        void validValue() {
            assertTrue(classify(List.of("ORAL"), List.of("ORAL")).isEmpty());
        }

        @Test
        @DisplayName("Should compare with the vocabulary case-insensitively")
        void vocabularyCaseInsensitive() {
            assertTrue(classify(List.of("oral"), List.of()).isEmpty());
        }

        @Test
        @DisplayName("Should report an invalid fine value")
        void invalidFineValue() {
            assertEquals(List.of(UncertaintyCondition.INVALID_FINE_VALUE), classify(List.of("BY MOUTH"), List.of()));
        }

        @Test
        @DisplayName("Should report an invalid coarse value")
        void invalidCoarseValue() {
            assertEquals(List.of(UncertaintyCondition.INVALID_COARSE_VALUE), classify(List.of(), List.of("INHALED")));
        }

        @Test
        @DisplayName("Should report a mismatch between sources")
        void sourceMismatch() {
            assertEquals(List.of(UncertaintyCondition.SOURCE_MISMATCH),
                    classify(List.of("ORAL"), List.of("DERMAL")));
        }

        @Test
        @DisplayName("Should accept fine values that are a subset of the coarse values")
        void fineSubsetOfCoarse() {
            assertTrue(classify(List.of("ORAL"), List.of("ORAL", "DERMAL")).isEmpty());
        }

        @Test
        @DisplayName("Should combine an invalid value with a mismatch")
        void invalidAndMismatch() {
            assertEquals(List.of(UncertaintyCondition.INVALID_FINE_VALUE, UncertaintyCondition.SOURCE_MISMATCH),
                    classify(List.of("BY MOUTH"), List.of("ORAL")));
        }
    }

    @Test
    @DisplayName("Should report a mismatch for unresolved entities too")
    void mismatchWhenUnresolved() {
        assertEquals(List.of(UncertaintyCondition.MULTIPLE_FINE_VALUES, UncertaintyCondition.SOURCE_MISMATCH),
                classify(List.of("ORAL", "DERMAL"), List.of("ORAL")));
    }

    @Nested
    @DisplayName("Rendering")
    class Rendering {

        @Test
        @DisplayName("Should prefix the attribute name")
        void singleCondition() {
            CandidateSet candidates = new CandidateSet(ANIMAL, List.of("ORAL", "DERMAL"), List.of());
            ResolvedRecord record = classifier.annotate(candidates, resolver.resolve(candidates));

            assertEquals("ROUTE: Multiple values for EXROUTE found", record.reason());
        }

        @Test
        @DisplayName("Should join conditions with an ampersand")
        void combinedConditions() {
            CandidateSet candidates = new CandidateSet(ANIMAL, List.of("BY MOUTH"), List.of("ORAL"));
            ResolvedRecord record = classifier.annotate(candidates, resolver.resolve(candidates));

            assertEquals("ROUTE: EXROUTE does not contain a valid CT value"
                    + " & Mismatch in values of TS parameter ROUTE and EXROUTE", record.reason());
            assertEquals("BY MOUTH", record.value());
        }

        @Test
        @DisplayName("Should leave a certain record without reason")
        void noReason() {
            CandidateSet candidates = new CandidateSet(ANIMAL, List.of("ORAL"), List.of("ORAL"));
            ResolvedRecord record = classifier.annotate(candidates, resolver.resolve(candidates));

            assertFalse(record.hasReason());
        }

        @Test
        @DisplayName("Should use study design wording at group level")
        void studyDesignWording() {
            UncertaintyClassifier designs = new UncertaintyClassifier(AttributeDescriptor.STUDY_DESIGN,
                    ReferenceVocabulary.of("DESIGN", List.of("PARALLEL")));
            AttributeResolver groupResolver = new AttributeResolver(ResolutionMode.GROUP_LEVEL_ONLY);
            CandidateSet candidates = new CandidateSet(EntityId.ofGroup("S1"), List.of(), List.of());

            ResolvedRecord record = designs.annotate(candidates, groupResolver.resolve(candidates));

            assertEquals("SDESIGN: TS parameter SDESIGN is missing", record.reason());
        }
    }
}
