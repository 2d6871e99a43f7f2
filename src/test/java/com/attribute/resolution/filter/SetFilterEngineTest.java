package com.attribute.resolution.filter;

import com.attribute.resolution.core.model.EntityId;
import com.attribute.resolution.core.model.ResolvedRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class SetFilterEngineTest {

    private final SetFilterEngine engine = new SetFilterEngine();

    private static ResolvedRecord fine(String study, String animal, String value) {
        return ResolvedRecord.resolved(EntityId.of(study, animal), value,
                com.attribute.resolution.core.model.ValueSource.FINE);
    }

    private static ResolvedRecord coarse(String study, String animal, String value) {
        return ResolvedRecord.resolved(EntityId.of(study, animal), value,
                com.attribute.resolution.core.model.ValueSource.COARSE);
    }

    private static ResolvedRecord unresolved(String study, String animal, String reason) {
        return ResolvedRecord.unresolved(EntityId.of(study, animal)).withReason(reason);
    }

    private static List<String> animals(List<ResolvedRecord> records) {
        return records.stream().map(r -> r.id().entityKey()).toList();
    }

    @Test
    @DisplayName("Should return every record when no target value is given")
    void inactiveCriteriaKeepsEverything() {
        List<ResolvedRecord> records = List.of(fine("S1", "A1", "ORAL"), unresolved("S1", "A2", "r"));

        assertEquals(records, engine.filter(records, FilterCriteria.none()));
    }

    @Test
    @DisplayName("Should ignore blank target values")
    void blankTargetsAreIgnored() {
        FilterCriteria criteria = new FilterCriteria(List.of(" ", ""), true, false, false);

        assertFalse(criteria.isActive());
    }

    @Nested
    @DisplayName("Matching")
    class Matching {

        @Test
        @DisplayName("Should match case-insensitively and keep input order")
        void caseInsensitiveMatch() {
            List<ResolvedRecord> records = List.of(
                    fine("S1", "A2", "oral"),
                    fine("S1", "A1", "DERMAL"),
                    coarse("S2", "B1", "Oral"));

            List<ResolvedRecord> result = engine.filter(records,
                    new FilterCriteria(List.of("ORAL"), false, false, false));

            assertEquals(List.of("A2", "B1"), animals(result));
        }

        @Test
        @DisplayName("Should never match unresolved entities")
        void unresolvedNeverMatch() {
            List<ResolvedRecord> records = List.of(unresolved("S1", "A1", "ROUTE: missing"));

            assertTrue(engine.filter(records, new FilterCriteria(List.of("ORAL"), false, false, false)).isEmpty());
        }

        @Test
        @DisplayName("Should match an unresolved study on one of its alternative values when not exclusive")
        void unresolvedStudyMatchesAlternative() {
            EntityId s2 = EntityId.ofGroup("S2");
            List<ResolvedRecord> records = List.of(
                    ResolvedRecord.resolved(EntityId.ofGroup("S1"), "PARALLEL",
                            com.attribute.resolution.core.model.ValueSource.COARSE),
                    ResolvedRecord.unresolved(s2).withReason("SDESIGN: Multiple TS parameters SDESIGN found"));
            Map<EntityId, List<String>> alternatives = Map.of(s2, List.of("parallel", "CROSSOVER"));

            List<ResolvedRecord> inclusive = engine.filter(records,
                    new FilterCriteria(List.of("PARALLEL"), false, false, false), alternatives);
            List<ResolvedRecord> exclusive = engine.filter(records,
                    new FilterCriteria(List.of("PARALLEL"), true, false, false), alternatives);

            assertEquals(List.of("S1", "S2"), inclusive.stream().map(r -> r.id().groupKey()).toList());
            assertNull(inclusive.get(1).value());
            assertEquals(List.of("S1"), exclusive.stream().map(r -> r.id().groupKey()).toList());
        }
    }

    @Nested
    @DisplayName("Exclusively")
    class Exclusively {

        @Test
        @DisplayName("Should drop a study exhibiting a value outside the target set")
        void dropsStudyWithOtherValues() {
            List<ResolvedRecord> records = List.of(
                    fine("S2", "B1", "SUBCUTANEOUS"),
                    fine("S2", "B2", "ORAL"));

            List<ResolvedRecord> result = engine.filter(records,
                    new FilterCriteria(List.of("SUBCUTANEOUS"), true, false, false));

            assertTrue(result.isEmpty());
        }

        @Test
        @DisplayName("Should keep studies whose resolved values are all targets")
        void keepsPureStudy() {
            List<ResolvedRecord> records = List.of(
                    fine("S1", "A1", "ORAL"),
                    fine("S2", "B1", "ORAL"),
                    fine("S2", "B2", "DERMAL"));

            List<ResolvedRecord> result = engine.filter(records,
                    new FilterCriteria(List.of("ORAL"), true, false, false));

            assertEquals(List.of("A1"), animals(result));
        }

        @Test
        @DisplayName("Should not count unresolved entities against a study")
        void ignoresUnresolved() {
            List<ResolvedRecord> records = List.of(
                    fine("S1", "A1", "ORAL"),
                    unresolved("S1", "A2", "ROUTE: multiple"));

            List<ResolvedRecord> result = engine.filter(records,
                    new FilterCriteria(List.of("ORAL"), true, false, false));

            assertEquals(List.of("A1"), animals(result));
        }

        @ParameterizedTest
        @ValueSource(strings = {"ORAL", "DERMAL", "SUBCUTANEOUS", "ORAL;DERMAL", "INHALATION"})
        @DisplayName("Should never match more entities than the non-exclusive filter")
        void monotonic(String targets) {
            List<ResolvedRecord> records = List.of(
                    fine("S1", "A1", "ORAL"),
                    fine("S1", "A2", "DERMAL"),
                    coarse("S1", "A3", "ORAL"),
                    fine("S2", "B1", "SUBCUTANEOUS"),
                    fine("S2", "B2", "ORAL"),
                    fine("S3", "C1", "DERMAL"));
            List<String> targetValues = List.of(targets.split(";"));

            int inclusive = engine.filter(records, new FilterCriteria(targetValues, false, false, false)).size();
            int exclusive = engine.filter(records, new FilterCriteria(targetValues, true, false, false)).size();

            assertTrue(exclusive <= inclusive);
        }
    }

    @Nested
    @DisplayName("Match all")
    class MatchAll {

        @Test
        @DisplayName("Should keep a study covering every target value, including coarse-resolved animals")
        void fullCoverage() {
            List<ResolvedRecord> records = List.of(
                    fine("S1", "A1", "ORAL"),
                    fine("S1", "A2", "ORAL GAVAGE"),
                    coarse("S1", "A3", "ORAL"));

            List<ResolvedRecord> result = engine.filter(records,
                    new FilterCriteria(List.of("ORAL", "ORAL GAVAGE"), false, true, false));

            assertEquals(List.of("A1", "A2", "A3"), animals(result));
        }

        @Test
        @DisplayName("Should drop studies covering only part of the target values")
        void partialCoverage() {
            List<ResolvedRecord> records = List.of(
                    fine("S1", "A1", "ORAL"),
                    fine("S1", "A2", "DERMAL"),
                    fine("S2", "B1", "ORAL"),
                    fine("S2", "B2", "ORAL"));

            List<ResolvedRecord> result = engine.filter(records,
                    new FilterCriteria(List.of("ORAL", "DERMAL"), false, true, false));

            assertEquals(List.of("A1", "A2"), animals(result));

            Map<String, Set<String>> coverage = new HashMap<>();
            for (ResolvedRecord record : result) {
                coverage.computeIfAbsent(record.id().groupKey(), k -> new HashSet<>()).add(record.value());
            }
            coverage.values().forEach(values -> assertEquals(Set.of("ORAL", "DERMAL"), values));
        }

        @Test
        @DisplayName("Should have no effect with a single target value")
        void singleTarget() {
            List<ResolvedRecord> records = List.of(fine("S1", "A1", "ORAL"), fine("S2", "B1", "DERMAL"));

            List<ResolvedRecord> result = engine.filter(records,
                    new FilterCriteria(List.of("ORAL"), false, true, false));

            assertEquals(List.of("A1"), animals(result));
        }

        @Test
        @DisplayName("Should count duplicate target spellings once")
        void duplicateTargets() {
            List<ResolvedRecord> records = List.of(fine("S1", "A1", "ORAL"));

            List<ResolvedRecord> result = engine.filter(records,
                    new FilterCriteria(List.of("ORAL", "oral"), false, true, false));

            assertEquals(List.of("A1"), animals(result));
        }
    }

    @Nested
    @DisplayName("Include uncertain")
    class IncludeUncertain {

        @Test
        @DisplayName("Should add every entity with a reason")
        void addsUncertain() {
            List<ResolvedRecord> records = List.of(
                    fine("S1", "A1", "ORAL"),
                    unresolved("S1", "A2", "ROUTE: Multiple values for EXROUTE found"),
                    fine("S1", "A3", "DERMAL"));

            List<ResolvedRecord> result = engine.filter(records,
                    new FilterCriteria(List.of("ORAL"), false, false, true));

            assertEquals(List.of("A1", "A2"), animals(result));
        }

        @Test
        @DisplayName("Should keep uncertain entities of a study dropped as non-exclusive")
        void bypassesExclusively() {
            List<ResolvedRecord> records = List.of(
                    fine("S2", "B1", "SUBCUTANEOUS"),
                    fine("S2", "B2", "ORAL").withReason("ROUTE: Mismatch in values of TS parameter ROUTE and EXROUTE"));

            List<ResolvedRecord> result = engine.filter(records,
                    new FilterCriteria(List.of("SUBCUTANEOUS"), true, false, true));

            assertEquals(List.of("B2"), animals(result));
            assertTrue(result.get(0).hasReason());
        }

        @Test
        @DisplayName("Should emit a matched uncertain entity once, with its reason")
        void matchedAndUncertain() {
            ResolvedRecord invalid = fine("S1", "A1", "ORAL").withReason("ROUTE: mismatch");
            List<ResolvedRecord> records = List.of(invalid);

            List<ResolvedRecord> result = engine.filter(records,
                    new FilterCriteria(List.of("ORAL"), false, false, true));

            assertEquals(List.of(invalid), result);
        }
    }
}
