package com.elclab.components.service;

import com.elclab.components.domain.CandidateRecord;
import com.elclab.components.domain.Component;
import com.elclab.components.domain.ComponentUpdate;
import com.elclab.components.domain.ReconcileOutcome;
import com.elclab.components.repository.ComponentRepository;
import com.elclab.components.repository.RepositoryException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Tests for {@link ReconciliationEngine}: the pure decision rules and the
 * store calls made for each outcome.
 */
@ExtendWith(MockitoExtension.class)
class ReconciliationEngineTest {

    @Mock
    private ComponentRepository mockRepository;

    private ReconciliationEngine engine;

    @BeforeEach
    void setUp() {
        engine = new ReconciliationEngine(mockRepository);
    }

    private static Component stored(String identifier, String price, String description) {
        Component c = new Component(identifier, description, new BigDecimal(price), 3);
        c.setId(42);
        return c;
    }

    private static CandidateRecord candidate(String identifier, String price, String description) {
        return new CandidateRecord(identifier, new BigDecimal(price), description);
    }

    // ======================================================================
    // decide()
    // ======================================================================

    @Nested
    @DisplayName("decide() precedence rules")
    class DecideTests {

        @Test
        @DisplayName("unknown identifier is inserted")
        void absent_inserted() {
            ReconciliationEngine.Decision d =
                    ReconciliationEngine.decide(null, candidate("R1", "0.10", null));
            assertEquals(ReconcileOutcome.INSERTED, d.getOutcome());
            assertNull(d.getUpdate());
        }

        @Test
        @DisplayName("higher price overwrites price and description")
        void higherPrice_overwritesBoth() {
            ReconciliationEngine.Decision d = ReconciliationEngine.decide(
                    stored("R1", "0.10", "old"), candidate("R1", "0.20", "new"));
            assertEquals(ReconcileOutcome.OVERWRITTEN, d.getOutcome());
            assertEquals(ComponentUpdate.priceAndDescription("new", new BigDecimal("0.20")),
                    d.getUpdate());
        }

        @Test
        @DisplayName("higher price without description clears the stored description")
        void higherPrice_absentDescription_clears() {
            ReconciliationEngine.Decision d = ReconciliationEngine.decide(
                    stored("R1", "0.10", "old"), candidate("R1", "0.20", null));
            assertEquals(ReconcileOutcome.OVERWRITTEN, d.getOutcome());
            assertTrue(d.getUpdate().isDescriptionSet());
            assertNull(d.getUpdate().getDescription());
        }

        @Test
        @DisplayName("R10K: equal price fills a missing description only")
        void equalPrice_fillsDescription() {
            ReconciliationEngine.Decision d = ReconciliationEngine.decide(
                    stored("R10K", "0.05", null), candidate("R10K", "0.05", "10k ohm resistor"));
            assertEquals(ReconcileOutcome.OVERWRITTEN, d.getOutcome());
            assertEquals(ComponentUpdate.descriptionOnly("10k ohm resistor"), d.getUpdate());
            assertNull(d.getUpdate().getPrice());
        }

        @Test
        @DisplayName("C1: lower price leaves the component unchanged")
        void lowerPrice_unchanged() {
            ReconciliationEngine.Decision d = ReconciliationEngine.decide(
                    stored("C1", "0.20", "100nF cap"), candidate("C1", "0.10", null));
            assertEquals(ReconcileOutcome.UNCHANGED, d.getOutcome());
            assertNull(d.getUpdate());
        }

        @ParameterizedTest(name = "[{index}] stored={0}/{1} candidate={2}/{3}")
        @CsvSource({
                "0.05,  desc,  0.05,  other",
                "0.05,  desc,  0.05,  ",
                "0.05,      ,  0.05,  ",
                "0.05,  desc,  0.050, other"
        })
        @DisplayName("equal prices never replace an existing description")
        void equalPrice_cases_unchanged(String storedPrice, String storedDesc,
                                        String candidatePrice, String candidateDesc) {
            ReconciliationEngine.Decision d = ReconciliationEngine.decide(
                    stored("X", storedPrice, storedDesc), candidate("X", candidatePrice, candidateDesc));
            assertEquals(ReconcileOutcome.UNCHANGED, d.getOutcome());
        }

        @Test
        @DisplayName("prices are compared numerically, not by scale")
        void numericComparison() {
            ReconciliationEngine.Decision d = ReconciliationEngine.decide(
                    stored("R1", "0.050", null), candidate("R1", "0.05", "resistor"));
            assertEquals(ReconcileOutcome.OVERWRITTEN, d.getOutcome());
            assertNull(d.getUpdate().getPrice());
        }
    }

    // ======================================================================
    // reconcile()
    // ======================================================================

    @Nested
    @DisplayName("reconcile() store interaction")
    class ReconcileTests {

        @Test
        @DisplayName("insert path writes the candidate with zero stock")
        void reconcile_inserts() {
            when(mockRepository.findByIdentifier("R1")).thenReturn(Optional.empty());
            when(mockRepository.insert(any(Component.class))).thenAnswer(inv -> {
                Component c = inv.getArgument(0);
                c.setId(7);
                return c;
            });

            ReconciliationEngine.Result result = engine.reconcile(candidate("R1", "0.10", "res"));

            assertEquals(ReconcileOutcome.INSERTED, result.getOutcome());
            assertEquals(7, result.getComponent().getId());
            assertEquals(0, result.getComponent().getQuantity());
            verify(mockRepository, never()).update(anyString(), any());
        }

        @Test
        @DisplayName("overwrite path issues exactly one update")
        void reconcile_overwrites() {
            Component existing = stored("R10K", "0.05", null);
            Component after = stored("R10K", "0.05", "10k ohm resistor");
            when(mockRepository.findByIdentifier("R10K")).thenReturn(Optional.of(existing));
            when(mockRepository.update(eq("R10K"), any(ComponentUpdate.class)))
                    .thenReturn(Optional.of(after));

            ReconciliationEngine.Result result =
                    engine.reconcile(candidate("R10K", "0.05", "10k ohm resistor"));

            assertEquals(ReconcileOutcome.OVERWRITTEN, result.getOutcome());
            assertEquals("10k ohm resistor", result.getComponent().getDescription());
            verify(mockRepository).update("R10K", ComponentUpdate.descriptionOnly("10k ohm resistor"));
            verify(mockRepository, never()).insert(any());
        }

        @Test
        @DisplayName("unchanged path does not write")
        void reconcile_unchanged_noWrite() {
            when(mockRepository.findByIdentifier("C1"))
                    .thenReturn(Optional.of(stored("C1", "0.20", "100nF cap")));

            ReconciliationEngine.Result result = engine.reconcile(candidate("C1", "0.10", null));

            assertEquals(ReconcileOutcome.UNCHANGED, result.getOutcome());
            verify(mockRepository).findByIdentifier("C1");
            verifyNoMoreInteractions(mockRepository);
        }

        @Test
        @DisplayName("store failure propagates as RepositoryException")
        void reconcile_storeFailure_propagates() {
            when(mockRepository.findByIdentifier("R1")).thenReturn(Optional.empty());
            when(mockRepository.insert(any(Component.class)))
                    .thenThrow(new RepositoryException("disk full"));

            assertThrows(RepositoryException.class,
                    () -> engine.reconcile(candidate("R1", "0.10", null)));
        }

        @Test
        @DisplayName("a component vanishing between read and write is a store error")
        void reconcile_vanished_throws() {
            when(mockRepository.findByIdentifier("R1"))
                    .thenReturn(Optional.of(stored("R1", "0.10", null)));
            when(mockRepository.update(eq("R1"), any(ComponentUpdate.class)))
                    .thenReturn(Optional.empty());

            assertThrows(RepositoryException.class,
                    () -> engine.reconcile(candidate("R1", "0.30", null)));
        }

        @Test
        @DisplayName("constructor rejects a null repository")
        void constructor_nullRepository_throws() {
            assertThrows(IllegalArgumentException.class, () -> new ReconciliationEngine(null));
        }
    }
}
