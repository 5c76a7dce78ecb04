package com.elclab.components.service;

import com.elclab.components.domain.CandidateRecord;
import com.elclab.components.domain.Component;
import com.elclab.components.domain.ComponentUpdate;
import com.elclab.components.domain.ReconcileOutcome;
import com.elclab.components.repository.ComponentRepository;
import com.elclab.components.repository.RepositoryException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * ReconciliationEngine - decides and applies the effect of one imported
 * record on the catalog.
 *
 * <p>RULES (first match wins), for candidate C and stored component E
 * with the same identifier:
 * <ol>
 *   <li>E absent: insert C with quantity 0. {@link ReconcileOutcome#INSERTED}</li>
 *   <li>C.price &gt; E.price: overwrite price and description with C's,
 *       even when C has no description. {@link ReconcileOutcome#OVERWRITTEN}</li>
 *   <li>Equal prices, E has no description, C has one: fill in the
 *       description only. {@link ReconcileOutcome#OVERWRITTEN}</li>
 *   <li>Otherwise nothing is written. {@link ReconcileOutcome#UNCHANGED}</li>
 * </ol>
 * Prices are compared numerically ({@code 0.05} equals {@code 0.050}).
 *
 * <p>The engine holds no per-batch state. Each call does exactly one store
 * read and at most one store write, so records of a batch reconciled in
 * file order see the effects of the records before them.
 */
public class ReconciliationEngine {

    private static final Logger log = LoggerFactory.getLogger(ReconciliationEngine.class);

    private final ComponentRepository repository;

    public ReconciliationEngine(ComponentRepository repository) {
        if (repository == null) {
            throw new IllegalArgumentException("ComponentRepository must not be null.");
        }
        this.repository = repository;
    }

    /**
     * Reconciles one candidate against the store.
     *
     * @param candidate a parsed, valid record
     * @return what happened, with the component as now stored
     * @throws RepositoryException if the store read or write fails
     */
    public Result reconcile(CandidateRecord candidate) {
        Objects.requireNonNull(candidate, "candidate");

        Component existing = repository.findByIdentifier(candidate.getIdentifier()).orElse(null);
        Decision decision = decide(existing, candidate);

        switch (decision.getOutcome()) {
            case INSERTED -> {
                Component inserted = repository.insert(candidate.toComponent());
                log.debug("'{}' inserted at price {}.",
                        candidate.getIdentifier(), candidate.getPrice().toPlainString());
                return new Result(ReconcileOutcome.INSERTED, inserted);
            }
            case OVERWRITTEN -> {
                Component updated = repository
                        .update(candidate.getIdentifier(), decision.getUpdate())
                        .orElseThrow(() -> new RepositoryException(
                                "Component '" + candidate.getIdentifier()
                                        + "' disappeared during reconciliation."));
                log.debug("'{}' overwritten with {}.", candidate.getIdentifier(), decision.getUpdate());
                return new Result(ReconcileOutcome.OVERWRITTEN, updated);
            }
            default -> {
                log.trace("'{}' unchanged.", candidate.getIdentifier());
                return new Result(ReconcileOutcome.UNCHANGED, existing);
            }
        }
    }

    /**
     * Pure decision function: which outcome applies and, for an overwrite,
     * which fields to write. Does not touch the store.
     *
     * @param existing  stored component, or null if none
     * @param candidate incoming record
     * @return the decision; {@link Decision#getUpdate()} is non-null only
     *         for {@link ReconcileOutcome#OVERWRITTEN}
     */
    public static Decision decide(Component existing, CandidateRecord candidate) {
        if (existing == null) {
            return new Decision(ReconcileOutcome.INSERTED, null);
        }

        int priceComparison = candidate.getPrice().compareTo(existing.getPrice());
        if (priceComparison > 0) {
            return new Decision(ReconcileOutcome.OVERWRITTEN,
                    ComponentUpdate.priceAndDescription(
                            candidate.getDescription(), candidate.getPrice()));
        }
        if (priceComparison == 0 && !existing.hasDescription() && candidate.hasDescription()) {
            return new Decision(ReconcileOutcome.OVERWRITTEN,
                    ComponentUpdate.descriptionOnly(candidate.getDescription()));
        }
        return new Decision(ReconcileOutcome.UNCHANGED, null);
    }

    // -----------------------------------------------------------------------
    // NESTED TYPES
    // -----------------------------------------------------------------------

    /** Outcome plus the fields an overwrite writes. */
    public static final class Decision {

        private final ReconcileOutcome outcome;
        private final ComponentUpdate  update;

        Decision(ReconcileOutcome outcome, ComponentUpdate update) {
            this.outcome = outcome;
            this.update  = update;
        }

        public ReconcileOutcome getOutcome() { return outcome; }
        public ComponentUpdate getUpdate()   { return update; }

        @Override
        public String toString() {
            return "Decision{" + outcome + (update == null ? "" : ", " + update) + "}";
        }
    }

    /** Outcome of one reconciliation and the component as it is now stored. */
    public static final class Result {

        private final ReconcileOutcome outcome;
        private final Component        component;

        Result(ReconcileOutcome outcome, Component component) {
            this.outcome   = outcome;
            this.component = component;
        }

        public ReconcileOutcome getOutcome() { return outcome; }
        public Component getComponent()      { return component; }
    }
}
