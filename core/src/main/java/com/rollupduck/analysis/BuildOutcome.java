package com.rollupduck.analysis;

import java.util.Objects;

/**
 * Result of building a summary specification for one query.
 */
public sealed interface BuildOutcome permits BuildOutcome.Candidate, BuildOutcome.Rejected {

    String queryId();

    /**
     * The query can be served by a summary table described by {@code spec}.
     */
    record Candidate(SummarySpec spec, Classification classification) implements BuildOutcome {
        public Candidate {
            Objects.requireNonNull(spec, "spec must not be null");
            Objects.requireNonNull(classification, "classification must not be null");
        }

        @Override
        public String queryId() {
            return classification.query().id();
        }
    }

    /**
     * The query is pinned to the main table.
     */
    record Rejected(String queryId, RejectionReason reason, String detail) implements BuildOutcome {
        public Rejected {
            Objects.requireNonNull(queryId, "queryId must not be null");
            Objects.requireNonNull(reason, "reason must not be null");
        }
    }
}
