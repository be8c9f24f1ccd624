package com.rollupduck.analysis;

import com.rollupduck.exception.QueryAnalysisException;
import com.rollupduck.query.AggregateItem;
import com.rollupduck.query.Query;
import com.rollupduck.query.QueryValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Builds a candidate {@link SummarySpec} for one query, or rejects it.
 *
 * <p>Steps:
 * <ol>
 *   <li>dimensions = GROUP BY columns plus DIMENSION-classified columns</li>
 *   <li>constant filters = CONSTANT-classified {@code column -> value} pairs</li>
 *   <li>aggregates = primitives decomposed from each SELECT aggregate, plus RowCount</li>
 *   <li>the {@link CardinalityGuard} may reject the dimension set</li>
 * </ol>
 *
 * <p>The builder is stateless apart from its guard and may be called from
 * several threads at once.
 */
public class SpecificationBuilder {

    private static final Logger logger = LoggerFactory.getLogger(SpecificationBuilder.class);

    private final FilterClassifier classifier;
    private final CardinalityGuard guard;

    public SpecificationBuilder(CardinalityGuard guard) {
        this(new FilterClassifier(), guard);
    }

    public SpecificationBuilder(FilterClassifier classifier, CardinalityGuard guard) {
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
        this.guard = Objects.requireNonNull(guard, "guard must not be null");
    }

    /**
     * Validates and classifies the query, then builds its candidate. Queries
     * built in code get the same checks as parsed ones.
     *
     * @param query the query
     * @return the outcome
     * @throws QueryAnalysisException if the query is malformed or cannot be classified
     */
    public BuildOutcome build(Query query) {
        Objects.requireNonNull(query, "query must not be null");
        try {
            QueryValidator.validate(query);
        } catch (QueryAnalysisException e) {
            throw e.getQueryId() == null ? e.withQueryId(query.id()) : e;
        }
        if (!query.isAggregation()) {
            return reject(query, RejectionReason.NOT_AGGREGATED, "query has no aggregate and no GROUP BY");
        }
        return build(classifier.classify(query));
    }

    /**
     * Builds the candidate from an existing classification.
     *
     * @param classification the classified query
     * @return the outcome
     */
    public BuildOutcome build(Classification classification) {
        Query query = classification.query();
        if (!query.isAggregation()) {
            return reject(query, RejectionReason.NOT_AGGREGATED, "query has no aggregate and no GROUP BY");
        }

        List<AggregatePrimitive> primitives = new ArrayList<>();
        primitives.add(AggregatePrimitive.rowCount());
        for (AggregateItem item : query.aggregates()) {
            Optional<List<AggregatePrimitive>> decomposed = AggregatePrimitive.decompose(item);
            if (decomposed.isEmpty()) {
                return reject(query, RejectionReason.NON_DECOMPOSABLE_AGGREGATE, item.label());
            }
            primitives.addAll(decomposed.get());
        }

        Signature signature = new Signature(classification.requiredDimensions(),
            classification.requiredConstants());
        if (guard.rejects(signature.dimensions(), signature.constants())) {
            return reject(query, RejectionReason.HIGH_CARDINALITY, "dimensions " + signature.dimensions());
        }

        SummarySpec spec = SummarySpec.candidate(signature, primitives, query.id());
        logger.debug("Candidate for {}: {}", query.id(), spec);
        return new BuildOutcome.Candidate(spec, classification);
    }

    private static BuildOutcome reject(Query query, RejectionReason reason, String detail) {
        logger.debug("Rejected {}: {} ({})", query.id(), reason, detail);
        return new BuildOutcome.Rejected(query.id(), reason, detail);
    }
}
