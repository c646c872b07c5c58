package com.moviebot.graph;

import com.moviebot.session.SessionModels.Constraint;
import com.moviebot.session.SessionModels.ConstraintKind;

import java.util.Map;

public class GraphModels {

    /**
     * One match returned by a candidate query. {@code matchedValue} is the label of the shared
     * property value when the query has one; {@code rating} is absent when the movie has none.
     */
    public record GraphRow(String entityId, String matchedValue, Double rating) {}

    /**
     * Hard predicates pushed into graph queries: typed constraints, negated (predicate, value)
     * pairs and the entity type every recommendable result must have.
     */
    public record GraphFilter(Map<ConstraintKind, Constraint> constraints,
                              Map<String, String> negatedProperties,
                              String requiredTypeId) {
        public GraphFilter {
            constraints = constraints == null ? Map.of() : Map.copyOf(constraints);
            negatedProperties = negatedProperties == null ? Map.of() : Map.copyOf(negatedProperties);
        }
    }
}
