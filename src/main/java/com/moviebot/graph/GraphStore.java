package com.moviebot.graph;

import com.moviebot.graph.GraphModels.GraphFilter;
import com.moviebot.graph.GraphModels.GraphRow;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only access to the movie knowledge graph. Implementations may throw unchecked exceptions
 * on any failure; callers decide whether to skip the query or fail open.
 */
public interface GraphStore {

    /**
     * Movies sharing a value of {@code predicate} with any of the seeds, one row per shared value.
     */
    List<GraphRow> sharedPropertyMatches(Set<String> seeds, String predicate, GraphFilter filter, Set<String> exclude, int limit);

    /**
     * Movies having every (predicate, value) pair of {@code required}.
     */
    List<GraphRow> propertyMatches(Map<String, String> required, GraphFilter filter, Set<String> exclude, int limit);

    /**
     * The subset of {@code entityIds} that satisfies {@code filter}.
     */
    Set<String> verifyMembership(Set<String> entityIds, GraphFilter filter);

    Optional<String> imageOf(String entityId);
}
