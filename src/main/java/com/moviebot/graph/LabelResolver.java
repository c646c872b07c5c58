package com.moviebot.graph;

import java.util.Optional;

public interface LabelResolver {
    Optional<String> labelOf(String entityId);
}
