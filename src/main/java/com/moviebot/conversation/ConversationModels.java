package com.moviebot.conversation;

import com.moviebot.recommendation.RecommendationModels.Recommendation;
import com.moviebot.recommendation.RecommendationModels.RecommendationStatus;
import com.moviebot.session.SessionModels.ParsedIntent;

import java.util.List;

public class ConversationModels {
    public record TurnRequest(String message, ParsedIntent intent, Integer k) {}

    public record TurnResponse(TurnKind kind,
                               String reply,
                               RecommendationStatus status,
                               List<Recommendation> recommendations) {}

    public enum TurnKind { RESET, HELP, RECOMMENDATION, ACKNOWLEDGED, FAILED }
}
