package com.moviebot.conversation;

import com.moviebot.conversation.ConversationModels.TurnKind;
import com.moviebot.conversation.ConversationModels.TurnRequest;
import com.moviebot.conversation.ConversationModels.TurnResponse;
import com.moviebot.recommendation.RecommendationModels.Recommendation;
import com.moviebot.recommendation.RecommendationModels.RecommendationResult;
import com.moviebot.recommendation.RecommendationService;
import com.moviebot.session.Session;
import com.moviebot.session.SessionManager;
import com.moviebot.session.SessionModels.IntentType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * One user message in, one reply out. The message text is only inspected for the reset and help
 * commands; everything else arrives already parsed in the request's intent.
 */
@Service
public class ConversationService {
    private static final Logger log = LoggerFactory.getLogger(ConversationService.class);

    static final Set<String> RESET_COMMANDS = Set.of("clear", "reset", "start over");
    static final Set<String> HELP_COMMANDS = Set.of("help", "info");

    public static final String RESET_REPLY = "Okay, let's start fresh. What can I help you with?";
    public static final String NO_INPUT_REPLY = "I can give you recommendations if you tell me a movie you like!";
    public static final String NOTHING_FOUND_REPLY = "I searched based on your preferences but couldn't find any matching movies. "
            + "You could try broadening your search.";
    public static final String ACK_REPLY = "Got it, I'll keep that in mind.";
    public static final String FAILURE_REPLY = "I'm sorry, I had trouble finding recommendations. Please try again.";
    public static final String HELP_REPLY = """
            I can give you movie recommendations, e.g. 'Recommend a movie like The Lion King' \
            or 'I want a comedy movie from the 90s'. Ask for 'more' to get movies like the last ones I showed you. \
            You can type 'clear' to reset our conversation.""";

    private final SessionManager sessionManager;
    private final RecommendationService recommendationService;

    public ConversationService(SessionManager sessionManager, RecommendationService recommendationService) {
        this.sessionManager = sessionManager;
        this.recommendationService = recommendationService;
    }

    public TurnResponse handle(String userId, TurnRequest request) {
        String message = request.message() == null ? "" : request.message();
        String command = message.strip().toLowerCase(Locale.ROOT);
        int k = request.k() == null ? recommendationService.defaultResultSize() : request.k();
        if (k <= 0) throw new IllegalArgumentException("k must be positive");

        return sessionManager.withSession(userId, session -> {
            TurnResponse response;
            if (RESET_COMMANDS.contains(command)) {
                session.clear();
                response = new TurnResponse(TurnKind.RESET, RESET_REPLY, null, List.of());
            } else if (HELP_COMMANDS.contains(command)) {
                response = new TurnResponse(TurnKind.HELP, HELP_REPLY, null, List.of());
            } else {
                session.update(request.intent());
                boolean wantsRecommendations = request.intent() != null && request.intent().intent() == IntentType.RECOMMENDATION;
                response = wantsRecommendations
                        ? recommendationTurn(session, k)
                        : new TurnResponse(TurnKind.ACKNOWLEDGED, ACK_REPLY, null, List.of());
            }
            session.recordTurn(message, response.reply());
            return response;
        });
    }

    private TurnResponse recommendationTurn(Session session, int k) {
        RecommendationResult result;
        try {
            result = recommendationService.recommend(session, k);
        } catch (RuntimeException e) {
            log.error("Recommendation turn failed for {}", session.userId(), e);
            return new TurnResponse(TurnKind.FAILED, FAILURE_REPLY, null, List.of());
        }
        String reply = switch (result.status()) {
            case OK -> render(result.recommendations());
            case NO_INPUT -> NO_INPUT_REPLY;
            case NOTHING_FOUND -> NOTHING_FOUND_REPLY;
        };
        return new TurnResponse(TurnKind.RECOMMENDATION, reply, result.status(), result.recommendations());
    }

    static String render(List<Recommendation> recommendations) {
        StringBuilder sb = new StringBuilder("Here are a few recommendations:");
        for (Recommendation r : recommendations) {
            sb.append("\n- **").append(r.label()).append("**: ").append(r.reason());
        }
        return sb.toString();
    }
}
