package com.moviebot;

import com.moviebot.conversation.ConversationModels.TurnKind;
import com.moviebot.conversation.ConversationModels.TurnRequest;
import com.moviebot.conversation.ConversationModels.TurnResponse;
import com.moviebot.conversation.ConversationService;
import com.moviebot.recommendation.RecommendationModels.Recommendation;
import com.moviebot.recommendation.RecommendationModels.RecommendationStatus;
import com.moviebot.session.SessionManager;
import com.moviebot.session.SessionModels.IntentType;
import com.moviebot.session.SessionModels.ParsedIntent;
import com.moviebot.session.SessionModels.SessionSnapshot;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class ConversationServiceTest {
    @Autowired
    private ConversationService conversationService;
    @Autowired
    private SessionManager sessionManager;

    private static List<String> ids(TurnResponse response) {
        return response.recommendations().stream().map(Recommendation::id).toList();
    }

    @Test
    void followUpRecommendsMoviesLikeThePreviousOnes() {
        TurnResponse first = conversationService.handle("cs-follow",
                new TurnRequest("Recommend movies like The Lion King", ParsedIntent.seeds("Q1"), 2));
        assertEquals(TurnKind.RECOMMENDATION, first.kind());
        assertEquals(List.of("Q4", "Q3"), ids(first));
        assertEquals("Here are a few recommendations:"
                + "\n- **The Lion King II**: shares the genre 'animated film'"
                + "\n- **The Jungle Book**: shares the genre 'animated film'", first.reply());

        TurnResponse second = conversationService.handle("cs-follow",
                new TurnRequest("more like those", ParsedIntent.followUpRequest(), 2));

        assertEquals(RecommendationStatus.OK, second.status());
        assertTrue(ids(second).stream().noneMatch(Set.of("Q1", "Q3", "Q4")::contains));
        SessionSnapshot snapshot = sessionManager.snapshot("cs-follow");
        assertTrue(snapshot.seedEntities().containsAll(Set.of("Q1", "Q3", "Q4")));
        assertEquals(Set.copyOf(ids(second)), Set.copyOf(snapshot.recommendedEntities()));
        assertEquals(2, snapshot.history().size());
    }

    @Test
    void resetClearsTheSessionWhateverTheIntent() {
        conversationService.handle("cs-reset", new TurnRequest("like The Lion King", ParsedIntent.seeds("Q1"), 2));

        TurnResponse reset = conversationService.handle("cs-reset", new TurnRequest("  Start Over ", ParsedIntent.seeds("Q6"), null));

        assertEquals(TurnKind.RESET, reset.kind());
        assertEquals(ConversationService.RESET_REPLY, reset.reply());
        SessionSnapshot snapshot = sessionManager.snapshot("cs-reset");
        assertTrue(snapshot.seedEntities().isEmpty());
        assertTrue(snapshot.recommendedEntities().isEmpty());
        assertEquals(1, snapshot.history().size());
    }

    @Test
    void helpLeavesTheSessionUntouched() {
        TurnResponse help = conversationService.handle("cs-help", new TurnRequest("help", ParsedIntent.seeds("Q1"), null));

        assertEquals(TurnKind.HELP, help.kind());
        assertEquals(ConversationService.HELP_REPLY, help.reply());
        assertTrue(sessionManager.snapshot("cs-help").seedEntities().isEmpty());
    }

    @Test
    void nonRecommendationIntentIsRememberedButNotAnswered() {
        ParsedIntent chat = new ParsedIntent(IntentType.OTHER, Set.of(), Map.of("genre", "Q101"), Map.of(), Map.of(), false);

        TurnResponse response = conversationService.handle("cs-other", new TurnRequest("I like comedies", chat, null));

        assertEquals(TurnKind.ACKNOWLEDGED, response.kind());
        assertEquals(Map.of("genre", "Q101"), sessionManager.snapshot("cs-other").preferences());
    }

    @Test
    void emptySessionAndEmptyResultGetFriendlyReplies() {
        TurnResponse noInput = conversationService.handle("cs-empty",
                new TurnRequest("recommend something", ParsedIntent.followUpRequest(), null));
        assertEquals(RecommendationStatus.NO_INPUT, noInput.status());
        assertEquals(ConversationService.NO_INPUT_REPLY, noInput.reply());

        ParsedIntent unknownGenre = new ParsedIntent(IntentType.RECOMMENDATION, Set.of(), Map.of("genre", "Q999"), Map.of(), Map.of(), false);
        TurnResponse nothing = conversationService.handle("cs-empty", new TurnRequest("a western please", unknownGenre, null));
        assertEquals(RecommendationStatus.NOTHING_FOUND, nothing.status());
        assertEquals(ConversationService.NOTHING_FOUND_REPLY, nothing.reply());
    }

    @Test
    void rejectsNonPositiveResultSize() {
        assertThrows(IllegalArgumentException.class,
                () -> conversationService.handle("cs-k", new TurnRequest("more", ParsedIntent.seeds("Q1"), 0)));
    }
}
