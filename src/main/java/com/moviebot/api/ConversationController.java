package com.moviebot.api;

import com.moviebot.conversation.ConversationModels;
import com.moviebot.conversation.ConversationService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/conversations")
public class ConversationController {
    private final ConversationService conversationService;

    public ConversationController(ConversationService conversationService) {
        this.conversationService = conversationService;
    }

    @PostMapping("/{userId}/turns")
    public ResponseEntity<ConversationModels.TurnResponse> turn(@PathVariable String userId,
                                                                @RequestBody ConversationModels.TurnRequest request) {
        return ResponseEntity.ok(conversationService.handle(userId, request));
    }
}
