package com.moviebot.api;

import com.moviebot.session.SessionManager;
import com.moviebot.session.SessionModels;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/sessions")
public class SessionController {
    private final SessionManager sessionManager;

    public SessionController(SessionManager sessionManager) {
        this.sessionManager = sessionManager;
    }

    @GetMapping("/{userId}")
    public ResponseEntity<SessionModels.SessionSnapshot> get(@PathVariable String userId) {
        if (!sessionManager.exists(userId)) return ResponseEntity.notFound().build();
        return ResponseEntity.ok(sessionManager.snapshot(userId));
    }

    @DeleteMapping("/{userId}")
    public ResponseEntity<Void> reset(@PathVariable String userId) {
        if (sessionManager.exists(userId)) sessionManager.reset(userId);
        return ResponseEntity.noContent().build();
    }
}
