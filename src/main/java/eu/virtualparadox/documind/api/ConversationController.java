package eu.virtualparadox.documind.api;

import eu.virtualparadox.documind.conversation.model.ConversationTurn;
import eu.virtualparadox.documind.conversation.service.ConversationService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/conversations")
@RequiredArgsConstructor
public class ConversationController {

    private final ConversationService conversationService;

    @GetMapping("/{sessionId}")
    public List<ConversationTurn> history(@RequestHeader(ApiHeaders.OWNER_ID) String ownerId,
                                          @PathVariable("sessionId") String sessionId,
                                          @RequestParam(name = "limit", defaultValue = "20") int limit) {
        return conversationService.history(ApiHeaders.requireOwner(ownerId), sessionId, limit);
    }

    @DeleteMapping("/{sessionId}")
    public ResponseEntity<Void> clear(@RequestHeader(ApiHeaders.OWNER_ID) String ownerId,
                                      @PathVariable("sessionId") String sessionId) {
        conversationService.clear(ApiHeaders.requireOwner(ownerId), sessionId);
        return ResponseEntity.noContent().build();
    }
}
