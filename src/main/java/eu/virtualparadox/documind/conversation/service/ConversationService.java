package eu.virtualparadox.documind.conversation.service;

import eu.virtualparadox.documind.conversation.entity.ConversationTurnEntity;
import eu.virtualparadox.documind.conversation.model.ConversationTurn;
import eu.virtualparadox.documind.conversation.repo.ConversationTurnRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Append-only conversation log per (owner, session).
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ConversationService {

    public static final int DEFAULT_HISTORY_LIMIT = 20;

    private final ConversationTurnRepository repository;

    @Transactional
    public void append(final String ownerId, final String sessionId, final ConversationTurn turn) {
        repository.save(ConversationTurnEntity.builder()
                .ownerId(ownerId)
                .sessionId(sessionId)
                .role(turn.role())
                .content(turn.content())
                .createdAt(turn.timestamp() == null ? Instant.now() : turn.timestamp())
                .queryId(turn.queryId())
                .build());
    }

    /**
     * @return the most recent {@code limit} turns, oldest first
     */
    @Transactional(readOnly = true)
    public List<ConversationTurn> history(final String ownerId, final String sessionId, final int limit) {
        if (limit <= 0) {
            return List.of();
        }

        final List<ConversationTurn> turns = new ArrayList<>();
        for (final ConversationTurnEntity e : repository.findByOwnerIdAndSessionIdOrderByIdDesc(ownerId, sessionId, PageRequest.of(0, limit))) {
            turns.add(new ConversationTurn(e.getRole(), e.getContent(), e.getCreatedAt(), e.getQueryId()));
        }
        Collections.reverse(turns);
        return turns;
    }

    public List<ConversationTurn> history(final String ownerId, final String sessionId) {
        return history(ownerId, sessionId, DEFAULT_HISTORY_LIMIT);
    }

    @Transactional
    public void clear(final String ownerId, final String sessionId) {
        final int removed = repository.deleteSession(ownerId, sessionId);
        log.info("Cleared {} turns of session {} for {}", removed, sessionId, ownerId);
    }
}
