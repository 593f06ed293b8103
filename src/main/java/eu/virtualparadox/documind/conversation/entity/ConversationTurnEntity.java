package eu.virtualparadox.documind.conversation.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(name = "conversation_turns",
        indexes = @Index(name = "idx_turns_owner_session", columnList = "owner_id, session_id"))
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ConversationTurnEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "owner_id", length = 128, nullable = false)
    private String ownerId;

    @Column(name = "session_id", length = 128, nullable = false)
    private String sessionId;

    @Column(length = 16, nullable = false)
    private String role;

    @Lob
    @Column(nullable = false)
    private String content;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "query_id", length = 64)
    private String queryId;
}
