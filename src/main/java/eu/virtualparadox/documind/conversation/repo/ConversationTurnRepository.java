package eu.virtualparadox.documind.conversation.repo;

import eu.virtualparadox.documind.conversation.entity.ConversationTurnEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface ConversationTurnRepository extends JpaRepository<ConversationTurnEntity, Long> {

    /**
     * Newest turns first; callers reverse the page to restore chronological order.
     */
    List<ConversationTurnEntity> findByOwnerIdAndSessionIdOrderByIdDesc(String ownerId, String sessionId, Pageable pageable);

    @Modifying
    @Query("delete from ConversationTurnEntity t where t.ownerId = :ownerId and t.sessionId = :sessionId")
    int deleteSession(@Param("ownerId") String ownerId, @Param("sessionId") String sessionId);
}
