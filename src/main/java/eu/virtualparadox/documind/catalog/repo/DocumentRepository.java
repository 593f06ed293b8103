package eu.virtualparadox.documind.catalog.repo;

import eu.virtualparadox.documind.catalog.EDocumentStatus;
import eu.virtualparadox.documind.catalog.entity.DocumentEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface DocumentRepository extends JpaRepository<DocumentEntity, String> {

    List<DocumentEntity> findByOwnerIdOrderByUploadedAtDesc(String ownerId);

    @Modifying
    @Query("update DocumentEntity d set d.status = :status where d.id = :id")
    int updateStatus(@Param("id") String id, @Param("status") EDocumentStatus status);

    @Modifying
    @Query("update DocumentEntity d set d.chunks = :chunks, d.status = :status where d.id = :id")
    int updateChunksAndStatus(@Param("id") String id,
                              @Param("chunks") int chunks,
                              @Param("status") EDocumentStatus status);
}
