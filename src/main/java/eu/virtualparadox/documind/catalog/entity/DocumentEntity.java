package eu.virtualparadox.documind.catalog.entity;

import eu.virtualparadox.documind.catalog.EDocumentStatus;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(name = "documents", indexes = @Index(name = "idx_documents_owner", columnList = "owner_id"))
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DocumentEntity {

    @Id
    @Column(length = 64, nullable = false)
    private String id;

    @Column(name = "owner_id", length = 128, nullable = false)
    private String ownerId;

    @Column(length = 512, nullable = false)
    private String filename;

    @Column(name = "file_type", length = 16, nullable = false)
    private String fileType;

    @Column(name = "size_bytes", nullable = false)
    private long sizeBytes;

    @Column(name = "uploaded_at", nullable = false)
    private Instant uploadedAt;

    /** Full extracted and cleaned text. */
    @Lob
    @Column(name = "content")
    @ToString.Exclude
    private String content;

    @Column(nullable = false)
    private int chunks;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", length = 32, nullable = false)
    private EDocumentStatus status;

    @PrePersist
    void prePersist() {
        if (uploadedAt == null) {
            uploadedAt = Instant.now();
        }

        if (status == null) {
            status = EDocumentStatus.PROCESSING;
        }
    }
}
