package de.leipzig.htwk.patentrisk.entity;

import java.time.LocalDateTime;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Entity
@Table(name = "claims", indexes = {
    @Index(name = "idx_claim_patent_id", columnList = "patent_id"),
    @Index(name = "idx_claim_patent_number", columnList = "patent_id, claim_number", unique = true)
})
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ClaimEntity {

    @Id
    @Column(name = "id", length = 36)
    private String id;

    @Column(name = "patent_id", nullable = false, length = 36)
    private String patentId;

    @Column(name = "claim_number", nullable = false)
    private Integer claimNumber;

    @Column(name = "claim_text", nullable = false, columnDefinition = "text")
    private String claimText;

    @Column(name = "is_independent", nullable = false)
    private Boolean independent;

    @Column(name = "parent_claim_number")
    private Integer parentClaimNumber;

    @Column(name = "claim_type", length = 50)
    private String claimType;

    // JSON array of phrases
    @Column(name = "key_elements", columnDefinition = "text")
    private String keyElements;

    @Column(name = "embedding", columnDefinition = "vector")
    private String embedding;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt = LocalDateTime.now();
}
