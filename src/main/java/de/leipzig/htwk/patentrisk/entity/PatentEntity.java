package de.leipzig.htwk.patentrisk.entity;

import java.time.LocalDate;
import java.time.LocalDateTime;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Entity
@Table(name = "patents", indexes = {
    @Index(name = "idx_patent_number", columnList = "patent_number", unique = true),
    @Index(name = "idx_classification", columnList = "classification"),
    @Index(name = "idx_created_at", columnList = "created_at")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PatentEntity {

    @Id
    @Column(name = "id", length = 36)
    private String id;

    @Column(name = "title", nullable = false, length = 1000)
    private String title;

    @Column(name = "abstract", columnDefinition = "text")
    private String abstractText;

    @Column(name = "claims_text", columnDefinition = "text")
    private String claimsText;

    @Column(name = "patent_number", length = 50)
    private String patentNumber;

    @Column(name = "applicant", length = 500)
    private String applicant;

    @Column(name = "classification", length = 100)
    private String classification;

    @Column(name = "filing_date")
    private LocalDate filingDate;

    @Column(name = "publication_date")
    private LocalDate publicationDate;

    // pgvector column, read in its text form "[0.1,0.2,...]"
    @Column(name = "embedding", columnDefinition = "vector")
    private String embedding;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt = LocalDateTime.now();
}
