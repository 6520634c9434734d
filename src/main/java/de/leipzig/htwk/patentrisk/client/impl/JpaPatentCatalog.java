package de.leipzig.htwk.patentrisk.client.impl;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import de.leipzig.htwk.patentrisk.client.PatentCatalog;
import de.leipzig.htwk.patentrisk.entity.ClaimEntity;
import de.leipzig.htwk.patentrisk.entity.PatentEntity;
import de.leipzig.htwk.patentrisk.model.Claim;
import de.leipzig.htwk.patentrisk.model.ClaimType;
import de.leipzig.htwk.patentrisk.model.Patent;
import de.leipzig.htwk.patentrisk.repository.ClaimRepository;
import de.leipzig.htwk.patentrisk.repository.PatentRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Catalog over the patents and claims tables. Entities are mapped to immutable model values
 * so nothing downstream can write back through a managed entity.
 */
@Component
@RequiredArgsConstructor
@Slf4j
@Transactional(readOnly = true)
public class JpaPatentCatalog implements PatentCatalog {

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {
    };

    private final PatentRepository patentRepository;
    private final ClaimRepository claimRepository;
    private final ObjectMapper objectMapper;

    @Override
    public Optional<Patent> findById(String patentId) {
        return patentRepository.findById(patentId).map(this::toPatent);
    }

    @Override
    public Map<String, Patent> findAllById(Collection<String> patentIds) {
        if (patentIds.isEmpty()) {
            return Map.of();
        }
        return patentRepository.findAllById(patentIds).stream()
            .map(this::toPatent)
            .collect(Collectors.toMap(Patent::getId, Function.identity(), (a, b) -> a, LinkedHashMap::new));
    }

    @Override
    public List<Claim> findClaims(String patentId) {
        return claimRepository.findByPatentIdOrderByClaimNumberAsc(patentId).stream()
            .map(this::toClaim)
            .toList();
    }

    @Override
    public Map<String, List<Claim>> findClaimsByPatentIds(Collection<String> patentIds) {
        if (patentIds.isEmpty()) {
            return Map.of();
        }
        return claimRepository.findByPatentIdInOrderByPatentIdAscClaimNumberAsc(patentIds).stream()
            .map(this::toClaim)
            .collect(Collectors.groupingBy(Claim::getPatentId, LinkedHashMap::new, Collectors.toList()));
    }

    @Override
    public List<Patent> fuzzyCandidates(int limit) {
        return patentRepository.findAllByOrderByCreatedAtDescIdAsc(PageRequest.of(0, limit)).stream()
            .map(this::toPatent)
            .toList();
    }

    @Override
    public long count() {
        return patentRepository.count();
    }

    private Patent toPatent(PatentEntity entity) {
        return Patent.builder()
            .id(entity.getId())
            .title(entity.getTitle())
            .abstractText(entity.getAbstractText())
            .claimsText(entity.getClaimsText())
            .patentNumber(entity.getPatentNumber())
            .applicant(entity.getApplicant())
            .classification(entity.getClassification())
            .filingDate(entity.getFilingDate())
            .publicationDate(entity.getPublicationDate())
            .createdAt(entity.getCreatedAt())
            .embedding(VectorCodec.fromVectorString(entity.getEmbedding()))
            .build();
    }

    private Claim toClaim(ClaimEntity entity) {
        boolean independent = entity.getIndependent() == null || entity.getIndependent();
        return Claim.builder()
            .patentId(entity.getPatentId())
            .claimNumber(entity.getClaimNumber())
            .text(entity.getClaimText())
            .independent(independent)
            .parentClaimNumber(independent ? null : entity.getParentClaimNumber())
            .claimType(ClaimType.fromString(entity.getClaimType()))
            .keyElements(parseKeyElements(entity))
            .embedding(VectorCodec.fromVectorString(entity.getEmbedding()))
            .build();
    }

    private List<String> parseKeyElements(ClaimEntity entity) {
        if (entity.getKeyElements() == null || entity.getKeyElements().isBlank()) {
            return List.of();
        }
        try {
            List<String> elements = objectMapper.readValue(entity.getKeyElements(), STRING_LIST);
            return elements != null ? elements.stream().filter(e -> e != null && !e.isBlank()).toList() : List.of();
        } catch (JsonProcessingException e) {
            log.warn("Unreadable key elements on claim {} of patent {}: {}",
                entity.getClaimNumber(), entity.getPatentId(), e.getOriginalMessage());
            return List.of();
        }
    }
}
