package de.leipzig.htwk.patentrisk.support;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import de.leipzig.htwk.patentrisk.client.PatentCatalog;
import de.leipzig.htwk.patentrisk.model.Claim;
import de.leipzig.htwk.patentrisk.model.Patent;

/**
 * Catalog over a map, in insertion order
 */
public class InMemoryPatentCatalog implements PatentCatalog {

    private final Map<String, Patent> patents = new LinkedHashMap<>();
    private final Map<String, List<Claim>> claims = new LinkedHashMap<>();

    public InMemoryPatentCatalog add(Patent patent) {
        patents.put(patent.getId(), patent);
        return this;
    }

    public InMemoryPatentCatalog addClaims(String patentId, List<Claim> patentClaims) {
        claims.put(patentId, List.copyOf(patentClaims));
        return this;
    }

    @Override
    public Optional<Patent> findById(String patentId) {
        return Optional.ofNullable(patents.get(patentId));
    }

    @Override
    public Map<String, Patent> findAllById(Collection<String> patentIds) {
        Map<String, Patent> found = new LinkedHashMap<>();
        for (String id : patentIds) {
            Patent patent = patents.get(id);
            if (patent != null) {
                found.put(id, patent);
            }
        }
        return found;
    }

    @Override
    public List<Claim> findClaims(String patentId) {
        return claims.getOrDefault(patentId, List.of());
    }

    @Override
    public Map<String, List<Claim>> findClaimsByPatentIds(Collection<String> patentIds) {
        Map<String, List<Claim>> found = new LinkedHashMap<>();
        for (String id : patentIds) {
            if (claims.containsKey(id)) {
                found.put(id, claims.get(id));
            }
        }
        return found;
    }

    @Override
    public List<Patent> fuzzyCandidates(int limit) {
        return new ArrayList<>(patents.values()).stream().limit(limit).toList();
    }

    @Override
    public long count() {
        return patents.size();
    }
}
