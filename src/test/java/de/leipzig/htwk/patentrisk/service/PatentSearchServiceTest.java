package de.leipzig.htwk.patentrisk.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.github.benmanes.caffeine.cache.Caffeine;

import de.leipzig.htwk.patentrisk.client.EmbeddingClient;
import de.leipzig.htwk.patentrisk.client.VectorIndex;
import de.leipzig.htwk.patentrisk.client.VectorIndex.Neighbor;
import de.leipzig.htwk.patentrisk.config.RiskEngineConfig;
import de.leipzig.htwk.patentrisk.exception.DimensionMismatchException;
import de.leipzig.htwk.patentrisk.exception.EmbeddingUnavailableException;
import de.leipzig.htwk.patentrisk.exception.RequestValidationException;
import de.leipzig.htwk.patentrisk.model.MatchType;
import de.leipzig.htwk.patentrisk.model.Patent;
import de.leipzig.htwk.patentrisk.model.SearchResult;
import de.leipzig.htwk.patentrisk.service.cache.CaffeineResultCache;
import de.leipzig.htwk.patentrisk.service.cache.ResultCache;
import de.leipzig.htwk.patentrisk.service.similarity.ScoreCombiner;
import de.leipzig.htwk.patentrisk.service.similarity.VectorSimilarity;
import de.leipzig.htwk.patentrisk.support.HashingEmbeddingClient;
import de.leipzig.htwk.patentrisk.support.InMemoryPatentCatalog;
import de.leipzig.htwk.patentrisk.support.TestComponents;

class PatentSearchServiceTest {

    private static final String QUERY = "video compression with motion vectors";

    private final RiskEngineConfig config = TestComponents.config();
    private final HashingEmbeddingClient embeddings = new HashingEmbeddingClient(64);
    private final InMemoryPatentCatalog catalog = new InMemoryPatentCatalog();
    private final VectorIndex vectorIndex = mock(VectorIndex.class);
    private final ResultCache cache = new CaffeineResultCache(Caffeine.newBuilder().build());

    private Patent video;
    private Patent audio;
    private Patent pump;

    @BeforeEach
    void setUp() {
        video = patent("P-VIDEO", "Video compression", "Compressing video streams using predicted motion vectors.");
        audio = patent("P-AUDIO", "Audio codec", "Compressing audio frames with a psychoacoustic model.");
        pump = patent("P-PUMP", "Hydraulic pump", "A gear pump with a relief valve.");
        catalog.add(video).add(audio).add(pump);

        when(vectorIndex.nearestNeighbors(any(), anyInt())).thenReturn(List.of(
            new Neighbor("P-VIDEO", 0.9),
            new Neighbor("P-AUDIO", 0.4)));
    }

    @Test
    void ranksByCombinedScoreAndTagsTheLegs() {
        List<SearchResult> results = service(embeddings).search(QUERY, 10, 0.7);

        assertEquals("P-VIDEO", results.get(0).patent().getId());
        assertEquals(MatchType.HYBRID, results.get(0).matchType());
        for (int i = 1; i < results.size(); i++) {
            assertTrue(results.get(i - 1).combinedScore() >= results.get(i).combinedScore());
        }
        for (SearchResult result : results) {
            assertFalse(result.degraded());
            assertEquals(ScoreCombiner.combinedScore(result.vectorScore(), result.fuzzyScore(), 0.7), result.combinedScore());
        }
    }

    @Test
    void storedEmbeddingsAreScoredExactly() {
        SearchResult top = service(embeddings).search(QUERY, 10, 0.7).get(0);

        assertEquals(VectorSimilarity.similarity(embeddings.embed(QUERY), video.getEmbedding()), top.vectorScore());
    }

    @Test
    void limitIsApplied() {
        assertEquals(1, service(embeddings).search(QUERY, 1, null).size());
    }

    @Test
    void identicalSearchesAreServedFromCache() {
        PatentSearchService service = service(embeddings);
        int embeddedBefore = embeddings.calls();

        List<SearchResult> first = service.search(QUERY, 5, 0.7);
        List<SearchResult> second = service.search("  video compression   with motion vectors ", 5, 0.7);

        assertSame(first, second);
        assertEquals(embeddedBefore + 1, embeddings.calls());
        verify(vectorIndex, times(1)).nearestNeighbors(any(), anyInt());
    }

    @Test
    void fallsBackToFuzzyWhenEmbeddingIsDown() {
        EmbeddingClient down = mock(EmbeddingClient.class);
        when(down.embed(any())).thenThrow(new EmbeddingUnavailableException("connection refused"));
        PatentSearchService service = service(down);

        List<SearchResult> results = service.search(QUERY, 10, 0.7);

        assertFalse(results.isEmpty());
        assertEquals("P-VIDEO", results.get(0).patent().getId());
        for (SearchResult result : results) {
            assertTrue(result.degraded());
            assertEquals(0.0, result.vectorScore());
            assertEquals(result.fuzzyScore(), result.combinedScore());
            assertEquals(MatchType.FUZZY, result.matchType());
        }
        verify(vectorIndex, never()).nearestNeighbors(any(), anyInt());

        // degraded results are not cached
        service.search(QUERY, 10, 0.7);
        verify(down, times(4)).embed(any());
    }

    @Test
    void fallsBackToFuzzyWhenIndexIsDown() {
        when(vectorIndex.nearestNeighbors(any(), anyInt())).thenThrow(new IllegalStateException("index offline"));

        List<SearchResult> results = service(embeddings).search(QUERY, 10, 0.7);

        assertTrue(results.stream().allMatch(SearchResult::degraded));
    }

    @Test
    void vectorOfWrongLengthIsRejected() {
        catalog.add(video.toBuilder().embedding(new double[32]).build());

        assertThrows(DimensionMismatchException.class, () -> service(embeddings).search(QUERY, 10, 0.7));
    }

    @Test
    void rejectsBlankQueryAndBadLimit() {
        PatentSearchService service = service(embeddings);

        assertThrows(RequestValidationException.class, () -> service.search("  ", 10, null));
        assertThrows(RequestValidationException.class, () -> service.search(QUERY, 0, null));
        assertThrows(RequestValidationException.class, () -> service.search(QUERY, config.getMaxSearchLimit() + 1, null));
    }

    private PatentSearchService service(EmbeddingClient embeddingClient) {
        return new PatentSearchService(embeddingClient, vectorIndex, catalog, new ScoreCombiner(config), cache,
            TestComponents.invoker(config), config);
    }

    private Patent patent(String id, String title, String abstractText) {
        Patent patent = Patent.builder().id(id).title(title).abstractText(abstractText).build();
        return patent.toBuilder().embedding(embeddings.embed(patent.searchableText())).build();
    }
}
