package com.github.salilvnair.supportrouter.knowledge;

import com.github.salilvnair.supportrouter.audit.AuditService;
import com.github.salilvnair.supportrouter.engine.session.RouterSession;
import com.github.salilvnair.supportrouter.engine.steps.KnowledgeLookupStep;
import com.github.salilvnair.supportrouter.knowledge.strategy.KeywordOverlapStrategy;
import com.github.salilvnair.supportrouter.knowledge.strategy.SemanticLookupStrategy;
import com.github.salilvnair.supportrouter.llm.EmbeddingClient;
import com.github.salilvnair.supportrouter.llm.RemoteModelClient;
import com.github.salilvnair.supportrouter.llm.RemoteModelInvoker;
import com.github.salilvnair.supportrouter.model.IncomingMessage;
import com.github.salilvnair.supportrouter.support.RouterFixtures;
import com.github.salilvnair.supportrouter.tenant.TenantConfigCompiler;
import com.github.salilvnair.supportrouter.tenant.TenantRuntime;
import com.github.salilvnair.supportrouter.tenant.config.TenantConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.support.StaticListableBeanFactory;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import static com.github.salilvnair.supportrouter.support.TestConstants.LAUNDRY_ANSWER;
import static com.github.salilvnair.supportrouter.support.TestConstants.PARKING_ANSWER;
import static com.github.salilvnair.supportrouter.support.TestConstants.SESSION_ID;
import static com.github.salilvnair.supportrouter.support.TestConstants.TENANT_ACME;
import static com.github.salilvnair.supportrouter.support.TestConstants.TEXT_PARKING_QUESTION;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;

class KnowledgeCatalogServiceTest {

    private final ExecutorService executor = Executors.newSingleThreadExecutor();

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void exactQuestionScoresOne() {
        KnowledgeMatch match = keywordOnly().lookup(TEXT_PARKING_QUESTION, RouterFixtures.acmeRuntime()).orElseThrow();

        assertEquals("parking", match.entry().id());
        assertEquals(1.0, match.score(), 1e-9);
        assertEquals(PARKING_ANSWER, match.resolvedAnswer());
        assertEquals(KeywordOverlapStrategy.NAME, match.strategy());
    }

    @Test
    void partialKeywordOverlapScoresFraction() {
        KnowledgeMatch match = keywordOnly()
                .lookup("Hur många parkeringsplatser har ni?", RouterFixtures.acmeRuntime())
                .orElseThrow();

        assertEquals("parking", match.entry().id());
        assertEquals(2.0 / 3.0, match.score(), 1e-9);
    }

    @Test
    void unrelatedMessageFindsNothing() {
        assertTrue(keywordOnly().lookup("Kan ni berätta om era planer?", RouterFixtures.acmeRuntime()).isEmpty());
    }

    @Test
    void groundingSnippetsAreResolvedAndRankedBestFirst() {
        List<String> snippets = keywordOnly()
                .groundingSnippets("Har ni parkering i garage och hur får jag en tvättid?", RouterFixtures.acmeRuntime());

        assertEquals(List.of(PARKING_ANSWER, LAUNDRY_ANSWER), snippets);
    }

    @Test
    void semanticStrategyIsTriedFirstWhenEmbeddingsExist() {
        KnowledgeCatalogService service = withEmbeddingClient(text -> new float[]{0.9f, 0.1f, 0f});

        KnowledgeMatch match = service.lookup("Var ställer jag bilen?", runtimeWithEmbeddings()).orElseThrow();

        assertEquals("parking", match.entry().id());
        assertEquals(SemanticLookupStrategy.NAME, match.strategy());
        assertTrue(match.score() > 0.9);
    }

    @Test
    void failingEmbeddingFallsBackToKeywords() {
        KnowledgeCatalogService service = withEmbeddingClient(text -> {
            throw new IllegalStateException("embedding service down");
        });

        KnowledgeMatch match = service.lookup(TEXT_PARKING_QUESTION, runtimeWithEmbeddings()).orElseThrow();

        assertEquals(KeywordOverlapStrategy.NAME, match.strategy());
    }

    @Test
    void unresolvedMessageEmbedsOnceForMatchAndGrounding() {
        AtomicInteger embedCalls = new AtomicInteger();
        KnowledgeCatalogService service = withEmbeddingClient(text -> {
            embedCalls.incrementAndGet();
            return new float[]{0.5f, 0.5f, 0.7f};
        });
        KnowledgeLookupStep step = new KnowledgeLookupStep(service, mock(AuditService.class));
        RouterSession session = new RouterSession(
                IncomingMessage.of("Hur många parkeringsplatser har ni?", SESSION_ID, TENANT_ACME),
                runtimeWithEmbeddings());

        step.execute(session);

        assertEquals(1, embedCalls.get());
        assertFalse(session.hasReply());
        assertEquals(List.of(PARKING_ANSWER), session.getGroundingSnippets());
    }

    @Test
    void searchDerivesMatchAndGroundingFromOneRanking() {
        KnowledgeSearchResult result = keywordOnly()
                .search("Har ni parkering i garage och hur får jag en tvättid?", RouterFixtures.acmeRuntime());

        assertEquals("parking", result.bestMatch().orElseThrow().entry().id());
        assertEquals(List.of(PARKING_ANSWER, LAUNDRY_ANSWER), result.groundingSnippets());
    }

    private KnowledgeCatalogService keywordOnly() {
        return new KnowledgeCatalogService(List.of(new KeywordOverlapStrategy()));
    }

    private KnowledgeCatalogService withEmbeddingClient(EmbeddingClient embeddingClient) {
        StaticListableBeanFactory beans = new StaticListableBeanFactory();
        beans.addBean("embeddingClient", embeddingClient);
        RemoteModelInvoker invoker = new RemoteModelInvoker(
                beans.getBeanProvider(RemoteModelClient.class),
                beans.getBeanProvider(EmbeddingClient.class),
                executor,
                RouterFixtures.properties()
        );
        return new KnowledgeCatalogService(List.of(new SemanticLookupStrategy(invoker), new KeywordOverlapStrategy()));
    }

    private TenantRuntime runtimeWithEmbeddings() {
        TenantConfig config = RouterFixtures.acmeConfig();
        config.getKnowledge().get(0).setEmbedding(new float[]{1f, 0f, 0f});
        config.getKnowledge().get(1).setEmbedding(new float[]{0f, 1f, 0f});
        return new TenantConfigCompiler(RouterFixtures.properties(), RouterFixtures.fixedClock()).compile(config);
    }
}
