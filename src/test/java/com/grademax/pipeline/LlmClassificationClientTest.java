package com.grademax.pipeline;

import com.grademax.pipeline.classification.ClassificationContext;
import com.grademax.pipeline.classification.ClassificationContextFactory;
import com.grademax.pipeline.classification.ClassificationModels.ClassificationReport;
import com.grademax.pipeline.classification.TopicClassifier;
import com.grademax.pipeline.config.SubjectProfile;
import com.grademax.pipeline.config.SubjectProfiles;
import com.grademax.pipeline.domain.DomainModels.ClassificationMethod;
import com.grademax.pipeline.domain.DomainModels.Difficulty;
import com.grademax.pipeline.domain.DomainModels.PageRange;
import com.grademax.pipeline.domain.PipelineIssue;
import com.grademax.pipeline.domain.QuestionUnit;
import com.grademax.pipeline.service.IngestionModels.IngestionRequest;
import com.grademax.pipeline.service.IngestionModels.PaperResult;
import com.grademax.pipeline.service.IngestionModels.Status;
import com.grademax.pipeline.service.PaperIngestionService;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(properties = {
        "pipeline.classification.external.enabled=true",
        "pipeline.classification.external.retry-wait=10ms",
        "pipeline.classification.external.max-attempts=2",
        "pipeline.classification.rate-limit-delay=0ms"
})
class LlmClassificationClientTest {
    private static final String REPLY = "{\"choices\": [{\"message\": {\"content\": "
            + "\"```json\\n[{\\\"index\\\": 0, \\\"topic\\\": \\\"5\\\", \\\"difficulty\\\": \\\"medium\\\", \\\"confidence\\\": 0.85}]\\n```\"}}]}";

    private static final AtomicInteger requests = new AtomicInteger();
    private static volatile int responseStatus = 200;
    private static volatile String responseBody;
    private static final HttpServer server = startServer();

    @Autowired
    private ClassificationContextFactory contextFactory;
    @Autowired
    private TopicClassifier classifier;
    @Autowired
    private SubjectProfiles profiles;
    @Autowired
    private PaperIngestionService ingestionService;

    private SubjectProfile physics;

    @DynamicPropertySource
    static void serviceUrl(DynamicPropertyRegistry registry) {
        registry.add("pipeline.classification.external.base-url", () -> "http://localhost:" + server.getAddress().getPort());
    }

    @AfterAll
    static void stopServer() {
        server.stop(0);
    }

    @BeforeEach
    void setUp() {
        physics = profiles.forSubject("4PH1");
        requests.set(0);
        responseStatus = 200;
        responseBody = null;
    }

    private static HttpServer startServer() {
        try {
            HttpServer httpServer = HttpServer.create(new InetSocketAddress("localhost", 0), 0);
            httpServer.createContext("/v1/chat/completions", exchange -> {
                requests.incrementAndGet();
                exchange.getRequestBody().readAllBytes();
                String reply = responseBody != null ? responseBody : responseStatus == 200 ? REPLY : "{\"error\": \"overloaded\"}";
                byte[] body = reply.getBytes(StandardCharsets.UTF_8);
                exchange.getResponseHeaders().add("Content-Type", "application/json");
                exchange.sendResponseHeaders(responseStatus, body.length);
                try (OutputStream out = exchange.getResponseBody()) {
                    out.write(body);
                }
            });
            httpServer.start();
            return httpServer;
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static QuestionUnit unit(String text) {
        return new QuestionUnit("llm-" + text.hashCode(), "paper", "3", "", List.of(new PageRange(0, null)), text, 3, false);
    }

    @Test
    void acceptsConfidentAnswerAndCachesIdenticalPrompts() {
        ClassificationContext context = contextFactory.create();
        QuestionUnit unit = unit("Write your answer about the balloon in the box.");

        classifier.classifyAll(List.of(unit), Map.of(), physics, context);

        assertEquals("5", unit.getTopicCode());
        assertEquals(Difficulty.MEDIUM, unit.getDifficulty());
        assertEquals(ClassificationMethod.EXTERNAL, unit.getClassificationMethod());
        assertFalse(unit.isReviewRequired());

        QuestionUnit same = unit("Write your answer about the balloon in the box.");
        classifier.classifyAll(List.of(same), Map.of(), physics, context);
        assertEquals("5", same.getTopicCode());
        assertEquals(1, requests.get());
    }

    @Test
    void serverErrorsAreRetriedThenFallBack() {
        responseStatus = 500;
        QuestionUnit unit = unit("Write your answer about the kite in the box.");

        ClassificationReport report = classifier.classifyAll(List.of(unit), Map.of(), physics, contextFactory.create());

        assertEquals(2, requests.get());
        assertEquals(ClassificationMethod.FALLBACK, unit.getClassificationMethod());
        assertEquals("1", unit.getTopicCode());
        assertTrue(report.issues().stream().anyMatch(i -> i.code().equals(PipelineIssue.Codes.CLASSIFICATION_SERVICE_ERROR)));
    }

    @Test
    void truncatedJsonBodyIsRetriedThenFallsBack() {
        responseBody = "{\"choices\": [{\"message\": ";
        QuestionUnit unit = unit("Write your answer about the parachute in the box.");

        ClassificationReport report = classifier.classifyAll(List.of(unit), Map.of(), physics, contextFactory.create());

        assertEquals(2, requests.get());
        assertEquals(ClassificationMethod.FALLBACK, unit.getClassificationMethod());
        assertEquals("1", unit.getTopicCode());
        assertTrue(report.issues().stream().anyMatch(i -> i.code().equals(PipelineIssue.Codes.CLASSIFICATION_SERVICE_ERROR)));
    }

    @Test
    void cancelledIngestionDoesNotStopTheNextOne() {
        ExamPdfFixtures.PaperFixture cancelledPaper = ExamPdfFixtures.physicsPaper(8, 17, 1);
        ClassificationContext cancelled = contextFactory.create();
        cancelled.cancel();

        PaperResult first = ingestionService.ingest(new IngestionRequest("4PH1_1P_Jun_2049.pdf",
                cancelledPaper.questionPaper(), "4PH1_1P_MS_Jun_2049.pdf", cancelledPaper.markScheme(), null), cancelled);
        assertEquals(Status.OK, first.status());
        assertEquals(0, requests.get());

        ExamPdfFixtures.PaperFixture nextPaper = ExamPdfFixtures.physicsPaper(8, 17, 2);
        PaperResult second = ingestionService.ingest(new IngestionRequest("4PH1_1P_Jun_2050.pdf",
                nextPaper.questionPaper(), "4PH1_1P_MS_Jun_2050.pdf", nextPaper.markScheme(), null));
        assertEquals(Status.OK, second.status());
        assertTrue(requests.get() > 0);
        assertTrue(second.units().stream().anyMatch(u -> u.getClassificationMethod() == ClassificationMethod.EXTERNAL));
    }
}
