package com.sitelens.crawl.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sitelens.crawl.model.CrawlRecord;
import com.sitelens.crawl.model.CrawlStatus;
import com.sitelens.crawl.service.CrawlOrchestratorService;
import okhttp3.mockwebserver.Dispatcher;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.context.WebApplicationContext;

import java.time.Duration;
import java.util.Optional;

import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@ActiveProfiles("test")
class CrawlApiSmokeTest {
    private static final String PAGE = """
        <html lang="en"><head><title>Toaster</title>
        <meta name="keywords" content="toaster, kitchen"></head>
        <body><p>Buy the toaster, add it to the cart and checkout today.</p></body></html>
        """;

    @Autowired
    private WebApplicationContext context;

    @Autowired
    private CrawlOrchestratorService orchestratorService;

    @Autowired
    private ObjectMapper objectMapper;

    private MockMvc mockMvc;
    private MockWebServer server;

    @BeforeEach
    void setUp() throws Exception {
        this.mockMvc = MockMvcBuilders.webAppContextSetup(context).build();
        server = new MockWebServer();
        server.setDispatcher(new Dispatcher() {
            @Override
            public MockResponse dispatch(RecordedRequest request) {
                String path = request.getPath() == null ? "" : request.getPath();
                if (path.equals("/robots.txt")) {
                    return new MockResponse().setResponseCode(200).setBody("User-agent: *\nDisallow: /private\n");
                }
                if (path.startsWith("/private")) {
                    return new MockResponse().setResponseCode(200).setBody("secret");
                }
                if (path.equals("/missing")) {
                    return new MockResponse().setResponseCode(404).setBody("gone");
                }
                return new MockResponse()
                    .setResponseCode(200)
                    .setHeader("Content-Type", "text/html; charset=utf-8")
                    .setBody(PAGE);
            }
        });
        server.start();
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
    }

    @Test
    void submittedCrawlCompletesAndResultIsServed() throws Exception {
        String crawlId = submit(server.url("/shop/toaster").toString());

        CrawlRecord record = await(crawlId);
        assertEquals(CrawlStatus.COMPLETED, record.status());

        mockMvc.perform(get("/api/v1/results/" + crawlId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.record.status").value("COMPLETED"))
            .andExpect(jsonPath("$.metadata.title").value("Toaster"))
            .andExpect(jsonPath("$.metadata.keywords[1]").value("kitchen"))
            .andExpect(jsonPath("$.metadata.language").value("en"))
            .andExpect(jsonPath("$.metadata.topics[0].topic").value("ecommerce"))
            .andExpect(jsonPath("$.metadata.statusCode").value(200));

        mockMvc.perform(get("/api/v1/results")
                .param("domain", record.domain())
                .param("status", "completed"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.total").value(greaterThanOrEqualTo(1)))
            .andExpect(jsonPath("$.results[0].status").value("COMPLETED"));

        mockMvc.perform(post("/api/v1/results/" + crawlId + "/retry"))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.error").value("crawl_not_retryable"));

        mockMvc.perform(delete("/api/v1/results/" + crawlId))
            .andExpect(status().isOk());
        mockMvc.perform(get("/api/v1/results/" + crawlId))
            .andExpect(status().isNotFound());
    }

    @Test
    void robotsBlockedCrawlFailsAndCanBeRetried() throws Exception {
        String crawlId = submit(server.url("/private/report").toString());

        CrawlRecord record = await(crawlId);
        assertEquals(CrawlStatus.FAILED, record.status());
        assertEquals("robots_disallowed", record.errorCode());
        assertEquals("Blocked by robots.txt", record.errorMessage());

        MvcResult retried = mockMvc.perform(post("/api/v1/results/" + crawlId + "/retry"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("PENDING"))
            .andReturn();
        String retryId = objectMapper.readTree(retried.getResponse().getContentAsString()).get("crawlId").asText();
        CrawlRecord retry = await(retryId);
        assertEquals(crawlId, retry.retryOf());
        assertEquals(1, retry.retryCount());
    }

    @Test
    void batchSubmissionCreatesOneRecordPerUrl() throws Exception {
        String body = objectMapper.writeValueAsString(java.util.Map.of(
            "urls", java.util.List.of(server.url("/a").toString(), server.url("/missing").toString()),
            "priority", "high"
        ));

        MvcResult result = mockMvc.perform(post("/api/v1/crawl/batch")
                .contentType(MediaType.APPLICATION_JSON)
                .content(body))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.totalUrls").value(2))
            .andExpect(jsonPath("$.results.length()").value(2))
            .andReturn();

        JsonNode results = objectMapper.readTree(result.getResponse().getContentAsString()).get("results");
        CrawlRecord first = await(results.get(0).get("crawlId").asText());
        CrawlRecord second = await(results.get(1).get("crawlId").asText());
        assertEquals(CrawlStatus.COMPLETED, first.status());
        assertEquals(CrawlStatus.FAILED, second.status());
        assertEquals("http_status", second.errorCode());
    }

    @Test
    void invalidRequestsAreRejected() throws Exception {
        mockMvc.perform(post("/api/v1/crawl")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"url\":\"ftp://example.com/file\"}"))
            .andExpect(status().isBadRequest());

        mockMvc.perform(post("/api/v1/crawl")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"url\":\"https://example.com\",\"maxRetries\":11}"))
            .andExpect(status().isBadRequest());

        mockMvc.perform(post("/api/v1/crawl")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"url\":\"https://example.com\",\"crawlDelay\":0.01}"))
            .andExpect(status().isBadRequest());

        mockMvc.perform(post("/api/v1/crawl/batch")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"urls\":[]}"))
            .andExpect(status().isBadRequest());

        mockMvc.perform(post("/api/v1/crawl")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"url\":\"https://example.com\",\"headers\":{\"X-A\":null}}"))
            .andExpect(status().isBadRequest());

        mockMvc.perform(post("/api/v1/crawl/batch")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"urls\":[\"https://example.com\"],\"headers\":{\"X-A\":null}}"))
            .andExpect(status().isBadRequest());

        mockMvc.perform(get("/api/v1/results").param("status", "sleeping"))
            .andExpect(status().isBadRequest());

        mockMvc.perform(post("/api/v1/results/unknown-id/retry"))
            .andExpect(status().isNotFound());
    }

    @Test
    void domainRateLimitCanBeReadSetAndReset() throws Exception {
        mockMvc.perform(put("/api/v1/domains/throttle.example/rate-limit").param("crawlDelay", "4.5"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.crawlDelay").value(4.5));

        mockMvc.perform(get("/api/v1/domains/throttle.example/rate-limit"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.domain").value("throttle.example"))
            .andExpect(jsonPath("$.crawlDelay").value(4.5));

        mockMvc.perform(put("/api/v1/domains/throttle.example/rate-limit").param("crawlDelay", "120"))
            .andExpect(status().isBadRequest());

        mockMvc.perform(delete("/api/v1/domains/throttle.example/rate-limit"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.reset").value(true));
    }

    @Test
    void healthReportsDatabaseAndCache() throws Exception {
        mockMvc.perform(get("/api/v1/health"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("healthy"))
            .andExpect(jsonPath("$.database").value(true))
            .andExpect(jsonPath("$.cacheType").value("in-memory"))
            .andExpect(jsonPath("$.counts.crawl_queue").value(greaterThanOrEqualTo(0)));
    }

    @Test
    void livenessAndReadinessAnswer() throws Exception {
        mockMvc.perform(get("/api/v1/liveness"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("alive"));

        mockMvc.perform(get("/api/v1/readiness"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("ready"));
    }

    private String submit(String url) throws Exception {
        MvcResult result = mockMvc.perform(post("/api/v1/crawl")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(java.util.Map.of("url", url))))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("PENDING"))
            .andReturn();
        return objectMapper.readTree(result.getResponse().getContentAsString()).get("crawlId").asText();
    }

    private CrawlRecord await(String crawlId) throws Exception {
        Optional<CrawlRecord> record = orchestratorService.awaitCompletion(crawlId, Duration.ofSeconds(15));
        assertTrue(record.isPresent());
        return record.get();
    }
}
