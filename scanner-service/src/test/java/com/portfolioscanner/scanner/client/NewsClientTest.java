package com.portfolioscanner.scanner.client;

import com.portfolioscanner.common.scan.ScanRequest;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.test.StepVerifier;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class NewsClientTest {

    private MockWebServer server;
    private NewsClient client;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        client = new NewsClient(WebClient.builder().baseUrl(server.url("/").toString()).build());
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
    }

    @Test
    void fetchArticlesPassesQueryToNewsService() throws Exception {
        server.enqueue(new MockResponse()
            .setHeader("Content-Type", "application/json")
            .setBody("[\"Title: a\\nContent: b\\n\"]"));

        StepVerifier.create(client.fetchArticles(new ScanRequest(List.of("IPO", "stock market"), "India", 25)))
            .assertNext(articles -> assertThat(articles).containsExactly("Title: a\nContent: b\n"))
            .verifyComplete();

        RecordedRequest request = server.takeRequest();
        assertThat(request.getRequestUrl().encodedPath()).isEqualTo("/api/v1/news/articles");
        assertThat(request.getRequestUrl().queryParameter("keywords")).isEqualTo("IPO,stock market");
        assertThat(request.getRequestUrl().queryParameter("country")).isEqualTo("India");
        assertThat(request.getRequestUrl().queryParameter("maxArticles")).isEqualTo("25");
    }

    @Test
    void serverErrorBecomesEmptyBatch() {
        server.enqueue(new MockResponse().setResponseCode(500).setBody("down"));

        StepVerifier.create(client.fetchArticles(ScanRequest.defaults()))
            .assertNext(articles -> assertThat(articles).isEmpty())
            .verifyComplete();
    }

    @Test
    void unreachableServiceBecomesEmptyBatch() throws Exception {
        server.shutdown();

        StepVerifier.create(client.fetchHeadlines())
            .assertNext(articles -> assertThat(articles).isEmpty())
            .verifyComplete();
    }
}
