package com.repotimeline.collector.client;

import com.repotimeline.collector.model.Commit;
import com.repotimeline.collector.model.Repository;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.*;

import java.io.IOException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link SourceHutProvider}.
 */
class SourceHutProviderTest {

    private MockWebServer server;
    private SourceHutProvider provider;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        provider = new SourceHutProvider("srht-token", new OkHttpClient(), server.url("/").toString(), 0);
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    private static MockResponse json(String body) {
        return new MockResponse().setResponseCode(200)
                .setHeader("Content-Type", "application/json")
                .setBody(body);
    }

    @Test
    @DisplayName("Lists repositories with commits and builds sr.ht web URLs")
    void listRepositories_filtersByCommitCount() throws Exception {
        server.enqueue(json("""
                {"results": [
                  {"name": "scdoc", "description": "man page generator", "commits_count": 412},
                  {"name": "scratch", "description": null, "commits_count": 0},
                  {"name": "unknown", "description": null}
                ]}"""));

        List<Repository> repos = provider.listRepositories("~sircmpwn");

        assertEquals(List.of(new Repository("scdoc", "~sircmpwn/scdoc", "https://git.sr.ht/~sircmpwn/scdoc",
                "man page generator", "master")), repos);

        RecordedRequest recorded = server.takeRequest();
        assertEquals("/~sircmpwn/repos", recorded.getPath());
        assertEquals("Bearer srht-token", recorded.getHeader("Authorization"));
    }

    @Test
    @DisplayName("Reads the log in one request and reports no merge commits")
    void listCommits_singleRequestNoMerges() throws Exception {
        server.enqueue(json("""
                {"results": [
                  {"id": "e1", "message": "Merge remote-tracking branch", "author": {"name": "Drew"},
                   "timestamp": "2024-02-10T12:00:00+00:00"},
                  {"id": "e2", "message": "fix", "timestamp": "2024-02-09T12:00:00+00:00"}
                ], "next": "should-not-be-followed"}"""));

        List<Commit> commits = provider.listCommits("~sircmpwn", "scdoc");

        assertEquals(2, commits.size());
        assertTrue(commits.stream().noneMatch(Commit::merge));
        assertEquals("Drew", commits.get(0).author());
        assertEquals("Unknown", commits.get(1).author());
        assertEquals(1, server.getRequestCount());
        assertEquals("/~sircmpwn/repos/scdoc/log", server.takeRequest().getPath());
    }

    @Test
    @DisplayName("Owner-qualified repositories are read from their own owner")
    void listCommits_qualifiedName() throws Exception {
        server.enqueue(json("{\"results\": []}"));

        provider.listCommits("~me", "~other/repo");

        assertEquals("/~other/repos/repo/log", server.takeRequest().getPath());
    }

    @Test
    @DisplayName("429 is RATE_LIMITED and 404 is NOT_FOUND")
    void statusClassification() {
        server.enqueue(new MockResponse().setResponseCode(429).setHeader("Retry-After", "60"));
        server.enqueue(new MockResponse().setResponseCode(404));

        ProviderException limited = assertThrows(ProviderException.class,
                () -> provider.listCommits("~sircmpwn", "scdoc"));
        ProviderException missing = assertThrows(ProviderException.class,
                () -> provider.listCommits("~sircmpwn", "missing"));

        assertEquals(ErrorKind.RATE_LIMITED, limited.kind());
        assertTrue(limited.getMessage().contains("retry after 60s"));
        assertEquals(ErrorKind.NOT_FOUND, missing.kind());
    }
}
