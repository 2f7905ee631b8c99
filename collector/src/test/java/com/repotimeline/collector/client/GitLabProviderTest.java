package com.repotimeline.collector.client;

import com.repotimeline.collector.model.Commit;
import com.repotimeline.collector.model.Repository;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.*;

import java.io.IOException;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link GitLabProvider}: user resolution, project filtering, encoded project paths
 * and GitLab-specific error messages.
 */
class GitLabProviderTest {

    private MockWebServer server;
    private GitLabProvider provider;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        provider = new GitLabProvider("glpat-test", new OkHttpClient(), server.url("/").toString(), 0);
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

    // =========================================================================
    // Repository listing
    // =========================================================================

    @Test
    @DisplayName("Resolves the user id, then keeps only projects with commits")
    void listRepositories_resolvesUserAndFilters() throws Exception {
        server.enqueue(json("[{\"id\": 42, \"username\": \"jdoe\"}]"));
        server.enqueue(json("""
                [
                  {"path": "api", "path_with_namespace": "jdoe/api", "web_url": "https://gitlab.com/jdoe/api",
                   "description": "REST API", "default_branch": "main", "statistics": {"commit_count": 87}},
                  {"path": "empty", "path_with_namespace": "jdoe/empty", "web_url": "https://gitlab.com/jdoe/empty",
                   "description": null, "default_branch": "main", "statistics": {"commit_count": 0}},
                  {"path": "nostats", "path_with_namespace": "jdoe/nostats", "web_url": "https://gitlab.com/jdoe/nostats",
                   "description": null, "default_branch": "main"}
                ]"""));

        List<Repository> repos = provider.listRepositories("jdoe");

        assertEquals(1, repos.size());
        assertEquals(new Repository("api", "jdoe/api", "https://gitlab.com/jdoe/api", "REST API", "main"),
                repos.get(0));

        RecordedRequest userLookup = server.takeRequest();
        assertEquals("/users?username=jdoe", userLookup.getPath());
        assertEquals("glpat-test", userLookup.getHeader("PRIVATE-TOKEN"));
        assertEquals("/users/42/projects?per_page=100&statistics=true", server.takeRequest().getPath());
    }

    @Test
    @DisplayName("An unknown username is NOT_FOUND without listing projects")
    void listRepositories_unknownUser_notFound() {
        server.enqueue(json("[]"));

        ProviderException ex = assertThrows(ProviderException.class,
                () -> provider.listRepositories("nobody"));

        assertEquals(ErrorKind.NOT_FOUND, ex.kind());
        assertEquals("GitLab user 'nobody' not found", ex.getMessage());
        assertEquals(1, server.getRequestCount());
    }

    @Test
    @DisplayName("429 carries GitLab quota headers in the message")
    void listRepositories_429_rateLimited() {
        server.enqueue(new MockResponse().setResponseCode(429)
                .setHeader("RateLimit-Remaining", "0")
                .setHeader("RateLimit-Reset", "1704067200"));

        ProviderException ex = assertThrows(ProviderException.class,
                () -> provider.listRepositories("jdoe"));

        assertEquals(ErrorKind.RATE_LIMITED, ex.kind());
        assertEquals(429, ex.statusCode());
        assertTrue(ex.getMessage().contains("remaining: 0, resets at 2024-01-01T00:00:00Z"), ex.getMessage());
    }

    @Test
    @DisplayName("403 is a plain provider error on GitLab")
    void listRepositories_403_providerError() {
        server.enqueue(new MockResponse().setResponseCode(403));

        ProviderException ex = assertThrows(ProviderException.class,
                () -> provider.listRepositories("jdoe"));

        assertEquals(ErrorKind.PROVIDER_ERROR, ex.kind());
        assertEquals(403, ex.statusCode());
    }

    @Test
    @DisplayName("401 points at the GitLab credential variable")
    void listRepositories_401_mentionsToken() {
        server.enqueue(new MockResponse().setResponseCode(401));

        ProviderException ex = assertThrows(ProviderException.class,
                () -> provider.listRepositories("jdoe"));

        assertEquals(ErrorKind.PROVIDER_ERROR, ex.kind());
        assertTrue(ex.getMessage().contains("GITLAB_TOKEN"), ex.getMessage());
    }

    // =========================================================================
    // Commit listing
    // =========================================================================

    @Test
    @DisplayName("Requests commits by URL-encoded project path and pages by number")
    void listCommits_encodedPathAndPaging() throws Exception {
        server.enqueue(json("""
                [{"id": "c1", "message": "first", "author_name": "Jane", "committed_date": "2024-03-01T09:00:00.000Z",
                  "parent_ids": ["p1"]}]"""));
        server.enqueue(json("[]"));

        List<Commit> commits = provider.listCommits("jdoe", "api");

        assertEquals(1, commits.size());
        assertEquals("/projects/jdoe%2Fapi/repository/commits?per_page=100&page=1", server.takeRequest().getPath());
        assertEquals("/projects/jdoe%2Fapi/repository/commits?per_page=100&page=2", server.takeRequest().getPath());
    }

    @Test
    @DisplayName("Offset timestamps are normalized to UTC and multi-parent commits flagged as merges")
    void listCommits_mapsOffsetsAndMerges() throws Exception {
        server.enqueue(json("""
                [
                  {"id": "m1", "message": "Merge branch 'x'", "author_name": "Jane",
                   "committed_date": "2024-01-01T23:30:00.000-02:00", "parent_ids": ["p1", "p2"]},
                  {"id": "c2", "message": "fix", "author_name": null,
                   "committed_date": "2024-01-01T08:00:00.000+00:00", "parent_ids": ["p0"]}
                ]"""));
        server.enqueue(json("[]"));

        List<Commit> commits = provider.listCommits("jdoe", "api");

        assertEquals(Instant.parse("2024-01-02T01:30:00Z"), commits.get(0).timestamp());
        assertTrue(commits.get(0).merge());
        assertEquals("Unknown", commits.get(1).author());
        assertFalse(commits.get(1).merge());
    }

    @Test
    @DisplayName("A missing project is NOT_FOUND")
    void listCommits_404_notFound() {
        server.enqueue(new MockResponse().setResponseCode(404));

        ProviderException ex = assertThrows(ProviderException.class,
                () -> provider.listCommits("jdoe", "gone"));

        assertEquals(ErrorKind.NOT_FOUND, ex.kind());
        assertTrue(ex.getMessage().contains("jdoe/gone"));
    }
}
