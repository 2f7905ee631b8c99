package com.repotimeline.collector.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.type.TypeReference;
import com.repotimeline.collector.model.Commit;
import com.repotimeline.collector.model.Repository;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * GitLab REST v4 provider. The identity is first resolved to a numeric user id; commit history
 * is paged by number over the URL-encoded {@code owner/repo} project path.
 */
public class GitLabProvider extends AbstractPlatformProvider {

    static final String BASE_URL = "https://gitlab.com/api/v4";

    private final String token;

    public GitLabProvider(String token, OkHttpClient httpClient) {
        this(token, httpClient, BASE_URL, DEFAULT_INITIAL_BACKOFF_MS);
    }

    GitLabProvider(String token, OkHttpClient httpClient, String baseUrl, long initialBackoffMs) {
        super(baseUrl, httpClient, initialBackoffMs);
        this.token = token;
    }

    @Override
    public Platform platform() {
        return Platform.GITLAB;
    }

    /**
     * Endpoints: GET /users?username={identity}, then
     * GET /users/{id}/projects?per_page=100&statistics=true
     */
    @Override
    public List<Repository> listRepositories(String identity) throws ProviderException, InterruptedException {
        long userId = resolveUserId(identity);

        String url = baseUrl + "/users/" + userId + "/projects?per_page=" + PER_PAGE + "&statistics=true";
        List<GitLabProject> projects = getJson(url, "projects of user '" + identity + "'",
                new TypeReference<>() {});
        if (projects == null) {
            return List.of();
        }

        List<Repository> result = new ArrayList<>();
        for (GitLabProject project : projects) {
            if (project.statistics() == null || project.statistics().commitCount() <= 0) {
                continue;
            }
            result.add(new Repository(project.path(), project.pathWithNamespace(), project.webUrl(),
                    project.description(), project.defaultBranch()));
        }
        return result;
    }

    long resolveUserId(String identity) throws ProviderException, InterruptedException {
        String url = baseUrl + "/users?username=" + encode(identity);
        List<GitLabUser> users = getJson(url, "user '" + identity + "'", new TypeReference<>() {});
        if (users == null || users.isEmpty()) {
            throw ProviderException.notFound("GitLab user '" + identity + "' not found");
        }
        return users.get(0).id();
    }

    /**
     * Endpoint: GET /projects/{url-encoded owner/repo}/repository/commits?per_page=100&page={n}
     */
    @Override
    public List<Commit> listCommits(String identity, String repository)
            throws ProviderException, InterruptedException {
        String projectPath = qualify(identity, repository);
        String encodedPath = encode(projectPath);
        return walkPages(commitsUrl(encodedPath, 1), "repository '" + projectPath + "'", (body, pageNumber) -> {
            List<GitLabCommit> page = objectMapper.readValue(body, new TypeReference<>() {});
            return new Page<>(toCommits(page), page.size(), commitsUrl(encodedPath, pageNumber + 1));
        });
    }

    private String commitsUrl(String encodedPath, int page) {
        return baseUrl + "/projects/" + encodedPath + "/repository/commits?per_page=" + PER_PAGE
                + "&page=" + page;
    }

    private static List<Commit> toCommits(List<GitLabCommit> page) {
        List<Commit> commits = new ArrayList<>(page.size());
        for (GitLabCommit c : page) {
            Instant timestamp = parseTimestamp(c.committedDate());
            if (timestamp == null) {
                continue;
            }
            boolean merge = c.parentIds() != null && c.parentIds().size() > 1;
            commits.add(new Commit(c.id(), c.message(),
                    c.authorName() != null ? c.authorName() : "Unknown", timestamp, merge));
        }
        return commits;
    }

    // -------------------------------------------------------------------------
    // Platform hooks
    // -------------------------------------------------------------------------

    @Override
    protected void authorize(Request.Builder builder) {
        if (token != null && !token.isBlank()) {
            builder.header("PRIVATE-TOKEN", token);
        }
    }

    @Override
    protected String rateLimitDetail(Response response) {
        String detail = quotaDetail(response, "RateLimit-Remaining", "RateLimit-Reset");
        return detail.isEmpty() ? super.rateLimitDetail(response) : detail;
    }

    @Override
    protected String failureMessage(int statusCode, String resource) {
        if (statusCode == 401) {
            return "GitLab authentication failed for " + resource + ". Check your "
                    + platform().credentialVariable();
        }
        return super.failureMessage(statusCode, resource);
    }

    // -------------------------------------------------------------------------
    // Wire format
    // -------------------------------------------------------------------------

    @JsonIgnoreProperties(ignoreUnknown = true)
    record GitLabUser(
            @JsonProperty("id") long id,
            @JsonProperty("username") String username
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record GitLabProject(
            @JsonProperty("path") String path,
            @JsonProperty("path_with_namespace") String pathWithNamespace,
            @JsonProperty("web_url") String webUrl,
            @JsonProperty("description") String description,
            @JsonProperty("default_branch") String defaultBranch,
            @JsonProperty("statistics") ProjectStatistics statistics
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ProjectStatistics(@JsonProperty("commit_count") long commitCount) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record GitLabCommit(
            @JsonProperty("id") String id,
            @JsonProperty("message") String message,
            @JsonProperty("author_name") String authorName,
            @JsonProperty("committed_date") String committedDate,
            @JsonProperty("parent_ids") List<String> parentIds
    ) {}
}
