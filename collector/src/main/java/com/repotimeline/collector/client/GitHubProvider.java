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
 * GitHub REST v3 provider. Commit history uses page-number pagination; HTTP 409 on a
 * repository means it has no commits yet. Forks and zero-size repositories are excluded.
 */
public class GitHubProvider extends AbstractPlatformProvider {

    static final String BASE_URL = "https://api.github.com";

    private final String token;

    public GitHubProvider(String token, OkHttpClient httpClient) {
        this(token, httpClient, BASE_URL, DEFAULT_INITIAL_BACKOFF_MS);
    }

    GitHubProvider(String token, OkHttpClient httpClient, String baseUrl, long initialBackoffMs) {
        super(baseUrl, httpClient, initialBackoffMs);
        this.token = token;
    }

    @Override
    public Platform platform() {
        return Platform.GITHUB;
    }

    /**
     * Endpoint: GET /users/{identity}/repos?per_page=100
     */
    @Override
    public List<Repository> listRepositories(String identity) throws ProviderException, InterruptedException {
        String url = baseUrl + "/users/" + encodeSegment(identity) + "/repos?per_page=" + PER_PAGE;
        List<GitHubRepo> repos = getJson(url, "user '" + identity + "'", new TypeReference<>() {});
        if (repos == null) {
            return List.of();
        }

        List<Repository> result = new ArrayList<>();
        for (GitHubRepo repo : repos) {
            if (repo.fork() || repo.size() <= 0) {
                continue;
            }
            result.add(new Repository(repo.name(), repo.fullName(), repo.htmlUrl(),
                    repo.description(), repo.defaultBranch()));
        }
        return result;
    }

    /**
     * Endpoint: GET /repos/{owner}/{repo}/commits?per_page=100&page={n}
     */
    @Override
    public List<Commit> listCommits(String identity, String repository)
            throws ProviderException, InterruptedException {
        String fullName = qualify(identity, repository);
        return walkPages(commitsUrl(fullName, 1), "repository '" + fullName + "'", (body, pageNumber) -> {
            List<GitHubCommit> page = objectMapper.readValue(body, new TypeReference<>() {});
            return new Page<>(toCommits(page), page.size(), commitsUrl(fullName, pageNumber + 1));
        });
    }

    private String commitsUrl(String fullName, int page) {
        return baseUrl + "/repos/" + encodePath(fullName) + "/commits?per_page=" + PER_PAGE + "&page=" + page;
    }

    private static List<Commit> toCommits(List<GitHubCommit> page) {
        List<Commit> commits = new ArrayList<>(page.size());
        for (GitHubCommit c : page) {
            CommitAuthor author = c.commit() != null ? c.commit().author() : null;
            Instant timestamp = parseTimestamp(author != null ? author.date() : null);
            if (timestamp == null) {
                continue;
            }
            boolean merge = c.parents() != null && c.parents().size() > 1;
            commits.add(new Commit(c.sha(), c.commit().message(),
                    author.name() != null ? author.name() : "Unknown", timestamp, merge));
        }
        return commits;
    }

    // -------------------------------------------------------------------------
    // Platform hooks
    // -------------------------------------------------------------------------

    @Override
    protected void authorize(Request.Builder builder) {
        if (token != null && !token.isBlank()) {
            builder.header("Authorization", "token " + token);
        }
    }

    @Override
    protected String acceptHeader() {
        return "application/vnd.github.v3+json";
    }

    @Override
    protected boolean isRateLimited(int statusCode) {
        return statusCode == 403 || statusCode == 429;
    }

    @Override
    protected boolean isEmptyRepository(int statusCode) {
        return statusCode == 409;
    }

    @Override
    protected String rateLimitDetail(Response response) {
        String detail = quotaDetail(response, "X-RateLimit-Remaining", "X-RateLimit-Reset");
        return detail.isEmpty() ? super.rateLimitDetail(response) : detail;
    }

    // -------------------------------------------------------------------------
    // Wire format
    // -------------------------------------------------------------------------

    @JsonIgnoreProperties(ignoreUnknown = true)
    record GitHubRepo(
            @JsonProperty("name") String name,
            @JsonProperty("full_name") String fullName,
            @JsonProperty("html_url") String htmlUrl,
            @JsonProperty("description") String description,
            @JsonProperty("default_branch") String defaultBranch,
            @JsonProperty("fork") boolean fork,
            @JsonProperty("size") long size
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record GitHubCommit(
            @JsonProperty("sha") String sha,
            @JsonProperty("commit") CommitDetail commit,
            @JsonProperty("parents") List<Parent> parents
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record CommitDetail(
            @JsonProperty("message") String message,
            @JsonProperty("author") CommitAuthor author
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record CommitAuthor(
            @JsonProperty("name") String name,
            @JsonProperty("date") String date
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Parent(@JsonProperty("sha") String sha) {}
}
