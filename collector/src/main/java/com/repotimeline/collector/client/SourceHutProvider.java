package com.repotimeline.collector.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.type.TypeReference;
import com.repotimeline.collector.model.Commit;
import com.repotimeline.collector.model.Repository;
import okhttp3.OkHttpClient;
import okhttp3.Request;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * sourcehut git provider. The log endpoint is read in a single call, and it exposes no parent
 * information, so every commit is reported as a non-merge commit.
 */
public class SourceHutProvider extends AbstractPlatformProvider {

    static final String BASE_URL = "https://git.sr.ht/api";
    private static final String WEB_URL = "https://git.sr.ht/";

    private final String token;

    public SourceHutProvider(String token, OkHttpClient httpClient) {
        this(token, httpClient, BASE_URL, DEFAULT_INITIAL_BACKOFF_MS);
    }

    SourceHutProvider(String token, OkHttpClient httpClient, String baseUrl, long initialBackoffMs) {
        super(baseUrl, httpClient, initialBackoffMs);
        this.token = token;
    }

    @Override
    public Platform platform() {
        return Platform.SOURCEHUT;
    }

    /**
     * Endpoint: GET /{identity}/repos
     */
    @Override
    public List<Repository> listRepositories(String identity) throws ProviderException, InterruptedException {
        String url = baseUrl + "/" + encodeSegment(identity) + "/repos";
        Results<SourceHutRepo> response = getJson(url, "user '" + identity + "'", new TypeReference<>() {});
        if (response == null || response.results() == null) {
            return List.of();
        }

        List<Repository> result = new ArrayList<>();
        for (SourceHutRepo repo : response.results()) {
            if (repo.commitsCount() == null || repo.commitsCount() <= 0) {
                continue;
            }
            String fullName = identity + "/" + repo.name();
            result.add(new Repository(repo.name(), fullName, WEB_URL + fullName, repo.description(), "master"));
        }
        return result;
    }

    /**
     * Endpoint: GET /{owner}/repos/{repo}/log, read once without pagination.
     */
    @Override
    public List<Commit> listCommits(String identity, String repository)
            throws ProviderException, InterruptedException {
        String fullName = qualify(identity, repository);
        int slash = fullName.indexOf('/');
        String owner = fullName.substring(0, slash);
        String name = fullName.substring(slash + 1);

        String url = baseUrl + "/" + encodeSegment(owner) + "/repos/" + encodeSegment(name) + "/log";
        Results<SourceHutCommit> response = getJson(url,
                "repository '" + fullName + "'", new TypeReference<>() {});
        if (response == null || response.results() == null) {
            return List.of();
        }

        List<Commit> commits = new ArrayList<>(response.results().size());
        for (SourceHutCommit c : response.results()) {
            Instant timestamp = parseTimestamp(c.timestamp());
            if (timestamp == null) {
                continue;
            }
            String author = c.author() != null && c.author().name() != null ? c.author().name() : "Unknown";
            commits.add(new Commit(c.id(), c.message(), author, timestamp, false));
        }
        return commits;
    }

    @Override
    protected void authorize(Request.Builder builder) {
        if (token != null && !token.isBlank()) {
            builder.header("Authorization", "Bearer " + token);
        }
    }

    // -------------------------------------------------------------------------
    // Wire format
    // -------------------------------------------------------------------------

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Results<T>(@JsonProperty("results") List<T> results) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SourceHutRepo(
            @JsonProperty("name") String name,
            @JsonProperty("description") String description,
            @JsonProperty("commits_count") Integer commitsCount
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SourceHutCommit(
            @JsonProperty("id") String id,
            @JsonProperty("message") String message,
            @JsonProperty("author") Author author,
            @JsonProperty("timestamp") String timestamp
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Author(@JsonProperty("name") String name) {}
}
