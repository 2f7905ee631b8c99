package com.repotimeline.collector.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.type.TypeReference;
import com.repotimeline.collector.model.Commit;
import com.repotimeline.collector.model.Repository;
import okhttp3.Credentials;
import okhttp3.OkHttpClient;
import okhttp3.Request;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Bitbucket Cloud 2.0 provider. Commit history is cursor-paged: each response body carries an
 * opaque {@code next} URL that is followed verbatim. Authenticates with HTTP Basic using the
 * account name and an app password.
 */
public class BitbucketProvider extends AbstractPlatformProvider {

    static final String BASE_URL = "https://api.bitbucket.org/2.0";

    private final String username;
    private final String appPassword;

    public BitbucketProvider(String username, String appPassword, OkHttpClient httpClient) {
        this(username, appPassword, httpClient, BASE_URL, DEFAULT_INITIAL_BACKOFF_MS);
    }

    BitbucketProvider(String username, String appPassword, OkHttpClient httpClient,
                      String baseUrl, long initialBackoffMs) {
        super(baseUrl, httpClient, initialBackoffMs);
        this.username = username;
        this.appPassword = appPassword;
    }

    @Override
    public Platform platform() {
        return Platform.BITBUCKET;
    }

    /**
     * Endpoint: GET /repositories/{identity}?pagelen=100
     */
    @Override
    public List<Repository> listRepositories(String identity) throws ProviderException, InterruptedException {
        String url = baseUrl + "/repositories/" + encodeSegment(identity) + "?pagelen=" + PER_PAGE;
        PagedResponse<BitbucketRepo> response = getJson(url, "user '" + identity + "'", new TypeReference<>() {});
        if (response == null || response.values() == null) {
            return List.of();
        }

        List<Repository> result = new ArrayList<>();
        for (BitbucketRepo repo : response.values()) {
            if (repo.size() <= 0) {
                continue;
            }
            String htmlUrl = repo.links() != null && repo.links().html() != null
                    ? repo.links().html().href()
                    : null;
            result.add(new Repository(repo.slug(), repo.fullName(),
                    htmlUrl != null ? htmlUrl : "https://bitbucket.org/" + repo.fullName(),
                    repo.description(),
                    repo.mainBranch() != null && repo.mainBranch().name() != null
                            ? repo.mainBranch().name()
                            : "master"));
        }
        return result;
    }

    /**
     * Endpoint: GET /repositories/{owner}/{repo}/commits?pagelen=100, then each body's {@code next}.
     */
    @Override
    public List<Commit> listCommits(String identity, String repository)
            throws ProviderException, InterruptedException {
        String fullName = qualify(identity, repository);
        String firstUrl = baseUrl + "/repositories/" + encodePath(fullName) + "/commits?pagelen=" + PER_PAGE;
        return walkPages(firstUrl, "repository '" + fullName + "'", (body, pageNumber) -> {
            PagedResponse<BitbucketCommit> page = objectMapper.readValue(body, new TypeReference<>() {});
            List<BitbucketCommit> values = page.values() != null ? page.values() : List.of();
            return new Page<>(toCommits(values), values.size(), page.next());
        });
    }

    private static List<Commit> toCommits(List<BitbucketCommit> page) {
        List<Commit> commits = new ArrayList<>(page.size());
        for (BitbucketCommit c : page) {
            Instant timestamp = parseTimestamp(c.date());
            if (timestamp == null) {
                continue;
            }
            boolean merge = c.parents() != null && c.parents().size() > 1;
            commits.add(new Commit(c.hash(), c.message(), authorName(c.author()), timestamp, merge));
        }
        return commits;
    }

    private static String authorName(CommitAuthor author) {
        if (author == null) {
            return "Unknown";
        }
        if (author.user() != null && author.user().displayName() != null) {
            return author.user().displayName();
        }
        return author.raw() != null ? author.raw() : "Unknown";
    }

    @Override
    protected void authorize(Request.Builder builder) {
        if (appPassword != null && !appPassword.isBlank()) {
            builder.header("Authorization", Credentials.basic(username, appPassword));
        }
    }

    // -------------------------------------------------------------------------
    // Wire format
    // -------------------------------------------------------------------------

    @JsonIgnoreProperties(ignoreUnknown = true)
    record PagedResponse<T>(
            @JsonProperty("values") List<T> values,
            @JsonProperty("next") String next
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record BitbucketRepo(
            @JsonProperty("slug") String slug,
            @JsonProperty("full_name") String fullName,
            @JsonProperty("links") Links links,
            @JsonProperty("description") String description,
            @JsonProperty("mainbranch") Branch mainBranch,
            @JsonProperty("size") long size
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Links(@JsonProperty("html") Link html) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Link(@JsonProperty("href") String href) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Branch(@JsonProperty("name") String name) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record BitbucketCommit(
            @JsonProperty("hash") String hash,
            @JsonProperty("message") String message,
            @JsonProperty("author") CommitAuthor author,
            @JsonProperty("date") String date,
            @JsonProperty("parents") List<Parent> parents
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record CommitAuthor(
            @JsonProperty("user") User user,
            @JsonProperty("raw") String raw
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record User(@JsonProperty("display_name") String displayName) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Parent(@JsonProperty("hash") String hash) {}
}
