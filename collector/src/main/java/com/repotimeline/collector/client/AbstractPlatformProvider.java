package com.repotimeline.collector.client;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Shared HTTP plumbing for the platform providers: request building, response classification,
 * retry of transient server errors, and the bounded page walk.
 *
 * <p>Subclasses supply authentication, endpoint URLs and field mapping. Thread-safe as long as
 * subclasses hold no mutable state; the underlying {@link OkHttpClient} and {@link ObjectMapper}
 * are both thread-safe.</p>
 */
public abstract class AbstractPlatformProvider implements GitPlatformProvider {

    private static final Logger logger = LoggerFactory.getLogger(AbstractPlatformProvider.class);

    /** Hard cap on pages walked per repository, independent of the platform. */
    public static final int MAX_PAGES = 10;

    static final int PER_PAGE = 100;
    static final String USER_AGENT = "repo-timeline";
    static final long DEFAULT_INITIAL_BACKOFF_MS = 1_000;
    private static final long MAX_BACKOFF_MS = 30_000;
    private static final int MAX_RETRIES = 3;

    protected final OkHttpClient httpClient;
    protected final ObjectMapper objectMapper;
    protected final String baseUrl;
    private final long initialBackoffMs;

    protected AbstractPlatformProvider(String baseUrl, OkHttpClient httpClient, long initialBackoffMs) {
        this.baseUrl = stripTrailingSlash(baseUrl);
        this.httpClient = httpClient;
        this.initialBackoffMs = initialBackoffMs;
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * Builds the client shared by all providers of a run. Every call is bounded by {@code timeout};
     * a timed-out call surfaces as {@link ErrorKind#PROVIDER_ERROR}.
     */
    public static OkHttpClient defaultHttpClient(Duration timeout) {
        return new OkHttpClient.Builder()
                .connectTimeout(timeout)
                .readTimeout(timeout)
                .writeTimeout(timeout)
                .build();
    }

    // -------------------------------------------------------------------------
    // Platform hooks
    // -------------------------------------------------------------------------

    /**
     * Adds the platform's authentication header, if a credential is configured.
     */
    protected abstract void authorize(Request.Builder builder);

    protected String acceptHeader() {
        return "application/json";
    }

    /**
     * Whether {@code statusCode} signals quota exhaustion on this platform.
     */
    protected boolean isRateLimited(int statusCode) {
        return statusCode == 429;
    }

    /**
     * Whether {@code statusCode} means "repository has no history yet" rather than an error.
     */
    protected boolean isEmptyRepository(int statusCode) {
        return false;
    }

    /**
     * Human-readable remaining-quota/reset detail for a rate-limited response, or an empty string.
     */
    protected String rateLimitDetail(Response response) {
        String retryAfter = response.header("Retry-After");
        return retryAfter != null ? " (retry after " + retryAfter + "s)" : "";
    }

    protected String failureMessage(int statusCode, String resource) {
        return platform().displayName() + " API error: HTTP " + statusCode + " for " + resource;
    }

    // -------------------------------------------------------------------------
    // Pagination
    // -------------------------------------------------------------------------

    /**
     * Walks pages starting at {@code firstUrl}. Stops on the first failure (propagated), on a page
     * the platform returned without entries, when the platform reports no further page, or after {@link #MAX_PAGES} requests.
     * Reaching the cap is not an error; the accumulated items are returned.
     */
    protected <T> List<T> walkPages(String firstUrl, String resource, PageReader<T> reader)
            throws ProviderException, InterruptedException {
        List<T> results = new ArrayList<>();
        String url = firstUrl;
        int pageNumber = 0;

        while (url != null) {
            if (pageNumber == MAX_PAGES) {
                logger.debug("Page cap of {} reached for {}; returning partial history", MAX_PAGES, resource);
                break;
            }
            pageNumber++;

            String body = get(url, resource);
            if (body == null) {
                break;
            }

            Page<T> page;
            try {
                page = reader.read(body, pageNumber);
            } catch (IOException e) {
                throw ProviderException.failure(platform().displayName()
                        + " returned a malformed page for " + resource + ": " + e.getMessage(), e);
            }
            if (page.rawCount() == 0) {
                break;
            }
            results.addAll(page.items());
            logger.debug("Fetched page {} with {} items for {}", pageNumber, page.items().size(), resource);

            url = page.nextUrl();
        }

        return results;
    }

    /**
     * Reads one page body into items plus the URL of the following page ({@code null} if none).
     * Entries dropped while mapping still count towards {@link Page#rawCount()}.
     */
    @FunctionalInterface
    protected interface PageReader<T> {
        Page<T> read(String body, int pageNumber) throws IOException;
    }

    /**
     * @param items    mapped entries
     * @param rawCount entries as returned by the platform, before any were dropped
     * @param nextUrl  following page, or {@code null}
     */
    protected record Page<T>(List<T> items, int rawCount, String nextUrl) {}

    // -------------------------------------------------------------------------
    // Core HTTP execution
    // -------------------------------------------------------------------------

    /**
     * Fetches and deserializes a single, non-paginated resource.
     *
     * @return the parsed body, or {@code null} when the platform signals an empty repository
     */
    protected <T> T getJson(String url, String resource, TypeReference<T> typeRef)
            throws ProviderException, InterruptedException {
        String body = get(url, resource);
        if (body == null) {
            return null;
        }
        try {
            return objectMapper.readValue(body, typeRef);
        } catch (IOException e) {
            throw ProviderException.failure(platform().displayName()
                    + " returned a malformed response for " + resource + ": " + e.getMessage(), e);
        }
    }

    Request buildRequest(String url) {
        Request.Builder builder = new Request.Builder()
                .url(url)
                .header("Accept", acceptHeader())
                .header("User-Agent", USER_AGENT);
        authorize(builder);
        return builder.build();
    }

    /**
     * Executes a GET with retry on 502/503/504 and classifies the outcome.
     *
     * @param resource description used in error messages, e.g. {@code "repository 'octo/cat'"}
     * @return the response body, or {@code null} for an empty-repository signal
     */
    String get(String url, String resource) throws ProviderException, InterruptedException {
        Request request = buildRequest(url);
        long backoffMs = initialBackoffMs;

        for (int attempt = 0; attempt <= MAX_RETRIES; attempt++) {
            try (Response response = httpClient.newCall(request).execute()) {
                int statusCode = response.code();
                logResponse(url, statusCode, response);

                if (response.isSuccessful()) {
                    ResponseBody body = response.body();
                    return body != null ? body.string() : "";
                }
                if (isEmptyRepository(statusCode)) {
                    logger.debug("{} reports {} as empty (HTTP {})",
                            platform().displayName(), resource, statusCode);
                    return null;
                }
                if (statusCode == 404) {
                    throw ProviderException.notFound(platform().displayName() + " "
                            + resource + " not found (HTTP 404)");
                }
                if (isRateLimited(statusCode)) {
                    throw ProviderException.rateLimited(platform().displayName()
                            + " rate limit exceeded" + rateLimitDetail(response)
                            + ". Set " + platform().credentialVariable() + " to raise the limit",
                            statusCode);
                }
                if (isTransient(statusCode) && attempt < MAX_RETRIES) {
                    long waitMs = getRetryWaitMs(response, backoffMs);
                    logger.warn("Received {} from {}. Retrying in {}ms (attempt {}/{})",
                            statusCode, url, waitMs, attempt + 1, MAX_RETRIES);
                    Thread.sleep(waitMs);
                    backoffMs = Math.min(backoffMs * 2, MAX_BACKOFF_MS);
                    continue;
                }
                throw ProviderException.failure(failureMessage(statusCode, resource), statusCode);
            } catch (InterruptedIOException e) {
                throw ProviderException.failure(platform().displayName() + " request timed out for "
                        + resource, e);
            } catch (IOException e) {
                throw ProviderException.failure(platform().displayName() + " request failed for "
                        + resource + ": " + e.getMessage(), e);
            }
        }

        throw ProviderException.failure("Exhausted retries for " + resource, ProviderException.NO_STATUS);
    }

    private static boolean isTransient(int statusCode) {
        return statusCode == 502 || statusCode == 503 || statusCode == 504;
    }

    /**
     * Uses the Retry-After header when present, otherwise the current backoff. The header value is
     * clamped to {@code [0, MAX_BACKOFF_MS]}.
     */
    long getRetryWaitMs(Response response, long backoffMs) {
        String retryAfter = response.header("Retry-After");
        if (retryAfter != null) {
            try {
                long seconds = Long.parseLong(retryAfter.trim());
                return Math.max(0, Math.min(seconds, MAX_BACKOFF_MS / 1_000)) * 1_000;
            } catch (NumberFormatException e) {
                logger.debug("Ignoring non-numeric Retry-After '{}'", retryAfter);
            }
        }
        return backoffMs;
    }

    // -------------------------------------------------------------------------
    // Helpers
    // -------------------------------------------------------------------------

    /**
     * Formats remaining quota and reset time from a pair of rate-limit headers.
     */
    static String quotaDetail(Response response, String remainingHeader, String resetHeader) {
        String remaining = response.header(remainingHeader);
        String reset = response.header(resetHeader);
        if (remaining == null && reset == null) {
            return "";
        }
        StringBuilder detail = new StringBuilder(" (");
        if (remaining != null) {
            detail.append("remaining: ").append(remaining);
        }
        if (reset != null) {
            if (remaining != null) {
                detail.append(", ");
            }
            try {
                detail.append("resets at ").append(Instant.ofEpochSecond(Long.parseLong(reset.trim())));
            } catch (NumberFormatException e) {
                detail.append("resets at ").append(reset);
            }
        }
        return detail.append(')').toString();
    }

    /**
     * Parses an ISO-8601 timestamp with either a {@code Z} or numeric offset.
     *
     * @return the instant, or {@code null} when missing or unparseable
     */
    static Instant parseTimestamp(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException e) {
            logger.warn("Dropping commit with unparseable timestamp '{}'", value);
            return null;
        }
    }

    /**
     * Qualifies a bare repository name with the identity; names already containing an owner pass through.
     */
    static String qualify(String identity, String repository) {
        return repository.contains("/") ? repository : identity + "/" + repository;
    }

    static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    /**
     * Encodes one URL path segment. Unlike form encoding, spaces become {@code %20} and {@code ~} is kept.
     */
    static String encodeSegment(String value) {
        return encode(value).replace("+", "%20").replace("%7E", "~");
    }

    /**
     * Encodes each segment of an {@code owner/repo} path, keeping the separators.
     */
    static String encodePath(String path) {
        String[] segments = path.split("/", -1);
        StringBuilder encoded = new StringBuilder();
        for (int i = 0; i < segments.length; i++) {
            if (i > 0) {
                encoded.append('/');
            }
            encoded.append(encodeSegment(segments[i]));
        }
        return encoded.toString();
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    private void logResponse(String url, int statusCode, Response response) {
        String remaining = response.header("X-RateLimit-Remaining");
        if (remaining == null) {
            remaining = response.header("RateLimit-Remaining");
        }
        logger.debug("{} API {} {} | rate-limit-remaining: {}", platform().displayName(),
                statusCode, url, remaining != null ? remaining : "n/a");
    }
}
