package com.repotimeline.collector.client;

import okhttp3.OkHttpClient;

import java.util.EnumMap;
import java.util.Map;

/**
 * Default {@link ProviderFactory}: one provider per platform, sharing a single HTTP client and
 * taking credentials from an explicit map rather than the process environment.
 */
public class PlatformProviders implements ProviderFactory {

    private final OkHttpClient httpClient;
    private final Map<Platform, String> credentials;

    /**
     * @param credentials optional secret per platform; missing entries mean anonymous access
     */
    public PlatformProviders(OkHttpClient httpClient, Map<Platform, String> credentials) {
        this.httpClient = httpClient;
        this.credentials = credentials.isEmpty()
                ? new EnumMap<>(Platform.class)
                : new EnumMap<>(credentials);
    }

    @Override
    public GitPlatformProvider create(Platform platform, String identity) {
        String credential = credentials.get(platform);
        return switch (platform) {
            case GITHUB -> new GitHubProvider(credential, httpClient);
            case GITLAB -> new GitLabProvider(credential, httpClient);
            case BITBUCKET -> new BitbucketProvider(identity, credential, httpClient);
            case SOURCEHUT -> new SourceHutProvider(credential, httpClient);
        };
    }
}
