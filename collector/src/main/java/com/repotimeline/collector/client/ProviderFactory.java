package com.repotimeline.collector.client;

/**
 * Creates the provider variant matching a platform for one run.
 */
@FunctionalInterface
public interface ProviderFactory {

    GitPlatformProvider create(Platform platform, String identity);
}
