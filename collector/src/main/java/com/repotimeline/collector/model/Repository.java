package com.repotimeline.collector.model;

/**
 * A repository discovered on a hosting platform, normalized across providers.
 *
 * @param name          short name used in commit-listing calls
 * @param fullName      owner-qualified name ({@code owner/repo})
 * @param url           browser URL of the repository
 * @param description   free-text description, may be {@code null}
 * @param defaultBranch name of the default branch
 */
public record Repository(
        String name,
        String fullName,
        String url,
        String description,
        String defaultBranch
) {}
