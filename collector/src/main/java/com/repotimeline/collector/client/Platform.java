package com.repotimeline.collector.client;

import java.util.Locale;

/**
 * Git hosting platforms a timeline can be collected from.
 */
public enum Platform {

    GITHUB("github", "GitHub", "GITHUB_TOKEN"),
    GITLAB("gitlab", "GitLab", "GITLAB_TOKEN"),
    BITBUCKET("bitbucket", "Bitbucket", "BITBUCKET_APP_PASSWORD"),
    SOURCEHUT("sourcehut", "SourceHut", "SOURCEHUT_TOKEN");

    private final String id;
    private final String displayName;
    private final String credentialVariable;

    Platform(String id, String displayName, String credentialVariable) {
        this.id = id;
        this.displayName = displayName;
        this.credentialVariable = credentialVariable;
    }

    public String id() {
        return id;
    }

    public String displayName() {
        return displayName;
    }

    /**
     * Well-known configuration name under which this platform's credential is looked up.
     */
    public String credentialVariable() {
        return credentialVariable;
    }

    /**
     * Resolves a platform from its lower-case id, e.g. {@code "gitlab"}.
     *
     * @throws IllegalArgumentException if the id names no supported platform
     */
    public static Platform fromId(String id) {
        if (id != null) {
            String normalized = id.trim().toLowerCase(Locale.ROOT);
            for (Platform platform : values()) {
                if (platform.id.equals(normalized)) {
                    return platform;
                }
            }
        }
        throw new IllegalArgumentException("Unsupported platform: " + id
                + " (expected one of github, gitlab, bitbucket, sourcehut)");
    }
}
