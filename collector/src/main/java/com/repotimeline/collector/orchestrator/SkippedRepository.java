package com.repotimeline.collector.orchestrator;

/**
 * A repository that contributed no data to a run, with the reason shown to the user.
 */
public record SkippedRepository(String repository, String reason) {

    static final String NO_COMMITS = "no commits found";

    public static SkippedRepository empty(String repository) {
        return new SkippedRepository(repository, NO_COMMITS);
    }

    /**
     * True when the repository was skipped because fetching it failed, not because it was empty.
     */
    public boolean failed() {
        return !NO_COMMITS.equals(reason);
    }
}
