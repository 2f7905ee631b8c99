package com.repotimeline.collector.orchestrator;

import com.repotimeline.collector.client.Platform;

import java.util.List;

/**
 * Input of one timeline run.
 *
 * @param platform             platform to query
 * @param identity             user or account name on that platform
 * @param explicitRepositories repositories to process; empty means discover them
 * @param includeMergeCommits  whether merge commits count towards the timeline
 */
public record TimelineRequest(
        Platform platform,
        String identity,
        List<String> explicitRepositories,
        boolean includeMergeCommits
) {

    public TimelineRequest {
        explicitRepositories = explicitRepositories == null ? List.of() : List.copyOf(explicitRepositories);
    }

    public static TimelineRequest discover(Platform platform, String identity) {
        return new TimelineRequest(platform, identity, List.of(), true);
    }
}
