package com.repotimeline.collector.orchestrator;

import com.repotimeline.collector.client.Platform;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for command-line parsing in {@link TimelineApp}.
 */
class TimelineAppTest {

    @Test
    @DisplayName("Parses the minimal invocation with defaults")
    void parseArgs_minimal() {
        TimelineApp.CliOptions options = TimelineApp.parseArgs(new String[]{"--platform", "github", "--user", "octocat"});

        assertEquals(Platform.GITHUB, options.platform());
        assertEquals("octocat", options.identity());
        assertTrue(options.repositories().isEmpty());
        assertTrue(options.includeMerges());
        assertNull(options.output());
        assertFalse(options.quiet());
    }

    @Test
    @DisplayName("Parses short flags, repository lists and switches")
    void parseArgs_full() {
        TimelineApp.CliOptions options = TimelineApp.parseArgs(new String[]{
                "-p", "GitLab", "-u", "jdoe", "-r", "api, web,,", "--repos", "docs",
                "--no-merges", "-o", "out/timeline.json", "-q"});

        assertEquals(Platform.GITLAB, options.platform());
        assertEquals(List.of("api", "web", "docs"), options.repositories());
        assertFalse(options.includeMerges());
        assertEquals(Path.of("out/timeline.json"), options.output());
        assertTrue(options.quiet());

        TimelineRequest request = options.toRequest();
        assertEquals(List.of("api", "web", "docs"), request.explicitRepositories());
        assertFalse(request.includeMergeCommits());
    }

    @Test
    @DisplayName("Rejects missing required arguments")
    void parseArgs_missingRequired() {
        IllegalArgumentException noPlatform = assertThrows(IllegalArgumentException.class,
                () -> TimelineApp.parseArgs(new String[]{"--user", "octocat"}));
        IllegalArgumentException noUser = assertThrows(IllegalArgumentException.class,
                () -> TimelineApp.parseArgs(new String[]{"--platform", "github"}));

        assertEquals("Missing required argument: --platform", noPlatform.getMessage());
        assertEquals("Missing required argument: --user", noUser.getMessage());
    }

    @Test
    @DisplayName("Rejects unknown flags, missing values and unsupported platforms")
    void parseArgs_invalid() {
        assertEquals("Unknown argument: --verbose", assertThrows(IllegalArgumentException.class,
                () -> TimelineApp.parseArgs(new String[]{"--verbose"})).getMessage());
        assertEquals("Missing value for --user", assertThrows(IllegalArgumentException.class,
                () -> TimelineApp.parseArgs(new String[]{"--platform", "github", "--user"})).getMessage());
        assertThrows(IllegalArgumentException.class,
                () -> TimelineApp.parseArgs(new String[]{"--platform", "gitea", "--user", "x"}));
    }

    @Test
    @DisplayName("Usage errors exit with status 2")
    void run_usageError() {
        assertEquals(TimelineApp.EXIT_USAGE, TimelineApp.run(new String[]{"--user", "octocat"}));
    }

    @Test
    @DisplayName("splitRepositories trims and drops blanks")
    void splitRepositories() {
        assertEquals(List.of("a", "b"), TimelineApp.splitRepositories(" a ,, b ,"));
        assertTrue(TimelineApp.splitRepositories(" , ").isEmpty());
    }
}
