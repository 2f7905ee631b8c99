package com.repotimeline.collector.export;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.repotimeline.collector.aggregate.DateBucketer;
import com.repotimeline.collector.aggregate.Statistics;
import com.repotimeline.collector.client.Platform;
import com.repotimeline.collector.model.DailySeries;
import com.repotimeline.collector.orchestrator.IngestionResult;
import com.repotimeline.collector.orchestrator.SkippedRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes a run's chart-ready dataset as JSON for the rendering side: the shared date axis,
 * one dataset per repository (own labels plus counts aligned to the axis), skipped
 * repositories and summary statistics.
 */
public class ChartDataExporter {

    private static final Logger logger = LoggerFactory.getLogger(ChartDataExporter.class);

    private final ObjectMapper objectMapper;

    public ChartDataExporter() {
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * Builds the export document. {@code generatedAt} is passed in so output is reproducible.
     */
    public ChartDocument toDocument(Platform platform, String identity, IngestionResult result,
                                    Instant generatedAt) {
        List<LocalDate> axis = result.labelUnion();

        List<Dataset> datasets = new ArrayList<>(result.series().size());
        for (DailySeries series : result.series()) {
            datasets.add(new Dataset(series.repository(), series.totalCommits(), series.labels(),
                    series.counts(), DateBucketer.alignToAxis(series, axis)));
        }

        return new ChartDocument(platform.id(), identity, generatedAt, result.totalCommitsAnalyzed(),
                axis, datasets, result.skippedRepositories(), result.statistics());
    }

    public void write(ChartDocument document, Writer writer) throws IOException {
        objectMapper.writeValue(writer, document);
    }

    public Path export(Platform platform, String identity, IngestionResult result, Path target)
            throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        ChartDocument document = toDocument(platform, identity, result, Instant.now());
        try (Writer writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
            write(document, writer);
        }
        logger.info("Timeline data for {} repositories written to {}", document.datasets().size(), target);
        return target;
    }

    // -------------------------------------------------------------------------
    // Document shape
    // -------------------------------------------------------------------------

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ChartDocument(
            @JsonProperty("platform") String platform,
            @JsonProperty("identity") String identity,
            @JsonProperty("generatedAt") Instant generatedAt,
            @JsonProperty("totalCommits") int totalCommits,
            @JsonProperty("labels") List<LocalDate> labels,
            @JsonProperty("datasets") List<Dataset> datasets,
            @JsonProperty("skipped") List<SkippedRepository> skipped,
            @JsonProperty("statistics") Statistics statistics
    ) {}

    public record Dataset(
            @JsonProperty("label") String label,
            @JsonProperty("total") int total,
            @JsonProperty("labels") List<LocalDate> labels,
            @JsonProperty("counts") List<Integer> counts,
            @JsonProperty("aligned") List<Integer> aligned
    ) {}
}
