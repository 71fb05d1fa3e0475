package com.labelrun.ingestion.job.campaign;

import com.labelrun.domain.ProgressStats;
import com.labelrun.ingestion.config.CampaignProperties;
import com.labelrun.ingestion.pipeline.FilePipeline;
import com.labelrun.ingestion.pipeline.FileResult;
import com.labelrun.ingestion.pipeline.classification.RunStats;
import com.labelrun.ingestion.pipeline.table.MalformedTableException;
import com.labelrun.ingestion.pipeline.table.RowCountMismatchException;
import com.labelrun.ingestion.store.ProgressStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Labels every *.csv below the input directory, one file at a time, writing each annotated copy to the same
 * relative path under the output directory. Logs a progress report after each file and a final report.
 * A file that is malformed or whose output fails the row-count check is reported and the campaign moves on; the run then ends with
 * {@link CampaignFailedException}. Progress store failures abort immediately.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "labelrun.campaign", name = "enabled", havingValue = "true")
public class LabelCampaignJob {

    private static final String RULE = "=".repeat(60);

    private final FilePipeline filePipeline;
    private final ProgressStore progressStore;
    private final CampaignProperties campaignProperties;
    private final Clock clock;

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        run();
    }

    public CampaignReport run() {
        Path inputDir = Paths.get(campaignProperties.getInputDirectory());
        Path outputDir = Paths.get(campaignProperties.getOutputDirectory());
        List<Path> files = discover(inputDir);
        log.info("Found {} CSV files to process", files.size());
        log.info("Output directory: {}", outputDir.toAbsolutePath());

        RunStats stats = new RunStats(clock);
        List<FileResult> results = new ArrayList<>(files.size());
        List<String> failedFiles = new ArrayList<>();
        for (int i = 0; i < files.size(); i++) {
            Path relative = inputDir.relativize(files.get(i));
            String sourceId = sourceId(relative);
            try {
                results.add(filePipeline.process(files.get(i), outputDir.resolve(relative), sourceId, stats));
            } catch (RowCountMismatchException | MalformedTableException e) {
                log.error("File {} failed: {}", sourceId, e.getMessage());
                failedFiles.add(sourceId);
            }
            logProgress(sourceId, i + 1, files.size(), stats);
        }

        CampaignReport report = new CampaignReport(results, failedFiles, progressStore.stats(), stats.elapsed());
        logFinalReport(files.size(), report, stats);
        if (!failedFiles.isEmpty()) {
            throw new CampaignFailedException(report);
        }
        return report;
    }

    static List<Path> discover(Path inputDir) {
        if (!Files.isDirectory(inputDir)) {
            log.warn("Input directory {} does not exist; nothing to do", inputDir.toAbsolutePath());
            return List.of();
        }
        try (Stream<Path> walk = Files.walk(inputDir)) {
            return walk.filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".csv"))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list " + inputDir, e);
        }
    }

    /** Relative path with '/' separators, stable across platforms. */
    static String sourceId(Path relative) {
        List<String> parts = new ArrayList<>();
        relative.forEach(p -> parts.add(p.toString()));
        return String.join("/", parts);
    }

    private void logProgress(String current, int done, int totalFiles, RunStats stats) {
        ProgressStats totals = progressStore.stats();
        double rate = stats.recordsPerMinute();
        log.info(RULE);
        log.info("Files: {}/{}  Current: {}", done, totalFiles, current);
        log.info("Total records: {}  Completed: {} ({}%)  Failed: {}",
                totals.total(), totals.completed(), format(totals.completedPct()), totals.failed());
        log.info("Processing rate: {} records/min  Elapsed: {} minutes",
                format(rate), format(stats.elapsed().toMillis() / 60_000.0));
        long expected = campaignProperties.getExpectedTotalRecords();
        if (expected > 0 && rate > 0) {
            double eta = stats.etaMinutes(expected - totals.completed());
            log.info("ETA: {} minutes ({} hours)", format(eta), format(eta / 60));
        }
        log.info(RULE);
    }

    private void logFinalReport(int totalFiles, CampaignReport report, RunStats stats) {
        ProgressStats totals = report.totals();
        double minutes = report.elapsed().toMillis() / 60_000.0;
        log.info(RULE);
        log.info("PROCESSING COMPLETE");
        log.info("Total files: {} ({} failed)", totalFiles, report.failedFiles().size());
        log.info("Total records: {}  Successful: {} ({}%)  Failed: {}",
                totals.total(), totals.completed(), format(totals.completedPct()), totals.failed());
        log.info("This run: {} processed, {} skipped, {} batches, labels {}",
                stats.processed(), stats.skipped(), stats.batches(), distribution(stats));
        log.info("Total time: {} minutes ({} hours)  Average rate: {} records/min",
                format(minutes), format(minutes / 60), format(stats.recordsPerMinute()));
        log.info(RULE);
    }

    private static String distribution(RunStats stats) {
        return stats.labelDistribution().entrySet().stream()
                .map(e -> e.getKey().wireName() + "=" + e.getValue())
                .collect(Collectors.joining(", ", "{", "}"));
    }

    private static String format(double value) {
        return String.format(Locale.ROOT, "%.1f", value);
    }
}
