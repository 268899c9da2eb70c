package com.dcruver.clausedrift.io;

import com.dcruver.clausedrift.config.DriftProperties;
import com.dcruver.clausedrift.domain.Change;
import com.dcruver.clausedrift.pipeline.ComparisonResult;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Writes comparison results as JSON plus a patch file of clause diffs.
 */
@Component
@Slf4j
public class ComparisonReportWriter {

    private static final DateTimeFormatter TIMESTAMP_FORMAT =
        DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss").withZone(ZoneOffset.UTC);

    private final ObjectMapper objectMapper;
    private final Path reportDir;

    public ComparisonReportWriter(DriftProperties properties) {
        this(Paths.get(properties.getReports().getDir()
            .replace("${user.home}", System.getProperty("user.home"))));
    }

    ComparisonReportWriter(Path reportDir) {
        this.reportDir = reportDir.toAbsolutePath();
        this.objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    /**
     * Write {@code <id>-<timestamp>.json} and, when any clause changed in place,
     * a matching {@code .patch} file.
     *
     * @return path of the JSON report
     */
    public Path write(ComparisonResult result) throws IOException {
        Files.createDirectories(reportDir);

        Instant completedAt = result.getCompletedAt() != null ? result.getCompletedAt() : Instant.now();
        String baseName = result.getComparisonId() + "-" + TIMESTAMP_FORMAT.format(completedAt);

        Path jsonFile = reportDir.resolve(baseName + ".json");
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(jsonFile.toFile(), result);

        String patch = buildPatch(result.getChanges());
        if (!patch.isEmpty()) {
            Files.writeString(reportDir.resolve(baseName + ".patch"), patch);
        }

        log.info("Wrote comparison report: {}", jsonFile);
        return jsonFile;
    }

    private String buildPatch(List<Change> changes) {
        StringBuilder sb = new StringBuilder();
        for (Change change : changes) {
            if (change.getDiff() == null || change.getDiff().getUnifiedDiff().isEmpty()) {
                continue;
            }
            sb.append(change.getDiff().getUnifiedDiff()).append("\n");
        }
        return sb.toString();
    }
}
