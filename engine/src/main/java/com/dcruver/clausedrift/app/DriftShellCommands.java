package com.dcruver.clausedrift.app;

import com.dcruver.clausedrift.domain.Clause;
import com.dcruver.clausedrift.domain.Fingerprint;
import com.dcruver.clausedrift.fingerprint.FingerprintEngine;
import com.dcruver.clausedrift.io.ComparisonReportWriter;
import com.dcruver.clausedrift.nlp.DriftAssistant;
import com.dcruver.clausedrift.pipeline.ComparisonRequest;
import com.dcruver.clausedrift.pipeline.ComparisonResult;
import com.dcruver.clausedrift.pipeline.ContractDriftPipeline;
import com.dcruver.clausedrift.reporting.DriftReportGenerator;
import com.dcruver.clausedrift.segment.ClauseSegmenter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;
import org.springframework.shell.standard.ShellOption;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Spring Shell commands for comparing plain-text contract versions.
 */
@ShellComponent
@Slf4j
public class DriftShellCommands {

    private final ClauseSegmenter segmenter;
    private final FingerprintEngine fingerprintEngine;
    private final ContractDriftPipeline pipeline;
    private final ComparisonReportWriter reportWriter;
    private final DriftReportGenerator reportGenerator;
    private final DriftAssistant assistant;

    public DriftShellCommands(
            ClauseSegmenter segmenter,
            FingerprintEngine fingerprintEngine,
            ContractDriftPipeline pipeline,
            ComparisonReportWriter reportWriter,
            DriftReportGenerator reportGenerator,
            @Autowired(required = false) DriftAssistant assistant) {
        this.segmenter = segmenter;
        this.fingerprintEngine = fingerprintEngine;
        this.pipeline = pipeline;
        this.reportWriter = reportWriter;
        this.reportGenerator = reportGenerator;
        this.assistant = assistant;
    }

    @ShellMethod(key = "segment", value = "Split a plain-text contract into clauses")
    public String segment(@ShellOption String file) {
        try {
            Path path = Path.of(file);
            List<Clause> clauses = segmenter.segment(path.getFileName().toString(), Files.readString(path));

            if (clauses.isEmpty()) {
                return "No clauses found.";
            }

            StringBuilder sb = new StringBuilder();
            for (Clause clause : clauses) {
                sb.append(String.format("%3d. [%s] %d words, chars %d-%d%n     %s%n",
                    clause.getNumber(),
                    clause.getCategoryKey() != null ? clause.getCategoryKey() : "uncategorized",
                    clause.getWordCount(),
                    clause.getSpanStart(),
                    clause.getSpanEnd(),
                    truncate(clause.getText(), 100)));
            }
            sb.append(String.format("%nTotal: %d clauses%n", clauses.size()));
            return sb.toString();

        } catch (Exception e) {
            log.error("Segmentation failed", e);
            return "Segmentation failed: " + e.getMessage();
        }
    }

    @ShellMethod(key = "compare", value = "Compare two versions of a contract and classify the risk of each change")
    public String compare(
            @ShellOption String oldFile,
            @ShellOption String newFile,
            @ShellOption(defaultValue = "false") boolean save) {
        try {
            Path oldPath = Path.of(oldFile);
            Path newPath = Path.of(newFile);

            ComparisonResult result = pipeline.compare(ComparisonRequest.builder()
                .oldVersionId(oldPath.getFileName().toString())
                .oldText(Files.readString(oldPath))
                .newVersionId(newPath.getFileName().toString())
                .newText(Files.readString(newPath))
                .build());

            StringBuilder sb = new StringBuilder(reportGenerator.render(result));
            if (save) {
                Path report = reportWriter.write(result);
                sb.append("\nReport saved to: ").append(report).append("\n");
            }
            return sb.toString();

        } catch (Exception e) {
            log.error("Comparison failed", e);
            return "Comparison failed: " + e.getMessage();
        }
    }

    @ShellMethod(key = "similarity", value = "Fingerprint similarity of two text snippets")
    public String similarity(@ShellOption String first, @ShellOption String second) {
        List<Fingerprint> prints = fingerprintEngine.fingerprintBatch("adhoc", List.of(first, second));
        double score = fingerprintEngine.similarity(prints.get(0), prints.get(1));
        return String.format("Similarity: %.3f (hamming distance %d)",
            score, FingerprintEngine.hammingDistance(prints.get(0), prints.get(1)));
    }

    @ShellMethod(key = "ai status", value = "Show whether the AI assistant is configured")
    public String aiStatus() {
        return assistant != null
            ? "AI assistant enabled: summaries and explanations come from the language model."
            : "AI assistant disabled: rule-based explanations only. Set drift.ai.enabled=true to enable.";
    }

    private String truncate(String text, int maxLength) {
        if (text == null || text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength) + "...";
    }
}
