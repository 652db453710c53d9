package com.eainde.nsgx.pipeline;

import com.eainde.nsgx.config.NsgxSettings;
import com.eainde.nsgx.report.RunSummary;
import lombok.extern.log4j.Log4j2;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.Locale;

/**
 * Runs the pipeline at startup when {@code nsgx.run.enabled=true}.
 *
 * <pre>
 * nsgx.run.stage=all      extract, merge, propose, export
 * nsgx.run.stage=propose  propose + export from stored document results only
 * </pre>
 */
@Log4j2
@Component
@ConditionalOnProperty(prefix = "nsgx.run", name = "enabled", havingValue = "true")
public class PipelineRunner implements CommandLineRunner {

    private final EnumDiffPipeline pipeline;
    private final NsgxSettings settings;

    public PipelineRunner(EnumDiffPipeline pipeline, NsgxSettings settings) {
        this.pipeline = pipeline;
        this.settings = settings;
    }

    @Override
    public void run(String... args) {
        String stage = settings.getStage().trim().toLowerCase(Locale.ROOT);
        switch (stage) {
            case "all" -> {
                PipelineReport report = pipeline.run(Path.of(settings.getInputDir()));
                RunSummary summary = report.runSummary();
                log.info("Run complete: {}/{} units succeeded, {} failed, {} documents without result, {} new values proposed",
                        summary.unitsSucceeded(), summary.units(), summary.unitsFailed(), summary.documentsFailed(),
                        report.proposals().aggregates().size());
            }
            case "propose" -> pipeline.proposeFromOutput();
            default -> throw new IllegalArgumentException("Unknown nsgx.run.stage: " + settings.getStage());
        }
    }
}
