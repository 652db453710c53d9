package com.eainde.nsgx.config;

import com.eainde.nsgx.client.ChatCompletionExtractionClient;
import com.eainde.nsgx.client.ExtractionClient;
import com.eainde.nsgx.exception.ExtractionConfigurationException;
import com.eainde.nsgx.model.Candidate;
import com.eainde.nsgx.model.DocumentResult;
import com.eainde.nsgx.pipeline.EnumDiffPipeline;
import com.eainde.nsgx.pipeline.PipelineRunner;
import com.eainde.nsgx.report.OutputLayout;
import com.eainde.nsgx.report.ResultWriter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.context.PropertyPlaceholderAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceTransactionManagerAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.JdbcTemplateAutoConfiguration;
import org.springframework.boot.convert.ApplicationConversionService;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NsgxConfigurationTest {

    @TempDir
    Path outputDir;

    private ApplicationContextRunner contextRunner() {
        return new ApplicationContextRunner()
                .withInitializer(context -> context.getBeanFactory()
                        .setConversionService(ApplicationConversionService.getSharedInstance()))
                .withConfiguration(AutoConfigurations.of(
                        PropertyPlaceholderAutoConfiguration.class,
                        DataSourceAutoConfiguration.class,
                        JdbcTemplateAutoConfiguration.class,
                        DataSourceTransactionManagerAutoConfiguration.class))
                .withUserConfiguration(NsgxSettings.class, NsgxConfiguration.class, PipelineRunner.class)
                .withPropertyValues(
                        "spring.datasource.url=jdbc:h2:mem:" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1",
                        "nsgx.run.enabled=true",
                        "nsgx.run.output-dir=" + outputDir);
    }

    private ApplicationContextRunner withoutCredentials() {
        return contextRunner().withPropertyValues("nsgx.client.endpoint=", "nsgx.client.api-key=");
    }

    // =========================================================================
    //  Propose stage
    // =========================================================================

    @Nested
    @DisplayName("Without service credentials")
    class WithoutCredentials {

        @Test
        @DisplayName("should start and run the propose stage from stored document results")
        void proposeStage() {
            withoutCredentials().withPropertyValues("nsgx.run.stage=propose").run(context -> {
                assertThat(context).hasNotFailed();
                assertThat(context).hasSingleBean(EnumDiffPipeline.class);

                ResultWriter writer = context.getBean(ResultWriter.class);
                writer.writeDocumentResult(new DocumentResult("NSG-0001-001", 1, List.of(),
                        Map.of("activities", List.of(Candidate.of("slacklining", "Slacklining",
                                "Slacklining ist verboten.", 0.8)))), true);

                context.getBean(PipelineRunner.class).run();

                OutputLayout layout = new OutputLayout(outputDir);
                assertThat(layout.proposals()).exists();
                assertThat(layout.reviewCsv()).exists();
                assertThat(layout.summary("propose")).exists();
            });
        }

        @Test
        @DisplayName("should report the missing configuration once the client is first used")
        void clientFailsOnFirstUse() {
            withoutCredentials().run(context -> {
                assertThat(context).hasNotFailed();

                assertThatThrownBy(() -> context.getBean(ExtractionClient.class))
                        .hasRootCauseInstanceOf(ExtractionConfigurationException.class);
            });
        }
    }

    // =========================================================================
    //  Configured client
    // =========================================================================

    @Test
    @DisplayName("should build the chat-completion client when endpoint and API key are set")
    void configuredClient() {
        contextRunner()
                .withPropertyValues("nsgx.client.endpoint=http://localhost:8089/v1", "nsgx.client.api-key=test-key")
                .run(context -> {
                    assertThat(context).hasNotFailed();
                    assertThat(context.getBean(ExtractionClient.class))
                            .isInstanceOf(ChatCompletionExtractionClient.class);
                });
    }
}
