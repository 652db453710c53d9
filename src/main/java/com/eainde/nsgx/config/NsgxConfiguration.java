package com.eainde.nsgx.config;

import com.eainde.nsgx.cache.JdbcResultCache;
import com.eainde.nsgx.chunk.DocumentSegmenter;
import com.eainde.nsgx.chunk.RuleBearingUnitFilter;
import com.eainde.nsgx.client.ChatCompletionExtractionClient;
import com.eainde.nsgx.client.ExtractionClient;
import com.eainde.nsgx.client.InstructionTemplate;
import com.eainde.nsgx.client.ModelProfile;
import com.eainde.nsgx.exception.CatalogLoadException;
import com.eainde.nsgx.merge.CandidateMerger;
import com.eainde.nsgx.merge.ConditionCanonicalizer;
import com.eainde.nsgx.merge.ConditionMerger;
import com.eainde.nsgx.merge.DocumentMergeEngine;
import com.eainde.nsgx.orchestration.ConcurrentExtractionOrchestrator;
import com.eainde.nsgx.orchestration.EscalationPolicy;
import com.eainde.nsgx.orchestration.ProviderMode;
import com.eainde.nsgx.orchestration.UnitProcessor;
import com.eainde.nsgx.pipeline.EnumDiffPipeline;
import com.eainde.nsgx.pipeline.PipelineOptions;
import com.eainde.nsgx.pipeline.TextDocumentSource;
import com.eainde.nsgx.proposal.CandidateClusterer;
import com.eainde.nsgx.proposal.CandidateDecisionEngine;
import com.eainde.nsgx.proposal.ProposalEngine;
import com.eainde.nsgx.proposal.QualifierHeuristics;
import com.eainde.nsgx.proposal.VocabularyCatalog;
import com.eainde.nsgx.report.ChangelogWriter;
import com.eainde.nsgx.report.DbmlPatchWriter;
import com.eainde.nsgx.report.ModelUpdateProposalWriter;
import com.eainde.nsgx.report.OutputLayout;
import com.eainde.nsgx.report.ResultWriter;
import com.eainde.nsgx.report.ReviewCsvExporter;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.log4j.Log4j2;
import okhttp3.OkHttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Lazy;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.PlatformTransactionManager;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Set;

/**
 * Wires the extraction pipeline from {@link NsgxSettings}.
 */
@Log4j2
@Configuration
public class NsgxConfiguration {

    private final NsgxSettings settings;

    public NsgxConfiguration(NsgxSettings settings) {
        this.settings = settings;
    }

    // ── Shared infrastructure ───────────────────────────────────────────

    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper();
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public OkHttpClient okHttpClient() {
        return new OkHttpClient.Builder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    // ── Extraction ──────────────────────────────────────────────────────

    /**
     * Built on first use, so the propose stage starts without endpoint and API key.
     */
    @Bean
    @Lazy
    public ChatCompletionExtractionClient extractionClient(OkHttpClient okHttpClient, ObjectMapper objectMapper) {
        return ChatCompletionExtractionClient.builder()
                .endpoint(settings.getEndpoint())
                .apiKey(settings.getApiKey())
                .httpClient(okHttpClient)
                .objectMapper(objectMapper)
                .emptyContentRetries(settings.getEmptyContentRetries())
                .emptyContentDelay(settings.getEmptyContentDelay())
                .defaultRetryAfter(settings.getDefaultRetryAfter())
                .build();
    }

    @Bean
    public VocabularyCatalog vocabularyCatalog(ResourceLoader resourceLoader, ObjectMapper objectMapper) {
        Resource resource = resourceLoader.getResource(settings.getCatalogLocation());
        try (InputStream in = resource.getInputStream()) {
            VocabularyCatalog catalog = VocabularyCatalog.load(in, objectMapper);
            log.info("Loaded known vocabulary from {}: {}", settings.getCatalogLocation(), catalog.getEnums().keySet());
            return catalog;
        } catch (IOException e) {
            throw new CatalogLoadException("Known vocabulary not found at " + settings.getCatalogLocation(), e);
        }
    }

    @Bean
    public JdbcResultCache resultCache(JdbcTemplate jdbcTemplate,
                                       PlatformTransactionManager transactionManager,
                                       ObjectMapper objectMapper) {
        JdbcResultCache cache = new JdbcResultCache(jdbcTemplate, transactionManager, objectMapper);
        cache.initializeSchema();
        return cache;
    }

    @Bean
    public ConcurrentExtractionOrchestrator extractionOrchestrator(@Lazy ExtractionClient extractionClient,
                                                                   JdbcResultCache resultCache,
                                                                   VocabularyCatalog vocabularyCatalog,
                                                                   ResourceLoader resourceLoader,
                                                                   ObjectMapper objectMapper) {
        String instructions = InstructionTemplate
                .load(resourceLoader.getResource(settings.getPromptLocation()))
                .render(vocabularyCatalog.toJson(objectMapper));
        UnitProcessor processor = new UnitProcessor(
                extractionClient,
                resultCache,
                instructions,
                fastModel(),
                thoroughModel(),
                ProviderMode.fromLabel(settings.getProviderMode()),
                new EscalationPolicy(settings.getEscalationConfidence()));
        return new ConcurrentExtractionOrchestrator(processor, settings.getConcurrency());
    }

    // ── Merge + proposal ────────────────────────────────────────────────

    @Bean
    public DocumentMergeEngine documentMergeEngine() {
        return new DocumentMergeEngine(
                new ConditionMerger(Set.copyOf(settings.getRangeConditionTypes())),
                new ConditionCanonicalizer(settings.getPsToKwFactor()),
                new CandidateMerger(settings.getQuoteMaxLength()));
    }

    @Bean
    public ProposalEngine proposalEngine(VocabularyCatalog vocabularyCatalog) {
        CandidateDecisionEngine decisionEngine = new CandidateDecisionEngine(
                vocabularyCatalog, QualifierHeuristics.defaults(), settings.getSimilarityThreshold());
        return new ProposalEngine(decisionEngine, new CandidateClusterer(settings.getSimilarityThreshold()));
    }

    // ── Pipeline ────────────────────────────────────────────────────────

    @Bean
    public ResultWriter resultWriter(ObjectMapper objectMapper) {
        return new ResultWriter(new OutputLayout(Path.of(settings.getOutputDir())), objectMapper);
    }

    @Bean
    public EnumDiffPipeline enumDiffPipeline(@Lazy ExtractionClient extractionClient,
                                             ConcurrentExtractionOrchestrator extractionOrchestrator,
                                             DocumentMergeEngine documentMergeEngine,
                                             ProposalEngine proposalEngine,
                                             ResultWriter resultWriter,
                                             Clock clock) {
        ProviderMode mode = ProviderMode.fromLabel(settings.getProviderMode());
        ModelProfile connectivityModel = !settings.isConnectivityCheck() ? null
                : mode == ProviderMode.THOROUGH ? thoroughModel() : fastModel();
        PipelineOptions options = new PipelineOptions(
                settings.isRuleFilterEnabled(), connectivityModel, settings.getMinDocCount(), settings.isOverwrite());

        return new EnumDiffPipeline(
                new TextDocumentSource(),
                DocumentSegmenter.builder().maxUnitChars(settings.getMaxUnitChars()).build(),
                new RuleBearingUnitFilter(),
                extractionClient,
                extractionOrchestrator,
                documentMergeEngine,
                proposalEngine,
                resultWriter,
                new ReviewCsvExporter(),
                new ChangelogWriter(clock),
                new DbmlPatchWriter(clock),
                new ModelUpdateProposalWriter(clock),
                options);
    }

    private ModelProfile fastModel() {
        return ModelProfile.fast(settings.getFastModel(), settings.getFastTimeout());
    }

    private ModelProfile thoroughModel() {
        return ModelProfile.thorough(settings.getThoroughModel(), settings.getThoroughTimeout());
    }
}
