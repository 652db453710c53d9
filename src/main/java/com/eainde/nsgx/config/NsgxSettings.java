package com.eainde.nsgx.config;

import lombok.Getter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;

/**
 * All {@code nsgx.*} settings. Engines are built from these in
 * {@link NsgxConfiguration} and never read properties themselves.
 */
@Getter
@Component
public class NsgxSettings {

    // ── Segmenter ───────────────────────────────────────────────────────

    @Value("${nsgx.segmenter.max-unit-chars:4000}")
    private int maxUnitChars;

    @Value("${nsgx.segmenter.rule-filter.enabled:false}")
    private boolean ruleFilterEnabled;

    // ── Extraction client ───────────────────────────────────────────────

    @Value("${nsgx.client.endpoint:${DEEPSEEK_ENDPOINT:}}")
    private String endpoint;

    @Value("${nsgx.client.api-key:${DEEPSEEK_API_KEY:}}")
    private String apiKey;

    @Value("${nsgx.client.fast-model:deepseek-chat}")
    private String fastModel;

    @Value("${nsgx.client.thorough-model:deepseek-reasoner}")
    private String thoroughModel;

    @Value("${nsgx.client.fast-timeout:60s}")
    private Duration fastTimeout;

    @Value("${nsgx.client.thorough-timeout:90s}")
    private Duration thoroughTimeout;

    @Value("${nsgx.client.empty-content-retries:2}")
    private int emptyContentRetries;

    @Value("${nsgx.client.empty-content-delay:1s}")
    private Duration emptyContentDelay;

    @Value("${nsgx.client.default-retry-after:60s}")
    private Duration defaultRetryAfter;

    @Value("${nsgx.client.connectivity-check:true}")
    private boolean connectivityCheck;

    // ── Orchestrator ────────────────────────────────────────────────────

    @Value("${nsgx.orchestrator.concurrency:4}")
    private int concurrency;

    @Value("${nsgx.orchestrator.provider-mode:adaptive}")
    private String providerMode;

    @Value("${nsgx.orchestrator.escalation-confidence:0.65}")
    private double escalationConfidence;

    // ── Merge ───────────────────────────────────────────────────────────

    @Value("${nsgx.merge.range-condition-types:datumspanne,tageszeit,date_range,time_range}")
    private List<String> rangeConditionTypes;

    @Value("${nsgx.merge.quote-max-length:500}")
    private int quoteMaxLength;

    @Value("${nsgx.heuristics.ps-to-kw-factor:0.7355}")
    private double psToKwFactor;

    // ── Proposal ────────────────────────────────────────────────────────

    @Value("${nsgx.proposal.min-doc-count:5}")
    private int minDocCount;

    @Value("${nsgx.proposal.similarity-threshold:80}")
    private double similarityThreshold;

    @Value("${nsgx.catalog.location:classpath:prompts/known_enums.json}")
    private String catalogLocation;

    @Value("${nsgx.prompt.location:classpath:prompts/extractor_system.txt}")
    private String promptLocation;

    // ── Run ─────────────────────────────────────────────────────────────

    @Value("${nsgx.run.stage:all}")
    private String stage;

    @Value("${nsgx.run.input-dir:./data/text}")
    private String inputDir;

    @Value("${nsgx.run.output-dir:./out}")
    private String outputDir;

    @Value("${nsgx.run.overwrite:true}")
    private boolean overwrite;
}
