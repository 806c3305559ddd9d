package com.aegis.rulegov.service.config;

import com.aegis.rulegov.analysis.OverlapAnalyzer;
import com.aegis.rulegov.api.RuleGenerator;
import com.aegis.rulegov.api.TransactionRecordStore;
import com.aegis.rulegov.catalog.FeatureCatalog;
import com.aegis.rulegov.evaluation.ConditionEvaluator;
import com.aegis.rulegov.evaluation.DryRunEngine;
import com.aegis.rulegov.generation.GenerationSettings;
import com.aegis.rulegov.generation.GuardedRuleGenerator;
import com.aegis.rulegov.generation.RuleOutputSchema;
import com.aegis.rulegov.governance.GovernanceSettings;
import com.aegis.rulegov.governance.SuggestionTransitions;
import com.aegis.rulegov.infra.telemetry.TracingService;
import com.aegis.rulegov.policy.PolicyGate;
import com.aegis.rulegov.sampling.SamplerSettings;
import com.aegis.rulegov.sampling.StratifiedSampler;
import com.aegis.rulegov.service.generation.OpenAiRuleGenerator;
import com.aegis.rulegov.validation.CatalogValidator;
import com.aegis.rulegov.validation.RuleStructureValidator;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.opentelemetry.api.trace.Tracer;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import okhttp3.OkHttpClient;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.logging.Logger;

/**
 * CDI producers for the framework-free core and evaluator components.
 * Settings come from {@code aegis.*} properties.
 */
@ApplicationScoped
public class AegisProducers {

    private static final Logger logger = Logger.getLogger(AegisProducers.class.getName());

    @ConfigProperty(name = "aegis.sampler.share.recent", defaultValue = "0.30")
    double recentShare;

    @ConfigProperty(name = "aegis.sampler.share.weekend-off-hours", defaultValue = "0.15")
    double weekendOffHoursShare;

    @ConfigProperty(name = "aegis.sampler.share.flagged-disputed", defaultValue = "0.20")
    double flaggedDisputedShare;

    @ConfigProperty(name = "aegis.sampler.share.high-value", defaultValue = "0.15")
    double highValueShare;

    @ConfigProperty(name = "aegis.sampler.share.random", defaultValue = "0.20")
    double randomShare;

    @ConfigProperty(name = "aegis.sampler.high-value-threshold", defaultValue = "5000")
    double highValueThreshold;

    @ConfigProperty(name = "aegis.evaluation.parallel-threshold", defaultValue = "5000")
    int parallelThreshold;

    @ConfigProperty(name = "aegis.generation.endpoint", defaultValue = "https://api.openai.com/v1")
    String generatorEndpoint;

    @ConfigProperty(name = "aegis.generation.api-key", defaultValue = "")
    String generatorApiKey;

    @ConfigProperty(name = "aegis.generation.model", defaultValue = "gpt-4o-mini")
    String generatorModel;

    @ConfigProperty(name = "aegis.generation.timeout-seconds", defaultValue = "20")
    long generationTimeoutSeconds;

    @ConfigProperty(name = "aegis.generation.rate-limit-per-minute", defaultValue = "10")
    int generationRateLimit;

    @ConfigProperty(name = "aegis.generation.cache-ttl-minutes", defaultValue = "30")
    long generationCacheTtlMinutes;

    @ConfigProperty(name = "aegis.generation.cache-max-size", defaultValue = "1000")
    long generationCacheMaxSize;

    @ConfigProperty(name = "aegis.governance.min-notes-length", defaultValue = "10")
    int minNotesLength;

    @ConfigProperty(name = "aegis.governance.suggestion-ttl-days", defaultValue = "7")
    long suggestionTtlDays;

    private final ExecutorService samplingExecutor = Executors.newFixedThreadPool(
            Runtime.getRuntime().availableProcessors(), daemonThreads("stratum-query"));

    private final ExecutorService generationExecutor = Executors.newCachedThreadPool(daemonThreads("rule-generation"));

    @Produces
    @Singleton
    public TracingService tracingService() {
        return TracingService.getInstance();
    }

    @Produces
    @ApplicationScoped
    public Tracer tracer(TracingService tracingService) {
        return tracingService.getTracer();
    }

    @Produces
    @Singleton
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Produces
    @Singleton
    public FeatureCatalog featureCatalog() {
        FeatureCatalog catalog = FeatureCatalog.loadDefault();
        logger.info("Feature catalog " + catalog.version() + " loaded with " + catalog.features().size() + " fields");
        return catalog;
    }

    @Produces
    @Singleton
    public RuleStructureValidator structureValidator(FeatureCatalog catalog) {
        return new RuleStructureValidator(catalog.policy().maxConditions());
    }

    @Produces
    @Singleton
    public CatalogValidator catalogValidator(FeatureCatalog catalog) {
        return new CatalogValidator(catalog);
    }

    @Produces
    @Singleton
    public PolicyGate policyGate(FeatureCatalog catalog) {
        return new PolicyGate(catalog.policy());
    }

    @Produces
    @Singleton
    public SuggestionTransitions suggestionTransitions() {
        return new SuggestionTransitions(new GovernanceSettings(minNotesLength, Duration.ofDays(suggestionTtlDays)));
    }

    /**
     * The generation chain: HTTP client, wrapped with the prompt cache, the per-caller rate
     * limit and the hard timeout.
     */
    @Produces
    @Singleton
    public RuleGenerator ruleGenerator(FeatureCatalog catalog, Clock clock) {
        Duration timeout = Duration.ofSeconds(generationTimeoutSeconds);
        OkHttpClient client = new OkHttpClient.Builder()
                .connectTimeout(Duration.ofSeconds(5))
                .readTimeout(timeout)
                .callTimeout(timeout)
                .build();
        RuleGenerator upstream = new OpenAiRuleGenerator(client, generatorEndpoint, generatorApiKey,
                generatorModel, new RuleOutputSchema(catalog));
        GenerationSettings settings = new GenerationSettings(generatorModel, timeout, generationRateLimit,
                Duration.ofMinutes(1), Duration.ofMinutes(generationCacheTtlMinutes), generationCacheMaxSize, 10);
        if (generatorApiKey.isBlank()) {
            logger.warning("aegis.generation.api-key is not set; rule generation calls will be refused upstream");
        }
        return new GuardedRuleGenerator(upstream, settings, generationExecutor, clock);
    }

    @Produces
    @Singleton
    public StratifiedSampler stratifiedSampler(TransactionRecordStore store, Clock clock) {
        SamplerSettings shares = SamplerSettings.withShares(recentShare, weekendOffHoursShare,
                flaggedDisputedShare, highValueShare, randomShare);
        SamplerSettings settings = new SamplerSettings(shares.shares(), shares.windows(), highValueThreshold,
                shares.businessHoursStart(), shares.businessHoursEnd());
        return new StratifiedSampler(store, settings, samplingExecutor, clock);
    }

    @Produces
    @Singleton
    public ConditionEvaluator conditionEvaluator() {
        return new ConditionEvaluator();
    }

    @Produces
    @Singleton
    public DryRunEngine dryRunEngine(ConditionEvaluator evaluator, PolicyGate policyGate, Clock clock) {
        return new DryRunEngine(evaluator, policyGate::stripPII, parallelThreshold, clock);
    }

    @Produces
    @Singleton
    public OverlapAnalyzer overlapAnalyzer(ConditionEvaluator evaluator) {
        return new OverlapAnalyzer(evaluator);
    }

    @PreDestroy
    void shutdownExecutors() {
        samplingExecutor.shutdownNow();
        generationExecutor.shutdownNow();
    }

    private static ThreadFactory daemonThreads(String prefix) {
        return new ThreadFactoryBuilder()
                .setNameFormat(prefix + "-%d")
                .setDaemon(true)
                .build();
    }
}
