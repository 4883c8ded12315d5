package com.budgetaudit.config;

import com.budgetaudit.observability.MetricsServiceInterface;
import com.budgetaudit.observability.TracingServiceInterface;
import com.budgetaudit.processing.ai.OpenAiCompatibleProvider;
import com.budgetaudit.processing.ai.ProviderChain;
import com.budgetaudit.processing.ai.ProviderTier;
import com.budgetaudit.processing.ai.RegexFallbackProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;

@Configuration
public class AiProviderConfig {

    private static final Logger logger = LoggerFactory.getLogger(AiProviderConfig.class);

    @Bean
    public ProviderChain providerChain(AiProviderProperties properties,
                                       @Qualifier("providerCallExecutor") ExecutorService providerCallExecutor,
                                       MetricsServiceInterface metricsService,
                                       TracingServiceInterface tracingService) {
        List<ProviderChain.TierBinding> tiers = new ArrayList<>();
        addTier(tiers, ProviderTier.PRIMARY, properties.getPrimary(), tracingService);
        addTier(tiers, ProviderTier.BACKUP, properties.getBackup(), tracingService);
        addTier(tiers, ProviderTier.DISASTER_PRIMARY, properties.getDisasterPrimary(), tracingService);
        addTier(tiers, ProviderTier.DISASTER_BACKUP, properties.getDisasterBackup(), tracingService);
        if (tiers.isEmpty()) {
            logger.warn("No AI provider configured, every extraction will use the regex fallback");
        }
        return new ProviderChain(tiers, new RegexFallbackProvider(), providerCallExecutor,
                Duration.ofSeconds(properties.getAttemptTimeoutSeconds()), properties.getFailureThreshold(),
                Clock.systemUTC(), metricsService);
    }

    private static void addTier(List<ProviderChain.TierBinding> tiers, ProviderTier tier, AiProviderProperties.Tier config,
                                TracingServiceInterface tracingService) {
        if (config == null || !config.isConfigured()) {
            logger.info("AI provider tier {} not configured, skipping", tier.getKey());
            return;
        }
        String name = config.getName() != null ? config.getName() : tier.getKey();
        tiers.add(new ProviderChain.TierBinding(tier, new OpenAiCompatibleProvider(name, config.getBaseUrl(),
                config.getApiKey(), config.getModel(), Duration.ofSeconds(config.getReadTimeoutSeconds()), tracingService)));
        logger.info("AI provider tier {} -> {} ({})", tier.getKey(), name, config.getModel());
    }
}
