package com.lucidityplatform.ledger.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.lucidityplatform.common.catalog.EffectCatalog;
import com.lucidityplatform.common.flux.EnvironmentFluxConfig;
import com.lucidityplatform.common.ledger.LiabilityRoller;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ClassPathResource;
import org.springframework.web.reactive.function.client.WebClient;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Clock;

@Configuration
public class LedgerConfig {

    private static final Logger log = LoggerFactory.getLogger(LedgerConfig.class);

    @Value("${services.notification.base-url}")
    private String notificationUrl;

    @Value("${services.world.base-url}")
    private String worldUrl;

    @Value("${lucidity.catalog.effects:lucidity/effect-catalog.json}")
    private String effectCatalogPath;

    @Value("${lucidity.catalog.environment:lucidity/flux-environment.json}")
    private String environmentPath;

    @Value("${lucidity.liability.loss-threshold:15}")
    private int liabilityLossThreshold;

    @Bean
    public WebClient notificationClient(WebClient.Builder builder) {
        return builder.baseUrl(notificationUrl).build();
    }

    @Bean
    public WebClient worldClient(WebClient.Builder builder) {
        return builder.baseUrl(worldUrl).build();
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        return mapper;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    // ── static catalogs ───────────────────────────────────────────────────────

    @Bean
    public EffectCatalog effectCatalog(ObjectMapper objectMapper) {
        EffectCatalog catalog = readResource(objectMapper, effectCatalogPath, EffectCatalog.class);
        log.info("Effect catalog loaded. encounters={} recovery={} liabilities={}",
                 catalog.encounters().keySet(), catalog.recovery().keySet(), catalog.liabilities().size());
        return catalog;
    }

    @Bean
    public EnvironmentFluxConfig environmentFluxConfig(ObjectMapper objectMapper) {
        EnvironmentFluxConfig config = readResource(objectMapper, environmentPath, EnvironmentFluxConfig.class);
        log.info("Environment flux profiles loaded. default={} environments={} subZones={}",
                 config.defaultFlux(), config.environmentDefaults().size(), config.subZoneOverrides().size());
        return config;
    }

    @Bean
    public LiabilityRoller liabilityRoller(EffectCatalog effectCatalog) {
        if (effectCatalog.liabilities().isEmpty()) {
            log.warn("Effect catalog has no liabilities, using built-in list");
            return new LiabilityRoller(LiabilityRoller.DEFAULT_CATALOG, liabilityLossThreshold);
        }
        return new LiabilityRoller(effectCatalog.liabilities(), liabilityLossThreshold);
    }

    private static <T> T readResource(ObjectMapper mapper, String path, Class<T> type) {
        try (InputStream in = new ClassPathResource(path).getInputStream()) {
            return mapper.readValue(in, type);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load " + path, e);
        }
    }
}
