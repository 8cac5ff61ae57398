package com.example.profilestore.config;

import com.example.profilestore.profile.ProfileCodec;
import com.example.profilestore.profile.ProfileOptions;
import com.example.profilestore.profile.ProfileStore;
import com.example.profilestore.profile.ProfileTemplate;
import com.example.profilestore.profile.SaveSink;
import com.example.profilestore.repo.SinkDeliveryRepo;
import com.example.profilestore.service.BackendHealthProbe;
import com.example.profilestore.service.BackendStatus;
import com.example.profilestore.service.HttpSaveSink;
import com.example.profilestore.service.SinkOutboxProjector;
import com.example.profilestore.store.RemoteStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;
import java.util.Set;
import java.util.UUID;

@Configuration
@EnableConfigurationProperties(ProfileStoreProperties.class)
public class ProfileStoreConfig {

    private static final Logger logger = LoggerFactory.getLogger(ProfileStoreConfig.class);

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public BackendStatus backendStatus(BackendHealthProbe probe) {
        return probe.probe();
    }

    @Bean
    @ConditionalOnMissingBean
    public ProfileTemplate profileTemplate(ProfileStoreProperties properties) {
        return ProfileTemplate.of(properties.getTemplate());
    }

    @Bean
    public ProfileCodec profileCodec(ObjectMapper objectMapper) {
        return new ProfileCodec(objectMapper);
    }

    @Bean
    public ProfileOptions profileOptions(ProfileStoreProperties properties, ProfileTemplate template, BackendStatus backend) {
        return ProfileOptions.builder()
                .storeName(properties.getStoreName())
                .storeVersion(properties.getStoreVersion())
                .saveInterval(properties.getSaveInterval())
                .keysToIgnore(Set.copyOf(properties.getKeysToIgnore()))
                .template(template)
                .persistenceEnabled(properties.isPersistenceEnabled())
                .allowInNonProductionEnv(properties.isAllowInNonProductionEnv())
                .productionEnvironment(properties.isProduction())
                .backendAvailable(backend.isAvailable())
                .sessionLockTimeout(properties.getSessionLockTimeout())
                .sessionCheckInterval(properties.getSessionCheckInterval())
                .maxConnectionAttempts(properties.getMaxConnectionAttempts())
                .maxConnectionAttemptDelay(properties.getMaxConnectionAttemptDelay())
                .build();
    }

    @Bean
    public ProfileStore profileStore(RemoteStore remote,
                                     ProfileOptions options,
                                     ProfileCodec codec,
                                     ObjectProvider<SaveSink> sink,
                                     Clock clock,
                                     ProfileStoreProperties properties) {
        String token = properties.getServerToken();
        if (token == null || token.isBlank()) {
            token = UUID.randomUUID().toString();
        }
        if (!options.persistenceActive()) {
            logger.warn("Profile persistence is inactive (enabled={}, backend={}, environment={})",
                    options.isPersistenceEnabled(), options.isBackendAvailable(), properties.getEnvironment());
        }
        SaveSink saveSink = sink.getIfAvailable(() -> SaveSink.NONE);
        return new ProfileStore(remote, options, codec, saveSink, clock, token);
    }

    @Bean
    @ConditionalOnProperty(prefix = "profiles", name = "external-sink-url")
    public HttpSaveSink httpSaveSink(WebClient.Builder builder,
                                     ProfileStoreProperties properties,
                                     SinkDeliveryRepo deliveryRepo,
                                     ObjectMapper objectMapper) {
        WebClient client = builder.baseUrl(properties.getExternalSinkUrl()).build();
        return new HttpSaveSink(client, deliveryRepo, objectMapper, properties.getSinkTimeout());
    }

    @Bean
    @ConditionalOnProperty(prefix = "profiles", name = "external-sink-url")
    public SinkOutboxProjector sinkOutboxProjector(SinkDeliveryRepo deliveryRepo,
                                                   HttpSaveSink sink,
                                                   ProfileStoreProperties properties) {
        return new SinkOutboxProjector(deliveryRepo, sink, properties);
    }
}
