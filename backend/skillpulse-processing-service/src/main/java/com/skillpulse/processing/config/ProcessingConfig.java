package com.skillpulse.processing.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.skillpulse.processing.service.SkillStreamProcessor;
import com.skillpulse.processing.store.FileSnapshotStore;
import com.skillpulse.processing.store.RedisSnapshotStore;
import com.skillpulse.processing.store.SnapshotStore;
import com.skillpulse.processing.text.AliasIndex;
import com.skillpulse.processing.text.SkillCatalog;
import com.skillpulse.processing.text.SkillExtractor;
import com.skillpulse.processing.trend.TrendEngine;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.nio.file.Path;
import java.time.Clock;

@Configuration
public class ProcessingConfig {

    private static final Logger log = LoggerFactory.getLogger(ProcessingConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public SkillCatalog skillCatalog(@Value("${skillpulse.catalog.location:classpath:skills/catalog.json}") String location) {
        return SkillCatalog.load(location);
    }

    @Bean
    public AliasIndex aliasIndex(SkillCatalog catalog) {
        AliasIndex index = AliasIndex.of(catalog);
        log.info("Alias index ready: {} aliases for {} skills", index.size(), catalog.size());
        return index;
    }

    @Bean
    public SkillExtractor skillExtractor(AliasIndex aliasIndex) {
        return new SkillExtractor(aliasIndex);
    }

    @Bean
    @Profile("!redis-pipeline")
    public SnapshotStore fileSnapshotStore(@Value("${skillpulse.snapshots.dir:data/trends}") String dir,
                                           @Value("${skillpulse.snapshots.file:historical_data.json}") String fileName,
                                           ObjectProvider<ObjectMapper> mapper,
                                           Clock clock) {
        Path file = Path.of(dir).resolve(fileName);
        log.info("Snapshot history file: {}", file.toAbsolutePath());
        return new FileSnapshotStore(file, mapper.getIfAvailable(ObjectMapper::new), clock);
    }

    @Bean
    @Profile("redis-pipeline")
    public SnapshotStore redisSnapshotStore(StringRedisTemplate redis,
                                            @Value("${skillpulse.snapshots.redis-key:skills:snapshots}") String hashKey,
                                            ObjectProvider<ObjectMapper> mapper,
                                            Clock clock) {
        log.info("Snapshot history in Redis hash '{}'", hashKey);
        return new RedisSnapshotStore(redis, hashKey, mapper.getIfAvailable(ObjectMapper::new), clock);
    }

    @Bean
    public TrendEngine trendEngine(SnapshotStore snapshotStore) {
        return new TrendEngine(snapshotStore);
    }

    @Bean
    public SkillStreamProcessor skillStreamProcessor(SkillExtractor extractor,
                                                     SnapshotStore snapshotStore,
                                                     Clock clock,
                                                     ObjectProvider<MeterRegistry> meterRegistry) {
        return new SkillStreamProcessor(extractor, snapshotStore, clock, meterRegistry.getIfAvailable(SimpleMeterRegistry::new));
    }
}
