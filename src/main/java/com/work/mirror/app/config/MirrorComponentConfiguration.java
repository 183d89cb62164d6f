package com.work.mirror.app.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.work.mirror.core.aggregate.BatchAggregator;
import com.work.mirror.core.cache.DurableResultLog;
import com.work.mirror.core.cache.TieredSnapshotCache;
import com.work.mirror.core.cache.VolatileSnapshotStore;
import com.work.mirror.core.cache.impl.CaffeineVolatileSnapshotStore;
import com.work.mirror.core.cache.impl.RedisVolatileSnapshotStore;
import com.work.mirror.core.config.MirrorCheckConfig;
import com.work.mirror.core.probe.MirrorClient;
import com.work.mirror.core.probe.MirrorProbe;
import com.work.mirror.core.probe.RestTemplateMirrorClient;
import com.work.mirror.core.repository.ProbeRecordRepository;
import com.work.mirror.core.repository.impl.PostgresProbeRecordRepository;
import com.work.mirror.core.repository.mapper.MirrorStatisticsMapper;
import com.work.mirror.core.repository.mapper.MirrorTestHistoryMapper;
import com.work.mirror.core.repository.mapper.TestBatchMapper;
import com.work.mirror.core.support.InMemoryProbeRecordRepository;
import com.work.mirror.core.support.metrics.MirrorCheckMetrics;
import com.work.mirror.core.support.metrics.NoopMirrorCheckMetrics;
import com.work.mirror.core.synth.ConfigSynthesizer;
import com.work.mirror.core.synth.DaemonConfigWriter;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.nio.file.Paths;

/**
 * 将核心组件装配为 Spring Bean，方便通过依赖注入复用。
 * 生产环境使用 PostgreSQL + Redis，mirror.durable-store / mirror.volatile-store 可切换为内存实现。
 */
@Configuration
@EnableConfigurationProperties(MirrorProperties.class)
public class MirrorComponentConfiguration {

    @Bean
    public MirrorCheckConfig mirrorCheckConfig(MirrorProperties properties) {
        return new MirrorCheckConfig(
                properties.getMirrors(),
                properties.getProbeTimeout(),
                properties.getTaskCeiling(),
                properties.getCheckInterval(),
                properties.getInitialDelay(),
                properties.getRecommendCount(),
                properties.isAutoApply(),
                Paths.get(properties.getDaemonJson()),
                Paths.get(properties.getDaemonJsonBackup())
        );
    }

    @Bean
    @ConditionalOnMissingBean(MirrorCheckMetrics.class)
    public MirrorCheckMetrics mirrorCheckMetrics() {
        return new NoopMirrorCheckMetrics();
    }

    @Bean
    @ConditionalOnMissingBean(MirrorClient.class)
    public MirrorClient mirrorClient() {
        return new RestTemplateMirrorClient();
    }

    @Bean
    public MirrorProbe mirrorProbe(MirrorClient mirrorClient) {
        return new MirrorProbe(mirrorClient);
    }

    @Bean
    @ConditionalOnProperty(prefix = "mirror", name = "durable-store", havingValue = "postgres", matchIfMissing = true)
    public ProbeRecordRepository postgresProbeRecordRepository(MirrorTestHistoryMapper historyMapper,
                                                               MirrorStatisticsMapper statisticsMapper,
                                                               TestBatchMapper batchMapper) {
        return new PostgresProbeRecordRepository(historyMapper, statisticsMapper, batchMapper);
    }

    @Bean
    @ConditionalOnProperty(prefix = "mirror", name = "durable-store", havingValue = "memory")
    public ProbeRecordRepository inMemoryProbeRecordRepository() {
        return new InMemoryProbeRecordRepository();
    }

    @Bean
    public DurableResultLog durableResultLog(ProbeRecordRepository repository,
                                             MirrorCheckMetrics metrics,
                                             MirrorProperties properties) {
        return new DurableResultLog(repository, metrics, properties.getHistoryMaxLimit());
    }

    @Bean
    @ConditionalOnProperty(prefix = "mirror", name = "volatile-store", havingValue = "redis", matchIfMissing = true)
    public VolatileSnapshotStore redisVolatileSnapshotStore(StringRedisTemplate redisTemplate,
                                                            ObjectMapper objectMapper,
                                                            MirrorProperties properties) {
        return new RedisVolatileSnapshotStore(redisTemplate, objectMapper, properties.getCacheKey());
    }

    @Bean
    @ConditionalOnProperty(prefix = "mirror", name = "volatile-store", havingValue = "local")
    public VolatileSnapshotStore caffeineVolatileSnapshotStore(MirrorCheckConfig config) {
        return new CaffeineVolatileSnapshotStore(config.getCheckInterval());
    }

    @Bean
    public TieredSnapshotCache tieredSnapshotCache(VolatileSnapshotStore volatileStore, MirrorCheckConfig config) {
        return new TieredSnapshotCache(volatileStore, config.getCheckInterval());
    }

    @Bean(destroyMethod = "shutdown")
    public BatchAggregator batchAggregator(MirrorProbe probe,
                                           DurableResultLog durableResultLog,
                                           MirrorCheckMetrics metrics,
                                           MirrorCheckConfig config,
                                           MirrorProperties properties) {
        return new BatchAggregator(probe, durableResultLog, metrics, config.getTaskCeiling(), properties.getProbeWorkers());
    }

    @Bean
    public ConfigSynthesizer configSynthesizer(MirrorCheckConfig config) {
        return new ConfigSynthesizer(config.getRecommendCount());
    }

    @Bean
    public DaemonConfigWriter daemonConfigWriter(MirrorCheckConfig config,
                                                 ObjectMapper objectMapper,
                                                 ApplicationEventPublisher eventPublisher) {
        return new DaemonConfigWriter(config.getDaemonJson(), config.getDaemonJsonBackup(), objectMapper, eventPublisher);
    }
}
