package com.streamfirst.pathtable.boot;

import com.streamfirst.pathtable.adapters.InMemoryCacheStoreAdapter;
import com.streamfirst.pathtable.adapters.InMemoryStorageAdapter;
import com.streamfirst.pathtable.adapters.JacksonCodecAdapter;
import com.streamfirst.pathtable.adapters.LocalFileStorageAdapter;
import com.streamfirst.pathtable.adapters.Slf4jEventSinkAdapter;
import com.streamfirst.pathtable.adapters.StorageCacheStoreAdapter;
import com.streamfirst.pathtable.application.CompositeEngine;
import com.streamfirst.pathtable.application.ContentCache;
import com.streamfirst.pathtable.application.FileSource;
import com.streamfirst.pathtable.application.Locator;
import com.streamfirst.pathtable.application.LockManager;
import com.streamfirst.pathtable.domain.PathTemplate;
import com.streamfirst.pathtable.ports.CacheStorePort;
import com.streamfirst.pathtable.ports.CodecPort;
import com.streamfirst.pathtable.ports.EventSinkPort;
import com.streamfirst.pathtable.ports.StoragePort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Conditional;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Wires storage, sources, the composite over them and the lock manager from
 * {@link PathTableProperties}.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(PathTableProperties.class)
public class PathTableConfiguration {

    // --- Adapter Beans ---

    @Bean
    @ConditionalOnMissingBean
    public StoragePort storagePort(PathTableProperties properties) {
        String root = properties.getStorage().getRoot();
        if (root == null || root.isBlank()) {
            log.info("No storage root configured, keeping files in memory");
            return new InMemoryStorageAdapter();
        }
        return new LocalFileStorageAdapter(Path.of(root));
    }

    @Bean
    @ConditionalOnMissingBean
    public EventSinkPort eventSinkPort() {
        return new Slf4jEventSinkAdapter();
    }

    @Bean(destroyMethod = "shutdown")
    @Conditional(ParallelReadsCondition.class)
    public ExecutorService pathTableReadExecutor(PathTableProperties properties) {
        return Executors.newFixedThreadPool(properties.getReadThreads());
    }

    // --- Application Service Beans ---

    @Bean
    @Conditional(SourcesConfiguredCondition.class)
    public CompositeEngine compositeEngine(PathTableProperties properties,
                                           StoragePort storagePort,
                                           EventSinkPort eventSinkPort,
                                           ObjectProvider<ExecutorService> readExecutor) {
        Map<String, FileSource> sources = new LinkedHashMap<>();
        properties.getSources().forEach((name, source) ->
            sources.put(name, fileSource(name, source, storagePort, eventSinkPort)));
        return new CompositeEngine(sources, properties.getReadThreads() > 0 ? readExecutor.getIfAvailable() : null);
    }

    @Bean
    public LockManager lockManager(PathTableProperties properties, StoragePort storagePort) {
        PathTableProperties.Lock lock = properties.getLock();
        return new LockManager(storagePort, lock.getDirectory(), lock.getTimeout(), lock.getPollInterval());
    }

    static FileSource fileSource(String name, PathTableProperties.Source settings,
                                 StoragePort storagePort, EventSinkPort eventSinkPort) {
        if (settings.getTemplate() == null || settings.getTemplate().isBlank()) {
            throw new IllegalArgumentException("Source '" + name + "' has no template");
        }
        PathTemplate template = PathTemplate.compile(settings.getTemplate());
        CodecPort codec = JacksonCodecAdapter.forFormat(settings.getCodec(), CodecPort.Mode.valueOf(settings.getMode().name()));

        CacheStorePort cacheStore;
        if (settings.getCacheLocation() != null && !settings.getCacheLocation().isBlank()) {
            cacheStore = new StorageCacheStoreAdapter(storagePort, PathTemplate.compile(settings.getCacheLocation()), template);
        } else if (settings.isCacheEnabled()) {
            cacheStore = new InMemoryCacheStoreAdapter();
        } else {
            cacheStore = CacheStorePort.disabled();
        }

        log.info("Configured source '{}' on {} ({} {}, {})", name, template, settings.getCodec(),
            settings.getMode(), settings.isWritable() ? "writable" : "read-only");
        return new FileSource(name, new Locator(template, storagePort),
            new ContentCache(storagePort, codec, cacheStore, eventSinkPort), settings.isWritable());
    }
}
