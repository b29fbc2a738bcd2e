package com.streamfirst.pathtable.boot;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Settings bound from {@code pathtable.*}.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "pathtable")
public class PathTableProperties {

    private Storage storage = new Storage();
    private Lock lock = new Lock();

    /**
     * Threads reading composite sources in parallel; 0 reads them one after the other.
     */
    private int readThreads = 0;

    /**
     * Sources by name, in declaration order.
     */
    private Map<String, Source> sources = new LinkedHashMap<>();

    @Getter
    @Setter
    public static class Storage {
        /**
         * Root directory of local-disk storage. When unset, files are kept in memory.
         */
        private String root;
    }

    @Getter
    @Setter
    public static class Lock {
        private String directory = "/locks";
        private Duration timeout = Duration.ofSeconds(60);
        private Duration pollInterval = Duration.ofSeconds(1);
    }

    @Getter
    @Setter
    public static class Source {
        private String template;
        private String codec = "json";
        private Mode mode = Mode.SINGLETON;
        private boolean writable = false;

        /**
         * Keeps decoded content in memory when no cache location is set. Off by default, so
         * every read decodes the file afresh.
         */
        private boolean cacheEnabled = false;

        /**
         * Template of the persisted cache shards. Setting it turns caching on.
         */
        private String cacheLocation;
    }

    public enum Mode {
        SINGLETON, MULTI
    }
}
