package com.vidnyan.reqtrace.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Configuration properties for the coverage engine.
 * Can be configured via application.properties or application.yml
 */
@Data
@Component
@ConfigurationProperties(prefix = "reqtrace")
public class ReqTraceProperties {

    /**
     * Root of the project to index.
     * Default: current directory
     */
    private String projectRoot = ".";

    /**
     * Configuration document, relative to the project root unless absolute.
     */
    private String configPath = ".config/reqtrace/config.yaml";

    private Scan scan = new Scan();

    private Watch watch = new Watch();

    private Cli cli = new Cli();

    public Path projectRootPath() {
        return Path.of(projectRoot).toAbsolutePath().normalize();
    }

    public Path configFilePath() {
        Path path = Path.of(configPath);
        return path.isAbsolute() ? path : projectRootPath().resolve(path).normalize();
    }

    @Data
    public static class Scan {

        /**
         * Threads used to read and scan files.
         */
        private int parallelism = Math.max(2, Runtime.getRuntime().availableProcessors());

        /**
         * Skip directories whose name starts with a dot.
         */
        private boolean skipHidden = true;

        /**
         * Extra extension to language mappings, e.g. {@code tpl: c}.
         */
        private Map<String, String> extensions = new LinkedHashMap<>();
    }

    @Data
    public static class Watch {

        private boolean enabled = false;

        /**
         * Quiet period after the last file event before reloading.
         */
        private Duration debounce = Duration.ofMillis(300);
    }

    @Data
    public static class Cli {

        /**
         * Print a coverage report on startup.
         */
        private boolean enabled = false;

        private boolean exitAfterReport = true;
    }
}
