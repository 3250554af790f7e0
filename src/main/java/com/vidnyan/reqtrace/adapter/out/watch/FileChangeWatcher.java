package com.vidnyan.reqtrace.adapter.out.watch;

import com.vidnyan.reqtrace.application.port.in.ReloadUseCase;
import com.vidnyan.reqtrace.config.ReqTraceProperties;
import com.vidnyan.reqtrace.domain.error.RebuildFailureException;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileSystems;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.HashMap;
import java.util.Map;

import static java.nio.file.StandardWatchEventKinds.ENTRY_CREATE;
import static java.nio.file.StandardWatchEventKinds.ENTRY_DELETE;
import static java.nio.file.StandardWatchEventKinds.ENTRY_MODIFY;
import static java.nio.file.StandardWatchEventKinds.OVERFLOW;

/**
 * Watches the project tree and triggers a debounced reload on any change.
 * Enabled with {@code reqtrace.watch.enabled=true}.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "reqtrace.watch", name = "enabled", havingValue = "true")
public class FileChangeWatcher {

    private final ReloadUseCase reloadUseCase;
    private final Path root;
    private final Path configDir;
    private final boolean skipHidden;
    private final Debouncer debouncer;
    private final Map<WatchKey, Path> keys = new HashMap<>();

    private WatchService watchService;
    private Thread thread;

    public FileChangeWatcher(ReloadUseCase reloadUseCase, ReqTraceProperties properties) {
        this.reloadUseCase = reloadUseCase;
        this.root = properties.projectRootPath();
        this.configDir = properties.configFilePath().getParent();
        this.skipHidden = properties.getScan().isSkipHidden();
        this.debouncer = new Debouncer(properties.getWatch().getDebounce(), this::reload);
    }

    @PostConstruct
    public void start() throws IOException {
        watchService = FileSystems.getDefault().newWatchService();
        registerTree(root);
        if (configDir != null && Files.isDirectory(configDir) && !keys.containsValue(configDir)) {
            keys.put(configDir.register(watchService, ENTRY_CREATE, ENTRY_DELETE, ENTRY_MODIFY), configDir);
        }
        thread = new Thread(this::loop, "reqtrace-watch");
        thread.setDaemon(true);
        thread.start();
        log.info("Watching {} ({} directories)", root, keys.size());
    }

    @PreDestroy
    public void stop() throws IOException {
        debouncer.close();
        if (watchService != null) {
            watchService.close();
        }
    }

    private void loop() {
        try {
            while (true) {
                WatchKey key = watchService.take();
                Path dir = keys.get(key);
                for (WatchEvent<?> event : key.pollEvents()) {
                    if (event.kind() == OVERFLOW) {
                        debouncer.trigger();
                        continue;
                    }
                    Path changed = dir == null ? root : dir.resolve((Path) event.context());
                    if (isHidden(changed)) {
                        continue;
                    }
                    if (event.kind() == ENTRY_CREATE && Files.isDirectory(changed)) {
                        registerTree(changed);
                    }
                    log.debug("{}: {}", event.kind().name(), changed);
                    debouncer.trigger();
                }
                if (!key.reset()) {
                    keys.remove(key);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ClosedWatchServiceException e) {
            log.debug("Watch service closed");
        } catch (IOException e) {
            log.error("File watching stopped: {}", e.getMessage(), e);
        }
    }

    private void reload() {
        try {
            long version = reloadUseCase.reload();
            log.info("Reloaded after file changes, now v{}", version);
        } catch (RebuildFailureException e) {
            log.warn("Reload after file changes failed: {}", e.getMessage());
        }
    }

    private void registerTree(Path start) throws IOException {
        Files.walkFileTree(start, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) throws IOException {
                if (!dir.equals(root) && isHidden(dir)) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                keys.put(dir.register(watchService, ENTRY_CREATE, ENTRY_DELETE, ENTRY_MODIFY), dir);
                return FileVisitResult.CONTINUE;
            }
        });
    }

    /**
     * Hidden when any path segment below the root starts with a dot; the config directory never is.
     */
    private boolean isHidden(Path path) {
        if (!skipHidden || !path.startsWith(root) || (configDir != null && path.startsWith(configDir))) {
            return false;
        }
        for (Path segment : root.relativize(path)) {
            if (segment.toString().startsWith(".")) {
                return true;
            }
        }
        return false;
    }
}
