package com.vidnyan.reqtrace.application.service;

import com.vidnyan.reqtrace.application.port.in.ReloadUseCase;
import com.vidnyan.reqtrace.config.ReqTraceProperties;
import com.vidnyan.reqtrace.domain.error.RebuildFailureException;
import com.vidnyan.reqtrace.domain.index.CoverageSnapshot;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owns the live snapshot and serializes rebuilds.
 *
 * <p>Readers take {@link #snapshot()} without blocking. One rebuild runs at a time; reload requests
 * arriving meanwhile share a single follow-up rebuild and all receive its outcome. A failed rebuild
 * leaves the previous snapshot in place.
 */
@Slf4j
@Service
public class ReloadController implements ReloadUseCase {

    private final IndexBuilder indexBuilder;
    private final Path projectRoot;
    private final AtomicReference<CoverageSnapshot> current;

    private final Object lock = new Object();
    private boolean running;
    private CompletableFuture<Long> pending;

    @Autowired
    public ReloadController(IndexBuilder indexBuilder, ReqTraceProperties properties) {
        this(indexBuilder, properties.projectRootPath());
    }

    public ReloadController(IndexBuilder indexBuilder, Path projectRoot) {
        this.indexBuilder = indexBuilder;
        this.projectRoot = projectRoot.toAbsolutePath().normalize();
        this.current = new AtomicReference<>(CoverageSnapshot.empty(this.projectRoot.toString()));
    }

    /**
     * Initial build. Failure is logged and version 0 (empty) stays live until a reload succeeds.
     */
    @PostConstruct
    public void start() {
        try {
            reload();
        } catch (RebuildFailureException e) {
            log.error("Initial index build failed, serving an empty index: {}", e.getMessage());
        }
    }

    public CoverageSnapshot snapshot() {
        return current.get();
    }

    @Override
    public long version() {
        return current.get().version();
    }

    @Override
    public long reload() throws RebuildFailureException {
        CompletableFuture<Long> request;
        boolean runHere = false;
        synchronized (lock) {
            if (pending == null) {
                pending = new CompletableFuture<>();
            }
            request = pending;
            if (!running) {
                running = true;
                runHere = true;
            }
        }
        if (runHere) {
            drain();
        }
        return await(request);
    }

    /**
     * Run queued rebuilds until none is left.
     */
    private void drain() {
        CompletableFuture<Long> batch = null;
        try {
            while (true) {
                synchronized (lock) {
                    batch = pending;
                    pending = null;
                    if (batch == null) {
                        running = false;
                        return;
                    }
                }
                try {
                    batch.complete(rebuild());
                } catch (RebuildFailureException e) {
                    batch.completeExceptionally(e);
                }
            }
        } catch (Error e) {
            synchronized (lock) {
                running = false;
            }
            if (batch != null) {
                batch.completeExceptionally(e);
            }
            throw e;
        }
    }

    private long rebuild() throws RebuildFailureException {
        long previous = current.get().version();
        log.info("Rebuilding index of {} (current v{})", projectRoot, previous);
        try {
            CoverageSnapshot built = indexBuilder.build(projectRoot);
            CoverageSnapshot next = built.withVersion(previous + 1);
            current.set(next);
            log.info("Snapshot v{} is live", next.version());
            return next.version();
        } catch (IOException | RuntimeException e) {
            log.error("Rebuild failed, keeping snapshot v{}", previous, e);
            throw new RebuildFailureException("Rebuild failed: " + e.getMessage(), e);
        }
    }

    private static long await(CompletableFuture<Long> request) throws RebuildFailureException {
        try {
            return request.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RebuildFailureException("Interrupted while waiting for rebuild", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RebuildFailureException failure) {
                throw new RebuildFailureException(failure.getMessage(), failure.getCause());
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new RebuildFailureException("Rebuild failed: " + cause.getMessage(), cause);
        }
    }
}
