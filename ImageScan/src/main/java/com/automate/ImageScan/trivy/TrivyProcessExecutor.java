package com.automate.ImageScan.trivy;

import com.automate.ImageScan.Config.ScannerProperties;
import com.automate.ImageScan.exception.ScanEngineException;
import com.automate.ImageScan.exception.ScanTimeoutException;
import com.automate.ImageScan.util.ImageReferences;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.*;

/**
 * Runs the engine as a child process, one per scan, and waits for its JSON report.
 * At most {@code scanner.max-concurrent-scans} processes run at once; further calls wait their turn.
 */
@Slf4j
@Component
public class TrivyProcessExecutor implements ScanExecutor {

    private static final Duration OUTPUT_GRACE = Duration.ofSeconds(5);
    private static final Duration KILL_GRACE = Duration.ofSeconds(5);

    private final ScannerProperties properties;
    private final Executor outputExecutor;
    private final Semaphore permits;

    public TrivyProcessExecutor(ScannerProperties properties,
                                @Qualifier("scanOutputExecutor") Executor outputExecutor) {
        this.properties = properties;
        this.outputExecutor = outputExecutor;
        this.permits = new Semaphore(properties.getMaxConcurrentScans(), true);
    }

    @Override
    public RawScanOutput execute(String image) {
        String target = ImageReferences.requireValid(image);
        acquirePermit(target);
        try {
            return run(target);
        } finally {
            permits.release();
        }
    }

    private void acquirePermit(String image) {
        if (permits.tryAcquire()) {
            return;
        }
        log.info("Scan of {} queued, {} scans already running", image, properties.getMaxConcurrentScans());
        try {
            permits.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ScanEngineException("Scan of " + image + " was cancelled while queued", e);
        }
    }

    List<String> buildCommand(String image) {
        List<String> cmd = new ArrayList<>(properties.getCommand());
        if (databaseCached()) {
            cmd.add(properties.getSkipDbUpdateFlag());
        }
        cmd.add(image);
        return cmd;
    }

    // without a cached database the engine has to download one first
    private boolean databaseCached() {
        String cacheDir = properties.getCacheDir();
        String flag = properties.getSkipDbUpdateFlag();
        if (cacheDir == null || cacheDir.isBlank() || flag == null || flag.isBlank()) {
            return false;
        }
        return Files.isDirectory(Paths.get(cacheDir, "db"));
    }

    private RawScanOutput run(String image) {
        List<String> cmd = buildCommand(image);
        Duration timeout = properties.getTimeout();
        log.debug("EXEC: {}", String.join(" ", cmd));

        long started = System.nanoTime();
        Process p;
        try {
            p = new ProcessBuilder(cmd).start();
        } catch (IOException e) {
            throw new ScanEngineException("Failed to start scanning engine '" + cmd.get(0) + "': " + e.getMessage(), e);
        }
        log.info("Scanning {} (pid {}, timeout {}s)", image, p.pid(), timeout.toSeconds());

        CompletableFuture<String> stdout = null;
        CompletableFuture<String> stderr = null;
        try {
            stdout = drain(p.getInputStream());
            stderr = drain(p.getErrorStream());
            closeStdin(p);

            boolean finished = p.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                log.warn("Scan of {} exceeded {}s, terminating engine (pid {})", image, timeout.toSeconds(), p.pid());
                terminate(p);
                throw new ScanTimeoutException(image, timeout);
            }

            int exit = p.exitValue();
            String out = await(stdout, image);
            String err = truncate(await(stderr, image));
            Duration elapsed = Duration.ofNanos(System.nanoTime() - started);

            if (exit != 0) {
                log.warn("Engine exited with {} for {} after {} ms", exit, image, elapsed.toMillis());
                throw ScanEngineException.exited(image, exit, err);
            }
            log.info("Engine finished {} in {} ms ({} chars of output)", image, elapsed.toMillis(), out.length());
            return new RawScanOutput(out, err, exit, elapsed);
        } catch (InterruptedException e) {
            terminate(p);
            Thread.currentThread().interrupt();
            throw new ScanEngineException("Scan of " + image + " was cancelled", e);
        } finally {
            if (p.isAlive()) {
                terminate(p);
            }
            if (stdout != null) stdout.cancel(true);
            if (stderr != null) stderr.cancel(true);
        }
    }

    private CompletableFuture<String> drain(InputStream in) {
        return CompletableFuture.supplyAsync(() -> {
            try (InputStream stream = in) {
                return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }, outputExecutor);
    }

    private String await(CompletableFuture<String> output, String image) throws InterruptedException {
        try {
            return output.get(OUTPUT_GRACE.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            throw new ScanEngineException("Failed to read engine output for " + image, e.getCause());
        } catch (TimeoutException e) {
            throw new ScanEngineException("Engine output for " + image + " was not closed after exit", e);
        }
    }

    private void closeStdin(Process p) {
        try {
            p.getOutputStream().close();
        } catch (IOException e) {
            log.debug("Could not close engine stdin (pid {}): {}", p.pid(), e.getMessage());
        }
    }

    /**
     * Kills the engine and anything it spawned, then reaps it.
     */
    private void terminate(Process p) {
        p.descendants().forEach(ProcessHandle::destroyForcibly);
        p.destroyForcibly();
        try {
            if (!p.waitFor(KILL_GRACE.toMillis(), TimeUnit.MILLISECONDS)) {
                log.error("Engine process {} still alive {}s after kill", p.pid(), KILL_GRACE.toSeconds());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while reaping engine process {}", p.pid());
        }
    }

    private String truncate(String s) {
        int max = properties.getDiagnosticsMaxChars();
        if (s == null || s.length() <= max) return s;
        return s.substring(0, max) + "...(truncated)";
    }
}
