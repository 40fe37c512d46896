package com.ayjx.browser;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Lazily started browser shared by every feature that renders pages.
 * <p>
 * {@link #instance()} checks the current browser and transparently replaces
 * it when it stopped answering.
 */
@Slf4j
public class SharedBrowser implements AutoCloseable {

    @FunctionalInterface
    public interface Launcher {
        Browser launch() throws CdpException, IOException;
    }

    private final Launcher launcher;
    private final ReentrantLock lock = new ReentrantLock();
    private Browser current;
    private int launches;

    public SharedBrowser(Launcher launcher) {
        this.launcher = launcher;
    }

    /**
     * The live browser, launching or relaunching it as needed.
     *
     * @throws CdpException if a new browser cannot be started
     */
    public Browser instance() throws CdpException {
        lock.lock();
        try {
            if (current != null) {
                if (current.isAlive()) {
                    return current;
                }
                log.warn("[browser] instance stopped responding, restarting");
                current.close();
                current = null;
            }
            try {
                current = launcher.launch();
            } catch (IOException e) {
                log.error("[browser] launch failed: {}", e.getMessage());
                throw new CdpException("Browser launch failed: " + e.getMessage(), e);
            }
            launches++;
            return current;
        } finally {
            lock.unlock();
        }
    }

    /** Number of browsers started so far. */
    public int getLaunchCount() {
        lock.lock();
        try {
            return launches;
        } finally {
            lock.unlock();
        }
    }

    /** Close the current browser, if any. A later {@link #instance()} starts a new one. */
    public void shutdown() {
        lock.lock();
        try {
            if (current != null) {
                log.info("[browser] shutting down shared browser");
                current.close();
                current = null;
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void close() {
        shutdown();
    }
}
