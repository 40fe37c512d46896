package com.ayjx.browser;

import com.ayjx.common.infra.NamedThreads;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStreamReader;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * A Chrome/Chromium/Edge child process with remote debugging enabled and a
 * throwaway profile directory. Closing it kills the process and removes the
 * profile.
 */
@Slf4j
public class BrowserProcess implements AutoCloseable {

    private static final Pattern DEVTOOLS_URL = Pattern.compile("listening on (.*/devtools/browser/.*)$");
    private static final long STARTUP_TIMEOUT_MS = 30_000;
    private static final long STOP_TIMEOUT_MS = 2_500;

    private static final List<String> EXECUTABLE_NAMES = List.of(
            "google-chrome-stable",
            "google-chrome",
            "chromium",
            "chromium-browser",
            "chrome",
            "msedge",
            "microsoft-edge");

    private static final List<String> WELL_KNOWN_PATHS = List.of(
            "/Applications/Google Chrome.app/Contents/MacOS/Google Chrome",
            "/Applications/Microsoft Edge.app/Contents/MacOS/Microsoft Edge",
            "C:\\Program Files\\Google\\Chrome\\Application\\chrome.exe",
            "C:\\Program Files (x86)\\Google\\Chrome\\Application\\chrome.exe",
            "C:\\Program Files (x86)\\Microsoft\\Edge\\Application\\msedge.exe",
            "C:\\Program Files\\Microsoft\\Edge\\Application\\msedge.exe");

    private final Process process;
    private final Path profileDir;
    private final String webSocketUrl;

    private BrowserProcess(Process process, Path profileDir, String webSocketUrl) {
        this.process = process;
        this.profileDir = profileDir;
        this.webSocketUrl = webSocketUrl;
    }

    /**
     * Start the browser and wait until it prints its DevTools URL.
     *
     * @param executable explicit executable, or null to search
     */
    public static BrowserProcess launch(boolean headless, String executable) throws IOException {
        Path exe = findExecutable(executable, System.getenv(), System.getenv("PATH"))
                .orElseThrow(() -> new IOException("Chrome/Edge not found. Set CHROME env var."));
        int port = findFreePort(8000, 9000)
                .orElseThrow(() -> new IOException("No available port in 8000-8999"));
        Path base = Path.of(System.getProperty("user.dir"), "data", "temp_browser");
        Files.createDirectories(base);
        Path profile = Files.createTempDirectory(base, "cdp_");

        List<String> args = arguments(exe, port, profile, headless);
        log.info("[browser] starting {} on port {}", exe, port);
        Process process = new ProcessBuilder(args)
                .redirectOutput(ProcessBuilder.Redirect.DISCARD)
                .start();
        try {
            String url = awaitDevToolsUrl(process);
            return new BrowserProcess(process, profile, url);
        } catch (IOException e) {
            process.destroyForcibly();
            deleteRecursively(profile);
            throw e;
        }
    }

    public String getWebSocketUrl() {
        return webSocketUrl;
    }

    public boolean isAlive() {
        return process.isAlive();
    }

    @Override
    public void close() {
        process.destroy();
        try {
            if (!process.waitFor(STOP_TIMEOUT_MS, TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                process.waitFor(STOP_TIMEOUT_MS, TimeUnit.MILLISECONDS);
            }
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
        }
        deleteRecursively(profileDir);
        log.info("[browser] process stopped");
    }

    static List<String> arguments(Path exe, int port, Path profile, boolean headless) {
        List<String> args = new ArrayList<>(List.of(
                exe.toString(),
                "--remote-debugging-port=" + port,
                "--user-data-dir=" + profile,
                "--no-sandbox",
                "--no-zygote",
                "--in-process-gpu",
                "--disable-dev-shm-usage",
                "--disable-background-networking",
                "--disable-default-apps",
                "--disable-extensions",
                "--disable-sync",
                "--disable-translate",
                "--metrics-recording-only",
                "--safebrowsing-disable-auto-update",
                "--mute-audio",
                "--no-first-run",
                "--hide-scrollbars",
                "--window-size=1200,1600"));
        if (headless) {
            args.add("--headless=new");
        }
        return args;
    }

    /**
     * Explicit path first, then {@code CHROME}, then the usual executable
     * names on {@code PATH}, then well-known install locations.
     */
    static Optional<Path> findExecutable(String explicit, Map<String, String> env, String pathVar) {
        if (explicit != null && !explicit.isBlank()) {
            return Optional.of(Path.of(explicit));
        }
        String fromEnv = env.get("CHROME");
        if (fromEnv != null && !fromEnv.isBlank()) {
            return Optional.of(Path.of(fromEnv));
        }
        if (pathVar != null) {
            for (String name : EXECUTABLE_NAMES) {
                for (String dir : pathVar.split(File.pathSeparator)) {
                    if (dir.isEmpty()) {
                        continue;
                    }
                    for (String candidate : List.of(name, name + ".exe")) {
                        Path path = Path.of(dir, candidate);
                        if (Files.isRegularFile(path) && Files.isExecutable(path)) {
                            return Optional.of(path);
                        }
                    }
                }
            }
        }
        for (String known : WELL_KNOWN_PATHS) {
            Path path = Path.of(known);
            if (Files.isRegularFile(path)) {
                return Optional.of(path);
            }
        }
        return Optional.empty();
    }

    /** First port in {@code [from, to)} that can be bound on loopback. */
    static OptionalInt findFreePort(int from, int to) {
        for (int port = from; port < to; port++) {
            try (ServerSocket socket = new ServerSocket(port, 1, InetAddress.getLoopbackAddress())) {
                return OptionalInt.of(socket.getLocalPort());
            } catch (IOException e) {
                log.trace("[browser] port {} busy", port);
            }
        }
        return OptionalInt.empty();
    }

    static Optional<String> parseDevToolsUrl(String line) {
        Matcher matcher = DEVTOOLS_URL.matcher(line.strip());
        return matcher.find() ? Optional.of(matcher.group(1)) : Optional.empty();
    }

    private static String awaitDevToolsUrl(Process process) throws IOException {
        CompletableFuture<String> url = new CompletableFuture<>();
        Thread reader = NamedThreads.daemon("browser-stderr").newThread(() -> {
            try (BufferedReader stderr = new BufferedReader(
                    new InputStreamReader(process.getErrorStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = stderr.readLine()) != null) {
                    if (!url.isDone()) {
                        parseDevToolsUrl(line).ifPresent(url::complete);
                    }
                }
                url.completeExceptionally(new IOException("WS URL not found in stderr"));
            } catch (IOException e) {
                url.completeExceptionally(e);
            }
        });
        reader.start();
        try {
            return url.get(STARTUP_TIMEOUT_MS, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw new IOException("browser did not report a DevTools URL within " + STARTUP_TIMEOUT_MS + "ms");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            throw cause instanceof IOException io ? io : new IOException(cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("interrupted while starting browser", e);
        }
    }

    static void deleteRecursively(Path dir) {
        if (dir == null || !Files.exists(dir)) {
            return;
        }
        for (int attempt = 1; attempt <= 10; attempt++) {
            try (Stream<Path> walk = Files.walk(dir)) {
                for (Path path : walk.sorted(Comparator.reverseOrder()).toList()) {
                    Files.deleteIfExists(path);
                }
                return;
            } catch (IOException e) {
                // the browser may still hold files for a moment after exit
                try {
                    Thread.sleep(100L * Math.min(attempt, 3));
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    return;
                }
            }
        }
        log.warn("[browser] could not remove profile directory {}", dir);
    }
}
