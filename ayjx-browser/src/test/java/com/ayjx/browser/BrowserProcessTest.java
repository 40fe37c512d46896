package com.ayjx.browser;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;

import static org.junit.jupiter.api.Assertions.*;

class BrowserProcessTest {

    @TempDir
    Path tempDir;

    @Test
    void parseDevToolsUrl_extractsUrlFromStderrLine() {
        Optional<String> url = BrowserProcess.parseDevToolsUrl(
                "DevTools listening on ws://127.0.0.1:8000/devtools/browser/0b1c-22\n");
        assertEquals(Optional.of("ws://127.0.0.1:8000/devtools/browser/0b1c-22"), url);
    }

    @Test
    void parseDevToolsUrl_ignoresOtherLines() {
        assertTrue(BrowserProcess.parseDevToolsUrl("[0101/000000.000:ERROR:gpu_init.cc] oops").isEmpty());
        assertTrue(BrowserProcess.parseDevToolsUrl("listening on ws://127.0.0.1:8000/json").isEmpty());
    }

    @Test
    void findExecutable_explicitPathWins() {
        Optional<Path> exe = BrowserProcess.findExecutable("/opt/chrome/chrome", Map.of("CHROME", "/usr/bin/x"), "");
        assertEquals(Optional.of(Path.of("/opt/chrome/chrome")), exe);
    }

    @Test
    void findExecutable_chromeEnvBeforePath() {
        Optional<Path> exe = BrowserProcess.findExecutable(null, Map.of("CHROME", "/usr/bin/x"), "");
        assertEquals(Optional.of(Path.of("/usr/bin/x")), exe);
    }

    @Test
    void findExecutable_searchesPath() throws IOException {
        Path bin = Files.createDirectories(tempDir.resolve("bin"));
        Path chromium = Files.createFile(bin.resolve("chromium"));
        assertTrue(chromium.toFile().setExecutable(true));

        Optional<Path> exe = BrowserProcess.findExecutable(" ", Map.of(), bin.toString());

        assertEquals(Optional.of(chromium), exe);
    }

    @Test
    void findFreePort_skipsBoundPort() throws IOException {
        try (ServerSocket taken = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
            int port = taken.getLocalPort();
            OptionalInt found = BrowserProcess.findFreePort(port, port + 1);
            assertTrue(found.isEmpty());
        }
    }

    @Test
    void arguments_headlessFlagOnlyWhenRequested() {
        List<String> headless = BrowserProcess.arguments(Path.of("chrome"), 8001, tempDir, true);
        List<String> windowed = BrowserProcess.arguments(Path.of("chrome"), 8001, tempDir, false);

        assertTrue(headless.contains("--headless=new"));
        assertFalse(windowed.contains("--headless=new"));
        assertTrue(headless.contains("--remote-debugging-port=8001"));
        assertEquals("chrome", headless.get(0));
    }

    @Test
    void deleteRecursively_removesTree() throws IOException {
        Path profile = Files.createDirectories(tempDir.resolve("cdp_1/Default"));
        Files.writeString(profile.resolve("Preferences"), "{}");

        BrowserProcess.deleteRecursively(tempDir.resolve("cdp_1"));

        assertFalse(Files.exists(tempDir.resolve("cdp_1")));
    }
}
