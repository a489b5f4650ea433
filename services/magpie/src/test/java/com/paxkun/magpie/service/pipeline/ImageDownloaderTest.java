package com.paxkun.magpie.service.pipeline;

import com.paxkun.magpie.config.MagpieProperties;
import com.paxkun.magpie.exception.DownloadException;
import com.paxkun.magpie.exception.DownloadTimeoutException;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.Arrays;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ImageDownloaderTest {

    private HttpServer server;
    private ExecutorService serverExecutor;
    private ImageDownloader downloader;
    private String baseUrl;
    private final AtomicReference<HttpExchange> lastExchange = new AtomicReference<>();

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        serverExecutor = Executors.newCachedThreadPool();
        server.setExecutor(serverExecutor);
        server.createContext("/ok.jpg", exchange -> {
            lastExchange.set(exchange);
            respond(exchange, 200, filled(2000), false);
        });
        server.createContext("/missing.jpg", exchange -> respond(exchange, 404, filled(200), false));
        server.createContext("/tiny.jpg", exchange -> respond(exchange, 200, filled(50), false));
        server.createContext("/declared-big.jpg", exchange -> respond(exchange, 200, filled(5000), false));
        server.createContext("/streamed-big.jpg", exchange -> respond(exchange, 200, filled(5000), true));
        server.createContext("/redirect.jpg", exchange -> {
            exchange.getResponseHeaders().set("Location", "/ok.jpg");
            exchange.sendResponseHeaders(302, -1);
            exchange.close();
        });
        server.createContext("/slow.jpg", exchange -> {
            try {
                Thread.sleep(3000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            respond(exchange, 200, filled(2000), false);
        });
        server.start();
        baseUrl = "http://127.0.0.1:" + server.getAddress().getPort();

        MagpieProperties.Download settings = new MagpieProperties.Download();
        settings.setTimeout(Duration.ofMillis(500));
        settings.setMaxBytes(4096);
        settings.setUserAgent("magpie-test/1.0");
        downloader = new ImageDownloader(settings);
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
        serverExecutor.shutdownNow();
    }

    @Test
    void downloadsBodyWithImageHeaders() {
        byte[] body = downloader.fetch(baseUrl + "/ok.jpg");

        assertThat(body).hasSize(2000);
        assertThat(lastExchange.get().getRequestHeaders().getFirst("User-Agent")).isEqualTo("magpie-test/1.0");
        assertThat(lastExchange.get().getRequestHeaders().getFirst("Accept")).isEqualTo("image/*,*/*;q=0.8");
    }

    @Test
    void followsRedirects() {
        assertThat(downloader.fetch(baseUrl + "/redirect.jpg")).hasSize(2000);
    }

    @Test
    void nonSuccessStatusFails() {
        assertThatThrownBy(() -> downloader.fetch(baseUrl + "/missing.jpg"))
                .isInstanceOf(DownloadException.class)
                .hasMessageContaining("404");
    }

    @Test
    void tinyBodyFails() {
        assertThatThrownBy(() -> downloader.fetch(baseUrl + "/tiny.jpg"))
                .isInstanceOf(DownloadException.class)
                .hasMessageContaining("too small");
    }

    @Test
    void declaredLengthOverCapFails() {
        assertThatThrownBy(() -> downloader.fetch(baseUrl + "/declared-big.jpg"))
                .isInstanceOf(DownloadException.class)
                .hasMessageContaining("too large");
    }

    @Test
    void undeclaredBodyOverCapFails() {
        assertThatThrownBy(() -> downloader.fetch(baseUrl + "/streamed-big.jpg"))
                .isInstanceOf(DownloadException.class);
    }

    @Test
    void slowServerTimesOut() {
        assertThatThrownBy(() -> downloader.fetch(baseUrl + "/slow.jpg"))
                .isInstanceOf(DownloadTimeoutException.class);
    }

    @Test
    void malformedUrlFails() {
        assertThatThrownBy(() -> downloader.fetch("http://exa mple.com/a b.jpg"))
                .isInstanceOf(DownloadException.class)
                .hasMessageContaining("Invalid image URL");
    }

    private static byte[] filled(int size) {
        byte[] bytes = new byte[size];
        Arrays.fill(bytes, (byte) 7);
        return bytes;
    }

    private static void respond(HttpExchange exchange, int status, byte[] body, boolean chunked) throws IOException {
        exchange.getResponseHeaders().set("Content-Type", "image/jpeg");
        exchange.sendResponseHeaders(status, chunked ? 0 : body.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(body);
        }
    }
}
