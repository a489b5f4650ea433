package com.paxkun.magpie.service.pipeline;

import com.paxkun.magpie.config.MagpieProperties;
import com.paxkun.magpie.exception.DownloadException;
import com.paxkun.magpie.exception.DownloadTimeoutException;
import com.paxkun.magpie.util.HttpFailures;
import io.netty.channel.ChannelOption;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.buffer.DataBufferLimitException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.net.URI;
import java.util.OptionalLong;

/**
 * Fetches candidate image bytes with a fixed desktop user agent.
 * The byte cap is checked against the declared Content-Length and again while the
 * body is buffered, so an undeclared oversized body still fails.
 */
@Slf4j
@Component
public class ImageDownloader {

    static final int MIN_BODY_BYTES = 100;
    private static final int MAX_REDIRECTS = 5;

    private final MagpieProperties.Download settings;
    private final WebClient webClient;

    @Autowired
    public ImageDownloader(MagpieProperties properties) {
        this(properties.getDownload());
    }

    ImageDownloader(MagpieProperties.Download settings) {
        this.settings = settings;
        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) settings.getTimeout().toMillis())
                .responseTimeout(settings.getTimeout())
                .followRedirect((request, response) -> response.status().code() / 100 == 3
                        && request.redirectedFrom().length < MAX_REDIRECTS);

        this.webClient = WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .exchangeStrategies(ExchangeStrategies.builder()
                        .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(settings.getMaxBytes()))
                        .build())
                .defaultHeader(HttpHeaders.USER_AGENT, settings.getUserAgent())
                .defaultHeader(HttpHeaders.ACCEPT, "image/*,*/*;q=0.8")
                .build();
    }

    public byte[] fetch(String url) {
        URI uri;
        try {
            uri = URI.create(url);
        } catch (IllegalArgumentException e) {
            throw new DownloadException("Invalid image URL: " + url, e);
        }

        byte[] body;
        try {
            body = webClient.get()
                    .uri(uri)
                    .exchangeToMono(response -> {
                        if (!response.statusCode().is2xxSuccessful()) {
                            int status = response.statusCode().value();
                            return response.releaseBody()
                                    .then(Mono.<byte[]>error(new DownloadException("HTTP " + status + " for " + url)));
                        }
                        OptionalLong declared = response.headers().contentLength();
                        if (declared.isPresent() && declared.getAsLong() > settings.getMaxBytes()) {
                            return response.releaseBody()
                                    .then(Mono.<byte[]>error(new DownloadException("Image too large: "
                                            + declared.getAsLong() + " bytes exceeds " + settings.getMaxBytes())));
                        }
                        return response.bodyToMono(byte[].class).defaultIfEmpty(new byte[0]);
                    })
                    .timeout(settings.getTimeout())
                    .block();
        } catch (RuntimeException e) {
            throw translate(e, url);
        }

        if (body == null || body.length < MIN_BODY_BYTES) {
            throw new DownloadException("Downloaded image too small: " + (body == null ? 0 : body.length) + " bytes");
        }
        log.debug("📥 Downloaded {} bytes from {}", body.length, url);
        return body;
    }

    private DownloadException translate(RuntimeException e, String url) {
        Throwable cause = HttpFailures.unwrap(e);
        if (cause instanceof DownloadException) {
            return (DownloadException) cause;
        }
        if (HttpFailures.isTimeout(cause)) {
            return new DownloadTimeoutException("Timed out downloading " + url, cause);
        }
        if (HttpFailures.hasCause(cause, DataBufferLimitException.class)) {
            return new DownloadException("Image body exceeds " + settings.getMaxBytes() + " bytes", cause);
        }
        return new DownloadException("Failed to download " + url + ": " + HttpFailures.rootMessage(cause), cause);
    }
}
