package com.paxkun.magpie.service.search;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.paxkun.magpie.config.MagpieProperties;
import com.paxkun.magpie.exception.NoResultsException;
import com.paxkun.magpie.exception.ProviderException;
import com.paxkun.magpie.exception.SearchException;
import com.paxkun.magpie.exception.SearchNetworkException;
import com.paxkun.magpie.exception.SessionTokenException;
import com.paxkun.magpie.util.HttpFailures;
import com.paxkun.magpie.util.LogSafe;
import io.netty.channel.ChannelOption;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.buffer.DataBufferLimitException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriBuilder;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;
import reactor.netty.transport.ProxyProvider;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Consumer;
import java.util.function.DoubleSupplier;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Two-step handshake against DuckDuckGo image search: load the HTML search page to
 * obtain the {@code vqd} session token, pause like a human would, then call the
 * {@code i.js} JSON endpoint with that token.
 * <p>
 * A fresh Reactor Netty client is built per call because the proxy is part of the
 * identity and changes on every attempt.
 * <p>
 * Author: Pax
 */
@Slf4j
@Component
public class DuckDuckGoSessionClient implements SearchSessionClient {

    private static final Pattern VQD_PATTERN = Pattern.compile("vqd=['\"]([^'\"]+)['\"]");
    private static final int MAX_BODY_BYTES = 5 * 1024 * 1024;

    private static final String SEC_CH_UA = "\"Not_A Brand\";v=\"8\", \"Chromium\";v=\"120\", \"Google Chrome\";v=\"120\"";

    private final MagpieProperties.Search settings;
    private final Gson gson = new Gson();

    private Sleeper sleeper = Sleeper.threadSleep();
    private DoubleSupplier random = () -> ThreadLocalRandom.current().nextDouble();

    @Autowired
    public DuckDuckGoSessionClient(MagpieProperties properties) {
        this(properties.getSearch());
    }

    DuckDuckGoSessionClient(MagpieProperties.Search settings) {
        this.settings = settings;
    }

    @Override
    public List<RawImageResult> search(String keyword, Identity identity) {
        WebClient client = buildClient(identity);
        log.info("🌐 Searching '{}' via {}", LogSafe.clean(keyword), identity.describeProxy());

        String page = get(client,
                builder -> builder.path("/")
                        .queryParam("q", "{q}")
                        .queryParam("t", "h_")
                        .queryParam("iax", "images")
                        .queryParam("ia", "images")
                        .build(keyword),
                this::pageHeaders,
                "search page");

        SearchSession session = extractSession(page);
        log.info("✅ Session token extracted: {}", session.redacted());

        pace();

        String body = get(client,
                builder -> builder.path("/i.js")
                        .queryParam("l", "us-en")
                        .queryParam("o", "json")
                        .queryParam("q", "{q}")
                        .queryParam("vqd", "{vqd}")
                        .queryParam("f", ",,,")
                        .queryParam("p", "1")
                        .queryParam("v7exp", "a")
                        .build(keyword, session.token()),
                this::apiHeaders,
                "image results");

        List<RawImageResult> results = decode(body);
        log.info("🖼️ Provider returned {} raw results for '{}'", results.size(), LogSafe.clean(keyword));
        return results;
    }

    SearchSession extractSession(String page) {
        if (page == null || page.isEmpty()) {
            throw new SessionTokenException("Empty search page, could not extract vqd token");
        }

        Matcher matcher = VQD_PATTERN.matcher(page);
        if (matcher.find()) {
            return new SearchSession(matcher.group(1));
        }

        // Some page variants carry the token in markup instead of an inline script.
        Document document = Jsoup.parse(page);
        Element holder = document.selectFirst("input[name=vqd], [data-vqd]");
        if (holder != null) {
            String token = holder.hasAttr("data-vqd") ? holder.attr("data-vqd") : holder.attr("value");
            if (!token.isBlank()) {
                return new SearchSession(token);
            }
        }

        throw new SessionTokenException("Could not extract vqd token from search page");
    }

    List<RawImageResult> decode(String body) {
        ImageResultsPage page;
        try {
            page = gson.fromJson(body, ImageResultsPage.class);
        } catch (JsonParseException e) {
            throw new ProviderException("Malformed image results payload: " + e.getMessage(), e);
        }
        if (page == null || page.getResults() == null || page.getResults().isEmpty()) {
            throw new NoResultsException("No images found in provider results");
        }
        return page.getResults();
    }

    private void pace() {
        long min = settings.getPacingMin().toMillis();
        long spread = Math.max(0L, settings.getPacingMax().toMillis() - min);
        Duration delay = Duration.ofMillis(min + (long) (random.getAsDouble() * spread));
        log.debug("⏳ Pacing {} ms before results call", delay.toMillis());
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SearchNetworkException("Interrupted while pacing between provider calls", e, false);
        }
    }

    private String get(WebClient client,
                       Function<UriBuilder, URI> uri,
                       Consumer<HttpHeaders> headers,
                       String step) {
        try {
            return client.get()
                    .uri(uri)
                    .headers(headers)
                    .exchangeToMono(response -> {
                        if (!response.statusCode().is2xxSuccessful()) {
                            int status = response.statusCode().value();
                            return response.releaseBody()
                                    .then(Mono.<String>error(new ProviderException(
                                            "Provider " + step + " returned HTTP " + status)));
                        }
                        return response.bodyToMono(String.class).defaultIfEmpty("");
                    })
                    .timeout(settings.getTimeout())
                    .block();
        } catch (RuntimeException e) {
            throw translate(e, step);
        }
    }

    private SearchException translate(RuntimeException e, String step) {
        Throwable cause = HttpFailures.unwrap(e);
        if (cause instanceof SearchException) {
            return (SearchException) cause;
        }
        if (HttpFailures.isTimeout(cause)) {
            return new SearchNetworkException("Timed out fetching " + step, cause, true);
        }
        if (HttpFailures.hasCause(cause, DataBufferLimitException.class)) {
            return new ProviderException("Provider " + step + " exceeded " + MAX_BODY_BYTES + " bytes", cause);
        }
        return new SearchNetworkException(
                "Network error fetching " + step + ": " + HttpFailures.rootMessage(cause), cause, false);
    }

    private WebClient buildClient(Identity identity) {
        int maxRedirects = settings.getMaxRedirects();
        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) settings.getTimeout().toMillis())
                .responseTimeout(settings.getTimeout())
                .compress(true)
                .followRedirect((request, response) -> isRedirect(response.status().code())
                        && request.redirectedFrom().length < maxRedirects);

        if (identity.hasProxy()) {
            httpClient = applyProxy(httpClient, identity.proxyAddress());
        }

        return WebClient.builder()
                .baseUrl(settings.getBaseUrl())
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .exchangeStrategies(ExchangeStrategies.builder()
                        .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(MAX_BODY_BYTES))
                        .build())
                .defaultHeader(HttpHeaders.USER_AGENT, identity.userAgent())
                .build();
    }

    private HttpClient applyProxy(HttpClient httpClient, String proxyAddress) {
        URI proxy = URI.create(proxyAddress);
        if (proxy.getHost() == null) {
            throw new SearchNetworkException("Invalid proxy address configured", null, false);
        }
        int port = proxy.getPort() > 0 ? proxy.getPort() : ("https".equalsIgnoreCase(proxy.getScheme()) ? 443 : 80);
        String userInfo = proxy.getUserInfo();

        return httpClient.proxy(spec -> {
            ProxyProvider.Builder builder = spec.type(ProxyProvider.Proxy.HTTP)
                    .host(proxy.getHost())
                    .port(port);
            if (userInfo != null && !userInfo.isEmpty()) {
                int separator = userInfo.indexOf(':');
                String username = separator >= 0 ? userInfo.substring(0, separator) : userInfo;
                String password = separator >= 0 ? userInfo.substring(separator + 1) : "";
                builder.username(username).password(ignored -> password);
            }
        });
    }

    private static boolean isRedirect(int status) {
        return status == 301 || status == 302 || status == 303 || status == 307 || status == 308;
    }

    private void pageHeaders(HttpHeaders headers) {
        headers.set(HttpHeaders.ACCEPT, "text/html,application/xhtml+xml,application/xml;q=0.9,image/webp,image/avif,*/*;q=0.8");
        commonHeaders(headers);
        headers.set("Sec-Fetch-Dest", "document");
        headers.set("Sec-Fetch-Mode", "navigate");
        headers.set("Sec-Fetch-Site", "none");
        headers.set("Upgrade-Insecure-Requests", "1");
    }

    private void apiHeaders(HttpHeaders headers) {
        headers.set(HttpHeaders.ACCEPT, "application/json, text/javascript, */*; q=0.01");
        commonHeaders(headers);
        headers.set("Sec-Fetch-Dest", "empty");
        headers.set("Sec-Fetch-Mode", "cors");
        headers.set("Sec-Fetch-Site", "same-origin");
        headers.set("X-Requested-With", "XMLHttpRequest");
        headers.set(HttpHeaders.REFERER, settings.getBaseUrl() + "/");
    }

    private void commonHeaders(HttpHeaders headers) {
        headers.set(HttpHeaders.ACCEPT_LANGUAGE, "en-US,en;q=0.9");
        headers.set(HttpHeaders.CACHE_CONTROL, "no-cache");
        headers.set(HttpHeaders.PRAGMA, "no-cache");
        headers.set("Sec-Ch-Ua", SEC_CH_UA);
        headers.set("Sec-Ch-Ua-Mobile", "?0");
        headers.set("Sec-Ch-Ua-Platform", "\"Windows\"");
    }

    void setSleeper(Sleeper sleeper) {
        this.sleeper = sleeper;
    }

    void setRandom(DoubleSupplier random) {
        this.random = random;
    }
}
