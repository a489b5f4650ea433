package com.paxkun.magpie.service.search;

import com.paxkun.magpie.config.MagpieProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Round-robin over the configured user agents and, independently, over the proxies.
 * Both cursors advance on every {@link #next()} whatever the outcome of the attempt.
 *
 * Author: Pax
 */
@Slf4j
@Component
public class IdentityRotator {

    private final List<String> userAgents;
    private final List<String> proxies;
    private final AtomicInteger userAgentCursor = new AtomicInteger();
    private final AtomicInteger proxyCursor = new AtomicInteger();

    @Autowired
    public IdentityRotator(MagpieProperties properties) {
        this(properties.getSearch().getUserAgents(), properties.getSearch().getProxies());
    }

    public IdentityRotator(List<String> userAgents, List<String> proxies) {
        this.userAgents = clean(userAgents);
        this.proxies = clean(proxies);
        if (this.userAgents.isEmpty()) {
            throw new IllegalArgumentException("At least one user agent must be configured");
        }
        if (this.proxies.isEmpty()) {
            log.warn("⚠️ No proxies configured. All search attempts will connect directly.");
        } else {
            log.info("🔁 Loaded {} proxies and {} user agents for rotation", this.proxies.size(), this.userAgents.size());
        }
    }

    public Identity next() {
        String userAgent = userAgents.get(advance(userAgentCursor, userAgents.size()));
        String proxy = proxies.isEmpty() ? null : proxies.get(advance(proxyCursor, proxies.size()));
        return new Identity(userAgent, proxy);
    }

    public int proxyCount() {
        return proxies.size();
    }

    public int userAgentCount() {
        return userAgents.size();
    }

    private static int advance(AtomicInteger cursor, int size) {
        return cursor.getAndUpdate(current -> (current + 1) % size);
    }

    private static List<String> clean(List<String> values) {
        if (values == null) {
            return List.of();
        }
        return values.stream()
                .filter(value -> value != null && !value.isBlank())
                .map(String::trim)
                .toList();
    }
}
