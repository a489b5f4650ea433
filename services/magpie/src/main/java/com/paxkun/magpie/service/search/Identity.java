package com.paxkun.magpie.service.search;

import java.net.URI;

/**
 * Network fingerprint for one search attempt.
 *
 * @param userAgent    browser user agent sent on every request of the attempt
 * @param proxyAddress forward proxy URL, or {@code null} for a direct connection
 */
public record Identity(String userAgent, String proxyAddress) {

    public boolean hasProxy() {
        return proxyAddress != null && !proxyAddress.isBlank();
    }

    /**
     * Proxy as {@code host:port} with any credentials removed, safe for logs.
     */
    public String describeProxy() {
        if (!hasProxy()) {
            return "direct";
        }
        try {
            URI uri = URI.create(proxyAddress);
            if (uri.getHost() == null) {
                return "unparseable-proxy";
            }
            return uri.getPort() > 0 ? uri.getHost() + ":" + uri.getPort() : uri.getHost();
        } catch (IllegalArgumentException e) {
            return "unparseable-proxy";
        }
    }
}
