package com.paxkun.magpie.service.search;

/**
 * Short-lived token scraped from the search page. Valid for a single attempt.
 */
public record SearchSession(String token) {

    /**
     * Token prefix for logs; the full value is never written out.
     */
    public String redacted() {
        return token.length() <= 6 ? "***" : token.substring(0, 6) + "…";
    }
}
