package com.whereq.scribe.model;

import lombok.Builder;
import lombok.ToString;
import lombok.Value;

/**
 * WordPress site address and application-password credentials
 */
@Value
@Builder
public class SiteCredentials {
    String url;

    String username;

    @ToString.Exclude
    String password;

    /**
     * Site URL without trailing slashes
     */
    public String baseUrl() {
        String base = url.trim();
        while (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base;
    }
}
