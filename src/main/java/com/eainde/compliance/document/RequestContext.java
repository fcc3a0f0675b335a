package com.eainde.compliance.document;

import java.net.URI;
import java.util.Locale;

/**
 * Where the document was fetched from. The scheme drives the transport-encryption rule and
 * the host the external-script rule.
 */
public record RequestContext(String url, String scheme, String host) {

    public RequestContext {
        scheme = scheme == null ? "" : scheme.toLowerCase(Locale.ROOT);
        host = host == null ? "" : host.toLowerCase(Locale.ROOT);
    }

    /**
     * @throws IllegalArgumentException when {@code url} is blank or not a URI
     */
    public static RequestContext fromUrl(String url) {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("url must not be blank");
        }
        URI uri = URI.create(url.strip());
        return new RequestContext(url.strip(), uri.getScheme(), uri.getHost());
    }

    public boolean isHttps() {
        return "https".equals(scheme);
    }
}
