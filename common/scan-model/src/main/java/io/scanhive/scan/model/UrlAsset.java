package io.scanhive.scan.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record UrlAsset(String url, String method) implements Asset {
    public UrlAsset {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("url must not be blank");
        }
        url = url.trim();
        method = method == null || method.isBlank() ? "GET" : method.trim();
    }

    public UrlAsset(String url) {
        this(url, null);
    }

    @Override
    public String selector() {
        return "v3.asset.link";
    }

    @Override
    public String describe() {
        return "URL: " + method + " " + url;
    }
}
