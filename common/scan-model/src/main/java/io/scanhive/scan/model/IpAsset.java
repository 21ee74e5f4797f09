package io.scanhive.scan.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record IpAsset(String host, Integer version, Integer mask) implements Asset {
    public IpAsset {
        if (host == null || host.isBlank()) {
            throw new IllegalArgumentException("ip host must not be blank");
        }
        host = host.trim();
        if (version == null) {
            version = host.contains(":") ? 6 : 4;
        } else if (version != 4 && version != 6) {
            throw new IllegalArgumentException("ip version must be 4 or 6, got " + version);
        }
    }

    public IpAsset(String host) {
        this(host, null, null);
    }

    /**
     * One selector for both families; the version travels in the payload.
     */
    @Override
    public String selector() {
        return "v3.asset.ip";
    }

    @Override
    public String describe() {
        return mask == null ? "IP: " + host : "IP: " + host + "/" + mask;
    }
}
