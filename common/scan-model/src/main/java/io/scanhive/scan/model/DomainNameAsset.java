package io.scanhive.scan.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record DomainNameAsset(String name) implements Asset {
    public DomainNameAsset {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("domain name must not be blank");
        }
        name = name.trim();
    }

    @Override
    public String selector() {
        return "v3.asset.domain_name";
    }

    @Override
    public String describe() {
        return "Domain Name: " + name;
    }
}
