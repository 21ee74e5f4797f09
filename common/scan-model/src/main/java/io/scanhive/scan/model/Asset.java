package io.scanhive.scan.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Target of a scan. The payload is handed to the injection agent together with the selector that
 * tells agents how to decode it.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = DomainNameAsset.class, name = "domain_name"),
    @JsonSubTypes.Type(value = IpAsset.class, name = "ip"),
    @JsonSubTypes.Type(value = UrlAsset.class, name = "url"),
    @JsonSubTypes.Type(value = FileAsset.class, name = "file")
})
public interface Asset {

    /**
     * Message selector of the asset, e.g. {@code v3.asset.domain_name}.
     */
    @JsonIgnore
    String selector();

    /**
     * Human readable descriptor persisted with the scan record.
     */
    @JsonIgnore
    String describe();

    /**
     * Serialized payload injected into the scan.
     */
    default byte[] toPayload() {
        return AssetPayloads.encode(this);
    }
}
