package io.scanhive.scan.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * JSON codec for asset payloads.
 */
public final class AssetPayloads {

    private static final ObjectMapper MAPPER = new ObjectMapper().findAndRegisterModules();

    private AssetPayloads() {
    }

    public static byte[] encode(Asset asset) {
        try {
            return MAPPER.writerFor(Asset.class).writeValueAsBytes(asset);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Unable to encode asset " + asset.describe(), e);
        }
    }

    public static Asset decode(byte[] payload) {
        try {
            return MAPPER.readValue(payload, Asset.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to decode asset payload", e);
        }
    }
}
