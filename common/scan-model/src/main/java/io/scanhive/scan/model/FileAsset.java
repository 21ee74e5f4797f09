package io.scanhive.scan.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.Arrays;

/**
 * Raw file asset; {@code content} travels base64 encoded in JSON.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FileAsset(String path, byte[] content) implements Asset {
    public FileAsset {
        content = content == null ? new byte[0] : content.clone();
    }

    @Override
    public byte[] content() {
        return content.clone();
    }

    @Override
    public String selector() {
        return "v3.asset.file";
    }

    @Override
    public String describe() {
        return path == null || path.isBlank() ? "File (" + content.length + " bytes)" : "File: " + path;
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof FileAsset that
            && java.util.Objects.equals(path, that.path)
            && Arrays.equals(content, that.content);
    }

    @Override
    public int hashCode() {
        return 31 * java.util.Objects.hashCode(path) + Arrays.hashCode(content);
    }

    @Override
    public String toString() {
        return "FileAsset[path=" + path + ", size=" + content.length + "]";
    }
}
