package io.scanhive.docker;

public record ConfigReference(String configId, String configName, String fileName) {
    public ConfigReference {
        if (configId == null || configId.isBlank()) {
            throw new IllegalArgumentException("configId must not be blank");
        }
        if (fileName == null || fileName.isBlank()) {
            throw new IllegalArgumentException("fileName must not be blank");
        }
    }
}
