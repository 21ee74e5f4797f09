package io.scanhive.scan.model;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Loads {@link AgentGroupDefinition}s from YAML documents.
 * <pre>
 * description: web scan
 * agents:
 *   - key: agent/scanhive/nmap
 *     replicas: 2
 *     args:
 *       - name: ports
 *         type: string
 *         value: "80,443"
 * </pre>
 */
public final class AgentGroupDefinitions {

    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory())
        .configure(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY, true)
        .findAndRegisterModules();

    private AgentGroupDefinitions() {
    }

    public static AgentGroupDefinition fromYaml(InputStream in) {
        Objects.requireNonNull(in, "in");
        try {
            AgentGroupDefinition definition = YAML.readValue(in, AgentGroupDefinition.class);
            return definition == null ? new AgentGroupDefinition(null, null) : definition;
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to parse agent group definition", e);
        }
    }

    public static AgentGroupDefinition fromYaml(String yaml) {
        Objects.requireNonNull(yaml, "yaml");
        try {
            AgentGroupDefinition definition = YAML.readValue(yaml, AgentGroupDefinition.class);
            return definition == null ? new AgentGroupDefinition(null, null) : definition;
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to parse agent group definition", e);
        }
    }

    public static AgentGroupDefinition fromFile(Path path) {
        Objects.requireNonNull(path, "path");
        try (InputStream in = Files.newInputStream(path)) {
            return fromYaml(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to read agent group definition " + path, e);
        }
    }
}
