package io.scanhive.runtime.agent;

import java.util.Locale;

/**
 * Naming of agent services and their settings configs. The {@link #PREFIX} separates agents from
 * infrastructure services when listing a universe. Service names are capped so that the settings
 * config name derived from them stays within the cluster's 64 character limit for config names.
 */
public final class AgentServiceNames {

    public static final String PREFIX = "agent_";

    static final String SETTINGS_CONFIG_PREFIX = "settings_";

    static final int MAX_CONFIG_NAME_LENGTH = 64;

    static final int MAX_LENGTH = MAX_CONFIG_NAME_LENGTH - SETTINGS_CONFIG_PREFIX.length();

    private static final String KEY_NAMESPACE = "agent/";

    private AgentServiceNames() {
    }

    /**
     * {@code agent/scanhive/nmap} in universe {@code 7} becomes {@code agent_scanhive_nmap_7}.
     */
    public static String serviceName(String agentKey, String universe) {
        if (agentKey == null || agentKey.isBlank()) {
            throw new IllegalArgumentException("agent key must not be blank");
        }
        String key = agentKey.trim();
        if (key.startsWith(KEY_NAMESPACE)) {
            key = key.substring(KEY_NAMESPACE.length());
        }
        int tag = key.indexOf(':');
        if (tag > 0) {
            key = key.substring(0, tag);
        }
        String sanitized = key.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9_-]", "_");
        String suffix = "_" + universe;
        String name = PREFIX + sanitized;
        int room = MAX_LENGTH - suffix.length();
        if (name.length() > room) {
            name = name.substring(0, room);
        }
        return name + suffix;
    }

    /**
     * Name of the config holding the instance settings of {@code serviceName}.
     */
    public static String settingsConfigName(String serviceName) {
        if (serviceName == null || serviceName.isBlank()) {
            throw new IllegalArgumentException("service name must not be blank");
        }
        String name = SETTINGS_CONFIG_PREFIX + serviceName;
        if (name.length() > MAX_CONFIG_NAME_LENGTH) {
            throw new IllegalArgumentException("settings config name exceeds "
                + MAX_CONFIG_NAME_LENGTH + " characters: " + name);
        }
        return name;
    }

    public static boolean isAgentService(String serviceName) {
        return serviceName != null && serviceName.startsWith(PREFIX);
    }
}
