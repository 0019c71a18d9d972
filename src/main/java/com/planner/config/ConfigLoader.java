package com.planner.config;

import com.planner.exception.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.Map;

/**
 * Loads planner configuration from YAML files.
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    /**
     * Load configuration from a path.
     * Supports classpath: prefix for classpath resources.
     *
     * @param path Path to the configuration file
     * @return Loaded configuration
     */
    public static PlannerConfig load(String path) {
        log.info("Loading planner configuration from: {}", path);

        Resource resource = getResource(path);
        try (InputStream inputStream = resource.getInputStream()) {
            return parseYaml(inputStream);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration from: " + path, e);
        } catch (YAMLException | ClassCastException e) {
            throw new ConfigurationException("Malformed configuration in: " + path, e);
        }
    }

    private static Resource getResource(String path) {
        if (path.startsWith("classpath:")) {
            String resourcePath = path.substring("classpath:".length());
            return new ClassPathResource(resourcePath);
        }
        return new FileSystemResource(path);
    }

    @SuppressWarnings("unchecked")
    static PlannerConfig parseYaml(InputStream inputStream) {
        Yaml yaml = new Yaml();
        Map<String, Object> root = yaml.load(inputStream);

        if (root == null) {
            throw new ConfigurationException("Configuration file is empty");
        }

        // The planner section may be at root or under a 'planner' key
        Map<String, Object> plannerConfig = root.containsKey("planner")
                ? (Map<String, Object>) root.get("planner")
                : root;

        String name = getString(plannerConfig, "name", "planner");
        ZoneId zone = parseZone(getString(plannerConfig, "zone", "UTC"));
        boolean seedDemoTasks = getBoolean(plannerConfig, "seed-demo-tasks", false);

        Map<String, Object> snapshotMap = (Map<String, Object>) plannerConfig.get("snapshot");
        boolean prettyPrint = snapshotMap == null || getBoolean(snapshotMap, "pretty-print", true);

        ReminderConfig reminder = parseReminderConfig((Map<String, Object>) plannerConfig.get("reminder"));

        PlannerConfig config = new PlannerConfig(name, zone, seedDemoTasks, prettyPrint, reminder);

        log.info("Loaded planner configuration: {} (zone={}, seedDemoTasks={}, reminders={})",
                name, zone, seedDemoTasks, reminder.enabled() ? "on" : "off");

        return config;
    }

    private static ReminderConfig parseReminderConfig(Map<String, Object> map) {
        if (map == null) {
            return ReminderConfig.defaults();
        }
        ReminderConfig defaults = ReminderConfig.defaults();
        boolean enabled = getBoolean(map, "enabled", defaults.enabled());
        int windowMinutes = getInt(map, "window-minutes", defaults.windowMinutes());
        int graceMinutes = getInt(map, "grace-minutes", defaults.graceMinutes());
        int intervalSeconds = getInt(map, "interval-seconds", defaults.intervalSeconds());

        if (windowMinutes < 0 || graceMinutes < 0) {
            throw new ConfigurationException("Reminder window and grace must not be negative");
        }
        if (intervalSeconds <= 0) {
            throw new ConfigurationException("Reminder interval-seconds must be positive, got " + intervalSeconds);
        }
        return new ReminderConfig(enabled, windowMinutes, graceMinutes, intervalSeconds);
    }

    private static ZoneId parseZone(String zone) {
        try {
            return ZoneId.of(zone);
        } catch (DateTimeException e) {
            throw new ConfigurationException("Unknown zone: " + zone, e);
        }
    }

    // Helper methods

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    private static int getInt(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Number) return ((Number) value).intValue();
        try {
            return Integer.parseInt(value.toString());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Expected an integer for '" + key + "', got: " + value, e);
        }
    }

    private static boolean getBoolean(Map<String, Object> map, String key, boolean defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Boolean) return (Boolean) value;
        return Boolean.parseBoolean(value.toString());
    }
}
