package com.mimecast.shuttle.config;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import javax.naming.ConfigurationException;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Structured configuration file reader.
 *
 * <p>The encoding is selected by file extension:
 * <ul>
 *     <li><b>.json</b> / <b>.json5</b> - parsed by Gson in lenient mode (comments and unquoted keys allowed).</li>
 *     <li><b>.yml</b> / <b>.yaml</b> - parsed by SnakeYAML with the safe constructor.</li>
 * </ul>
 * <p>The document root must be a mapping. An empty document yields an empty map.
 */
public final class ConfigLoader {
    private static final Logger log = LogManager.getLogger(ConfigLoader.class);

    private ConfigLoader() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Checks whether the file extension is one this loader understands.
     *
     * @param path File path.
     * @return Boolean.
     */
    public static boolean isSupported(Path path) {
        return isJson(path) || isYaml(path);
    }

    /**
     * Reads a structured file into a map.
     *
     * @param path File path.
     * @return Map of String, Object.
     * @throws ConfigurationException Unreadable file, unsupported extension or malformed content.
     */
    public static Map<String, Object> load(Path path) throws ConfigurationException {
        if (!isSupported(path)) {
            throw new ConfigurationException("Unsupported configuration format (expected .json, .json5, .yml or .yaml): " + path);
        }

        Object parsed;
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            if (isJson(path)) {
                parsed = new Gson().fromJson(reader, Object.class);
            } else {
                parsed = new Yaml(new SafeConstructor(new LoaderOptions())).load(reader);
            }
        } catch (IOException e) {
            throw configurationException("Unable to read configuration file: " + path, e);
        } catch (JsonParseException | YAMLException e) {
            throw configurationException("Malformed configuration file: " + path, e);
        }

        if (parsed == null) {
            log.debug("Configuration file {} is empty", path);
            return new LinkedHashMap<>();
        }
        if (!(parsed instanceof Map)) {
            throw new ConfigurationException("Configuration root must be a mapping: " + path);
        }

        Map<String, Object> map = new LinkedHashMap<>();
        ((Map<?, ?>) parsed).forEach((key, value) -> map.put(String.valueOf(key), value));
        log.debug("Loaded {} top level keys from {}", map.size(), path);
        return map;
    }

    private static boolean isJson(Path path) {
        String name = fileName(path);
        return name.endsWith(".json") || name.endsWith(".json5");
    }

    private static boolean isYaml(Path path) {
        String name = fileName(path);
        return name.endsWith(".yml") || name.endsWith(".yaml");
    }

    private static String fileName(Path path) {
        return path.getFileName() == null ? "" : path.getFileName().toString().toLowerCase(Locale.ROOT);
    }

    private static ConfigurationException configurationException(String message, Exception cause) {
        ConfigurationException e = new ConfigurationException(message + ": " + cause.getMessage());
        e.setRootCause(cause);
        return e;
    }
}
