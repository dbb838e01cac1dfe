package com.mimecast.shuttle.config;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.naming.ConfigurationException;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Source to destination mailbox name mapping.
 *
 * <p>Loaded from a flat JSON or YAML mapping of source name to destination name.
 * <br>Mailboxes without an entry keep their name, so an empty mapping is the identity.
 */
public class MailboxMapping {
    private static final Logger log = LogManager.getLogger(MailboxMapping.class);

    private final Map<String, String> names;

    /**
     * Constructs a new MailboxMapping instance.
     *
     * @param names Map of source name to destination name.
     */
    public MailboxMapping(Map<String, String> names) {
        this.names = Collections.unmodifiableMap(new LinkedHashMap<>(names));
    }

    /**
     * Identity mapping.
     *
     * @return MailboxMapping instance with no entries.
     */
    public static MailboxMapping identity() {
        return new MailboxMapping(Map.of());
    }

    /**
     * Loads mapping file.
     *
     * @param path File path, .json, .json5, .yml or .yaml.
     * @return MailboxMapping instance.
     * @throws ConfigurationException Unreadable, unsupported or non string entries.
     */
    public static MailboxMapping load(Path path) throws ConfigurationException {
        Map<String, String> names = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : ConfigLoader.load(path).entrySet()) {
            if (!(entry.getValue() instanceof String)) {
                throw new ConfigurationException("Mapping for mailbox " + entry.getKey() + " must be a string in " + path);
            }
            names.put(entry.getKey(), (String) entry.getValue());
        }
        log.info("Loaded {} mailbox mappings from {}", names.size(), path);
        return new MailboxMapping(names);
    }

    /**
     * Resolves the destination mailbox name.
     *
     * @param sourceMailbox Source mailbox name.
     * @return Mapped name or the source name.
     */
    public String resolve(String sourceMailbox) {
        return names.getOrDefault(sourceMailbox, sourceMailbox);
    }

    /**
     * Gets mapping entries.
     *
     * @return Unmodifiable map.
     */
    public Map<String, String> getNames() {
        return names;
    }
}
