package com.mimecast.shuttle.config;

import javax.naming.ConfigurationException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Mailboxes never handed to the migration pipeline.
 *
 * <p>File format is one mailbox name per line.
 * <br>Lines are trimmed, blank lines and lines starting with <i>#</i> are ignored.
 */
public class ExcludeList {

    private final Set<String> names;

    /**
     * Constructs a new ExcludeList instance.
     *
     * @param names Mailbox names.
     */
    public ExcludeList(Set<String> names) {
        this.names = Collections.unmodifiableSet(new LinkedHashSet<>(names));
    }

    /**
     * Empty exclude list.
     *
     * @return ExcludeList instance.
     */
    public static ExcludeList empty() {
        return new ExcludeList(Set.of());
    }

    /**
     * Loads exclude file.
     *
     * @param path File path.
     * @return ExcludeList instance.
     * @throws ConfigurationException Unable to read file.
     */
    public static ExcludeList load(Path path) throws ConfigurationException {
        Set<String> names = new LinkedHashSet<>();
        try {
            for (String line : Files.readAllLines(path, StandardCharsets.UTF_8)) {
                String name = line.strip();
                if (!name.isEmpty() && !name.startsWith("#")) {
                    names.add(name);
                }
            }
        } catch (IOException e) {
            ConfigurationException ce = new ConfigurationException("Unable to read exclude file: " + path);
            ce.setRootCause(e);
            throw ce;
        }
        return new ExcludeList(names);
    }

    /**
     * Checks if mailbox is excluded.
     *
     * @param mailbox Mailbox name.
     * @return Boolean.
     */
    public boolean contains(String mailbox) {
        return names.contains(mailbox);
    }

    public boolean isEmpty() {
        return names.isEmpty();
    }

    public Set<String> getNames() {
        return names;
    }
}
