package com.mimecast.shuttle.mime;

import jakarta.mail.MessagingException;
import jakarta.mail.internet.InternetHeaders;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.ByteArrayInputStream;
import java.util.Optional;

/**
 * Message-ID header extraction.
 *
 * <p>Only the header block is parsed, the body is never decoded.
 * <br>A missing or unparseable header yields an empty result, never an error.
 */
public final class MessageIds {
    private static final Logger log = LogManager.getLogger(MessageIds.class);

    private MessageIds() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Extracts Message-ID from raw message bytes.
     *
     * @param content Raw RFC 822 message.
     * @return Optional of trimmed Message-ID value.
     */
    public static Optional<String> extract(byte[] content) {
        if (content == null || content.length == 0) {
            return Optional.empty();
        }
        try {
            InternetHeaders headers = new InternetHeaders(new ByteArrayInputStream(content));
            String value = headers.getHeader("Message-ID", null);
            return StringUtils.isBlank(value) ? Optional.empty() : Optional.of(value.strip());
        } catch (MessagingException e) {
            log.debug("Unable to parse headers for Message-ID: {}", e.getMessage());
            return Optional.empty();
        }
    }
}
