package com.mimecast.shuttle.imap;

import com.mimecast.shuttle.config.EndpointConfig;
import jakarta.mail.AuthenticationFailedException;
import jakarta.mail.MessagingException;
import jakarta.mail.Session;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.eclipse.angus.mail.imap.IMAPStore;

import java.util.Properties;

/**
 * Jakarta Mail IMAP connector.
 *
 * <p>Builds Jakarta Mail session properties from an {@link EndpointConfig} and logs in.
 * <br>Implicit TLS uses the <i>imaps</i> protocol, plain connections use <i>imap</i> with opportunistic STARTTLS.
 */
public class JakartaImapConnector implements ImapConnector {
    private static final Logger log = LogManager.getLogger(JakartaImapConnector.class);

    private final boolean debug;

    /**
     * Constructs a new JakartaImapConnector instance.
     */
    public JakartaImapConnector() {
        this(false);
    }

    /**
     * Constructs a new JakartaImapConnector instance.
     *
     * @param debug Enable Jakarta Mail protocol trace.
     */
    public JakartaImapConnector(boolean debug) {
        this.debug = debug;
    }

    @Override
    public ImapSession open(EndpointConfig endpoint) throws ImapConnectionException {
        log.info("Connecting to {}:{} as {}", endpoint.getHost(),
                endpoint.hasPort() ? String.valueOf(endpoint.getPort()) : "default", endpoint.getUser());

        Properties props = buildProperties(endpoint);
        String protocol = props.getProperty("mail.store.protocol");
        try {
            Session session = Session.getInstance(props);
            IMAPStore store = (IMAPStore) session.getStore(protocol);
            store.connect(endpoint.getHost(), endpoint.getPort(), endpoint.getUser(), endpoint.getPass());
            return new JakartaImapSession(endpoint, session, store);
        } catch (AuthenticationFailedException e) {
            throw new ImapConnectionException("IMAP authentication failed for " + endpoint + ": " + e.getMessage(), e);
        } catch (MessagingException e) {
            throw new ImapConnectionException("IMAP connection failed for " + endpoint + ": " + e.getMessage(), e);
        }
    }

    /**
     * Builds Jakarta Mail session properties for IMAP/IMAPS.
     *
     * @param endpoint Endpoint configuration.
     * @return Properties instance.
     */
    Properties buildProperties(EndpointConfig endpoint) {
        Properties props = new Properties();
        String protocol = endpoint.isSsl() ? "imaps" : "imap";
        String prefix = "mail." + protocol + ".";

        props.put("mail.store.protocol", protocol);
        props.put(prefix + "host", endpoint.getHost());
        props.put(prefix + "port", String.valueOf(endpoint.getPort()));
        props.put(prefix + "ssl.enable", String.valueOf(endpoint.isSsl()));
        if (endpoint.isTrustAll()) {
            props.put(prefix + "ssl.trust", "*");
        }
        if (!endpoint.isSsl()) {
            props.put(prefix + "starttls.enable", "true");
        }

        props.put(prefix + "connectiontimeout", String.valueOf(endpoint.getConnectTimeout() * 1000L));
        props.put(prefix + "timeout", String.valueOf(endpoint.getTimeout() * 1000L));

        // Large messages are fetched whole, do not let the provider split them into partial fetches.
        props.put(prefix + "partialfetch", "false");
        // Fetching must not set \Seen on the source copy.
        props.put(prefix + "peek", "true");

        props.put("mail.debug", String.valueOf(debug));
        return props;
    }
}
