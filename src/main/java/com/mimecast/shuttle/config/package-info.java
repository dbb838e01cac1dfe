/**
 * Handles the configuration of a migration run.
 *
 * <p>Provides the configuration foundation and typed views over it.
 * <br>Files may be JSON (Gson, lenient so JSON5 style comments work) or YAML (SnakeYAML), chosen by extension.
 *
 * <ul>
 *     <li><b>MigrationConfig</b> - endpoints, ledger path and pipeline tuning.</li>
 *     <li><b>EndpointConfig</b> - one IMAP account.</li>
 *     <li><b>MailboxMapping</b> - optional source to destination mailbox renames.</li>
 *     <li><b>ExcludeList</b> - mailboxes to leave alone.</li>
 * </ul>
 */
package com.mimecast.shuttle.config;
