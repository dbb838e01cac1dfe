/**
 * Shuttle, a resumable IMAP mailbox migration tool.
 *
 * <p>Copies every mailbox of a source account to a destination account.
 * <br>Each migrated message is moved to an archive mailbox at the source and recorded in a local ledger,
 * <br>so a run can be stopped and started again at any point without losing or repeating messages.
 *
 * <p>Usage:
 * <pre>
 *   java -jar shuttle.jar -c migration.yaml [-m mapping.json] [-e exclude.txt] [-d] [-v]
 * </pre>
 *
 * @see com.mimecast.shuttle.Main
 */
package com.mimecast.shuttle;
