/**
 * Mailbox migration.
 *
 * <p>{@link com.mimecast.shuttle.migrate.MigrationOrchestrator} walks the source mailboxes
 * <br>and hands each to {@link com.mimecast.shuttle.migrate.BatchTransferPipeline}.
 *
 * <p>Progress is persisted in a {@link com.mimecast.shuttle.ledger.TransferLedger} keyed by
 * <br>source mailbox and UID, so an interrupted run resumes where it stopped.
 */
package com.mimecast.shuttle.migrate;
