/**
 * The durable record of completed message transfers.
 *
 * <p>The ledger makes every migration step idempotent.
 * <br>Before a message is touched the pipeline asks {@link com.mimecast.shuttle.ledger.TransferLedger#isTransferred(String, String)};
 * <br>after it was appended to the destination and archived at the source the pipeline commits a
 * <br>{@link com.mimecast.shuttle.ledger.TransferRecord}.
 *
 * <h2>Backends:</h2>
 * <ul>
 *     <li><b>SQLite</b> - single file database in WAL mode, used for real runs.</li>
 *     <li><b>InMemory</b> - for tests.</li>
 * </ul>
 *
 * @see com.mimecast.shuttle.ledger.SqliteTransferLedger
 * @see com.mimecast.shuttle.ledger.InMemoryTransferLedger
 */
package com.mimecast.shuttle.ledger;
