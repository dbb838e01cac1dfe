/**
 * IMAP session boundary.
 *
 * <p>{@link com.mimecast.shuttle.imap.ImapSession} is the set of protocol operations the migration needs:
 * <br>list, select, create, search, fetch, append, move and logout.
 * <br>{@link com.mimecast.shuttle.imap.JakartaImapSession} implements it on Jakarta Mail with the Angus IMAP provider.
 *
 * <p>{@link com.mimecast.shuttle.imap.SessionManager} opens sessions and replaces dead ones.
 *
 * <h2>Errors:</h2>
 * <ul>
 *     <li><b>ImapConnectionException</b> - a session could not be opened.</li>
 *     <li><b>SessionAbortedException</b> - the session died mid operation, retry on a new one.</li>
 *     <li><b>ImapException</b> - the server refused the operation, do not retry.</li>
 * </ul>
 */
package com.mimecast.shuttle.imap;
