/**
 * Retry of IMAP operations that fail because the session died.
 *
 * @see com.mimecast.shuttle.retry.RetryPolicy
 */
package com.mimecast.shuttle.retry;
