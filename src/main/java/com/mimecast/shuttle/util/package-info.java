/**
 * Small shared utilities.
 *
 * <p>{@link com.mimecast.shuttle.util.Sleeper} is the single point through which the migration waits,
 * <br>so that every delay in the engine can be observed and skipped in tests.
 */
package com.mimecast.shuttle.util;
