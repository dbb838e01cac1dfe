/**
 * Run wiring.
 */
package com.mimecast.shuttle.main;
