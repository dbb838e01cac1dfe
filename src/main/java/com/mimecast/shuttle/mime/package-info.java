/**
 * MIME helpers.
 */
package com.mimecast.shuttle.mime;
