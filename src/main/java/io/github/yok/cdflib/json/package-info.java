/**
 * JSON request parsing and response building for simple RPC-style endpoints.
 *
 * <p>
 * The classes work on plain strings and streams, so they can sit behind any HTTP layer: the caller
 * passes the request method, content type and body, and copies the response headers and body to
 * its own response object.
 * </p>
 */
package io.github.yok.cdflib.json;
