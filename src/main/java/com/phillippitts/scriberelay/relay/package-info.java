/**
 * Relay session supervisor.
 *
 * <p>Authenticates each client WebSocket, opens one upstream engine connection per session with
 * the server-held key, forwards PCM frames byte-for-byte and relays classified results back.
 * Close codes: 4001 auth timeout, 4002 auth failed, 4003 origin not allowed.
 */
package com.phillippitts.scriberelay.relay;
