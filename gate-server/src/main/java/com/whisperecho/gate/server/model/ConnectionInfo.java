package com.whisperecho.gate.server.model;

/**
 * Connection-level attributes used to label anonymous requests.
 *
 * @param sourceAddress remote address as seen by the server
 * @param agentString   the {@code User-Agent} header, may be null
 */
public record ConnectionInfo(String sourceAddress, String agentString) {
}
