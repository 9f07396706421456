package com.whisperecho.gate.client.model;

import java.net.URI;

/**
 * Network connection details for a gated server.
 *
 * @param baseUri the server root (e.g. http://host:8080/). Request paths are resolved against it.
 */
public record GateConnectionInfo(URI baseUri) {
}
