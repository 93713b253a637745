package com.codeheadsystems.cloak.client.model;

import java.net.URI;

/**
 * Network connection details for the gateway that relays secret chat calls.
 *
 * @param endpoint base URL of the gateway (e.g. http://host:8080); endpoint paths are appended.
 */
public record GatewayConnectionInfo(URI endpoint) {
}
