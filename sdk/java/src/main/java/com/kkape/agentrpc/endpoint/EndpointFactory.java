package com.kkape.agentrpc.endpoint;

import com.kkape.agentrpc.error.TransportException;

/**
 * Builds the endpoint bindings for a server URL. Must not perform network I/O, since it
 * runs while a reconfiguration is pending.
 */
@FunctionalInterface
public interface EndpointFactory {

    EndpointSet create(String serverUrl) throws TransportException;
}
