package com.kkape.agentrpc.endpoint;

import com.kkape.agentrpc.error.KolideServiceException;

/**
 * One remote operation: encode the request, do the network round trip, decode the reply.
 *
 * @param <Q> request message
 * @param <R> response message
 */
@FunctionalInterface
public interface Endpoint<Q, R> {

    R invoke(Q request) throws KolideServiceException;
}
