package com.kkape.agentrpc.middleware;

import com.kkape.agentrpc.KolideService;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered list of middleware. The first entry wraps the service directly, each later entry
 * wraps the result of the previous one, so the last entry runs first on every call.
 */
public final class ServiceChain {
    private final List<ServiceMiddleware> layers;

    private ServiceChain(List<ServiceMiddleware> layers) {
        this.layers = Collections.unmodifiableList(new ArrayList<>(layers));
    }

    public static ServiceChain of(ServiceMiddleware... layers) {
        List<ServiceMiddleware> list = new ArrayList<>();
        Collections.addAll(list, layers);
        return new ServiceChain(list);
    }

    /**
     * Logging innermost, request ids outermost: the id is in place before anything is logged.
     */
    public static ServiceChain standard() {
        return standard(Clock.systemUTC());
    }

    public static ServiceChain standard(Clock clock) {
        return of(LoggingMiddleware.middleware(clock), RequestIdMiddleware::new);
    }

    public List<ServiceMiddleware> layers() {
        return layers;
    }

    public KolideService apply(KolideService service) {
        KolideService wrapped = service;
        for (ServiceMiddleware layer : layers) {
            wrapped = layer.wrap(wrapped);
        }
        return wrapped;
    }
}
