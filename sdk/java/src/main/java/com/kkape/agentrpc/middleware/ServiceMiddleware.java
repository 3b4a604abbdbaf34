package com.kkape.agentrpc.middleware;

import com.kkape.agentrpc.KolideService;

/**
 * Decorates a {@link KolideService}.
 */
@FunctionalInterface
public interface ServiceMiddleware {

    KolideService wrap(KolideService next);
}
