package com.kkape.agentrpc;

/**
 * Client settings whose changes are broadcast to {@link ConfigObserver}s.
 */
public enum ConfigKey {
    SERVER_URL
}
