package com.kkape.agentrpc;

import java.util.Set;

/**
 * Notified after one or more client settings changed.
 */
public interface ConfigObserver {

    void configChanged(Set<ConfigKey> changedKeys);
}
