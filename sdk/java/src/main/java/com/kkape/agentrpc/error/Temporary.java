package com.kkape.agentrpc.error;

/**
 * Marks an error the caller may retry once the network condition clears.
 */
public interface Temporary {

    boolean isTemporary();
}
