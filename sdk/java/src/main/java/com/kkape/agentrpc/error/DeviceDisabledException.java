package com.kkape.agentrpc.error;

/**
 * The server flagged this device as disabled. Takes precedence over every other
 * field of the response that carried the flag.
 */
public class DeviceDisabledException extends KolideServiceException {

    public DeviceDisabledException() {
        super("device disabled");
    }
}
