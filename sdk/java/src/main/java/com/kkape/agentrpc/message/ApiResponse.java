package com.kkape.agentrpc.message;

import com.google.gson.annotations.SerializedName;

/**
 * Envelope fields shared by every response. The disable flag is evaluated before
 * anything else in the response.
 */
public abstract class ApiResponse {
    @SerializedName("disable_device")
    private boolean disableDevice;

    public boolean isDisableDevice() {
        return disableDevice;
    }

    public void setDisableDevice(boolean disableDevice) {
        this.disableDevice = disableDevice;
    }
}
