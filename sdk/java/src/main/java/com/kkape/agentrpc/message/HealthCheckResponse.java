package com.kkape.agentrpc.message;

import com.google.gson.annotations.SerializedName;

public class HealthCheckResponse extends ApiResponse {
    @SerializedName("status")
    private int status;

    public int getStatus() { return status; }
    public void setStatus(int status) { this.status = status; }
}
