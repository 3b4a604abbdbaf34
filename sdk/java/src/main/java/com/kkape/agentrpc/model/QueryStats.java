package com.kkape.agentrpc.model;

import com.google.gson.annotations.SerializedName;

/**
 * Resource usage reported by osquery for a distributed query.
 */
public class QueryStats {
    @SerializedName("wall_time_ms")
    private long wallTimeMs;
    @SerializedName("user_time")
    private long userTime;
    @SerializedName("system_time")
    private long systemTime;
    @SerializedName("memory")
    private long memory;

    public long getWallTimeMs() { return wallTimeMs; }
    public void setWallTimeMs(long wallTimeMs) { this.wallTimeMs = wallTimeMs; }
    public long getUserTime() { return userTime; }
    public void setUserTime(long userTime) { this.userTime = userTime; }
    public long getSystemTime() { return systemTime; }
    public void setSystemTime(long systemTime) { this.systemTime = systemTime; }
    public long getMemory() { return memory; }
    public void setMemory(long memory) { this.memory = memory; }
}
