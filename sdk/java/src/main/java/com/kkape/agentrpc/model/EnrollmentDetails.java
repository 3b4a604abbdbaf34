package com.kkape.agentrpc.model;

import com.google.gson.annotations.SerializedName;

import java.util.Objects;

/**
 * Host identity snapshot sent once at enrollment time.
 */
public final class EnrollmentDetails {
    @SerializedName("os_version")
    private final String osVersion;
    @SerializedName("os_build_id")
    private final String osBuild;
    @SerializedName("os_platform")
    private final String osPlatform;
    @SerializedName("os_platform_like")
    private final String osPlatformLike;
    @SerializedName("os_name")
    private final String osName;
    @SerializedName("hostname")
    private final String hostname;
    @SerializedName("hardware_vendor")
    private final String hardwareVendor;
    @SerializedName("hardware_model")
    private final String hardwareModel;
    @SerializedName("hardware_serial")
    private final String hardwareSerial;
    @SerializedName("osquery_version")
    private final String osqueryVersion;
    @SerializedName("launcher_version")
    private final String launcherVersion;

    private EnrollmentDetails(Builder builder) {
        this.osVersion = builder.osVersion;
        this.osBuild = builder.osBuild;
        this.osPlatform = builder.osPlatform;
        this.osPlatformLike = builder.osPlatformLike;
        this.osName = builder.osName;
        this.hostname = builder.hostname;
        this.hardwareVendor = builder.hardwareVendor;
        this.hardwareModel = builder.hardwareModel;
        this.hardwareSerial = builder.hardwareSerial;
        this.osqueryVersion = builder.osqueryVersion;
        this.launcherVersion = builder.launcherVersion;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Details with every field empty, used when nothing is known about the host yet.
     */
    public static EnrollmentDetails empty() {
        return new Builder().build();
    }

    public String getOsVersion() { return osVersion; }
    public String getOsBuild() { return osBuild; }
    public String getOsPlatform() { return osPlatform; }
    public String getOsPlatformLike() { return osPlatformLike; }
    public String getOsName() { return osName; }
    public String getHostname() { return hostname; }
    public String getHardwareVendor() { return hardwareVendor; }
    public String getHardwareModel() { return hardwareModel; }
    public String getHardwareSerial() { return hardwareSerial; }
    public String getOsqueryVersion() { return osqueryVersion; }
    public String getLauncherVersion() { return launcherVersion; }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof EnrollmentDetails)) {
            return false;
        }
        EnrollmentDetails that = (EnrollmentDetails) o;
        return Objects.equals(osVersion, that.osVersion)
                && Objects.equals(osBuild, that.osBuild)
                && Objects.equals(osPlatform, that.osPlatform)
                && Objects.equals(osPlatformLike, that.osPlatformLike)
                && Objects.equals(osName, that.osName)
                && Objects.equals(hostname, that.hostname)
                && Objects.equals(hardwareVendor, that.hardwareVendor)
                && Objects.equals(hardwareModel, that.hardwareModel)
                && Objects.equals(hardwareSerial, that.hardwareSerial)
                && Objects.equals(osqueryVersion, that.osqueryVersion)
                && Objects.equals(launcherVersion, that.launcherVersion);
    }

    @Override
    public int hashCode() {
        return Objects.hash(osVersion, osBuild, osPlatform, osPlatformLike, osName, hostname,
                hardwareVendor, hardwareModel, hardwareSerial, osqueryVersion, launcherVersion);
    }

    @Override
    public String toString() {
        return "EnrollmentDetails{hostname=" + hostname + ", osPlatform=" + osPlatform
                + ", osVersion=" + osVersion + ", launcherVersion=" + launcherVersion + "}";
    }

    /**
     * Builder for EnrollmentDetails. Unset fields are empty strings.
     */
    public static class Builder {
        private String osVersion = "";
        private String osBuild = "";
        private String osPlatform = "";
        private String osPlatformLike = "";
        private String osName = "";
        private String hostname = "";
        private String hardwareVendor = "";
        private String hardwareModel = "";
        private String hardwareSerial = "";
        private String osqueryVersion = "";
        private String launcherVersion = "";

        public Builder osVersion(String osVersion) {
            this.osVersion = nullToEmpty(osVersion);
            return this;
        }

        public Builder osBuild(String osBuild) {
            this.osBuild = nullToEmpty(osBuild);
            return this;
        }

        public Builder osPlatform(String osPlatform) {
            this.osPlatform = nullToEmpty(osPlatform);
            return this;
        }

        public Builder osPlatformLike(String osPlatformLike) {
            this.osPlatformLike = nullToEmpty(osPlatformLike);
            return this;
        }

        public Builder osName(String osName) {
            this.osName = nullToEmpty(osName);
            return this;
        }

        public Builder hostname(String hostname) {
            this.hostname = nullToEmpty(hostname);
            return this;
        }

        public Builder hardwareVendor(String hardwareVendor) {
            this.hardwareVendor = nullToEmpty(hardwareVendor);
            return this;
        }

        public Builder hardwareModel(String hardwareModel) {
            this.hardwareModel = nullToEmpty(hardwareModel);
            return this;
        }

        public Builder hardwareSerial(String hardwareSerial) {
            this.hardwareSerial = nullToEmpty(hardwareSerial);
            return this;
        }

        public Builder osqueryVersion(String osqueryVersion) {
            this.osqueryVersion = nullToEmpty(osqueryVersion);
            return this;
        }

        public Builder launcherVersion(String launcherVersion) {
            this.launcherVersion = nullToEmpty(launcherVersion);
            return this;
        }

        public EnrollmentDetails build() {
            return new EnrollmentDetails(this);
        }

        private static String nullToEmpty(String value) {
            return value == null ? "" : value;
        }
    }
}
