package com.kkape.agentrpc.message;

import com.google.gson.annotations.SerializedName;
import com.kkape.agentrpc.model.EnrollmentDetails;

public class EnrollmentRequest {
    @SerializedName("enroll_secret")
    private String enrollSecret;
    @SerializedName("host_identifier")
    private String hostIdentifier;
    @SerializedName("EnrollmentDetails")
    private EnrollmentDetails enrollmentDetails;

    public EnrollmentRequest() {
    }

    public EnrollmentRequest(String enrollSecret, String hostIdentifier, EnrollmentDetails enrollmentDetails) {
        this.enrollSecret = enrollSecret;
        this.hostIdentifier = hostIdentifier;
        this.enrollmentDetails = enrollmentDetails;
    }

    public String getEnrollSecret() { return enrollSecret; }
    public String getHostIdentifier() { return hostIdentifier; }

    public EnrollmentDetails getEnrollmentDetails() {
        return enrollmentDetails == null ? EnrollmentDetails.empty() : enrollmentDetails;
    }
}
