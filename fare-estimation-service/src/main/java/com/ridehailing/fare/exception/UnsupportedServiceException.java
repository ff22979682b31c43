package com.ridehailing.fare.exception;

/**
 * Raised when a fare is requested for a service id with no configured pricing profile.
 * Indicates a caller or configuration bug; never retried.
 */
public class UnsupportedServiceException extends RuntimeException {

    public static final String CODE = "UNSUPPORTED_SERVICE";

    private final String service;

    public UnsupportedServiceException(String service) {
        super("Unsupported service: " + service);
        this.service = service;
    }

    public String getCode() {
        return CODE;
    }

    public String getService() {
        return service;
    }
}
