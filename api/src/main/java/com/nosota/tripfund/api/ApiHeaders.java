package com.nosota.tripfund.api;

/**
 * HTTP headers shared by all tripfund endpoints.
 */
public final class ApiHeaders {

    /**
     * ID of the calling user. Set by the gateway after the identity provider token is verified.
     */
    public static final String USER_ID = "X-User-Id";

    /**
     * Optional request correlation ID; generated by the service when absent and echoed back.
     */
    public static final String CORRELATION_ID = "X-Correlation-Id";

    private ApiHeaders() {
    }
}
