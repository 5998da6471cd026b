package com.restschema.common.status;

/**
 * Status codes understood by the dispatcher, each paired with the HTTP status a host should
 * answer with and the short title used in error envelopes.
 */
public enum StatusCode {
    OK(200, "OK"),
    INVALID_ARGUMENT(400, "Bad Request"),            // parameter or representation failures
    UNAUTHENTICATED(401, "Unauthorized"),
    PERMISSION_DENIED(403, "Forbidden"),
    NOT_FOUND(404, "Not Found"),
    METHOD_NOT_ALLOWED(405, "Method Not Allowed"),
    ALREADY_EXISTS(409, "Conflict"),
    UNSUPPORTED_MEDIA_TYPE(415, "Unsupported Media Type"),
    INTERNAL(500, "Internal Server Error");

    private final int httpCode;
    private final String title;

    StatusCode(int httpCode, String title) {
        this.httpCode = httpCode;
        this.title = title;
    }

    /**
     * Returns the corresponding HTTP status code.
     */
    public int getHttpCode() {
        return httpCode;
    }

    /**
     * Returns the short, human readable title of this code.
     */
    public String getTitle() {
        return title;
    }
}
