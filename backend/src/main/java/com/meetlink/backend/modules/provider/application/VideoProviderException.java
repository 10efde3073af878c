package com.meetlink.backend.modules.provider.application;

public class VideoProviderException extends RuntimeException {

    private final int statusCode;
    private final String errorCode;
    private final boolean timeout;

    public VideoProviderException(int statusCode, String errorCode, String message) {
        super(message);
        this.statusCode = statusCode;
        this.errorCode = errorCode;
        this.timeout = false;
    }

    public VideoProviderException(String message, Throwable cause, boolean timeout) {
        super(message, cause);
        this.statusCode = -1;
        this.errorCode = null;
        this.timeout = timeout;
    }

    /**
     * HTTP status returned by the provider, or -1 when no response was received.
     */
    public int getStatusCode() {
        return statusCode;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public boolean isTimeout() {
        return timeout;
    }

    public boolean isRetryable() {
        return timeout || statusCode < 0 || statusCode == 429 || statusCode >= 500;
    }
}
