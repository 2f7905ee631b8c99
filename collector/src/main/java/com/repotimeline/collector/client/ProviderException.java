package com.repotimeline.collector.client;

/**
 * Failure raised by a {@link GitPlatformProvider}. The {@link ErrorKind} decides how callers
 * react; the message is meant for people.
 */
public class ProviderException extends Exception {

    /** Status value used when no HTTP response was received. */
    public static final int NO_STATUS = -1;

    private final ErrorKind kind;
    private final int statusCode;

    public ProviderException(ErrorKind kind, String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.statusCode = statusCode;
    }

    public static ProviderException notFound(String message) {
        return new ProviderException(ErrorKind.NOT_FOUND, message, 404, null);
    }

    public static ProviderException rateLimited(String message, int statusCode) {
        return new ProviderException(ErrorKind.RATE_LIMITED, message, statusCode, null);
    }

    public static ProviderException failure(String message, int statusCode) {
        return new ProviderException(ErrorKind.PROVIDER_ERROR, message, statusCode, null);
    }

    public static ProviderException failure(String message, Throwable cause) {
        return new ProviderException(ErrorKind.PROVIDER_ERROR, message, NO_STATUS, cause);
    }

    public ErrorKind kind() {
        return kind;
    }

    /**
     * @return the HTTP status that caused the failure, or {@link #NO_STATUS}
     */
    public int statusCode() {
        return statusCode;
    }
}
