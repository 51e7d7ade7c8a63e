package eu.fbk.wikistore;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;

/**
 * Signals the failure of a Wikistore operation, carrying the {@link Status} the failure should
 * be reported with.
 * <p>
 * The status distinguishes failures caused by the client (e.g., a malformed query or an
 * unsupported content type) from failures of the server itself (e.g., a storage error): only the
 * latter are logged as faults by the HTTP frontend. The exception message is the human readable
 * description returned to clients.
 * </p>
 */
public class OperationException extends Exception {

    private static final long serialVersionUID = 1L;

    private final Status status;

    /**
     * Creates a new instance with the status and message specified.
     *
     * @param status
     *            the status of the failed operation
     * @param message
     *            the error message
     */
    public OperationException(final Status status, final String message) {
        this(status, message, null);
    }

    /**
     * Creates a new instance with the status, message and optional cause specified.
     *
     * @param status
     *            the status of the failed operation
     * @param message
     *            the error message
     * @param cause
     *            the optional cause of this exception
     */
    public OperationException(final Status status, final String message,
            @Nullable final Throwable cause) {
        super(Preconditions.checkNotNull(message), cause);
        this.status = Preconditions.checkNotNull(status);
    }

    /**
     * Returns the status associated to this exception.
     *
     * @return the status
     */
    public Status getStatus() {
        return this.status;
    }

    @Override
    public String toString() {
        return this.status + ": " + getMessage();
    }

    /**
     * The outcome of a failed operation, mapped one-to-one to an HTTP status code.
     */
    public enum Status {

        /** The request is malformed or has invalid parameters. */
        ERROR_INVALID_INPUT(400),

        /** The requested resource or method does not exist. */
        ERROR_NOT_FOUND(404),

        /** None of the representations acceptable by the client can be produced. */
        ERROR_NOT_ACCEPTABLE(406),

        /** The request body has a media type that is not supported. */
        ERROR_UNSUPPORTED_MEDIA_TYPE(415),

        /** The operation failed due to a server side fault. */
        ERROR_UNEXPECTED(500);

        private final int httpStatus;

        private Status(final int httpStatus) {
            this.httpStatus = httpStatus;
        }

        /**
         * Returns the HTTP status code corresponding to this status.
         *
         * @return the HTTP status code
         */
        public int getHTTPStatus() {
            return this.httpStatus;
        }

        /**
         * Returns whether this status denotes a fault of the server, rather than of the client.
         *
         * @return true for server faults
         */
        public boolean isServerError() {
            return this.httpStatus >= 500;
        }

    }

}
