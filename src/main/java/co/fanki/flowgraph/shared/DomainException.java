package co.fanki.flowgraph.shared;

/**
 * Raised when a caller breaks the input contract of the engine.
 *
 * <p>Graph shape problems are never reported through this exception:
 * orphan edges, unreachable nodes and missing entries travel as data in
 * the diagnostic and flow reports. Only input that cannot be read at all
 * (a missing AST, an unparseable document, an unknown export format or
 * session) ends up here.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class DomainException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Error code used when none is given. */
    public static final String DEFAULT_ERROR_CODE = "DOMAIN_ERROR";

    private final String errorCode;

    /**
     * Creates a new domain exception with a message.
     *
     * @param message the error message
     */
    public DomainException(final String message) {
        super(message);
        this.errorCode = DEFAULT_ERROR_CODE;
    }

    /**
     * Creates a new domain exception with a message and error code.
     *
     * @param message the error message
     * @param errorCode the specific error code
     */
    public DomainException(final String message, final String errorCode) {
        super(message);
        this.errorCode = errorCode;
    }

    /**
     * Creates a new domain exception with message, error code, and cause.
     *
     * @param message the error message
     * @param errorCode the specific error code
     * @param cause the underlying cause
     */
    public DomainException(final String message, final String errorCode,
            final Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    /**
     * Returns the error code for this exception.
     *
     * @return the error code
     */
    public String getErrorCode() {
        return errorCode;
    }

}
