package in.kirim.domain.common;

/**
 * Rejected job input. Carries the code so the HTTP layer can answer 400.
 */
public class JobValidationException extends RuntimeException {

    private final ValidationErrorCode code;

    public JobValidationException(ValidationErrorCode code) {
        super(code.getMessage());
        this.code = code;
    }

    public JobValidationException(ValidationErrorCode code, String detail) {
        super(code.getMessage() + ": " + detail);
        this.code = code;
    }

    public ValidationErrorCode getCode() {
        return code;
    }
}
