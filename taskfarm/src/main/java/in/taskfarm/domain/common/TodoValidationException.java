package in.taskfarm.domain.common;

/**
 * Bad input. Raised before any write, so nothing has been persisted.
 */
public class TodoValidationException extends CoordinationException {

    private final ValidationErrorCode code;

    public TodoValidationException(ValidationErrorCode code) {
        super(code.getMessage());
        this.code = code;
    }

    public TodoValidationException(ValidationErrorCode code, String detail) {
        super(code.getMessage() + ": " + detail);
        this.code = code;
    }

    public ValidationErrorCode getCode() {
        return code;
    }
}
