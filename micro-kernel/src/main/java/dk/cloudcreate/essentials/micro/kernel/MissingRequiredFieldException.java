package dk.cloudcreate.essentials.micro.kernel;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Thrown when the aggregate id or aggregate version can't be extracted from a message payload or an aggregate state
 */
public class MissingRequiredFieldException extends MicroKernelException {
    public final String fieldName;

    public MissingRequiredFieldException(String fieldName, String source) {
        super(msg("Missing required field '{}' in {}", fieldName, source));
        this.fieldName = requireNonNull(fieldName, "No fieldName provided");
    }

    public MissingRequiredFieldException(String fieldName, String source, Throwable cause) {
        super(msg("Invalid value for required field '{}' in {}", fieldName, source), cause);
        this.fieldName = requireNonNull(fieldName, "No fieldName provided");
    }
}
