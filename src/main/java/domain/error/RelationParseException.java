package domain.error;

/** Malformed {@code schema.name} text. */
public class RelationParseException extends ModelBuildException {

    public RelationParseException(String detail) {
        super(detail);
    }

    public RelationParseException(String detail, Throwable cause) {
        super(detail, cause);
    }
}
