package domain.error;

/** Invalid model body (empty body, malformed section markers, forbidden {@code ${this}} in {@code @base}). */
public class BodyParseException extends ModelBuildException {

    public BodyParseException(String detail) {
        super(detail);
    }

    public BodyParseException(String detail, Throwable cause) {
        super(detail, cause);
    }
}
