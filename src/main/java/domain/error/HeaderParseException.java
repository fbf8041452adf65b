package domain.error;

/** Invalid model header (missing/invalid key, malformed test syntax, invalid tag, incremental-only field misuse). */
public class HeaderParseException extends ModelBuildException {

    public HeaderParseException(String detail) {
        super(detail);
    }

    public HeaderParseException(String detail, Throwable cause) {
        super(detail, cause);
    }
}
