package domain.error;

/** Dependency analysis failure (SQL that cannot be analysed, unknown or ambiguous relations). */
public class DependencyException extends ModelBuildException {

    public DependencyException(String detail) {
        super(detail);
    }

    public DependencyException(String detail, Throwable cause) {
        super(detail, cause);
    }
}
