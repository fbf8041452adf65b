package domain.error;

/** Dependency graph failure (circular dependency, unknown model referenced by a target or selector). */
public class GraphException extends ModelBuildException {

    public GraphException(String detail) {
        super(detail);
    }

    public GraphException(String detail, Throwable cause) {
        super(detail, cause);
    }
}
