package domain.graph;

import domain.error.GraphException;
import domain.model.Relation;

import java.util.Locale;

/**
 * One parsed selector: {@code schema.name}, {@code tag:t}, {@code deps:rel},
 * {@code downstream:rel} or {@code tree:rel}.
 */
public final class Selector {

    public enum Kind {
        EXACT,
        TAG,
        DEPS,
        DOWNSTREAM,
        TREE
    }

    private final Kind kind;
    private final Relation relation;
    private final String tag;

    private Selector(Kind kind, Relation relation, String tag) {
        this.kind = kind;
        this.relation = relation;
        this.tag = tag;
    }

    public static Selector parse(String raw) {
        String s = raw == null ? "" : raw.trim();

        if (s.startsWith("tag:")) {
            String tag = s.substring(4).trim();
            if (tag.isEmpty()) throw new GraphException("empty tag in selector: " + s);
            return new Selector(Kind.TAG, null, tag.toLowerCase(Locale.ROOT));
        }
        if (s.startsWith("deps:")) return withModel(Kind.DEPS, s, s.substring(5));
        if (s.startsWith("downstream:")) return withModel(Kind.DOWNSTREAM, s, s.substring(11));
        if (s.startsWith("tree:")) return withModel(Kind.TREE, s, s.substring(5));

        if (s.indexOf('.') < 0) {
            throw new GraphException("invalid selector '" + s
                    + "': expected 'schema.name' or prefix like 'tag:', 'deps:', 'downstream:', 'tree:'");
        }
        return new Selector(Kind.EXACT, Relation.parse(s), null);
    }

    private static Selector withModel(Kind kind, String whole, String model) {
        String m = model.trim();
        if (m.isEmpty()) throw new GraphException("empty model in selector: " + whole);
        return new Selector(kind, Relation.parse(m), null);
    }

    public Kind getKind() {
        return kind;
    }

    /** Null for {@link Kind#TAG}. */
    public Relation getRelation() {
        return relation;
    }

    /** Lowercased; null unless {@link Kind#TAG}. */
    public String getTag() {
        return tag;
    }

    @Override
    public String toString() {
        return switch (kind) {
            case EXACT -> relation.toString();
            case TAG -> "tag:" + tag;
            case DEPS -> "deps:" + relation;
            case DOWNSTREAM -> "downstream:" + relation;
            case TREE -> "tree:" + relation;
        };
    }
}
