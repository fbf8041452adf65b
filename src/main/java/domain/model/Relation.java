package domain.model;

import domain.error.RelationParseException;

import java.util.Comparator;
import java.util.Objects;

/**
 * Schema-qualified relation ({@code schema.name}).
 *
 * <p>Ordered by schema, then name, so it can key sorted maps and produce deterministic output.</p>
 */
public final class Relation implements Comparable<Relation> {

    private static final Comparator<Relation> ORDER = Comparator
            .comparing(Relation::getSchema)
            .thenComparing(Relation::getName);

    private final String schema;
    private final String name;

    private Relation(String schema, String name) {
        this.schema = schema;
        this.name = name;
    }

    public static Relation of(String schema, String name) {
        if (schema == null || schema.isBlank() || name == null || name.isBlank()) {
            throw new RelationParseException("invalid relation '" + schema + "." + name + "': schema and name must be non-empty");
        }
        return new Relation(schema, name);
    }

    /**
     * Parses {@code schema.name}; exactly two non-empty dot-separated parts.
     */
    public static Relation parse(String text) {
        String s = text == null ? "" : text.trim();
        String[] parts = s.split("\\.", -1);
        if (parts.length != 2 || parts[0].isEmpty() || parts[1].isEmpty()) {
            if (s.indexOf('.') < 0) {
                throw new RelationParseException("invalid relation '" + s
                        + "': must include schema (e.g., 'public." + s + "' or 'staging." + s + "')");
            }
            throw new RelationParseException("invalid relation '" + s
                    + "': expected schema.table format (e.g., 'public.users')");
        }
        return new Relation(parts[0], parts[1]);
    }

    public String getSchema() {
        return schema;
    }

    public String getName() {
        return name;
    }

    @Override
    public int compareTo(Relation o) {
        return ORDER.compare(this, o);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Relation)) return false;
        Relation other = (Relation) o;
        return schema.equals(other.schema) && name.equals(other.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(schema, name);
    }

    @Override
    public String toString() {
        return schema + "." + name;
    }
}
