package domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * List-backed sink with de-duplication by (kind|model|detail).
 *
 * <p>check runs lint and qualify over the same body, which report the same unqualified
 * reference twice.</p>
 */
public final class ListIssueSink implements IssueSink {

    private final List<ModelIssue> target;
    private final Set<String> seen = new HashSet<>(64);

    public ListIssueSink() {
        this(new ArrayList<>());
    }

    public ListIssueSink(List<ModelIssue> target) {
        this.target = target;
    }

    private static String key(ModelIssue i) {
        return i.getKind().name() + "|" + i.getModel() + "|" + i.getDetail();
    }

    @Override
    public void report(ModelIssue issue) {
        if (issue == null || target == null) return;
        if (seen.add(key(issue))) {
            target.add(issue);
        }
    }

    public List<ModelIssue> getIssues() {
        return Collections.unmodifiableList(target);
    }

    public boolean isEmpty() {
        return target.isEmpty();
    }
}
