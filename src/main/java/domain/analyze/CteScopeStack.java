package domain.analyze;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.HashSet;
import java.util.Set;

/**
 * CTE names visible at the current point of a query walk, one frame per enclosing {@code WITH}.
 */
final class CteScopeStack {

    private final Deque<Set<String>> frames = new ArrayDeque<>();

    void push(Collection<String> names) {
        frames.push(new HashSet<>(names));
    }

    void pop() {
        frames.pop();
    }

    /** Innermost frame first. */
    boolean isVisible(String name) {
        for (Set<String> frame : frames) {
            if (frame.contains(name)) return true;
        }
        return false;
    }

    int depth() {
        return frames.size();
    }
}
