package FAConvert.Model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.TreeSet;

/**
 * Canonical identity of a set of states: the sorted list of member names.
 * Two keys are equal iff they have the same members, regardless of insertion order.
 * The display name is the comma-joined member list, or {@link #EMPTY_NAME} for the empty set.
 */
public final class SubsetKey {
    public static final String EMPTY_NAME = "∅";
    public static final SubsetKey EMPTY = new SubsetKey(Collections.emptyList());

    private final List<String> members;
    private final String name;

    private SubsetKey(List<String> sortedMembers) {
        this.members = sortedMembers;
        this.name = sortedMembers.isEmpty() ? EMPTY_NAME : String.join(",", sortedMembers);
    }

    public static SubsetKey of(Collection<String> states) {
        if (states.isEmpty()) {
            return EMPTY;
        }
        return new SubsetKey(Collections.unmodifiableList(new ArrayList<>(new TreeSet<>(states))));
    }

    public List<String> getMembers() {
        return members;
    }

    public boolean isEmpty() {
        return members.isEmpty();
    }

    public int size() {
        return members.size();
    }

    public String getName() {
        return name;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof SubsetKey && members.equals(((SubsetKey) o).members);
    }

    @Override
    public int hashCode() {
        return members.hashCode();
    }

    @Override
    public String toString() {
        return name;
    }
}
