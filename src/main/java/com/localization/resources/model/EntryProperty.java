package com.localization.resources.model;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Observable properties of a {@link ResourceTableEntry} and how they depend on each other.
 *
 * <p>A change of one property invalidates its dependents, which are reported in the same
 * notification round.</p>
 */
public enum EntryProperty {
    CODE_REFERENCES("CodeReferences"),
    FILE_EXISTS("FileExists"),
    ERRORS("Errors"),
    HAS_ANY_STRING_FORMAT_PARAMETER_MISMATCHES("HasAnyStringFormatParameterMismatches"),
    IS_INVARIANT("IsInvariant", HAS_ANY_STRING_FORMAT_PARAMETER_MISMATCHES),
    COMMENTS("Comments"),
    COMMENT("Comment", COMMENTS, IS_INVARIANT),
    VALUES("Values", FILE_EXISTS, ERRORS, HAS_ANY_STRING_FORMAT_PARAMETER_MISMATCHES),
    KEY("Key", VALUES, COMMENT);

    private final String propertyName;
    private final List<EntryProperty> dependents;

    EntryProperty(String propertyName, EntryProperty... dependents) {
        this.propertyName = propertyName;
        this.dependents = List.of(dependents);
    }

    /**
     * Name used in {@link java.beans.PropertyChangeEvent}s.
     */
    public String getPropertyName() {
        return propertyName;
    }

    public List<EntryProperty> getDependents() {
        return dependents;
    }

    /**
     * This property followed by all properties that transitively depend on it,
     * breadth first and without duplicates.
     */
    public List<EntryProperty> affected() {
        List<EntryProperty> result = new ArrayList<>();
        Set<EntryProperty> seen = EnumSet.noneOf(EntryProperty.class);
        Deque<EntryProperty> queue = new ArrayDeque<>();
        queue.add(this);
        while (!queue.isEmpty()) {
            EntryProperty property = queue.poll();
            if (seen.add(property)) {
                result.add(property);
                queue.addAll(property.dependents);
            }
        }
        return result;
    }
}
