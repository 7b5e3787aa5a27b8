package com.questrail.dispatch.conflict;

import com.questrail.dispatch.model.Section;
import com.questrail.dispatch.model.Train;

import java.util.Objects;
import java.util.Optional;

/**
 * Conflict on the identical section only.
 * <p>
 * Two trains conflict when both hold a section and it is the same section.
 * Adjacent sections never conflict.
 */
public enum SameSectionConflictDetector implements ConflictDetector {
    INSTANCE;

    @Override
    public boolean competesForResource(Train a, Train b) {
        Objects.requireNonNull(a, "a");
        Objects.requireNonNull(b, "b");
        if (a.equals(b)) {
            return false;
        }

        Optional<Section> sa = a.currentSection();
        Optional<Section> sb = b.currentSection();
        if (sa.isEmpty() || sb.isEmpty()) {
            return false;
        }
        return sa.get().id().equals(sb.get().id());
    }
}
