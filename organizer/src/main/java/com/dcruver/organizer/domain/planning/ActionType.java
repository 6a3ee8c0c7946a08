package com.dcruver.organizer.domain.planning;

import java.nio.file.Path;
import java.util.Objects;

public enum ActionType {
    /**
     * Same name, different folder
     */
    MOVE,

    /**
     * Same folder, different name
     */
    RENAME,

    MOVE_RENAME,

    /**
     * Left where it is
     */
    SKIP;

    public static ActionType between(Path from, Path to) {
        if (from.equals(to)) {
            return SKIP;
        }
        boolean sameDir = Objects.equals(from.getParent(), to.getParent());
        boolean sameName = Objects.equals(from.getFileName(), to.getFileName());
        if (sameDir) {
            return RENAME;
        }
        return sameName ? MOVE : MOVE_RENAME;
    }
}
