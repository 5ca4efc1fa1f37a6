package io.rosterstore.core;

import java.util.List;

/**
 * Human-readable operation descriptors written to the journal.
 *
 * <p>Shared by every engine so audit output reads the same regardless of backing store.
 */
public final class JournalOperations {

    private static final String NULL_NAME = "<NULL>";

    private JournalOperations() {}

    public static String insert(String name, int subscription) {
        return "INSERT " + nameOrNull(name) + ", " + subscription;
    }

    /**
     * Captures the values the update replaces.
     */
    public static String update(String priorName, int priorSubscription) {
        return "UPDATE " + nameOrNull(priorName) + " " + priorSubscription;
    }

    public static String delete(String name, int subscription) {
        return "DELETE " + nameOrNull(name) + " " + subscription;
    }

    public static String groupAdd(String group) {
        return "GRPADD " + group;
    }

    public static String groupDelete(String group) {
        return "GRPDEL " + group;
    }

    /**
     * One journal row per operation: the item descriptor followed by the group changes it carried.
     */
    public static String combine(String itemOp, List<String> groupOps) {
        if (groupOps.isEmpty()) {
            return itemOp;
        }
        return itemOp + "; " + String.join("; ", groupOps);
    }

    private static String nameOrNull(String name) {
        return name == null ? NULL_NAME : name;
    }
}
