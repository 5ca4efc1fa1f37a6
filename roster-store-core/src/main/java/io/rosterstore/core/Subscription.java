package io.rosterstore.core;

/**
 * Subscription state of a roster item, stored as a bitmask.
 *
 * <p>The low bits carry the RFC 6121 relationship (to/from plus pending flags). Bit {@code 0x100}
 * marks a tombstone: the item was removed and is kept only until clients had a chance to see
 * the removal through roster versioning.
 */
public final class Subscription {

    public static final int TO = 0x01;
    public static final int FROM = 0x02;
    public static final int PENDING_OUT = 0x04;
    public static final int PENDING_IN = 0x08;
    public static final int TOMBSTONE = 0x100;

    private static final int STATE_MASK = 0xFF;

    public static final Subscription NONE = new Subscription(0);
    public static final Subscription BOTH = new Subscription(TO | FROM);

    private final int bitmask;

    private Subscription(int bitmask) {
        this.bitmask = bitmask;
    }

    public static Subscription fromBitmask(int bitmask) {
        if (bitmask < 0 || bitmask > (TOMBSTONE | STATE_MASK)) {
            throw new IllegalArgumentException("subscription bitmask out of range: " + bitmask);
        }
        if (bitmask == 0) return NONE;
        if (bitmask == (TO | FROM)) return BOTH;
        return new Subscription(bitmask);
    }

    public int bitmask() {
        return bitmask;
    }

    public boolean isTombstone() {
        return (bitmask & TOMBSTONE) != 0;
    }

    public Subscription asTombstone() {
        return isTombstone() ? this : fromBitmask(bitmask | TOMBSTONE);
    }

    /**
     * Same relationship bits without the tombstone flag.
     */
    public Subscription live() {
        return isTombstone() ? fromBitmask(bitmask & STATE_MASK) : this;
    }

    public boolean subscribedTo() {
        return (bitmask & TO) != 0;
    }

    public boolean subscribedFrom() {
        return (bitmask & FROM) != 0;
    }

    public boolean pendingOut() {
        return (bitmask & PENDING_OUT) != 0;
    }

    public boolean pendingIn() {
        return (bitmask & PENDING_IN) != 0;
    }

    /**
     * RFC 6121 {@code subscription} attribute value: none, to, from or both.
     */
    public String stateName() {
        if (subscribedTo() && subscribedFrom()) return "both";
        if (subscribedTo()) return "to";
        if (subscribedFrom()) return "from";
        return "none";
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) return true;
        if (!(other instanceof Subscription)) return false;
        return bitmask == ((Subscription) other).bitmask;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(bitmask);
    }

    @Override
    public String toString() {
        return stateName() + (isTombstone() ? "(removed)" : "") + "[" + bitmask + "]";
    }
}
