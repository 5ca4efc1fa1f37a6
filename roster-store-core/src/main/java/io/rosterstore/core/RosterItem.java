package io.rosterstore.core;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * One entry of a user's roster.
 *
 * <p>Used both as the desired state handed to the store and as the committed state read back.
 * {@code version} is assigned by the store; callers building a desired item pass {@code 0}.
 */
public final class RosterItem {

    private final String contact;
    private final String name;
    private final Subscription subscription;
    private final Set<String> groups;
    private final long version;

    public RosterItem(String contact, String name, Subscription subscription, Collection<String> groups, long version) {
        this.contact = Addresses.requireAddress(contact, "contact");
        this.name = name;
        this.subscription = Objects.requireNonNull(subscription, "subscription");
        this.groups = Collections.unmodifiableSet(new LinkedHashSet<>(Objects.requireNonNull(groups, "groups")));
        if (version < 0) throw new IllegalArgumentException("version must be non-negative");
        this.version = version;
    }

    public static RosterItem of(String contact, String name, Subscription subscription, String... groups) {
        return new RosterItem(contact, name, subscription, Arrays.asList(groups), 0L);
    }

    public String contact() {
        return contact;
    }

    /**
     * Display name, or {@code null} when the user never named the contact.
     */
    public String name() {
        return name;
    }

    public Subscription subscription() {
        return subscription;
    }

    public Set<String> groups() {
        return groups;
    }

    public long version() {
        return version;
    }

    public boolean isRemoved() {
        return subscription.isTombstone();
    }

    public RosterItem withSubscription(Subscription newSubscription) {
        return new RosterItem(contact, name, newSubscription, groups, version);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) return true;
        if (!(other instanceof RosterItem)) return false;
        RosterItem that = (RosterItem) other;
        return version == that.version
                && contact.equals(that.contact)
                && Objects.equals(name, that.name)
                && subscription.equals(that.subscription)
                && groups.equals(that.groups);
    }

    @Override
    public int hashCode() {
        return Objects.hash(contact, name, subscription, groups, version);
    }

    @Override
    public String toString() {
        return "RosterItem{" + contact + ", name=" + name + ", " + subscription + ", groups=" + groups + ", ver=" + version + "}";
    }
}
