package io.rosterstore.spi;

import java.util.Objects;
import java.util.Optional;

/**
 * Stream feature hook advertising roster versioning (RFC 6121 section 2.6.1).
 *
 * <p>Offered only to authenticated client streams, and only when the store supports versions.
 */
public final class RosterVersioningFeature {

    public static final String NAMESPACE = "urn:xmpp:features:rosterver";
    public static final String FEATURE_ELEMENT = "<ver xmlns='" + NAMESPACE + "'/>";

    private final RosterStore store;

    public RosterVersioningFeature(RosterStore store) {
        this.store = Objects.requireNonNull(store, "store");
    }

    /**
     * @return the feature element to include in {@code <stream:features/>}, or empty to decline
     */
    public Optional<String> offer(SessionView session) {
        Objects.requireNonNull(session, "session");
        if (!store.supportsVersioning()) return Optional.empty();
        if (session.isServerToServer()) return Optional.empty();
        if (session.authenticatedAddress().isEmpty()) return Optional.empty();
        return Optional.of(FEATURE_ELEMENT);
    }
}
