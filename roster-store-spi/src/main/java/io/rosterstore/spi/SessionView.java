package io.rosterstore.spi;

import java.util.Optional;

/**
 * What the feature hook needs to know about a stream being negotiated.
 */
public interface SessionView {

    /**
     * True for server-to-server streams.
     */
    boolean isServerToServer();

    /**
     * Bare address the stream authenticated as, if SASL has completed.
     */
    Optional<String> authenticatedAddress();
}
