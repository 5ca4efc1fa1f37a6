package io.rosterstore.core;

/**
 * Guards for bare addresses.
 *
 * <p>Addresses are opaque keys compared by exact string equality. Normalization belongs to the
 * caller; this only rejects values that could never be interned.
 */
public final class Addresses {

    private Addresses() {}

    /**
     * @throws RosterStoreException.IdentityResolutionFailure if the address is null, blank or carries a resource
     */
    public static String requireAddress(String address, String role) {
        if (address == null || address.isBlank()) {
            throw new RosterStoreException.IdentityResolutionFailure(role + " address must not be blank");
        }
        if (address.indexOf('/') >= 0) {
            throw new RosterStoreException.IdentityResolutionFailure(role + " address must be bare: " + address);
        }
        return address;
    }
}
