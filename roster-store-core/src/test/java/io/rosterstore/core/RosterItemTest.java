package io.rosterstore.core;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RosterItemTest {

    @Test
    void groupsAreCopiedAndImmutable() {
        List<String> groups = new java.util.ArrayList<>(List.of("Friends", "Work"));
        RosterItem item = new RosterItem("c@x", "Carol", Subscription.NONE, groups, 0L);
        groups.add("Family");

        assertThat(item.groups()).containsExactly("Friends", "Work");
        assertThatThrownBy(() -> item.groups().add("Other")).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void removedFollowsTombstoneFlag() {
        RosterItem item = RosterItem.of("c@x", null, Subscription.BOTH);
        assertThat(item.isRemoved()).isFalse();
        assertThat(item.withSubscription(Subscription.BOTH.asTombstone()).isRemoved()).isTrue();
    }

    @Test
    void rejectsBlankOrFullAddresses() {
        assertThatThrownBy(() -> RosterItem.of(" ", null, Subscription.NONE))
                .isInstanceOf(RosterStoreException.IdentityResolutionFailure.class);
        assertThatThrownBy(() -> RosterItem.of("c@x/phone", null, Subscription.NONE))
                .isInstanceOf(RosterStoreException.IdentityResolutionFailure.class);
    }

    @Test
    void journalDescriptorsSpellOutNullNames() {
        assertThat(JournalOperations.insert(null, 3)).isEqualTo("INSERT <NULL>, 3");
        assertThat(JournalOperations.update("Carol", 1)).isEqualTo("UPDATE Carol 1");
        assertThat(JournalOperations.groupAdd("Work")).isEqualTo("GRPADD Work");
    }

    @Test
    void factoryKeepsGroupOrderAndDropsDuplicates() {
        RosterItem item = RosterItem.of("c@x", "Carol", Subscription.NONE, "Work", "Friends", "Work");

        assertThat(item.groups()).containsExactly("Work", "Friends");
        assertThat(item.version()).isZero();
    }

    @Test
    void combinedDescriptorListsGroupChangesAfterItemChange() {
        assertThat(JournalOperations.combine(JournalOperations.delete("Carol", 3), List.of()))
                .isEqualTo("DELETE Carol 3");
        assertThat(JournalOperations.combine(JournalOperations.insert("Carol", 0),
                List.of(JournalOperations.groupAdd("Friends"), JournalOperations.groupDelete("Work"))))
                .isEqualTo("INSERT Carol, 0; GRPADD Friends; GRPDEL Work");
    }
}
