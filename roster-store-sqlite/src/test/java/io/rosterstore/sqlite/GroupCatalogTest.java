package io.rosterstore.sqlite;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class GroupCatalogTest {

    @TempDir
    Path tempDir;

    private Database database;
    private final IdentityInterner identities = new IdentityInterner();
    private final GroupCatalog catalog = new GroupCatalog();
    private long owner;
    private long carol;

    @BeforeEach
    void setUp() {
        database = Database.open(tempDir.resolve("roster.sqlite"));
        SchemaBootstrap.install(database);
        owner = database.inTransaction("resolve", connection -> identities.resolve(connection, "u@x"));
        carol = database.inTransaction("resolve", connection -> identities.resolve(connection, "c@x"));
    }

    @AfterEach
    void tearDown() {
        database.close();
    }

    @Test
    void groupsAreScopedPerOwner() {
        long other = database.inTransaction("resolve", connection -> identities.resolve(connection, "v@x"));

        long mine = database.inTransaction("group", connection -> catalog.resolveGroup(connection, owner, "Friends"));
        long again = database.inTransaction("group", connection -> catalog.resolveGroup(connection, owner, "Friends"));
        long theirs = database.inTransaction("group", connection -> catalog.resolveGroup(connection, other, "Friends"));

        assertThat(again).isEqualTo(mine);
        assertThat(theirs).isNotEqualTo(mine);
    }

    @Test
    void losingGroupAllocationReturnsWinnersId() {
        long winner = database.inTransaction("group", connection -> catalog.resolveGroup(connection, owner, "Friends"));

        long loser = database.inTransaction("group", connection -> catalog.allocateGroup(connection, owner, "Friends"));

        assertThat(loser).isEqualTo(winner);
    }

    @Test
    void membershipIsASet() {
        long friends = database.inTransaction("group", connection -> catalog.resolveGroup(connection, owner, "Friends"));

        boolean added = database.inTransaction("add", connection -> catalog.addMember(connection, friends, carol));
        boolean addedAgain = database.inTransaction("add", connection -> catalog.addMember(connection, friends, carol));

        assertThat(added).isTrue();
        assertThat(addedAgain).isFalse();
    }

    @Test
    void membersOfIsOrderedByName() {
        database.execute("add", connection -> {
            for (String name : List.of("Work", "Family", "Friends")) {
                catalog.addMember(connection, catalog.resolveGroup(connection, owner, name), carol);
            }
        });

        List<GroupCatalog.Group> groups = database.inTransaction("members", connection -> catalog.membersOf(connection, owner, carol));

        assertThat(groups).extracting(GroupCatalog.Group::name).containsExactly("Family", "Friends", "Work");
        assertThat(database.<java.util.Map<Long, java.util.Set<String>>>inTransaction("by contact", connection -> catalog.groupsByContact(connection, owner)))
                .containsOnlyKeys(carol)
                .extractingByKey(carol)
                .isEqualTo(java.util.Set.of("Family", "Friends", "Work"));
    }

    @Test
    void collectEmptyDropsOnlyMemberlessGroups() {
        database.execute("setup", connection -> {
            long friends = catalog.resolveGroup(connection, owner, "Friends");
            long work = catalog.resolveGroup(connection, owner, "Work");
            catalog.addMember(connection, friends, carol);
            catalog.addMember(connection, work, carol);
            catalog.removeMember(connection, List.of(work), carol);
        });

        int collected = database.inTransaction("collect", connection -> catalog.collectEmpty(connection, owner));

        assertThat(collected).isEqualTo(1);
        assertThat(database.<List<GroupCatalog.Group>>inTransaction("members", connection -> catalog.membersOf(connection, owner, carol)))
                .extracting(GroupCatalog.Group::name)
                .containsExactly("Friends");
    }

    @Test
    void removeAllClearsOwnersGroups() {
        database.execute("setup", connection ->
                catalog.addMember(connection, catalog.resolveGroup(connection, owner, "Friends"), carol));

        int removed = database.inTransaction("remove all", connection -> catalog.removeAll(connection, owner));

        assertThat(removed).isEqualTo(1);
        assertThat(database.<List<GroupCatalog.Group>>inTransaction("members", connection -> catalog.membersOf(connection, owner, carol))).isEmpty();
    }
}
