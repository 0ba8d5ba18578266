package com.salesforce.dynamodbv2.mapper.tracking;

import static org.awaitility.Awaitility.await;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.amazonaws.services.dynamodbv2.model.AttributeValue;
import com.salesforce.dynamodbv2.mapper.condition.Condition;
import com.salesforce.dynamodbv2.mapper.condition.Conditions;
import com.salesforce.dynamodbv2.mapper.model.Action;
import com.salesforce.dynamodbv2.mapper.testsupport.User;
import com.salesforce.dynamodbv2.mapper.types.TypeEngine;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ChangeTrackerTest {

    private ChangeTracker sut;
    private User user;

    @BeforeEach
    void beforeEach() {
        sut = new ChangeTracker(new TypeEngine());
        user = new User("u1");
    }

    @Test
    void marksAccumulateInOrder() {
        sut.mark(user, User.EMAIL);
        sut.mark(user, User.AGE);
        sut.mark(user, User.EMAIL);
        assertThat(sut.getMarked(user), contains(User.EMAIL, User.AGE));
        assertTrue(sut.getMarked(new User("u2")).isEmpty());
    }

    @Test
    void collectedObjectsAreForgotten() {
        sut.mark(user, User.AGE);
        markUnreferencedUser();
        assertEquals(2, sut.trackedCount());

        await().pollInSameThread()
            .pollInterval(Duration.ofMillis(50))
            .atMost(Duration.ofSeconds(10))
            .until(() -> {
                System.gc();
                return sut.trackedCount() == 1;
            });

        assertThat(sut.getMarked(user), contains(User.AGE));
    }

    private void markUnreferencedUser() {
        User transientUser = new User("u2");
        sut.mark(transientUser, User.EMAIL);
        sut.setAction(transientUser, User.AGE, Action.add(1L));
    }

    @Test
    void actionsMarkTheirColumn() {
        sut.setAction(user, User.AGE, Action.add(1L));
        assertThat(sut.getMarked(user), contains(User.AGE));
        assertEquals(Map.of(User.AGE, Action.add(1L)), sut.getActions(user));
        sut.setAction(user, User.AGE, Action.add(2L));
        assertEquals(Action.add(2L), sut.getActions(user).get(User.AGE));
    }

    @Test
    void unsyncedSnapshotExpectsEveryColumnMissing() {
        Condition snapshot = sut.getSnapshot(user, User.SCHEMA);
        assertEquals(User.SCHEMA.getColumns().size(), snapshot.size());
        for (Condition condition : Conditions.iterConditions(snapshot)) {
            assertNull(condition.getValues().get(0));
        }
        // cached until synced
        assertSame(snapshot, sut.getSnapshot(user, User.SCHEMA));
    }

    @Test
    void syncSnapshotsMarkedNonKeyColumns() {
        user.setAge(30L);
        user.setEmail("a@b.c");
        sut.mark(user, User.ID);
        sut.mark(user, User.AGE);
        sut.mark(user, User.NAME);
        sut.setAction(user, User.EMAIL, Action.set("a@b.c"));

        Condition snapshot = sut.sync(user, User.SCHEMA);

        assertEquals(User.AGE.eq(new AttributeValue().withN("30")).setDumped(true)
                .and(User.EMAIL.eq(new AttributeValue().withS("a@b.c")).setDumped(true))
                .and(User.NAME.eq(null).setDumped(true)),
            snapshot);
        assertSame(snapshot, sut.getSnapshot(user, User.SCHEMA));
        assertTrue(sut.getActions(user).isEmpty());
        // marks survive a sync
        assertEquals(4, sut.getMarked(user).size());
    }

    @Test
    void snapshotDoesNotFollowLaterChanges() {
        user.setAge(30L);
        sut.mark(user, User.AGE);
        Condition snapshot = sut.sync(user, User.SCHEMA);
        user.setAge(31L);
        Condition age = (Condition) snapshot.getValues().get(0);
        assertEquals(new AttributeValue().withN("30"), age.getValues().get(0));
    }

    @Test
    void clearForgetsEverything() {
        sut.mark(user, User.AGE);
        sut.sync(user, User.SCHEMA);
        sut.clear(user);
        assertTrue(sut.getMarked(user).isEmpty());
        assertNull(sut.peekSnapshot(user));
    }

    @Test
    void objectsAreTrackedByIdentity() {
        User other = new User("u1");
        sut.mark(user, User.AGE);
        assertTrue(sut.getMarked(other).isEmpty());
    }

}
