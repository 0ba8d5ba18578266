package com.salesforce.dynamodbv2.mapper.condition;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.junit.jupiter.api.Assertions.assertEquals;

import com.salesforce.dynamodbv2.mapper.testsupport.User;
import java.util.List;
import org.junit.jupiter.api.Test;

class ConditionsTest {

    private final Condition a = User.AGE.eq(3L);
    private final Condition b = User.EMAIL.eq(User.NAME);
    private final Condition c = User.SCORES.get("x").isNull();

    @Test
    void iterConditionsOfLeaf() {
        assertEquals(List.of(a), Conditions.iterConditions(a));
    }

    @Test
    void iterConditionsSkipsMetaRoot() {
        Condition not = b.not();
        Condition root = a.and(not).and(c);
        assertThat(Conditions.iterConditions(root), contains(a, not, b, c));
    }

    @Test
    void iterConditionsOfEmpty() {
        assertThat(Conditions.iterConditions(new AndCondition()), empty());
    }

    @Test
    void iterConditionsVisitsSharedNodesOnce() {
        OrCondition or = new OrCondition(a, b);
        AndCondition root = new AndCondition(or, new NotCondition(or));
        assertEquals(4, Conditions.iterConditions(root).size());
    }

    @Test
    void iterConditionsYieldsCyclicRootOnce() {
        AndCondition root = new AndCondition(a);
        NotCondition not = new NotCondition(root);
        root.getValues().add(not);
        List<Condition> conditions = Conditions.iterConditions(root);
        assertThat(conditions, contains(a, not, root));
        assertEquals(2, root.size());
    }

    @Test
    void iterColumnsIncludesValuePaths() {
        Condition root = a.and(b).and(c);
        assertThat(Conditions.iterColumns(root), contains(User.AGE, User.EMAIL, User.NAME, User.SCORES));
    }

    @Test
    void printableName() {
        assertEquals("scores.x[2]", Conditions.printableName(User.SCORES.get("x").get(2)));
        assertEquals("name", Conditions.printableName(User.NAME));
    }

}
