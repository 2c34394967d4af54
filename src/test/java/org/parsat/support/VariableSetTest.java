package org.parsat.support;

import com.google.common.collect.ImmutableMap;
import org.parsat.formula.Expression;
import org.junit.Test;

import java.util.Arrays;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.Matchers.contains;
import static org.junit.Assert.assertThat;

public class VariableSetTest {

    @Test
    public void duplicatesKeepFirstOccurrence() {
        VariableSet v = VariableSet.of("b", "a", "b", " c ", "a");
        assertThat(v.asList(), contains("b", "a", "c"));
        assertThat(v.size(), is(3));
        assertThat(v.candidateCount(), is(8L));
        assertThat(v.contains("c"), is(true));
        assertThat(v.contains(" c "), is(false));
    }

    @Test
    public void fromExpressionFollowsFirstAppearance() {
        Expression e = Expression.and(Expression.identifier("y"),
                Expression.or(Expression.identifier("x"), Expression.not(Expression.identifier("y"))));
        assertThat(VariableSet.fromExpression(e).asList(), contains("y", "x"));
    }

    @Test
    public void largestAllowedSet() {
        VariableSet v = new VariableSet(IntStream.range(0, VariableSet.MAX_VARIABLES)
                .mapToObj(i -> "v" + i).collect(Collectors.toList()));
        assertThat(v.candidateCount(), is(1L << 62));
    }

    @Test(expected = IllegalArgumentException.class)
    public void tooManyVariablesAreRejected() {
        new VariableSet(IntStream.range(0, VariableSet.MAX_VARIABLES + 1)
                .mapToObj(i -> "v" + i).collect(Collectors.toList()));
    }

    @Test(expected = IllegalArgumentException.class)
    public void blankNameIsRejected() {
        new VariableSet(Arrays.asList("a", ""));
    }

    @Test
    public void assignmentLookups() {
        Assignment a = new Assignment(ImmutableMap.of("a", true, "b", false));
        assertThat(a.valueOf("a"), is(true));
        assertThat(a.valueOf("b"), is(false));
        assertThat(a.valueOf("z"), is(nullValue()));
        assertThat(a.toString(), is("{a=true, b=false}"));
    }

    @Test(expected = UnsupportedOperationException.class)
    public void assignmentIsImmutable() {
        new Assignment(ImmutableMap.of("a", true)).asMap().put("b", true);
    }
}
