package org.parsat.search;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.parsat.errors.FormulaException;
import org.parsat.errors.FormulaParseException;
import org.parsat.errors.SearchTimeoutException;
import org.parsat.errors.UndefinedVariableException;
import org.parsat.errors.UnsupportedOperatorException;
import org.parsat.evaluation.Evaluator;
import org.parsat.formula.Expression;
import org.parsat.formula.FormulaParser;
import org.parsat.support.Assignment;
import org.parsat.support.AssignmentEnumerator;
import org.parsat.support.VariableSet;
import org.junit.Test;

import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.hamcrest.CoreMatchers.either;
import static org.hamcrest.CoreMatchers.instanceOf;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.Matchers.lessThan;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.fail;

public class SearchCoordinatorTest {
    private static final VariableSet abc = VariableSet.of("a", "b", "c");
    private final SearchCoordinator coordinator = new SearchCoordinator(new SearchConfiguration(4, 16, 0));
    private final FormulaParser parser = new FormulaParser();
    private final Evaluator evaluator = new Evaluator();

    private static VariableSet variables(int n) {
        return new VariableSet(IntStream.range(0, n).mapToObj(i -> "x" + i).collect(Collectors.toList()));
    }

    private void assertWitnessSatisfies(String formula, SearchResult result) throws FormulaException {
        assertThat(result.isSatisfiable(), is(true));
        assertThat(evaluator.evaluate(parser.parse(formula), result.getAssignment()), is(true));
    }

    @Test
    public void contradictionIsUnsatisfiable() throws Exception {
        SearchResult r = coordinator.search("a && !a", VariableSet.of("a"));
        assertThat(r.isUnsatisfiable(), is(true));
        assertThat(r.getAssignment(), is(nullValue()));
    }

    @Test
    public void tautologyIsSatisfiedByEitherValue() throws Exception {
        SearchResult r = coordinator.search("a || !a", VariableSet.of("a"));
        assertThat(r.isSatisfiable(), is(true));
        assertThat(r.getAssignment(), either(is(new Assignment(ImmutableMap.of("a", true))))
                .or(is(new Assignment(ImmutableMap.of("a", false)))));
    }

    @Test
    public void mixedFormulaIsSatisfied() throws Exception {
        assertWitnessSatisfies("a && b || !c", coordinator.search("a && b || !c", abc));
    }

    @Test
    public void witnessCoversWholeVariableSet() throws Exception {
        // variables not used by the formula still appear in the witness
        SearchResult r = coordinator.search("a && a", abc);
        assertWitnessSatisfies("a && a", r);
        assertThat(r.getAssignment().size(), is(3));
        assertThat(r.getAssignment().valueOf("a"), is(true));
    }

    @Test
    public void uniqueWitnessIsFound() throws Exception {
        SearchResult r = coordinator.search("a && !b && c", abc);
        assertThat(r.getAssignment(), is(new Assignment(ImmutableMap.of("a", true, "b", false, "c", true))));
    }

    @Test
    public void unsatisfiableOnlyAfterEveryCandidate() throws Exception {
        SearchResult r = coordinator.search("(x0 || x1) && !x0 && !x1", variables(8));
        assertThat(r.isUnsatisfiable(), is(true));
        SearchStatistics stats = r.getStatistics();
        assertThat(stats.getCandidates(), is(256L));
        assertThat(stats.getRefuted(), is(256L));
        assertThat(stats.getEvaluated(), is(256L));
        assertThat(stats.getCancelled(), is(0L));
        assertThat(stats.isTimerStopped(), is(true));
    }

    @Test
    public void sequentialConfigurationGivesSameVerdicts() throws Exception {
        SearchCoordinator sequential = new SearchCoordinator(new SearchConfiguration(1, 1, 0));
        assertThat(sequential.search("a && !a", VariableSet.of("a")).isUnsatisfiable(), is(true));
        assertWitnessSatisfies("a && !b", sequential.search("a && !b", abc));
    }

    @Test
    public void verdictAgreesWithExhaustiveCheck() throws Exception {
        List<String> formulas = ImmutableList.of(
                "a && !a", "a || !a", "a && b || !c", "a && !b", "a && a",
                "(a || b) && (!a || c) && (!b || !c) && (!c || a)",
                "!(a || b || c)", "(a && !a) || (b && !b)", "((a))", "!(a && b) && a && b");
        for (String formula : formulas) {
            Expression tree = parser.parse(formula);
            boolean expected = false;
            for (Assignment x : new AssignmentEnumerator(abc)) expected |= evaluator.evaluate(tree, x);
            SearchResult r = coordinator.search(tree, abc);
            assertThat(formula, r.isSatisfiable(), is(expected));
            if (expected) assertThat(formula, evaluator.evaluate(tree, r.getAssignment()), is(true));
        }
    }

    @Test
    public void searchesOverFormulaVariables() throws Exception {
        SearchResult r = coordinator.search(parser.parse("p && !q"));
        assertThat(r.getAssignment(), is(new Assignment(ImmutableMap.of("p", true, "q", false))));
    }

    @Test
    public void undeclaredVariableAbortsSearch() throws Exception {
        try {
            coordinator.search("a && b || d", abc);
            fail("expected an undefined variable");
        } catch (UndefinedVariableException e) {
            assertThat(e.getVariableName(), is("d"));
        }
    }

    @Test
    public void undeclaredVariableAbortsEvenIfSatisfiableOtherwise() throws Exception {
        try {
            coordinator.search(parser.parse("a || d"), VariableSet.of("a"));
            fail("expected an undefined variable");
        } catch (UndefinedVariableException e) {
            assertThat(e.getVariableName(), is("d"));
        }
    }

    @Test(timeout = 30000)
    public void stackOverflowInUnitFailsSearchInsteadOfHanging() throws Exception {
        Expression deep = Expression.identifier("a");
        for (int i = 0; i < 500_000; i++) {
            deep = Expression.not(deep);
        }
        SearchCoordinator sequential = new SearchCoordinator(new SearchConfiguration(1, 4, 0));
        try {
            sequential.search(deep, VariableSet.of("a"));
            fail("expected the overflow to abort the search");
        } catch (IllegalStateException e) {
            assertThat(e.getCause(), instanceOf(StackOverflowError.class));
        }
    }

    @Test(expected = UnsupportedOperatorException.class)
    public void unsupportedOperatorIsReported() throws Exception {
        coordinator.search("a + b", abc);
    }

    @Test(expected = FormulaParseException.class)
    public void malformedTextIsReported() throws Exception {
        coordinator.search("a && || b", abc);
    }

    @Test(timeout = 20000)
    public void firstSuccessStopsRemainingWork() throws Exception {
        SearchResult r = coordinator.search("x0 || x1", variables(24));
        assertWitnessSatisfies("x0 || x1", r);
        assertThat(r.getStatistics().getEvaluated(), lessThan(r.getStatistics().getCandidates()));
    }

    @Test(timeout = 20000, expected = SearchTimeoutException.class)
    public void timeoutAbortsLongSearch() throws Exception {
        SearchCoordinator limited = new SearchCoordinator(new SearchConfiguration(2, 8, 1));
        limited.search("x0 && !x0", variables(40));
    }

    @Test(timeout = 20000)
    public void interruptionCancelsSearch() throws Exception {
        AtomicReference<Throwable> thrown = new AtomicReference<>();
        Thread caller = new Thread(() -> {
            try {
                coordinator.search("x0 && !x0", variables(40));
            } catch (Throwable t) {
                thrown.set(t);
            }
        });
        caller.start();
        Thread.sleep(200);
        caller.interrupt();
        caller.join();
        assertThat(thrown.get(), instanceOf(InterruptedException.class));
    }

    @Test
    public void coordinatorIsReusable() throws Exception {
        for (int i = 0; i < 20; ++i) {
            assertThat(coordinator.search("a && !a", VariableSet.of("a")).isUnsatisfiable(), is(true));
            assertThat(coordinator.search("a || !a", VariableSet.of("a")).isSatisfiable(), is(true));
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void missingFormulaIsRejected() throws Exception {
        coordinator.search((Expression) null, abc);
    }
}
