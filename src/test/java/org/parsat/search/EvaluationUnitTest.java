package org.parsat.search;

import org.parsat.errors.UndefinedVariableException;
import org.parsat.evaluation.Evaluator;
import org.parsat.formula.Expression;
import org.parsat.support.Assignment;
import org.parsat.support.AssignmentEnumerator;
import org.parsat.support.VariableSet;
import org.junit.Test;

import java.util.concurrent.Semaphore;

import static org.hamcrest.CoreMatchers.instanceOf;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.fail;

public class EvaluationUnitTest {
    private static final Expression a = Expression.identifier("a");

    private static SearchRun runOf(Expression formula, VariableSet variables) {
        AssignmentEnumerator enumerator = new AssignmentEnumerator(variables);
        return new SearchRun(formula, enumerator, new Evaluator(), new SearchStatistics(enumerator.size()));
    }

    @Test
    public void satisfyingUnitSettlesAndCancels() {
        SearchRun run = runOf(a, VariableSet.of("a"));
        EvaluationUnit unit = new EvaluationUnit(1, run, null);
        assertThat(unit.getState(), is(UnitState.PENDING));
        unit.run();
        assertThat(unit.getState(), is(UnitState.SUCCEEDED));
        assertThat(run.isSettled(), is(true));
        assertThat(run.isCancelled(), is(true));
        assertThat(run.getVerdict().witness().valueOf("a"), is(true));
    }

    @Test
    public void refutationAloneDoesNotSettle() {
        SearchRun run = runOf(a, VariableSet.of("a"));
        EvaluationUnit unit = new EvaluationUnit(0, run, null);
        unit.run();
        assertThat(unit.getState(), is(UnitState.REFUTED));
        assertThat(run.isSettled(), is(false));
        assertThat(run.getRefutedCount(), is(1L));
    }

    @Test
    public void lastRefutationSettlesAsExhausted() {
        SearchRun run = runOf(Expression.and(a, Expression.not(a)), VariableSet.of("a"));
        new EvaluationUnit(1, run, null).run();
        new EvaluationUnit(0, run, null).run();
        assertThat(run.isSettled(), is(true));
        assertThat(run.getVerdict().witness(), is(nullValue()));
        assertThat(run.getVerdict().failure(), is(nullValue()));
        assertThat(run.getStatistics().getRefuted(), is(2L));
    }

    @Test
    public void evaluationErrorSettlesAsFailure() {
        SearchRun run = runOf(Expression.identifier("d"), VariableSet.of("a"));
        EvaluationUnit unit = new EvaluationUnit(0, run, null);
        unit.run();
        assertThat(unit.getState(), is(UnitState.FAILED));
        assertThat(run.getVerdict().failure(), instanceOf(UndefinedVariableException.class));
        assertThat(run.getStatistics().getFailed(), is(1L));
    }

    @Test
    public void errorInEvaluationSettlesAsFailureAndIsRethrown() {
        AssignmentEnumerator enumerator = new AssignmentEnumerator(VariableSet.of("a"));
        Evaluator overflowing = new Evaluator() {
            @Override
            public boolean evaluate(Expression node, Assignment assignment) {
                throw new StackOverflowError();
            }
        };
        SearchRun run = new SearchRun(a, enumerator, overflowing, new SearchStatistics(enumerator.size()));
        Semaphore inFlight = new Semaphore(1);
        inFlight.acquireUninterruptibly();
        EvaluationUnit unit = new EvaluationUnit(0, run, inFlight);
        try {
            unit.run();
            fail("expected the error to be rethrown");
        } catch (StackOverflowError expected) {
            // reported first, then rethrown to the pool thread
        }
        assertThat(unit.getState(), is(UnitState.FAILED));
        assertThat(run.isSettled(), is(true));
        assertThat(run.isCancelled(), is(true));
        assertThat(run.getVerdict().failure(), instanceOf(StackOverflowError.class));
        assertThat(run.getStatistics().getFailed(), is(1L));
        assertThat(inFlight.availablePermits(), is(1));
    }

    @Test
    public void unitStartedAfterCancellationDoesNoWork() {
        SearchRun run = runOf(a, VariableSet.of("a"));
        run.cancel();
        EvaluationUnit unit = new EvaluationUnit(1, run, null);
        unit.run();
        assertThat(unit.getState(), is(UnitState.CANCELLED));
        assertThat(run.isSettled(), is(false));
        assertThat(run.getStatistics().getCancelled(), is(1L));
        assertThat(run.getStatistics().getEvaluated(), is(0L));
    }

    @Test
    public void firstVerdictWins() {
        SearchRun run = runOf(Expression.or(a, Expression.identifier("b")), VariableSet.of("a", "b"));
        new EvaluationUnit(3, run, null).run();
        new EvaluationUnit(1, run, null).run();
        assertThat(run.getVerdict().witness().valueOf("b"), is(true));
    }

    @Test
    public void inFlightPermitIsReturned() {
        Semaphore permits = new Semaphore(0);
        new EvaluationUnit(0, runOf(Expression.identifier("zz"), VariableSet.of("a")), permits).run();
        assertThat(permits.availablePermits(), is(1));
    }
}
