package org.parsat.search;

import org.parsat.evaluation.Evaluator;
import org.parsat.formula.Expression;
import org.parsat.support.Assignment;
import org.parsat.support.AssignmentEnumerator;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Logger;

/**
 * Stato condiviso di una singola ricerca tra coordinatore e unità di valutazione.
 *
 * Unico stato mutabile condiviso: il verdetto (slot a scrittura singola), il contatore
 * degli assegnamenti confutati e il flag di cancellazione, tutti atomici. L'albero
 * della formula è di sola lettura.
 *
 * Il primo evento terminale fissa il verdetto:
 * • un'unità soddisfatta -> SAT con il suo assegnamento
 * • un'unità fallita -> errore per l'intera ricerca
 * • l'ultimo dei 2^n assegnamenti confutato -> UNSAT
 */
class SearchRun {

    private static final Logger LOGGER = Logger.getLogger(SearchRun.class.getName());

    private final Expression formula;
    private final AssignmentEnumerator enumerator;
    private final Evaluator evaluator;
    private final SearchStatistics statistics;

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final AtomicLong refuted = new AtomicLong(0);
    private final AtomicReference<Verdict> verdict = new AtomicReference<>();
    private final CountDownLatch verdictReached = new CountDownLatch(1);

    SearchRun(Expression formula, AssignmentEnumerator enumerator, Evaluator evaluator, SearchStatistics statistics) {
        this.formula = formula;
        this.enumerator = enumerator;
        this.evaluator = evaluator;
        this.statistics = statistics;
    }

    Expression getFormula() {
        return formula;
    }

    AssignmentEnumerator getEnumerator() {
        return enumerator;
    }

    Evaluator getEvaluator() {
        return evaluator;
    }

    SearchStatistics getStatistics() {
        return statistics;
    }

    //region CANCELLAZIONE

    boolean isCancelled() {
        return cancelled.get();
    }

    void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            LOGGER.fine("Cancellazione propagata alle unità in corso");
        }
    }

    //endregion

    //region SEGNALAZIONE ESITI DALLE UNITÀ

    void reportSatisfied(long index, Assignment witness) {
        statistics.recordSatisfied();
        if (settle(Verdict.satisfied(witness))) {
            LOGGER.fine("Unità " + index + " soddisfa la formula: " + witness);
        }
    }

    void reportRefuted(long index) {
        statistics.recordRefuted();
        if (refuted.incrementAndGet() == enumerator.size() && settle(Verdict.exhausted())) {
            LOGGER.fine("Tutti i " + enumerator.size() + " assegnamenti confutati");
        }
    }

    void reportFailure(long index, Throwable failure) {
        statistics.recordFailed();
        if (settle(Verdict.failed(failure))) {
            LOGGER.fine("Unità " + index + " fallita: " + failure.getMessage());
        }
    }

    void reportCancelled(long index) {
        statistics.recordCancelled();
        LOGGER.finest("Unità " + index + " cancellata prima della valutazione");
    }

    /**
     * Fissa il verdetto se nessun altro evento terminale è già avvenuto.
     *
     * @return true se questo evento ha fissato il verdetto
     */
    private boolean settle(Verdict candidate) {
        if (!verdict.compareAndSet(null, candidate)) {
            return false;
        }
        cancel();
        verdictReached.countDown();
        return true;
    }

    //endregion

    //region ATTESA DEL VERDETTO

    boolean isSettled() {
        return verdict.get() != null;
    }

    void awaitVerdict() throws InterruptedException {
        verdictReached.await();
    }

    /**
     * @return true se il verdetto è stato raggiunto entro il tempo indicato
     */
    boolean awaitVerdict(long timeout, TimeUnit unit) throws InterruptedException {
        return verdictReached.await(timeout, unit);
    }

    Verdict getVerdict() {
        return verdict.get();
    }

    long getRefutedCount() {
        return refuted.get();
    }

    //endregion

    /**
     * Esito terminale: testimone, errore, oppure nessuno dei due (spazio esaurito).
     */
    record Verdict(Assignment witness, Throwable failure) {

        static Verdict satisfied(Assignment witness) {
            return new Verdict(witness, null);
        }

        static Verdict failed(Throwable failure) {
            return new Verdict(null, failure);
        }

        static Verdict exhausted() {
            return new Verdict(null, null);
        }
    }
}
