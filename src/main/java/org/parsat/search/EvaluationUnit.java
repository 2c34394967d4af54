package org.parsat.search;

import org.parsat.errors.EvaluationException;
import org.parsat.support.Assignment;

import java.util.concurrent.Semaphore;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * UNITÀ DI VALUTAZIONE - Valuta la formula su un singolo assegnamento candidato
 *
 * L'unità costruisce da sé il proprio assegnamento a partire dall'indice e ne è
 * l'unica proprietaria; l'unico stato condiviso che tocca è la segnalazione
 * dell'esito a {@link SearchRun}. Prima di valutare controlla la cancellazione:
 * se la ricerca è già conclusa rinuncia senza lavoro.
 *
 * ESITI DI ERRORE:
 * • EvaluationException: segnalata come fallimento, il thread del pool prosegue
 * • RuntimeException inattesa: registrata a SEVERE e segnalata come fallimento
 * • Error (es. StackOverflowError su alberi molto profondi): segnalato come
 *   fallimento e poi rilanciato, così la ricerca termina comunque con un verdetto
 */
class EvaluationUnit implements Runnable {

    private static final Logger LOGGER = Logger.getLogger(EvaluationUnit.class.getName());

    private final long index;
    private final SearchRun run;

    /** Permesso di volo da restituire a fine esecuzione, null se non limitato */
    private final Semaphore inFlight;

    private volatile UnitState state = UnitState.PENDING;

    EvaluationUnit(long index, SearchRun run, Semaphore inFlight) {
        this.index = index;
        this.run = run;
        this.inFlight = inFlight;
    }

    @Override
    public void run() {
        try {
            if (run.isCancelled()) {
                state = UnitState.CANCELLED;
                run.reportCancelled(index);
                return;
            }

            state = UnitState.RUNNING;
            Assignment candidate = run.getEnumerator().assignmentAt(index);
            boolean satisfied = run.getEvaluator().evaluate(run.getFormula(), candidate);

            if (satisfied) {
                state = UnitState.SUCCEEDED;
                run.reportSatisfied(index, candidate);
            } else {
                state = UnitState.REFUTED;
                run.reportRefuted(index);
            }
        } catch (EvaluationException e) {
            state = UnitState.FAILED;
            run.reportFailure(index, e);
        } catch (RuntimeException e) {
            state = UnitState.FAILED;
            LOGGER.log(Level.SEVERE, "Errore inatteso nell'unità " + index, e);
            run.reportFailure(index, e);
        } catch (Error e) {
            // il verdetto va fissato prima che l'errore termini il thread del pool
            state = UnitState.FAILED;
            LOGGER.log(Level.SEVERE, "Errore fatale nell'unità " + index, e);
            run.reportFailure(index, e);
            throw e;
        } finally {
            if (inFlight != null) {
                inFlight.release();
            }
        }
    }

    UnitState getState() {
        return state;
    }
}
