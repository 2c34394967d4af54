package org.parsat.search;

import org.parsat.errors.EvaluationException;
import org.parsat.errors.FormulaException;
import org.parsat.errors.SearchTimeoutException;
import org.parsat.evaluation.Evaluator;
import org.parsat.formula.Expression;
import org.parsat.formula.FormulaParser;
import org.parsat.support.AssignmentEnumerator;
import org.parsat.support.VariableSet;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * COORDINATORE RICERCA - Ricerca di soddisfacibilità per forza bruta parallela
 *
 * FLUSSO:
 * 1. Enumerazione dei 2^n assegnamenti sull'insieme di variabili
 * 2. Una unità di valutazione per assegnamento, eseguita su un pool di thread
 * 3. Il primo assegnamento soddisfacente chiude la ricerca (SAT) e cancella le unità restanti
 * 4. UNSAT solo dopo che tutti i 2^n assegnamenti sono stati confutati
 * 5. Un errore di valutazione in qualunque unità interrompe la ricerca con quell'errore
 *
 * RISORSE:
 * Le unità in volo sono limitate da un semaforo ({@link SearchConfiguration#getMaxInFlight()}),
 * quindi la memoria resta costante anche con molte variabili. La cancellazione è
 * cooperativa: le unità già in valutazione terminano, ma il coordinatore non le aspetta.
 *
 * COMPONENTI:
 * • {@link SearchRun}: verdetto, contatori e cancellazione condivisi da una ricerca
 * • {@link EvaluationUnit}: valutazione di un singolo assegnamento candidato
 * • {@link SearchConfiguration}: parallelismo, unità in volo e timeout
 *
 * Ogni ricerca usa un pool dedicato, chiuso al termine: il coordinatore è riutilizzabile
 * e può servire ricerche concorrenti.
 */
public class SearchCoordinator {

    private static final Logger LOGGER = Logger.getLogger(SearchCoordinator.class.getName());

    private static final AtomicInteger SEARCH_COUNTER = new AtomicInteger();

    private final SearchConfiguration configuration;
    private final Evaluator evaluator;
    private final FormulaParser parser;

    public SearchCoordinator() {
        this(SearchConfiguration.defaults());
    }

    public SearchCoordinator(SearchConfiguration configuration) {
        if (configuration == null) {
            throw new IllegalArgumentException("Configurazione non può essere null");
        }
        this.configuration = configuration;
        this.evaluator = new Evaluator();
        this.parser = new FormulaParser();
    }

    public SearchConfiguration getConfiguration() {
        return configuration;
    }

    //region PUNTI DI INGRESSO

    /**
     * Cerca un assegnamento che soddisfi la formula.
     *
     * @param formula albero della formula, condiviso in sola lettura tra le unità
     * @param variables variabili su cui spazia la ricerca, in ordine fisso
     * @return SAT con testimone, oppure UNSAT dopo la copertura completa
     * @throws EvaluationException se la formula riferisce variabili fuori dall'insieme o contiene nodi non supportati
     * @throws SearchTimeoutException se il timeout configurato scade prima del verdetto
     * @throws InterruptedException se il thread chiamante viene interrotto durante l'attesa
     */
    public SearchResult search(Expression formula, VariableSet variables)
            throws EvaluationException, SearchTimeoutException, InterruptedException {
        if (formula == null) {
            throw new IllegalArgumentException("Formula non può essere null");
        }
        if (variables == null) {
            throw new IllegalArgumentException("Insieme variabili non può essere null");
        }

        AssignmentEnumerator enumerator = new AssignmentEnumerator(variables);
        SearchStatistics statistics = new SearchStatistics(enumerator.size());
        SearchRun run = new SearchRun(formula, enumerator, evaluator, statistics);

        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine("Ricerca su " + formula + " con variabili " + variables
                    + " (" + enumerator.size() + " candidati)");
        }

        try {
            executeUnits(run);
            return resolveVerdict(run);
        } finally {
            statistics.stopTimer();
        }
    }

    /**
     * Ricerca sulle sole variabili che compaiono nella formula.
     */
    public SearchResult search(Expression formula)
            throws EvaluationException, SearchTimeoutException, InterruptedException {
        return search(formula, VariableSet.fromExpression(formula));
    }

    /**
     * Analizza il testo della formula e avvia la ricerca.
     *
     * @throws FormulaException per errori di parsing, costruzione, valutazione o timeout
     * @throws InterruptedException se il thread chiamante viene interrotto durante l'attesa
     */
    public SearchResult search(String formulaText, VariableSet variables) throws FormulaException, InterruptedException {
        return search(parser.parse(formulaText), variables);
    }

    //endregion

    //region ESECUZIONE UNITÀ

    /**
     * Sottomette le unità al pool finché serve e attende il verdetto.
     *
     * Il ciclo di sottomissione si ferma appena il verdetto è fissato; in ogni caso,
     * all'uscita, la ricerca viene cancellata e il pool chiuso senza attendere le
     * unità ancora in valutazione.
     */
    private void executeUnits(SearchRun run) throws SearchTimeoutException, InterruptedException {
        long deadline = configuration.hasTimeout()
                ? System.nanoTime() + TimeUnit.SECONDS.toNanos(configuration.getTimeoutSeconds())
                : 0L;

        ExecutorService executor = Executors.newFixedThreadPool(
                configuration.getParallelism(), new UnitThreadFactory(SEARCH_COUNTER.incrementAndGet()));
        Semaphore inFlight = new Semaphore(configuration.getMaxInFlight());

        try {
            long candidates = run.getEnumerator().size();
            for (long index = 0; index < candidates && !run.isSettled(); index++) {
                if (!acquire(inFlight, deadline)) {
                    throw timeout(run);
                }
                executor.execute(new EvaluationUnit(index, run, inFlight));
            }

            if (!awaitVerdict(run, deadline)) {
                throw timeout(run);
            }
        } finally {
            run.cancel();
            executor.shutdownNow();
        }
    }

    private boolean acquire(Semaphore inFlight, long deadline) throws InterruptedException {
        if (deadline == 0L) {
            inFlight.acquire();
            return true;
        }
        long remaining = deadline - System.nanoTime();
        // con permessi sempre disponibili tryAcquire non scadrebbe mai
        return remaining > 0L && inFlight.tryAcquire(remaining, TimeUnit.NANOSECONDS);
    }

    private boolean awaitVerdict(SearchRun run, long deadline) throws InterruptedException {
        if (deadline == 0L) {
            run.awaitVerdict();
            return true;
        }
        return run.awaitVerdict(Math.max(0L, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
    }

    private SearchTimeoutException timeout(SearchRun run) {
        LOGGER.warning("Timeout di " + configuration.getTimeoutSeconds() + " secondi raggiunto dopo "
                + run.getRefutedCount() + " assegnamenti confutati su " + run.getEnumerator().size());
        return new SearchTimeoutException(configuration.getTimeoutSeconds());
    }

    //endregion

    //region VERDETTO

    /**
     * Traduce il verdetto in risultato. I messaggi non includono la formula:
     * renderla è ricorsivo quanto valutarla.
     */
    private SearchResult resolveVerdict(SearchRun run) throws EvaluationException {
        SearchRun.Verdict verdict = run.getVerdict();
        SearchStatistics statistics = run.getStatistics();

        if (verdict.failure() != null) {
            Throwable failure = verdict.failure();
            if (failure instanceof EvaluationException) {
                LOGGER.info("Ricerca interrotta per errore di valutazione: " + failure.getMessage());
                throw (EvaluationException) failure;
            }
            LOGGER.warning("Ricerca interrotta per errore inatteso: " + failure);
            throw new IllegalStateException("Errore inatteso durante la ricerca su "
                    + run.getEnumerator().size() + " assegnamenti", failure);
        }

        if (verdict.witness() != null) {
            LOGGER.info("Formula SAT, soddisfatta da " + verdict.witness());
            return SearchResult.satisfied(verdict.witness(), statistics);
        }

        LOGGER.info("Formula UNSAT (" + statistics.getRefuted() + " assegnamenti confutati)");
        return SearchResult.unsatisfiable(statistics);
    }

    //endregion

    /**
     * Thread daemon con nome riconoscibile: le unità ancora in valutazione dopo
     * la chiusura del pool non impediscono la terminazione della JVM.
     */
    private static final class UnitThreadFactory implements ThreadFactory {

        private final int searchId;
        private final AtomicInteger threadCounter = new AtomicInteger();

        UnitThreadFactory(int searchId) {
            this.searchId = searchId;
        }

        @Override
        public Thread newThread(Runnable task) {
            Thread thread = new Thread(task, "ricerca-" + searchId + "-unita-" + threadCounter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
