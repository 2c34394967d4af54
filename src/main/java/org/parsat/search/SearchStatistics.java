package org.parsat.search;

/**
 * STATISTICHE RICERCA - Contatori di esecuzione di una singola ricerca
 *
 * Aggiornate concorrentemente dalle unità di valutazione: tutte le operazioni
 * di incremento sono sincronizzate.
 */
public class SearchStatistics {

    //region CONTATORI

    /** Assegnamenti candidati: 2^n */
    private final long candidates;

    /** Unità che hanno completato una valutazione (con esito o con errore) */
    private long evaluated = 0;

    /** Unità il cui assegnamento rende falsa la formula */
    private long refuted = 0;

    /** Unità che hanno rinunciato alla valutazione dopo la cancellazione */
    private long cancelled = 0;

    /** Unità terminate con errore */
    private long failed = 0;

    //endregion

    //region TIMING

    private final long startTime;
    private long executionTimeMs = 0;
    private boolean timerStopped = false;

    //endregion

    /**
     * Avvia immediatamente la misurazione del tempo di esecuzione.
     *
     * @param candidates numero di assegnamenti dello spazio di ricerca
     */
    public SearchStatistics(long candidates) {
        this.candidates = candidates;
        this.startTime = System.currentTimeMillis();
    }

    //region INCREMENTI

    public synchronized void recordSatisfied() {
        evaluated++;
    }

    public synchronized void recordRefuted() {
        evaluated++;
        refuted++;
    }

    public synchronized void recordFailed() {
        evaluated++;
        failed++;
    }

    public synchronized void recordCancelled() {
        cancelled++;
    }

    /**
     * Ferma il timer; le chiamate successive non hanno effetto.
     */
    public synchronized void stopTimer() {
        if (!timerStopped) {
            executionTimeMs = System.currentTimeMillis() - startTime;
            timerStopped = true;
        }
    }

    //endregion

    //region ACCESSORS

    public long getCandidates() {
        return candidates;
    }

    public synchronized long getEvaluated() {
        return evaluated;
    }

    public synchronized long getRefuted() {
        return refuted;
    }

    public synchronized long getCancelled() {
        return cancelled;
    }

    public synchronized long getFailed() {
        return failed;
    }

    /**
     * @return durata in millisecondi; se il timer è ancora attivo, il tempo trascorso finora
     */
    public synchronized long getExecutionTimeMs() {
        return timerStopped ? executionTimeMs : System.currentTimeMillis() - startTime;
    }

    public synchronized boolean isTimerStopped() {
        return timerStopped;
    }

    /**
     * Frazione dello spazio di ricerca effettivamente valutata.
     */
    public synchronized double getCoverage() {
        return candidates == 0 ? 0.0 : (double) evaluated / candidates;
    }

    //endregion

    //region OUTPUT

    @Override
    public synchronized String toString() {
        StringBuilder output = new StringBuilder();
        output.append("=== STATISTICHE RICERCA ===\n");
        output.append("Candidati: ").append(candidates).append("\n");
        output.append("Valutati: ").append(evaluated).append("\n");
        output.append("Confutati: ").append(refuted).append("\n");
        output.append("Cancellati: ").append(cancelled).append("\n");
        output.append("Falliti: ").append(failed).append("\n");
        output.append("Tempo: ").append(getExecutionTimeMs()).append(" ms\n");
        return output.toString();
    }

    public synchronized String toCompactString() {
        return String.format("candidati=%d, valutati=%d, confutati=%d, cancellati=%d, falliti=%d, tempo=%dms",
                candidates, evaluated, refuted, cancelled, failed, getExecutionTimeMs());
    }

    //endregion
}
