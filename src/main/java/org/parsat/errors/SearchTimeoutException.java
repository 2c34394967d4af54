package org.parsat.errors;

/**
 * Il tempo massimo configurato per una ricerca è scaduto prima di un verdetto.
 */
public class SearchTimeoutException extends FormulaException {

    /** Timeout configurato in secondi */
    private final int timeoutSeconds;

    public SearchTimeoutException(int timeoutSeconds) {
        super("Timeout raggiunto dopo " + timeoutSeconds + " secondi");
        this.timeoutSeconds = timeoutSeconds;
    }

    public int getTimeoutSeconds() {
        return timeoutSeconds;
    }
}
