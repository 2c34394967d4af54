package org.parsat.errors;

/**
 * Errore di valutazione di un albero di espressione.
 *
 * Durante una ricerca è fatale per l'intera ricerca: non viene mai
 * interpretato come esito {@code false} di un singolo assegnamento.
 */
public abstract class EvaluationException extends FormulaException {

    protected EvaluationException(String message) {
        super(message);
    }
}
