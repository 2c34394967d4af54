package org.parsat.search;

/**
 * Ciclo di vita di un'unità di valutazione.
 *
 * PENDING -> RUNNING -> SUCCEEDED | REFUTED | FAILED
 * PENDING -> CANCELLED (ricerca già conclusa prima dell'avvio)
 */
public enum UnitState {
    PENDING,
    RUNNING,
    SUCCEEDED,  // l'assegnamento soddisfa la formula
    REFUTED,    // l'assegnamento rende falsa la formula
    FAILED,     // errore di valutazione
    CANCELLED
}
