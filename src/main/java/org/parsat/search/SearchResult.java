package org.parsat.search;

import org.parsat.support.Assignment;

import java.util.Map;
import java.util.Objects;

/**
 * RISULTATO RICERCA - Esito immutabile di una ricerca di soddisfacibilità
 *
 * Raccoglie ciò che il coordinatore produce al termine della ricerca: esito,
 * eventuale testimone e statistiche di esecuzione.
 *
 * DESIGN PRINCIPLES:
 * • Immutabilità: condivisibile tra thread dopo la costruzione
 * • Factory methods al posto del costruttore pubblico
 * • Validazione della coerenza tra esito e testimone
 *
 * COMPONENTI:
 * • Esito: SAT (soddisfacibile) vs UNSAT (insoddisfacibile)
 * • Testimone: assegnamento che rende vera la formula, solo per SAT
 * • Statistiche: assegnamenti valutati, confutati, cancellati e tempo impiegato
 *
 * Con più assegnamenti soddisfacenti il testimone è uno qualunque di essi:
 * l'ordine di completamento delle unità concorrenti non è deterministico.
 */
public class SearchResult {

    private final boolean satisfiable;

    /** Testimone per esiti SAT, null per UNSAT */
    private final Assignment assignment;

    private final SearchStatistics statistics;

    private SearchResult(boolean satisfiable, Assignment assignment, SearchStatistics statistics) {
        if (satisfiable && assignment == null) {
            throw new IllegalArgumentException("Risultato SAT richiede un assegnamento testimone");
        }
        if (!satisfiable && assignment != null) {
            throw new IllegalArgumentException("Risultato UNSAT non può avere assegnamento");
        }
        if (statistics == null) {
            throw new IllegalArgumentException("Statistiche non possono essere null");
        }

        this.satisfiable = satisfiable;
        this.assignment = assignment;
        this.statistics = statistics;
    }

    //region FACTORY

    public static SearchResult satisfied(Assignment witness, SearchStatistics statistics) {
        return new SearchResult(true, witness, statistics);
    }

    public static SearchResult unsatisfiable(SearchStatistics statistics) {
        return new SearchResult(false, null, statistics);
    }

    //endregion

    //region ACCESSORS

    public boolean isSatisfiable() {
        return satisfiable;
    }

    public boolean isUnsatisfiable() {
        return !satisfiable;
    }

    /**
     * @return assegnamento testimone per SAT, null per UNSAT
     */
    public Assignment getAssignment() {
        return assignment;
    }

    public SearchStatistics getStatistics() {
        return statistics;
    }

    //endregion

    //region OUTPUT E UGUAGLIANZA

    /**
     * Formato: "SAT" seguito dal modello ordinato per nome, oppure "UNSAT".
     */
    @Override
    public String toString() {
        StringBuilder output = new StringBuilder();
        if (satisfiable) {
            output.append("SAT\n");
            output.append("Modello:\n");
            assignment.asMap().entrySet().stream()
                    .sorted(Map.Entry.comparingByKey())
                    .forEach(entry -> output.append(entry.getKey())
                            .append(" → ").append(entry.getValue()).append("\n"));
        } else {
            output.append("UNSAT\n");
        }
        return output.toString();
    }

    public String toCompactString() {
        return String.format("SearchResult{%s, %s}", satisfiable ? "SAT " + assignment : "UNSAT",
                statistics.toCompactString());
    }

    /**
     * Uguaglianza su esito e testimone; le statistiche sono ignorate.
     */
    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;

        SearchResult other = (SearchResult) obj;
        return satisfiable == other.satisfiable && Objects.equals(assignment, other.assignment);
    }

    @Override
    public int hashCode() {
        return Objects.hash(satisfiable, assignment);
    }

    //endregion
}
