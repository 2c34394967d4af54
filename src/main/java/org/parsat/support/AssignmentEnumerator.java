package org.parsat.support;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * ENUMERATORE ASSEGNAMENTI - Copertura completa dell'ipercubo booleano
 *
 * Gli assegnamenti sono indicizzati da 0 a 2^n - 1: per l'indice i, la variabile
 * in posizione j vale {@code ((i >> j) & 1) == 1}. La corrispondenza è biunivoca,
 * quindi ogni punto dell'ipercubo viene prodotto esattamente una volta.
 *
 * L'accesso per indice permette a ogni unità di valutazione di costruire da sola
 * il proprio assegnamento; l'iterazione è pigra e ogni {@link #iterator()} riparte
 * da zero.
 */
public final class AssignmentEnumerator implements Iterable<Assignment> {

    private final VariableSet variables;

    public AssignmentEnumerator(VariableSet variables) {
        if (variables == null) {
            throw new IllegalArgumentException("Insieme variabili non può essere null");
        }
        this.variables = variables;
    }

    public long size() {
        return variables.candidateCount();
    }

    /**
     * Costruisce l'assegnamento di indice dato.
     *
     * @param index indice in [0, 2^n)
     * @throws IndexOutOfBoundsException se l'indice è fuori intervallo
     */
    public Assignment assignmentAt(long index) {
        if (index < 0 || index >= size()) {
            throw new IndexOutOfBoundsException("Indice assegnamento fuori intervallo: " + index);
        }

        Map<String, Boolean> values = new LinkedHashMap<>();
        for (int j = 0; j < variables.size(); j++) {
            values.put(variables.get(j), ((index >> j) & 1L) == 1L);
        }
        return new Assignment(values);
    }

    @Override
    public Iterator<Assignment> iterator() {
        return new Iterator<>() {
            private long next = 0;

            @Override
            public boolean hasNext() {
                return next < size();
            }

            @Override
            public Assignment next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                return assignmentAt(next++);
            }
        };
    }
}
