package org.parsat.support;

import org.parsat.formula.Expression;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * INSIEME DI VARIABILI - Lista ordinata e senza duplicati su cui spazia una ricerca
 *
 * La posizione di ogni variabile è il bit che ne determina il valore durante
 * l'enumerazione degli assegnamenti: l'ordine resta fisso per tutta la vita
 * dell'istanza. I duplicati vengono scartati mantenendo la prima occorrenza.
 */
public final class VariableSet {

    /**
     * Massimo numero di variabili: 2^n candidati devono restare rappresentabili come long.
     */
    public static final int MAX_VARIABLES = 62;

    private final List<String> names;

    /**
     * @param names nomi delle variabili in ordine (non null, nessun nome vuoto)
     * @throws IllegalArgumentException se un nome è null o vuoto, o se le variabili sono più di {@link #MAX_VARIABLES}
     */
    public VariableSet(List<String> names) {
        if (names == null) {
            throw new IllegalArgumentException("Lista variabili non può essere null");
        }

        Set<String> unique = new LinkedHashSet<>();
        for (String name : names) {
            if (name == null || name.trim().isEmpty()) {
                throw new IllegalArgumentException("Nome variabile non può essere null o vuoto");
            }
            unique.add(name.trim());
        }

        if (unique.size() > MAX_VARIABLES) {
            throw new IllegalArgumentException("Troppe variabili: " + unique.size() + " (massimo " + MAX_VARIABLES + ")");
        }
        this.names = Collections.unmodifiableList(new ArrayList<>(unique));
    }

    public static VariableSet of(String... names) {
        return new VariableSet(Arrays.asList(names));
    }

    /**
     * Ricava le variabili di una formula nell'ordine in cui compaiono per la prima volta.
     */
    public static VariableSet fromExpression(Expression expression) {
        if (expression == null) {
            throw new IllegalArgumentException("Espressione non può essere null");
        }
        return new VariableSet(expression.identifiers());
    }

    public int size() {
        return names.size();
    }

    public String get(int position) {
        return names.get(position);
    }

    public boolean contains(String name) {
        return names.contains(name);
    }

    public List<String> asList() {
        return names;
    }

    /**
     * Numero di assegnamenti distinti: 2^n (uno solo per l'insieme vuoto).
     */
    public long candidateCount() {
        return 1L << names.size();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        return names.equals(((VariableSet) obj).names);
    }

    @Override
    public int hashCode() {
        return names.hashCode();
    }

    @Override
    public String toString() {
        return names.toString();
    }
}
