package org.parsat.support;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Assegnamento immutabile variabile -> valore di verità.
 *
 * L'ordine di iterazione segue l'ordine di inserimento, cioè quello
 * dell'insieme di variabili da cui l'assegnamento è stato generato.
 */
public final class Assignment {

    private final Map<String, Boolean> values;

    /**
     * @param values mappa nome -> valore (copiata; nessuna chiave o valore null)
     * @throws IllegalArgumentException se la mappa è null o contiene elementi null
     */
    public Assignment(Map<String, Boolean> values) {
        if (values == null) {
            throw new IllegalArgumentException("Mappa valori non può essere null");
        }
        for (Map.Entry<String, Boolean> entry : values.entrySet()) {
            if (entry.getKey() == null || entry.getValue() == null) {
                throw new IllegalArgumentException("Assegnamento non può contenere chiavi o valori null");
            }
        }
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    /**
     * @return valore della variabile, null se la variabile non è assegnata
     */
    public Boolean valueOf(String name) {
        return values.get(name);
    }

    public boolean contains(String name) {
        return values.containsKey(name);
    }

    public int size() {
        return values.size();
    }

    public Map<String, Boolean> asMap() {
        return values;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        return values.equals(((Assignment) obj).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
