package org.parsat.search;

import java.util.Properties;

/**
 * CONFIGURAZIONE RICERCA - Parametri immutabili e validati del coordinatore
 *
 * PARAMETRI:
 * - parallelism: thread del pool di valutazione (default: processori disponibili)
 * - maxInFlight: unità di valutazione sottomesse e non ancora concluse (default: 4 per thread)
 * - timeoutSeconds: tempo massimo per ricerca, 0 = nessun limite
 *
 * Il tetto alle unità in volo evita di allocare 2^n task per insiemi di variabili
 * grandi; non influisce sulla correttezza del verdetto.
 */
public final class SearchConfiguration {

    //region VALORI DI DEFAULT E LIMITI

    public static final String PARALLELISM_KEY = "search.parallelism";
    public static final String MAX_IN_FLIGHT_KEY = "search.maxInFlight";
    public static final String TIMEOUT_KEY = "search.timeoutSeconds";

    /** Nessun timeout */
    public static final int DEFAULT_TIMEOUT_SECONDS = 0;
    public static final int MIN_TIMEOUT_SECONDS = 1;
    public static final int MIN_PARALLELISM = 1;
    public static final int MIN_IN_FLIGHT = 1;

    /** Unità in volo per thread quando maxInFlight non è specificato */
    public static final int IN_FLIGHT_PER_THREAD = 4;

    //endregion

    private final int parallelism;
    private final int maxInFlight;
    private final int timeoutSeconds;

    /**
     * @throws IllegalArgumentException se un parametro è fuori dai limiti
     */
    public SearchConfiguration(int parallelism, int maxInFlight, int timeoutSeconds) {
        if (parallelism < MIN_PARALLELISM) {
            throw new IllegalArgumentException("Parallelismo deve essere almeno " + MIN_PARALLELISM + ": " + parallelism);
        }
        if (maxInFlight < MIN_IN_FLIGHT) {
            throw new IllegalArgumentException("Unità in volo devono essere almeno " + MIN_IN_FLIGHT + ": " + maxInFlight);
        }
        if (timeoutSeconds != DEFAULT_TIMEOUT_SECONDS && timeoutSeconds < MIN_TIMEOUT_SECONDS) {
            throw new IllegalArgumentException("Timeout deve essere 0 (nessun limite) o almeno "
                    + MIN_TIMEOUT_SECONDS + " secondi: " + timeoutSeconds);
        }

        this.parallelism = parallelism;
        this.maxInFlight = maxInFlight;
        this.timeoutSeconds = timeoutSeconds;
    }

    /**
     * Configurazione di default dimensionata sui processori disponibili.
     */
    public static SearchConfiguration defaults() {
        int processors = Runtime.getRuntime().availableProcessors();
        return new SearchConfiguration(processors, processors * IN_FLIGHT_PER_THREAD, DEFAULT_TIMEOUT_SECONDS);
    }

    /**
     * Legge la configurazione dalle proprietà indicate; le chiavi assenti prendono il default.
     *
     * @param properties proprietà con chiavi {@value #PARALLELISM_KEY}, {@value #MAX_IN_FLIGHT_KEY}, {@value #TIMEOUT_KEY}
     * @throws IllegalArgumentException se un valore non è un intero valido
     */
    public static SearchConfiguration fromProperties(Properties properties) {
        SearchConfiguration defaults = defaults();
        int parallelism = readInt(properties, PARALLELISM_KEY, defaults.parallelism);
        int maxInFlight = readInt(properties, MAX_IN_FLIGHT_KEY, parallelism * IN_FLIGHT_PER_THREAD);
        int timeoutSeconds = readInt(properties, TIMEOUT_KEY, DEFAULT_TIMEOUT_SECONDS);
        return new SearchConfiguration(parallelism, maxInFlight, timeoutSeconds);
    }

    private static int readInt(Properties properties, String key, int defaultValue) {
        String value = properties.getProperty(key);
        if (value == null || value.trim().isEmpty()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Valore non valido per " + key + ": " + value, e);
        }
    }

    public int getParallelism() {
        return parallelism;
    }

    public int getMaxInFlight() {
        return maxInFlight;
    }

    public int getTimeoutSeconds() {
        return timeoutSeconds;
    }

    public boolean hasTimeout() {
        return timeoutSeconds != DEFAULT_TIMEOUT_SECONDS;
    }

    @Override
    public String toString() {
        return String.format("SearchConfiguration{parallelism=%d, maxInFlight=%d, timeout=%s}",
                parallelism, maxInFlight, hasTimeout() ? timeoutSeconds + "s" : "nessuno");
    }
}
