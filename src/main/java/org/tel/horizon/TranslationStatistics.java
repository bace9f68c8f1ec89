package org.tel.horizon;

/**
 * STATISTICHE DI TRADUZIONE - Metriche raccolte durante lo srotolamento dell'orizzonte
 *
 * Conta passi, regole ed esterni prodotti dal gestore dell'orizzonte e riporta lo
 * stato del motore (atomi, portatori, cache) all'ultima operazione conclusa.
 * Il timer parte alla creazione e si ferma con {@link #stopTimer()}.
 */
public class TranslationStatistics {

    //region CONTATORI ORIZZONTE

    private int steps = 0;
    private int rules = 0;
    private int constraints = 0;
    private int externalsOpened = 0;
    private int externalsBound = 0;
    private int externalsFixed = 0;
    private int rollbacks = 0;

    //endregion

    //region STATO DEL MOTORE

    private int atoms = 0;
    private int auxiliaryAtoms = 0;
    private int carriers = 0;
    private int cacheEntries = 0;
    private int cacheHits = 0;
    private int cacheMisses = 0;

    //endregion

    //region TIMING

    private final long startTime;
    private long executionTimeMs = 0;
    private boolean timerStopped = false;

    public TranslationStatistics() {
        this.startTime = System.currentTimeMillis();
    }

    public void stopTimer() {
        if (!timerStopped) {
            executionTimeMs = System.currentTimeMillis() - startTime;
            timerStopped = true;
        }
    }

    /**
     * @return tempo trascorso in ms (parziale se il timer è ancora attivo)
     */
    public long getExecutionTimeMs() {
        return timerStopped ? executionTimeMs : System.currentTimeMillis() - startTime;
    }

    //endregion

    //region AGGIORNAMENTO

    void incrementSteps() {
        steps++;
    }

    void addRules(int total, int constraintCount) {
        rules += total;
        constraints += constraintCount;
    }

    void incrementExternalsOpened() {
        externalsOpened++;
    }

    void incrementExternalsBound() {
        externalsBound++;
    }

    void incrementExternalsFixed() {
        externalsFixed++;
    }

    void incrementRollbacks() {
        rollbacks++;
    }

    /**
     * Copia lo stato corrente del motore di traduzione.
     */
    void recordEngineState(int atoms, int auxiliaryAtoms, int carriers,
                           int cacheEntries, int cacheHits, int cacheMisses) {
        this.atoms = atoms;
        this.auxiliaryAtoms = auxiliaryAtoms;
        this.carriers = carriers;
        this.cacheEntries = cacheEntries;
        this.cacheHits = cacheHits;
        this.cacheMisses = cacheMisses;
    }

    //endregion

    //region LETTURA

    public int getSteps() {
        return steps;
    }

    public int getRules() {
        return rules;
    }

    public int getConstraints() {
        return constraints;
    }

    public int getExternalsOpened() {
        return externalsOpened;
    }

    public int getExternalsBound() {
        return externalsBound;
    }

    public int getExternalsFixed() {
        return externalsFixed;
    }

    public int getRollbacks() {
        return rollbacks;
    }

    public int getAtoms() {
        return atoms;
    }

    public int getAuxiliaryAtoms() {
        return auxiliaryAtoms;
    }

    public int getCarriers() {
        return carriers;
    }

    public int getCacheEntries() {
        return cacheEntries;
    }

    public int getCacheHits() {
        return cacheHits;
    }

    public int getCacheMisses() {
        return cacheMisses;
    }

    /**
     * @return frazione di richieste alla cache risolte senza nuova allocazione (0.0 se nessuna)
     */
    public double getCacheHitRate() {
        int requests = cacheHits + cacheMisses;
        return requests > 0 ? (double) cacheHits / requests : 0.0;
    }

    public double getRulesPerStep() {
        return steps > 0 ? (double) rules / steps : 0.0;
    }

    //endregion

    //region OUTPUT

    @Override
    public String toString() {
        StringBuilder output = new StringBuilder();

        output.append("========================[ TRANSLATION COMPLETED: HORIZON STATS ]========================\n");
        output.append("    Passi:          ").append(steps).append("\n");
        output.append("    Regole:         ").append(rules).append(" (").append(constraints).append(" vincoli)\n");
        output.append(String.format("    Regole/passo:   %.2f%n", getRulesPerStep()));
        output.append("===================================[ ATOMS STATS ]=======================================\n");
        output.append("    Atomi:          ").append(atoms).append("\n");
        output.append("    Ausiliari:      ").append(auxiliaryAtoms).append("\n");
        output.append("    Portatori:      ").append(carriers).append("\n");
        output.append("    Esterni:        ").append(externalsOpened)
                .append(" aperti, ").append(externalsBound)
                .append(" legati, ").append(externalsFixed).append(" fissati\n");
        output.append("===================================[ CACHE STATS ]=======================================\n");
        output.append("    Voci:           ").append(cacheEntries).append("\n");
        output.append(String.format("    Hit rate:       %.1f%% (%d hit, %d miss)%n",
                getCacheHitRate() * 100.0, cacheHits, cacheMisses));

        if (rollbacks > 0) {
            output.append("    Annullamenti:   ").append(rollbacks).append("\n");
        }

        output.append("    Tempo:          ").append(getExecutionTimeMs()).append("ms\n");
        output.append("=========================================================================================\n");

        return output.toString();
    }

    /**
     * Riga singola per il logging.
     */
    public String toCompactString() {
        return String.format("Stats[Steps:%d, Rules:%d, Aux:%d, Carriers:%d, Ext:%d/%d/%d, Time:%dms]",
                steps, rules, auxiliaryAtoms, carriers, externalsOpened, externalsBound, externalsFixed,
                getExecutionTimeMs());
    }

    //endregion
}
