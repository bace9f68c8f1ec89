package org.tel.formula;

import org.tel.support.Stage;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Insieme di formule raggruppate per stadio, nell'ordine in cui compaiono nel sorgente.
 *
 * È l'interfaccia in ingresso del gestore dell'orizzonte: ogni formula è già
 * ground e va richiesta in ogni passo a cui si applica il suo stadio.
 */
public final class StagedProgram {

    private final Map<Stage, List<Formula>> formulas = new EnumMap<>(Stage.class);

    public StagedProgram() {
        for (Stage stage : Stage.values()) {
            formulas.put(stage, new ArrayList<>());
        }
    }

    /**
     * Aggiunge una formula allo stadio indicato.
     *
     * @return questo programma, per concatenare le chiamate
     * @throws IllegalArgumentException se stadio o formula sono null
     */
    public StagedProgram add(Stage stage, Formula formula) {
        if (stage == null || formula == null) {
            throw new IllegalArgumentException("Stadio e formula non possono essere null");
        }
        formulas.get(stage).add(formula);
        return this;
    }

    public List<Formula> formulas(Stage stage) {
        return Collections.unmodifiableList(formulas.get(stage));
    }

    public int size() {
        return formulas.values().stream().mapToInt(List::size).sum();
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<Stage, List<Formula>> entry : formulas.entrySet()) {
            for (Formula formula : entry.getValue()) {
                sb.append('#').append(entry.getKey().name().toLowerCase())
                        .append(' ').append(formula).append(".\n");
            }
        }
        return sb.toString();
    }
}
