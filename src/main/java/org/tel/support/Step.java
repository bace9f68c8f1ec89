package org.tel.support;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Passo discreto della traccia, etichettato con gli stadi a cui appartiene.
 *
 * Il passo 0 è INITIAL, ogni passo successivo è DYNAMIC, tutti sono ALWAYS.
 * FINAL viene aggiunto solo all'ultimo passo quando l'orizzonte si chiude.
 */
public final class Step {

    private final int index;
    private final Set<Stage> stages;

    private Step(int index, Set<Stage> stages) {
        this.index = index;
        this.stages = Collections.unmodifiableSet(stages);
    }

    /**
     * @param index indice del passo (>= 0)
     * @throws IllegalArgumentException se l'indice è negativo
     */
    public static Step of(int index) {
        if (index < 0) {
            throw new IllegalArgumentException("Indice del passo non può essere negativo: " + index);
        }
        EnumSet<Stage> stages = EnumSet.of(Stage.ALWAYS);
        stages.add(index == 0 ? Stage.INITIAL : Stage.DYNAMIC);
        return new Step(index, stages);
    }

    /**
     * Copia del passo etichettata anche come finale.
     */
    public Step withFinal() {
        EnumSet<Stage> extended = EnumSet.copyOf(stages);
        extended.add(Stage.FINAL);
        return new Step(index, extended);
    }

    public int index() {
        return index;
    }

    public Set<Stage> stages() {
        return stages;
    }

    public boolean belongsTo(Stage stage) {
        return stages.contains(stage);
    }

    public boolean isFinal() {
        return stages.contains(Stage.FINAL);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Step step)) {
            return false;
        }
        return index == step.index && stages.equals(step.stages);
    }

    @Override
    public int hashCode() {
        return 31 * index + stages.hashCode();
    }

    @Override
    public String toString() {
        return "Step[" + index + " " + stages + "]";
    }
}
