package org.tel.support;

/**
 * CONTESTO DI PASSO - Indice temporale corrente e stadio della formula in traduzione
 *
 * Risolve i riferimenti relativi (negativi verso il passato, positivi verso il
 * futuro) rispetto al passo corrente e allo stato dell'orizzonte. Il contesto è
 * immutabile: il gestore dell'orizzonte ne crea uno per ogni traduzione.
 *
 * CONVENZIONI:
 * - I riferimenti prima del passo 0 non sono errori: saturano sul passo 0
 * - I riferimenti al futuro dallo stadio FINAL sono vietati
 * - Oltre l'orizzonte chiuso non esiste alcun passo
 */
public final class StepContext {

    private final int step;
    private final Stage stage;
    private final int horizon;
    private final boolean closed;

    /**
     * @param step passo corrente
     * @param stage stadio della formula che si sta traducendo
     * @param horizon ultimo passo srotolato
     * @param closed true se l'orizzonte è stato chiuso da markFinal
     * @throws IllegalArgumentException se il passo è fuori dalla finestra
     */
    public StepContext(int step, Stage stage, int horizon, boolean closed) {
        if (stage == null) {
            throw new IllegalArgumentException("Stadio non può essere null");
        }
        if (step < 0 || step > horizon) {
            throw new IllegalArgumentException("Passo " + step + " fuori dalla finestra [0, " + horizon + "]");
        }
        this.step = step;
        this.stage = stage;
        this.horizon = horizon;
        this.closed = closed;
    }

    /**
     * Risolve un riferimento relativo al passo corrente.
     *
     * @param offset spostamento (negativo = passato, positivo = futuro, 0 = presente)
     * @return passo bersaglio e sua posizione rispetto alla finestra
     */
    public StepReference resolve(int offset) {
        int target = step + offset;

        if (offset > 0 && !stage.licensesFuture()) {
            return new StepReference(target, StepReference.Window.STAGE_FORBIDDEN);
        }
        if (target < 0) {
            return new StepReference(0, StepReference.Window.BEFORE_INITIAL);
        }
        if (target > horizon) {
            return new StepReference(target, closed
                    ? StepReference.Window.BEYOND_FINAL
                    : StepReference.Window.BEYOND_HORIZON);
        }
        return new StepReference(target, StepReference.Window.IN_WINDOW);
    }

    /**
     * Stesso stadio e stesso orizzonte, spostato su un altro passo della finestra.
     */
    public StepContext atStep(int target) {
        if (target == step) {
            return this;
        }
        return new StepContext(target, stage, horizon, closed);
    }

    public int step() {
        return step;
    }

    public Stage stage() {
        return stage;
    }

    public int horizon() {
        return horizon;
    }

    public boolean isClosed() {
        return closed;
    }

    /** Il passo corrente è l'ultimo srotolato e l'orizzonte può ancora crescere. */
    public boolean isFrontier() {
        return step == horizon && !closed;
    }

    /** Il passo corrente è l'ultimo di un orizzonte chiuso. */
    public boolean isFinalStep() {
        return step == horizon && closed;
    }

    @Override
    public String toString() {
        return "StepContext[step=" + step + ", stage=" + stage + ", horizon=" + horizon
                + (closed ? ", closed" : "") + "]";
    }
}
