package org.tel.horizon;

import org.tel.support.TruthValue;

/**
 * ESTERNO DI FRONTIERA - Segnaposto a tre valori per un obbligo oltre l'orizzonte
 *
 * Nasce aperto con valore FREE: il risolutore può sceglierne liberamente il
 * valore. Quando il passo bersaglio viene srotolato l'esterno viene legato al
 * letterale reale dell'operando; quando l'orizzonte si chiude senza che il
 * passo esista viene fissato a un valore costante. In entrambi i casi il
 * dominio collassa a due valori e l'esterno non cambia più.
 *
 * Solo il gestore dell'orizzonte può legare o fissare un esterno.
 */
public final class BoundaryExternal {

    public enum State {
        OPEN,
        BOUND,
        FIXED
    }

    private final PendingObligation obligation;
    private State state = State.OPEN;
    private TruthValue fixedValue = TruthValue.FREE;
    private int boundLiteral = 0;

    BoundaryExternal(PendingObligation obligation) {
        this.obligation = obligation;
    }

    /**
     * Lega l'esterno al letterale dell'operando al passo bersaglio.
     *
     * @throws IllegalStateException se l'esterno non è più aperto
     */
    void bind(int literal) {
        requireOpen();
        this.boundLiteral = literal;
        this.state = State.BOUND;
    }

    /**
     * Fissa il valore dell'esterno alla chiusura dell'orizzonte.
     *
     * @throws IllegalArgumentException se il valore è FREE
     * @throws IllegalStateException se l'esterno non è più aperto
     */
    void fix(TruthValue value) {
        if (value == null || value.isFree()) {
            throw new IllegalArgumentException("Un esterno chiuso non può restare libero");
        }
        requireOpen();
        this.fixedValue = value;
        this.state = State.FIXED;
    }

    private void requireOpen() {
        if (state != State.OPEN) {
            throw new IllegalStateException("Esterno " + atom() + " già chiuso (" + state + ")");
        }
    }

    public int atom() {
        return obligation.external();
    }

    public PendingObligation obligation() {
        return obligation;
    }

    public State state() {
        return state;
    }

    public boolean isOpen() {
        return state == State.OPEN;
    }

    /**
     * FREE finché l'esterno è aperto, il valore costante se è stato fissato.
     *
     * @throws IllegalStateException se l'esterno è legato: il valore dipende dal letterale
     */
    public TruthValue value() {
        if (state == State.BOUND) {
            throw new IllegalStateException("Il valore dell'esterno " + atom()
                    + " dipende dal letterale " + boundLiteral);
        }
        return fixedValue;
    }

    /** Letterale legato, 0 se l'esterno non è legato. */
    public int boundLiteral() {
        return boundLiteral;
    }

    @Override
    public String toString() {
        return "BoundaryExternal[" + atom() + " " + obligation + " " + state
                + (state == State.BOUND ? " = " + boundLiteral : state == State.FIXED ? " = " + fixedValue : "")
                + "]";
    }
}
