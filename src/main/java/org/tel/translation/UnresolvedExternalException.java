package org.tel.translation;

/**
 * Un esterno di frontiera è rimasto libero dopo la chiusura dell'orizzonte.
 * Indica una violazione interna: alla chiusura ogni obbligo deve essere fissato.
 */
public class UnresolvedExternalException extends TranslationException {

    private final int external;

    public UnresolvedExternalException(int external, String description) {
        super("Esterno " + external + " ancora libero a orizzonte chiuso: " + description);
        this.external = external;
    }

    public int external() {
        return external;
    }
}
