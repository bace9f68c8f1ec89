package org.tel.translation;

import org.tel.formula.Formula;
import org.tel.support.Stage;

/**
 * Una formula si riferisce a una direzione temporale che il suo stadio non consente.
 */
public class StageViolationException extends TranslationException {

    private final transient Formula formula;
    private final Stage stage;

    public StageViolationException(Formula formula, Stage stage) {
        super("La formula " + formula + " dello stadio " + stage.name().toLowerCase()
                + " non può riferirsi al futuro");
        this.formula = formula;
        this.stage = stage;
    }

    public Formula formula() {
        return formula;
    }

    public Stage stage() {
        return stage;
    }
}
