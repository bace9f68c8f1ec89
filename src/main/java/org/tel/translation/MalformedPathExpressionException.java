package org.tel.translation;

import org.tel.formula.Formula;
import org.tel.formula.PathExpression;

/**
 * Espressione di cammino non in forma normale: una stella il cui corpo può non
 * consumare passi, oppure un test sulla costante falsa.
 */
public class MalformedPathExpressionException extends TranslationException {

    private final transient Formula formula;
    private final transient PathExpression path;

    public MalformedPathExpressionException(Formula formula, PathExpression path) {
        super("Cammino non in forma normale " + path + " nella formula " + formula);
        this.formula = formula;
        this.path = path;
    }

    public Formula formula() {
        return formula;
    }

    public PathExpression path() {
        return path;
    }
}
