package org.tel.formula;

import java.util.Objects;

/**
 * Espressione di cammino regolare usata dagli operatori dinamici box e diamond.
 *
 * VARIANTI:
 * - STEP: &true, consuma esattamente un passo
 * - TEST: ? f, vale senza consumare passi se f vale nel passo corrente
 * - SEQUENCE: p ;; q
 * - CHOICE: p + q
 * - STAR: * p, ripetizione di p zero o più volte
 *
 * FORMA NORMALE:
 * Il motore di traduzione non normalizza i cammini: richiede che ogni corpo di
 * una stella consumi almeno un passo su ogni ramo (altrimenti la definizione
 * ricorsiva della stella non sarebbe ben fondata nello stesso passo) e che non
 * compaiano test sulla costante &false (rami irraggiungibili).
 */
public final class PathExpression {

    public enum Type {
        STEP,
        TEST,
        SEQUENCE,
        CHOICE,
        STAR
    }

    public static final PathExpression STEP = new PathExpression(Type.STEP, null, null, null);

    private final Type type;
    private final Formula test;
    private final PathExpression left;
    private final PathExpression right;
    private final int hash;

    private PathExpression(Type type, Formula test, PathExpression left, PathExpression right) {
        this.type = type;
        this.test = test;
        this.left = left;
        this.right = right;
        this.hash = Objects.hash(type, test, left, right);
    }

    public static PathExpression step() {
        return STEP;
    }

    public static PathExpression test(Formula formula) {
        if (formula == null) {
            throw new IllegalArgumentException("Formula del test non può essere null");
        }
        return new PathExpression(Type.TEST, formula, null, null);
    }

    public static PathExpression sequence(PathExpression left, PathExpression right) {
        return new PathExpression(Type.SEQUENCE, null, requirePath(left), requirePath(right));
    }

    public static PathExpression choice(PathExpression left, PathExpression right) {
        return new PathExpression(Type.CHOICE, null, requirePath(left), requirePath(right));
    }

    public static PathExpression star(PathExpression body) {
        return new PathExpression(Type.STAR, null, null, requirePath(body));
    }

    /**
     * Un atomo in posizione di cammino abbrevia ?a ;; &true.
     */
    public static PathExpression atomStep(Formula atom) {
        return sequence(test(atom), STEP);
    }

    private static PathExpression requirePath(PathExpression path) {
        if (path == null) {
            throw new IllegalArgumentException("Sottocammino non può essere null");
        }
        return path;
    }

    public Type type() {
        return type;
    }

    /** Formula del test (solo TEST). */
    public Formula test() {
        return test;
    }

    public PathExpression left() {
        return left;
    }

    /** Secondo operando, oppure corpo della stella. */
    public PathExpression right() {
        return right;
    }

    //region FORMA NORMALE

    /**
     * Verifica che ogni parola del linguaggio del cammino consumi almeno un passo.
     */
    public boolean consumesStep() {
        return switch (type) {
            case STEP -> true;
            case TEST, STAR -> false;
            case SEQUENCE -> left.consumesStep() || right.consumesStep();
            case CHOICE -> left.consumesStep() && right.consumesStep();
        };
    }

    /**
     * Predicato di validazione usato dal motore prima di tradurre un operatore dinamico.
     *
     * @return true se ogni stella ha un corpo che consuma passi e non ci sono test su &false
     */
    public boolean isNormalForm() {
        return switch (type) {
            case STEP -> true;
            case TEST -> test.type() != Formula.Type.FALSE;
            case SEQUENCE, CHOICE -> left.isNormalForm() && right.isNormalForm();
            case STAR -> right.consumesStep() && right.isNormalForm();
        };
    }

    /**
     * Cerca cammini malformati annidati nelle formule dei test.
     */
    PathExpression findMalformedPath() {
        return switch (type) {
            case STEP -> null;
            case TEST -> test.findMalformedPath();
            case STAR -> right.findMalformedPath();
            case SEQUENCE, CHOICE -> {
                PathExpression inLeft = left.findMalformedPath();
                yield inLeft != null ? inLeft : right.findMalformedPath();
            }
        };
    }

    /**
     * Un cammino si riferisce al futuro se può consumare passi o se lo fa un suo test.
     */
    public boolean referencesFuture() {
        return switch (type) {
            case STEP -> true;
            case TEST -> test.referencesFuture();
            case STAR -> right.referencesFuture();
            case SEQUENCE, CHOICE -> left.referencesFuture() || right.referencesFuture();
        };
    }

    //endregion

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof PathExpression path)) {
            return false;
        }
        return hash == path.hash
                && type == path.type
                && Objects.equals(test, path.test)
                && Objects.equals(left, path.left)
                && Objects.equals(right, path.right);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        return switch (type) {
            case STEP -> "&true";
            case TEST -> "(?" + test + ")";
            case SEQUENCE -> "(" + left + ";;" + right + ")";
            case CHOICE -> "(" + left + "+" + right + ")";
            case STAR -> "(*" + right + ")";
        };
    }
}
