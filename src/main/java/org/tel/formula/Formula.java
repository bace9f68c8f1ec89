package org.tel.formula;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * FORMULA TEMPORALE E DINAMICA - Albero immutabile delle formule modali
 *
 * Rappresenta formule della logica temporale (operatori passati e futuri) e della
 * logica dinamica (box e diamond su espressioni di cammino) in forma ad albero.
 * Ogni nodo è immutabile: le istanze vengono create una sola volta dal parser e
 * condivise per tutta l'esecuzione.
 *
 * UGUAGLIANZA STRUTTURALE:
 * - Due formule costruite separatamente ma con la stessa struttura sono uguali
 * - L'hash è calcolato una volta nel costruttore (le formule sono chiavi di cache)
 * - La rappresentazione testuale è canonica e coincide per formule uguali
 *
 * ZUCCHERO SINTATTICO:
 * - a ;> b  diventa  a & (> b)      e  a ;>: b  diventa  a & (>: b)
 * - a <; b  diventa  (< a) & b      e  a <:; b  diventa  (<: a) & b
 * - >> a    diventa  >* (~&final | a)
 * - n < a    diventa  < ... < a con n operatori, e 0 < a è a stesso (così anche <:, >, >:)
 * Le espansioni avvengono nei metodi factory, prima di qualunque traduzione.
 */
public final class Formula {

    //region TIPI E STRUTTURA DATI

    /**
     * Tipi di nodi supportati nella rappresentazione ad albero.
     */
    public enum Type {
        ATOM,           // Proposizione atomica: p(t1,...,tn)
        TRUE,           // &true
        FALSE,          // &false
        INITIAL,        // &initial
        FINAL,          // &final
        NOT,            // ~a
        AND,            // a & b
        OR,             // a | b
        IMPLIES,        // a -> b
        IMPLIED_BY,     // a <- b
        IFF,            // a <> b
        PREVIOUS,       // < a
        WEAK_PREVIOUS,  // <: a
        NEXT,           // > a
        WEAK_NEXT,      // >: a
        INITIALLY,      // << a
        SINCE,          // a <? b, oppure <? b (once) senza operando sinistro
        TRIGGER,        // a <* b, oppure <* b (historically)
        UNTIL,          // a >? b, oppure >? b (eventually)
        RELEASE,        // a >* b, oppure >* b (always)
        BOX,            // [p].>* a
        DIAMOND         // [p].>? a
    }

    public static final Formula TRUE = new Formula(Type.TRUE, null, List.of(), true, null, null, null);
    public static final Formula FALSE = new Formula(Type.FALSE, null, List.of(), true, null, null, null);
    public static final Formula INITIAL = new Formula(Type.INITIAL, null, List.of(), true, null, null, null);
    public static final Formula FINAL = new Formula(Type.FINAL, null, List.of(), true, null, null, null);

    private final Type type;

    /** Nome del predicato (solo ATOM) */
    private final String name;

    /** Argomenti ground del predicato (solo ATOM) */
    private final List<Term> arguments;

    /** Segno della negazione classica (solo ATOM) */
    private final boolean positive;

    /** Operando sinistro degli operatori binari, null per once/historically/eventually/always */
    private final Formula left;

    /** Operando destro, oppure unico operando degli operatori unari */
    private final Formula right;

    /** Espressione di cammino (solo BOX e DIAMOND) */
    private final PathExpression path;

    private final int hash;

    /** Prefisso dei simboli generati dalla traduzione, vietato ai nomi del programma */
    public static final String RESERVED_PREFIX = "__";

    //endregion

    //region COSTRUTTORI E FACTORY

    private Formula(Type type, String name, List<Term> arguments, boolean positive,
                    Formula left, Formula right, PathExpression path) {
        this.type = type;
        this.name = name;
        this.arguments = arguments;
        this.positive = positive;
        this.left = left;
        this.right = right;
        this.path = path;
        this.hash = Objects.hash(type, name, arguments, positive, left, right, path);
    }

    /**
     * Proposizione atomica p(t1,...,tn).
     *
     * @param name nome del predicato (non null, non vuoto, senza apici, senza il prefisso "__")
     * @param arguments argomenti ground
     * @throws IllegalArgumentException se il nome non è valido
     */
    public static Formula atom(String name, List<Term> arguments) {
        return atom(name, arguments, true);
    }

    public static Formula atom(String name) {
        return atom(name, List.of(), true);
    }

    /**
     * Proposizione atomica con segno di negazione classica esplicito.
     */
    public static Formula atom(String name, List<Term> arguments, boolean positive) {
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalArgumentException("Nome della proposizione atomica non può essere null o vuoto");
        }
        // I riferimenti temporali si esprimono con < e >, non con apici
        if (name.startsWith("'") || name.endsWith("'")) {
            throw new IllegalArgumentException("Le formule temporali usano < e > al posto degli apici: " + name);
        }
        if (name.trim().startsWith(RESERVED_PREFIX)) {
            throw new IllegalArgumentException("Il prefisso " + RESERVED_PREFIX
                    + " è riservato agli atomi ausiliari: " + name);
        }
        return new Formula(Type.ATOM, name.trim(), arguments == null ? List.of() : List.copyOf(arguments),
                positive, null, null, null);
    }

    public static Formula not(Formula operand) {
        return unary(Type.NOT, operand);
    }

    public static Formula and(Formula left, Formula right) {
        return binary(Type.AND, left, right);
    }

    public static Formula or(Formula left, Formula right) {
        return binary(Type.OR, left, right);
    }

    public static Formula implies(Formula left, Formula right) {
        return binary(Type.IMPLIES, left, right);
    }

    public static Formula impliedBy(Formula left, Formula right) {
        return binary(Type.IMPLIED_BY, left, right);
    }

    public static Formula iff(Formula left, Formula right) {
        return binary(Type.IFF, left, right);
    }

    public static Formula previous(Formula operand) {
        return unary(Type.PREVIOUS, operand);
    }

    public static Formula weakPrevious(Formula operand) {
        return unary(Type.WEAK_PREVIOUS, operand);
    }

    public static Formula next(Formula operand) {
        return unary(Type.NEXT, operand);
    }

    public static Formula weakNext(Formula operand) {
        return unary(Type.WEAK_NEXT, operand);
    }

    /** n < a: il passo n posizioni prima, falso se non esiste. */
    public static Formula previous(int count, Formula operand) {
        return repeat(Type.PREVIOUS, count, operand);
    }

    public static Formula weakPrevious(int count, Formula operand) {
        return repeat(Type.WEAK_PREVIOUS, count, operand);
    }

    /** n > a: il passo n posizioni dopo, falso se non esiste. */
    public static Formula next(int count, Formula operand) {
        return repeat(Type.NEXT, count, operand);
    }

    public static Formula weakNext(int count, Formula operand) {
        return repeat(Type.WEAK_NEXT, count, operand);
    }

    public static Formula initially(Formula operand) {
        return unary(Type.INITIALLY, operand);
    }

    public static Formula once(Formula operand) {
        return fixpoint(Type.SINCE, null, operand);
    }

    public static Formula since(Formula left, Formula right) {
        return fixpoint(Type.SINCE, requireOperand(left), right);
    }

    public static Formula historically(Formula operand) {
        return fixpoint(Type.TRIGGER, null, operand);
    }

    public static Formula trigger(Formula left, Formula right) {
        return fixpoint(Type.TRIGGER, requireOperand(left), right);
    }

    public static Formula eventually(Formula operand) {
        return fixpoint(Type.UNTIL, null, operand);
    }

    public static Formula until(Formula left, Formula right) {
        return fixpoint(Type.UNTIL, requireOperand(left), right);
    }

    public static Formula always(Formula operand) {
        return fixpoint(Type.RELEASE, null, operand);
    }

    public static Formula release(Formula left, Formula right) {
        return fixpoint(Type.RELEASE, requireOperand(left), right);
    }

    public static Formula box(PathExpression path, Formula operand) {
        return dynamic(Type.BOX, path, operand);
    }

    public static Formula diamond(PathExpression path, Formula operand) {
        return dynamic(Type.DIAMOND, path, operand);
    }

    /** a ;> b */
    public static Formula sequenceNext(Formula left, Formula right) {
        return and(left, next(right));
    }

    /** a ;>: b */
    public static Formula weakSequenceNext(Formula left, Formula right) {
        return and(left, weakNext(right));
    }

    /** a <; b */
    public static Formula sequencePrevious(Formula left, Formula right) {
        return and(previous(left), right);
    }

    /** a <:; b */
    public static Formula weakSequencePrevious(Formula left, Formula right) {
        return and(weakPrevious(left), right);
    }

    /** >> a: a vale nell'ultimo stato */
    public static Formula finallyAt(Formula operand) {
        return always(or(not(FINAL), operand));
    }

    private static Formula unary(Type type, Formula operand) {
        return new Formula(type, null, List.of(), true, null, requireOperand(operand), null);
    }

    /**
     * Annida n operatori di un passo: ogni riferimento resta al passo adiacente.
     */
    private static Formula repeat(Type type, int count, Formula operand) {
        if (count < 0) {
            throw new IllegalArgumentException("Numero di passi negativo: " + count);
        }
        Formula result = requireOperand(operand);
        for (int i = 0; i < count; i++) {
            result = unary(type, result);
        }
        return result;
    }

    private static Formula binary(Type type, Formula left, Formula right) {
        return new Formula(type, null, List.of(), true, requireOperand(left), requireOperand(right), null);
    }

    private static Formula fixpoint(Type type, Formula left, Formula right) {
        return new Formula(type, null, List.of(), true, left, requireOperand(right), null);
    }

    private static Formula dynamic(Type type, PathExpression path, Formula operand) {
        if (path == null) {
            throw new IllegalArgumentException("Espressione di cammino non può essere null");
        }
        return new Formula(type, null, List.of(), true, null, requireOperand(operand), path);
    }

    private static Formula requireOperand(Formula operand) {
        if (operand == null) {
            throw new IllegalArgumentException("Operando della formula non può essere null");
        }
        return operand;
    }

    //endregion

    //region ACCESSO AI CAMPI

    public Type type() {
        return type;
    }

    public String name() {
        return name;
    }

    public List<Term> arguments() {
        return arguments;
    }

    public boolean isPositive() {
        return positive;
    }

    /**
     * Operando sinistro; null per gli operatori unari e per le varianti
     * senza operando sinistro degli operatori di punto fisso.
     */
    public Formula left() {
        return left;
    }

    public Formula right() {
        return right;
    }

    /** Unico operando degli operatori unari (coincide con {@link #right()}). */
    public Formula operand() {
        return right;
    }

    public PathExpression path() {
        return path;
    }

    public boolean isAtomic() {
        return type == Type.ATOM;
    }

    public boolean isConstant() {
        return type == Type.TRUE || type == Type.FALSE;
    }

    //endregion

    //region ANALISI STRUTTURALE

    /**
     * Verifica se la formula fa riferimento a passi successivi a quello corrente.
     *
     * La costante &final non conta come riferimento al futuro: il suo valore
     * dipende solo da quale passo chiude l'orizzonte.
     *
     * @return true se compaiono next, until, release o cammini che consumano passi
     */
    public boolean referencesFuture() {
        return switch (type) {
            case ATOM, TRUE, FALSE, INITIAL, FINAL -> false;
            case NEXT, WEAK_NEXT, UNTIL, RELEASE -> true;
            case BOX, DIAMOND -> path.referencesFuture() || right.referencesFuture();
            default -> (left != null && left.referencesFuture()) || right.referencesFuture();
        };
    }

    /**
     * Cerca la prima espressione di cammino non in forma normale.
     *
     * @return il cammino malformato, oppure null se tutti i cammini sono validi
     */
    public PathExpression findMalformedPath() {
        return switch (type) {
            case ATOM, TRUE, FALSE, INITIAL, FINAL -> null;
            case BOX, DIAMOND -> {
                if (!path.isNormalForm()) {
                    yield path;
                }
                PathExpression nested = path.findMalformedPath();
                yield nested != null ? nested : right.findMalformedPath();
            }
            default -> {
                PathExpression inLeft = left != null ? left.findMalformedPath() : null;
                yield inLeft != null ? inLeft : right.findMalformedPath();
            }
        };
    }

    //endregion

    //region UGUAGLIANZA E RAPPRESENTAZIONE

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Formula formula)) {
            return false;
        }
        return hash == formula.hash
                && type == formula.type
                && positive == formula.positive
                && Objects.equals(name, formula.name)
                && arguments.equals(formula.arguments)
                && Objects.equals(left, formula.left)
                && Objects.equals(right, formula.right)
                && Objects.equals(path, formula.path);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    /**
     * Rappresentazione canonica, interamente parentesizzata.
     */
    @Override
    public String toString() {
        return switch (type) {
            case ATOM -> (positive ? "" : "-") + name
                    + (arguments.isEmpty() ? "" : arguments.stream().map(Term::toString)
                    .collect(Collectors.joining(",", "(", ")")));
            case TRUE -> "&true";
            case FALSE -> "&false";
            case INITIAL -> "&initial";
            case FINAL -> "&final";
            case NOT -> "(~" + right + ")";
            case AND -> "(" + left + "&" + right + ")";
            case OR -> "(" + left + "|" + right + ")";
            case IMPLIES -> "(" + left + "->" + right + ")";
            case IMPLIED_BY -> "(" + left + "<-" + right + ")";
            case IFF -> "(" + left + "<>" + right + ")";
            case PREVIOUS -> "(<" + right + ")";
            case WEAK_PREVIOUS -> "(<:" + right + ")";
            case NEXT -> "(>" + right + ")";
            case WEAK_NEXT -> "(>:" + right + ")";
            case INITIALLY -> "(<<" + right + ")";
            case SINCE -> "(" + (left == null ? "" : left.toString()) + "<?" + right + ")";
            case TRIGGER -> "(" + (left == null ? "" : left.toString()) + "<*" + right + ")";
            case UNTIL -> "(" + (left == null ? "" : left.toString()) + ">?" + right + ")";
            case RELEASE -> "(" + (left == null ? "" : left.toString()) + ">*" + right + ")";
            case BOX -> "([" + path + "].>*" + right + ")";
            case DIAMOND -> "([" + path + "].>?" + right + ")";
        };
    }

    //endregion
}
