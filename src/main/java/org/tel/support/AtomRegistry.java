package org.tel.support;

import org.tel.formula.Formula;
import org.tel.formula.Term;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * REGISTRO ATOMI - Numerazione progressiva degli atomi ground prodotti dalla traduzione
 *
 * Assegna a ogni simbolo un identificativo intero a partire da 1, come le
 * variabili numeriche di una formula CNF. L'atomo 1 è riservato alla costante
 * falsa: il letterale {@link #FALSE} non è mai derivabile e {@link #TRUE} è la
 * sua negazione.
 *
 * CATEGORIE DI ATOMI:
 * - USER: proposizioni del programma, simbolo p(args,passo)
 * - AUXILIARY: letterali definiti per sottoformule composte, __aux(id)
 * - CARRIER: portatori dei punti fissi, __carrier(id)
 * - EXTERNAL: esterni di frontiera a tre valori, __ext(id)
 *
 * Il registro supporta checkpoint e rollback per annullare un'estensione
 * dell'orizzonte fallita.
 */
public class AtomRegistry {

    public enum Kind {
        RESERVED,
        USER,
        AUXILIARY,
        CARRIER,
        EXTERNAL
    }

    /** Letterale mai vero: l'atomo riservato __false */
    public static final int FALSE = 1;

    /** Letterale sempre vero: not __false */
    public static final int TRUE = -FALSE;

    private final List<String> symbols = new ArrayList<>();
    private final List<Kind> kinds = new ArrayList<>();
    private final Map<String, Integer> symbolToAtom = new HashMap<>();

    private int checkpoint = -1;

    public AtomRegistry() {
        register("__false", Kind.RESERVED);
    }

    //region ALLOCAZIONE

    /**
     * Atomo ground per una proposizione del programma al passo indicato.
     * Lo stesso simbolo restituisce sempre lo stesso identificativo.
     *
     * @param atom formula atomica
     * @param step passo a cui la proposizione si riferisce
     * @return identificativo dell'atomo
     */
    public int atom(Formula atom, int step) {
        if (atom == null || !atom.isAtomic()) {
            throw new IllegalArgumentException("Attesa una formula atomica: " + atom);
        }
        String symbol = userSymbol(atom, step);
        Integer existing = symbolToAtom.get(symbol);
        return existing != null ? existing : register(symbol, Kind.USER);
    }

    /**
     * Nuovo atomo ausiliario, sempre distinto dai precedenti.
     */
    public int auxiliary(Kind kind) {
        if (kind == Kind.USER || kind == Kind.RESERVED) {
            throw new IllegalArgumentException("Categoria non ausiliaria: " + kind);
        }
        int atom = symbols.size() + 1;
        String prefix = switch (kind) {
            case CARRIER -> "__carrier";
            case EXTERNAL -> "__ext";
            default -> "__aux";
        };
        return register(prefix + "(" + atom + ")", kind);
    }

    private int register(String symbol, Kind kind) {
        symbols.add(symbol);
        kinds.add(kind);
        int atom = symbols.size();
        symbolToAtom.put(symbol, atom);
        return atom;
    }

    private static String userSymbol(Formula atom, int step) {
        List<String> arguments = atom.arguments().stream()
                .map(Term::toString)
                .collect(Collectors.toCollection(ArrayList::new));
        arguments.add(Integer.toString(step));
        return (atom.isPositive() ? "" : "-") + atom.name() + "(" + String.join(",", arguments) + ")";
    }

    //endregion

    //region INTERROGAZIONE

    /**
     * @throws IllegalArgumentException se l'atomo non è registrato
     */
    public String symbol(int atom) {
        checkAtom(atom);
        return symbols.get(atom - 1);
    }

    /**
     * Rappresentazione di un letterale con segno, con "not" per la negazione.
     */
    public String literal(int literal) {
        return literal < 0 ? "not " + symbol(-literal) : symbol(literal);
    }

    public Kind kind(int atom) {
        checkAtom(atom);
        return kinds.get(atom - 1);
    }

    public boolean isAuxiliary(int atom) {
        Kind kind = kind(atom);
        return kind == Kind.AUXILIARY || kind == Kind.CARRIER || kind == Kind.EXTERNAL;
    }

    public List<Integer> atoms(Kind kind) {
        List<Integer> result = new ArrayList<>();
        for (int i = 0; i < kinds.size(); i++) {
            if (kinds.get(i) == kind) {
                result.add(i + 1);
            }
        }
        return result;
    }

    public List<Integer> userAtoms() {
        return atoms(Kind.USER);
    }

    public int size() {
        return symbols.size();
    }

    private void checkAtom(int atom) {
        if (atom < 1 || atom > symbols.size()) {
            throw new IllegalArgumentException("Atomo non registrato: " + atom);
        }
    }

    //endregion

    //region TRANSAZIONI

    public void checkpoint() {
        checkpoint = symbols.size();
    }

    public void commit() {
        checkpoint = -1;
    }

    /**
     * Elimina gli atomi registrati dopo l'ultimo checkpoint.
     *
     * @throws IllegalStateException se non c'è un checkpoint attivo
     */
    public void rollback() {
        if (checkpoint < 0) {
            throw new IllegalStateException("Nessun checkpoint attivo nel registro degli atomi");
        }
        while (symbols.size() > checkpoint) {
            int last = symbols.size() - 1;
            symbolToAtom.remove(symbols.remove(last));
            kinds.remove(last);
        }
        checkpoint = -1;
    }

    //endregion
}
