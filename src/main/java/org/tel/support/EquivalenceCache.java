package org.tel.support;

import org.tel.formula.Formula;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.IntSupplier;
import java.util.logging.Logger;

/**
 * CACHE DI EQUIVALENZA - Condivisione strutturale dei letterali per (formula, passo)
 *
 * Garantisce che per ogni coppia (formula, passo) venga allocato al più un
 * letterale. Il letterale è scelto una sola volta, al momento dell'inserimento,
 * e non viene mai riassegnato: una seconda richiesta restituisce lo stesso
 * letterale con isNew=false e il chiamante non deve riemettere le regole
 * definitorie.
 *
 * Le proposizioni atomiche non entrano nella cache: il loro letterale è
 * l'atomo ground restituito da {@link AtomRegistry}.
 */
public class EquivalenceCache {

    private static final Logger LOGGER = Logger.getLogger(EquivalenceCache.class.getName());

    /**
     * Chiave della cache. Le formule hanno uguaglianza strutturale, quindi
     * occorrenze distinte della stessa formula condividono la voce.
     */
    public record Key(Formula formula, int step) {
    }

    /**
     * @param literal letterale associato alla coppia
     * @param isNew true se la voce è stata creata da questa chiamata
     */
    public record Entry(int literal, boolean isNew) {
    }

    private final Map<Key, Integer> entries = new HashMap<>();

    /** Chiavi inserite dall'ultimo checkpoint, per il rollback */
    private List<Key> journal;

    private int hits = 0;
    private int misses = 0;

    //region ACCESSO

    /**
     * @return il letterale memorizzato, oppure null se la coppia non è presente
     */
    public Integer lookup(Formula formula, int step) {
        checkFormula(formula);
        Integer literal = entries.get(new Key(formula, step));
        if (literal != null) {
            hits++;
        }
        return literal;
    }

    /** Presenza della coppia, senza contarla tra i successi. */
    public boolean contains(Formula formula, int step) {
        checkFormula(formula);
        return entries.containsKey(new Key(formula, step));
    }

    /**
     * Restituisce il letterale della coppia, allocandolo con l'allocatore se assente.
     *
     * @param allocator invocato solo in caso di assenza
     * @return letterale e indicazione di nuova creazione
     */
    public Entry getOrCreate(Formula formula, int step, IntSupplier allocator) {
        checkFormula(formula);
        Key key = new Key(formula, step);
        Integer existing = entries.get(key);
        if (existing != null) {
            hits++;
            return new Entry(existing, false);
        }

        misses++;
        int literal = allocator.getAsInt();
        entries.put(key, literal);
        if (journal != null) {
            journal.add(key);
        }
        LOGGER.finest(() -> "Cache: " + formula + " @" + step + " -> " + literal);
        return new Entry(literal, true);
    }

    private static void checkFormula(Formula formula) {
        if (formula == null) {
            throw new IllegalArgumentException("Formula non può essere null");
        }
        if (formula.isAtomic()) {
            throw new IllegalArgumentException("Le proposizioni atomiche non entrano nella cache: " + formula);
        }
    }

    public int size() {
        return entries.size();
    }

    public int hits() {
        return hits;
    }

    public int misses() {
        return misses;
    }

    //endregion

    //region TRANSAZIONI

    public void checkpoint() {
        journal = new ArrayList<>();
    }

    public void commit() {
        journal = null;
    }

    /**
     * Rimuove le voci inserite dopo l'ultimo checkpoint.
     */
    public void rollback() {
        if (journal == null) {
            throw new IllegalStateException("Nessun checkpoint attivo nella cache di equivalenza");
        }
        journal.forEach(entries::remove);
        LOGGER.fine(() -> "Cache: annullate " + journal.size() + " voci");
        journal = null;
    }

    //endregion
}
