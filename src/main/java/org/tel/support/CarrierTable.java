package org.tel.support;

import org.tel.formula.Formula;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Tabella dei portatori di punto fisso.
 *
 * Ogni catena è identificata dalla formula e dal passo di ancoraggio: i portatori
 * degli operatori passati sono ancorati al passo 0, quelli delle eventualità
 * richieste al passo in cui la richiesta è nata. Per ogni passo della catena è
 * memorizzato il letterale del portatore, così il passo successivo può
 * riferirsi al precedente senza ricalcolarlo.
 */
public class CarrierTable {

    public record Chain(Formula formula, int anchor) {
    }

    private final Map<Chain, NavigableMap<Integer, Integer>> chains = new HashMap<>();

    private record Insertion(Chain chain, int step) {
    }

    /** Inserimenti dall'ultimo checkpoint, per il rollback */
    private List<Insertion> journal;

    private int size = 0;

    public void record(Formula formula, int anchor, int step, int carrier) {
        if (step < anchor) {
            throw new IllegalArgumentException("Passo " + step + " precede l'ancoraggio " + anchor);
        }
        Chain chain = new Chain(formula, anchor);
        NavigableMap<Integer, Integer> steps = chains.computeIfAbsent(chain, c -> new TreeMap<>());
        if (steps.containsKey(step)) {
            throw new IllegalStateException("Portatore già registrato per " + formula + " @" + step);
        }
        steps.put(step, carrier);
        size++;
        if (journal != null) {
            journal.add(new Insertion(chain, step));
        }
    }

    /**
     * @return il portatore della catena al passo indicato, oppure null
     */
    public Integer carrier(Formula formula, int anchor, int step) {
        NavigableMap<Integer, Integer> steps = chains.get(new Chain(formula, anchor));
        return steps == null ? null : steps.get(step);
    }

    /**
     * @return l'ultimo passo della catena, oppure -1 se la catena non esiste
     */
    public int lastStep(Formula formula, int anchor) {
        NavigableMap<Integer, Integer> steps = chains.get(new Chain(formula, anchor));
        return steps == null || steps.isEmpty() ? -1 : steps.lastKey();
    }

    public boolean contains(Formula formula, int anchor) {
        return chains.containsKey(new Chain(formula, anchor));
    }

    /** Numero totale di portatori allocati. */
    public int size() {
        return size;
    }

    public void checkpoint() {
        journal = new ArrayList<>();
    }

    public void commit() {
        journal = null;
    }

    public void rollback() {
        if (journal == null) {
            throw new IllegalStateException("Nessun checkpoint attivo nella tabella dei portatori");
        }
        for (Insertion insertion : journal) {
            NavigableMap<Integer, Integer> steps = chains.get(insertion.chain());
            steps.remove(insertion.step());
            if (steps.isEmpty()) {
                chains.remove(insertion.chain());
            }
            size--;
        }
        journal = null;
    }
}
