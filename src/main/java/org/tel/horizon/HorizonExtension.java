package org.tel.horizon;

import org.tel.support.GroundRule;
import org.tel.support.TruthValue;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Risultato di un'estensione (o della chiusura) dell'orizzonte.
 *
 * @param step passo srotolato o chiuso
 * @param rules regole nuove prodotte da questa operazione
 * @param externals esterni ancora aperti dopo l'operazione, tutti FREE
 */
public record HorizonExtension(int step, List<GroundRule> rules, Map<Integer, TruthValue> externals) {

    public HorizonExtension {
        rules = List.copyOf(rules);
        externals = Collections.unmodifiableMap(new TreeMap<>(externals));
    }
}
