package org.tel.support;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Valutatore di supporto ai test per i programmi prodotti dal traduttore.
 *
 * Le regole emesse sono normali, stratificate e acicliche: fissato il valore
 * degli atomi liberi (atomi del programma ed esterni aperti), ogni altro atomo è
 * vero se e solo se una delle sue regole ha il corpo soddisfatto. Il modello così
 * ottenuto è l'unico modello stabile per quella scelta; è accettato se rispetta
 * tutti i vincoli.
 */
public final class ProgramEvaluator {

    private final Map<Integer, List<GroundRule>> definitions = new HashMap<>();
    private final List<GroundRule> constraints = new ArrayList<>();

    public ProgramEvaluator(Collection<GroundRule> rules) {
        for (GroundRule rule : rules) {
            if (rule.isConstraint()) {
                constraints.add(rule);
            } else {
                for (int head : rule.head()) {
                    definitions.computeIfAbsent(head, k -> new ArrayList<>()).add(rule);
                }
            }
        }
    }

    /**
     * Atomi veri nel modello determinato dalla scelta sugli atomi liberi.
     *
     * @param free atomi il cui valore è scelto dall'esterno
     * @param chosen sottoinsieme di free scelto vero
     * @param atoms atomi di cui interessa il valore
     */
    public Set<Integer> model(Set<Integer> free, Set<Integer> chosen, Collection<Integer> atoms) {
        Evaluation evaluation = new Evaluation(free, chosen);
        Set<Integer> result = new HashSet<>();
        for (int atom : atoms) {
            if (evaluation.value(atom)) {
                result.add(atom);
            }
        }
        return result;
    }

    /**
     * @return true se il modello determinato dalla scelta rispetta tutti i vincoli
     */
    public boolean accepts(Set<Integer> free, Set<Integer> chosen) {
        Evaluation evaluation = new Evaluation(free, chosen);
        for (GroundRule constraint : constraints) {
            if (evaluation.body(constraint)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Valore di un letterale con segno per la scelta data.
     */
    public boolean holds(int literal, Set<Integer> free, Set<Integer> chosen) {
        boolean value = new Evaluation(free, chosen).value(Math.abs(literal));
        return literal > 0 == value;
    }

    /**
     * Tutte le scelte sugli atomi liberi accettate dal programma.
     */
    public List<Set<Integer>> acceptedChoices(List<Integer> free) {
        if (free.size() > 20) {
            throw new IllegalArgumentException("Troppi atomi liberi da enumerare: " + free.size());
        }
        Set<Integer> freeSet = new HashSet<>(free);
        List<Set<Integer>> accepted = new ArrayList<>();
        for (int mask = 0; mask < (1 << free.size()); mask++) {
            Set<Integer> chosen = new HashSet<>();
            for (int i = 0; i < free.size(); i++) {
                if ((mask & (1 << i)) != 0) {
                    chosen.add(free.get(i));
                }
            }
            if (accepts(freeSet, chosen)) {
                accepted.add(chosen);
            }
        }
        return accepted;
    }

    private final class Evaluation {
        private final Set<Integer> free;
        private final Set<Integer> chosen;
        private final Map<Integer, Boolean> memo = new HashMap<>();
        private final Set<Integer> visiting = new HashSet<>();

        Evaluation(Set<Integer> free, Set<Integer> chosen) {
            this.free = free;
            this.chosen = chosen;
        }

        boolean value(int atom) {
            if (free.contains(atom)) {
                return chosen.contains(atom);
            }
            Boolean known = memo.get(atom);
            if (known != null) {
                return known;
            }
            if (!visiting.add(atom)) {
                throw new IllegalStateException("Dipendenza ciclica sull'atomo " + atom);
            }
            boolean result = false;
            for (GroundRule rule : definitions.getOrDefault(atom, List.of())) {
                if (body(rule)) {
                    result = true;
                    break;
                }
            }
            visiting.remove(atom);
            memo.put(atom, result);
            return result;
        }

        boolean body(GroundRule rule) {
            for (int atom : rule.positiveBody()) {
                if (!value(atom)) {
                    return false;
                }
            }
            for (int atom : rule.negativeBody()) {
                if (value(atom)) {
                    return false;
                }
            }
            return true;
        }
    }
}
