package org.tel.support;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.IntFunction;
import java.util.stream.Collectors;

/**
 * REGOLA GROUND - Regola proposizionale passata al motore di risoluzione
 *
 * Forma: h :- p1, ..., pm, not n1, ..., not nk.
 * Testa vuota = vincolo di integrità, corpo vuoto = fatto.
 *
 * I letterali sono interi con segno sugli identificativi degli atomi
 * ({@link AtomRegistry}): positivo = atomo, negativo = negazione per default.
 * Le liste contengono sempre identificativi di atomi (positivi).
 *
 * @param head atomi della testa (disgiunzione; al più uno per le regole prodotte dal traduttore)
 * @param positiveBody atomi del corpo positivo
 * @param negativeBody atomi del corpo negato
 */
public record GroundRule(List<Integer> head, List<Integer> positiveBody, List<Integer> negativeBody) {

    public GroundRule {
        head = List.copyOf(head);
        positiveBody = List.copyOf(positiveBody);
        negativeBody = List.copyOf(negativeBody);
        for (int atom : head) {
            if (atom <= 0) {
                throw new IllegalArgumentException("La testa contiene solo atomi positivi: " + atom);
            }
        }
    }

    //region FACTORY CON SEMPLIFICAZIONE

    /**
     * Regola definitoria "head :- body" semplificata rispetto alle costanti.
     *
     * Il letterale vero viene rimosso dal corpo; se il corpo contiene il letterale
     * falso, o un atomo insieme alla sua negazione, la regola non può mai
     * applicarsi e non viene prodotta.
     *
     * @param head atomo definito (positivo)
     * @param signedBody letterali con segno del corpo
     * @return la regola, oppure vuoto se la regola è banalmente inapplicabile
     */
    public static Optional<GroundRule> definition(int head, int... signedBody) {
        if (head <= 0) {
            throw new IllegalArgumentException("Atomo di testa non valido: " + head);
        }
        return build(List.of(head), signedBody);
    }

    /**
     * Vincolo di integrità ":- body" semplificato come {@link #definition}.
     */
    public static Optional<GroundRule> constraint(int... signedBody) {
        return build(List.of(), signedBody);
    }

    public static GroundRule fact(int head) {
        return new GroundRule(List.of(head), List.of(), List.of());
    }

    private static Optional<GroundRule> build(List<Integer> head, int... signedBody) {
        Set<Integer> literals = new LinkedHashSet<>();
        for (int literal : signedBody) {
            if (literal == AtomRegistry.FALSE) {
                return Optional.empty();
            }
            if (literal == AtomRegistry.TRUE) {
                continue;
            }
            if (literals.contains(-literal)) {
                return Optional.empty();
            }
            literals.add(literal);
        }

        List<Integer> positive = new ArrayList<>();
        List<Integer> negative = new ArrayList<>();
        for (int literal : literals) {
            if (literal > 0) {
                positive.add(literal);
            } else {
                negative.add(-literal);
            }
        }
        return Optional.of(new GroundRule(head, positive, negative));
    }

    //endregion

    //region INTERROGAZIONE

    public boolean isConstraint() {
        return head.isEmpty();
    }

    public boolean isFact() {
        return !head.isEmpty() && positiveBody.isEmpty() && negativeBody.isEmpty();
    }

    /**
     * Letterali del corpo con segno, nell'ordine positivi poi negati.
     */
    public int[] signedBody() {
        int[] body = new int[positiveBody.size() + negativeBody.size()];
        int i = 0;
        for (int atom : positiveBody) {
            body[i++] = atom;
        }
        for (int atom : negativeBody) {
            body[i++] = -atom;
        }
        return body;
    }

    //endregion

    //region RAPPRESENTAZIONE

    /**
     * Rende la regola in sintassi ASP usando i simboli forniti per ogni atomo.
     */
    public String render(IntFunction<String> symbols) {
        String headText = head.stream().map(symbols::apply).collect(Collectors.joining("; "));

        List<String> body = new ArrayList<>();
        positiveBody.forEach(atom -> body.add(symbols.apply(atom)));
        negativeBody.forEach(atom -> body.add("not " + symbols.apply(atom)));

        if (body.isEmpty()) {
            return isConstraint() ? ":- #true." : headText + ".";
        }
        return (isConstraint() ? ":- " : headText + " :- ") + String.join(", ", body) + ".";
    }

    @Override
    public String toString() {
        return render(Integer::toString);
    }

    //endregion
}
