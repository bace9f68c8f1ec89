package org.tel.formula;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Termine ground usato come argomento di una proposizione atomica.
 *
 * I numeri sono conservati nella loro forma canonica (senza zeri iniziali),
 * quindi due termini scritti in modo diverso ma con lo stesso significato
 * risultano uguali e producono la stessa chiave nella cache di equivalenza.
 *
 * @param name nome del simbolo, del numero o della stringa (con apici)
 * @param arguments argomenti del termine funzionale, vuoti per le costanti
 */
public record Term(String name, List<Term> arguments) {

    public Term {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Nome del termine non può essere null o vuoto");
        }
        name = name.trim();
        arguments = arguments == null ? List.of() : List.copyOf(arguments);
    }

    /**
     * Costante simbolica o stringa.
     */
    public static Term symbol(String name) {
        return new Term(name, List.of());
    }

    /**
     * Costante numerica in forma canonica.
     */
    public static Term number(long value) {
        return new Term(Long.toString(value), List.of());
    }

    /**
     * Termine funzionale f(t1,...,tn).
     */
    public static Term function(String name, List<Term> arguments) {
        return new Term(name, arguments);
    }

    @Override
    public String toString() {
        if (arguments.isEmpty()) {
            return name;
        }
        return name + arguments.stream().map(Term::toString).collect(Collectors.joining(",", "(", ")"));
    }
}
