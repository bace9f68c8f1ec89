package org.tel.horizon;

import org.tel.support.GroundRule;

import java.util.List;

/**
 * Esito di una traduzione puntuale: il letterale della formula e le regole nuove.
 */
public record TranslationResult(int literal, List<GroundRule> rules) {

    public TranslationResult {
        rules = List.copyOf(rules);
    }
}
