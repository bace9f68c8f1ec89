package org.tel.support;

/**
 * Esito della risoluzione di un riferimento relativo da parte di {@link StepContext}.
 *
 * @param target passo bersaglio (saturato a 0 per i riferimenti prima dell'inizio)
 * @param window posizione del bersaglio rispetto alla finestra dei passi srotolati
 */
public record StepReference(int target, Window window) {

    public enum Window {
        IN_WINDOW,          // il passo esiste già
        BEFORE_INITIAL,     // riferimento passato oltre il passo 0: saturato
        BEYOND_HORIZON,     // passo futuro non ancora srotolato, orizzonte aperto
        BEYOND_FINAL,       // passo futuro che non esisterà mai: orizzonte chiuso
        STAGE_FORBIDDEN     // lo stadio non consente di riferirsi al futuro
    }

    public boolean isAvailable() {
        return window == Window.IN_WINDOW;
    }
}
