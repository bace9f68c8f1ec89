package org.tel.translation;

/**
 * Errore fatale di traduzione: interrompe l'estensione dell'orizzonte in corso,
 * che viene annullata senza consegnare regole parziali.
 */
public class TranslationException extends RuntimeException {

    public TranslationException(String message) {
        super(message);
    }

    public TranslationException(String message, Throwable cause) {
        super(message, cause);
    }
}
