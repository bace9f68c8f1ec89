package org.tel.support;

/**
 * Stadi del programma temporale: stabiliscono a quali passi si applica una formula.
 */
public enum Stage {
    INITIAL,    // solo il passo 0
    DYNAMIC,    // tutti i passi > 0
    ALWAYS,     // tutti i passi
    FINAL;      // solo l'ultimo passo dell'orizzonte chiuso

    /**
     * Verifica se lo stadio si applica al passo indicato durante l'estensione
     * dell'orizzonte. Lo stadio FINAL non si applica mai qui: viene tradotto
     * soltanto alla chiusura.
     *
     * @param step indice del passo (>= 0)
     * @return true se le formule dello stadio vanno tradotte al passo
     */
    public boolean appliesTo(int step) {
        return switch (this) {
            case INITIAL -> step == 0;
            case DYNAMIC -> step > 0;
            case ALWAYS -> true;
            case FINAL -> false;
        };
    }

    /**
     * Solo le formule dello stadio finale non possono riferirsi al futuro:
     * dopo l'ultimo passo non esiste alcuno stato.
     */
    public boolean licensesFuture() {
        return this != FINAL;
    }

    /**
     * Converte il nome testuale (con o senza '#') nello stadio corrispondente.
     *
     * @throws IllegalArgumentException se il nome non corrisponde ad alcuno stadio
     */
    public static Stage fromName(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Nome stadio null");
        }
        String normalized = name.startsWith("#") ? name.substring(1) : name;
        for (Stage stage : values()) {
            if (stage.name().equalsIgnoreCase(normalized.trim())) {
                return stage;
            }
        }
        throw new IllegalArgumentException("Stadio sconosciuto: " + name);
    }
}
