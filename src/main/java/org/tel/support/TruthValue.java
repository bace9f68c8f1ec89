package org.tel.support;

/**
 * Dominio di verità degli esterni di frontiera.
 *
 * I letterali derivati ordinari sono sempre a due valori: solo gli esterni che
 * rappresentano obblighi oltre l'orizzonte possono assumere FREE.
 */
public enum TruthValue {
    TRUE,
    FALSE,
    FREE;   // non ancora vincolato: il risolutore può scegliere

    public boolean isFree() {
        return this == FREE;
    }
}
