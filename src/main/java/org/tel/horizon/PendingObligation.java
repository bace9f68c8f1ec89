package org.tel.horizon;

import org.tel.formula.Formula;
import org.tel.support.Stage;

/**
 * Riferimento futuro in attesa che il passo bersaglio venga srotolato.
 *
 * @param external atomo dell'esterno di frontiera che sostituisce il riferimento
 * @param operand formula da valutare al passo bersaglio
 * @param weak true per il next debole
 * @param sourceStep passo in cui il riferimento è stato tradotto
 * @param targetStep passo bersaglio
 * @param stage stadio della formula che ha prodotto l'obbligo
 */
public record PendingObligation(int external, Formula operand, boolean weak,
                                int sourceStep, int targetStep, Stage stage) {

    @Override
    public String toString() {
        return (weak ? ">:" : ">") + operand + " @" + sourceStep + " -> " + targetStep;
    }
}
