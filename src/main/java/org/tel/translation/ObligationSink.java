package org.tel.translation;

import org.tel.formula.Formula;
import org.tel.support.Stage;

/**
 * Destinatario degli impegni che la traduzione di un passo lascia ai passi futuri.
 *
 * Il motore di traduzione non conosce l'evoluzione dell'orizzonte: registra qui
 * ciò che potrà essere risolto solo quando un passo successivo verrà srotolato
 * o quando l'orizzonte verrà chiuso.
 */
public interface ObligationSink {

    /**
     * Un next oltre l'orizzonte aperto è stato sostituito da un esterno libero.
     *
     * @param external atomo esterno allocato
     * @param operand formula da valutare al passo bersaglio
     * @param weak true per il next debole (vero se il passo non esisterà mai)
     * @param sourceStep passo in cui il riferimento è stato tradotto
     * @param targetStep passo a cui l'obbligo si riferisce
     * @param stage stadio della formula che ha generato l'obbligo
     */
    void openExternal(int external, Formula operand, boolean weak, int sourceStep, int targetStep, Stage stage);

    /**
     * Una formula richiesta va richiesta di nuovo al passo indicato, non ancora srotolato.
     */
    void deferRequirement(Formula formula, Stage stage, int targetStep);

    /**
     * È nata una catena di portatori per un'eventualità richiesta: va estesa a
     * ogni nuovo passo e chiusa con un vincolo quando l'orizzonte si chiude.
     */
    void anchorEventuality(Formula eventuality, Stage stage, int anchorStep);
}
