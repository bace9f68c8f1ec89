package org.tel.translation;

import org.tel.formula.Formula;
import org.tel.formula.PathExpression;
import org.tel.support.AtomRegistry;
import org.tel.support.CarrierTable;
import org.tel.support.EquivalenceCache;
import org.tel.support.GroundRule;
import org.tel.support.StepContext;
import org.tel.support.StepReference;

import java.util.List;
import java.util.logging.Logger;

/**
 * MOTORE DI TRADUZIONE - Compilatore ricorsivo da formule modali a regole ground
 *
 * Data una formula e un contesto di passo restituisce un letterale che la denota
 * ed emette le regole che lo definiscono, sullo stile della trasformazione di
 * Tseitin: ogni sottoformula composta riceve un atomo ausiliario definito da
 * regole normali, stratificate e acicliche.
 *
 * REGOLE DEFINITORIE (x è l'atomo della formula al passo s):
 * - a & b:   x :- a, b.
 * - a | b:   x :- a.  x :- b.
 * - a -> b:  x :- not a.  x :- b.
 * - a <> b:  x :- a, b.  x :- not a, not b.
 * - ~a:      nessuna regola, condivide il letterale negato di a
 * - a >? b:  x :- b.  x :- a, N.   con N = (> (a >? b)) al passo s
 * - a >* b:  x :- b, a.  x :- b, N.   con N = (>: (a >* b)) al passo s
 * - a <? b:  c :- b.  c :- a, c'.  con c' portatore al passo s-1
 * - a <* b:  v :- not b.  v :- not a, v'.  e la formula denota not v
 *
 * Ogni regola fa riferimento solo al passo corrente, al precedente o al
 * successivo, così i passi successivi possono essere srotolati senza rivisitare
 * quelli già emessi. I riferimenti a passi non ancora srotolati diventano
 * esterni di frontiera consegnati all'{@link ObligationSink}.
 *
 * I portatori sono riservati agli operatori passati e alle eventualità richieste
 * da una formula di stadio: until, release e la stella dei cammini, quando
 * compaiono dentro una formula, si definiscono tramite la continuazione al passo
 * successivo.
 *
 * PROFONDITÀ:
 * Una formula di punto fisso tradotta per la prima volta lontano dal bordo della
 * finestra (un operatore passato all'ultimo passo, un until a un passo già
 * superato) non scende ricorsivamente passo per passo: la catena viene prima
 * tradotta in modo iterativo a partire dal passo più vicino già in cache.
 *
 * CONTESTO DI RICHIESTA:
 * Le formule degli stadi sono richieste con {@link #require}: le congiunzioni si
 * separano, ">* f" richiede f e si ripropone al passo successivo senza alcun
 * portatore, ">? f" apre una catena di portatori chiusa da un vincolo alla fine
 * dell'orizzonte, ogni altra formula produce il vincolo ":- not x".
 */
public class TranslationEngine {

    private static final Logger LOGGER = Logger.getLogger(TranslationEngine.class.getName());

    private final AtomRegistry atoms = new AtomRegistry();
    private final EquivalenceCache cache = new EquivalenceCache();
    private final CarrierTable carriers = new CarrierTable();
    private final ObligationSink sink;

    /**
     * @param sink destinatario degli obblighi verso i passi futuri
     */
    public TranslationEngine(ObligationSink sink) {
        if (sink == null) {
            throw new IllegalArgumentException("Destinatario degli obblighi non può essere null");
        }
        this.sink = sink;
    }

    //region CONTESTO LETTERALE

    /**
     * Traduce la formula al passo del contesto.
     *
     * @param formula formula ground da tradurre
     * @param context passo, stadio e stato dell'orizzonte
     * @param out regole prodotte dalla traduzione (solo quelle nuove)
     * @return letterale con segno che denota la formula
     * @throws MalformedPathExpressionException se un cammino non è in forma normale
     * @throws StageViolationException se lo stadio non consente un riferimento al futuro
     */
    public int translate(Formula formula, StepContext context, List<GroundRule> out) {
        if (formula == null) {
            throw new IllegalArgumentException("Formula da tradurre non può essere null");
        }

        switch (formula.type()) {
            case ATOM:
                return atoms.atom(formula, context.step());
            case TRUE:
                return AtomRegistry.TRUE;
            case FALSE:
                return AtomRegistry.FALSE;
            case INITIAL:
                return context.step() == 0 ? AtomRegistry.TRUE : AtomRegistry.FALSE;
            case NOT:
                return -translate(formula.operand(), context, out);
            default:
                break;
        }

        Integer cached = cache.lookup(formula, context.step());
        if (cached != null) {
            return cached;
        }

        LOGGER.finest(() -> "Traduzione di " + formula + " @" + context.step());

        return switch (formula.type()) {
            case AND, OR, IMPLIES, IMPLIED_BY, IFF -> translateConnective(formula, context, out);
            case PREVIOUS, WEAK_PREVIOUS -> translatePrevious(formula, context, out);
            case INITIALLY -> share(formula, context, translate(formula.operand(), context.atStep(0), out));
            case NEXT, WEAK_NEXT -> translateNext(formula, context, out);
            case FINAL -> translateFinal(formula, context, out);
            case SINCE -> translateSince(formula, context, out);
            case TRIGGER -> translateTrigger(formula, context, out);
            case UNTIL -> translateUntil(formula, context, out);
            case RELEASE -> translateRelease(formula, context, out);
            case BOX, DIAMOND -> translateDynamic(formula, context, out);
            default -> throw new IllegalStateException("Tipo di formula non gestito: " + formula.type());
        };
    }

    private int translateConnective(Formula formula, StepContext context, List<GroundRule> out) {
        int l = translate(formula.left(), context, out);
        int r = translate(formula.right(), context, out);

        return switch (formula.type()) {
            case AND -> define(formula, context, out, new int[]{l, r});
            case OR -> define(formula, context, out, new int[]{l}, new int[]{r});
            case IMPLIES -> define(formula, context, out, new int[]{-l}, new int[]{r});
            case IMPLIED_BY -> define(formula, context, out, new int[]{l}, new int[]{-r});
            default -> define(formula, context, out, new int[]{l, r}, new int[]{-l, -r});
        };
    }

    //endregion

    //region OPERATORI PASSATI

    private int translatePrevious(Formula formula, StepContext context, List<GroundRule> out) {
        StepReference reference = context.resolve(-1);
        if (reference.window() == StepReference.Window.BEFORE_INITIAL) {
            // Il passo 0 non ha predecessori: < è falso, <: è vero
            boolean weak = formula.type() == Formula.Type.WEAK_PREVIOUS;
            return share(formula, context, weak ? AtomRegistry.TRUE : AtomRegistry.FALSE);
        }
        int literal = translate(formula.operand(), context.atStep(reference.target()), out);
        return share(formula, context, literal);
    }

    private int translateSince(Formula formula, StepContext context, List<GroundRule> out) {
        fillPastChain(formula, context, out);
        int r = translate(formula.right(), context, out);
        int l = formula.left() == null ? AtomRegistry.TRUE : translate(formula.left(), context, out);
        int previous = previousCarrier(formula, context, out);

        EquivalenceCache.Entry entry = cache.getOrCreate(formula, context.step(),
                () -> atoms.auxiliary(AtomRegistry.Kind.CARRIER));
        if (entry.isNew()) {
            int carrier = entry.literal();
            GroundRule.definition(carrier, r).ifPresent(out::add);
            GroundRule.definition(carrier, l, previous).ifPresent(out::add);
            carriers.record(formula, 0, context.step(), carrier);
        }
        return entry.literal();
    }

    /**
     * Il portatore di trigger accumula le violazioni: la formula denota la sua negazione.
     */
    private int translateTrigger(Formula formula, StepContext context, List<GroundRule> out) {
        fillPastChain(formula, context, out);
        int r = translate(formula.right(), context, out);
        int l = formula.left() == null ? AtomRegistry.FALSE : translate(formula.left(), context, out);
        int previousViolation = -previousCarrier(formula, context, out);

        EquivalenceCache.Entry entry = cache.getOrCreate(formula, context.step(),
                () -> -atoms.auxiliary(AtomRegistry.Kind.CARRIER));
        if (entry.isNew()) {
            int violation = -entry.literal();
            GroundRule.definition(violation, -r).ifPresent(out::add);
            GroundRule.definition(violation, -l, previousViolation).ifPresent(out::add);
            carriers.record(formula, 0, context.step(), violation);
        }
        return entry.literal();
    }

    /**
     * Letterale della stessa formula al passo precedente; prima del passo 0 vale il
     * caso base del punto fisso (since falso, trigger vero).
     */
    private int previousCarrier(Formula formula, StepContext context, List<GroundRule> out) {
        StepReference reference = context.resolve(-1);
        if (reference.window() == StepReference.Window.BEFORE_INITIAL) {
            return formula.type() == Formula.Type.TRIGGER ? AtomRegistry.TRUE : AtomRegistry.FALSE;
        }
        return translate(formula, context.atStep(reference.target()), out);
    }

    /**
     * Traduce la catena del punto fisso passato dal primo passo mancante fino al
     * passo precedente a quello del contesto, in ordine crescente: ogni passo trova
     * già in cache il proprio predecessore.
     */
    private void fillPastChain(Formula formula, StepContext context, List<GroundRule> out) {
        for (int step = carriers.lastStep(formula, 0) + 1; step < context.step(); step++) {
            translate(formula, context.atStep(step), out);
        }
    }

    //endregion

    //region OPERATORI FUTURI

    private int translateNext(Formula formula, StepContext context, List<GroundRule> out) {
        boolean weak = formula.type() == Formula.Type.WEAK_NEXT;
        StepReference reference = context.resolve(1);

        switch (reference.window()) {
            case IN_WINDOW:
                return share(formula, context, translate(formula.operand(), context.atStep(reference.target()), out));
            case BEYOND_FINAL:
                return share(formula, context, weak ? AtomRegistry.TRUE : AtomRegistry.FALSE);
            case BEYOND_HORIZON:
                EquivalenceCache.Entry entry = cache.getOrCreate(formula, context.step(),
                        () -> atoms.auxiliary(AtomRegistry.Kind.EXTERNAL));
                if (entry.isNew()) {
                    sink.openExternal(entry.literal(), formula.operand(), weak,
                            context.step(), reference.target(), context.stage());
                }
                return entry.literal();
            case STAGE_FORBIDDEN:
                throw new StageViolationException(formula, context.stage());
            default:
                throw new IllegalStateException("Riferimento futuro inatteso: " + reference);
        }
    }

    /**
     * &final è falso prima dell'ultimo passo srotolato, vero all'ultimo passo di
     * un orizzonte chiuso, e alla frontiera aperta equivale a >: &false.
     */
    private int translateFinal(Formula formula, StepContext context, List<GroundRule> out) {
        if (context.step() < context.horizon()) {
            return share(formula, context, AtomRegistry.FALSE);
        }
        if (context.isFinalStep()) {
            return share(formula, context, AtomRegistry.TRUE);
        }
        return share(formula, context, translate(Formula.weakNext(Formula.FALSE), context, out));
    }

    private int translateUntil(Formula formula, StepContext context, List<GroundRule> out) {
        fillFutureChain(formula, context, out);
        int r = translate(formula.right(), context, out);
        int l = formula.left() == null ? AtomRegistry.TRUE : translate(formula.left(), context, out);
        int continuation = translate(Formula.next(formula), context, out);
        return define(formula, context, out, new int[]{r}, new int[]{l, continuation});
    }

    private int translateRelease(Formula formula, StepContext context, List<GroundRule> out) {
        fillFutureChain(formula, context, out);
        int r = translate(formula.right(), context, out);
        int l = formula.left() == null ? AtomRegistry.FALSE : translate(formula.left(), context, out);
        int continuation = translate(Formula.weakNext(formula), context, out);
        return define(formula, context, out, new int[]{r, l}, new int[]{r, continuation});
    }

    /**
     * Duale di {@link #fillPastChain}: traduce la formula nei passi successivi già
     * srotolati, dall'ultimo non ancora in cache all'indietro, così la
     * continuazione al passo del contesto trova il passo seguente già definito.
     */
    private void fillFutureChain(Formula formula, StepContext context, List<GroundRule> out) {
        if (context.resolve(1).window() != StepReference.Window.IN_WINDOW) {
            return;
        }
        int firstCached = context.step() + 1;
        while (firstCached <= context.horizon() && !cache.contains(formula, firstCached)) {
            firstCached++;
        }
        for (int step = firstCached - 1; step > context.step(); step--) {
            translate(formula, context.atStep(step), out);
        }
    }

    //endregion

    //region OPERATORI DINAMICI

    private int translateDynamic(Formula formula, StepContext context, List<GroundRule> out) {
        if (!formula.path().isNormalForm()) {
            throw new MalformedPathExpressionException(formula, formula.path());
        }
        if (formula.path().type() == PathExpression.Type.STAR) {
            fillFutureChain(formula, context, out);
        }
        return share(formula, context, translate(expand(formula), context, out));
    }

    /**
     * Riscrive un operatore dinamico secondo la struttura del suo cammino.
     *
     * La stella si espande in un punto fisso sullo stesso operatore: il corpo
     * consuma almeno un passo, quindi la ricorsione raggiunge il passo successivo
     * tramite un next e termina alla frontiera.
     *
     * @param dynamic formula BOX o DIAMOND
     * @return formula equivalente con il cammino esterno eliminato
     */
    public static Formula expand(Formula dynamic) {
        boolean box = dynamic.type() == Formula.Type.BOX;
        PathExpression path = dynamic.path();
        Formula operand = dynamic.operand();

        return switch (path.type()) {
            case STEP -> box ? Formula.weakNext(operand) : Formula.next(operand);
            case TEST -> box ? Formula.implies(path.test(), operand) : Formula.and(path.test(), operand);
            case SEQUENCE -> modal(box, path.left(), modal(box, path.right(), operand));
            case CHOICE -> box
                    ? Formula.and(modal(true, path.left(), operand), modal(true, path.right(), operand))
                    : Formula.or(modal(false, path.left(), operand), modal(false, path.right(), operand));
            case STAR -> box
                    ? Formula.and(operand, modal(true, path.right(), dynamic))
                    : Formula.or(operand, modal(false, path.right(), dynamic));
        };
    }

    private static Formula modal(boolean box, PathExpression path, Formula operand) {
        return box ? Formula.box(path, operand) : Formula.diamond(path, operand);
    }

    //endregion

    //region CONTESTO DI RICHIESTA

    /**
     * Impone che la formula valga al passo del contesto.
     *
     * @param formula formula richiesta (tipicamente di uno stadio del programma)
     * @param context passo, stadio e stato dell'orizzonte
     * @param out regole prodotte
     */
    public void require(Formula formula, StepContext context, List<GroundRule> out) {
        if (formula.type() == Formula.Type.TRUE) {
            return;
        }
        if (formula.type() == Formula.Type.AND) {
            require(formula.left(), context, out);
            require(formula.right(), context, out);
            return;
        }
        if (formula.type() == Formula.Type.RELEASE && formula.left() == null) {
            requireAlways(formula, context, out);
            return;
        }
        if (formula.type() == Formula.Type.UNTIL && formula.left() == null && !context.isClosed()) {
            requireEventually(formula, context, out);
            return;
        }

        int literal = translate(formula, context, out);
        GroundRule.constraint(-literal).ifPresent(out::add);
    }

    /**
     * ">* f" richiesto: f vale ora e ">* f" vale al passo successivo, se esiste.
     */
    private void requireAlways(Formula formula, StepContext context, List<GroundRule> out) {
        StepContext current = context;
        while (true) {
            StepReference reference = current.resolve(1);
            if (reference.window() == StepReference.Window.STAGE_FORBIDDEN) {
                throw new StageViolationException(formula, current.stage());
            }

            require(formula.operand(), current, out);

            if (reference.window() != StepReference.Window.IN_WINDOW) {
                if (reference.window() == StepReference.Window.BEYOND_HORIZON) {
                    sink.deferRequirement(formula, current.stage(), reference.target());
                } else {
                    int last = current.step();
                    LOGGER.finest(() -> "Nessun passo dopo " + last + " per " + formula);
                }
                return;
            }
            current = current.atStep(reference.target());
        }
    }

    /**
     * ">? f" richiesto: apre una catena di portatori ancorata al passo corrente.
     * Il portatore all'ultimo passo dovrà essere vero alla chiusura.
     */
    private void requireEventually(Formula formula, StepContext context, List<GroundRule> out) {
        int anchor = context.step();
        if (carriers.contains(formula, anchor)) {
            return;
        }

        int witness = translate(formula.operand(), context, out);
        int carrier = atoms.auxiliary(AtomRegistry.Kind.CARRIER);
        GroundRule.definition(carrier, witness).ifPresent(out::add);
        carriers.record(formula, anchor, anchor, carrier);

        for (int step = anchor + 1; step <= context.horizon(); step++) {
            advanceEventuality(formula, anchor, context.atStep(step), out);
        }
        sink.anchorEventuality(formula, context.stage(), anchor);
    }

    /**
     * Estende una catena di eventualità al passo del contesto:
     * c_k :- c_{k-1}.  c_k :- f_k.
     *
     * @return il portatore al nuovo passo
     * @throws IllegalStateException se la catena non arriva al passo precedente
     */
    public int advanceEventuality(Formula eventuality, int anchor, StepContext context, List<GroundRule> out) {
        Integer previous = carriers.carrier(eventuality, anchor, context.step() - 1);
        if (previous == null) {
            throw new IllegalStateException("Catena di " + eventuality + " ancorata a " + anchor
                    + " interrotta prima del passo " + context.step());
        }

        int witness = translate(eventuality.operand(), context, out);
        int carrier = atoms.auxiliary(AtomRegistry.Kind.CARRIER);
        GroundRule.definition(carrier, previous).ifPresent(out::add);
        GroundRule.definition(carrier, witness).ifPresent(out::add);
        carriers.record(eventuality, anchor, context.step(), carrier);
        return carrier;
    }

    /**
     * Chiude una catena di eventualità: il portatore all'ultimo passo deve valere.
     */
    public void closeEventuality(Formula eventuality, int anchor, int finalStep, List<GroundRule> out) {
        Integer carrier = carriers.carrier(eventuality, anchor, finalStep);
        if (carrier == null) {
            throw new IllegalStateException("Catena di " + eventuality + " ancorata a " + anchor
                    + " non raggiunge il passo finale " + finalStep);
        }
        GroundRule.constraint(-carrier).ifPresent(out::add);
    }

    /**
     * Lega un esterno di frontiera al letterale reale dell'operando: X :- L.
     *
     * @param context contesto del passo bersaglio, ora srotolato
     * @return il letterale dell'operando al passo bersaglio
     */
    public int bindExternal(int external, Formula operand, StepContext context, List<GroundRule> out) {
        int literal = translate(operand, context, out);
        GroundRule.definition(external, literal).ifPresent(out::add);
        return literal;
    }

    //endregion

    //region ALLOCAZIONE E CONDIVISIONE

    /**
     * Alloca l'atomo ausiliario della formula e, se nuovo, emette una regola per
     * ciascun corpo.
     */
    private int define(Formula formula, StepContext context, List<GroundRule> out, int[]... bodies) {
        EquivalenceCache.Entry entry = cache.getOrCreate(formula, context.step(),
                () -> atoms.auxiliary(AtomRegistry.Kind.AUXILIARY));
        if (entry.isNew()) {
            for (int[] body : bodies) {
                GroundRule.definition(entry.literal(), body).ifPresent(out::add);
            }
        }
        return entry.literal();
    }

    /**
     * Associa alla formula un letterale già esistente, senza nuove regole.
     */
    private int share(Formula formula, StepContext context, int literal) {
        return cache.getOrCreate(formula, context.step(), () -> literal).literal();
    }

    //endregion

    //region STATO E TRANSAZIONI

    public AtomRegistry atoms() {
        return atoms;
    }

    public EquivalenceCache cache() {
        return cache;
    }

    public CarrierTable carriers() {
        return carriers;
    }

    public void checkpoint() {
        atoms.checkpoint();
        cache.checkpoint();
        carriers.checkpoint();
    }

    public void commit() {
        atoms.commit();
        cache.commit();
        carriers.commit();
    }

    public void rollback() {
        atoms.rollback();
        cache.rollback();
        carriers.rollback();
        LOGGER.fine("Traduzione annullata: stato riportato all'ultimo checkpoint");
    }

    //endregion
}
