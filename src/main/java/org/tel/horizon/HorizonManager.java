package org.tel.horizon;

import org.tel.formula.Formula;
import org.tel.formula.PathExpression;
import org.tel.formula.StagedProgram;
import org.tel.support.AtomRegistry;
import org.tel.support.GroundRule;
import org.tel.support.Stage;
import org.tel.support.Step;
import org.tel.support.StepContext;
import org.tel.support.TruthValue;
import org.tel.translation.MalformedPathExpressionException;
import org.tel.translation.ObligationSink;
import org.tel.translation.StageViolationException;
import org.tel.translation.TranslationEngine;
import org.tel.translation.TranslationException;
import org.tel.translation.UnresolvedExternalException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * GESTORE DELL'ORIZZONTE - Srotolamento incrementale di un programma temporale
 *
 * Coordina la traduzione passo per passo di un {@link StagedProgram}: a ogni
 * estensione traduce le formule degli stadi che si applicano al nuovo passo,
 * risolve gli obblighi futuri che lo avevano come bersaglio ed estende le catene
 * di portatori delle eventualità richieste.
 *
 * STATO MANTENUTO TRA I PASSI:
 * - Esterni di frontiera e obblighi pendenti, indicizzati per passo bersaglio
 * - Richieste differite (">* f" da richiedere di nuovo al passo successivo)
 * - Catene di eventualità da estendere e chiudere con un vincolo finale
 * - Regole emesse per ogni passo, mai modificate dopo l'emissione
 *
 * ATOMICITÀ:
 * Ogni operazione pubblica è una transazione. Gli impegni prodotti durante la
 * traduzione vengono accumulati in una transazione e applicati solo al termine;
 * se la traduzione fallisce, con una {@link TranslationException} o con
 * qualunque altro errore, il motore viene riportato al checkpoint e nessuna
 * regola del passo viene consegnata.
 *
 * CHIUSURA:
 * {@link #markFinal(int)} traduce lo stadio finale all'ultimo passo e fissa gli
 * obblighi rimasti aperti: un next forte diventa falso, un next debole vero.
 * Dopo la chiusura l'orizzonte non può più crescere.
 */
public class HorizonManager {

    private static final Logger LOGGER = Logger.getLogger(HorizonManager.class.getName());

    /** Catena di portatori di un'eventualità richiesta, ancorata al passo in cui è nata */
    private record Eventuality(Formula formula, Stage stage, int anchor) {
    }

    private final StagedProgram program;
    private final TranslationEngine engine;
    private final TranslationStatistics statistics = new TranslationStatistics();

    //region STATO DELL'ORIZZONTE

    private final List<Step> steps = new ArrayList<>();
    private final List<List<GroundRule>> rulesByStep = new ArrayList<>();
    private final List<GroundRule> finalRules = new ArrayList<>();
    private final List<GroundRule> supplementaryRules = new ArrayList<>();

    private final Map<Integer, BoundaryExternal> externals = new LinkedHashMap<>();
    private final Map<Integer, List<PendingObligation>> pendingByTarget = new HashMap<>();
    private final Map<Integer, Map<Formula, Stage>> deferredByTarget = new HashMap<>();
    private final List<Eventuality> eventualities = new ArrayList<>();

    private boolean closed = false;
    private Transaction transaction;

    //endregion

    /**
     * @param program formule ground raggruppate per stadio
     * @throws IllegalArgumentException se il programma è null
     */
    public HorizonManager(StagedProgram program) {
        if (program == null) {
            throw new IllegalArgumentException("Programma non può essere null");
        }
        this.program = program;
        this.engine = new TranslationEngine(new Frontier());
    }

    //region ESTENSIONE DELL'ORIZZONTE

    /**
     * Srotola il passo successivo.
     *
     * @return regole del nuovo passo ed esterni ancora aperti
     * @throws IllegalStateException se l'orizzonte è già stato chiuso
     * @throws TranslationException se una formula non è traducibile; l'orizzonte resta invariato
     */
    public HorizonExtension extendHorizon() {
        if (closed) {
            throw new IllegalStateException("Orizzonte chiuso al passo " + horizon() + ": impossibile estenderlo");
        }

        int step = steps.size();
        List<GroundRule> rules = new ArrayList<>();
        Transaction current = begin();

        try {
            // Obblighi che attendevano questo passo
            for (PendingObligation obligation : pendingByTarget.getOrDefault(step, List.of())) {
                StepContext context = new StepContext(step, obligation.stage(), step, false);
                int literal = engine.bindExternal(obligation.external(), obligation.operand(), context, rules);
                current.bindings.put(obligation.external(), literal);
            }

            for (Eventuality eventuality : eventualities) {
                StepContext context = new StepContext(step, eventuality.stage(), step, false);
                engine.advanceEventuality(eventuality.formula(), eventuality.anchor(), context, rules);
            }

            Map<Formula, Stage> requirements = new LinkedHashMap<>(deferredByTarget.getOrDefault(step, Map.of()));
            for (Stage stage : Stage.values()) {
                if (stage.appliesTo(step)) {
                    for (Formula formula : program.formulas(stage)) {
                        validate(formula, stage);
                        requirements.putIfAbsent(formula, stage);
                    }
                }
            }

            for (Map.Entry<Formula, Stage> requirement : requirements.entrySet()) {
                StepContext context = new StepContext(step, requirement.getValue(), step, false);
                engine.require(requirement.getKey(), context, rules);
            }
        } catch (RuntimeException | Error e) {
            abort(e, "estensione al passo " + step);
            throw e;
        }

        commit(current);
        steps.add(Step.of(step));
        rulesByStep.add(Collections.unmodifiableList(rules));
        pendingByTarget.remove(step);
        deferredByTarget.remove(step);

        statistics.incrementSteps();
        recordRules(rules);
        recordEngineState();

        Map<Integer, TruthValue> open = openExternals();
        LOGGER.info("Passo " + step + " srotolato: " + rules.size() + " regole, "
                + open.size() + " esterni aperti");
        return new HorizonExtension(step, rules, open);
    }

    /**
     * Chiude l'orizzonte all'ultimo passo srotolato.
     *
     * @param step indice dell'ultimo passo, deve coincidere con {@link #horizon()}
     * @return regole di chiusura (stadio finale e valori fissati degli obblighi)
     * @throws IllegalStateException se l'orizzonte è vuoto o già chiuso
     * @throws IllegalArgumentException se il passo non è l'ultimo srotolato
     * @throws TranslationException se lo stadio finale non è traducibile
     */
    public HorizonExtension markFinal(int step) {
        if (closed) {
            throw new IllegalStateException("Orizzonte già chiuso al passo " + horizon());
        }
        if (steps.isEmpty()) {
            throw new IllegalStateException("Impossibile chiudere un orizzonte senza passi");
        }
        if (step != horizon()) {
            throw new IllegalArgumentException("Il passo finale deve essere l'ultimo srotolato ("
                    + horizon() + "), ricevuto " + step);
        }

        List<GroundRule> rules = new ArrayList<>();
        Transaction current = begin();

        try {
            StepContext context = new StepContext(step, Stage.FINAL, step, true);
            for (Formula formula : program.formulas(Stage.FINAL)) {
                validate(formula, Stage.FINAL);
                engine.require(formula, context, rules);
            }

            // Nessun passo dopo l'ultimo: next forte falso, next debole vero
            for (PendingObligation obligation : pendingByTarget.getOrDefault(step + 1, List.of())) {
                if (obligation.weak()) {
                    rules.add(GroundRule.fact(obligation.external()));
                    current.fixes.put(obligation.external(), TruthValue.TRUE);
                } else {
                    GroundRule.constraint(obligation.external()).ifPresent(rules::add);
                    current.fixes.put(obligation.external(), TruthValue.FALSE);
                }
            }

            for (Eventuality eventuality : eventualities) {
                engine.closeEventuality(eventuality.formula(), eventuality.anchor(), step, rules);
            }

            for (BoundaryExternal external : externals.values()) {
                if (external.isOpen() && !current.fixes.containsKey(external.atom())) {
                    throw new UnresolvedExternalException(external.atom(), external.obligation().toString());
                }
            }
            if (!current.opened.isEmpty()) {
                PendingObligation leaked = current.opened.get(0);
                throw new UnresolvedExternalException(leaked.external(), leaked.toString());
            }
        } catch (RuntimeException | Error e) {
            abort(e, "chiusura al passo " + step);
            throw e;
        }

        commit(current);
        closed = true;
        steps.set(step, steps.get(step).withFinal());
        finalRules.addAll(rules);
        pendingByTarget.remove(step + 1);
        deferredByTarget.remove(step + 1);

        recordRules(rules);
        recordEngineState();
        statistics.stopTimer();

        LOGGER.info("Orizzonte chiuso al passo " + step + ": " + rules.size() + " regole di chiusura");
        return new HorizonExtension(step, rules, Map.of());
    }

    /**
     * Traduce una formula a un passo già srotolato, fuori dagli stadi del programma.
     * Gli obblighi futuri prodotti vengono registrati come per le formule degli stadi.
     *
     * @param formula formula ground
     * @param step passo nella finestra [0, horizon]
     * @return letterale della formula e regole nuove
     * @throws IllegalArgumentException se il passo non è stato srotolato
     */
    public TranslationResult translate(Formula formula, int step) {
        if (formula == null) {
            throw new IllegalArgumentException("Formula da tradurre non può essere null");
        }
        if (step < 0 || step > horizon()) {
            throw new IllegalArgumentException("Passo " + step + " non srotolato (orizzonte " + horizon() + ")");
        }

        List<GroundRule> rules = new ArrayList<>();
        Transaction current = begin();
        int literal;

        try {
            validate(formula, Stage.ALWAYS);
            literal = engine.translate(formula, new StepContext(step, Stage.ALWAYS, horizon(), closed), rules);
        } catch (RuntimeException | Error e) {
            abort(e, "traduzione puntuale al passo " + step);
            throw e;
        }

        commit(current);
        supplementaryRules.addAll(rules);
        recordRules(rules);
        recordEngineState();
        return new TranslationResult(literal, rules);
    }

    /**
     * Controlli preliminari: cammini in forma normale e nessun riferimento al
     * futuro dallo stadio finale.
     */
    private static void validate(Formula formula, Stage stage) {
        PathExpression malformed = formula.findMalformedPath();
        if (malformed != null) {
            throw new MalformedPathExpressionException(formula, malformed);
        }
        if (!stage.licensesFuture() && formula.referencesFuture()) {
            throw new StageViolationException(formula, stage);
        }
    }

    //endregion

    //region TRANSAZIONI

    /**
     * Impegni raccolti durante un'operazione, applicati solo se questa riesce.
     */
    private static final class Transaction {
        final List<PendingObligation> opened = new ArrayList<>();
        final Map<Integer, Map<Formula, Stage>> deferred = new HashMap<>();
        final List<Eventuality> anchored = new ArrayList<>();
        final Map<Integer, Integer> bindings = new LinkedHashMap<>();
        final Map<Integer, TruthValue> fixes = new LinkedHashMap<>();
    }

    private Transaction begin() {
        engine.checkpoint();
        transaction = new Transaction();
        return transaction;
    }

    private void commit(Transaction current) {
        engine.commit();

        for (PendingObligation obligation : current.opened) {
            externals.put(obligation.external(), new BoundaryExternal(obligation));
            pendingByTarget.computeIfAbsent(obligation.targetStep(), k -> new ArrayList<>()).add(obligation);
            statistics.incrementExternalsOpened();
        }
        current.deferred.forEach((target, formulas) -> {
            Map<Formula, Stage> existing = deferredByTarget.computeIfAbsent(target, k -> new LinkedHashMap<>());
            formulas.forEach(existing::putIfAbsent);
        });
        eventualities.addAll(current.anchored);

        current.bindings.forEach((atom, literal) -> {
            externals.get(atom).bind(literal);
            statistics.incrementExternalsBound();
        });
        current.fixes.forEach((atom, value) -> {
            externals.get(atom).fix(value);
            statistics.incrementExternalsFixed();
        });

        transaction = null;
    }

    private void abort(Throwable cause, String operation) {
        engine.rollback();
        transaction = null;
        statistics.incrementRollbacks();
        LOGGER.log(Level.WARNING, "Annullata " + operation + ": " + cause.getMessage(), cause);
    }

    /**
     * Riceve dal motore gli impegni verso i passi futuri e li accoda alla
     * transazione corrente.
     */
    private final class Frontier implements ObligationSink {

        @Override
        public void openExternal(int external, Formula operand, boolean weak,
                                 int sourceStep, int targetStep, Stage stage) {
            PendingObligation obligation = new PendingObligation(external, operand, weak, sourceStep, targetStep, stage);
            active().opened.add(obligation);
            LOGGER.fine(() -> "Nuovo esterno di frontiera " + external + ": " + obligation);
        }

        @Override
        public void deferRequirement(Formula formula, Stage stage, int targetStep) {
            active().deferred.computeIfAbsent(targetStep, k -> new LinkedHashMap<>()).putIfAbsent(formula, stage);
        }

        @Override
        public void anchorEventuality(Formula eventuality, Stage stage, int anchorStep) {
            active().anchored.add(new Eventuality(eventuality, stage, anchorStep));
            LOGGER.fine(() -> "Catena di portatori per " + eventuality + " ancorata al passo " + anchorStep);
        }

        private Transaction active() {
            if (transaction == null) {
                throw new IllegalStateException("Obbligo registrato fuori da un'operazione dell'orizzonte");
            }
            return transaction;
        }
    }

    //endregion

    //region STATISTICHE

    private void recordRules(List<GroundRule> rules) {
        int constraints = (int) rules.stream().filter(GroundRule::isConstraint).count();
        statistics.addRules(rules.size(), constraints);
    }

    private void recordEngineState() {
        AtomRegistry atoms = engine.atoms();
        int auxiliary = atoms.atoms(AtomRegistry.Kind.AUXILIARY).size()
                + atoms.atoms(AtomRegistry.Kind.CARRIER).size()
                + atoms.atoms(AtomRegistry.Kind.EXTERNAL).size();
        statistics.recordEngineState(atoms.size(), auxiliary, engine.carriers().size(),
                engine.cache().size(), engine.cache().hits(), engine.cache().misses());
    }

    //endregion

    //region INTERROGAZIONE

    /** Ultimo passo srotolato, -1 se nessun passo è stato srotolato. */
    public int horizon() {
        return steps.size() - 1;
    }

    public boolean isClosed() {
        return closed;
    }

    public Step step(int index) {
        return steps.get(index);
    }

    /**
     * Regole emesse quando il passo è stato srotolato, identiche a quelle restituite allora.
     */
    public List<GroundRule> rulesAt(int step) {
        if (step < 0 || step >= rulesByStep.size()) {
            throw new IllegalArgumentException("Passo non srotolato: " + step);
        }
        return rulesByStep.get(step);
    }

    /** Regole emesse da {@link #markFinal(int)}. */
    public List<GroundRule> finalRules() {
        return Collections.unmodifiableList(finalRules);
    }

    /** Regole emesse dalle traduzioni puntuali. */
    public List<GroundRule> supplementaryRules() {
        return Collections.unmodifiableList(supplementaryRules);
    }

    /**
     * Tutte le regole emesse finora: passi in ordine, traduzioni puntuali e chiusura.
     */
    public List<GroundRule> allRules() {
        List<GroundRule> all = new ArrayList<>();
        rulesByStep.forEach(all::addAll);
        all.addAll(supplementaryRules);
        all.addAll(finalRules);
        return all;
    }

    /**
     * Esterni ancora aperti, da passare al risolutore come liberi.
     */
    public Map<Integer, TruthValue> openExternals() {
        Map<Integer, TruthValue> open = new TreeMap<>();
        for (BoundaryExternal external : externals.values()) {
            if (external.isOpen()) {
                open.put(external.atom(), TruthValue.FREE);
            }
        }
        return open;
    }

    public BoundaryExternal external(int atom) {
        return externals.get(atom);
    }

    public Collection<BoundaryExternal> externals() {
        return Collections.unmodifiableCollection(externals.values());
    }

    public List<PendingObligation> pendingObligations() {
        List<PendingObligation> pending = new ArrayList<>();
        pendingByTarget.values().forEach(pending::addAll);
        return pending;
    }

    public AtomRegistry atoms() {
        return engine.atoms();
    }

    public TranslationEngine engine() {
        return engine;
    }

    public TranslationStatistics statistics() {
        return statistics;
    }

    public StagedProgram program() {
        return program;
    }

    //endregion
}
