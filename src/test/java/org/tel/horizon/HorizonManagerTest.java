package org.tel.horizon;

import org.junit.jupiter.api.Test;
import org.tel.formula.Formula;
import org.tel.formula.FormulaParser;
import org.tel.formula.PathExpression;
import org.tel.formula.StagedProgram;
import org.tel.support.AtomRegistry;
import org.tel.support.GroundRule;
import org.tel.support.ProgramEvaluator;
import org.tel.support.Stage;
import org.tel.support.TruthValue;
import org.tel.translation.MalformedPathExpressionException;
import org.tel.translation.StageViolationException;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test del gestore dell'orizzonte.
 *
 * Verifica:
 * - Richieste ">* f" tradotte senza atomi ausiliari né portatori
 * - Catene di eventualità estese passo per passo e chiuse con un vincolo
 * - Esterni di frontiera liberi, legati all'estensione e fissati alla chiusura
 * - Operatori dinamici su più passi
 * - Regole dei passi già emessi mai modificate
 * - Atomicità: un errore lascia l'orizzonte invariato
 */
public class HorizonManagerTest {

    private static final Formula A = Formula.atom("a");
    private static final Formula B = Formula.atom("b");

    //region SUPPORTO

    private static HorizonManager unroll(String source, int steps) {
        HorizonManager manager = new HorizonManager(FormulaParser.parseProgram(source));
        for (int i = 0; i < steps; i++) {
            manager.extendHorizon();
        }
        return manager;
    }

    /**
     * Atomi liberi per il risolutore: atomi del programma ed esterni ancora aperti.
     */
    private static List<Integer> freeAtoms(HorizonManager manager) {
        List<Integer> free = new ArrayList<>(manager.atoms().userAtoms());
        free.addAll(manager.openExternals().keySet());
        return free;
    }

    private static Set<Integer> atomsOf(HorizonManager manager, Formula atom, int... steps) {
        Set<Integer> result = new HashSet<>();
        for (int step : steps) {
            result.add(manager.atoms().atom(atom, step));
        }
        return result;
    }

    //endregion

    @Test
    public void testEmptyHorizon() {
        HorizonManager manager = new HorizonManager(new StagedProgram());
        assertEquals(-1, manager.horizon());
        assertFalse(manager.isClosed());
        assertThrows(IllegalStateException.class, () -> manager.markFinal(0));
        assertThrows(IllegalArgumentException.class, () -> manager.translate(A, 0));
        assertThrows(IllegalArgumentException.class, () -> new HorizonManager(null));
    }

    @Test
    public void testInitialAlwaysIsOneConstraint() {
        HorizonManager manager = new HorizonManager(FormulaParser.parseProgram("#initial >* a."));
        HorizonExtension first = manager.extendHorizon();

        int a0 = manager.atoms().atom(A, 0);
        assertEquals(List.of(GroundRule.constraint(-a0).orElseThrow()), first.rules());
        assertTrue(first.externals().isEmpty());

        HorizonExtension second = manager.extendHorizon();
        int a1 = manager.atoms().atom(A, 1);
        assertEquals(List.of(GroundRule.constraint(-a1).orElseThrow()), second.rules(),
                "La richiesta differita deve raggiungere il passo successivo");

        manager.markFinal(1);
        assertTrue(manager.atoms().atoms(AtomRegistry.Kind.AUXILIARY).isEmpty(), "Nessun atomo ausiliario");
        assertTrue(manager.atoms().atoms(AtomRegistry.Kind.CARRIER).isEmpty(), "Nessun portatore");
        assertTrue(manager.atoms().atoms(AtomRegistry.Kind.EXTERNAL).isEmpty(), "Nessun esterno");
        assertTrue(manager.finalRules().isEmpty());
    }

    @Test
    public void testAlwaysStageAndDeferredRequirementAreNotDuplicated() {
        HorizonManager manager = unroll("#always >* a.", 3);
        for (int step = 0; step <= 2; step++) {
            assertEquals(1, manager.rulesAt(step).size(),
                    "La stessa richiesta dallo stadio e dal passo precedente va tradotta una volta");
        }
    }

    @Test
    public void testEventuallyCarrierChain() {
        HorizonManager manager = unroll("#initial >? a.", 3);
        Formula eventually = Formula.eventually(A);

        assertTrue(manager.allRules().stream().noneMatch(GroundRule::isConstraint),
                "Finché l'orizzonte è aperto l'eventualità non è vincolata");
        assertEquals(2, manager.engine().carriers().lastStep(eventually, 0));

        HorizonExtension closing = manager.markFinal(2);
        int carrier = manager.engine().carriers().carrier(eventually, 0, 2);
        assertEquals(List.of(GroundRule.constraint(-carrier).orElseThrow()), closing.rules());

        List<Integer> free = freeAtoms(manager);
        Set<Integer> as = atomsOf(manager, A, 0, 1, 2);
        ProgramEvaluator evaluator = new ProgramEvaluator(manager.allRules());
        Set<Integer> freeSet = new HashSet<>(free);
        for (int mask = 0; mask < 8; mask++) {
            Set<Integer> chosen = new HashSet<>();
            int bit = 0;
            for (int atom : as) {
                if ((mask & (1 << bit++)) != 0) {
                    chosen.add(atom);
                }
            }
            assertEquals(!chosen.isEmpty(), evaluator.holds(carrier, freeSet, chosen),
                    "Il portatore finale vale se a vale in almeno un passo: " + chosen);
        }
        assertEquals(7, evaluator.acceptedChoices(free).size());
    }

    @Test
    public void testNextAtFrontierIsFreeThenBound() {
        HorizonManager manager = new HorizonManager(FormulaParser.parseProgram("#initial > a."));
        HorizonExtension first = manager.extendHorizon();

        assertEquals(1, first.externals().size());
        int external = first.externals().keySet().iterator().next();
        assertEquals(TruthValue.FREE, first.externals().get(external));
        assertEquals(TruthValue.FREE, manager.external(external).value());
        assertEquals(1, manager.pendingObligations().size());

        HorizonExtension second = manager.extendHorizon();
        int a1 = manager.atoms().atom(A, 1);
        assertTrue(second.externals().isEmpty(), "L'esterno deve essere legato dopo l'estensione");
        assertEquals(List.of(GroundRule.definition(external, a1).orElseThrow()), second.rules());
        assertEquals(BoundaryExternal.State.BOUND, manager.external(external).state());
        assertEquals(a1, manager.external(external).boundLiteral());
        assertThrows(IllegalStateException.class, () -> manager.external(external).value());
        assertTrue(manager.pendingObligations().isEmpty());
        assertEquals(1, manager.statistics().getExternalsBound());
    }

    @Test
    public void testClosingFixesStrongNextToFalse() {
        HorizonManager manager = new HorizonManager(FormulaParser.parseProgram("#initial > a."));
        int external = manager.extendHorizon().externals().keySet().iterator().next();

        HorizonExtension closing = manager.markFinal(0);
        assertEquals(List.of(GroundRule.constraint(external).orElseThrow()), closing.rules());
        assertEquals(TruthValue.FALSE, manager.external(external).value());
        assertTrue(manager.openExternals().isEmpty());

        ProgramEvaluator evaluator = new ProgramEvaluator(manager.allRules());
        assertTrue(evaluator.acceptedChoices(freeAtoms(manager)).isEmpty(),
                "Non esiste un passo successivo all'ultimo: il programma è inconsistente");
    }

    @Test
    public void testClosingFixesWeakNextToTrue() {
        HorizonManager manager = new HorizonManager(FormulaParser.parseProgram("#initial >: a."));
        int external = manager.extendHorizon().externals().keySet().iterator().next();

        HorizonExtension closing = manager.markFinal(0);
        assertEquals(List.of(GroundRule.fact(external)), closing.rules());
        assertEquals(TruthValue.TRUE, manager.external(external).value());
        assertEquals(1, new ProgramEvaluator(manager.allRules()).acceptedChoices(freeAtoms(manager)).size());
        assertEquals(1, manager.statistics().getExternalsFixed());
    }

    @Test
    public void testOpenHorizonLeavesChoiceToSolver() {
        HorizonManager manager = unroll("#always a -> > b.", 2);
        Map<Integer, TruthValue> open = manager.openExternals();
        assertEquals(1, open.size(), "Solo l'obbligo dell'ultimo passo resta aperto");

        List<Integer> free = freeAtoms(manager);
        List<Set<Integer>> accepted = new ProgramEvaluator(manager.allRules()).acceptedChoices(free);
        int a1 = manager.atoms().atom(A, 1);
        int external = open.keySet().iterator().next();
        for (Set<Integer> choice : accepted) {
            assertTrue(!choice.contains(a1) || choice.contains(external),
                    "Se a vale all'ultimo passo l'esterno deve essere scelto vero");
        }
    }

    @Test
    public void testDiamondStarOverSteps() {
        StagedProgram program = new StagedProgram()
                .add(Stage.INITIAL, Formula.diamond(PathExpression.star(PathExpression.atomStep(A)), B));
        HorizonManager manager = new HorizonManager(program);
        manager.extendHorizon();
        manager.extendHorizon();
        manager.extendHorizon();
        manager.markFinal(2);

        int[] a = {manager.atoms().atom(A, 0), manager.atoms().atom(A, 1), manager.atoms().atom(A, 2)};
        int[] b = {manager.atoms().atom(B, 0), manager.atoms().atom(B, 1), manager.atoms().atom(B, 2)};
        List<Integer> free = List.of(a[0], a[1], a[2], b[0], b[1], b[2]);
        assertEquals(new HashSet<>(free), new HashSet<>(freeAtoms(manager)));

        List<Set<Integer>> accepted = new ProgramEvaluator(manager.allRules()).acceptedChoices(free);
        int expected = 0;
        for (int mask = 0; mask < 64; mask++) {
            boolean holds = false;
            for (int j = 0; j <= 2; j++) {
                if ((mask & (1 << (3 + j))) != 0) {
                    holds = true;
                    break;
                }
                if ((mask & (1 << j)) == 0) {
                    break;
                }
            }
            if (holds) {
                expected++;
            }
        }
        assertEquals(expected, accepted.size(), "I modelli devono essere quelli di a >? b");
        for (Set<Integer> choice : accepted) {
            assertTrue(choice.contains(b[0]) || choice.contains(a[0]));
        }
    }

    @Test
    public void testFinalStage() {
        HorizonManager manager = unroll("#final a & <b.", 2);
        assertTrue(manager.allRules().isEmpty(), "Lo stadio finale non si applica durante l'estensione");

        HorizonExtension closing = manager.markFinal(1);
        assertFalse(closing.rules().isEmpty());
        assertTrue(manager.step(1).isFinal());
        assertFalse(manager.step(0).isFinal());

        List<Set<Integer>> accepted = new ProgramEvaluator(manager.allRules()).acceptedChoices(freeAtoms(manager));
        int a1 = manager.atoms().atom(A, 1);
        int b0 = manager.atoms().atom(B, 0);
        assertEquals(1, accepted.size());
        assertEquals(Set.of(a1, b0), accepted.get(0));
    }

    @Test
    public void testEmittedRulesAreNeverModified() {
        HorizonManager manager = new HorizonManager(FormulaParser.parseProgram(
                "#always a -> > b.\n#initial >? a.\n#dynamic <a <> b."));
        List<List<GroundRule>> returned = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            returned.add(manager.extendHorizon().rules());
        }
        manager.markFinal(3);
        manager.translate(Formula.once(B), 3);

        for (int step = 0; step < 4; step++) {
            assertEquals(returned.get(step), manager.rulesAt(step),
                    "Le regole del passo " + step + " non devono cambiare");
        }
        assertThrows(UnsupportedOperationException.class, () -> manager.rulesAt(0).add(GroundRule.fact(2)));
    }

    @Test
    public void testStageViolationLeavesHorizonUnchanged() {
        HorizonManager manager = unroll("#always a.\n#final > b.", 2);
        int atoms = manager.atoms().size();
        List<GroundRule> before = manager.allRules();

        assertThrows(StageViolationException.class, () -> manager.markFinal(1));

        assertFalse(manager.isClosed(), "La chiusura fallita non deve chiudere l'orizzonte");
        assertEquals(1, manager.horizon());
        assertEquals(atoms, manager.atoms().size());
        assertEquals(before, manager.allRules());
        assertEquals(1, manager.statistics().getRollbacks());
        manager.extendHorizon();
        assertEquals(2, manager.horizon(), "L'orizzonte deve restare utilizzabile");
    }

    @Test
    public void testMalformedPathRollsBackExtension() {
        StagedProgram program = new StagedProgram()
                .add(Stage.ALWAYS, Formula.or(A, B))
                .add(Stage.DYNAMIC, Formula.box(PathExpression.star(PathExpression.test(A)), B));
        HorizonManager manager = new HorizonManager(program);
        manager.extendHorizon();
        int atoms = manager.atoms().size();
        int cacheEntries = manager.engine().cache().size();

        assertThrows(MalformedPathExpressionException.class, manager::extendHorizon);
        assertEquals(0, manager.horizon());
        assertEquals(atoms, manager.atoms().size());
        assertEquals(cacheEntries, manager.engine().cache().size());
    }

    @Test
    public void testLongHorizonClosesWithPastFormula() {
        HorizonManager manager = unroll("#final <* a.", 5000);
        assertTrue(manager.allRules().isEmpty());

        HorizonExtension closing = manager.markFinal(5000);

        assertTrue(manager.isClosed());
        assertEquals(5001, manager.engine().carriers().size(), "Un portatore di violazione per passo");
        assertEquals(2 * 5001, closing.rules().size(), "Due regole per portatore e il vincolo finale");
        assertEquals(1, closing.rules().stream().filter(GroundRule::isConstraint).count());

        TranslationResult eventually = manager.translate(Formula.eventually(B), 0);
        assertEquals(2 * 5001 - 1, eventually.rules().size(), "Una regola al passo 5000, due negli altri");
    }

    @Test
    public void testAnyFailureLeavesHorizonUnchanged() {
        HorizonManager manager = unroll("#always a | > b.", 2);
        int atoms = manager.atoms().size();
        int cacheEntries = manager.engine().cache().size();
        List<GroundRule> before = manager.allRules();

        Formula deep = B;
        for (int i = 0; i < 1_000_000; i++) {
            deep = Formula.previous(deep);
        }
        Formula nested = Formula.and(Formula.once(A), deep);
        assertThrows(StackOverflowError.class, () -> manager.translate(nested, 1));

        assertEquals(1, manager.statistics().getRollbacks());
        assertEquals(atoms, manager.atoms().size());
        assertEquals(cacheEntries, manager.engine().cache().size());
        assertEquals(before, manager.allRules());
        assertEquals(1, manager.openExternals().size(), "Resta aperto solo l'esterno del passo 1");

        manager.extendHorizon();
        manager.markFinal(2);
        assertTrue(manager.isClosed(), "L'orizzonte resta utilizzabile dopo l'errore");
    }

    @Test
    public void testClosedHorizonCannotGrow() {
        HorizonManager manager = unroll("#always a.", 2);
        assertThrows(IllegalArgumentException.class, () -> manager.markFinal(0),
                "Il passo finale deve essere l'ultimo srotolato");
        manager.markFinal(1);

        assertTrue(manager.isClosed());
        assertThrows(IllegalStateException.class, manager::extendHorizon);
        assertThrows(IllegalStateException.class, () -> manager.markFinal(1));
    }

    @Test
    public void testAdHocTranslation() {
        HorizonManager manager = unroll("#always a.", 3);

        TranslationResult result = manager.translate(Formula.once(B), 2);
        assertEquals(5, result.rules().size(), "Due regole per portatore, una sola al passo 0");
        assertEquals(result.rules(), manager.supplementaryRules());

        TranslationResult again = manager.translate(Formula.once(B), 2);
        assertEquals(result.literal(), again.literal());
        assertTrue(again.rules().isEmpty(), "La formula è già in cache");

        TranslationResult future = manager.translate(Formula.next(A), 2);
        assertEquals(AtomRegistry.Kind.EXTERNAL, manager.atoms().kind(future.literal()));
        assertTrue(manager.openExternals().containsKey(future.literal()),
                "Gli obblighi delle traduzioni puntuali sono registrati come quelli degli stadi");
        assertThrows(IllegalArgumentException.class, () -> manager.translate(A, 3));
    }

    @Test
    public void testStatistics() {
        HorizonManager manager = unroll("#always a | > b.", 3);
        manager.markFinal(2);

        TranslationStatistics statistics = manager.statistics();
        assertEquals(3, statistics.getSteps());
        assertEquals(manager.allRules().size(), statistics.getRules());
        assertEquals(3, statistics.getExternalsOpened());
        assertEquals(2, statistics.getExternalsBound());
        assertEquals(1, statistics.getExternalsFixed());
        assertTrue(statistics.toString().contains("Passi:"));
        assertTrue(statistics.toCompactString().startsWith("Stats[Steps:3"));
    }
}
