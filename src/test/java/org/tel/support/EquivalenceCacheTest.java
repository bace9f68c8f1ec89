package org.tel.support;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.tel.formula.Formula;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test della cache di equivalenza e della tabella dei portatori.
 *
 * Verifica:
 * - Un solo letterale per coppia (formula, passo), anche per formule costruite separatamente
 * - L'allocatore viene invocato solo in caso di assenza
 * - Il rollback rimuove solo le voci inserite dopo il checkpoint
 */
public class EquivalenceCacheTest {

    private EquivalenceCache cache;
    private AtomicInteger allocations;

    @BeforeEach
    public void setUp() {
        cache = new EquivalenceCache();
        allocations = new AtomicInteger(10);
    }

    private Formula conjunction() {
        return Formula.and(Formula.atom("a"), Formula.next(Formula.atom("b")));
    }

    @Test
    public void testGetOrCreateIsIdempotent() {
        EquivalenceCache.Entry first = cache.getOrCreate(conjunction(), 2, allocations::incrementAndGet);
        EquivalenceCache.Entry second = cache.getOrCreate(conjunction(), 2, allocations::incrementAndGet);

        assertTrue(first.isNew());
        assertFalse(second.isNew(), "La seconda richiesta non deve creare una nuova voce");
        assertEquals(first.literal(), second.literal());
        assertEquals(11, allocations.get(), "L'allocatore deve essere invocato una sola volta");
        assertEquals(1, cache.hits());
        assertEquals(1, cache.misses());
    }

    @Test
    public void testStepIsPartOfTheKey() {
        int atZero = cache.getOrCreate(conjunction(), 0, allocations::incrementAndGet).literal();
        int atOne = cache.getOrCreate(conjunction(), 1, allocations::incrementAndGet).literal();
        assertNotEquals(atZero, atOne);
        assertEquals(2, cache.size());
        assertNull(cache.lookup(conjunction(), 2));
        assertTrue(cache.contains(conjunction(), 0));
        assertFalse(cache.contains(conjunction(), 2));
        assertEquals(atOne, cache.lookup(conjunction(), 1));
    }

    @Test
    public void testAtomicFormulasAreRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> cache.getOrCreate(Formula.atom("a"), 0, allocations::incrementAndGet));
        assertThrows(IllegalArgumentException.class, () -> cache.lookup(null, 0));
    }

    @Test
    public void testRollbackRemovesOnlyNewEntries() {
        int kept = cache.getOrCreate(conjunction(), 0, allocations::incrementAndGet).literal();
        cache.checkpoint();
        cache.getOrCreate(conjunction(), 1, allocations::incrementAndGet);
        cache.getOrCreate(Formula.not(Formula.FINAL), 1, allocations::incrementAndGet);
        cache.rollback();

        assertEquals(1, cache.size());
        assertEquals(kept, cache.lookup(conjunction(), 0));
        assertNull(cache.lookup(conjunction(), 1));
        assertThrows(IllegalStateException.class, () -> cache.rollback());
    }

    @Test
    public void testCommitKeepsEntries() {
        cache.checkpoint();
        cache.getOrCreate(conjunction(), 0, allocations::incrementAndGet);
        cache.commit();
        assertEquals(1, cache.size());
    }

    @Test
    public void testCarrierChains() {
        CarrierTable carriers = new CarrierTable();
        Formula once = Formula.once(Formula.atom("a"));

        carriers.record(once, 0, 0, 5);
        carriers.record(once, 0, 1, 7);
        carriers.checkpoint();
        carriers.record(once, 0, 2, 9);
        carriers.record(Formula.eventually(Formula.atom("b")), 2, 2, 11);

        assertEquals(2, carriers.lastStep(once, 0));
        assertEquals(4, carriers.size());
        assertThrows(IllegalStateException.class, () -> carriers.record(once, 0, 2, 13),
                "Un passo della catena non può essere registrato due volte");
        assertThrows(IllegalArgumentException.class, () -> carriers.record(once, 3, 1, 13));

        carriers.rollback();
        assertEquals(1, carriers.lastStep(once, 0));
        assertEquals(7, carriers.carrier(once, 0, 1));
        assertNull(carriers.carrier(once, 0, 2));
        assertFalse(carriers.contains(Formula.eventually(Formula.atom("b")), 2));
        assertEquals(2, carriers.size());
        assertEquals(-1, carriers.lastStep(once, 4));
    }
}
