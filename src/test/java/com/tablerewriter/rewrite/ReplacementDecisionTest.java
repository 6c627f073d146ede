package com.tablerewriter.rewrite;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

public class ReplacementDecisionTest {

    private static final TableIdentifier ORDERS = new TableIdentifier(null, "sales", "orders");

    @Test
    void keepRetainsValueAndAbsence() {
        assertEquals("sales", Replacement.keep().applyTo("sales"));
        assertNull(Replacement.keep().applyTo(null));
    }

    @Test
    void clearAndSetAreDistinctFromKeep() {
        assertNull(Replacement.clear().applyTo("sales"));
        assertEquals("lake", Replacement.set("lake").applyTo(null));
        assertNotEquals(Replacement.keep(), Replacement.clear());
        assertEquals(Replacement.set("lake"), Replacement.set("lake"));
    }

    @Test
    void setRequiresAValue() {
        assertThrows(IllegalArgumentException.class, () -> Replacement.set(null));
        assertTrue(Replacement.setOrKeep(null).isKeep());
        assertTrue(Replacement.setOrKeep("x").isSet());
    }

    @Test
    void valueIsOnlyCarriedBySet() {
        assertEquals("lake", Replacement.set("lake").getValue());
        assertNull(Replacement.keep().getValue());
        assertNull(Replacement.clear().getValue());
    }

    @Test
    void decisionAppliesEachSlotIndependently() {
        ReplacementDecision decision = ReplacementDecision.of(
                Replacement.set("lake"), Replacement.keep(), Replacement.set("orders_v2"));
        assertEquals(new TableIdentifier("lake", "sales", "orders_v2"), decision.applyTo(ORDERS));

        ReplacementDecision drop = ReplacementDecision.of(Replacement.keep(), Replacement.clear(), Replacement.keep());
        assertEquals(new TableIdentifier(null, null, "orders"), drop.applyTo(ORDERS));
    }

    @Test
    void keepAllIsIdentity() {
        assertTrue(ReplacementDecision.keepAll().isKeepAll());
        assertFalse(ReplacementDecision.database("x").isKeepAll());
        assertEquals(ORDERS, ReplacementDecision.keepAll().applyTo(ORDERS));
    }

    @Test
    void slotsCannotBeNull() {
        assertThrows(NullPointerException.class,
                () -> ReplacementDecision.of(null, Replacement.keep(), Replacement.keep()));
    }
}
