package com.raditha.repairgraph.ged;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BeamWidthPolicyTest {

    @Test
    void testDefaultSteps() {
        BeamWidthPolicy policy = BeamWidthPolicy.defaults();

        assertEquals(100, policy.widthFor(0));
        assertEquals(100, policy.widthFor(19));
        assertEquals(50, policy.widthFor(20));
        assertEquals(50, policy.widthFor(49));
        assertEquals(20, policy.widthFor(99));
        assertEquals(10, policy.widthFor(100));
        assertEquals(10, policy.widthFor(200));
        assertEquals(1, policy.widthFor(201));
        assertEquals(1, policy.widthFor(5000));
    }

    @Test
    void testParseRoundTripsThroughToString() {
        BeamWidthPolicy policy = BeamWidthPolicy.parse("20:100, 50:50, 100:20, 201:10, *:1");

        assertEquals(BeamWidthPolicy.defaults(), policy);
        assertEquals("20:100,50:50,100:20,201:10,*:1", policy.toString());
        assertEquals(policy, BeamWidthPolicy.parse(policy.toString()));
    }

    @Test
    void testStepsAreSortedByLimit() {
        BeamWidthPolicy policy = BeamWidthPolicy.parse("50:5,10:40,*:2");

        assertEquals(List.of(new BeamWidthPolicy.Step(10, 40), new BeamWidthPolicy.Step(50, 5)), policy.steps());
        assertEquals(40, policy.widthFor(3));
        assertEquals(5, policy.widthFor(10));
        assertEquals(2, policy.fallbackWidth());
    }

    @Test
    void testFixedPolicy() {
        BeamWidthPolicy policy = BeamWidthPolicy.fixed(7);

        assertEquals(7, policy.widthFor(1));
        assertEquals(7, policy.widthFor(10_000));
        assertEquals("*:7", policy.toString());
    }

    @Test
    void testMalformedPoliciesAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> BeamWidthPolicy.parse(""));
        assertThrows(IllegalArgumentException.class, () -> BeamWidthPolicy.parse("20:100"), "missing fallback");
        assertThrows(IllegalArgumentException.class, () -> BeamWidthPolicy.parse("20-100,*:1"));
        assertThrows(IllegalArgumentException.class, () -> BeamWidthPolicy.parse("x:100,*:1"));
        assertThrows(IllegalArgumentException.class, () -> BeamWidthPolicy.parse("20:0,*:1"));
        assertThrows(IllegalArgumentException.class, () -> BeamWidthPolicy.parse("*:0"));
        assertThrows(IllegalArgumentException.class, () -> BeamWidthPolicy.fixed(0));
    }
}
