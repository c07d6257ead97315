package com.raditha.repairgraph.metrics;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TokenEditDistanceTest {

    private TokenEditDistance distance;

    @BeforeEach
    void setUp() {
        distance = new TokenEditDistance();
    }

    @Test
    void testIdenticalSequences() {
        List<String> tokens = List.of("return", "x", "+", "1", ";");

        assertEquals(0, distance.distance(tokens, tokens));
        assertEquals(1.0, distance.similarity(tokens, tokens));
    }

    @Test
    void testSubstitutionInsertionDeletion() {
        assertEquals(1, distance.distance(List.of("a", "b", "c"), List.of("a", "x", "c")));
        assertEquals(1, distance.distance(List.of("a", "c"), List.of("a", "b", "c")));
        assertEquals(1, distance.distance(List.of("a", "b", "c"), List.of("a", "c")));
        assertEquals(3, distance.distance(List.of("k", "i", "t", "t", "e", "n"),
                List.of("s", "i", "t", "t", "i", "n", "g")));
    }

    @Test
    void testEmptySequences() {
        assertEquals(0, distance.distance(List.of(), List.of()));
        assertEquals(3, distance.distance(List.of(), List.of("a", "b", "c")));
        assertEquals(1.0, distance.similarity(List.of(), List.of()));
        assertEquals(0.0, distance.similarity(List.of(), List.of("a")));
    }

    @Test
    void testSymmetric() {
        List<String> a = List.of("if", "(", "x", ")", "return", ";");
        List<String> b = List.of("while", "(", "y", ")", "{", "}");

        assertEquals(distance.distance(a, b), distance.distance(b, a));
    }
}
