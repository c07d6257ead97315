package com.raditha.repairgraph.metrics;

import com.raditha.repairgraph.extraction.SourceFile;
import com.raditha.repairgraph.extraction.SourceUnitParser;
import com.raditha.repairgraph.model.GraphBuildException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AstEditDistanceTest {

    private SourceUnitParser parser;

    @BeforeEach
    void setUp() {
        parser = new SourceUnitParser();
    }

    private List<SourceFile> files(String text) throws GraphBuildException {
        return parser.parse("A.java", text).files();
    }

    private AstEditDistance.Result distance(String before, String after) throws GraphBuildException {
        return AstEditDistance.compute(files(before), files(after));
    }

    @Test
    void testIdenticalTreesHaveZeroDistance() throws GraphBuildException {
        String code = "class A { int f(int x) { if (x > 0) { return x; } return -x; } }";

        AstEditDistance.Result result = distance(code, code);

        assertEquals(0, result.distance());
        assertEquals(result.sizeBefore(), result.sizeAfter());
        assertEquals(0.0, result.normalized());
    }

    @Test
    void testRenamesAndLiteralsAreNotEdits() throws GraphBuildException {
        AstEditDistance.Result result = distance(
                "class A { int f(int x) { return x + 1; } }",
                "class A { int g(int y) { return y + 2; } }");

        assertEquals(0, result.distance());
    }

    @Test
    void testChangedOperatorIsOneRelabel() throws GraphBuildException {
        AstEditDistance.Result result = distance(
                "class A { int f(int x) { return x + 1; } }",
                "class A { int f(int x) { return x - 1; } }");

        assertEquals(1, result.distance());
    }

    @Test
    void testInsertedStatementCostsItsSize() throws GraphBuildException {
        // ExpressionStmt, UnaryExpr, NameExpr, SimpleName
        AstEditDistance.Result result = distance(
                "class A { void f(int x) { g(x); } }",
                "class A { void f(int x) { g(x); x++; } }");

        assertEquals(4, result.distance());
        assertEquals(4, result.sizeDelta());
    }

    @Test
    void testCommentsAreIgnored() throws GraphBuildException {
        AstEditDistance.Result result = distance(
                "class A { void f() { g(); } }",
                "class A { /** doc */ void f() { // call\n g(); } }");

        assertEquals(0, result.distance());
    }

    @Test
    void testDistanceIsSymmetric() throws GraphBuildException {
        String before = "class A { int f(int x) { return x; } }";
        String after = "class A { int f(int x) { while (x > 0) { x--; } return x * 2; } }";

        assertEquals(distance(before, after).distance(), distance(after, before).distance());
        assertTrue(distance(before, after).distance() > 0);
    }
}
