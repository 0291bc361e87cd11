package com.expressiongraph;

import static org.junit.jupiter.api.Assertions.*;
import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.*;

public class LpReaderTest {

    private static Model read(String... lines) {
        return new LpReader().read(String.join("\n", lines));
    }

    @Test
    public void labelledConstraintRow() {
        Model m = read("subject to", " c1: x + y <= 10");
        assertEquals(new HashSet<>(Arrays.asList("x", "y")), ids(m));
        assertEquals(1, m.constraintCount());
        assertEquals(Arrays.asList("x", "y"), m.getConstraint(0).getVariableIds());
    }

    @Test
    public void objectiveRowsAreRelationsToo() {
        Model m = read("Minimize", " obj: 3 a + 2 b - c");
        assertEquals(1, m.constraintCount());
        assertEquals(Arrays.asList("a", "b", "c"), m.getConstraint(0).getVariableIds());
    }

    @Test
    public void allSectionKeywordsRecognised() {
        for (String h : Arrays.asList("minimize", "MAXIMIZE", "Minimum", "maximum", "min", "max",
                "Subject To", "such that", "st", "S.T.")) {
            Model m = read(h, " x + y >= 1");
            assertEquals(1, m.constraintCount(), h);
        }
    }

    @Test
    public void unknownHeaderClosesSection() {
        Model m = read("subject to", " a + b <= 1", "Bounds", " x + y <= 3", "General", " z");
        assertEquals(1, m.constraintCount());
        assertFalse(m.hasVariable("x"));
        assertFalse(m.hasVariable("z"));
    }

    @Test
    public void linesBeforeAnySectionAreIgnored() {
        Model m = read(" a + b <= 1", "st", " c + d <= 1");
        assertEquals(1, m.constraintCount());
        assertEquals(Arrays.asList("c", "d"), m.getConstraint(0).getVariableIds());
    }

    @Test
    public void commentsAndBlankLines() {
        Model m = read("\\ header comment",
                "subject to",
                "",
                "\\ a comment does not close the section",
                "   ",
                " r1: p + q >= 2 \\ q2 + q3 is commented out");
        assertEquals(1, m.constraintCount());
        assertEquals(Arrays.asList("p", "q"), m.getConstraint(0).getVariableIds());
    }

    @Test
    public void unindentedRowIsTreatedAsHeader() {
        // a row starting with a letter in column 0 looks like a header and resets the section
        Model m = read("subject to", "c1: x + y <= 10", " c2: u + v <= 1");
        assertEquals(0, m.constraintCount());
    }

    @Test
    public void rowsAreLowerCased() {
        Model m = read("st", " Cap: Alpha + BETA <= 4");
        assertEquals(Arrays.asList("alpha", "beta"), m.getConstraint(0).getVariableIds());
    }

    @Test
    public void singleVariableRowRegistersRelation() {
        Model m = read("st", " lim: x <= 4");
        assertEquals(1, m.constraintCount());
        assertEquals(Collections.singletonList("x"), m.getConstraint(0).getVariableIds());
    }

    @Test
    public void rowsWithoutVariablesAreDropped() {
        Model m = read("st", " 3 + 4 <= 10", " :", " -x1 >= 2");
        assertEquals(0, m.constraintCount());
        assertEquals(0, m.variableCount());
    }

    @Test
    public void multiLineRowsBecomeSeparateRelations() {
        Model m = read("st", " c1: x + y", "   + z <= 3");
        assertEquals(2, m.constraintCount());
        assertEquals(Arrays.asList("x", "y"), m.getConstraint(0).getVariableIds());
        assertEquals(Collections.singletonList("z"), m.getConstraint(1).getVariableIds());
    }

    @Test
    public void identifierPredicate() {
        for (String ok : Arrays.asList("x", "x1", "_y", "a.b", "a_b[1]", "e]", "x<", "名前"))
            assertTrue(LpReader.isVariable(ok), ok);

        for (String bad : Arrays.asList("", "1x", "9", "+", "-x", "*", "^2", "<=", ">=", "=", "(a", ")",
                "[a", "]a", ",a", ":a", "a+b", "a-b", "a*b", "a^b", "a:b"))
            assertFalse(LpReader.isVariable(bad), bad);

        char[] c = new char[255];
        Arrays.fill(c, 'v');
        assertTrue(LpReader.isVariable(new String(c)));
        assertFalse(LpReader.isVariable(new String(c) + "v"));
        assertFalse(LpReader.isVariable(null));
    }

    @Test
    public void readsResourceFile() throws IOException {
        try (BufferedReader br = new BufferedReader(new InputStreamReader(
                getClass().getResourceAsStream("/knapsack.lp"), StandardCharsets.UTF_8))) {
            Model m = new LpReader().read(br);
            assertTrue(m.isFrozen());
            assertEquals(3, m.variableCount());
            assertEquals(4, m.constraintCount());   // objective + cap + side + single
            assertEquals(Arrays.asList("x1", "x3"), m.getConstraint(2).getVariableIds());
        }
    }

    private static Set<String> ids(Model m) {
        Set<String> s = new HashSet<>();
        for (Variable v : m.getVariables()) s.add(v.getId());
        return s;
    }
}
