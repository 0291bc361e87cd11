package com.expressiongraph;

import java.io.BufferedReader;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Reads CPLEX-style LP text. Every non-header line of the objective and
 * constraint sections becomes one relation holding the tokens that look like
 * variable names. Bounds, general/binary sections and anything else are
 * skipped. Malformed lines are dropped without error.
 */
public final class LpReader implements ModelReader {

    enum Section { NONE, OBJECTIVE, CONSTRAINT }

    static final Set<String> OBJECTIVE_HEADERS =
            Set.of("minimize", "maximize", "minimum", "maximum", "min", "max");
    static final Set<String> CONSTRAINT_HEADERS =
            Set.of("subject to", "such that", "st", "s.t.");

    static final int MAX_NAME_LENGTH = 255;
    private static final String BAD_FIRST = "+-*^<>=()[],:";
    private static final String BAD_ANYWHERE = "+-*^:";

    @Override
    public Model read(BufferedReader in) throws IOException {
        Model model = new Model();
        Section section = Section.NONE;
        String line;
        while ((line = in.readLine()) != null) {
            if (line.startsWith("\\")) continue;                   // comment

            String low = line.trim().toLowerCase(Locale.ROOT);
            if (low.isEmpty()) continue;

            if (Character.isLetter(line.charAt(0))) {              // section header
                if (OBJECTIVE_HEADERS.contains(low)) section = Section.OBJECTIVE;
                else if (CONSTRAINT_HEADERS.contains(low)) section = Section.CONSTRAINT;
                else section = Section.NONE;
                continue;
            }
            if (section == Section.NONE) continue;

            List<String> vars = variablesOf(low);
            if (!vars.isEmpty()) model.createConstraintRelation(vars);
        }
        return model.freeze();
    }

    /** Extracts the variable tokens of an already lower-cased, trimmed body line. */
    static List<String> variablesOf(String low) {
        int bs = low.indexOf('\\');
        if (bs >= 0) low = low.substring(0, bs);
        int colon = low.indexOf(':');
        if (colon >= 0) low = low.substring(colon + 1);

        List<String> out = new ArrayList<>();
        for (String tok : low.trim().split("\\s+")) {
            if (isVariable(tok)) out.add(tok);
        }
        return out;
    }

    /**
     * LP name rules: at most 255 characters, must not start with a digit or
     * any of {@code + - * ^ < > = ( ) [ ] , :}, and must not contain
     * {@code + - * ^ :} anywhere.
     */
    public static boolean isVariable(String token) {
        if (token == null || token.isEmpty() || token.length() > MAX_NAME_LENGTH) return false;
        char first = token.charAt(0);
        if (Character.isDigit(first)) return false;
        if (BAD_FIRST.indexOf(first) >= 0) return false;
        for (int i = 0; i < token.length(); i++) {
            if (BAD_ANYWHERE.indexOf(token.charAt(i)) >= 0) return false;
        }
        return true;
    }
}
