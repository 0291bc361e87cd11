package com.expressiongraph;

import java.io.BufferedReader;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads the COLUMNS section of fixed or free MPS text. Entries are grouped by
 * row name; each row becomes one relation once the section ends.
 */
public final class MpsReader implements ModelReader {

    static final String COLUMNS = "COLUMNS";
    static final String MARKER = "MARKER";

    @Override
    public Model read(BufferedReader in) throws IOException {
        Map<String, List<String>> rows = new LinkedHashMap<>();
        boolean inColumns = false;
        String line;
        while ((line = in.readLine()) != null) {
            if (line.startsWith(COLUMNS)) { inColumns = true; continue; }
            if (!inColumns) continue;
            if (line.trim().isEmpty()) continue;
            if (!Character.isWhitespace(line.charAt(0))) break;   // next section

            String[] tok = line.trim().split("\\s+");
            if (tok.length < 2) continue;
            if (tok[1].contains(MARKER)) continue;                 // INTORG / INTEND

            List<String> vars = rows.computeIfAbsent(tok[0], r -> new ArrayList<>());
            for (int i = 1; i < tok.length; i += 2) vars.add(tok[i]);
        }

        Model model = new Model();
        for (List<String> vars : rows.values()) model.createConstraintRelation(vars);
        return model.freeze();
    }
}
