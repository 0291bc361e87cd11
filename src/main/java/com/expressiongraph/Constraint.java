package com.expressiongraph;

import java.util.Collections;
import java.util.List;

/** One row of the source problem: the variable ids it mentions, in encounter order. */
public final class Constraint {
    private final int index;
    private final List<String> variableIds;   // may contain duplicates

    Constraint(int index, List<String> variableIds) {
        this.index = index;
        this.variableIds = Collections.unmodifiableList(variableIds);
    }

    public int getIndex() { return index; }
    public List<String> getVariableIds() { return variableIds; }
    public int size() { return variableIds.size(); }

    @Override
    public String toString() { return "c" + index + variableIds; }
}
