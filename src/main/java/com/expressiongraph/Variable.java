package com.expressiongraph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A decision variable of the model. Constraints it takes part in are kept
 * as indices into {@link Model#getConstraints()}, never as references.
 */
public final class Variable {
    private final String id;
    private final List<Integer> constraintIndices = new ArrayList<>();

    Variable(String id) {
        this.id = id;
    }

    public String getId() { return id; }

    /** Indices of the constraints this variable occurs in (one entry per occurrence list, no dedup). */
    public List<Integer> getConstraintIndices() { return Collections.unmodifiableList(constraintIndices); }

    void addConstraint(int index) { constraintIndices.add(index); }

    @Override
    public String toString() { return id; }
}
