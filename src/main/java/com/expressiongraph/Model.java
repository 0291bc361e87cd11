package com.expressiongraph;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Variables and constraints read from an LP or MPS file. Only structure is
 * kept: which variables occur together in which row.
 *
 * The model owns both collections; variables and constraints refer to each
 * other by id / index. Readers freeze the model before handing it out.
 */
public final class Model {
    private final Map<String, Variable> variables = new LinkedHashMap<>();
    private final List<Constraint> constraints = new ArrayList<>();
    private boolean frozen;

    /** Returns the variable with this id, creating it on first use. */
    public Variable createVariable(String id) {
        Variable v = variables.get(id);
        if (v != null) return v;
        checkMutable();
        v = new Variable(id);
        variables.put(id, v);
        return v;
    }

    /** Registers one row holding the given ids (order and duplicates preserved). */
    public Constraint createConstraintRelation(List<String> ids) {
        checkMutable();
        List<Variable> vars = new ArrayList<>(ids.size());
        for (String id : ids) vars.add(createVariable(id));

        Constraint c = new Constraint(constraints.size(), new ArrayList<>(ids));
        constraints.add(c);
        for (Variable v : vars) v.addConstraint(c.getIndex());
        return c;
    }

    public Model freeze() {
        frozen = true;
        return this;
    }

    public boolean isFrozen() { return frozen; }

    public Variable getVariable(String id) { return variables.get(id); }
    public boolean hasVariable(String id) { return variables.containsKey(id); }
    public Collection<Variable> getVariables() { return Collections.unmodifiableCollection(variables.values()); }
    public List<Constraint> getConstraints() { return Collections.unmodifiableList(constraints); }
    public Constraint getConstraint(int index) { return constraints.get(index); }
    public int variableCount() { return variables.size(); }
    public int constraintCount() { return constraints.size(); }

    private void checkMutable() {
        if (frozen) throw new IllegalStateException("Model is frozen");
    }
}
