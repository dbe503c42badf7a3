package com.challenges.tslgen.generator;

/** Side of a conditional choice that produced a single or error frame. */
public enum Branch {
    IF("if"),
    ELSE("else");

    private final String label;

    Branch(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    @Override
    public String toString() {
        return label;
    }
}
