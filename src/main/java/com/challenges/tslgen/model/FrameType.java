package com.challenges.tslgen.model;

public enum FrameType {
    NORMAL("normal"),
    SINGLE("single"),
    ERROR("error");

    private final String label;

    FrameType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public boolean isNormal() {
        return this == NORMAL;
    }

    @Override
    public String toString() {
        return label;
    }
}
