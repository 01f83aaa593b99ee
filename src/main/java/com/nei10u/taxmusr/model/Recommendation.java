package com.nei10u.taxmusr.model;

public enum Recommendation {
    JOINT("joint"),
    INDIVIDUAL("individual");

    private final String label;

    Recommendation(String label) {
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
