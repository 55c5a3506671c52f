package com.example.userload.client;

public enum Operation {
    REGISTER("register"),
    LOGIN("login");

    private final String label;

    Operation(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
