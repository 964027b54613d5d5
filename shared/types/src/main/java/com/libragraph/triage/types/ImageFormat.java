package com.libragraph.triage.types;

public enum ImageFormat {
    RAW("raw", "Raw / dd image"),
    SPLIT_RAW("split", "Raw image split into numbered segments (.001, .002, ...)"),
    EWF("ewf", "Expert Witness segmented container (.E01, .E02, ...)");

    private final String label;
    private final String description;

    ImageFormat(String label, String description) {
        this.label = label;
        this.description = description;
    }

    public String label() {
        return label;
    }

    public String description() {
        return description;
    }
}
