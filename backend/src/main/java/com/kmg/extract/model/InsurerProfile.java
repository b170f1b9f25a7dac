package com.kmg.extract.model;

public enum InsurerProfile {
    RELIANCE("reliance", "Reliance General Insurance"),
    SHRIRAM("shriram", "SHRIRAM GENERAL INSURANCE COMPANY LIMITED");

    private final String marker;
    private final String companyName;

    InsurerProfile(String marker, String companyName) {
        this.marker = marker;
        this.companyName = companyName;
    }

    public String marker() {
        return marker;
    }

    public String companyName() {
        return companyName;
    }
}
