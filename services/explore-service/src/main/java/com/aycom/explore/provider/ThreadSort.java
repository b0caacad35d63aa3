package com.aycom.explore.provider;

public enum ThreadSort {
    POPULAR("popular"),
    RECENT("recent");

    private final String wireValue;

    ThreadSort(String wireValue) {
        this.wireValue = wireValue;
    }

    public String getWireValue() {
        return wireValue;
    }
}
