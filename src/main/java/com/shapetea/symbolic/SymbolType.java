package com.shapetea.symbolic;

public enum SymbolType {
    INT("_I"),
    FLOAT("_F"),
    STRING("_Str"),
    BOOL("_B"),
    SHAPE("_Shp");

    private final String suffix;

    SymbolType(String suffix) {
        this.suffix = suffix;
    }

    /** Infix put between the requested name and the symbol id, e.g. {@code n_I12}. */
    public String suffix() {
        return suffix;
    }
}
