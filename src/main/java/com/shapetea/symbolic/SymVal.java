package com.shapetea.symbolic;

import com.shapetea.ir.CodeSource;

/**
 * A symbolic variable. Ids are unique within one analysis run, so identity is the id alone.
 * Shape symbols additionally carry their rank expression.
 */
public final class SymVal {

    public final SymbolType type;
    public final int id;
    public final String name;
    public final CodeSource source;
    /** Only set for {@link SymbolType#SHAPE}. */
    public final ExpNum rank;

    private SymVal(SymbolType type, int id, String name, ExpNum rank, CodeSource source) {
        this.type = type;
        this.id = id;
        this.name = name;
        this.rank = rank;
        this.source = source;
    }

    public static SymVal of(SymbolType type, int id, String baseName, CodeSource source) {
        if (type == SymbolType.SHAPE) {
            throw new IllegalArgumentException("shape symbols need a rank");
        }
        return new SymVal(type, id, baseName + type.suffix() + id, null, source);
    }

    public static SymVal shape(int id, String baseName, ExpNum rank, CodeSource source) {
        return new SymVal(SymbolType.SHAPE, id, baseName + SymbolType.SHAPE.suffix() + id, rank, source);
    }

    public boolean isNumeric() {
        return type == SymbolType.INT || type == SymbolType.FLOAT;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SymVal)) return false;
        SymVal s = (SymVal) o;
        return id == s.id && type == s.type;
    }

    @Override
    public int hashCode() {
        return id * 31 + type.ordinal();
    }

    @Override
    public String toString() {
        return name;
    }
}
