package com.shapetea.ir;

import java.util.Objects;

/**
 * Opaque position tag attached to IR nodes, symbols and constraints.
 *
 * The engine never interprets a source. It only carries it along so the driver can point
 * diagnostics back at the program. Two forms exist: a node handed over by the host
 * frontend, and a file id plus line/column range for externalized reporting.
 */
public abstract class CodeSource {

    private CodeSource() {}

    public static CodeSource host(Object node) {
        return new HostNode(node);
    }

    public static CodeSource range(int fileId, int startLine, int startCol, int endLine, int endCol) {
        return new FileRange(fileId, startLine, startCol, endLine, endCol);
    }

    public static final class HostNode extends CodeSource {
        public final Object node;

        HostNode(Object node) {
            this.node = Objects.requireNonNull(node, "node");
        }

        @Override
        public String toString() {
            return String.valueOf(node);
        }
    }

    public static final class FileRange extends CodeSource {
        public final int fileId;
        public final int startLine;
        public final int startCol;
        public final int endLine;
        public final int endCol;

        FileRange(int fileId, int startLine, int startCol, int endLine, int endCol) {
            this.fileId = fileId;
            this.startLine = startLine;
            this.startCol = startCol;
            this.endLine = endLine;
            this.endCol = endCol;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof FileRange)) return false;
            FileRange r = (FileRange) o;
            return fileId == r.fileId && startLine == r.startLine && startCol == r.startCol
                    && endLine == r.endLine && endCol == r.endCol;
        }

        @Override
        public int hashCode() {
            return Objects.hash(fileId, startLine, startCol, endLine, endCol);
        }

        @Override
        public String toString() {
            return "file" + fileId + ":" + (startLine + 1) + ":" + (startCol + 1);
        }
    }
}
