package com.crowelang.compiler.ast;

/**
 * 源码区间信息（起始行列 + 起止偏移）
 */
public final class SourceSpan {
    private final String file;
    private final int line;
    private final int column;
    private final int offset;
    private final int endOffset;

    public static final SourceSpan UNKNOWN = new SourceSpan("<unknown>", 0, 0, 0, 0);

    public SourceSpan(String file, int line, int column, int offset, int endOffset) {
        this.file = file;
        this.line = line;
        this.column = column;
        this.offset = offset;
        this.endOffset = endOffset;
    }

    public String getFile() {
        return file;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public int getOffset() {
        return offset;
    }

    public int getEndOffset() {
        return endOffset;
    }

    public int getLength() {
        return endOffset - offset;
    }

    /**
     * 从当前起点延伸到 other 的终点
     */
    public SourceSpan to(SourceSpan other) {
        return new SourceSpan(file, line, column, offset, Math.max(endOffset, other.endOffset));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SourceSpan)) return false;
        SourceSpan that = (SourceSpan) o;
        return line == that.line && column == that.column
                && offset == that.offset && endOffset == that.endOffset
                && (file == null ? that.file == null : file.equals(that.file));
    }

    @Override
    public int hashCode() {
        int result = file != null ? file.hashCode() : 0;
        result = 31 * result + line;
        result = 31 * result + column;
        result = 31 * result + offset;
        result = 31 * result + endOffset;
        return result;
    }

    @Override
    public String toString() {
        return file + ":" + line + ":" + column;
    }
}
