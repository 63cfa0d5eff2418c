package com.crowelang.compiler.codegen;

import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;

import java.util.ArrayList;
import java.util.List;

/**
 * Source Map v3 构建器
 *
 * <p>生成位置为 0 基行列；源位置按 1 基行列传入（与 {@code SourceSpan} 一致），编码时转换。
 * 映射必须按生成位置递增的顺序添加。</p>
 */
public final class SourceMapBuilder {

    private static final String BASE64 =
            "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789+/";

    private final List<Mapping> mappings = new ArrayList<>();

    public void addMapping(int generatedLine, int generatedColumn, int sourceLine, int sourceColumn) {
        if (sourceLine <= 0) {
            return;
        }
        if (!mappings.isEmpty()) {
            Mapping last = mappings.get(mappings.size() - 1);
            if (last.generatedLine == generatedLine && last.generatedColumn == generatedColumn) {
                return;
            }
        }
        mappings.add(new Mapping(generatedLine, generatedColumn, sourceLine, sourceColumn));
    }

    /**
     * 合并另一个构建器的映射，生成行整体偏移 lineOffset
     */
    void appendShifted(SourceMapBuilder other, int lineOffset, int firstLineColumnOffset) {
        for (Mapping m : other.mappings) {
            int column = m.generatedLine == 0 ? m.generatedColumn + firstLineColumnOffset : m.generatedColumn;
            addMapping(m.generatedLine + lineOffset, column, m.sourceLine, m.sourceColumn);
        }
    }

    /**
     * 输出 JSON 格式的 Source Map
     */
    public String build(String file, String sourceName, String sourceContent) {
        JsonObject root = new JsonObject();
        root.addProperty("version", 3);
        root.addProperty("file", file);
        JsonArray sources = new JsonArray();
        sources.add(sourceName);
        root.add("sources", sources);
        JsonArray contents = new JsonArray();
        contents.add(sourceContent);
        root.add("sourcesContent", contents);
        root.add("names", new JsonArray());
        root.addProperty("mappings", encodeMappings());
        return new GsonBuilder().disableHtmlEscaping().create().toJson(root);
    }

    /**
     * 行以 ';' 分隔，段以 ',' 分隔；每段四个字段：生成列、源索引、源行、源列，均为相对前值的增量
     */
    String encodeMappings() {
        StringBuilder sb = new StringBuilder();
        int currentLine = 0;
        int prevSourceLine = 0;
        int prevSourceColumn = 0;
        int prevGeneratedColumn = 0;
        boolean firstInLine = true;

        for (Mapping m : mappings) {
            while (currentLine < m.generatedLine) {
                sb.append(';');
                currentLine++;
                prevGeneratedColumn = 0;
                firstInLine = true;
            }
            if (!firstInLine) {
                sb.append(',');
            }
            int sourceLine = m.sourceLine - 1;
            int sourceColumn = Math.max(m.sourceColumn - 1, 0);
            encodeVlq(sb, m.generatedColumn - prevGeneratedColumn);
            encodeVlq(sb, 0);
            encodeVlq(sb, sourceLine - prevSourceLine);
            encodeVlq(sb, sourceColumn - prevSourceColumn);
            prevGeneratedColumn = m.generatedColumn;
            prevSourceLine = sourceLine;
            prevSourceColumn = sourceColumn;
            firstInLine = false;
        }
        return sb.toString();
    }

    static void encodeVlq(StringBuilder sb, int value) {
        int vlq = value < 0 ? ((-value) << 1) | 1 : value << 1;
        do {
            int digit = vlq & 0x1f;
            vlq >>>= 5;
            if (vlq > 0) {
                digit |= 0x20;
            }
            sb.append(BASE64.charAt(digit));
        } while (vlq > 0);
    }

    /** 单条映射 */
    private static final class Mapping {
        final int generatedLine;
        final int generatedColumn;
        final int sourceLine;
        final int sourceColumn;

        Mapping(int generatedLine, int generatedColumn, int sourceLine, int sourceColumn) {
            this.generatedLine = generatedLine;
            this.generatedColumn = generatedColumn;
            this.sourceLine = sourceLine;
            this.sourceColumn = sourceColumn;
        }
    }
}
