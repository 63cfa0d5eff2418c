package com.crowelang.compiler.compiler;

import com.crowelang.compiler.diagnostic.Diagnostic;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 内容寻址的编译缓存
 *
 * <p>键为选项指纹与源码的 SHA-256。内存层使用 Caffeine，同一键的并发请求
 * 只会触发一次编译；可选的磁盘层每个键一个 JSON 文件，先写临时文件再原子替换。</p>
 *
 * <p>只缓存没有错误的结果。</p>
 */
public final class CompilationCache {
    private static final Logger LOGGER = Logger.getLogger(CompilationCache.class.getName());

    public static final long DEFAULT_MAXIMUM_SIZE = 256;

    private static final int FORMAT_VERSION = 1;
    private static final String ENTRY_SUFFIX = ".json";

    private final Cache<String, CompileResult> memory;
    private final Path directory;
    private final Gson gson = new GsonBuilder().disableHtmlEscaping().create();

    public CompilationCache() {
        this(null, DEFAULT_MAXIMUM_SIZE);
    }

    /**
     * @param directory   磁盘缓存目录，null 表示只使用内存缓存
     * @param maximumSize 内存缓存最大条目数
     */
    public CompilationCache(Path directory, long maximumSize) {
        if (maximumSize <= 0) {
            throw new IllegalArgumentException("maximumSize must be positive");
        }
        this.directory = directory;
        this.memory = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .build();
    }

    /**
     * 计算缓存键
     *
     * @param fingerprint 影响输出的选项与文件名
     * @param source      源码
     */
    public static String key(String fingerprint, String source) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            md.update(fingerprint.getBytes(StandardCharsets.UTF_8));
            md.update((byte) 0);
            byte[] hash = md.digest(source.getBytes(StandardCharsets.UTF_8));
            StringBuilder sb = new StringBuilder();
            for (byte b : hash) {
                sb.append(String.format("%02x", b));
            }
            return sb.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * 查找缓存，未命中时调用 compiler 编译
     *
     * @return 命中时 {@link CompileResult#isFromCache()} 为 true
     */
    public CompileResult get(String key, Supplier<CompileResult> compiler, CompileStats stats) {
        // Caffeine 不缓存 null：失败结果通过 holder 带出
        final CompileResult[] computed = new CompileResult[1];
        final boolean[] fromDisk = new boolean[1];
        CompileResult cached = memory.get(key, k -> {
            CompileResult onDisk = readEntry(k);
            if (onDisk != null) {
                fromDisk[0] = true;
                return onDisk;
            }
            CompileResult result = compiler.get();
            computed[0] = result;
            if (!result.isSuccess()) {
                return null;
            }
            writeEntry(k, result);
            return result;
        });

        if (computed[0] != null) {
            stats.recordCacheMiss();
            return computed[0];
        }
        stats.recordCacheHit();
        LOGGER.fine("Compilation cache hit (" + (fromDisk[0] ? "disk" : "memory") + "): " + key);
        return cached.asCached();
    }

    public long size() {
        return memory.estimatedSize();
    }

    /** 清空内存层；磁盘层不受影响 */
    public void invalidateAll() {
        memory.invalidateAll();
    }

    // ============ 磁盘层 ============

    Path entryPath(String key) {
        return directory.resolve(key + ENTRY_SUFFIX);
    }

    private CompileResult readEntry(String key) {
        if (directory == null) {
            return null;
        }
        Path path = entryPath(key);
        if (!Files.isRegularFile(path)) {
            return null;
        }
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            JsonObject root = gson.fromJson(reader, JsonObject.class);
            if (root == null || !root.has("version") || root.get("version").getAsInt() != FORMAT_VERSION
                    || !root.has("key") || !key.equals(root.get("key").getAsString()) || !root.has("code")) {
                LOGGER.warning("Ignoring stale or foreign cache entry " + path);
                return null;
            }
            String sourceMap = root.has("sourceMap") && !root.get("sourceMap").isJsonNull()
                    ? root.get("sourceMap").getAsString() : null;
            List<Diagnostic> warnings = new ArrayList<>();
            if (root.has("warnings")) {
                for (JsonElement e : root.getAsJsonArray("warnings")) {
                    warnings.add(Diagnostic.fromJson(e.getAsJsonObject()));
                }
            }
            return new CompileResult(root.get("code").getAsString(), sourceMap,
                    Collections.emptyList(), warnings, null, true);
        } catch (IOException | JsonParseException | IllegalStateException
                 | IllegalArgumentException | UnsupportedOperationException e) {
            LOGGER.log(Level.WARNING, "Unreadable cache entry " + path + ", recompiling", e);
            return null;
        }
    }

    private void writeEntry(String key, CompileResult result) {
        if (directory == null) {
            return;
        }
        JsonObject root = new JsonObject();
        root.addProperty("version", FORMAT_VERSION);
        root.addProperty("key", key);
        root.addProperty("code", result.getCode());
        root.addProperty("sourceMap", result.getSourceMap());
        JsonArray warnings = new JsonArray();
        for (Diagnostic d : result.getWarnings()) {
            warnings.add(d.toJson());
        }
        root.add("warnings", warnings);

        Path target = entryPath(key);
        Path temp = null;
        try {
            Files.createDirectories(directory);
            temp = Files.createTempFile(directory, key, ".tmp");
            try (Writer writer = Files.newBufferedWriter(temp, StandardCharsets.UTF_8)) {
                gson.toJson(root, writer);
            }
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
            temp = null;
        } catch (IOException e) {
            // 写入失败不影响本次编译结果
            LOGGER.log(Level.WARNING, "Failed to write cache entry " + target, e);
        } finally {
            if (temp != null) {
                try {
                    Files.deleteIfExists(temp);
                } catch (IOException e) {
                    LOGGER.log(Level.FINE, "Failed to delete temporary cache file " + temp, e);
                }
            }
        }
    }
}
