package com.crowelang.compiler.compiler;

import com.crowelang.compiler.diagnostic.Diagnostic;
import com.crowelang.compiler.diagnostic.Diagnostics;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * 编译缓存测试
 */
class CompilationCacheTest {

    private static final String KEY = CompilationCache.key("target=TYPESCRIPT", "strategy S { }");

    /** 记录调用次数的编译函数 */
    private static final class CountingCompiler implements Supplier<CompileResult> {
        final AtomicInteger calls = new AtomicInteger();
        private final CompileResult result;

        CountingCompiler(CompileResult result) {
            this.result = result;
        }

        @Override
        public CompileResult get() {
            calls.incrementAndGet();
            return result;
        }
    }

    private static CompileResult success(String code) {
        Diagnostics diagnostics = new Diagnostics("s.crowe");
        diagnostics.warning("NO_RISK_MGMT", "Strategy 'S' has no risk management defined", 1, 1);
        return new CompileResult(code, null, Collections.emptyList(),
                diagnostics.getWarnings(), null, false);
    }

    private static CompileResult failure() {
        Diagnostics diagnostics = new Diagnostics("s.crowe");
        diagnostics.lexicalError("Unexpected character '@'", 1, 3);
        return new CompileResult("", null, diagnostics.getErrors(),
                Collections.emptyList(), null, false);
    }

    @Nested
    @DisplayName("缓存键")
    class KeyTests {

        @Test
        @DisplayName("SHA-256 十六进制，源码或选项变化都会改变键")
        void testKey() {
            assertThat(KEY).hasSize(64).matches("[0-9a-f]+");
            assertThat(CompilationCache.key("target=TYPESCRIPT", "strategy S { }")).isEqualTo(KEY);
            assertThat(CompilationCache.key("target=TYPESCRIPT", "strategy T { }")).isNotEqualTo(KEY);
            assertThat(CompilationCache.key("target=JAVASCRIPT", "strategy S { }")).isNotEqualTo(KEY);
        }

        @Test
        @DisplayName("指纹与源码之间有分隔符")
        void testSeparator() {
            assertThat(CompilationCache.key("ab", "c")).isNotEqualTo(CompilationCache.key("a", "bc"));
        }

        @Test
        @DisplayName("容量必须为正")
        void testMaximumSize() {
            assertThatThrownBy(() -> new CompilationCache(null, 0))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("内存层")
    class MemoryTests {

        @Test
        @DisplayName("命中时不再编译")
        void testHit() {
            CompilationCache cache = new CompilationCache();
            CompileStats stats = new CompileStats();
            CountingCompiler compiler = new CountingCompiler(success("export {};\n"));

            CompileResult first = cache.get(KEY, compiler, stats);
            CompileResult second = cache.get(KEY, compiler, stats);

            assertThat(compiler.calls.get()).isEqualTo(1);
            assertThat(first.isFromCache()).isFalse();
            assertThat(second.isFromCache()).isTrue();
            assertThat(second.getCode()).isEqualTo(first.getCode());
            assertThat(stats.getCacheMisses()).isEqualTo(1);
            assertThat(stats.getCacheHits()).isEqualTo(1);
            assertThat(cache.size()).isEqualTo(1);
        }

        @Test
        @DisplayName("失败结果不缓存")
        void testFailureNotCached() {
            CompilationCache cache = new CompilationCache();
            CompileStats stats = new CompileStats();
            CountingCompiler compiler = new CountingCompiler(failure());

            assertThat(cache.get(KEY, compiler, stats).isSuccess()).isFalse();
            assertThat(cache.get(KEY, compiler, stats).isFromCache()).isFalse();

            assertThat(compiler.calls.get()).isEqualTo(2);
            assertThat(stats.getCacheMisses()).isEqualTo(2);
            assertThat(cache.size()).isZero();
        }

        @Test
        @DisplayName("清空后重新编译")
        void testInvalidateAll() {
            CompilationCache cache = new CompilationCache();
            CompileStats stats = new CompileStats();
            CountingCompiler compiler = new CountingCompiler(success("a"));

            cache.get(KEY, compiler, stats);
            cache.invalidateAll();
            cache.get(KEY, compiler, stats);

            assertThat(compiler.calls.get()).isEqualTo(2);
        }
    }

    @Nested
    @DisplayName("磁盘层")
    class DiskTests {

        @TempDir
        Path directory;

        @Test
        @DisplayName("新实例从磁盘读取结果与警告")
        void testReadBack() {
            CountingCompiler compiler = new CountingCompiler(success("export const x = 1;\n"));
            new CompilationCache(directory, 16).get(KEY, compiler, new CompileStats());

            CompilationCache reopened = new CompilationCache(directory, 16);
            assertThat(Files.isRegularFile(reopened.entryPath(KEY))).isTrue();

            CompileStats stats = new CompileStats();
            CompileResult result = reopened.get(KEY, compiler, stats);

            assertThat(compiler.calls.get()).isEqualTo(1);
            assertThat(result.isFromCache()).isTrue();
            assertThat(result.getCode()).isEqualTo("export const x = 1;\n");
            assertThat(result.getAst()).isNull();
            assertThat(result.getWarnings()).extracting(Diagnostic::getCode).containsExactly("NO_RISK_MGMT");
            assertThat(stats.getCacheHits()).isEqualTo(1);
        }

        @Test
        @DisplayName("损坏的条目视为未命中并被覆盖")
        void testCorruptEntry() throws Exception {
            CompilationCache cache = new CompilationCache(directory, 16);
            Files.write(cache.entryPath(KEY), "{not json".getBytes(StandardCharsets.UTF_8));

            CountingCompiler compiler = new CountingCompiler(success("ok"));
            CompileResult result = cache.get(KEY, compiler, new CompileStats());

            assertThat(compiler.calls.get()).isEqualTo(1);
            assertThat(result.getCode()).isEqualTo("ok");
            assertThat(new String(Files.readAllBytes(cache.entryPath(KEY)), StandardCharsets.UTF_8))
                    .contains("\"key\":\"" + KEY + "\"");
        }

        @Test
        @DisplayName("键不匹配或版本不同的条目被忽略")
        void testForeignEntry() throws Exception {
            CompilationCache cache = new CompilationCache(directory, 16);
            Files.write(cache.entryPath(KEY),
                    "{\"version\":1,\"key\":\"other\",\"code\":\"stale\"}".getBytes(StandardCharsets.UTF_8));
            CountingCompiler compiler = new CountingCompiler(success("fresh"));
            assertThat(cache.get(KEY, compiler, new CompileStats()).getCode()).isEqualTo("fresh");

            cache.invalidateAll();
            Files.write(cache.entryPath(KEY),
                    ("{\"version\":99,\"key\":\"" + KEY + "\",\"code\":\"stale\"}").getBytes(StandardCharsets.UTF_8));
            assertThat(cache.get(KEY, compiler, new CompileStats()).getCode()).isEqualTo("fresh");
            assertThat(compiler.calls.get()).isEqualTo(2);
        }

        @Test
        @DisplayName("失败结果不写盘")
        void testFailureNotWritten() {
            CompilationCache cache = new CompilationCache(directory, 16);
            cache.get(KEY, new CountingCompiler(failure()), new CompileStats());
            assertThat(Files.exists(cache.entryPath(KEY))).isFalse();
        }
    }
}
