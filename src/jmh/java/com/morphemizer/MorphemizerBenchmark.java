package com.morphemizer;

import com.morphemizer.morph.SpaceMorphemizer;
import com.morphemizer.morph.VietnameseMorphemizer;
import com.morphemizer.vocab.CompoundVocabulary;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.options.Options;
import org.openjdk.jmh.runner.options.OptionsBuilder;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * 分词性能基准测试
 */
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.SECONDS)
@State(Scope.Benchmark)
@Fork(value = 1, jvmArgs = {"-Xms1g", "-Xmx1g"})
@Warmup(iterations = 3)
@Measurement(iterations = 5)
public class MorphemizerBenchmark {

    @State(Scope.Thread)
    public static class VietnameseState {
        VietnameseMorphemizer morphemizer;
        String sentence;
        int counter;

        @Setup
        public void setup() {
            // 5000个合成复合词
            List<String> compounds = new ArrayList<>();
            for (int i = 0; i < 5000; i++) {
                compounds.add("từ" + i + " ghép" + (i % 7 == 0 ? " dài" + i : ""));
            }
            compounds.add("bánh mì");
            compounds.add("cà phê sữa đá");
            morphemizer = new VietnameseMorphemizer(CompoundVocabulary.of(compounds), 1024);
            sentence = "Sáng nay tôi ăn bánh mì và uống cà phê sữa đá ở quán quen gần nhà";
        }
    }

    @State(Scope.Thread)
    public static class CacheState {
        SpaceMorphemizer morphemizer = new SpaceMorphemizer();
        String sentence = "The quick brown fox jumps over the lazy dog";
    }

    @Benchmark
    public int vietnameseCompoundSubstitution(VietnameseState state) {
        // 每次使用不同的表达式以绕过缓存
        return state.morphemizer.getMorphemesFromExpr(state.sentence + " " + (state.counter++)).size();
    }

    @Benchmark
    @BenchmarkMode(Mode.AverageTime)
    @OutputTimeUnit(TimeUnit.NANOSECONDS)
    public int cachedSpaceSegmentation(CacheState state) {
        return state.morphemizer.getMorphemesFromExpr(state.sentence).size();
    }

    public static void main(String[] args) throws Exception {
        Options opt = new OptionsBuilder()
            .include(MorphemizerBenchmark.class.getSimpleName())
            .forks(1)
            .build();
        new Runner(opt).run();
    }
}
