package com.morphemizer.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.morphemizer.analyzer.AnalyzerException;
import com.morphemizer.config.Constants;
import com.morphemizer.config.MorphConfig;
import com.morphemizer.config.Preferences;
import com.morphemizer.morph.Morpheme;
import com.morphemizer.morph.Morphemizer;
import com.morphemizer.morph.MorphemizerRegistry;
import com.morphemizer.morph.SpaceMorphemizer;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.function.Function;

@Command(
    name = "morph",
    description = "按语言把文本切分为词素",
    mixinStandardHelpOptions = true,
    version = "1.0.0",
    subcommands = {
        MainCommand.ListSubcommand.class,
        MainCommand.SegmentSubcommand.class
    }
)
public class MainCommand implements Callable<Integer> {

    static Function<MorphConfig, MorphemizerRegistry> registryFactory = MorphemizerRegistry::createDefault;

    @Option(names = {"--config"}, description = "偏好设置文件（JSON）", defaultValue = Constants.DEFAULT_PREFERENCES_FILE)
    private Path configFile;

    @Option(names = {"--frequency-list"}, description = "越南语词频表路径，覆盖偏好设置中的 path_frequency")
    private Path frequencyList;

    @Option(names = {"--cache-size"}, description = "每个分词器的缓存容量", defaultValue = "131072")
    private int cacheSize;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new MainCommand()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        System.out.println("按语言把文本切分为词素");
        System.out.println("使用 --help 查看帮助信息");
        return 0;
    }

    MorphConfig buildConfig() {
        Preferences preferences = Preferences.load(configFile);
        if (frequencyList != null) {
            preferences = preferences.with(Constants.PREF_PATH_FREQUENCY, frequencyList.toString());
        }
        MorphConfig config = MorphConfig.defaults();
        config.setPreferences(preferences);
        if (cacheSize <= 0) {
            System.err.printf("非法缓存容量 %d，已回退为默认值 %d%n", cacheSize, Constants.MORPHEME_CACHE_CAPACITY);
        } else {
            config.setCacheCapacity(cacheSize);
        }
        return config;
    }

    @Command(name = "list", description = "列出全部分词器")
    static class ListSubcommand implements Callable<Integer> {

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                MorphemizerRegistry registry = registryFactory.apply(main.buildConfig());
                for (Morphemizer morphemizer : registry.getAllMorphemizers()) {
                    System.out.printf("%-24s %s%n", morphemizer.getName(), morphemizer.getDescription());
                }
                return 0;
            } catch (Exception exception) {
                System.err.println("列出分词器失败: " + exception.getMessage());
                return 1;
            }
        }
    }

    @Command(name = "segment", description = "切分表达式并输出词素")
    static class SegmentSubcommand implements Callable<Integer> {

        @Parameters(description = "要切分的表达式（可指定多个）", arity = "1..*")
        private List<String> expressions;

        @Option(names = {"-m", "--morphemizer"}, description = "分词器名称", defaultValue = SpaceMorphemizer.NAME)
        private String morphemizerName;

        @Option(names = {"-f", "--format"}, description = "输出格式 (text|json)", defaultValue = "text")
        private String format;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                MorphemizerRegistry registry = registryFactory.apply(main.buildConfig());
                Optional<Morphemizer> morphemizer = registry.getMorphemizerByName(morphemizerName);
                if (morphemizer.isEmpty()) {
                    System.err.println("未知的分词器: " + morphemizerName);
                    return 1;
                }

                for (String expression : expressions) {
                    List<Morpheme> morphemes = morphemizer.get().getMorphemesFromExpr(expression);
                    if ("json".equalsIgnoreCase(format)) {
                        printJsonResult(morphemes);
                    } else {
                        printTextResult(morphemes);
                    }
                }
                return 0;
            } catch (AnalyzerException analyzerException) {
                System.err.println("外部解析服务失败: " + analyzerException.getMessage());
                return 2;
            } catch (Exception exception) {
                System.err.println("切分失败: " + exception.getMessage());
                exception.printStackTrace();
                return 1;
            }
        }

        private void printTextResult(List<Morpheme> morphemes) {
            if (morphemes.isEmpty()) {
                System.out.println("(无词素)");
                return;
            }
            for (Morpheme morpheme : morphemes) {
                System.out.println(String.join("\t",
                    morpheme.inflected(), morpheme.base(), morpheme.read(), morpheme.pos(), morpheme.subPos()));
            }
        }

        private void printJsonResult(List<Morpheme> morphemes) throws IOException {
            ObjectMapper mapper = new ObjectMapper();
            System.out.println(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(morphemes));
        }
    }
}
