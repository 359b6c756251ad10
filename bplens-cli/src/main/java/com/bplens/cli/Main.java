package com.bplens.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * bplens CLI 入口点（picocli）
 */
@Command(name = "bplens", version = "bplens v0.1.0",
         mixinStandardHelpOptions = true,
         description = "将蓝图图转换为伪代码")
public class Main implements Callable<Integer> {

    @Parameters(index = "0", description = "图文件路径（剪贴板文本或 JSON）")
    String file;

    @Option(names = {"-f", "--format"}, description = "输入格式（json, text；默认按扩展名推断）")
    String format;

    @Option(names = "--indent-size", defaultValue = "4", description = "缩进空格数（默认 4）")
    int indentSize;

    @Option(names = "--use-tabs", description = "使用 Tab 缩进")
    boolean useTabs;

    @Option(names = "--types", description = "输出声明的类型标注")
    boolean showTypes;

    @Option(names = "--verbose", description = "输出详细日志")
    boolean verbose;

    @Override
    public Integer call() {
        LoggingSetup.install(verbose);
        AnalyzeRunner runner = new AnalyzeRunner(System.out, System.err);
        return runner.analyzeFile(file, format, runner.formatConfig(indentSize, useTabs, showTypes));
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }
}
