package work.pollochang.skinmatch;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.util.concurrent.Callable;

@Command(name = "skin-matcher",
        mixinStandardHelpOptions = true,
        version = "1.0",
        description = "角色皮膚相似度搜尋工具",
        subcommands = {SearchCommand.class, ConvertCommand.class, AlgorithmsCommand.class})
public class Execute implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        // 未指定子命令時只顯示說明
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Execute()).execute(args);
        System.exit(exitCode);
    }
}
