package work.pollochang.skinmatch;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;
import work.pollochang.skinmatch.algorithm.AlgorithmRegistry;
import work.pollochang.skinmatch.algorithm.MatchingAlgorithm;
import work.pollochang.skinmatch.embedding.EmbeddingBackend;

import java.io.PrintWriter;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(name = "algorithms",
        mixinStandardHelpOptions = true,
        description = "列出可用的比對演算法與權重。")
public class AlgorithmsCommand implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        AlgorithmRegistry registry = AlgorithmRegistry.createDefault(EmbeddingBackend.unavailable());
        for (MatchingAlgorithm algorithm : registry.all()) {
            out.printf("%-20s %s%n", algorithm.name(), algorithm.displayName());
            out.printf("%-20s %s%n", "", algorithm.description());
            for (Map.Entry<String, Double> weight : algorithm.weights().entrySet()) {
                out.printf("%-20s   %-18s %.0f%%%n", "", weight.getKey(), weight.getValue() * 100);
            }
        }
        out.flush();
        return 0;
    }
}
