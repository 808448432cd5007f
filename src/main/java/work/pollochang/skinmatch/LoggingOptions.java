package work.pollochang.skinmatch;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Option;

/**
 * 各子命令共用的 -v 選項。
 */
public class LoggingOptions {

    static final String BASE_LOGGER = "work.pollochang.skinmatch";

    @Option(names = {"-v", "--verbose"}, description = "輸出除錯訊息。")
    void setVerbose(boolean verbose) {
        if (verbose && LoggerFactory.getLogger(BASE_LOGGER) instanceof Logger logger) {
            logger.setLevel(Level.DEBUG);
        }
    }
}
