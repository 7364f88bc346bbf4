package org.calista.culturerank;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.culturerank.core.RankEngine;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Console runner: ranks one request file and prints the response JSON.
 *
 * <pre>
 *   CultureRankApp &lt;request.json&gt; [config.json]
 * </pre>
 *
 * The config file defaults to {@code config/culture-rank.json} and is created with defaults
 * when missing.
 */
public final class CultureRankApp {

    private static final Logger log = LogManager.getLogger(CultureRankApp.class);

    static final Path DEFAULT_CONFIG = Path.of("config/culture-rank.json");

    public static void main(String[] args) {
        if (args.length < 1 || args.length > 2) {
            System.err.println("usage: CultureRankApp <request.json> [config.json]");
            System.exit(2);
        }
        Path request = Path.of(args[0]);
        Path config = args.length == 2 ? Path.of(args[1]) : DEFAULT_CONFIG;

        try {
            System.out.println(run(request, config));
        } catch (IOException e) {
            log.error("I/O failure for request={} config={}", request, config, e);
            System.exit(1);
        } catch (IllegalArgumentException e) {
            log.error("Rejected request {}: {}", request, e.getMessage());
            System.exit(3);
        }
    }

    static String run(Path requestFile, Path configFile) throws IOException {
        RankEngine engine = RankEngine.builder().build(configFile);
        return engine.rankFile(requestFile);
    }
}
