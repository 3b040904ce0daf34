package com.cubefour.core.policy;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.Locale;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Command line entry point for running {@link SelfPlay} sessions with configurable parameters.
 */
public final class SelfPlayRunner {

    private static final Logger LOGGER = Logger.getLogger(SelfPlayRunner.class.getName());
    private static final String LOGGING_CONFIG = "/logging.properties";

    private SelfPlayRunner() {
    }

    public static void main(String[] args) {
        installLoggingConfiguration();
        if (args.length < 2 || args.length > 6) {
            printUsage();
            return;
        }
        try {
            int gameCount = Integer.parseInt(args[0]);
            long timeLimitMillis = Long.parseLong(args[1]);
            SearchAlgorithm firstAlgorithm = SearchAlgorithm.NEGAMAX;
            SearchAlgorithm secondAlgorithm = SearchAlgorithm.NEGAMAX;
            EngineConfig config = EngineConfig.defaults().withTimeLimit(Duration.ofMillis(timeLimitMillis));

            for (int index = 2; index < args.length; index++) {
                String option = args[index];
                if (option.startsWith("--first=")) {
                    firstAlgorithm = parseAlgorithm(option.substring("--first=".length()));
                } else if (option.startsWith("--second=")) {
                    secondAlgorithm = parseAlgorithm(option.substring("--second=".length()));
                } else if (option.startsWith("--maxDepth=")) {
                    config = config.withMaxDepth(Integer.parseInt(option.substring("--maxDepth=".length())));
                } else if (option.startsWith("--seed=")) {
                    config = config.withRandomSeed(Long.parseLong(option.substring("--seed=".length())));
                } else {
                    throw new IllegalArgumentException("Unrecognised argument: " + option);
                }
            }

            SelfPlay selfPlay = new SelfPlay(new DecisionPolicy(config.withAlgorithm(firstAlgorithm)),
                    new DecisionPolicy(config.withAlgorithm(secondAlgorithm)));
            selfPlay.playGames(gameCount);
            LOGGER.info(String.format("Finished %d games: first %d, second %d, draws %d", selfPlay.getGamesPlayed(),
                    selfPlay.getFirstWins(), selfPlay.getSecondWins(), selfPlay.getDraws()));
        } catch (NumberFormatException ex) {
            LOGGER.log(Level.SEVERE, "Failed to parse arguments", ex);
            printUsage();
        } catch (IllegalArgumentException ex) {
            LOGGER.log(Level.SEVERE, ex.getMessage(), ex);
        }
    }

    static SearchAlgorithm parseAlgorithm(String value) {
        return SearchAlgorithm.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    private static void installLoggingConfiguration() {
        try (InputStream input = SelfPlayRunner.class.getResourceAsStream(LOGGING_CONFIG)) {
            if (input != null) {
                LogManager.getLogManager().readConfiguration(input);
            }
        } catch (IOException ex) {
            LOGGER.log(Level.WARNING, "Failed to read logging configuration", ex);
        }
    }

    private static void printUsage() {
        System.err.println(
                "Usage: SelfPlayRunner <gameCount> <timeLimitMillis> [--first=negamax|mcts] "
                        + "[--second=negamax|mcts] [--maxDepth=<n>] [--seed=<n>]");
    }
}
