package io.github.cyfko.diceql.console;

import io.github.cyfko.diceql.core.api.DiceParser;
import io.github.cyfko.diceql.core.config.DicePolicy;
import io.github.cyfko.diceql.core.exception.DiceSyntaxException;
import io.github.cyfko.diceql.core.impl.BasicDiceParser;
import io.github.cyfko.diceql.core.impl.RandomDieRoller;
import io.github.cyfko.diceql.core.model.RollResult;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Interactive loop reading roll expressions and printing their evaluation.
 * <p>
 * Each line is evaluated with a {@link DiceParser} and printed as {@code "{rendered} = {total}"}
 * followed by a blank line. A blank line or end of input ends the loop. A malformed expression
 * is reported and the loop goes on.
 * </p>
 *
 * <h2>System properties</h2>
 * <ul>
 *   <li>{@code diceql.policy}: {@code DEFAULT} (default), {@code STRICT} or {@code RELAXED}</li>
 *   <li>{@code diceql.seed}: optional long seed for reproducible rolls</li>
 * </ul>
 *
 * @since 1.0.0
 */
public class DiceRollConsole {

    static final String PROMPT = "What would you like to roll?";
    static final String POLICY_PROPERTY = "diceql.policy";
    static final String SEED_PROPERTY = "diceql.seed";
    static final String LOGGING_CONFIG = "/diceql-logging.properties";

    private static final Logger log = Logger.getLogger(DiceRollConsole.class.getName());

    private final DiceParser parser;

    public DiceRollConsole(DiceParser parser) {
        this.parser = Objects.requireNonNull(parser, "parser cannot be null");
    }

    /**
     * Runs the loop until a blank line or the end of input.
     *
     * @param in  source of expressions, one per line
     * @param out destination of prompts and results
     * @return the number of expressions evaluated successfully
     * @throws UncheckedIOException if reading the input fails
     */
    public int run(BufferedReader in, PrintWriter out) {
        int evaluated = 0;
        while (true) {
            out.println(PROMPT);
            out.flush();

            String line;
            try {
                line = in.readLine();
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read roll expression", e);
            }
            if (line == null || line.isBlank()) {
                break;
            }

            try {
                RollResult result = parser.evaluate(line);
                out.println(result.format());
                evaluated++;
            } catch (DiceSyntaxException e) {
                log.fine(() -> String.format("Rejected '%s' (%s): %s", line, e.getKind(), e.getMessage()));
                out.println("Invalid roll: " + e.getMessage());
            }
            out.println();
        }
        out.flush();
        return evaluated;
    }

    /**
     * Builds the parser described by the {@code diceql.policy} and {@code diceql.seed} properties.
     *
     * @param policyName value of {@code diceql.policy}, null for the default policy
     * @param seed       value of {@code diceql.seed}, null for a system-seeded roller
     * @return the configured parser
     * @throws IllegalArgumentException if the policy name is unknown or the seed is not a long
     */
    static DiceParser createParser(String policyName, String seed) {
        DicePolicy policy = policyName == null ? DicePolicy.defaults() : DicePolicy.named(policyName);
        if (seed == null) {
            return new BasicDiceParser(policy);
        }
        try {
            return new BasicDiceParser(policy, RandomDieRoller.seeded(Long.parseLong(seed.trim())));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + SEED_PROPERTY + ": " + seed, e);
        }
    }

    static void configureLogging() {
        try (InputStream config = DiceRollConsole.class.getResourceAsStream(LOGGING_CONFIG)) {
            if (config != null) {
                LogManager.getLogManager().readConfiguration(config);
            }
        } catch (IOException e) {
            log.log(Level.WARNING, "Could not load " + LOGGING_CONFIG, e);
        }
    }

    public static void main(String[] args) {
        configureLogging();
        DiceParser parser = createParser(System.getProperty(POLICY_PROPERTY), System.getProperty(SEED_PROPERTY));

        BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        PrintWriter out = new PrintWriter(System.out, true, StandardCharsets.UTF_8);
        int evaluated = new DiceRollConsole(parser).run(in, out);
        log.info(() -> String.format("Console closed after %d roll(s)", evaluated));
    }
}
