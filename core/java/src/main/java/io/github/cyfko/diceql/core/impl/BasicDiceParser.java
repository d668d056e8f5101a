package io.github.cyfko.diceql.core.impl;

import io.github.cyfko.diceql.core.api.DiceParser;
import io.github.cyfko.diceql.core.api.DieRoller;
import io.github.cyfko.diceql.core.api.ExpressionNode;
import io.github.cyfko.diceql.core.config.DicePolicy;
import io.github.cyfko.diceql.core.exception.DiceSyntaxException;
import io.github.cyfko.diceql.core.model.Field;
import io.github.cyfko.diceql.core.model.Term;
import io.github.cyfko.diceql.core.parsing.ExpressionTreeBuilder;
import io.github.cyfko.diceql.core.parsing.FieldSplitter;
import io.github.cyfko.diceql.core.parsing.TermClassifier;

import java.util.List;
import java.util.logging.Logger;

/**
 * Default {@link DiceParser} running the three parsing phases in sequence.
 *
 * <ol>
 *   <li><strong>Phase 1</strong>: {@link FieldSplitter#split(String, DicePolicy)} -
 *       operand/operator fields, expression length limit</li>
 *   <li><strong>Phase 2</strong>: {@link TermClassifier#classify(List, DicePolicy)} -
 *       tagged die/literal/operator terms, dice count and face limits</li>
 *   <li><strong>Phase 3</strong>: {@link ExpressionTreeBuilder#build(List, DieRoller)} -
 *       tree construction, rolling every die once</li>
 * </ol>
 *
 * <h2>Usage examples</h2>
 * <pre>{@code
 * // Default policy, system-seeded dice
 * DiceParser parser = new BasicDiceParser();
 * RollResult result = parser.evaluate("2d6+3");
 *
 * // Strict limits, reproducible dice
 * DiceParser parser = new BasicDiceParser(DicePolicy.strict(), RandomDieRoller.seeded(42L));
 * }</pre>
 *
 * <p>
 * The parser keeps no state between calls; thread safety depends on the injected {@link DieRoller}.
 * </p>
 *
 * @since 1.0.0
 */
public class BasicDiceParser implements DiceParser {

    private static final Logger log = Logger.getLogger(BasicDiceParser.class.getName());

    private final DicePolicy dicePolicy;
    private final DieRoller dieRoller;

    /**
     * Default constructor using {@link DicePolicy#defaults()} and a system-seeded {@link RandomDieRoller}.
     */
    public BasicDiceParser() {
        this(DicePolicy.defaults());
    }

    /**
     * Constructor with custom limits and a system-seeded {@link RandomDieRoller}.
     *
     * @param dicePolicy the complexity limits
     * @throws IllegalArgumentException if the policy is null
     */
    public BasicDiceParser(DicePolicy dicePolicy) {
        this(dicePolicy, new RandomDieRoller());
    }

    /**
     * Constructor with custom limits and random source.
     *
     * @param dicePolicy the complexity limits
     * @param dieRoller  the random source for dice
     * @throws IllegalArgumentException if either argument is null
     */
    public BasicDiceParser(DicePolicy dicePolicy, DieRoller dieRoller) {
        if (dicePolicy == null) {
            throw new IllegalArgumentException("Dice policy is required");
        }
        if (dieRoller == null) {
            throw new IllegalArgumentException("Die roller is required");
        }
        this.dicePolicy = dicePolicy;
        this.dieRoller = dieRoller;
    }

    public DicePolicy getDicePolicy() {
        return dicePolicy;
    }

    @Override
    public ExpressionNode parse(String expression) throws DiceSyntaxException {
        List<Field> fields = FieldSplitter.split(expression, dicePolicy);
        log.fine(() -> "Split '" + expression + "' into " + fields);

        List<Term> terms = TermClassifier.classify(fields, dicePolicy);
        log.fine(() -> "Classified terms: " + terms);

        ExpressionNode root = ExpressionTreeBuilder.build(terms, dieRoller);
        log.fine(() -> String.format("Evaluated '%s' to %d", expression, root.value()));
        return root;
    }
}
