package com.memoryengine.ifmemory;

import com.memoryengine.domain.model.BindingSnapshot;
import com.memoryengine.domain.model.ConditionResult;
import com.memoryengine.domain.model.Scalar;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.expression.EvaluationContext;
import org.springframework.expression.EvaluationException;
import org.springframework.expression.ParseException;
import org.springframework.expression.spel.SpelNode;
import org.springframework.expression.spel.ast.BooleanLiteral;
import org.springframework.expression.spel.ast.FloatLiteral;
import org.springframework.expression.spel.ast.IntLiteral;
import org.springframework.expression.spel.ast.LongLiteral;
import org.springframework.expression.spel.ast.OpAnd;
import org.springframework.expression.spel.ast.OpDivide;
import org.springframework.expression.spel.ast.OpEQ;
import org.springframework.expression.spel.ast.OpGE;
import org.springframework.expression.spel.ast.OpGT;
import org.springframework.expression.spel.ast.OpLE;
import org.springframework.expression.spel.ast.OpLT;
import org.springframework.expression.spel.ast.OpMinus;
import org.springframework.expression.spel.ast.OpModulus;
import org.springframework.expression.spel.ast.OpMultiply;
import org.springframework.expression.spel.ast.OpNE;
import org.springframework.expression.spel.ast.OpOr;
import org.springframework.expression.spel.ast.OpPlus;
import org.springframework.expression.spel.ast.OperatorNot;
import org.springframework.expression.spel.ast.OperatorPower;
import org.springframework.expression.spel.ast.RealLiteral;
import org.springframework.expression.spel.ast.Ternary;
import org.springframework.expression.spel.ast.VariableReference;
import org.springframework.expression.spel.standard.SpelExpression;
import org.springframework.expression.spel.standard.SpelExpressionParser;
import org.springframework.expression.spel.support.SimpleEvaluationContext;
import org.springframework.stereotype.Component;

/**
 * {@link ConditionEvaluator} backed by the Spring Expression Language.
 *
 * <p>Each {@code [alias]} token is rewritten to a positional SpEL variable
 * ({@code #v0}, {@code #v1}, ...) so that alias names never clash with SpEL keywords
 * or reserved variables. The parsed tree is then restricted to literals, variables,
 * comparison, logical and arithmetic operators and the ternary operator; property
 * access, method calls, type and bean references, assignment and collection
 * operators are rejected at parse time. Evaluation runs in a read-only
 * {@link SimpleEvaluationContext}.
 *
 * <p>Result rules: a {@link Boolean} is taken as is; a {@link Number} is true when its
 * magnitude exceeds {@link Scalar#ZERO_TOLERANCE}; anything else is an error.
 */
@Component
public class SpelConditionEvaluator implements ConditionEvaluator {

    private static final Pattern ALIAS_TOKEN = Pattern.compile("\\[([^\\[\\]]*)]");
    private static final Pattern ALIAS_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final int MAX_CACHED_CONDITIONS = 4096;

    private static final List<Class<? extends SpelNode>> ALLOWED_NODES = List.of(
            BooleanLiteral.class,
            IntLiteral.class,
            LongLiteral.class,
            RealLiteral.class,
            FloatLiteral.class,
            VariableReference.class,
            OpAnd.class,
            OpOr.class,
            OperatorNot.class,
            OpEQ.class,
            OpNE.class,
            OpGT.class,
            OpGE.class,
            OpLT.class,
            OpLE.class,
            OpPlus.class,
            OpMinus.class,
            OpMultiply.class,
            OpDivide.class,
            OpModulus.class,
            OperatorPower.class,
            Ternary.class);

    private final SpelExpressionParser parser = new SpelExpressionParser();

    /** Successfully parsed conditions keyed by their text. */
    private final Map<String, ParsedCondition> parsedConditions = new ConcurrentHashMap<>();

    @Override
    public ConditionResult evaluate(String condition, BindingSnapshot snapshot) {
        ParsedCondition parsed;
        try {
            parsed = parse(condition);
        } catch (InvalidConditionException e) {
            return ConditionResult.error(e.getMessage());
        }

        EvaluationContext context = SimpleEvaluationContext.forReadOnlyDataBinding().build();
        for (Map.Entry<String, String> variable : parsed.variableNames().entrySet()) {
            String alias = variable.getKey();
            if (!snapshot.contains(alias)) {
                return ConditionResult.error("Unknown alias '" + alias + "'");
            }
            context.setVariable(variable.getValue(), snapshot.get(alias).toEvaluationValue());
        }

        Object value;
        try {
            value = parsed.expression().getValue(context);
        } catch (EvaluationException e) {
            return ConditionResult.error("Evaluation failed: " + e.getMessage());
        } catch (ArithmeticException e) {
            // Integer division or modulus by zero is not wrapped by SpEL
            return ConditionResult.error("Evaluation failed: " + e.getMessage());
        }

        if (value instanceof Boolean booleanValue) {
            return ConditionResult.of(booleanValue);
        }
        if (value instanceof Number number) {
            return ConditionResult.of(Scalar.isNonZero(number.doubleValue()));
        }
        return ConditionResult.error("Condition must yield a boolean or a number, got "
                + (value == null ? "null" : value.getClass().getSimpleName()));
    }

    @Override
    public Optional<String> validate(String condition, Set<String> boundAliases) {
        ParsedCondition parsed;
        try {
            parsed = parse(condition);
        } catch (InvalidConditionException e) {
            return Optional.of(e.getMessage());
        }
        return parsed.variableNames().keySet().stream()
                .filter(alias -> !boundAliases.contains(alias))
                .findFirst()
                .map(alias -> "Unknown alias '" + alias + "'");
    }

    @Override
    public Set<String> referencedAliases(String condition) {
        Set<String> aliases = new LinkedHashSet<>();
        if (condition == null) {
            return aliases;
        }
        Matcher matcher = ALIAS_TOKEN.matcher(condition);
        while (matcher.find()) {
            aliases.add(matcher.group(1));
        }
        return aliases;
    }

    private ParsedCondition parse(String condition) {
        if (condition == null || condition.isBlank()) {
            throw new InvalidConditionException("Condition is empty");
        }
        ParsedCondition cached = parsedConditions.get(condition);
        if (cached != null) {
            return cached;
        }

        Map<String, String> variableNames = new LinkedHashMap<>();
        StringBuilder rewritten = new StringBuilder();
        Matcher matcher = ALIAS_TOKEN.matcher(condition);
        while (matcher.find()) {
            String alias = matcher.group(1);
            if (!ALIAS_NAME.matcher(alias).matches()) {
                throw new InvalidConditionException("Invalid alias reference '[" + alias + "]'");
            }
            String variableName = variableNames.computeIfAbsent(alias, key -> "v" + variableNames.size());
            matcher.appendReplacement(rewritten, Matcher.quoteReplacement(" #" + variableName + " "));
        }
        matcher.appendTail(rewritten);

        SpelExpression expression;
        try {
            expression = parser.parseRaw(rewritten.toString());
        } catch (ParseException e) {
            throw new InvalidConditionException("Syntax error: " + e.getSimpleMessage());
        }
        checkAllowed(expression.getAST());

        ParsedCondition parsed = new ParsedCondition(expression, Collections.unmodifiableMap(variableNames));
        if (parsedConditions.size() >= MAX_CACHED_CONDITIONS) {
            parsedConditions.clear();
        }
        parsedConditions.put(condition, parsed);
        return parsed;
    }

    private static void checkAllowed(SpelNode node) {
        if (ALLOWED_NODES.stream().noneMatch(allowed -> allowed.isInstance(node))) {
            throw new InvalidConditionException("Unsupported element '" + node.toStringAST() + "'");
        }
        for (int i = 0; i < node.getChildCount(); i++) {
            checkAllowed(node.getChild(i));
        }
    }

    private static final class ParsedCondition {

        private final SpelExpression expression;

        /** alias -> SpEL variable name, in order of first appearance. */
        private final Map<String, String> variableNames;

        private ParsedCondition(SpelExpression expression, Map<String, String> variableNames) {
            this.expression = expression;
            this.variableNames = variableNames;
        }

        SpelExpression expression() {
            return expression;
        }

        Map<String, String> variableNames() {
            return variableNames;
        }
    }

    private static final class InvalidConditionException extends RuntimeException {

        private InvalidConditionException(String message) {
            super(message);
        }
    }
}
