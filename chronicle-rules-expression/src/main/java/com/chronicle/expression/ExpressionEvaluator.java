package com.chronicle.expression;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import static com.chronicle.expression.Coercion.bool;
import static com.chronicle.expression.Coercion.isNull;
import static com.chronicle.expression.Coercion.numberNode;
import static com.chronicle.expression.Coercion.requireNumber;
import static com.chronicle.expression.Coercion.truthy;

/**
 * Evaluates expressions against a JSON variable context. Pure: no I/O, no shared mutable state, so one
 * instance can be used from many threads.
 * <p>
 * Evaluation is left-to-right and depth-first. {@code and}, {@code or}, {@code if} and the collection
 * operators evaluate only the arguments they need; skipped branches are never visited and never traced.
 * Inside a collection operator body, variables resolve against the current element ({@code reduce} binds
 * {@code current} and {@code accumulator}) and an empty var path means the element itself. At the top level
 * an empty var path is "no reference" and resolves to null.
 */
public final class ExpressionEvaluator {

    private static final Logger log = LoggerFactory.getLogger(ExpressionEvaluator.class);

    private final OperatorRegistry registry;

    public ExpressionEvaluator() {
        this(OperatorRegistry.empty());
    }

    public ExpressionEvaluator(OperatorRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    public OperatorRegistry getRegistry() {
        return registry;
    }

    /** Parses and evaluates the wire form with a trace. Never throws for expression errors. */
    public EvaluationResult evaluate(JsonNode expression, JsonNode context) {
        Expression parsed;
        try {
            parsed = ExpressionParser.parse(expression);
        } catch (ExpressionException e) {
            log.debug("Expression rejected | errorType={} | message={}", e.getErrorType(), e.getMessage());
            return EvaluationResult.failure(e, List.of());
        }
        return evaluate(parsed, context, true);
    }

    public EvaluationResult evaluate(Expression expression, JsonNode context) {
        return evaluate(expression, context, true);
    }

    /** Evaluates a parsed expression; errors become a failed result carrying the partial trace. */
    public EvaluationResult evaluate(Expression expression, JsonNode context, boolean includeTrace) {
        Objects.requireNonNull(expression, "expression");
        ExecutionTrace trace = includeTrace ? new ExecutionTrace() : ExecutionTrace.disabled();
        try {
            JsonNode value = evaluate(expression, context, trace);
            return EvaluationResult.success(value, trace.steps());
        } catch (ExpressionException e) {
            log.debug("Evaluation failed | errorType={} | message={} | steps={}", e.getErrorType(), e.getMessage(), trace.size());
            return EvaluationResult.failure(e, trace.steps());
        }
    }

    /**
     * Evaluates and records into the given trace.
     *
     * @throws ExpressionException on unknown operators, type mismatches or malformed nodes
     */
    public JsonNode evaluate(Expression expression, JsonNode context, ExecutionTrace trace) {
        Objects.requireNonNull(trace, "trace");
        JsonNode data = context != null ? context : JsonNodeFactory.instance.objectNode();
        return eval(expression, new Scope(data, false, trace));
    }

    private record Scope(JsonNode data, boolean nested, ExecutionTrace trace) {
        Scope withData(JsonNode element) {
            return new Scope(element, true, trace);
        }
    }

    private JsonNode eval(Expression e, Scope scope) {
        return switch (e.kind()) {
            case LITERAL -> evalLiteral((Literal) e, scope);
            case VAR -> evalVar((VarRef) e, scope);
            case OPERATION -> evalOperation((Operation) e, scope);
        };
    }

    private JsonNode evalLiteral(Literal literal, Scope scope) {
        int step = scope.trace().begin("literal", literal.toJson());
        JsonNode out;
        if (literal.isArray()) {
            ArrayNode arr = JsonNodeFactory.instance.arrayNode();
            for (Expression element : literal.elements()) arr.add(eval(element, scope));
            out = arr;
        } else {
            out = literal.value();
        }
        scope.trace().complete(step, out);
        return out;
    }

    private JsonNode evalVar(VarRef ref, Scope scope) {
        int step = scope.trace().begin(Operator.VAR, TextNode.valueOf(ref.path()));
        JsonNode found = resolvePath(scope.data(), ref.path(), scope.nested());
        JsonNode out;
        if (!isNull(found)) {
            out = found;
        } else if (ref.defaultValue() != null) {
            out = eval(ref.defaultValue(), scope);
        } else {
            out = NullNode.getInstance();
        }
        scope.trace().complete(step, out);
        return out;
    }

    static JsonNode resolvePath(JsonNode data, String path, boolean nested) {
        if (path.isEmpty()) return nested ? data : null;
        JsonNode cur = data;
        for (String segment : path.split("\\.", -1)) {
            if (isNull(cur)) return null;
            if (cur.isObject()) {
                cur = cur.get(segment);
            } else if (cur.isArray()) {
                cur = cur.get(parseIndex(segment));
            } else {
                return null;
            }
        }
        return cur;
    }

    private static int parseIndex(String segment) {
        try {
            return Integer.parseInt(segment);
        } catch (NumberFormatException e) {
            return -1;
        }
    }

    private JsonNode evalOperation(Operation op, Scope scope) {
        int step = scope.trace().begin(op.name(), op.toJson());
        JsonNode out = op.isBuiltIn() ? applyBuiltIn(op, scope) : applyCustom(op, scope);
        if (out == null) out = NullNode.getInstance();
        scope.trace().complete(step, out);
        return out;
    }

    private JsonNode applyCustom(Operation op, Scope scope) {
        CustomOperator custom = registry.get(op.name());
        if (custom == null) {
            throw new UnknownOperatorException(op.name());
        }
        List<JsonNode> args = args(op, scope);
        try {
            return custom.apply(args);
        } catch (ExpressionException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ExpressionException("Custom operator '" + op.name() + "' failed: " + e.getMessage(), e);
        }
    }

    private JsonNode applyBuiltIn(Operation op, Scope scope) {
        String name = op.name();
        return switch (op.operator()) {
            case AND -> and(op, scope);
            case OR -> or(op, scope);
            case NOT -> bool(!truthy(args(op, scope, 1, Integer.MAX_VALUE).get(0)));
            case DOUBLE_NOT -> bool(truthy(args(op, scope, 1, Integer.MAX_VALUE).get(0)));
            case IF -> ifThenElse(op, scope);

            case LOOSE_EQ -> {
                List<JsonNode> a = args(op, scope, 2, 2);
                yield bool(Coercion.looseEquals(a.get(0), a.get(1)));
            }
            case STRICT_EQ -> {
                List<JsonNode> a = args(op, scope, 2, 2);
                yield bool(Coercion.strictEquals(a.get(0), a.get(1)));
            }
            case LOOSE_NE -> {
                List<JsonNode> a = args(op, scope, 2, 2);
                yield bool(!Coercion.looseEquals(a.get(0), a.get(1)));
            }
            case STRICT_NE -> {
                List<JsonNode> a = args(op, scope, 2, 2);
                yield bool(!Coercion.strictEquals(a.get(0), a.get(1)));
            }
            case GT -> relational(args(op, scope, 2, 2), c -> c > 0);
            case GE -> relational(args(op, scope, 2, 2), c -> c >= 0);
            case LT -> relational(args(op, scope, 2, 3), c -> c < 0);
            case LE -> relational(args(op, scope, 2, 3), c -> c <= 0);

            case ADD -> {
                double sum = 0;
                for (JsonNode a : args(op, scope)) sum += requireNumber(name, a);
                yield numberNode(sum);
            }
            case SUBTRACT -> {
                List<JsonNode> a = args(op, scope, 1, 2);
                yield a.size() == 1
                        ? numberNode(-requireNumber(name, a.get(0)))
                        : numberNode(requireNumber(name, a.get(0)) - requireNumber(name, a.get(1)));
            }
            case MULTIPLY -> {
                double product = 1;
                for (JsonNode a : args(op, scope, 1, Integer.MAX_VALUE)) product *= requireNumber(name, a);
                yield numberNode(product);
            }
            case DIVIDE -> {
                List<JsonNode> a = args(op, scope, 2, 2);
                double divisor = nonZero(name, a.get(1));
                yield numberNode(requireNumber(name, a.get(0)) / divisor);
            }
            case MODULO -> {
                List<JsonNode> a = args(op, scope, 2, 2);
                double divisor = nonZero(name, a.get(1));
                yield numberNode(requireNumber(name, a.get(0)) % divisor);
            }
            case MIN -> extreme(name, args(op, scope), true);
            case MAX -> extreme(name, args(op, scope), false);

            case IN -> {
                List<JsonNode> a = args(op, scope, 2, 2);
                yield bool(contains(a.get(1), a.get(0)));
            }
            case CAT -> {
                StringBuilder sb = new StringBuilder();
                for (JsonNode a : args(op, scope)) {
                    if (!isNull(a)) sb.append(Coercion.toJsString(a));
                }
                yield TextNode.valueOf(sb.toString());
            }
            case SUBSTR -> substr(args(op, scope, 2, 3));
            case MERGE -> {
                ArrayNode merged = JsonNodeFactory.instance.arrayNode();
                for (JsonNode a : args(op, scope)) {
                    if (a.isArray()) merged.addAll((ArrayNode) a);
                    else merged.add(a);
                }
                yield merged;
            }

            case MAP -> map(op, scope);
            case FILTER -> filter(op, scope);
            case REDUCE -> reduce(op, scope);
            case ALL -> quantifier(op, scope, Quantifier.ALL);
            case NONE -> quantifier(op, scope, Quantifier.NONE);
            case SOME -> quantifier(op, scope, Quantifier.SOME);

            case MISSING -> missing(args(op, scope), scope);
            case MISSING_SOME -> missingSome(args(op, scope, 2, 2), scope);
        };
    }

    private List<JsonNode> args(Operation op, Scope scope) {
        List<JsonNode> out = new ArrayList<>(op.args().size());
        for (Expression a : op.args()) out.add(eval(a, scope));
        return out;
    }

    private List<JsonNode> args(Operation op, Scope scope, int min, int max) {
        requireArity(op, min, max);
        return args(op, scope);
    }

    private static void requireArity(Operation op, int min, int max) {
        int n = op.args().size();
        if (n < min || n > max) {
            String expected = min == max ? String.valueOf(min)
                    : max == Integer.MAX_VALUE ? "at least " + min : min + " to " + max;
            throw new MalformedExpressionException(
                    String.format("'%s' expects %s argument(s), got %d", op.name(), expected, n));
        }
    }

    private JsonNode and(Operation op, Scope scope) {
        requireArity(op, 1, Integer.MAX_VALUE);
        JsonNode last = null;
        for (Expression a : op.args()) {
            last = eval(a, scope);
            if (!truthy(last)) return last;
        }
        return last;
    }

    private JsonNode or(Operation op, Scope scope) {
        requireArity(op, 1, Integer.MAX_VALUE);
        JsonNode last = null;
        for (Expression a : op.args()) {
            last = eval(a, scope);
            if (truthy(last)) return last;
        }
        return last;
    }

    private JsonNode ifThenElse(Operation op, Scope scope) {
        List<Expression> a = op.args();
        int i = 0;
        for (; i + 1 < a.size(); i += 2) {
            if (truthy(eval(a.get(i), scope))) {
                return eval(a.get(i + 1), scope);
            }
        }
        return i < a.size() ? eval(a.get(i), scope) : NullNode.getInstance();
    }

    private interface Comparison {
        boolean test(int compareResult);
    }

    private static JsonNode relational(List<JsonNode> a, Comparison cmp) {
        Integer first = Coercion.compare(a.get(0), a.get(1));
        if (first == null || !cmp.test(first)) return bool(false);
        if (a.size() == 3) {
            Integer second = Coercion.compare(a.get(1), a.get(2));
            return bool(second != null && cmp.test(second));
        }
        return bool(true);
    }

    private static double nonZero(String operator, JsonNode divisor) {
        double d = requireNumber(operator, divisor);
        if (d == 0) throw new TypeMismatchException(operator, divisor, "division by zero");
        return d;
    }

    private static JsonNode extreme(String operator, List<JsonNode> args, boolean min) {
        if (args.isEmpty()) return NullNode.getInstance();
        double best = min ? Double.POSITIVE_INFINITY : Double.NEGATIVE_INFINITY;
        for (JsonNode a : args) {
            double d = requireNumber(operator, a);
            best = min ? Math.min(best, d) : Math.max(best, d);
        }
        return numberNode(best);
    }

    private static boolean contains(JsonNode haystack, JsonNode needle) {
        if (haystack == null) return false;
        if (haystack.isTextual()) {
            return haystack.textValue().contains(Coercion.toJsString(needle));
        }
        if (haystack.isArray()) {
            for (JsonNode element : haystack) {
                if (Coercion.strictEquals(element, needle)) return true;
            }
        }
        return false;
    }

    private static JsonNode substr(List<JsonNode> a) {
        String source = isNull(a.get(0)) ? "" : Coercion.toJsString(a.get(0));
        double rawStart = Coercion.toNumber(a.get(1));
        int len = source.length();
        int start = Double.isNaN(rawStart) ? 0 : (int) rawStart;
        if (start < 0) start = Math.max(len + start, 0);
        start = Math.min(start, len);
        String tail = source.substring(start);
        if (a.size() < 3) return TextNode.valueOf(tail);
        double rawLength = Coercion.toNumber(a.get(2));
        int count = Double.isNaN(rawLength) ? 0 : (int) rawLength;
        int end = count < 0 ? Math.max(tail.length() + count, 0) : Math.min(count, tail.length());
        return TextNode.valueOf(tail.substring(0, end));
    }

    private JsonNode map(Operation op, Scope scope) {
        requireArity(op, 2, 2);
        ArrayNode out = JsonNodeFactory.instance.arrayNode();
        JsonNode items = eval(op.arg(0), scope);
        if (items == null || !items.isArray()) return out;
        for (JsonNode item : items) out.add(eval(op.arg(1), scope.withData(item)));
        return out;
    }

    private JsonNode filter(Operation op, Scope scope) {
        requireArity(op, 2, 2);
        ArrayNode out = JsonNodeFactory.instance.arrayNode();
        JsonNode items = eval(op.arg(0), scope);
        if (items == null || !items.isArray()) return out;
        for (JsonNode item : items) {
            if (truthy(eval(op.arg(1), scope.withData(item)))) out.add(item);
        }
        return out;
    }

    private JsonNode reduce(Operation op, Scope scope) {
        requireArity(op, 2, 3);
        JsonNode items = eval(op.arg(0), scope);
        JsonNode acc = op.args().size() == 3 ? eval(op.arg(2), scope) : NullNode.getInstance();
        if (items == null || !items.isArray()) return acc;
        for (JsonNode item : items) {
            ObjectNode frame = JsonNodeFactory.instance.objectNode();
            frame.set("current", item);
            frame.set("accumulator", acc);
            acc = eval(op.arg(1), scope.withData(frame));
        }
        return acc;
    }

    private enum Quantifier { ALL, NONE, SOME }

    private JsonNode quantifier(Operation op, Scope scope, Quantifier q) {
        requireArity(op, 2, 2);
        JsonNode items = eval(op.arg(0), scope);
        boolean empty = items == null || !items.isArray() || items.size() == 0;
        if (empty) return bool(q == Quantifier.NONE);
        for (JsonNode item : items) {
            boolean hit = truthy(eval(op.arg(1), scope.withData(item)));
            switch (q) {
                case ALL -> {
                    if (!hit) return bool(false);
                }
                case NONE -> {
                    if (hit) return bool(false);
                }
                case SOME -> {
                    if (hit) return bool(true);
                }
            }
        }
        return bool(q != Quantifier.SOME);
    }

    private static ArrayNode missing(List<JsonNode> args, Scope scope) {
        List<JsonNode> keys = args;
        if (!args.isEmpty() && args.get(0).isArray()) {
            keys = new ArrayList<>();
            for (JsonNode k : args.get(0)) keys.add(k);
        }
        ArrayNode out = JsonNodeFactory.instance.arrayNode();
        for (JsonNode key : keys) {
            String path = isNull(key) ? "" : Coercion.toJsString(key);
            JsonNode value = resolvePath(scope.data(), path, scope.nested());
            if (isNull(value) || (value.isTextual() && value.textValue().isEmpty())) {
                out.add(key);
            }
        }
        return out;
    }

    private static ArrayNode missingSome(List<JsonNode> args, Scope scope) {
        JsonNode keys = args.get(1);
        if (!keys.isArray()) {
            throw new MalformedExpressionException("'missing_some' expects an array of variable names as second argument");
        }
        double need = requireNumber("missing_some", args.get(0));
        ArrayNode absent = missing(List.of(keys), scope);
        if (keys.size() - absent.size() >= need) {
            return JsonNodeFactory.instance.arrayNode();
        }
        return absent;
    }
}
