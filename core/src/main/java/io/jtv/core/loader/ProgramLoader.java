package io.jtv.core.loader;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import io.jtv.core.ast.Condition;
import io.jtv.core.ast.ControlStmt;
import io.jtv.core.ast.DataExpr;
import io.jtv.core.ast.Param;
import io.jtv.core.ast.Program;
import io.jtv.core.ast.Purity;
import io.jtv.core.ast.ReversibleOp;
import io.jtv.core.error.ProgramLoadException;
import io.jtv.core.types.Type;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.math.BigInteger;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.StreamSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads serialized syntax trees (YAML or JSON) into {@link Program}s.
 *
 * <p>Documents are validated against the bundled {@code schema/program-schema.json}, then converted
 * node by node with strict unknown-key rejection. Hex ({@code 0x…}) and binary ({@code 0b…})
 * integer spellings are decoded here, so the engine only ever sees integer literals.
 *
 * <p>Thread-safe.
 */
public final class ProgramLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ProgramLoader.class);

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final JsonSchemaFactory SCHEMA_FACTORY =
            JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012);
    private static final String SCHEMA_RESOURCE = "/schema/program-schema.json";

    // ── Strict unknown-key detection ──

    private static final Set<String> ASSIGN_KEYS = Set.of("target", "value");
    private static final Set<String> IF_KEYS = Set.of("cond", "then", "else");
    private static final Set<String> WHILE_KEYS = Set.of("cond", "body");
    private static final Set<String> FOR_KEYS = Set.of("var", "from", "to", "body");
    private static final Set<String> CALL_KEYS = Set.of("name", "args");
    private static final Set<String> COMPARE_KEYS = Set.of("left", "op", "right");
    private static final Set<String> UPDATE_KEYS = Set.of("target", "value");
    private static final Set<String> FUNCTION_KEYS = Set.of("name", "purity", "params", "returns", "body");
    private static final Set<String> PARAM_KEYS = Set.of("name", "type");

    private final JsonSchema schema;

    public ProgramLoader() {
        this.schema = loadSchema();
    }

    private static JsonSchema loadSchema() {
        try (InputStream in = ProgramLoader.class.getResourceAsStream(SCHEMA_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing classpath resource " + SCHEMA_RESOURCE);
            }
            return SCHEMA_FACTORY.getSchema(new ObjectMapper().readTree(in));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + SCHEMA_RESOURCE, e);
        }
    }

    /**
     * Loads a program document from a file. The program id defaults to the file name without
     * extension.
     *
     * @throws ProgramLoadException if the file cannot be read or is not a valid program
     */
    public Program load(Path path) {
        Objects.requireNonNull(path, "path must not be null");
        String source = path.toString();
        JsonNode root;
        try {
            root = YAML_MAPPER.readTree(path.toFile());
        } catch (IOException e) {
            throw new ProgramLoadException("Failed to read or parse program: " + e.getMessage(), e, source);
        }
        String fileName = path.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        return convert(root, dot > 0 ? fileName.substring(0, dot) : fileName, source);
    }

    /**
     * Parses a program document held in memory.
     *
     * @param source label used as the default program id and in error messages
     * @throws ProgramLoadException if the text is not a valid program
     */
    public Program parse(String content, String source) {
        Objects.requireNonNull(content, "content must not be null");
        JsonNode root;
        try {
            root = YAML_MAPPER.readTree(content);
        } catch (JsonProcessingException e) {
            throw new ProgramLoadException("Failed to parse program: " + e.getOriginalMessage(), e, source);
        }
        return convert(root, source, source);
    }

    private Program convert(JsonNode root, String defaultId, String source) {
        if (root == null || root.isMissingNode() || root.isNull()) {
            throw new ProgramLoadException("Program document is empty", source);
        }
        Set<ValidationMessage> violations = schema.validate(root);
        if (!violations.isEmpty()) {
            String detail = violations.stream()
                    .map(ValidationMessage::getMessage)
                    .sorted()
                    .collect(Collectors.joining("; "));
            throw new ProgramLoadException("Program does not match the document schema: " + detail, source);
        }

        Converter converter = new Converter(source);
        List<ControlStmt> statements = new ArrayList<>();
        JsonNode functions = root.get("functions");
        if (functions != null) {
            for (JsonNode fn : functions) {
                statements.add(converter.function(fn));
            }
        }
        statements.addAll(converter.block(root.get("main"), "main"));

        String id = root.hasNonNull("id") ? root.get("id").asText() : defaultId;
        Program program = new Program(id, ControlStmt.sequence(statements));
        LOG.debug("Loaded program: id={}, source={}, functions={}", id, source, program.functions().size());
        return program;
    }

    /** Node-to-tree conversion for one document; carries the source for error messages. */
    private static final class Converter {

        private final String source;

        Converter(String source) {
            this.source = source;
        }

        // ── Statements ──

        List<ControlStmt> block(JsonNode node, String where) {
            if (node == null || node.isNull()) {
                return List.of();
            }
            if (!node.isArray()) {
                throw error("'" + where + "' must be a list of statements");
            }
            List<ControlStmt> out = new ArrayList<>(node.size());
            for (JsonNode stmt : node) {
                out.add(statement(stmt));
            }
            return out;
        }

        ControlStmt blockStmt(JsonNode node, String where) {
            return ControlStmt.sequence(block(node, where));
        }

        ControlStmt statement(JsonNode node) {
            Map.Entry<String, JsonNode> entry = single(node, "statement");
            JsonNode body = entry.getValue();
            switch (entry.getKey()) {
                case "skip":
                    return ControlStmt.skip();
                case "assign":
                    rejectUnknownKeys(body, ASSIGN_KEYS, "assign");
                    return new ControlStmt.Assign(requireText(body, "target", "assign"), expr(require(body, "value", "assign")));
                case "if":
                    rejectUnknownKeys(body, IF_KEYS, "if");
                    return new ControlStmt.If(
                            condition(require(body, "cond", "if")),
                            blockStmt(body.get("then"), "if.then"),
                            blockStmt(body.get("else"), "if.else"));
                case "while":
                    rejectUnknownKeys(body, WHILE_KEYS, "while");
                    return new ControlStmt.While(condition(require(body, "cond", "while")), blockStmt(body.get("body"), "while.body"));
                case "for":
                    rejectUnknownKeys(body, FOR_KEYS, "for");
                    return new ControlStmt.ForRange(
                            requireText(body, "var", "for"),
                            expr(require(body, "from", "for")),
                            expr(require(body, "to", "for")),
                            blockStmt(body.get("body"), "for.body"));
                case "return":
                    return new ControlStmt.Return(expr(body));
                case "print":
                    return new ControlStmt.Print(expr(body));
                case "reverse":
                    return reverseBlock(body);
                case "call":
                    rejectUnknownKeys(body, CALL_KEYS, "call");
                    return new ControlStmt.CallStmt(requireText(body, "name", "call"), args(body.get("args")));
                case "function":
                    return function(body);
                default:
                    throw error("Unknown statement '" + entry.getKey() + "'");
            }
        }

        ControlStmt.FunctionDecl function(JsonNode node) {
            rejectUnknownKeys(node, FUNCTION_KEYS, "function");
            String name = requireText(node, "name", "function");
            List<Param> params = new ArrayList<>();
            JsonNode paramsNode = node.get("params");
            if (paramsNode != null) {
                for (JsonNode param : paramsNode) {
                    rejectUnknownKeys(param, PARAM_KEYS, name + ".params");
                    params.add(new Param(requireText(param, "name", "param"), type(requireText(param, "type", "param"))));
                }
            }
            Type returns = node.hasNonNull("returns") ? type(node.get("returns").asText()) : Type.UNIT;
            Purity purity;
            try {
                purity = Purity.fromKeyword(node.hasNonNull("purity") ? node.get("purity").asText() : null);
            } catch (IllegalArgumentException e) {
                throw error(e.getMessage());
            }
            return new ControlStmt.FunctionDecl(name, params, returns, purity, blockStmt(node.get("body"), name + ".body"));
        }

        private ControlStmt.ReverseBlock reverseBlock(JsonNode node) {
            if (!node.isArray()) {
                throw error("'reverse' must be a list of updates");
            }
            List<ReversibleOp> ops = new ArrayList<>();
            for (JsonNode opNode : node) {
                Map.Entry<String, JsonNode> entry = single(opNode, "reverse update");
                JsonNode body = entry.getValue();
                rejectUnknownKeys(body, UPDATE_KEYS, "reverse." + entry.getKey());
                String target = requireText(body, "target", entry.getKey());
                DataExpr value = expr(require(body, "value", entry.getKey()));
                switch (entry.getKey()) {
                    case "add":
                        ops.add(new ReversibleOp.AddAssign(target, value));
                        break;
                    case "sub":
                        ops.add(new ReversibleOp.SubAssign(target, value));
                        break;
                    default:
                        throw error("Unknown reverse update '" + entry.getKey() + "', expected 'add' or 'sub'");
                }
            }
            return new ControlStmt.ReverseBlock(ops);
        }

        private Type type(String name) {
            try {
                return Type.fromName(name);
            } catch (IllegalArgumentException e) {
                throw error(e.getMessage());
            }
        }

        // ── Conditions ──

        Condition condition(JsonNode node) {
            if (node.isObject() && node.size() == 1) {
                Map.Entry<String, JsonNode> entry = node.fields().next();
                JsonNode body = entry.getValue();
                switch (entry.getKey()) {
                    case "truthy":
                        return new Condition.Truthy(expr(body));
                    case "compare":
                        rejectUnknownKeys(body, COMPARE_KEYS, "compare");
                        return new Condition.Comparison(
                                expr(require(body, "left", "compare")),
                                comparator(requireText(body, "op", "compare")),
                                expr(require(body, "right", "compare")));
                    case "and":
                        return logical(body, Condition.LogicalOp.AND, "and");
                    case "or":
                        return logical(body, Condition.LogicalOp.OR, "or");
                    case "not":
                        return new Condition.Not(condition(body));
                    default:
                        break;
                }
            }
            return new Condition.Truthy(expr(node));
        }

        private Condition logical(JsonNode node, Condition.LogicalOp op, String where) {
            if (!node.isArray() || node.size() < 2) {
                throw error("'" + where + "' needs a list of at least two conditions");
            }
            Condition result = condition(node.get(0));
            for (int i = 1; i < node.size(); i++) {
                result = new Condition.Logical(result, op, condition(node.get(i)));
            }
            return result;
        }

        private Condition.Comparator comparator(String symbol) {
            for (Condition.Comparator comparator : Condition.Comparator.values()) {
                if (comparator.symbol().equals(symbol)) {
                    return comparator;
                }
            }
            throw error("Unknown comparison operator '" + symbol + "'");
        }

        // ── Expressions ──

        DataExpr expr(JsonNode node) {
            if (node.isIntegralNumber()) {
                return new DataExpr.IntegerLiteral(node.bigIntegerValue());
            } else if (node.isNumber()) {
                return new DataExpr.FloatLiteral(node.doubleValue());
            } else if (node.isTextual()) {
                return new DataExpr.VariableRef(node.asText());
            }
            Map.Entry<String, JsonNode> entry = single(node, "expression");
            JsonNode body = entry.getValue();
            switch (entry.getKey()) {
                case "int":
                    return new DataExpr.IntegerLiteral(integer(body.asText(), 10, ""));
                case "hex":
                    return new DataExpr.IntegerLiteral(integer(body.asText(), 16, "0x"));
                case "binary":
                    return new DataExpr.IntegerLiteral(integer(body.asText(), 2, "0b"));
                case "float":
                    return new DataExpr.FloatLiteral(floating(body));
                case "rational": {
                    JsonNode pair = pair(body, "rational");
                    BigInteger denominator = integer(pair.get(1).asText(), 10, "");
                    if (denominator.signum() == 0) {
                        throw error("Rational literal has a zero denominator");
                    }
                    return new DataExpr.RationalLiteral(integer(pair.get(0).asText(), 10, ""), denominator);
                }
                case "complex": {
                    JsonNode pair = pair(body, "complex");
                    return new DataExpr.ComplexLiteral(floating(pair.get(0)), floating(pair.get(1)));
                }
                case "symbol":
                    return new DataExpr.SymbolicLiteral(body.asText());
                case "var":
                    return new DataExpr.VariableRef(body.asText());
                case "add": {
                    JsonNode pair = pair(body, "add");
                    return new DataExpr.Addition(expr(pair.get(0)), expr(pair.get(1)));
                }
                case "sub": {
                    JsonNode pair = pair(body, "sub");
                    return new DataExpr.Addition(expr(pair.get(0)), new DataExpr.Negation(expr(pair.get(1))));
                }
                case "neg":
                    return new DataExpr.Negation(expr(body));
                case "call":
                    rejectUnknownKeys(body, CALL_KEYS, "call");
                    return new DataExpr.PureCall(requireText(body, "name", "call"), args(body.get("args")));
                default:
                    throw error("Unknown expression '" + entry.getKey() + "'");
            }
        }

        private List<DataExpr> args(JsonNode node) {
            if (node == null || node.isNull()) {
                return List.of();
            }
            if (!node.isArray()) {
                throw error("'args' must be a list");
            }
            List<DataExpr> out = new ArrayList<>(node.size());
            for (JsonNode arg : node) {
                out.add(expr(arg));
            }
            return out;
        }

        /** Decodes an integer literal; {@code prefix} is optional in the text. Underscores are separators. */
        private BigInteger integer(String text, int radix, String prefix) {
            String digits = text.trim().replace("_", "");
            boolean negative = digits.startsWith("-");
            if (negative) {
                digits = digits.substring(1);
            }
            if (!prefix.isEmpty() && digits.toLowerCase(Locale.ROOT).startsWith(prefix)) {
                digits = digits.substring(prefix.length());
            }
            try {
                BigInteger value = new BigInteger(digits, radix);
                return negative ? value.negate() : value;
            } catch (NumberFormatException e) {
                throw error("Invalid base-" + radix + " integer literal '" + text + "'");
            }
        }

        private double floating(JsonNode node) {
            if (node.isNumber()) {
                return node.doubleValue();
            }
            try {
                return Double.parseDouble(node.asText());
            } catch (NumberFormatException e) {
                throw error("Invalid float literal '" + node.asText() + "'");
            }
        }

        private JsonNode pair(JsonNode node, String where) {
            if (!node.isArray() || node.size() != 2) {
                throw error("'" + where + "' needs exactly two elements");
            }
            return node;
        }

        // ── Helpers ──

        private Map.Entry<String, JsonNode> single(JsonNode node, String what) {
            if (node == null || !node.isObject() || node.size() != 1) {
                throw error("Each " + what + " must be an object with exactly one key, got: " + node);
            }
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            return fields.next();
        }

        private JsonNode require(JsonNode node, String field, String where) {
            JsonNode value = node == null ? null : node.get(field);
            if (value == null || value.isNull()) {
                throw error("Missing required field '" + field + "' in '" + where + "'");
            }
            return value;
        }

        private String requireText(JsonNode node, String field, String where) {
            JsonNode value = require(node, field, where);
            if (!value.isTextual() || value.asText().isBlank()) {
                throw error("Field '" + field + "' in '" + where + "' must be a non-empty string");
            }
            return value.asText();
        }

        private void rejectUnknownKeys(JsonNode node, Set<String> knownKeys, String where) {
            if (node == null || !node.isObject()) {
                throw error("'" + where + "' must be an object");
            }
            List<String> unknown = StreamSupport.stream(((Iterable<String>) node::fieldNames).spliterator(), false)
                    .filter(key -> !knownKeys.contains(key))
                    .collect(Collectors.toList());
            if (!unknown.isEmpty()) {
                throw error("Unknown key" + (unknown.size() > 1 ? "s" : "") + " in '" + where + "': " + unknown
                        + ", recognized keys are: " + knownKeys);
            }
        }

        private ProgramLoadException error(String message) {
            return new ProgramLoadException(message, source);
        }
    }
}
