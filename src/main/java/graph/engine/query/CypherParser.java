package graph.engine.query;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import graph.engine.error.GraphQueryException;
import graph.engine.expr.Aggregate;
import graph.engine.expr.Arithmetic;
import graph.engine.expr.BooleanExpression;
import graph.engine.expr.Comparison;
import graph.engine.expr.Expression;
import graph.engine.expr.FunctionCall;
import graph.engine.expr.InList;
import graph.engine.expr.Literal;
import graph.engine.expr.Negate;
import graph.engine.expr.NullCheck;
import graph.engine.expr.Parameter;
import graph.engine.expr.PropertyRef;
import graph.engine.expr.StringMatch;
import graph.engine.expr.VariableRef;

/**
 * Recursive descent parser for the read-only Cypher subset:
 * <pre>
 *   MATCH pattern [, pattern]* [WHERE expr] [MATCH ...]*
 *   RETURN [DISTINCT] expr [AS alias] [, ...]*
 *   [ORDER BY expr [ASC|DESC] [, ...]*] [SKIP n] [LIMIT n] [;]
 * </pre>
 * Keywords are case-insensitive. Malformed text fails with PARSE_ERROR.
 * Stateless; one instance may be shared between threads.
 */
public class CypherParser {
    private static final Set<String> UNSUPPORTED_CLAUSES = Set.of(
        "OPTIONAL", "CREATE", "MERGE", "DELETE", "DETACH", "SET", "REMOVE", "WITH", "UNWIND", "UNION", "CALL");

    public CypherQuery parse(String text) {
        if (text == null) throw new IllegalArgumentException("query text must not be null");
        return new Parser(tokenize(text)).query();
    }

    // ---- tokenizer -------------------------------------------------------

    enum TokenType { WORD, NUMBER, STRING, PARAM, SYMBOL, EOF }

    record Token(TokenType type, String text, int position) {
        boolean is(String symbolOrKeyword) {
            return (type == TokenType.SYMBOL && text.equals(symbolOrKeyword))
                || (type == TokenType.WORD && text.equalsIgnoreCase(symbolOrKeyword));
        }
    }

    List<Token> tokenize(String raw) {
        List<Token> out = new ArrayList<>();
        int i = 0;
        int n = raw.length();
        while (i < n) {
            char c = raw.charAt(i);
            if (Character.isWhitespace(c)) { i++; continue; }
            int start = i;
            if (Character.isLetter(c) || c == '_') {
                while (i < n && (Character.isLetterOrDigit(raw.charAt(i)) || raw.charAt(i) == '_')) i++;
                out.add(new Token(TokenType.WORD, raw.substring(start, i), start));
            } else if (c == '`') {
                int end = raw.indexOf('`', i + 1);
                if (end < 0) throw error("Unterminated quoted identifier", start);
                out.add(new Token(TokenType.WORD, raw.substring(i + 1, end), start));
                i = end + 1;
            } else if (Character.isDigit(c)) {
                while (i < n && Character.isDigit(raw.charAt(i))) i++;
                if (i + 1 < n && raw.charAt(i) == '.' && Character.isDigit(raw.charAt(i + 1))) {
                    i++;
                    while (i < n && Character.isDigit(raw.charAt(i))) i++;
                }
                if (i < n && (raw.charAt(i) == 'e' || raw.charAt(i) == 'E')) {
                    int j = i + 1;
                    if (j < n && (raw.charAt(j) == '+' || raw.charAt(j) == '-')) j++;
                    if (j < n && Character.isDigit(raw.charAt(j))) {
                        i = j;
                        while (i < n && Character.isDigit(raw.charAt(i))) i++;
                    }
                }
                out.add(new Token(TokenType.NUMBER, raw.substring(start, i), start));
            } else if (c == '\'' || c == '"') {
                StringBuilder sb = new StringBuilder();
                i++;
                boolean closed = false;
                while (i < n) {
                    char ch = raw.charAt(i);
                    if (ch == '\\' && i + 1 < n) {
                        char esc = raw.charAt(i + 1);
                        sb.append(switch (esc) {
                            case 'n' -> '\n';
                            case 't' -> '\t';
                            case 'r' -> '\r';
                            default -> esc;
                        });
                        i += 2;
                    } else if (ch == c) {
                        closed = true;
                        i++;
                        break;
                    } else {
                        sb.append(ch);
                        i++;
                    }
                }
                if (!closed) throw error("Unterminated string literal", start);
                out.add(new Token(TokenType.STRING, sb.toString(), start));
            } else if (c == '$') {
                i++;
                while (i < n && (Character.isLetterOrDigit(raw.charAt(i)) || raw.charAt(i) == '_')) i++;
                if (i == start + 1) throw error("Parameter name expected after '$'", start);
                out.add(new Token(TokenType.PARAM, raw.substring(start + 1, i), start));
            } else {
                String two = i + 1 < n ? raw.substring(i, i + 2) : "";
                if (two.equals("<=") || two.equals(">=") || two.equals("<>") || two.equals("!=")) {
                    out.add(new Token(TokenType.SYMBOL, two.equals("!=") ? "<>" : two, start));
                    i += 2;
                } else if ("()[]{}:,.-<>=+*/%|;".indexOf(c) >= 0) {
                    out.add(new Token(TokenType.SYMBOL, String.valueOf(c), start));
                    i++;
                } else {
                    throw error("Unexpected character '" + c + "'", start);
                }
            }
        }
        out.add(new Token(TokenType.EOF, "<end>", n));
        return out;
    }

    private static GraphQueryException error(String message, int position) {
        return GraphQueryException.parse(message + " at position " + position);
    }

    // ---- parser ----------------------------------------------------------

    private static final class Parser {
        private final List<Token> tokens;
        private int pos;

        Parser(List<Token> tokens) { this.tokens = tokens; }

        CypherQuery query() {
            List<PathPattern> patterns = new ArrayList<>();
            List<Expression> wheres = new ArrayList<>();
            rejectUnsupported();
            if (!peek().is("MATCH")) throw unexpected("MATCH");
            while (accept("MATCH")) {
                patterns.add(path());
                while (accept(",")) patterns.add(path());
                if (accept("WHERE")) wheres.add(expression());
                rejectUnsupported();
            }
            expect("RETURN");
            boolean distinct = accept("DISTINCT");
            List<ReturnItem> items = new ArrayList<>();
            do {
                if (peek().is("*")) throw unexpected("a return expression ('RETURN *' is not supported)");
                Expression e = expression();
                String alias = accept("AS") ? identifier() : null;
                items.add(new ReturnItem(e, alias));
            } while (accept(","));
            List<OrderItem> order = new ArrayList<>();
            if (accept("ORDER")) {
                expect("BY");
                do {
                    Expression e = expression();
                    boolean asc = true;
                    if (accept("DESC") || accept("DESCENDING")) asc = false;
                    else if (!accept("ASC")) accept("ASCENDING");
                    order.add(new OrderItem(e, asc));
                } while (accept(","));
            }
            Long skip = accept("SKIP") ? count("SKIP") : null;
            Long limit = accept("LIMIT") ? count("LIMIT") : null;
            accept(";");
            if (peek().type() != TokenType.EOF) {
                rejectUnsupported();
                throw unexpected("end of query");
            }
            Expression where = wheres.isEmpty() ? null : BooleanExpression.allOf(wheres);
            return new CypherQuery(patterns, where, distinct, items, order, skip, limit);
        }

        private void rejectUnsupported() {
            Token t = peek();
            if (t.type() == TokenType.WORD && UNSUPPORTED_CLAUSES.contains(t.text().toUpperCase(Locale.ROOT))) {
                throw error("Unsupported clause " + t.text().toUpperCase(Locale.ROOT), t.position());
            }
        }

        private long count(String clause) {
            Token t = next();
            if (t.type() != TokenType.NUMBER || t.text().contains(".") || t.text().toLowerCase(Locale.ROOT).contains("e")) {
                throw error(clause + " requires a non-negative integer", t.position());
            }
            try {
                return Long.parseLong(t.text());
            } catch (NumberFormatException e) {
                throw error(clause + " value out of range: " + t.text(), t.position());
            }
        }

        // pattern := node (relationship node)*
        private PathPattern path() {
            NodePattern start = node();
            List<PathPattern.Segment> segments = new ArrayList<>();
            while (peek().is("-") || peek().is("<")) {
                RelationshipPattern rel = relationship();
                segments.add(new PathPattern.Segment(rel, node()));
            }
            return new PathPattern(start, segments);
        }

        private NodePattern node() {
            expect("(");
            String variable = peek().type() == TokenType.WORD ? identifier() : null;
            String label = null;
            if (accept(":")) label = identifier();
            if (peek().is(":")) throw error("Multiple labels on one node are not supported", peek().position());
            Map<String, Expression> props = peek().is("{") ? propertyMap() : Map.of();
            expect(")");
            return new NodePattern(variable, label, props);
        }

        private RelationshipPattern relationship() {
            boolean incoming = accept("<");
            expect("-");
            String variable = null;
            String type = null;
            Map<String, Expression> props = Map.of();
            if (accept("[")) {
                if (peek().type() == TokenType.WORD) variable = identifier();
                if (accept(":")) type = identifier();
                if (peek().is("|")) throw error("Alternative relationship types are not supported", peek().position());
                if (peek().is("*")) throw error("Variable-length relationships are not supported", peek().position());
                if (peek().is("{")) props = propertyMap();
                expect("]");
            }
            expect("-");
            boolean outgoing = accept(">");
            Direction dir;
            if (incoming && !outgoing) dir = Direction.INCOMING;
            else if (outgoing && !incoming) dir = Direction.OUTGOING;
            else dir = Direction.EITHER;
            return new RelationshipPattern(variable, type, dir, props);
        }

        private Map<String, Expression> propertyMap() {
            expect("{");
            Map<String, Expression> props = new LinkedHashMap<>();
            if (!peek().is("}")) {
                do {
                    Token keyTok = peek();
                    String key = identifier();
                    expect(":");
                    if (props.put(key, expression()) != null) {
                        throw error("Duplicate property '" + key + "' in map", keyTok.position());
                    }
                } while (accept(","));
            }
            expect("}");
            return props;
        }

        // ---- expressions, lowest precedence first ----

        private Expression expression() { return or(); }

        private Expression or() {
            Expression left = xor();
            List<Expression> parts = null;
            while (accept("OR")) {
                if (parts == null) { parts = new ArrayList<>(); parts.add(left); }
                parts.add(xor());
            }
            return parts == null ? left : new BooleanExpression(BooleanExpression.Type.OR, parts);
        }

        private Expression xor() {
            Expression left = and();
            while (accept("XOR")) left = BooleanExpression.xor(left, and());
            return left;
        }

        private Expression and() {
            Expression left = not();
            List<Expression> parts = null;
            while (accept("AND")) {
                if (parts == null) { parts = new ArrayList<>(); parts.add(left); }
                parts.add(not());
            }
            return parts == null ? left : new BooleanExpression(BooleanExpression.Type.AND, parts);
        }

        private Expression not() {
            if (accept("NOT")) return BooleanExpression.not(not());
            return comparison();
        }

        private Expression comparison() {
            Expression left = additive();
            Token t = peek();
            if (t.type() == TokenType.SYMBOL) {
                Comparison.Op op = switch (t.text()) {
                    case "=" -> Comparison.Op.EQ;
                    case "<>" -> Comparison.Op.NE;
                    case "<" -> Comparison.Op.LT;
                    case "<=" -> Comparison.Op.LTE;
                    case ">" -> Comparison.Op.GT;
                    case ">=" -> Comparison.Op.GTE;
                    default -> null;
                };
                if (op != null) {
                    next();
                    return new Comparison(op, left, additive());
                }
                return left;
            }
            if (accept("IS")) {
                boolean negated = accept("NOT");
                expect("NULL");
                return new NullCheck(left, negated);
            }
            if (accept("IN")) {
                expect("[");
                List<Expression> items = new ArrayList<>();
                if (!peek().is("]")) {
                    do { items.add(expression()); } while (accept(","));
                }
                expect("]");
                return new InList(left, items);
            }
            if (accept("CONTAINS")) return new StringMatch(StringMatch.Op.CONTAINS, left, additive());
            if (accept("STARTS")) {
                expect("WITH");
                return new StringMatch(StringMatch.Op.STARTS_WITH, left, additive());
            }
            if (accept("ENDS")) {
                expect("WITH");
                return new StringMatch(StringMatch.Op.ENDS_WITH, left, additive());
            }
            return left;
        }

        private Expression additive() {
            Expression left = multiplicative();
            while (true) {
                if (accept("+")) left = new Arithmetic(Arithmetic.Op.ADD, left, multiplicative());
                else if (peek().is("-") && !startsRelationship()) {
                    next();
                    left = new Arithmetic(Arithmetic.Op.SUB, left, multiplicative());
                } else return left;
            }
        }

        // "-[" or "--" after an expression would only appear in a pattern, never in arithmetic
        private boolean startsRelationship() {
            Token after = tokens.get(Math.min(pos + 1, tokens.size() - 1));
            return after.is("[") || after.is("-") || after.is(">");
        }

        private Expression multiplicative() {
            Expression left = unary();
            while (true) {
                if (accept("*")) left = new Arithmetic(Arithmetic.Op.MUL, left, unary());
                else if (accept("/")) left = new Arithmetic(Arithmetic.Op.DIV, left, unary());
                else if (accept("%")) left = new Arithmetic(Arithmetic.Op.MOD, left, unary());
                else return left;
            }
        }

        private Expression unary() {
            if (accept("-")) {
                Expression operand = unary();
                if (operand instanceof Literal l && l.value() instanceof Long v) return new Literal(-v);
                if (operand instanceof Literal l && l.value() instanceof Double v) return new Literal(-v);
                return new Negate(operand);
            }
            if (accept("+")) return unary();
            return primary();
        }

        private Expression primary() {
            Token t = next();
            switch (t.type()) {
                case NUMBER -> { return number(t); }
                case STRING -> { return new Literal(t.text()); }
                case PARAM -> { return new Parameter(t.text()); }
                case SYMBOL -> {
                    if (t.is("(")) {
                        Expression inner = expression();
                        expect(")");
                        return inner;
                    }
                    if (t.is("[")) throw error("List literals are only supported after IN", t.position());
                    throw error("Unexpected '" + t.text() + "'", t.position());
                }
                case WORD -> {
                    String word = t.text();
                    if (word.equalsIgnoreCase("true")) return Literal.TRUE;
                    if (word.equalsIgnoreCase("false")) return Literal.FALSE;
                    if (word.equalsIgnoreCase("null")) return Literal.NULL;
                    if (peek().is("(")) return function(word);
                    if (accept(".")) {
                        Token prop = next();
                        if (prop.type() != TokenType.WORD) throw error("Property name expected after '.'", prop.position());
                        return new PropertyRef(word, prop.text());
                    }
                    return new VariableRef(word);
                }
                default -> throw error("Unexpected end of query", t.position());
            }
        }

        private Expression function(String name) {
            expect("(");
            if (accept("*")) {
                expect(")");
                if (name.equalsIgnoreCase("count")) return Aggregate.countStar();
                return new FunctionCall(name, List.of(), false, true);
            }
            boolean distinct = accept("DISTINCT");
            List<Expression> args = new ArrayList<>();
            if (!peek().is(")")) {
                do { args.add(expression()); } while (accept(","));
            }
            expect(")");
            return new FunctionCall(name, args, distinct, false);
        }

        private Literal number(Token t) {
            String s = t.text();
            try {
                if (s.contains(".") || s.contains("e") || s.contains("E")) return new Literal(Double.parseDouble(s));
                return new Literal(Long.parseLong(s));
            } catch (NumberFormatException e) {
                throw error("Invalid number literal: " + s, t.position());
            }
        }

        private String identifier() {
            Token t = next();
            if (t.type() != TokenType.WORD) throw error("Identifier expected but found '" + t.text() + "'", t.position());
            return t.text();
        }

        private Token peek() { return tokens.get(pos); }

        private Token next() {
            Token t = tokens.get(pos);
            if (t.type() != TokenType.EOF) pos++;
            return t;
        }

        private boolean accept(String s) {
            if (peek().is(s)) {
                pos++;
                return true;
            }
            return false;
        }

        private void expect(String s) {
            if (!accept(s)) throw unexpected("'" + s + "'");
        }

        private GraphQueryException unexpected(String expected) {
            Token t = peek();
            String found = t.type() == TokenType.EOF ? "end of query" : "'" + t.text() + "'";
            return error("Expected " + expected + " but found " + found, t.position());
        }
    }
}
