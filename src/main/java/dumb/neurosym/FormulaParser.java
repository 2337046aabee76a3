package dumb.neurosym;

import dumb.neurosym.Formula.BinaryTemporalOp;
import dumb.neurosym.Formula.Connective;
import dumb.neurosym.Formula.DeonticOp;
import dumb.neurosym.Formula.Quantifier;
import dumb.neurosym.Formula.TemporalOp;
import dumb.neurosym.Term.Var;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Reads the textual formula language into {@link Formula} trees.
 * <p>
 * Precedence from loosest to tightest: quantifiers (body extends right), {@code ↔ ⊕}, {@code →} (right
 * associative), {@code ∨}, {@code ∧}, {@code U S} (right associative), prefix operators, atoms.
 * ASCII and Unicode spellings are interchangeable. The single letters {@code O P F G X} are operators only
 * when immediately followed by '('.
 */
public class FormulaParser {

    public static final int DEFAULT_MAX_DEPTH = 256;
    public static final int DEFAULT_MAX_LENGTH = 100_000;
    private static final int CONTEXT_RADIUS = 20;

    private final int maxDepth;
    private final int maxLength;

    public FormulaParser() {
        this(DEFAULT_MAX_DEPTH, DEFAULT_MAX_LENGTH);
    }

    public FormulaParser(int maxDepth, int maxLength) {
        if (maxDepth < 1 || maxDepth > Formula.MAX_DEPTH)
            throw new IllegalArgumentException("maxDepth must be within 1.." + Formula.MAX_DEPTH + ": " + maxDepth);
        if (maxLength < 1) throw new IllegalArgumentException("maxLength must be positive: " + maxLength);
        this.maxDepth = maxDepth;
        this.maxLength = maxLength;
    }

    public FormulaParser(Config.ParserConfig c) {
        this(c.maxDepth(), c.maxLength());
    }

    public int maxDepth() {
        return maxDepth;
    }

    public Formula parse(String text) throws ParseException {
        requireNonNull(text);
        if (text.length() > maxLength)
            throw new ParseException(ParseException.Kind.SYNTAX_ERROR,
                    "Input of " + text.length() + " characters exceeds the limit of " + maxLength, 1, 0, "");
        var tokens = new Lexer(text).tokens();
        var r = new Reader(text, tokens);
        Formula f;
        try {
            f = r.formula();
        } catch (IllegalArgumentException e) {
            var t = r.peek();
            throw new ParseException(ParseException.Kind.MAX_DEPTH_EXCEEDED, e.getMessage(), t.line, t.col, context(text, t.offset));
        }
        var t = r.peek();
        if (t.type != T.EOF) throw r.error("Unexpected " + t.describe() + " after complete formula", t);
        return f;
    }

    public List<Formula> parseAll(List<String> texts) throws ParseException {
        var out = new ArrayList<Formula>(texts.size());
        for (var s : texts) out.add(parse(s));
        return out;
    }

    private static String context(String text, int offset) {
        var from = Math.max(0, offset - CONTEXT_RADIUS);
        var to = Math.min(text.length(), offset + CONTEXT_RADIUS);
        return text.substring(from, to);
    }

    private enum T {
        NOT, AND, OR, IMPLIES, IFF, XOR,
        FORALL, EXISTS,
        ALWAYS, EVENTUALLY, NEXT, UNTIL, SINCE,
        OBLIGATORY, PERMITTED, FORBIDDEN,
        LPAREN, RPAREN, COMMA, DOT,
        IDENT, NUMBER, STRING, VAR,
        EOF
    }

    private record Token(T type, String text, int line, int col, int offset) {
        String describe() {
            return type == T.EOF ? "end of input" : "'" + text + "'";
        }
    }

    private static final class Lexer {
        private final String s;
        private final List<Token> out = new ArrayList<>();
        private int pos, line = 1, col;

        Lexer(String s) {
            this.s = s;
        }

        private static boolean identStart(int c) {
            return Character.isLetter(c) || c == '_';
        }

        private static boolean identPart(int c) {
            return Character.isLetterOrDigit(c) || c == '_';
        }

        private int peek(int ahead) {
            var i = pos + ahead;
            return i < s.length() ? s.charAt(i) : -1;
        }

        private void advance(int n) {
            for (var i = 0; i < n; i++) {
                if (s.charAt(pos) == '\n') {
                    line++;
                    col = 0;
                } else {
                    col++;
                }
                pos++;
            }
        }

        private void emit(T type, int length) {
            out.add(new Token(type, s.substring(pos, pos + length), line, col, pos));
            advance(length);
        }

        private ParseException error(ParseException.Kind kind, String message) {
            return new ParseException(kind, message, line, col, context(s, pos));
        }

        List<Token> tokens() throws ParseException {
            while (pos < s.length()) {
                var c = s.charAt(pos);
                if (Character.isWhitespace(c)) {
                    advance(1);
                    continue;
                }
                if (c == ';') {
                    while (pos < s.length() && s.charAt(pos) != '\n') advance(1);
                    continue;
                }
                switch (c) {
                    case '¬', '!', '~' -> emit(T.NOT, 1);
                    case '∧' -> emit(T.AND, 1);
                    case '&' -> emit(T.AND, peek(1) == '&' ? 2 : 1);
                    case '∨' -> emit(T.OR, 1);
                    case '|' -> emit(T.OR, peek(1) == '|' ? 2 : 1);
                    case '→' -> emit(T.IMPLIES, 1);
                    case '↔' -> emit(T.IFF, 1);
                    case '⊕', '^' -> emit(T.XOR, 1);
                    case '∀' -> emit(T.FORALL, 1);
                    case '∃' -> emit(T.EXISTS, 1);
                    case '□' -> emit(T.ALWAYS, 1);
                    case '◊', '◇' -> emit(T.EVENTUALLY, 1);
                    case '(' -> emit(T.LPAREN, 1);
                    case ')' -> emit(T.RPAREN, 1);
                    case ',' -> emit(T.COMMA, 1);
                    case '.' -> emit(T.DOT, 1);
                    case '"' -> string();
                    case '?' -> variable();
                    case '-' -> {
                        if (peek(1) == '>') emit(T.IMPLIES, 2);
                        else if (Character.isDigit(peek(1))) number();
                        else throw unknownOperator();
                    }
                    case '<' -> {
                        if (peek(1) == '-' && peek(2) == '>') emit(T.IFF, 3);
                        else throw unknownOperator();
                    }
                    default -> {
                        if (Character.isDigit(c)) number();
                        else if (identStart(c)) word();
                        else throw unknownOperator();
                    }
                }
            }
            out.add(new Token(T.EOF, "", line, col, pos));
            return out;
        }

        private ParseException unknownOperator() {
            var end = pos + 1;
            while (end < s.length() && !Character.isWhitespace(s.charAt(end)) && !identPart(s.charAt(end))
                    && "()\",.".indexOf(s.charAt(end)) < 0)
                end++;
            return error(ParseException.Kind.UNKNOWN_OPERATOR, "Unknown operator '" + s.substring(pos, end) + "'");
        }

        private void number() {
            var len = 1;
            while (Character.isDigit(peek(len))) len++;
            if (peek(len) == '.' && Character.isDigit(peek(len + 1))) {
                len++;
                while (Character.isDigit(peek(len))) len++;
            }
            emit(T.NUMBER, len);
        }

        private void word() {
            var len = 1;
            while (identPart(peek(len))) len++;
            var w = s.substring(pos, pos + len);
            var paren = peek(len) == '(';
            var type = switch (w) {
                case "forall" -> T.FORALL;
                case "exists" -> T.EXISTS;
                case "always" -> T.ALWAYS;
                case "eventually" -> T.EVENTUALLY;
                case "next" -> T.NEXT;
                case "until", "U" -> T.UNTIL;
                case "since", "S" -> T.SINCE;
                case "G" -> paren ? T.ALWAYS : T.IDENT;
                case "X" -> paren ? T.NEXT : T.IDENT;
                case "O" -> paren ? T.OBLIGATORY : T.IDENT;
                case "P" -> paren ? T.PERMITTED : T.IDENT;
                case "F" -> paren ? T.FORBIDDEN : T.IDENT;
                default -> T.IDENT;
            };
            emit(type, len);
        }

        private void variable() throws ParseException {
            var len = 1;
            if (!identStart(peek(len)))
                throw error(ParseException.Kind.SYNTAX_ERROR, "Variable name must follow '?'");
            while (identPart(peek(len))) len++;
            emit(T.VAR, len);
        }

        private void string() throws ParseException {
            var sb = new StringBuilder();
            var startLine = line;
            var startCol = col;
            var start = pos;
            advance(1);
            while (true) {
                if (pos >= s.length())
                    throw error(ParseException.Kind.SYNTAX_ERROR, "Unterminated string literal");
                var c = s.charAt(pos);
                if (c == '"') {
                    advance(1);
                    break;
                }
                if (c == '\\') {
                    if (pos + 1 >= s.length())
                        throw error(ParseException.Kind.SYNTAX_ERROR, "Unterminated string literal");
                    var e = s.charAt(pos + 1);
                    switch (e) {
                        case '"' -> sb.append('"');
                        case '\\' -> sb.append('\\');
                        case 'n' -> sb.append('\n');
                        case 't' -> sb.append('\t');
                        default -> throw error(ParseException.Kind.SYNTAX_ERROR, "Invalid escape sequence '\\" + e + "'");
                    }
                    advance(2);
                } else {
                    sb.append(c);
                    advance(1);
                }
            }
            out.add(new Token(T.STRING, sb.toString(), startLine, startCol, start));
        }
    }

    /** Recursive descent over the token list; {@link #depth} bounds the recursion. */
    private final class Reader {
        private final String text;
        private final List<Token> tokens;
        private final Deque<String> bound = new ArrayDeque<>();
        private int pos;
        private int depth;

        Reader(String text, List<Token> tokens) {
            this.text = text;
            this.tokens = tokens;
        }

        Token peek() {
            return tokens.get(pos);
        }

        private Token next() {
            var t = tokens.get(pos);
            if (t.type != T.EOF) pos++;
            return t;
        }

        private boolean at(T type) {
            return peek().type == type;
        }

        private Token expect(T type, String what) throws ParseException {
            var t = peek();
            if (t.type != type) throw error("Expected " + what + ", found " + t.describe(), t);
            return next();
        }

        ParseException error(String message, Token at) {
            return new ParseException(ParseException.Kind.SYNTAX_ERROR, message, at.line, at.col, context(text, at.offset));
        }

        private void enter() throws ParseException {
            if (++depth > maxDepth) {
                var t = peek();
                throw new ParseException(ParseException.Kind.MAX_DEPTH_EXCEEDED,
                        "Nesting exceeds the maximum depth of " + maxDepth, t.line, t.col, context(text, t.offset));
            }
        }

        private void exit() {
            depth--;
        }

        /** Left-associative chains grow without recursing, so their depth is checked on the result. */
        private Formula bounded(Formula f) throws ParseException {
            if (f.depth() > maxDepth) throw tooDeep();
            return f;
        }

        private ParseException tooDeep() {
            var t = peek();
            return new ParseException(ParseException.Kind.MAX_DEPTH_EXCEEDED,
                    "Nesting exceeds the maximum depth of " + maxDepth, t.line, t.col, context(text, t.offset));
        }

        Formula formula() throws ParseException {
            var left = implication();
            while (at(T.IFF) || at(T.XOR)) {
                var op = next().type == T.IFF ? Connective.IFF : Connective.XOR;
                left = bounded(new Formula.Binary(op, left, implication()));
            }
            return left;
        }

        private Formula implication() throws ParseException {
            var left = disjunction();
            if (at(T.IMPLIES)) {
                next();
                enter();
                var right = implication();
                exit();
                return Formula.implies(left, right);
            }
            return left;
        }

        private Formula disjunction() throws ParseException {
            var left = conjunction();
            while (at(T.OR)) {
                next();
                left = bounded(Formula.or(left, conjunction()));
            }
            return left;
        }

        private Formula conjunction() throws ParseException {
            var left = temporalBinary();
            while (at(T.AND)) {
                next();
                left = bounded(Formula.and(left, temporalBinary()));
            }
            return left;
        }

        private Formula temporalBinary() throws ParseException {
            var left = unary();
            if (at(T.UNTIL) || at(T.SINCE)) {
                var op = next().type == T.UNTIL ? BinaryTemporalOp.UNTIL : BinaryTemporalOp.SINCE;
                enter();
                var right = temporalBinary();
                exit();
                return new Formula.BinaryTemporal(op, left, right);
            }
            return left;
        }

        private Formula unary() throws ParseException {
            var t = peek();
            switch (t.type) {
                case NOT, ALWAYS, EVENTUALLY, NEXT, OBLIGATORY, PERMITTED, FORBIDDEN -> {
                    next();
                    enter();
                    var body = unary();
                    exit();
                    return switch (t.type) {
                        case NOT -> Formula.not(body);
                        case ALWAYS -> new Formula.Temporal(TemporalOp.ALWAYS, body);
                        case EVENTUALLY -> new Formula.Temporal(TemporalOp.EVENTUALLY, body);
                        case NEXT -> new Formula.Temporal(TemporalOp.NEXT, body);
                        case OBLIGATORY -> new Formula.Deontic(DeonticOp.OBLIGATORY, body);
                        case PERMITTED -> new Formula.Deontic(DeonticOp.PERMITTED, body);
                        default -> new Formula.Deontic(DeonticOp.FORBIDDEN, body);
                    };
                }
                case FORALL, EXISTS -> {
                    return quantified();
                }
                default -> {
                    return primary();
                }
            }
        }

        private Formula quantified() throws ParseException {
            var q = next().type == T.FORALL ? Quantifier.FORALL : Quantifier.EXISTS;
            var vars = new ArrayList<Var>();
            while (true) {
                var v = peek();
                if (v.type == T.IDENT) vars.add(Var.of(next().text));
                else if (v.type == T.VAR) vars.add(Var.of(next().text.substring(1)));
                else throw error("Expected variable after quantifier, found " + v.describe(), v);
                if (!at(T.COMMA)) break;
                next();
            }
            expect(T.DOT, "'.' after quantified variable");
            for (var v : vars) bound.push(v.name());
            enter();
            Formula body;
            try {
                body = formula();
            } finally {
                for (var i = 0; i < vars.size(); i++) bound.pop();
            }
            exit();
            if (body.depth() + vars.size() > maxDepth) throw tooDeep();
            for (var i = vars.size() - 1; i >= 0; i--) body = new Formula.Quantified(q, vars.get(i), body);
            return body;
        }

        private Formula primary() throws ParseException {
            var t = peek();
            switch (t.type) {
                case LPAREN -> {
                    next();
                    enter();
                    var f = formula();
                    expect(T.RPAREN, "')'");
                    exit();
                    return f;
                }
                case IDENT, UNTIL, SINCE -> {
                    next();
                    var args = at(T.LPAREN) ? arguments() : List.<Term>of();
                    return new Formula.Pred(t.text, args);
                }
                default -> throw error("Expected formula, found " + t.describe(), t);
            }
        }

        private List<Term> arguments() throws ParseException {
            expect(T.LPAREN, "'('");
            enter();
            var args = new ArrayList<Term>();
            if (at(T.RPAREN)) throw error("Expected argument, found ')'", peek());
            args.add(term());
            while (at(T.COMMA)) {
                next();
                args.add(term());
            }
            expect(T.RPAREN, "')' or ','");
            exit();
            return args;
        }

        private Term term() throws ParseException {
            var t = peek();
            switch (t.type) {
                case VAR -> {
                    next();
                    return Var.of(t.text.substring(1));
                }
                case NUMBER, STRING -> {
                    next();
                    return Term.Const.of(t.text);
                }
                case IDENT, OBLIGATORY, PERMITTED, FORBIDDEN, NEXT, ALWAYS -> {
                    if (t.type != T.IDENT && !Character.isLetter(t.text.charAt(0)))
                        throw error("Expected term, found " + t.describe(), t);
                    next();
                    if (at(T.LPAREN)) return new Term.Fn(t.text, arguments());
                    return bound.contains(t.text) ? Var.of(t.text) : Term.Const.of(t.text);
                }
                default -> throw error("Expected term, found " + t.describe(), t);
            }
        }
    }

    public static class ParseException extends Exception {
        private final Kind kind;
        private final int line;
        private final int col;
        private final String context;

        public ParseException(Kind kind, String message, int line, int col, String context) {
            super(message);
            this.kind = requireNonNull(kind);
            this.line = line;
            this.col = col;
            this.context = context;
        }

        public Kind kind() {
            return kind;
        }

        public int line() {
            return line;
        }

        public int col() {
            return col;
        }

        public String context() {
            return context;
        }

        @Override
        public String getMessage() {
            var location = (line != -1 && col != -1) ? " at line " + line + ", col " + col : "";
            var ctx = context.isEmpty() ? "" : " near '" + context + "'";
            return "[" + kind + "] " + super.getMessage() + location + ctx;
        }

        public enum Kind {
            SYNTAX_ERROR, MAX_DEPTH_EXCEEDED, UNKNOWN_OPERATOR
        }
    }
}
