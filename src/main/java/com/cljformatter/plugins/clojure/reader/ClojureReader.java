package com.cljformatter.plugins.clojure.reader;

import com.cljformatter.api.error.SyntaxError;
import com.cljformatter.plugins.clojure.tree.Atom;
import com.cljformatter.plugins.clojure.tree.Collection;
import com.cljformatter.plugins.clojure.tree.Comment;
import com.cljformatter.plugins.clojure.tree.Forms;
import com.cljformatter.plugins.clojure.tree.Meta;
import com.cljformatter.plugins.clojure.tree.Node;
import com.cljformatter.plugins.clojure.tree.NodeType;
import com.cljformatter.plugins.clojure.tree.Tagged;
import com.cljformatter.plugins.clojure.tree.Whitespace;
import com.cljformatter.plugins.clojure.tree.Wrapper;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Reads Clojure source text into a comment-preserving syntax tree.
 * Every comment, whitespace run and comma becomes a node, and atoms keep their exact spelling,
 * so writing the tree back reproduces the input (with {@code \r\n} read as {@code \n}).
 */
public class ClojureReader {

    private static final Pattern INT_PATTERN = Pattern.compile(
            "[-+]?(?:0|[1-9][0-9]*|0[xX][0-9A-Fa-f]+|0[0-7]+|[1-9][0-9]?[rR][0-9A-Za-z]+|0[0-9]+)N?");
    private static final Pattern RATIO_PATTERN = Pattern.compile("[-+]?[0-9]+/[0-9]+");
    private static final Pattern FLOAT_PATTERN = Pattern.compile(
            "[-+]?[0-9]+(?:\\.[0-9]*)?(?:[eE][-+]?[0-9]+)?M?");
    private static final Pattern UNICODE_CHAR = Pattern.compile("u[0-9A-Fa-f]{4}");
    private static final Pattern OCTAL_CHAR = Pattern.compile("o[0-7]{1,3}");
    private static final List<String> NAMED_CHARS =
            List.of("newline", "space", "tab", "backspace", "formfeed", "return");

    private final String text;
    private int pos;
    private int line = 1;
    private int column = 1;

    private ClojureReader(String text) {
        this.text = text;
    }

    /**
     * Reads a whole source file.
     *
     * @throws SyntaxError on unbalanced delimiters or invalid literals
     */
    public static Forms read(String text) throws SyntaxError {
        return new ClojureReader(text).readForms();
    }

    private Forms readForms() throws SyntaxError {
        List<Node> children = new ArrayList<>();
        while (true) {
            _readNoise(children);
            if (_atEnd()) {
                return new Forms(children);
            }
            char c = _peek();
            if (_isClosing(c)) {
                throw _error("Unmatched delimiter: " + c);
            }
            children.add(_readForm());
        }
    }

    /**
     * Collects whitespace, commas and comments until the next significant character.
     */
    private void _readNoise(List<Node> into) {
        while (!_atEnd()) {
            char c = _peek();
            if (c == '\n' || c == '\r') {
                _next();
                if (c == '\r' && !_atEnd() && _peek() == '\n') {
                    _next();
                }
                into.add(Whitespace.newline());
            } else if (c == ',') {
                _next();
                into.add(new Whitespace(Whitespace.Kind.COMMA, ","));
            } else if (_isSpace(c)) {
                int start = pos;
                while (!_atEnd() && _isSpace(_peek())) {
                    _next();
                }
                into.add(new Whitespace(Whitespace.Kind.SPACE, text.substring(start, pos)));
            } else if (c == ';' || (c == '#' && _peekAt(1) == '!')) {
                into.add(_readComment());
            } else {
                return;
            }
        }
    }

    private Comment _readComment() {
        int start = pos;
        while (!_atEnd() && _peek() != '\n' && _peek() != '\r') {
            _next();
        }
        return new Comment(text.substring(start, pos));
    }

    private Node _readForm() throws SyntaxError {
        char c = _peek();
        switch (c) {
            case '(':
                return _readCollection(Collection.Kind.LIST, "", ')');
            case '[':
                return _readCollection(Collection.Kind.VECTOR, "", ']');
            case '{':
                return _readCollection(Collection.Kind.MAP, "", '}');
            case ')':
            case ']':
            case '}':
                throw _error("Unmatched delimiter: " + c);
            case '"':
                return new Atom(_readString(""));
            case '\'':
                _next();
                return _readWrapper(Wrapper.Kind.QUOTE);
            case '`':
                _next();
                return _readWrapper(Wrapper.Kind.SYNTAX_QUOTE);
            case '~':
                _next();
                if (!_atEnd() && _peek() == '@') {
                    _next();
                    return _readWrapper(Wrapper.Kind.UNQUOTE_SPLICING);
                }
                return _readWrapper(Wrapper.Kind.UNQUOTE);
            case '@':
                _next();
                return _readWrapper(Wrapper.Kind.DEREF);
            case '^':
                _next();
                return _readMeta("^");
            case '\\':
                return _readCharacter();
            case '#':
                return _readDispatch();
            default:
                return _readToken();
        }
    }

    private Collection _readCollection(Collection.Kind kind, String prefix, char close) throws SyntaxError {
        int openLine = line;
        int openColumn = column;
        _next();
        List<Node> children = new ArrayList<>();
        while (true) {
            _readNoise(children);
            if (_atEnd()) {
                throw new SyntaxError("EOF while reading, starting at line " + openLine
                        + ", column " + openColumn, line, column);
            }
            char c = _peek();
            if (c == close) {
                _next();
                return new Collection(kind, prefix, children);
            }
            if (_isClosing(c)) {
                throw _error("Unmatched delimiter: " + c + ", expected " + close);
            }
            children.add(_readForm());
        }
    }

    private String _readString(String prefix) throws SyntaxError {
        int startLine = line;
        int startColumn = column;
        int start = pos;
        _next();
        while (true) {
            if (_atEnd()) {
                throw new SyntaxError("EOF while reading string", startLine, startColumn);
            }
            char c = _next();
            if (c == '\\') {
                if (_atEnd()) {
                    throw new SyntaxError("EOF while reading string", startLine, startColumn);
                }
                _next();
            } else if (c == '"') {
                return prefix + text.substring(start, pos).replace("\r\n", "\n");
            }
        }
    }

    /**
     * Reads the single form a reader macro applies to, keeping the noise in front of it.
     * An uneval marker keeps reading past nested uneval markers, which it then owns.
     */
    private Wrapper _readWrapper(Wrapper.Kind kind) throws SyntaxError {
        List<Node> children = new ArrayList<>();
        while (true) {
            Node target = _readTarget(children, kind.getPrefix());
            children.add(target);
            if (kind != Wrapper.Kind.UNEVAL || !_isUneval(target)) {
                return new Wrapper(kind, children);
            }
        }
    }

    private Node _readTarget(List<Node> noise, String macro) throws SyntaxError {
        int macroLine = line;
        int macroColumn = column;
        _readNoise(noise);
        if (_atEnd() || _isClosing(_peek())) {
            throw new SyntaxError("Missing form after " + macro, macroLine, macroColumn);
        }
        return _readForm();
    }

    private Meta _readMeta(String prefix) throws SyntaxError {
        List<Node> children = new ArrayList<>();
        children.add(_readTarget(children, prefix));
        children.add(_readTarget(children, prefix));
        return new Meta(prefix, children);
    }

    private Node _readDispatch() throws SyntaxError {
        int startLine = line;
        int startColumn = column;
        char c = _peekAt(1);
        switch (c) {
            case '{':
                _next();
                return _readCollection(Collection.Kind.SET, "", '}');
            case '(': {
                _next();
                List<Node> children = new ArrayList<>();
                children.add(_readCollection(Collection.Kind.LIST, "", ')'));
                return new Wrapper(Wrapper.Kind.FN, children);
            }
            case '\'':
                _next();
                _next();
                return _readWrapper(Wrapper.Kind.VAR_QUOTE);
            case '_':
                _next();
                _next();
                return _readWrapper(Wrapper.Kind.UNEVAL);
            case '=':
                _next();
                _next();
                return _readWrapper(Wrapper.Kind.EVAL);
            case '^':
                _next();
                _next();
                return _readMeta("#^");
            case '"':
                _next();
                return new Atom(_readString("#"));
            case '#':
                return _readToken();
            case '?':
                return _readReaderConditional();
            case ':':
                return _readNamespacedMap();
            default:
                if (c != 0 && Character.isLetter(c)) {
                    return _readTagged();
                }
                throw new SyntaxError("No dispatch macro for: #" + (c == 0 ? "" : String.valueOf(c)),
                        startLine, startColumn);
        }
    }

    private Wrapper _readReaderConditional() throws SyntaxError {
        int startLine = line;
        int startColumn = column;
        _next();
        _next();
        Wrapper.Kind kind = Wrapper.Kind.READER_CONDITIONAL;
        if (!_atEnd() && _peek() == '@') {
            _next();
            kind = Wrapper.Kind.READER_CONDITIONAL_SPLICING;
        }
        if (_atEnd() || _peek() != '(') {
            throw new SyntaxError("Reader conditional body must be a list", startLine, startColumn);
        }
        List<Node> children = new ArrayList<>();
        children.add(_readCollection(Collection.Kind.LIST, "", ')'));
        return new Wrapper(kind, children);
    }

    private Collection _readNamespacedMap() throws SyntaxError {
        int startLine = line;
        int startColumn = column;
        int start = pos;
        _next();
        while (!_atEnd() && !_isDelimiter(_peek())) {
            _next();
        }
        String prefix = text.substring(start, pos);
        if (_atEnd() || _peek() != '{' || prefix.length() < 3 && !prefix.equals("#::")) {
            throw new SyntaxError("Namespaced map must specify a map", startLine, startColumn);
        }
        return _readCollection(Collection.Kind.MAP, prefix, '}');
    }

    private Tagged _readTagged() throws SyntaxError {
        int start = pos;
        _next();
        while (!_atEnd() && !_isDelimiter(_peek())) {
            _next();
        }
        String tag = text.substring(start, pos);
        List<Node> children = new ArrayList<>();
        children.add(_readTarget(children, tag));
        return new Tagged(tag, children);
    }

    private Atom _readCharacter() throws SyntaxError {
        int startLine = line;
        int startColumn = column;
        int start = pos;
        _next();
        if (_atEnd()) {
            throw new SyntaxError("EOF while reading character", startLine, startColumn);
        }
        _next();
        while (!_atEnd() && !_isDelimiter(_peek())) {
            _next();
        }
        String literal = text.substring(start, pos);
        String body = literal.substring(1);
        if (body.length() > 1 && !NAMED_CHARS.contains(body)
                && !UNICODE_CHAR.matcher(body).matches() && !OCTAL_CHAR.matcher(body).matches()) {
            throw new SyntaxError("Unsupported character: " + literal, startLine, startColumn);
        }
        return new Atom(literal);
    }

    private Atom _readToken() throws SyntaxError {
        int startLine = line;
        int startColumn = column;
        int start = pos;
        _next();
        while (!_atEnd() && !_isDelimiter(_peek())) {
            _next();
        }
        String token = text.substring(start, pos);
        _validateToken(token, startLine, startColumn);
        return new Atom(token);
    }

    private void _validateToken(String token, int tokenLine, int tokenColumn) throws SyntaxError {
        char first = token.charAt(0);
        boolean numeric = Character.isDigit(first)
                || ((first == '+' || first == '-') && token.length() > 1 && Character.isDigit(token.charAt(1)));
        if (numeric) {
            if (!INT_PATTERN.matcher(token).matches()
                    && !RATIO_PATTERN.matcher(token).matches()
                    && !FLOAT_PATTERN.matcher(token).matches()) {
                throw new SyntaxError("Invalid number: " + token, tokenLine, tokenColumn);
            }
            return;
        }
        if (token.startsWith("##")) {
            if (!token.equals("##Inf") && !token.equals("##-Inf") && !token.equals("##NaN")) {
                throw new SyntaxError("Invalid symbolic value: " + token, tokenLine, tokenColumn);
            }
            return;
        }
        if (token.equals(":") || token.equals("::") || token.startsWith(":::")
                || (token.length() > 1 && token.endsWith(":"))) {
            throw new SyntaxError("Invalid token: " + token, tokenLine, tokenColumn);
        }
    }

    private boolean _isUneval(Node node) {
        return node.getType() == NodeType.WRAPPER && ((Wrapper) node).getKind() == Wrapper.Kind.UNEVAL;
    }

    private static boolean _isSpace(char c) {
        return c == ' ' || c == '\t' || c == '\f' || c == '\u000B';
    }

    private static boolean _isClosing(char c) {
        return c == ')' || c == ']' || c == '}';
    }

    /**
     * Characters that end a token: whitespace, commas and the terminating macro characters.
     */
    private static boolean _isDelimiter(char c) {
        return Character.isWhitespace(c) || c == ',' || "\";@^`~()[]{}\\".indexOf(c) >= 0;
    }

    private SyntaxError _error(String message) {
        return new SyntaxError(message, line, column);
    }

    private boolean _atEnd() {
        return pos >= text.length();
    }

    private char _peek() {
        return text.charAt(pos);
    }

    private char _peekAt(int offset) {
        int index = pos + offset;
        return index < text.length() ? text.charAt(index) : 0;
    }

    private char _next() {
        char c = text.charAt(pos++);
        if (c == '\n') {
            line++;
            column = 1;
        } else if (c == '\r') {
            if (pos >= text.length() || text.charAt(pos) != '\n') {
                line++;
                column = 1;
            }
        } else {
            column++;
        }
        return c;
    }
}
