package com.nsformatter.plugins.clojure.syntax;

import com.nsformatter.util.LoggerUtil;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Lossless reader for Clojure source. Every character of the input ends up in exactly
 * one node, so {@code read(source).toSource()} returns {@code source} unchanged.
 */
public class ClojureReader {
    private static final Logger logger = LoggerUtil.getLogger(ClojureReader.class);

    private final String source;
    private int pos;
    private int line = 1;
    private int column = 1;

    private ClojureReader(String source) {
        this.source = source;
    }

    /**
     * Reads the whole source into a root node.
     *
     * @throws ReaderException if delimiters are unbalanced or a literal is unterminated
     */
    public static FormsNode read(String source) {
        ClojureReader reader = new ClojureReader(source);
        List<SyntaxNode> children = new ArrayList<>();
        while (!reader.atEnd()) {
            char c = reader.peek();
            if (isCloser(c)) {
                throw reader.error("Unmatched delimiter '" + c + "'");
            }
            children.add(reader.readNode());
        }
        logger.fine("Read " + children.size() + " top-level nodes");
        return new FormsNode(children);
    }

    /**
     * Reads a single form, e.g. one {@code ns} declaration, ignoring surrounding whitespace.
     */
    public static SyntaxNode readForm(String source) {
        List<SyntaxNode> content = read(source).getContentChildren();
        if (content.size() != 1) {
            throw new ReaderException("Expected exactly one form but found " + content.size(), 1, 1);
        }
        return content.get(0);
    }

    private SyntaxNode readNode() {
        char c = peek();
        if (isNewlineAt(pos)) {
            return readNewline();
        }
        if (isWhitespace(c)) {
            return readWhitespace();
        }
        return switch (c) {
            case ';' -> readComment(CommentNode.LINE_MARKER);
            case '(' -> readCollection(NodeTag.LIST);
            case '[' -> readCollection(NodeTag.VECTOR);
            case '{' -> readCollection(NodeTag.MAP);
            case '"' -> new StringNode(readStringLiteral());
            case ':' -> new KeywordNode(readTokenText());
            case '^' -> readMeta(MetaNode.MARKER);
            case '\'' -> readPrefixed(NodeTag.QUOTE);
            case '`' -> readPrefixed(NodeTag.SYNTAX_QUOTE);
            case '@' -> readPrefixed(NodeTag.DEREF);
            case '~' -> readPrefixed(peek(1) == '@' ? NodeTag.UNQUOTE_SPLICING : NodeTag.UNQUOTE);
            case '\\' -> new TokenNode(readCharLiteral());
            case '#' -> readDispatch();
            default -> new TokenNode(readTokenText());
        };
    }

    private SyntaxNode readDispatch() {
        char next = peek(1);
        switch (next) {
            case '{':
                return readCollection(NodeTag.SET);
            case '(':
                return readCollection(NodeTag.FN);
            case '"': {
                advance(1);
                return new TokenNode("#" + readStringLiteral());
            }
            case '\'':
                return readPrefixed(NodeTag.VAR);
            case '_':
                return readPrefixed(NodeTag.UNEVAL);
            case '=':
                return readPrefixed(NodeTag.EVAL);
            case '^':
                return readMeta(MetaNode.LEGACY_MARKER);
            case '!':
                return readComment(CommentNode.SHEBANG_MARKER);
            case '?':
                return readReaderConditional();
            default:
                if (pos + 1 >= source.length() || isDelimiter(next)) {
                    throw error("Unsupported dispatch character after '#'");
                }
                // Tagged literals, ##Inf and #:ns map prefixes read as tokens.
                return new TokenNode(readTokenText());
        }
    }

    private ReaderConditionalNode readReaderConditional() {
        advance(2);
        String discriminator = ReaderConditionalNode.DISCRIMINATOR;
        if (!atEnd() && peek() == '@') {
            advance(1);
            discriminator = ReaderConditionalNode.SPLICE_DISCRIMINATOR;
        }
        if (atEnd() || peek() != '(') {
            throw error("Reader conditional must be followed by a list");
        }
        return new ReaderConditionalNode(discriminator, readCollection(NodeTag.LIST));
    }

    private CollectionNode readCollection(NodeTag tag) {
        int startLine = line;
        int startColumn = column;
        advance(tag.getOpen().length());
        char close = tag.getClose().charAt(0);

        List<SyntaxNode> children = new ArrayList<>();
        while (true) {
            if (atEnd()) {
                throw new ReaderException("Unclosed '" + tag.getOpen() + "'", startLine, startColumn);
            }
            char c = peek();
            if (c == close) {
                advance(1);
                return new CollectionNode(tag, children);
            }
            if (isCloser(c)) {
                throw error("Mismatched delimiter '" + c + "', expected '" + close + "'");
            }
            children.add(readNode());
        }
    }

    private PrefixNode readPrefixed(NodeTag tag) {
        advance(tag.getOpen().length());
        List<SyntaxNode> children = new ArrayList<>();
        readFormWithGap(children, tag.getOpen());
        return new PrefixNode(tag, children);
    }

    private MetaNode readMeta(String marker) {
        advance(marker.length());
        List<SyntaxNode> children = new ArrayList<>();
        readFormWithGap(children, marker);
        readFormWithGap(children, marker);
        return new MetaNode(marker, children);
    }

    /**
     * Reads whitespace and comments up to and including the next form.
     */
    private void readFormWithGap(List<SyntaxNode> children, String prefix) {
        while (true) {
            if (atEnd() || isCloser(peek())) {
                throw error("Missing form after '" + prefix + "'");
            }
            SyntaxNode node = readNode();
            children.add(node);
            if (!node.isWhitespaceOrComment()) {
                return;
            }
        }
    }

    private CommentNode readComment(String marker) {
        advance(marker.length());
        int start = pos;
        while (!atEnd() && !isNewlineAt(pos)) {
            advance(1);
        }
        return new CommentNode(marker, source.substring(start, pos));
    }

    private NewlineNode readNewline() {
        int length = peek() == '\r' ? 2 : 1;
        String text = source.substring(pos, pos + length);
        advance(length);
        return new NewlineNode(text);
    }

    private WhitespaceNode readWhitespace() {
        int start = pos;
        while (!atEnd() && isWhitespace(peek()) && !isNewlineAt(pos)) {
            advance(1);
        }
        return new WhitespaceNode(source.substring(start, pos));
    }

    private String readStringLiteral() {
        int startLine = line;
        int startColumn = column;
        int start = pos;
        advance(1);
        while (true) {
            if (atEnd()) {
                throw new ReaderException("Unterminated string", startLine, startColumn);
            }
            char c = peek();
            if (c == '\\') {
                if (pos + 1 >= source.length()) {
                    throw new ReaderException("Unterminated string", startLine, startColumn);
                }
                advance(2);
            } else {
                advance(1);
                if (c == '"') {
                    return source.substring(start, pos);
                }
            }
        }
    }

    private String readCharLiteral() {
        int start = pos;
        advance(1);
        if (atEnd()) {
            throw error("Unterminated character literal");
        }
        advance(1);
        while (!atEnd() && !isDelimiter(peek())) {
            advance(1);
        }
        return source.substring(start, pos);
    }

    private String readTokenText() {
        int start = pos;
        while (!atEnd() && !isDelimiter(peek())) {
            advance(1);
        }
        if (pos == start) {
            throw error("Unexpected character '" + peek() + "'");
        }
        return source.substring(start, pos);
    }

    private void advance(int count) {
        for (int i = 0; i < count && pos < source.length(); i++) {
            if (source.charAt(pos) == '\n') {
                line++;
                column = 1;
            } else {
                column++;
            }
            pos++;
        }
    }

    private boolean atEnd() {
        return pos >= source.length();
    }

    private char peek() {
        return source.charAt(pos);
    }

    private char peek(int offset) {
        int index = pos + offset;
        return index < source.length() ? source.charAt(index) : '\0';
    }

    private boolean isNewlineAt(int index) {
        char c = source.charAt(index);
        return c == '\n' || (c == '\r' && index + 1 < source.length() && source.charAt(index + 1) == '\n');
    }

    private ReaderException error(String message) {
        return new ReaderException(message, line, column);
    }

    private static boolean isWhitespace(char c) {
        return Character.isWhitespace(c) || c == ',';
    }

    private static boolean isCloser(char c) {
        return c == ')' || c == ']' || c == '}';
    }

    private static boolean isDelimiter(char c) {
        return isWhitespace(c) || c == '(' || c == '[' || c == '{' || isCloser(c) || c == '"' || c == ';';
    }
}
