/*
 * Vimdoc-HTML - Vimdoc Help File Conversion
 * Copyright (C) 2025 Richard Boyechko
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published
 * by the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <https://www.gnu.org/licenses/>.
 */
package net.boyechko.vimdoc.syntax;

import java.util.ArrayDeque;
import java.util.Deque;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads the S-expression dump printed by the grammar's {@code parse} command back into a syntax
 * tree over the given source:
 *
 * <pre>
 * (help_file [0, 0] - [1, 0]
 *   (block [0, 0] - [1, 0]
 *     (line [0, 0] - [0, 5]
 *       text: (word [0, 0] - [0, 5]))))
 * </pre>
 *
 * <p>{@code (ERROR ...)} denotes an error node, {@code (MISSING kind ...)} a missing node and a
 * quoted kind such as {@code ("|" [0, 0] - [0, 1])} an anonymous token. Nesting is handled with an
 * explicit stack, so dumps of any depth can be read.
 */
public final class ParseTreeReader {
    private static final Logger logger = LoggerFactory.getLogger(ParseTreeReader.class);

    private static final String MISSING_HEAD = "MISSING";

    private final String dump;
    private final SourceText source;
    private int pos;
    private int lineNumber = 1;

    private ParseTreeReader(String dump, SourceText source) {
        this.dump = dump;
        this.source = source;
    }

    public static SyntaxTree read(String dump, SourceText source) throws ParseTreeReadException {
        SyntaxTree tree = new ParseTreeReader(dump, source).readTree();
        logger.debug("Read parse tree rooted at {}", tree.root());
        return tree;
    }

    public static SyntaxTree read(String dump, String source) throws ParseTreeReadException {
        return read(dump, SourceText.of(source));
    }

    /** Returns a parser that answers every request with the tree described by {@code dump}. */
    public static SyntaxParser parserFor(String dump) {
        return source -> read(dump, source);
    }

    private SyntaxTree readTree() throws ParseTreeReadException {
        Deque<TreeNode> open = new ArrayDeque<>();
        TreeNode root = null;
        String pendingField = null;

        while (true) {
            skipWhitespace();
            if (atEnd()) {
                break;
            }
            char c = peek();
            if (c == '(') {
                pos++;
                TreeNode node = readNode(pendingField);
                pendingField = null;
                if (open.isEmpty()) {
                    if (root != null) {
                        throw error("Found more than one root node");
                    }
                    root = node;
                } else {
                    open.peek().append(node);
                }
                open.push(node);
            } else if (c == ')') {
                if (pendingField != null) {
                    throw error("Field '" + pendingField + "' is not followed by a node");
                }
                if (open.isEmpty()) {
                    throw error("Unbalanced ')'");
                }
                pos++;
                open.pop();
            } else {
                if (open.isEmpty()) {
                    throw error("Expected '(' but found '" + c + "' instead");
                }
                pendingField = readIdentifier();
                skipWhitespace();
                expect(':');
            }
        }

        if (!open.isEmpty()) {
            throw error("Expected closing ')' but found end of input instead");
        }
        if (root == null) {
            throw error("Parse tree dump is empty");
        }
        return new SyntaxTree(source, root);
    }

    private TreeNode readNode(String fieldName) throws ParseTreeReadException {
        skipWhitespace();
        String kind;
        boolean named = true;
        boolean error = false;
        boolean missing = false;

        if (peekIs('"')) {
            kind = readQuoted();
            named = false;
        } else {
            kind = readIdentifier();
            if (TreeNode.ERROR_KIND.equals(kind)) {
                error = true;
            } else if (MISSING_HEAD.equals(kind)) {
                missing = true;
                skipWhitespace();
                if (peekIs('"')) {
                    kind = readQuoted();
                    named = false;
                } else {
                    kind = readIdentifier();
                }
            }
        }

        skipWhitespace();
        Point start = readPoint();
        skipWhitespace();
        expect('-');
        skipWhitespace();
        Point end = readPoint();

        int startByte;
        int endByte;
        try {
            startByte = source.offsetOf(start);
            endByte = source.offsetOf(end);
        } catch (IllegalArgumentException e) {
            throw new ParseTreeReadException(e.getMessage(), lineNumber, e);
        }
        if (endByte < startByte) {
            throw error("Node '" + kind + "' ends before it starts");
        }
        return new TreeNode(
                kind, named, error, missing, fieldName, start, end, startByte, endByte);
    }

    private Point readPoint() throws ParseTreeReadException {
        expect('[');
        skipWhitespace();
        int row = readInt();
        skipWhitespace();
        expect(',');
        skipWhitespace();
        int column = readInt();
        skipWhitespace();
        expect(']');
        return new Point(row, column);
    }

    private int readInt() throws ParseTreeReadException {
        int begin = pos;
        while (!atEnd() && Character.isDigit(peek())) {
            pos++;
        }
        if (begin == pos) {
            throw error("Expected a number");
        }
        try {
            return Integer.parseInt(dump.substring(begin, pos));
        } catch (NumberFormatException e) {
            throw new ParseTreeReadException("Number out of range", lineNumber, e);
        }
    }

    private String readIdentifier() throws ParseTreeReadException {
        int begin = pos;
        while (!atEnd() && (Character.isLetterOrDigit(peek()) || peek() == '_')) {
            pos++;
        }
        if (begin == pos) {
            throw error(atEnd() ? "Unexpected end of input" : "Unexpected '" + peek() + "'");
        }
        return dump.substring(begin, pos);
    }

    private String readQuoted() throws ParseTreeReadException {
        expect('"');
        StringBuilder sb = new StringBuilder();
        while (true) {
            if (atEnd()) {
                throw error("Expected closing '\"' but found end of input instead");
            }
            char c = dump.charAt(pos++);
            if (c == '"') {
                return sb.toString();
            }
            if (c == '\n') {
                lineNumber++;
            }
            if (c == '\\') {
                if (atEnd()) {
                    throw error("Unterminated escape sequence");
                }
                c = dump.charAt(pos++);
                switch (c) {
                    case 'n' -> c = '\n';
                    case 't' -> c = '\t';
                    case 'r' -> c = '\r';
                    default -> {}
                }
            }
            sb.append(c);
        }
    }

    private void skipWhitespace() {
        while (!atEnd() && Character.isWhitespace(peek())) {
            if (peek() == '\n') {
                lineNumber++;
            }
            pos++;
        }
    }

    private void expect(char expected) throws ParseTreeReadException {
        if (atEnd()) {
            throw error("Expected '" + expected + "' but found end of input instead");
        }
        if (peek() != expected) {
            throw error("Expected '" + expected + "' but found '" + peek() + "' instead");
        }
        pos++;
    }

    private boolean atEnd() {
        return pos >= dump.length();
    }

    private char peek() {
        return dump.charAt(pos);
    }

    private boolean peekIs(char c) {
        return !atEnd() && peek() == c;
    }

    private ParseTreeReadException error(String message) {
        return new ParseTreeReadException(message, lineNumber);
    }
}
