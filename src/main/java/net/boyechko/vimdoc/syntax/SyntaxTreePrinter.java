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

/** Text dumps of a syntax tree. Both walk the tree with a cursor rather than recursion. */
public final class SyntaxTreePrinter {
    private static final String INDENT = "  ";

    private SyntaxTreePrinter() {}

    /**
     * Returns a one-line S-expression of the named nodes below {@code node}, e.g. {@code (line
     * (word) (MISSING word))}. Missing anonymous tokens are included, other anonymous nodes are
     * not.
     */
    public static String toSexp(SyntaxNode node) {
        StringBuilder sb = new StringBuilder();
        Deque<Boolean> shownAncestors = new ArrayDeque<>();
        SyntaxCursor cursor = node.walk();
        boolean first = true;

        while (true) {
            SyntaxNode current = cursor.node();
            boolean shown = current.isNamed() || current.isMissing();
            if (shown) {
                if (!first) {
                    sb.append(' ');
                }
                first = false;
                String field = cursor.fieldName();
                if (field != null) {
                    sb.append(field).append(": ");
                }
                sb.append('(');
                if (current.isMissing()) {
                    sb.append("MISSING ");
                }
                sb.append(current.isNamed() ? current.kind() : quote(current.kind()));
            }

            if (cursor.gotoFirstChild()) {
                shownAncestors.push(shown);
                continue;
            }
            if (shown) {
                sb.append(')');
            }

            while (!cursor.gotoNextSibling()) {
                if (!cursor.gotoParent()) {
                    return sb.toString();
                }
                if (shownAncestors.pop()) {
                    sb.append(')');
                }
            }
        }
    }

    /**
     * Returns one line per node, indented two spaces per level:
     *
     * <pre>Name: "text: ", Kind: "word" [Row:0, Col:0] - [Row:0, Col:5]</pre>
     *
     * @param showAnonymous whether anonymous tokens are listed as well
     */
    public static String toIndentedTreeString(SyntaxNode node, boolean showAnonymous) {
        StringBuilder sb = new StringBuilder();
        SyntaxCursor cursor = node.walk();

        while (true) {
            SyntaxNode current = cursor.node();
            if (current.isNamed() || showAnonymous) {
                String field = cursor.fieldName();
                sb.append(INDENT.repeat(cursor.depth()))
                        .append("Name: ")
                        .append(quote(field != null ? field + ": " : ""))
                        .append(", Kind: ")
                        .append(quote(current.kind()))
                        .append(' ')
                        .append(span(current))
                        .append('\n');
            }

            if (cursor.gotoFirstChild()) {
                continue;
            }
            while (!cursor.gotoNextSibling()) {
                if (!cursor.gotoParent()) {
                    return sb.toString();
                }
            }
        }
    }

    /** Formats a node's range as {@code [Row:r, Col:c] - [Row:r2, Col:c2]}. */
    public static String span(SyntaxNode node) {
        Point start = node.startPoint();
        Point end = node.endPoint();
        return "[Row:"
                + start.row()
                + ", Col:"
                + start.column()
                + "] - [Row:"
                + end.row()
                + ", Col:"
                + end.column()
                + "]";
    }

    private static String quote(String s) {
        return "\"" + s.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }
}
