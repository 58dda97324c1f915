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
package net.boyechko.vimdoc.traversal;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import net.boyechko.vimdoc.syntax.SourceText;
import net.boyechko.vimdoc.syntax.SyntaxNode;
import net.boyechko.vimdoc.text.TextRules;

/** What a {@link NodeVisitor} knows about the node being visited. */
public record VisitContext(
        SyntaxNode node,
        SourceText source,
        /** Levels below the node the walk started from (0 = that node). */
        int depth) {

    /** Returns the node's type, or empty for error nodes and kinds outside the grammar. */
    public Optional<NodeType> nodeType() {
        return NodeType.fromKind(node.kind());
    }

    public String kind() {
        return node.kind();
    }

    public boolean is(NodeType type) {
        return type.kind().equals(node.kind());
    }

    /** True if the node or anything below it is an error or missing node. */
    public boolean hasError() {
        return node.hasError();
    }

    public boolean hasNamedChildren() {
        return node.namedChildCount() > 0;
    }

    /** The source text the node spans; malformed UTF-8 is replaced rather than rejected. */
    public String rawText() {
        return source.lenientText(node.startByte(), node.endByte());
    }

    /** The raw text, escaped for use in HTML. */
    public String cleanText() {
        return TextRules.escapeHtml(rawText());
    }

    public Optional<NodeType> parentType() {
        SyntaxNode parent = node.parent();
        return parent != null ? NodeType.fromKind(parent.kind()) : Optional.empty();
    }

    public Optional<SyntaxNode> previousNamedSibling() {
        SyntaxNode parent = node.parent();
        if (parent == null) {
            return Optional.empty();
        }
        SyntaxNode previous = null;
        for (SyntaxNode sibling : parent.children()) {
            if (isSelf(sibling)) {
                return Optional.ofNullable(previous);
            }
            if (sibling.isNamed()) {
                previous = sibling;
            }
        }
        return Optional.empty();
    }

    public Optional<SyntaxNode> nextNamedSibling() {
        SyntaxNode parent = node.parent();
        if (parent == null) {
            return Optional.empty();
        }
        boolean seen = false;
        for (SyntaxNode sibling : parent.children()) {
            if (seen && sibling.isNamed()) {
                return Optional.of(sibling);
            }
            if (isSelf(sibling)) {
                seen = true;
            }
        }
        return Optional.empty();
    }

    public Optional<NodeType> previousNamedSiblingType() {
        return previousNamedSibling().flatMap(n -> NodeType.fromKind(n.kind()));
    }

    public List<SyntaxNode> namedChildren() {
        List<SyntaxNode> named = new ArrayList<>();
        for (SyntaxNode child : node.children()) {
            if (child.isNamed()) {
                named.add(child);
            }
        }
        return named;
    }

    /** Returns the first node of the given type below this one, in document order. */
    public Optional<SyntaxNode> firstDescendant(NodeType type) {
        Deque<SyntaxNode> pending = new ArrayDeque<>();
        pushChildren(pending, node);
        while (!pending.isEmpty()) {
            SyntaxNode next = pending.pop();
            if (type.kind().equals(next.kind())) {
                return Optional.of(next);
            }
            pushChildren(pending, next);
        }
        return Optional.empty();
    }

    public String textOf(SyntaxNode other) {
        return source.lenientText(other.startByte(), other.endByte());
    }

    /** Matches by span and kind, since a parser binding may hand out a new wrapper per access. */
    private boolean isSelf(SyntaxNode other) {
        return other.startByte() == node.startByte()
                && other.endByte() == node.endByte()
                && other.kind().equals(node.kind());
    }

    private static void pushChildren(Deque<SyntaxNode> pending, SyntaxNode parent) {
        List<? extends SyntaxNode> children = parent.children();
        for (int i = children.size() - 1; i >= 0; i--) {
            pending.push(children.get(i));
        }
    }
}
