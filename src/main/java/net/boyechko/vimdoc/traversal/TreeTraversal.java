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

import java.util.ArrayList;
import java.util.List;
import net.boyechko.vimdoc.syntax.SourceText;
import net.boyechko.vimdoc.syntax.SyntaxCursor;
import net.boyechko.vimdoc.syntax.SyntaxNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Walks a syntax tree in pre-order and folds each node's output together with the outputs of its
 * children.
 *
 * <p>The walk is driven by the cursor alone and keeps one list of pending outputs per depth, so
 * arbitrarily deep documents never grow the call stack.
 */
public class TreeTraversal<O> {
    private static final Logger logger = LoggerFactory.getLogger(TreeTraversal.class);

    private final SourceText source;
    private final Joiner<O> joiner;

    public TreeTraversal(SourceText source, Joiner<O> joiner) {
        this.source = source;
        this.joiner = joiner;
    }

    /** Visits the node under the cursor and every named node below it. */
    public O visitAllNamed(SyntaxCursor cursor, NodeVisitor<O> visitor) {
        return visitAll(cursor, visitor, false);
    }

    /**
     * Visits the node under the cursor and everything below it. When {@code unnamed} is false,
     * anonymous nodes are not visited but the outputs of their named descendants still reach the
     * nearest visited ancestor.
     *
     * <p>The cursor is back on its starting node when this returns.
     *
     * @return the joined outputs of the top-level visited nodes; the join of an empty list when
     *     nothing was visited
     */
    public O visitAll(SyntaxCursor cursor, NodeVisitor<O> visitor, boolean unnamed) {
        int startDepth = cursor.depth();
        // levels.get(d) collects the outputs of finished nodes d levels below the start
        List<List<O>> levels = new ArrayList<>();
        levels.add(new ArrayList<>());
        // open.get(d) is the context of the node whose children are collected in level d + 1,
        // or null when that node is not visited
        List<VisitContext> open = new ArrayList<>();
        int visited = 0;

        while (true) {
            SyntaxNode node = cursor.node();
            VisitContext ctx = null;
            boolean descend = true;
            if (node.isNamed() || unnamed) {
                ctx = new VisitContext(node, source, cursor.depth() - startDepth);
                descend = visitor.enter(ctx);
                visited++;
            }

            if (descend && cursor.gotoFirstChild()) {
                open.add(ctx);
                levels.add(new ArrayList<>());
                continue;
            }
            if (ctx != null) {
                last(levels).add(visitor.leave(ctx, List.of()));
            }

            // Climb until a sibling is found, finishing each node on the way up.
            while (cursor.depth() == startDepth || !cursor.gotoNextSibling()) {
                if (cursor.depth() == startDepth) {
                    logger.debug("{} visited {} nodes", visitor.name(), visited);
                    return joiner.join(levels.get(0));
                }
                cursor.gotoParent();
                List<O> children = levels.remove(levels.size() - 1);
                VisitContext parent = open.remove(open.size() - 1);
                if (parent != null) {
                    last(levels).add(visitor.leave(parent, children));
                } else {
                    last(levels).addAll(children);
                }
            }
        }
    }

    /** Visits the named children of the node under the cursor, without their descendants. */
    public O visitChildrenNamed(SyntaxCursor cursor, NodeVisitor<O> visitor) {
        return visitChildren(cursor, visitor, false);
    }

    /**
     * Visits the immediate children of the node under the cursor. Each child is entered and left
     * with no child outputs; the node itself is not visited.
     */
    public O visitChildren(SyntaxCursor cursor, NodeVisitor<O> visitor, boolean unnamed) {
        List<O> outputs = new ArrayList<>();
        if (!cursor.gotoFirstChild()) {
            return joiner.join(outputs);
        }
        int depth = 1;
        do {
            SyntaxNode node = cursor.node();
            if (node.isNamed() || unnamed) {
                VisitContext ctx = new VisitContext(node, source, depth);
                visitor.enter(ctx);
                outputs.add(visitor.leave(ctx, List.of()));
            }
        } while (cursor.gotoNextSibling());
        cursor.gotoParent();
        return joiner.join(outputs);
    }

    private static <T> List<T> last(List<List<T>> levels) {
        return levels.get(levels.size() - 1);
    }
}
