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

import java.nio.charset.CharacterCodingException;
import java.util.List;

/**
 * A node of the concrete syntax tree produced by the external vimdoc grammar. Implementations must
 * keep parent links consistent with {@link #children()} so that {@link NodeCursor} can navigate
 * them.
 */
public interface SyntaxNode {

    String kind();

    /** True for grammar rules, false for anonymous tokens such as punctuation. */
    boolean isNamed();

    boolean isError();

    boolean isMissing();

    /** True if this node or any node below it is an error or missing node. */
    boolean hasError();

    Point startPoint();

    Point endPoint();

    int startByte();

    int endByte();

    /** Returns the parent node, or null for the root. */
    SyntaxNode parent();

    List<? extends SyntaxNode> children();

    /** Name of the grammar field this node fills in its parent, or null. */
    default String fieldName() {
        return null;
    }

    default int childCount() {
        return children().size();
    }

    default int namedChildCount() {
        int count = 0;
        for (SyntaxNode child : children()) {
            if (child.isNamed()) {
                count++;
            }
        }
        return count;
    }

    default String utf8Text(SourceText source) throws CharacterCodingException {
        return source.utf8Text(startByte(), endByte());
    }

    default String toSexp() {
        return SyntaxTreePrinter.toSexp(this);
    }

    default SyntaxCursor walk() {
        return new NodeCursor(this);
    }
}
