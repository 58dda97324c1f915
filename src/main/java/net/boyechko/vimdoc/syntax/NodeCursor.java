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
import java.util.List;

/** {@link SyntaxCursor} over any {@link SyntaxNode}, tracking the child index at each level. */
public final class NodeCursor implements SyntaxCursor {
    private final Deque<Integer> indices = new ArrayDeque<>();
    private SyntaxNode current;

    public NodeCursor(SyntaxNode start) {
        this.current = start;
    }

    @Override
    public SyntaxNode node() {
        return current;
    }

    @Override
    public boolean gotoFirstChild() {
        List<? extends SyntaxNode> kids = current.children();
        if (kids.isEmpty()) {
            return false;
        }
        indices.push(0);
        current = kids.get(0);
        return true;
    }

    @Override
    public boolean gotoNextSibling() {
        if (indices.isEmpty()) {
            return false;
        }
        List<? extends SyntaxNode> siblings = current.parent().children();
        int next = indices.peek() + 1;
        if (next >= siblings.size()) {
            return false;
        }
        indices.pop();
        indices.push(next);
        current = siblings.get(next);
        return true;
    }

    @Override
    public boolean gotoParent() {
        if (indices.isEmpty()) {
            return false;
        }
        indices.pop();
        current = current.parent();
        return true;
    }

    @Override
    public String fieldName() {
        return indices.isEmpty() ? null : current.fieldName();
    }

    @Override
    public int depth() {
        return indices.size();
    }
}
