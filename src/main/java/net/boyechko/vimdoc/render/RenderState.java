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
package net.boyechko.vimdoc.render;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

/** State carried from one node to the next during a single HTML walk. */
final class RenderState {
    private String pendingLanguage;
    private int listLevel = 1;
    // Per depth, the indent of the node left last at that depth if it was a list item, else null.
    // Entries deeper than the node being entered or left belong to finished subtrees.
    private final List<Integer> lastListItemIndent = new ArrayList<>();

    /** Remembers the language of a code block for the code that follows it. */
    void setPendingLanguage(String language) {
        this.pendingLanguage = language;
    }

    /** Returns and clears the pending language. */
    Optional<String> takePendingLanguage() {
        Optional<String> language = Optional.ofNullable(pendingLanguage);
        pendingLanguage = null;
        return language;
    }

    int listLevel() {
        return listLevel;
    }

    void setListLevel(int listLevel) {
        this.listLevel = Math.max(1, listLevel);
    }

    /** Starts a node; the siblings seen below an earlier node no longer count. */
    void enterNode(int depth) {
        truncate(depth + 1);
    }

    /** Finishes a node that is not a list item. */
    void leaveNode(int depth) {
        record(depth, null);
    }

    void leaveListItem(int depth, int indent) {
        record(depth, indent);
    }

    /** Indent of the previous named sibling of a node at this depth, if it was a list item. */
    OptionalInt previousListItemIndent(int depth) {
        if (depth >= lastListItemIndent.size() || lastListItemIndent.get(depth) == null) {
            return OptionalInt.empty();
        }
        return OptionalInt.of(lastListItemIndent.get(depth));
    }

    void reset() {
        pendingLanguage = null;
        listLevel = 1;
        lastListItemIndent.clear();
    }

    private void record(int depth, Integer indent) {
        truncate(depth + 1);
        while (lastListItemIndent.size() <= depth) {
            lastListItemIndent.add(null);
        }
        lastListItemIndent.set(depth, indent);
    }

    private void truncate(int size) {
        while (lastListItemIndent.size() > size) {
            lastListItemIndent.remove(lastListItemIndent.size() - 1);
        }
    }
}
