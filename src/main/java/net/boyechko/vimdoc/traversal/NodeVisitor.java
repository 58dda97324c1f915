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

import java.util.List;

/** Produces output for the nodes of a syntax tree, bottom-up. */
public interface NodeVisitor<O> {

    default String name() {
        return getClass().getSimpleName();
    }

    /**
     * Called before any node below this one is visited.
     *
     * @return false to skip the node's descendants; {@link #leave} then gets no child outputs
     */
    default boolean enter(VisitContext ctx) {
        return true;
    }

    /**
     * Called once every descendant has been left.
     *
     * @param children outputs of the visited children, in order
     */
    O leave(VisitContext ctx, List<O> children);
}
