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

/**
 * Stateful navigation over a syntax tree. A cursor never moves above the node it was created
 * from.
 */
public interface SyntaxCursor {

    SyntaxNode node();

    boolean gotoFirstChild();

    boolean gotoNextSibling();

    boolean gotoParent();

    /** Field name of the current node within its parent, or null. */
    String fieldName();

    /** Number of levels below the node the cursor was created from. */
    int depth();
}
