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
package net.boyechko.vimdoc.build;

import net.boyechko.vimdoc.syntax.Point;

/** Signals that a syntax tree does not have the shape of a help file. */
public abstract class TreeBuildException extends Exception {
    private final Point start;

    protected TreeBuildException(Point start, String message) {
        super(message);
        this.start = start;
    }

    protected TreeBuildException(Point start, String message, Throwable cause) {
        super(message, cause);
        this.start = start;
    }

    /** Start of the node the problem was found at. */
    public Point start() {
        return start;
    }
}
