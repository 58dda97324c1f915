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

/** A required child is absent. */
public class MissingFieldException extends TreeBuildException {
    private final String name;
    private final String nodeKind;

    public MissingFieldException(Point start, String name, String nodeKind) {
        super(start, "[" + nodeKind + " @ " + start + "] Missing " + name);
        this.name = name;
        this.nodeKind = nodeKind;
    }

    public String name() {
        return name;
    }

    public String nodeKind() {
        return nodeKind;
    }
}
