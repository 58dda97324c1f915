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

import java.util.Collection;
import net.boyechko.vimdoc.syntax.Point;

/** A node's kind is not one of the kinds allowed at its position. */
public class KindMismatchException extends TreeBuildException {
    private final String expected;
    private final String actual;

    public KindMismatchException(Point start, Collection<String> expectedKinds, String actual) {
        this(start, String.join(" or ", expectedKinds), actual);
    }

    public KindMismatchException(Point start, String expected, String actual) {
        super(start, "[@ " + start + "] Expected " + expected + ", but was actually " + actual);
        this.expected = expected;
        this.actual = actual;
    }

    /** The allowed kinds, joined with " or ". */
    public String expected() {
        return expected;
    }

    public String actual() {
        return actual;
    }
}
