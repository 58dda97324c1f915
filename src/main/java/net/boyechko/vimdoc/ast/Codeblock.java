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
package net.boyechko.vimdoc.ast;

import java.util.List;
import java.util.Optional;

/** A {@code >lang ... <} block. The language is only present when given after the marker. */
public record Codeblock(Optional<Language> language, List<Line> lines)
        implements LineChild, LineLiChild {
    public Codeblock {
        language = language != null ? language : Optional.empty();
        lines = List.copyOf(lines);
    }
}
