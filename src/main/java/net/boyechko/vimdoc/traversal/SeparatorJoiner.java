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

/** Joins strings with a fixed separator. */
public final class SeparatorJoiner implements Joiner<String> {
    public static final SeparatorJoiner NEWLINE = new SeparatorJoiner("\n");
    public static final SeparatorJoiner SPACE = new SeparatorJoiner(" ");

    private final String separator;
    private final boolean skipEmpty;

    public SeparatorJoiner(String separator) {
        this(separator, false);
    }

    private SeparatorJoiner(String separator, boolean skipEmpty) {
        this.separator = separator;
        this.skipEmpty = skipEmpty;
    }

    /** Returns a joiner with the same separator that leaves out empty strings. */
    public SeparatorJoiner skippingEmpty() {
        return skipEmpty ? this : new SeparatorJoiner(separator, true);
    }

    @Override
    public String join(List<String> outputs) {
        StringBuilder sb = new StringBuilder();
        boolean first = true;
        for (String output : outputs) {
            if (skipEmpty && output.isEmpty()) {
                continue;
            }
            if (!first) {
                sb.append(separator);
            }
            sb.append(output);
            first = false;
        }
        return sb.toString();
    }
}
