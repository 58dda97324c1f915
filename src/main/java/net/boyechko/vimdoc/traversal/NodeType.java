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

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/** The node kinds of the vimdoc grammar that renderers know about. */
public enum NodeType {
    ARGUMENT("argument"),
    BLOCK("block"),
    CODE("code"),
    CODEBLOCK("codeblock"),
    CODESPAN("codespan"),
    COLUMN_HEADING("column_heading"),
    H1("h1"),
    H2("h2"),
    H3("h3"),
    HELP_FILE("help_file"),
    KEYCODE("keycode"),
    LANGUAGE("language"),
    LINE("line"),
    LINE_LI("line_li"),
    OPTIONLINK("optionlink"),
    TAG("tag"),
    TAGLINK("taglink"),
    UPPERCASE_NAME("uppercase_name"),
    URL("url"),
    WORD("word");

    private static final Map<String, NodeType> BY_KIND =
            Arrays.stream(values()).collect(Collectors.toMap(NodeType::kind, Function.identity()));

    private final String kind;

    NodeType(String kind) {
        this.kind = kind;
    }

    /** The kind string the grammar uses for this type. */
    public String kind() {
        return kind;
    }

    public boolean isHeading() {
        return this == H1 || this == H2 || this == H3;
    }

    /** Returns the type for a kind string; empty for error nodes and unknown kinds. */
    public static Optional<NodeType> fromKind(String kind) {
        return Optional.ofNullable(BY_KIND.get(kind));
    }

    @Override
    public String toString() {
        return kind;
    }
}
