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
package net.boyechko.vimdoc.core;

/** What {@link ConversionService#convert} produces. */
public enum OutputFormat {
    /** HTML fragment of the help file. */
    HTML,
    /** One line per named node with its position and a preview of its text. */
    DEBUG,
    /** Indented dump of every node, anonymous tokens and field names included. */
    TREE,
    /** The syntax tree as a one-line S-expression. */
    SEXP
}
