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
package net.boyechko.vimdoc.issues;

import net.boyechko.vimdoc.syntax.Point;
import net.boyechko.vimdoc.syntax.SyntaxNode;

/** Represents where in the help file an issue was found. */
public sealed interface IssueLocation {
    record None() implements IssueLocation {
        @Override
        public String toString() {
            return "(document)";
        }
    }

    record AtNode(String kind, Point start, Point end) implements IssueLocation {
        @Override
        public String toString() {
            return kind + " @ " + start;
        }
    }

    record AtText(String text) implements IssueLocation {
        @Override
        public String toString() {
            return "\"" + text + "\"";
        }
    }

    static IssueLocation none() {
        return new None();
    }

    static IssueLocation at(SyntaxNode node) {
        if (node == null) {
            return none();
        }
        return new AtNode(node.kind(), node.startPoint(), node.endPoint());
    }

    static IssueLocation atText(String text) {
        return new AtText(text);
    }
}
