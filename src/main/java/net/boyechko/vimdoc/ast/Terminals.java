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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/** Collects the leaves of a help file in document order. */
public final class Terminals {

    private Terminals() {}

    public static List<Terminal> of(HelpFile helpFile) {
        List<Terminal> terminals = new ArrayList<>();
        Deque<Object> pending = new ArrayDeque<>();
        pushAll(pending, helpFile.blocks());

        while (!pending.isEmpty()) {
            Object node = pending.pop();
            if (node instanceof Terminal terminal) {
                terminals.add(terminal);
            } else if (node instanceof Block block) {
                pushAll(pending, block.children());
            } else if (node instanceof Line line) {
                pushAll(pending, line.children());
            } else if (node instanceof LineLi lineLi) {
                pushAll(pending, lineLi.children());
            } else if (node instanceof Codeblock codeblock) {
                pushAll(pending, codeblock.lines());
                codeblock.language().ifPresent(pending::push);
            } else if (node instanceof ColumnHeading heading) {
                pushAll(pending, heading.name());
            } else if (node instanceof H1 h1) {
                pushAll(pending, h1.children());
            } else if (node instanceof H2 h2) {
                pushAll(pending, h2.children());
            } else if (node instanceof H3 h3) {
                pushAll(pending, h3.children());
                pending.push(h3.name());
            } else if (node instanceof Argument argument) {
                pending.push(argument.text());
            } else if (node instanceof Codespan codespan) {
                pending.push(codespan.text());
            } else if (node instanceof Optionlink optionlink) {
                pending.push(optionlink.text());
            } else if (node instanceof Tag tag) {
                pending.push(tag.text());
            } else if (node instanceof Taglink taglink) {
                pending.push(taglink.text());
            } else if (node instanceof Url url) {
                pending.push(url.text());
            }
        }
        return terminals;
    }

    /** Returns the texts of {@link #of(HelpFile)}. */
    public static List<String> texts(HelpFile helpFile) {
        List<String> texts = new ArrayList<>();
        for (Terminal terminal : of(helpFile)) {
            texts.add(terminal.text());
        }
        return texts;
    }

    private static void pushAll(Deque<Object> pending, List<?> children) {
        for (int i = children.size() - 1; i >= 0; i--) {
            pending.push(children.get(i));
        }
    }
}
