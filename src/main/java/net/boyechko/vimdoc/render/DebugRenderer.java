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
package net.boyechko.vimdoc.render;

import java.util.ArrayList;
import java.util.List;
import net.boyechko.vimdoc.syntax.SyntaxTree;
import net.boyechko.vimdoc.syntax.SyntaxTreePrinter;
import net.boyechko.vimdoc.text.TextRules;
import net.boyechko.vimdoc.traversal.NodeVisitor;
import net.boyechko.vimdoc.traversal.SeparatorJoiner;
import net.boyechko.vimdoc.traversal.TreeTraversal;
import net.boyechko.vimdoc.traversal.VisitContext;

/**
 * Dumps one line per named node, indented four spaces per level:
 *
 * <pre>
 * Kind: "help_file" [Row:0, Col:0] - [Row:1, Col:0] = "hello\n"
 *     Kind: "block" [Row:0, Col:0] - [Row:1, Col:0] = "hello\n"
 * </pre>
 *
 * Text longer than ten bytes is cut short and marked {@code [trimmed]}.
 */
public class DebugRenderer implements Renderer, NodeVisitor<String> {
    private static final int PREVIEW_BYTES = 10;

    @Override
    public String render(SyntaxTree tree) {
        return new TreeTraversal<>(tree.source(), SeparatorJoiner.NEWLINE)
                .visitAllNamed(tree.walk(), this);
    }

    @Override
    public String leave(VisitContext ctx, List<String> children) {
        List<String> lines = new ArrayList<>(children.size() + 1);
        lines.add(describe(ctx));
        lines.addAll(children);
        return SeparatorJoiner.NEWLINE.join(lines);
    }

    private static String describe(VisitContext ctx) {
        String text = ctx.rawText();
        String shown;
        if (TextRules.utf8Length(text) > PREVIEW_BYTES) {
            shown = TextRules.debugQuote(TextRules.truncate(text, PREVIEW_BYTES)) + " [trimmed]";
        } else {
            shown = TextRules.debugQuote(text);
        }
        return "    ".repeat(ctx.depth())
                + "Kind: "
                + TextRules.debugQuote(ctx.kind())
                + " "
                + SyntaxTreePrinter.span(ctx.node())
                + " = "
                + shown;
    }
}
