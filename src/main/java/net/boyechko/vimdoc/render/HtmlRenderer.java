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

import java.math.BigDecimal;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;
import net.boyechko.vimdoc.syntax.SyntaxNode;
import net.boyechko.vimdoc.syntax.SyntaxTree;
import net.boyechko.vimdoc.text.TextRules;
import net.boyechko.vimdoc.traversal.Joiner;
import net.boyechko.vimdoc.traversal.NodeType;
import net.boyechko.vimdoc.traversal.NodeVisitor;
import net.boyechko.vimdoc.traversal.SeparatorJoiner;
import net.boyechko.vimdoc.traversal.TreeTraversal;
import net.boyechko.vimdoc.traversal.VisitContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Renders a vimdoc syntax tree as HTML.
 *
 * <p>Each node starts from its escaped source text when it has no named children or is an inline
 * element containing a parse error, and from the space-joined output of its children otherwise;
 * the rules per node type then wrap or replace that text. A code block's language and the nesting
 * level of list items are carried between nodes in a {@link RenderState}, so an instance must not
 * be shared by concurrent walks.
 */
public class HtmlRenderer implements Renderer, NodeVisitor<String> {
    private static final Logger logger = LoggerFactory.getLogger(HtmlRenderer.class);

    private static final Joiner<String> JOINER = SeparatorJoiner.SPACE.skippingEmpty();

    private static final Set<NodeType> CONTAINERS =
            EnumSet.of(
                    NodeType.HELP_FILE,
                    NodeType.BLOCK,
                    NodeType.LINE,
                    NodeType.LINE_LI,
                    NodeType.CODEBLOCK,
                    NodeType.H1,
                    NodeType.H2,
                    NodeType.H3);

    private final RenderOptions options;
    private final RenderState state = new RenderState();
    private final RenderStats stats = new RenderStats();

    public HtmlRenderer() {
        this(RenderOptions.defaults());
    }

    public HtmlRenderer(RenderOptions options) {
        this.options = options;
    }

    @Override
    public String render(SyntaxTree tree) {
        state.reset();
        stats.clear();
        String html = new TreeTraversal<>(tree.source(), JOINER).visitAllNamed(tree.walk(), this);
        logger.debug("Rendered {} characters of HTML; {}", html.length(), stats);
        return html;
    }

    /** Statistics of the most recent {@link #render} call. */
    public RenderStats stats() {
        return stats;
    }

    public RenderOptions options() {
        return options;
    }

    /** Children are only rendered when their output is used. */
    @Override
    public boolean enter(VisitContext ctx) {
        state.enterNode(ctx.depth());
        return !usesOwnText(ctx);
    }

    @Override
    public String leave(VisitContext ctx, List<String> children) {
        String text = usesOwnText(ctx) ? ctx.cleanText() : JOINER.join(children);
        String trimmed = text.stripLeading();
        Optional<NodeType> type = ctx.nodeType();
        String html =
                type.isPresent()
                        ? renderKnown(type.get(), ctx, text, trimmed)
                        : renderUnknown(ctx, text, trimmed);
        if (!ctx.is(NodeType.LINE_LI)) {
            state.leaveNode(ctx.depth());
        }
        return html;
    }

    /**
     * Code, leaves, error nodes and inline elements containing an error show their own source
     * text. Containers always render their children, so an error stays local to the fragment it
     * occurs in.
     */
    private static boolean usesOwnText(VisitContext ctx) {
        SyntaxNode node = ctx.node();
        if (ctx.is(NodeType.CODE) || !ctx.hasNamedChildren()) {
            return true;
        }
        if (node.isError() || node.isMissing()) {
            return true;
        }
        return ctx.hasError() && ctx.nodeType().map(t -> !CONTAINERS.contains(t)).orElse(true);
    }

    private String renderKnown(NodeType type, VisitContext ctx, String text, String trimmed) {
        if ((type == NodeType.BLOCK || type == NodeType.CODE) && TextRules.isBlank(text)) {
            if (type == NodeType.CODE) {
                // The language belongs to this code even when the code is empty.
                state.takePendingLanguage();
            }
            return "";
        }
        if (ctx.hasError() && type != NodeType.CODE && !CONTAINERS.contains(type)) {
            return text;
        }

        return switch (type) {
            case ARGUMENT -> "<code>" + text + "</code>";
            case BLOCK -> renderBlock(text);
            case CODE -> renderCode(text);
            case CODESPAN -> renderCodespan(ctx, trimmed);
            case COLUMN_HEADING -> "<div class=\"help-column_heading\">" + text + "</div>";
            case H1, H2, H3 -> renderHeading(type, ctx, text);
            case KEYCODE -> "<code>" + trimmed + "</code>";
            case LANGUAGE -> {
                state.setPendingLanguage(ctx.rawText());
                yield "";
            }
            case LINE -> renderLine(ctx, text, trimmed);
            case LINE_LI -> renderListItem(ctx, text);
            case OPTIONLINK -> "<a href=\"#"
                    + TextRules.anchorId(wordOf(ctx, ctx.node()))
                    + "\"><code>'"
                    + text
                    + "'</code></a>";
            case TAG -> renderTag(ctx, text);
            case TAGLINK -> renderTaglink(ctx, text);
            case URL -> renderUrl(ctx);
            case CODEBLOCK, HELP_FILE, UPPERCASE_NAME, WORD -> text;
        };
    }

    private String renderBlock(String text) {
        if (options.isOld()) {
            return "<div class=\"old-help-para\">" + text.stripTrailing() + "</div>\n";
        }
        return "<div class=\"help-para\">\n" + text + "\n</div>\n";
    }

    /** In legacy mode the backticks stay, as in :help. */
    private String renderCodespan(VisitContext ctx, String trimmed) {
        if (options.isOld()) {
            return "<span class=\"help-codespan\">" + ctx.cleanText().stripLeading() + "</span>";
        }
        return "<code>" + trimmed + "</code>";
    }

    private String renderCode(String text) {
        Optional<String> language = state.takePendingLanguage();
        String code = TextRules.trimIndent(text, options.effectiveTabWidth()).stripTrailing();
        if (language.isPresent()) {
            return "<pre><code class=\"language-"
                    + TextRules.escapeAttribute(language.get())
                    + "\">"
                    + code
                    + "</code></pre>";
        }
        return "<pre>" + code + "</pre>";
    }

    /** The link target comes from the raw text so that it is escaped once, for an attribute. */
    private String renderUrl(VisitContext ctx) {
        TextRules.UrlParts url = TextRules.fixUrl(ctx.rawText().stripLeading());
        return "<a href=\""
                + TextRules.escapeAttribute(url.href())
                + "\">"
                + TextRules.escapeHtml(url.href())
                + "</a>"
                + TextRules.escapeHtml(url.trailing());
    }

    private String renderHeading(NodeType type, VisitContext ctx, String text) {
        String raw = ctx.rawText();
        if (TextRules.isNoise(raw)) {
            stats.addNoiseLine(raw);
            return "";
        }
        String anchor =
                ctx.firstDescendant(NodeType.TAG)
                        .map(tag -> TextRules.anchorId(wordOf(ctx, tag)))
                        .map(id -> "<a name=\"" + id + "\"></a>")
                        .orElse("");
        String element = type == NodeType.H1 ? "h2" : "h3";
        return anchor
                + "<"
                + element
                + " class=\"help-heading\">"
                + text
                + "</"
                + element
                + ">";
    }

    private String renderTag(VisitContext ctx, String text) {
        String name = wordOf(ctx, ctx.node());
        stats.addTag(name);
        if (ctx.parentType().map(NodeType::isHeading).orElse(false)) {
            // The heading carries the anchor.
            return "<span class=\"help-tag\">" + text + "</span>";
        }
        return "<a name=\""
                + TextRules.anchorId(name)
                + "\"></a><code class=\"help-tag\">"
                + text
                + "</code>";
    }

    private String renderTaglink(VisitContext ctx, String text) {
        String target = wordOf(ctx, ctx.node());
        stats.addTaglink(target);
        return "<a href=\"#" + TextRules.anchorId(target) + "\">" + text + "</a>";
    }

    private String renderLine(VisitContext ctx, String text, String trimmed) {
        boolean inCode =
                ctx.parentType()
                        .map(parent -> parent == NodeType.CODE || parent == NodeType.CODEBLOCK)
                        .orElse(false);
        if (!inCode) {
            if (TextRules.isBlank(text)) {
                return "";
            }
            String raw = ctx.rawText();
            if (TextRules.isNoise(raw)) {
                stats.addNoiseLine(raw);
                return "";
            }
        }

        if (options.isOld() && startsWithHeading(ctx)) {
            return trimmed;
        }
        return text + "\n";
    }

    private static boolean startsWithHeading(VisitContext ctx) {
        List<SyntaxNode> named = ctx.namedChildren();
        if (named.isEmpty()) {
            return false;
        }
        Optional<NodeType> first = NodeType.fromKind(named.get(0).kind());
        return first.map(t -> t == NodeType.COLUMN_HEADING || t.isHeading()).orElse(false);
    }

    /**
     * A list item directly after another one is nested one level deeper when it is indented
     * more, and one level shallower when it is indented less.
     */
    private String renderListItem(VisitContext ctx, String text) {
        int indent = indentOf(ctx, ctx.node());
        OptionalInt previousIndent = state.previousListItemIndent(ctx.depth());
        int level;
        if (previousIndent.isEmpty()) {
            level = 1;
        } else {
            level = state.listLevel();
            if (indent > previousIndent.getAsInt()) {
                level++;
            } else if (indent < previousIndent.getAsInt()) {
                level--;
            }
        }
        state.setListLevel(level);
        state.leaveListItem(ctx.depth(), indent);

        return "<div class=\"help-li\" style=\""
                + marginFor(state.listLevel())
                + "\">"
                + text
                + "</div>";
    }

    private String marginFor(int level) {
        if (level <= 1) {
            return "";
        }
        BigDecimal rem =
                BigDecimal.valueOf(options.effectiveIndentStep())
                        .multiply(BigDecimal.valueOf(level))
                        .stripTrailingZeros();
        return "margin-left: " + rem.toPlainString() + "rem;";
    }

    /** Column of the first visible character of the node, with tabs expanded. */
    private int indentOf(VisitContext ctx, SyntaxNode node) {
        int indent = node.startPoint().column();
        String raw = ctx.textOf(node);
        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            if (c == ' ') {
                indent++;
            } else if (c == '\t') {
                indent += options.effectiveTabWidth();
            } else {
                break;
            }
        }
        return indent;
    }

    private String renderUnknown(VisitContext ctx, String text, String trimmed) {
        if (!ctx.hasError()) {
            return "";
        }
        if (TextRules.ignoreParseError(trimmed)) {
            return text;
        }
        stats.addParseError(ctx.rawText());
        return "{ERROR: "
                + TextRules.truncate(text, options.effectiveErrorPreviewBytes())
                + "}";
    }

    /** The raw text of the node's {@code word} child, or of the node itself if it has none. */
    private static String wordOf(VisitContext ctx, SyntaxNode node) {
        for (SyntaxNode child : node.children()) {
            if (NodeType.WORD.kind().equals(child.kind())) {
                return ctx.textOf(child);
            }
        }
        return ctx.textOf(node);
    }
}
