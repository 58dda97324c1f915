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

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import net.boyechko.vimdoc.VimdocTestBase;
import net.boyechko.vimdoc.syntax.SyntaxTree;
import net.boyechko.vimdoc.syntax.TreeNode;
import org.junit.jupiter.api.Test;

class HtmlRendererTest extends VimdocTestBase {

    private static final Pattern STYLE = Pattern.compile("style=\"([^\"]*)\"");

    private static String para(String inner) {
        return "<div class=\"help-para\">\n" + inner + "\n\n</div>\n";
    }

    /** A one-line document whose line spans the whole source. */
    private static SyntaxTree oneLine(String source, TreeNode.Builder... lineChildren) {
        TreeNode.Builder line = named("line", 0, source.length());
        for (TreeNode.Builder child : lineChildren) {
            line.child(child);
        }
        return tree(source, document(source, line));
    }

    private static String render(SyntaxTree tree) {
        return new HtmlRenderer().render(tree);
    }

    @Test
    void rendersParagraph() {
        assertEquals(HELLO_HTML, render(parse(HELLO_SOURCE, HELLO_DUMP)));
    }

    @Test
    void rendersLegacyParagraph() {
        HtmlRenderer renderer = new HtmlRenderer(RenderOptions.defaults().withOld(true));

        assertEquals(
                "<div class=\"old-help-para\">hello world</div>\n",
                renderer.render(parse(HELLO_SOURCE, HELLO_DUMP)));
        assertTrue(renderer.options().isOld());
    }

    @Test
    void rendersCodeblockWithLanguage() {
        String html = render(parse(CODEBLOCK_SOURCE, CODEBLOCK_DUMP));

        assertEquals(para("<pre><code class=\"language-lua\">x = 1</code></pre>"), html);
    }

    @Test
    void languageAppliesOnlyToItsOwnCode() {
        String source = ">lua\n  a\n<\n>\n  b\n<\n";
        TreeNode.Builder first =
                named("line", 0, 11)
                        .child(
                                named("codeblock", 0, 11)
                                        .child(named("language", 1, 4))
                                        .child(named("code", 5, 9)));
        TreeNode.Builder second =
                named("line", 11, 19)
                        .child(named("codeblock", 11, 19).child(named("code", 13, 17)));
        String html = render(tree(source, document(source, first, second)));

        assertTrue(html.contains("<pre><code class=\"language-lua\">a</code></pre>"), html);
        assertTrue(html.contains("<pre>b</pre>"), html);
    }

    @Test
    void emptyCodeStillTakesItsLanguage() {
        String source = ">lua\n<\n>\n  b\n<\n";
        TreeNode.Builder first =
                named("line", 0, 7)
                        .child(
                                named("codeblock", 0, 7)
                                        .child(named("language", 1, 4))
                                        .child(named("code", 5, 5)));
        TreeNode.Builder second =
                named("line", 7, 15).child(named("codeblock", 7, 15).child(named("code", 9, 13)));

        assertEquals(para("<pre>b</pre>"), render(tree(source, document(source, first, second))));
    }

    @Test
    void rendersHeadingWithAnchor() {
        HtmlRenderer renderer = new HtmlRenderer();

        String html = renderer.render(parse(HEADING_SOURCE, HEADING_DUMP));

        assertEquals(
                para(
                        "<a name=\"intro\"></a><h3 class=\"help-heading\">INTRO "
                                + "<span class=\"help-tag\">intro</span></h3>"),
                html);
        assertEquals(Set.of("intro"), renderer.stats().tags());
        assertEquals("intro", renderer.stats().firstTag().orElseThrow());
    }

    @Test
    void legacyHeadingLineIsNotFollowedByNewline() {
        HtmlRenderer renderer = new HtmlRenderer(RenderOptions.defaults().withOld(true));

        String html = renderer.render(parse(HEADING_SOURCE, HEADING_DUMP));

        assertEquals(
                "<div class=\"old-help-para\"><a name=\"intro\"></a><h3 class=\"help-heading\">"
                        + "INTRO <span class=\"help-tag\">intro</span></h3></div>\n",
                html);
    }

    @Test
    void firstLevelHeadingBecomesH2() {
        String source = "Title\n";
        String html = render(oneLine(source, named("h1", 0, 5).child(word(0, 5))));

        assertEquals(para("<h2 class=\"help-heading\">Title</h2>"), html);
    }

    @Test
    void rendersColumnHeading() {
        String source = "Name~\n";
        TreeNode.Builder heading =
                named("column_heading", 0, 5)
                        .child(word(0, 4))
                        .child(TreeNode.anonymous("~").span(4, 5));

        assertEquals(
                para("<div class=\"help-column_heading\">Name</div>"),
                render(oneLine(source, heading)));
    }

    @Test
    void boilerplateLinesAreDropped() {
        String source = "NVIM REFERENCE MANUAL\n";
        HtmlRenderer renderer = new HtmlRenderer();

        String html = renderer.render(oneLine(source, word(0, 4), word(5, 14), word(15, 21)));

        assertEquals("", html);
        assertEquals(List.of(source), renderer.stats().noiseLines());
    }

    @Test
    void rendersTagDefinitionAndLink() {
        String source = "*foo* |foo|\n";
        TreeNode.Builder tag = named("tag", 0, 5).child(word(1, 4).field("text"));
        TreeNode.Builder taglink = named("taglink", 6, 11).child(word(7, 10).field("text"));
        HtmlRenderer renderer = new HtmlRenderer();

        String html = renderer.render(oneLine(source, tag, taglink));

        assertEquals(
                para(
                        "<a name=\"foo\"></a><code class=\"help-tag\">foo</code> "
                                + "<a href=\"#foo\">foo</a>"),
                html);
        assertEquals(Set.of("foo"), renderer.stats().taglinks());
        assertTrue(renderer.stats().unresolvedTaglinks().isEmpty());
    }

    @Test
    void linksToUndefinedTagsAreUnresolved() {
        String source = "see |foo| |matchit|\n";
        TreeNode.Builder foo =
                named("taglink", 4, 9)
                        .child(TreeNode.anonymous("|").span(4, 5))
                        .child(word(5, 8).field("text"))
                        .child(TreeNode.anonymous("|").span(8, 9));
        TreeNode.Builder matchit = named("taglink", 10, 19).child(word(11, 18).field("text"));
        HtmlRenderer renderer = new HtmlRenderer();

        String html = renderer.render(oneLine(source, word(0, 3), foo, matchit));

        assertTrue(html.contains("see <a href=\"#foo\">foo</a>"), html);
        assertEquals(Set.of("foo"), renderer.stats().unresolvedTaglinks(), "matchit is known");
    }

    @Test
    void rendersInlineElements() {
        assertEquals(
                para("<a href=\"#ts\"><code>'ts'</code></a>"),
                render(oneLine("'ts'\n", named("optionlink", 0, 4).child(word(1, 3)))));
        assertEquals(
                para("<code>arg</code>"),
                render(oneLine("{arg}\n", named("argument", 0, 5).child(word(1, 4)))));
        assertEquals(
                para("<code>&lt;Esc&gt;</code>"),
                render(oneLine("<Esc>\n", named("keycode", 0, 5))));
        assertEquals(
                para("<code>x</code>"),
                render(oneLine("`x`\n", named("codespan", 0, 3).child(word(1, 2)))));
    }

    @Test
    void legacyCodespanKeepsBackticks() {
        HtmlRenderer renderer = new HtmlRenderer(RenderOptions.defaults().withOld(true));

        String html = renderer.render(oneLine("`x`\n", named("codespan", 0, 3).child(word(1, 2))));

        assertEquals(
                "<div class=\"old-help-para\"><span class=\"help-codespan\">`x`</span></div>\n",
                html);
    }

    @Test
    void urlLeavesTrailingPunctuationOutsideTheLink() {
        String source = "https://neovim.io).\n";
        String html = render(oneLine(source, named("url", 0, 19).child(word(0, 19))));

        assertEquals(para("<a href=\"https://neovim.io\">https://neovim.io</a>)."), html);
    }

    @Test
    void quotesInUrlsAreEscapedInsideTheAttribute() {
        String source = "https://a.b/?q=\"x\"\n";
        String html = render(oneLine(source, named("url", 0, 18).child(word(0, 18))));

        assertEquals(
                para("<a href=\"https://a.b/?q=&quot;x&quot;\">https://a.b/?q=\"x\"</a>"), html);
    }

    @Test
    void ampersandsInUrlsAreEscapedOnce() {
        String source = "https://a.b/?x=1&y=2\n";
        String html = render(oneLine(source, named("url", 0, 20).child(word(0, 20))));

        assertEquals(
                para("<a href=\"https://a.b/?x=1&amp;y=2\">https://a.b/?x=1&amp;y=2</a>"), html);
    }

    @Test
    void quotesInLanguageAreEscaped() {
        String source = ">lua\"x\n  a\n<\n";
        TreeNode.Builder codeblock =
                named("codeblock", 0, 13)
                        .child(named("language", 1, 6))
                        .child(named("code", 7, 11));

        String html = render(oneLine(source, codeblock));

        assertEquals(para("<pre><code class=\"language-lua&quot;x\">a</code></pre>"), html);
    }

    @Test
    void errorNodesBecomeErrorMarkers() {
        String source = "foo bar\n";
        HtmlRenderer renderer = new HtmlRenderer();

        TreeNode.Builder error = TreeNode.error().span(4, 7).child(word(4, 7));
        String html = renderer.render(oneLine(source, word(0, 3), error));

        assertEquals(para("foo {ERROR: bar}"), html);
        assertEquals(List.of("bar"), renderer.stats().parseErrors());
    }

    @Test
    void errorMarkersAreTruncated() {
        String source = "foo abcdefghijklmnop\n";
        String html = render(oneLine(source, word(0, 3), TreeNode.error().span(4, 20)));

        assertEquals(para("foo {ERROR: abcdefghij}"), html);
    }

    @Test
    void unclosedMarkupIsShownAsText() {
        String source = "foo *bar\n";
        TreeNode.Builder error =
                TreeNode.error()
                        .span(4, 8)
                        .child(TreeNode.anonymous("*").span(4, 5))
                        .child(word(5, 8));
        HtmlRenderer renderer = new HtmlRenderer();

        assertEquals(para("foo *bar"), renderer.render(oneLine(source, word(0, 3), error)));
        assertTrue(renderer.stats().parseErrors().isEmpty());
    }

    @Test
    void inlineElementWithErrorShowsItsSourceText() {
        String source = "|foo\n";
        TreeNode.Builder taglink =
                named("taglink", 0, 4)
                        .child(TreeNode.anonymous("|").span(0, 1))
                        .child(word(1, 4))
                        .child(TreeNode.missing("|", false).span(4, 4));
        HtmlRenderer renderer = new HtmlRenderer();

        assertEquals(para("|foo"), renderer.render(oneLine(source, taglink)));
        assertTrue(renderer.stats().taglinks().isEmpty(), "A broken link is not a link");
    }

    @Test
    void unknownNodesWithoutErrorsRenderNothing() {
        String source = "foo bar\n";

        assertEquals(para("foo"), render(oneLine(source, word(0, 3), named("note", 4, 7))));
    }

    @Test
    void listItemsAreIndentedByNestingLevel() {
        String source = "- a\n  - b\n    - c\n  - d\n- e\n";
        List<int[]> rows =
                List.of(
                        new int[] {0, 4},
                        new int[] {4, 10},
                        new int[] {10, 18},
                        new int[] {18, 24},
                        new int[] {24, 28});
        SyntaxTree tree = listDocument(source, rows);

        String html = render(tree);

        assertEquals(
                List.of("", "margin-left: 3rem;", "margin-left: 4.5rem;", "margin-left: 3rem;", ""),
                styles(html));
        assertTrue(html.contains("<div class=\"help-li\" style=\"\">a\n</div>"), html);
    }

    @Test
    void listLevelsChangeOneStepAtATime() {
        Random random = new Random(42);
        RenderOptions options = new RenderOptions();
        options.indent_step = 1;

        for (int round = 0; round < 20; round++) {
            StringBuilder source = new StringBuilder();
            List<Integer> indents = new ArrayList<>();
            List<int[]> rows = new ArrayList<>();
            for (int i = 0; i < 12; i++) {
                int indent = 2 * random.nextInt(4);
                int start = source.length();
                source.append(" ".repeat(indent)).append("- x\n");
                indents.add(indent);
                rows.add(new int[] {start, source.length()});
            }
            String text = source.toString();
            SyntaxTree tree = listDocument(text, rows);

            List<Integer> levels = levels(styles(new HtmlRenderer(options).render(tree)));

            assertEquals(indents.size(), levels.size());
            assertEquals(1, levels.get(0), "The first item is at the top level");
            for (int i = 1; i < levels.size(); i++) {
                int step = levels.get(i) - levels.get(i - 1);
                int indentChange = Integer.compare(indents.get(i), indents.get(i - 1));
                if (indentChange > 0) {
                    assertEquals(1, step, "Deeper indent nests one level at item " + i);
                } else if (indentChange == 0) {
                    assertEquals(0, step, "Same indent keeps the level at item " + i);
                } else {
                    assertTrue(step == -1 || levels.get(i) == 1, "Shallower indent at item " + i);
                }
            }
        }
    }

    @Test
    void listItemInNewBlockStartsAtTopLevel() {
        String text = "- a\n  - b\n  - c\n";
        TreeNode.Builder first =
                named("block", 0, 10)
                        .child(listItem(new int[] {0, 4}))
                        .child(listItem(new int[] {4, 10}));
        TreeNode.Builder second = named("block", 10, 16).child(listItem(new int[] {10, 16}));
        SyntaxTree tree =
                tree(text, named("help_file", 0, text.length()).child(first).child(second));

        assertEquals(List.of("", "margin-left: 3rem;", ""), styles(render(tree)));
    }

    @Test
    void listItemAfterPlainLineStartsAtTopLevel() {
        String source = "- a\n  - b\nfoo\n  - c\n";
        TreeNode.Builder block =
                named("block", 0, source.length())
                        .child(listItem(new int[] {0, 4}))
                        .child(listItem(new int[] {4, 10}))
                        .child(named("line", 10, 14).child(word(10, 13)))
                        .child(listItem(new int[] {14, 20}));
        SyntaxTree tree = tree(source, named("help_file", 0, source.length()).child(block));

        assertEquals(List.of("", "margin-left: 3rem;", ""), styles(render(tree)));
    }

    @Test
    void renderingTwiceGivesTheSameResult() {
        String source = "see |foo|\n";
        SyntaxTree tree = oneLine(source, word(0, 3), named("taglink", 4, 9).child(word(5, 8)));
        HtmlRenderer renderer = new HtmlRenderer();

        String first = renderer.render(tree);
        String firstSummary = renderer.stats().toString();
        String second = renderer.render(tree);

        assertEquals(first, second);
        assertEquals(firstSummary, renderer.stats().toString(), "Stats are not accumulated");
    }

    /** One list item per row; each row ends in "- x\n" with x the item's only word. */
    private static SyntaxTree listDocument(String source, List<int[]> rows) {
        TreeNode.Builder block = named("block", 0, source.length());
        for (int[] row : rows) {
            block.child(listItem(row));
        }
        return tree(source, named("help_file", 0, source.length()).child(block));
    }

    private static TreeNode.Builder listItem(int[] row) {
        int letter = row[1] - 2;
        TreeNode.Builder line = named("line", letter, row[1]).child(word(letter, letter + 1));
        return named("line_li", row[0], row[1]).child(line);
    }

    private static List<String> styles(String html) {
        List<String> styles = new ArrayList<>();
        Matcher m = STYLE.matcher(html);
        while (m.find()) {
            styles.add(m.group(1));
        }
        return styles;
    }

    /** Converts {@code margin-left: Nrem;} styles back to levels, for an indent step of 1. */
    private static List<Integer> levels(List<String> styles) {
        List<Integer> levels = new ArrayList<>();
        for (String style : styles) {
            if (style.isEmpty()) {
                levels.add(1);
            } else {
                String rem = style.replace("margin-left: ", "").replace("rem;", "");
                levels.add(Integer.parseInt(rem));
            }
        }
        return levels;
    }
}
