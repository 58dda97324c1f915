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

import java.nio.charset.CharacterCodingException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import net.boyechko.vimdoc.ast.Argument;
import net.boyechko.vimdoc.ast.Block;
import net.boyechko.vimdoc.ast.BlockChild;
import net.boyechko.vimdoc.ast.Codeblock;
import net.boyechko.vimdoc.ast.Codespan;
import net.boyechko.vimdoc.ast.ColumnHeading;
import net.boyechko.vimdoc.ast.H1;
import net.boyechko.vimdoc.ast.H2;
import net.boyechko.vimdoc.ast.H3;
import net.boyechko.vimdoc.ast.HChild;
import net.boyechko.vimdoc.ast.HelpFile;
import net.boyechko.vimdoc.ast.Keycode;
import net.boyechko.vimdoc.ast.Language;
import net.boyechko.vimdoc.ast.Line;
import net.boyechko.vimdoc.ast.LineChild;
import net.boyechko.vimdoc.ast.LineLi;
import net.boyechko.vimdoc.ast.LineLiChild;
import net.boyechko.vimdoc.ast.Optionlink;
import net.boyechko.vimdoc.ast.Tag;
import net.boyechko.vimdoc.ast.Taglink;
import net.boyechko.vimdoc.ast.UppercaseName;
import net.boyechko.vimdoc.ast.Url;
import net.boyechko.vimdoc.ast.Word;
import net.boyechko.vimdoc.issues.Issue;
import net.boyechko.vimdoc.issues.IssueLocation;
import net.boyechko.vimdoc.issues.IssueReporter;
import net.boyechko.vimdoc.issues.IssueSeverity;
import net.boyechko.vimdoc.issues.IssueType;
import net.boyechko.vimdoc.syntax.SourceText;
import net.boyechko.vimdoc.syntax.SyntaxCursor;
import net.boyechko.vimdoc.syntax.SyntaxNode;
import net.boyechko.vimdoc.syntax.SyntaxTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a concrete syntax tree into a {@link HelpFile}.
 *
 * <p>Each grammar position has a table from node kind to the method that builds it. Error and
 * missing nodes inside lists are reported to the {@link IssueReporter} and left out, so one
 * broken fragment does not lose the rest of the document. Structural problems (a wrong kind, a
 * missing or duplicated single child, undecodable text) fail with a {@link TreeBuildException}.
 *
 * <p>Every build method is entered with the cursor on the node it builds and returns with the
 * cursor on that same node.
 */
public final class TreeBuilder {
    private static final Logger logger = LoggerFactory.getLogger(TreeBuilder.class);

    private final SourceText source;
    private final IssueReporter reporter;

    private final Map<String, NodeFactory<BlockChild>> blockChildren = new LinkedHashMap<>();
    private final Map<String, NodeFactory<LineChild>> lineChildren = new LinkedHashMap<>();
    private final Map<String, NodeFactory<LineLiChild>> lineLiChildren = new LinkedHashMap<>();
    private final Map<String, NodeFactory<HChild>> headingChildren = new LinkedHashMap<>();

    public TreeBuilder(SourceText source) {
        this(source, IssueReporter.logging());
    }

    public TreeBuilder(SourceText source, IssueReporter reporter) {
        this.source = source;
        this.reporter = reporter;

        blockChildren.put("line", this::line);
        blockChildren.put("line_li", this::lineLi);

        lineChildren.put("argument", this::argument);
        lineChildren.put("codeblock", this::codeblock);
        lineChildren.put("codespan", this::codespan);
        lineChildren.put("column_heading", this::columnHeading);
        lineChildren.put("h1", this::h1);
        lineChildren.put("h2", this::h2);
        lineChildren.put("h3", this::h3);
        lineChildren.put("keycode", this::keycode);
        lineChildren.put("optionlink", this::optionlink);
        lineChildren.put("tag", this::tag);
        lineChildren.put("taglink", this::taglink);
        lineChildren.put("url", this::url);
        lineChildren.put("word", this::word);

        lineLiChildren.put("codeblock", this::codeblock);
        lineLiChildren.put("line", this::line);

        headingChildren.put("argument", this::argument);
        headingChildren.put("codespan", this::codespan);
        headingChildren.put("keycode", this::keycode);
        headingChildren.put("optionlink", this::optionlink);
        headingChildren.put("tag", this::tag);
        headingChildren.put("taglink", this::taglink);
        headingChildren.put("url", this::url);
        headingChildren.put("word", this::word);
    }

    /** Builds a help file from a whole tree, which must have been parsed from this source. */
    public HelpFile build(SyntaxTree tree) throws TreeBuildException {
        return build(tree.walk());
    }

    /** Builds a help file from the {@code help_file} node under the cursor. */
    public HelpFile build(SyntaxCursor cursor) throws TreeBuildException {
        HelpFile helpFile = helpFile(cursor);
        logger.debug("Built help file with {} blocks", helpFile.blocks().size());
        return helpFile;
    }

    // Non-terminals

    private HelpFile helpFile(SyntaxCursor cursor) throws TreeBuildException {
        expectKind(cursor, "help_file");
        return new HelpFile(many(cursor, this::block));
    }

    private Block block(SyntaxCursor cursor) throws TreeBuildException {
        expectKind(cursor, "block");
        return new Block(many(cursor, c -> dispatch(c, blockChildren)));
    }

    private Line line(SyntaxCursor cursor) throws TreeBuildException {
        expectKind(cursor, "line");
        return new Line(many(cursor, c -> dispatch(c, lineChildren)));
    }

    private LineLi lineLi(SyntaxCursor cursor) throws TreeBuildException {
        expectKind(cursor, "line_li");
        return new LineLi(many(cursor, c -> dispatch(c, lineLiChildren)));
    }

    /**
     * A code block is an optional leading {@code language} followed by lines. The grammar may
     * also group the lines under a {@code code} node, whose lines are taken over directly.
     */
    private Codeblock codeblock(SyntaxCursor cursor) throws TreeBuildException {
        expectKind(cursor, "codeblock");
        Language language = null;
        List<Line> lines = new ArrayList<>();

        if (cursor.gotoFirstChild()) {
            try {
                boolean first = true;
                do {
                    SyntaxNode node = cursor.node();
                    if (reportIfInvalid(node) || !node.isNamed()) {
                        continue;
                    }
                    if (first && "language".equals(node.kind())) {
                        language = language(cursor);
                    } else if ("code".equals(node.kind())) {
                        lines.addAll(code(cursor));
                    } else {
                        lines.add(line(cursor));
                    }
                    first = false;
                } while (cursor.gotoNextSibling());
            } finally {
                cursor.gotoParent();
            }
        }
        return new Codeblock(Optional.ofNullable(language), lines);
    }

    private List<Line> code(SyntaxCursor cursor) throws TreeBuildException {
        SyntaxNode node = cursor.node();
        if (node.namedChildCount() == 0) {
            // Code without line structure is kept as one word so its text is not lost.
            Word text = new Word(text(node), node.startPoint());
            return Collections.singletonList(new Line(List.of(text)));
        }
        return many(cursor, this::line);
    }

    private Argument argument(SyntaxCursor cursor) throws TreeBuildException {
        expectKind(cursor, "argument");
        return new Argument(single(cursor, "text", this::word));
    }

    private Codespan codespan(SyntaxCursor cursor) throws TreeBuildException {
        expectKind(cursor, "codespan");
        return new Codespan(single(cursor, "text", this::word));
    }

    private Optionlink optionlink(SyntaxCursor cursor) throws TreeBuildException {
        expectKind(cursor, "optionlink");
        return new Optionlink(single(cursor, "text", this::word));
    }

    private Tag tag(SyntaxCursor cursor) throws TreeBuildException {
        expectKind(cursor, "tag");
        return new Tag(single(cursor, "text", this::word));
    }

    private Taglink taglink(SyntaxCursor cursor) throws TreeBuildException {
        expectKind(cursor, "taglink");
        return new Taglink(single(cursor, "text", this::word));
    }

    private Url url(SyntaxCursor cursor) throws TreeBuildException {
        expectKind(cursor, "url");
        return new Url(single(cursor, "text", this::word));
    }

    private ColumnHeading columnHeading(SyntaxCursor cursor) throws TreeBuildException {
        expectKind(cursor, "column_heading");
        return new ColumnHeading(many(cursor, c -> dispatch(c, headingChildren)));
    }

    private H1 h1(SyntaxCursor cursor) throws TreeBuildException {
        expectKind(cursor, "h1");
        return new H1(many(cursor, c -> dispatch(c, headingChildren)));
    }

    private H2 h2(SyntaxCursor cursor) throws TreeBuildException {
        expectKind(cursor, "h2");
        return new H2(many(cursor, c -> dispatch(c, headingChildren)));
    }

    /** The first named child of an {@code h3} must be its uppercase name. */
    private H3 h3(SyntaxCursor cursor) throws TreeBuildException {
        expectKind(cursor, "h3");
        SyntaxNode h3 = cursor.node();
        UppercaseName name = null;
        List<HChild> children = new ArrayList<>();

        if (cursor.gotoFirstChild()) {
            try {
                do {
                    SyntaxNode node = cursor.node();
                    if (reportIfInvalid(node) || !node.isNamed()) {
                        continue;
                    }
                    if (name == null) {
                        name = uppercaseName(cursor);
                    } else {
                        children.add(dispatch(cursor, headingChildren));
                    }
                } while (cursor.gotoNextSibling());
            } finally {
                cursor.gotoParent();
            }
        }

        if (name == null) {
            throw new MissingFieldException(h3.startPoint(), "name", h3.kind());
        }
        return new H3(name, children);
    }

    // Terminals

    private Word word(SyntaxCursor cursor) throws TreeBuildException {
        expectKind(cursor, "word");
        SyntaxNode node = cursor.node();
        return new Word(text(node), node.startPoint());
    }

    private Keycode keycode(SyntaxCursor cursor) throws TreeBuildException {
        expectKind(cursor, "keycode");
        SyntaxNode node = cursor.node();
        return new Keycode(text(node), node.startPoint());
    }

    private Language language(SyntaxCursor cursor) throws TreeBuildException {
        expectKind(cursor, "language");
        SyntaxNode node = cursor.node();
        return new Language(text(node), node.startPoint());
    }

    private UppercaseName uppercaseName(SyntaxCursor cursor) throws TreeBuildException {
        expectKind(cursor, "uppercase_name");
        SyntaxNode node = cursor.node();
        return new UppercaseName(text(node), node.startPoint());
    }

    // Field helpers

    /** Builds every valid named child of the current node, in order. */
    private <T> List<T> many(SyntaxCursor cursor, NodeFactory<T> childFactory)
            throws TreeBuildException {
        List<T> children = new ArrayList<>();
        if (!cursor.gotoFirstChild()) {
            return children;
        }
        try {
            do {
                SyntaxNode node = cursor.node();
                if (reportIfInvalid(node) || !node.isNamed()) {
                    continue;
                }
                children.add(childFactory.build(cursor));
            } while (cursor.gotoNextSibling());
        } finally {
            cursor.gotoParent();
        }
        return children;
    }

    /** Builds the one valid named child of the current node. */
    private <T> T single(SyntaxCursor cursor, String field, NodeFactory<T> childFactory)
            throws TreeBuildException {
        SyntaxNode parent = cursor.node();
        T child = null;
        int count = 0;

        if (cursor.gotoFirstChild()) {
            try {
                do {
                    SyntaxNode node = cursor.node();
                    if (reportIfInvalid(node) || !node.isNamed()) {
                        continue;
                    }
                    count++;
                    if (count == 1) {
                        child = childFactory.build(cursor);
                    }
                } while (cursor.gotoNextSibling());
            } finally {
                cursor.gotoParent();
            }
        }

        if (count > 1) {
            throw new TooManyChildrenException(parent.startPoint(), 1, count, parent.kind());
        }
        if (child == null) {
            throw new MissingFieldException(parent.startPoint(), field, parent.kind());
        }
        return child;
    }

    private <T> T dispatch(SyntaxCursor cursor, Map<String, NodeFactory<T>> table)
            throws TreeBuildException {
        SyntaxNode node = cursor.node();
        NodeFactory<T> factory = table.get(node.kind());
        if (factory == null) {
            throw new KindMismatchException(node.startPoint(), table.keySet(), node.kind());
        }
        return factory.build(cursor);
    }

    private static void expectKind(SyntaxCursor cursor, String kind)
            throws KindMismatchException {
        SyntaxNode node = cursor.node();
        if (!kind.equals(node.kind())) {
            throw new KindMismatchException(node.startPoint(), kind, node.kind());
        }
    }

    private String text(SyntaxNode node) throws InvalidTextException {
        try {
            return node.utf8Text(source);
        } catch (CharacterCodingException e) {
            throw new InvalidTextException(node.startPoint(), e);
        }
    }

    /** Reports an error or missing node and returns true; returns false for any other node. */
    private boolean reportIfInvalid(SyntaxNode node) {
        if (!node.isError() && !node.isMissing()) {
            return false;
        }
        IssueType type = node.isError() ? IssueType.INVALID_NODE : IssueType.MISSING_NODE;
        reporter.report(
                new Issue(type, IssueSeverity.WARNING, IssueLocation.at(node), node.toSexp()));
        return true;
    }
}
