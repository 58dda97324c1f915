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

import java.io.IOException;
import net.boyechko.vimdoc.ast.HelpFile;
import net.boyechko.vimdoc.build.TreeBuildException;
import net.boyechko.vimdoc.build.TreeBuilder;
import net.boyechko.vimdoc.issues.Issue;
import net.boyechko.vimdoc.issues.IssueList;
import net.boyechko.vimdoc.issues.IssueReporter;
import net.boyechko.vimdoc.render.DebugRenderer;
import net.boyechko.vimdoc.render.HtmlRenderer;
import net.boyechko.vimdoc.render.RenderOptions;
import net.boyechko.vimdoc.render.RenderStats;
import net.boyechko.vimdoc.syntax.SourceText;
import net.boyechko.vimdoc.syntax.SyntaxParser;
import net.boyechko.vimdoc.syntax.SyntaxTree;
import net.boyechko.vimdoc.syntax.SyntaxTreePrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Parses vimdoc source and turns it into HTML, a node dump or a typed tree. */
public class ConversionService {
    private static final Logger logger = LoggerFactory.getLogger(ConversionService.class);

    private final SyntaxParser parser;
    private final RenderOptions options;
    private final IssueReporter reporter;

    public static class ConversionServiceBuilder {
        private SyntaxParser parser;
        private RenderOptions options;
        private IssueReporter reporter;

        public ConversionServiceBuilder withParser(SyntaxParser parser) {
            this.parser = parser;
            return this;
        }

        public ConversionServiceBuilder withOptions(RenderOptions options) {
            this.options = options;
            return this;
        }

        public ConversionServiceBuilder withIssueReporter(IssueReporter reporter) {
            this.reporter = reporter;
            return this;
        }

        public ConversionService build() {
            if (parser == null) {
                throw new IllegalStateException(
                        "SyntaxParser must be provided via withParser(...) before building ConversionService");
            }
            return new ConversionService(this);
        }
    }

    public static ConversionServiceBuilder builder() {
        return new ConversionServiceBuilder();
    }

    private ConversionService(ConversionServiceBuilder builder) {
        this.parser = builder.parser;
        this.options = builder.options != null ? builder.options : RenderOptions.defaults();
        this.reporter = builder.reporter != null ? builder.reporter : IssueReporter.logging();
    }

    /**
     * Parses and converts one help file.
     *
     * @throws IOException if the parser fails
     */
    public ConversionResult convert(String source, OutputFormat format) throws IOException {
        return convert(parse(source), format);
    }

    /** Converts an already parsed help file. Rendering never fails on malformed input. */
    public ConversionResult convert(SyntaxTree tree, OutputFormat format) {
        IssueList issues = new IssueList();
        RenderStats stats = new RenderStats();
        String output;

        switch (format) {
            case HTML -> {
                HtmlRenderer renderer = new HtmlRenderer(options);
                output = renderer.render(tree);
                stats = renderer.stats();
                issues.addAll(stats.toIssues());
            }
            case DEBUG -> output = new DebugRenderer().render(tree);
            case TREE -> output = SyntaxTreePrinter.toIndentedTreeString(tree.root(), true);
            case SEXP -> output = tree.root().toSexp();
            default -> throw new IllegalArgumentException("Unknown output format: " + format);
        }

        for (Issue issue : issues) {
            reporter.report(issue);
        }
        logger.debug(
                "Converted to {}: {} characters, {} issues",
                format,
                output.length(),
                issues.size());
        return new ConversionResult(format, output, stats, issues);
    }

    /**
     * Parses a help file and builds its typed tree. Error and missing nodes go to the configured
     * {@link IssueReporter} and are left out of the tree.
     *
     * @throws IOException if the parser fails
     * @throws TreeBuildException if the tree does not have the structure of a help file
     */
    public HelpFile buildHelpFile(String source) throws IOException, TreeBuildException {
        SyntaxTree tree = parse(source);
        return new TreeBuilder(tree.source(), reporter).build(tree);
    }

    public RenderOptions options() {
        return options;
    }

    private SyntaxTree parse(String source) throws IOException {
        try {
            return parser.parse(SourceText.of(source));
        } catch (IOException e) {
            logger.error("Failed to parse vimdoc: {}", e.getMessage());
            throw e;
        }
    }
}
