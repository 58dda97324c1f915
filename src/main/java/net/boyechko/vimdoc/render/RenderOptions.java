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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

/**
 * Settings for {@link HtmlRenderer}, loaded from YAML:
 *
 * <pre>
 * old: false
 * tab_width: 8
 * indent_step: 1.5
 * error_preview_bytes: 10
 * </pre>
 */
public final class RenderOptions {
    private static final String DEFAULT_OPTIONS_RESOURCE = "/vimdoc-render.yaml";
    private static final Logger logger = LoggerFactory.getLogger(RenderOptions.class);

    /** Legacy markup: plain paragraphs, bare heading lines and codespans shown with backticks. */
    public boolean old;

    /** Spaces per tab when removing the indentation of code. */
    public int tab_width = 8;

    /** Left margin, in rem, added per list nesting level. */
    public double indent_step = 1.5;

    /** How many bytes of an unparseable fragment are shown in its error marker. */
    public int error_preview_bytes = 10;

    public boolean isOld() {
        return old;
    }

    public int getTabWidth() {
        return tab_width;
    }

    public double getIndentStep() {
        return indent_step;
    }

    public int getErrorPreviewBytes() {
        return error_preview_bytes;
    }

    /** Returns a copy with legacy mode switched on or off. */
    public RenderOptions withOld(boolean old) {
        RenderOptions copy = copy();
        copy.old = old;
        return copy;
    }

    /**
     * Load options from a classpath resource (e.g., from src/main/resources/)
     *
     * @param resourcePath Path starting with "/" for absolute resource path
     */
    public static RenderOptions fromResource(String resourcePath) {
        try (var inputStream = RenderOptions.class.getResourceAsStream(resourcePath)) {
            if (inputStream == null) {
                throw new IllegalArgumentException("Resource not found: " + resourcePath);
            }

            var yaml = new Yaml(new Constructor(RenderOptions.class, new LoaderOptions()));
            RenderOptions options = yaml.load(inputStream);
            if (options == null) {
                options = new RenderOptions();
            }
            logger.debug("Loaded render options {} from resource {}", options, resourcePath);

            var warnings = options.validate();
            if (!warnings.isEmpty()) {
                logger.warn(
                        "Render options loaded from {} have {} warnings:",
                        resourcePath,
                        warnings.size());
                for (String warning : warnings) {
                    logger.warn("  - {}", warning);
                }
            }
            return options;
        } catch (Exception e) {
            logger.error(
                    "Failed to load render options from resource {}: {}",
                    resourcePath,
                    e.getMessage());
            throw new RuntimeException(
                    "Failed to load render options from resource "
                            + resourcePath
                            + ": "
                            + e.getMessage(),
                    e);
        }
    }

    /** Load the options bundled with the library */
    public static RenderOptions defaults() {
        return fromResource(DEFAULT_OPTIONS_RESOURCE);
    }

    /**
     * Checks the options for values that cannot be rendered sensibly. Offending values are
     * replaced when used, see {@link #effectiveTabWidth()}.
     *
     * @return warning messages, empty if everything is usable
     */
    public List<String> validate() {
        List<String> warnings = new ArrayList<>();
        if (tab_width < 1) {
            warnings.add("tab_width is " + tab_width + "; using 1");
        }
        if (indent_step < 0) {
            warnings.add("indent_step is negative (" + indent_step + "); using 0");
        }
        if (error_preview_bytes < 0) {
            warnings.add("error_preview_bytes is negative (" + error_preview_bytes + "); using 0");
        }
        return warnings;
    }

    int effectiveTabWidth() {
        return Math.max(1, tab_width);
    }

    double effectiveIndentStep() {
        return Math.max(0, indent_step);
    }

    int effectiveErrorPreviewBytes() {
        return Math.max(0, error_preview_bytes);
    }

    private RenderOptions copy() {
        RenderOptions copy = new RenderOptions();
        copy.old = old;
        copy.tab_width = tab_width;
        copy.indent_step = indent_step;
        copy.error_preview_bytes = error_preview_bytes;
        return copy;
    }

    @Override
    public String toString() {
        return "{old="
                + old
                + ", tab_width="
                + tab_width
                + ", indent_step="
                + indent_step
                + ", error_preview_bytes="
                + error_preview_bytes
                + "}";
    }
}
