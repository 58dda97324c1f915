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
package net.boyechko.vimdoc.text;

import java.nio.charset.StandardCharsets;
import java.util.Set;
import java.util.regex.Pattern;
import org.apache.commons.text.StringEscapeUtils;

/** Classification and clean-up rules applied to vimdoc text while rendering. Stateless. */
public final class TextRules {

    private static final Pattern TOC_HINT =
            Pattern.compile("Type .*gO.* to see the table of contents");

    // "NVIM REFERENCE MANUAL    by ..."
    private static final Pattern TITLE_LINE =
            Pattern.compile("^\\s*N?VIM[ \\t]*REFERENCE[ \\t]*MANUAL");

    // "*api.txt*    Nvim"
    private static final Pattern HELP_FIRST_LINE =
            Pattern.compile("\\s*\\*?[a-zA-Z]+\\.txt\\*?\\s+N?[vV]im\\s*$");

    // "vim:tw=78:ts=8:sw=4:sts=4:et:ft=help:norl:"
    private static final Pattern MODELINE =
            Pattern.compile(
                    "^\\s*vim?:.*ft=help|^\\s*vim?:.*filetype=help|[*>]local-additions[*<]");

    /** Tag names that look broken but are known to be fine in the upstream help files. */
    private static final Set<String> INVALID_TAG_FALSE_POSITIVES =
            Set.of(
                    "'previewpopup'",
                    "'pvp'",
                    "'string'",
                    "Query",
                    "eq?",
                    "lsp-request",
                    "matchit",
                    "matchit.txt",
                    "set!",
                    "v:_null_blob",
                    "v:_null_dict",
                    "v:_null_list",
                    "v:_null_string",
                    "vim.lsp.buf_request()",
                    "vim.lsp.util.get_progress_messages()",
                    "vim.treesitter.start()");

    private TextRules() {}

    /** Returns true if every character is a tab or a space (vacuously true for ""). */
    public static boolean isBlank(String s) {
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c != ' ' && c != '\t') {
                return false;
            }
        }
        return true;
    }

    /** Returns true for boilerplate lines that do not belong in rendered output. */
    public static boolean isNoise(String s) {
        return TOC_HINT.matcher(s).find()
                || TITLE_LINE.matcher(s).find()
                || HELP_FIRST_LINE.matcher(s).find()
                || MODELINE.matcher(s).find();
    }

    /**
     * Returns true for parse errors that :help treats as plain text, such as an unclosed tag or
     * code span.
     */
    public static boolean ignoreParseError(String s) {
        if (s.isEmpty()) {
            return false;
        }
        char first = s.charAt(0);
        return first == '`' || first == '\'' || first == '|' || first == '*';
    }

    /** Returns true if an unresolved tag name is a known false positive. */
    public static boolean ignoreInvalid(String s) {
        return INVALID_TAG_FALSE_POSITIVES.contains(s) || s.contains("===") || s.contains("---");
    }

    /**
     * Splits trailing punctuation off a URL: at most one '.', then at most one ')'.
     *
     * @return the URL proper and the punctuation that follows it
     */
    public static UrlParts fixUrl(String url) {
        int keep = url.length();
        if (url.endsWith(".")) {
            keep--;
        }
        if (keep > 0 && url.charAt(keep - 1) == ')') {
            keep--;
        }
        return new UrlParts(url.substring(0, keep), url.substring(keep));
    }

    public record UrlParts(String href, String trailing) {}

    /**
     * Expands tabs to {@code tabWidth} spaces and removes the indentation shared by every line.
     */
    public static String trimIndent(String s, int tabWidth) {
        String expanded = s.replace("\t", " ".repeat(tabWidth));
        String[] lines = expanded.split("\n", -1);
        int lineCount = lines.length;
        // A trailing newline does not start another line.
        if (lineCount > 1 && lines[lineCount - 1].isEmpty()) {
            lineCount--;
        }

        int common = Integer.MAX_VALUE;
        for (int i = 0; i < lineCount; i++) {
            common = Math.min(common, leadingSpaces(lines[i]));
        }
        if (common == Integer.MAX_VALUE) {
            common = 0;
        }

        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < lineCount; i++) {
            if (i > 0) {
                sb.append('\n');
            }
            sb.append(lines[i], Math.min(common, lines[i].length()), lines[i].length());
        }
        return sb.toString();
    }

    /** Returns the longest prefix of at most {@code maxBytes} UTF-8 bytes. */
    public static String truncate(String s, int maxBytes) {
        int bytes = 0;
        int i = 0;
        while (i < s.length()) {
            int cp = s.codePointAt(i);
            int width = utf8Width(cp);
            if (bytes + width > maxBytes) {
                break;
            }
            bytes += width;
            i += Character.charCount(cp);
        }
        return s.substring(0, i);
    }

    public static int utf8Length(String s) {
        return s.getBytes(StandardCharsets.UTF_8).length;
    }

    /** Escapes the three characters that matter inside HTML text content. */
    public static String escapeHtml(String s) {
        return s.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;");
    }

    /** Escapes unescaped text for a double-quoted attribute value, quotes included. */
    public static String escapeAttribute(String s) {
        return StringEscapeUtils.escapeHtml4(s);
    }

    /** Encodes a tag name for use in {@code name} and {@code href} attributes. */
    public static String anchorId(String tagName) {
        StringBuilder sb = new StringBuilder();
        for (byte b : tagName.getBytes(StandardCharsets.UTF_8)) {
            int c = b & 0xff;
            if ((c >= 'a' && c <= 'z')
                    || (c >= 'A' && c <= 'Z')
                    || (c >= '0' && c <= '9')
                    || "-._~!*'()".indexOf(c) >= 0) {
                sb.append((char) c);
            } else {
                sb.append('%').append(String.format("%02X", c));
            }
        }
        return sb.toString();
    }

    /** Double-quotes a string, escaping quotes, backslashes and control characters. */
    public static String debugQuote(String s) {
        StringBuilder sb = new StringBuilder("\"");
        for (int i = 0; i < s.length(); ) {
            int cp = s.codePointAt(i);
            i += Character.charCount(cp);
            switch (cp) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                case 0 -> sb.append("\\0");
                default -> {
                    if (Character.isISOControl(cp)) {
                        sb.append("\\u{").append(Integer.toHexString(cp)).append('}');
                    } else {
                        sb.appendCodePoint(cp);
                    }
                }
            }
        }
        return sb.append('"').toString();
    }

    private static int leadingSpaces(String line) {
        int n = 0;
        while (n < line.length() && line.charAt(n) == ' ') {
            n++;
        }
        return n;
    }

    private static int utf8Width(int cp) {
        if (cp < 0x80) {
            return 1;
        } else if (cp < 0x800) {
            return 2;
        } else if (cp < 0x10000) {
            return 3;
        }
        return 4;
    }
}
