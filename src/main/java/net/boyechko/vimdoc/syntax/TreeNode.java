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
package net.boyechko.vimdoc.syntax;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/**
 * In-memory {@link SyntaxNode}. Nodes are assembled top-down by {@link ParseTreeReader} or through
 * a {@link Builder}; once the tree is handed out it is not modified.
 */
public final class TreeNode implements SyntaxNode {
    public static final String ERROR_KIND = "ERROR";

    private final String kind;
    private final boolean named;
    private final boolean error;
    private final boolean missing;
    private final String fieldName;
    private final Point startPoint;
    private final Point endPoint;
    private final int startByte;
    private final int endByte;
    private final List<TreeNode> children = new ArrayList<>();
    private final List<TreeNode> childrenView = Collections.unmodifiableList(children);

    private TreeNode parent;
    private boolean containsError;

    TreeNode(
            String kind,
            boolean named,
            boolean error,
            boolean missing,
            String fieldName,
            Point startPoint,
            Point endPoint,
            int startByte,
            int endByte) {
        this.kind = kind;
        this.named = named;
        this.error = error;
        this.missing = missing;
        this.fieldName = fieldName;
        this.startPoint = startPoint;
        this.endPoint = endPoint;
        this.startByte = startByte;
        this.endByte = endByte;
        this.containsError = error || missing;
    }

    /** Attaches a child and propagates its error flag to every ancestor. */
    void append(TreeNode child) {
        child.parent = this;
        children.add(child);
        if (child.containsError) {
            for (TreeNode n = this; n != null && !n.containsError; n = n.parent) {
                n.containsError = true;
            }
        }
    }

    @Override
    public String kind() {
        return kind;
    }

    @Override
    public boolean isNamed() {
        return named;
    }

    @Override
    public boolean isError() {
        return error;
    }

    @Override
    public boolean isMissing() {
        return missing;
    }

    @Override
    public boolean hasError() {
        return containsError;
    }

    @Override
    public Point startPoint() {
        return startPoint;
    }

    @Override
    public Point endPoint() {
        return endPoint;
    }

    @Override
    public int startByte() {
        return startByte;
    }

    @Override
    public int endByte() {
        return endByte;
    }

    @Override
    public TreeNode parent() {
        return parent;
    }

    @Override
    public List<TreeNode> children() {
        return childrenView;
    }

    @Override
    public String fieldName() {
        return fieldName;
    }

    @Override
    public String toString() {
        return kind + " " + startPoint + " - " + endPoint;
    }

    public static Builder named(String kind) {
        return new Builder(kind, true);
    }

    public static Builder anonymous(String kind) {
        return new Builder(kind, false);
    }

    public static Builder error() {
        return new Builder(ERROR_KIND, true).markError();
    }

    public static Builder missing(String kind, boolean named) {
        return new Builder(kind, named).markMissing();
    }

    /** Describes a subtree by byte ranges; {@link #build(SourceText)} resolves positions. */
    public static final class Builder {
        private final String kind;
        private final boolean named;
        private final List<Builder> children = new ArrayList<>();
        private boolean error;
        private boolean missing;
        private String fieldName;
        private int startByte;
        private int endByte;

        private Builder(String kind, boolean named) {
            this.kind = kind;
            this.named = named;
        }

        private Builder markError() {
            this.error = true;
            return this;
        }

        private Builder markMissing() {
            this.missing = true;
            return this;
        }

        public Builder span(int startByte, int endByte) {
            this.startByte = startByte;
            this.endByte = endByte;
            return this;
        }

        public Builder field(String fieldName) {
            this.fieldName = fieldName;
            return this;
        }

        public Builder child(Builder child) {
            children.add(child);
            return this;
        }

        public Builder children(List<Builder> kids) {
            children.addAll(kids);
            return this;
        }

        public TreeNode build(SourceText source) {
            TreeNode root = create(this, source);
            Deque<TreeNode> nodes = new ArrayDeque<>();
            Deque<Builder> pending = new ArrayDeque<>();
            nodes.push(root);
            pending.push(this);
            while (!pending.isEmpty()) {
                Builder b = pending.pop();
                TreeNode node = nodes.pop();
                for (Builder kid : b.children) {
                    TreeNode child = create(kid, source);
                    node.append(child);
                    pending.push(kid);
                    nodes.push(child);
                }
            }
            return root;
        }

        private static TreeNode create(Builder b, SourceText source) {
            return new TreeNode(
                    b.kind,
                    b.named,
                    b.error,
                    b.missing,
                    b.fieldName,
                    source.pointAt(b.startByte),
                    source.pointAt(b.endByte),
                    b.startByte,
                    b.endByte);
        }
    }
}
