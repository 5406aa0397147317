package dev.mars.cirrus.core;

/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */


import java.nio.file.Path;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Immutable unit of work held in the transfer queue.
 *
 * <p>A queue item is created either by a user selection (depth 0) or by expanding a
 * folder (depth of the folder plus one). It is consumed exactly once when the scheduler
 * takes it from the queue and is never modified afterwards.</p>
 *
 * <h3>Parent reference:</h3>
 * <p>The parent reference is either a folder id assigned by the orchestration service or a
 * client-local placeholder (typically the local path of a folder that has not been created
 * yet). It is resolved against the folder id map when the item is processed.</p>
 *
 * <h3>Usage Example:</h3>
 * <pre>{@code
 * QueueItem item = QueueItem.builder()
 *     .kind(ItemKind.FILE)
 *     .path(Paths.get("/home/user/report.pdf"))
 *     .parentRef("root-folder-id")
 *     .build();
 * }</pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 * @see ItemKind
 */
public final class QueueItem {

    private final String id;
    private final ItemKind kind;
    private final Path path;
    private final String name;
    private final String parentRef;
    private final int depth;

    private QueueItem(Builder builder) {
        this.kind = Objects.requireNonNull(builder.kind, "Item kind cannot be null");
        this.path = Objects.requireNonNull(builder.path, "Item path cannot be null").toAbsolutePath();
        this.id = builder.id != null ? builder.id : generateId();
        this.name = builder.name != null ? builder.name : displayNameOf(this.path);
        this.parentRef = builder.parentRef;
        this.depth = builder.depth;
    }

    public String getId() {
        return id;
    }

    public ItemKind getKind() {
        return kind;
    }

    public boolean isFolder() {
        return kind == ItemKind.FOLDER;
    }

    public boolean isFile() {
        return kind == ItemKind.FILE;
    }

    public Path getPath() {
        return path;
    }

    public String getName() {
        return name;
    }

    /**
     * Server folder id or local placeholder of the containing folder, may be null for root items.
     */
    public String getParentRef() {
        return parentRef;
    }

    /**
     * Nesting depth below the original selection. Informational only.
     */
    public int getDepth() {
        return depth;
    }

    /**
     * Local path of the directory containing this item, used for readiness gating.
     */
    public Path getParentPath() {
        return path.getParent();
    }

    /**
     * Generates an id of the form {@code transfer-<epochMillis>-<hex>}.
     */
    public static String generateId() {
        return "transfer-" + System.currentTimeMillis() + "-"
                + Long.toHexString(ThreadLocalRandom.current().nextLong());
    }

    private static String displayNameOf(Path path) {
        Path fileName = path.getFileName();
        return fileName != null ? fileName.toString() : "unknown";
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        QueueItem that = (QueueItem) o;
        return id.equals(that.id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "QueueItem{" +
                "id='" + id + '\'' +
                ", kind=" + kind +
                ", name='" + name + '\'' +
                ", depth=" + depth +
                '}';
    }

    public static class Builder {
        private String id;
        private ItemKind kind;
        private Path path;
        private String name;
        private String parentRef;
        private int depth;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder kind(ItemKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder file(Path path) {
            this.kind = ItemKind.FILE;
            this.path = path;
            return this;
        }

        public Builder folder(Path path) {
            this.kind = ItemKind.FOLDER;
            this.path = path;
            return this;
        }

        public Builder path(Path path) {
            this.path = path;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder parentRef(String parentRef) {
            this.parentRef = parentRef;
            return this;
        }

        public Builder depth(int depth) {
            if (depth < 0) {
                throw new IllegalArgumentException("Depth cannot be negative: " + depth);
            }
            this.depth = depth;
            return this;
        }

        public QueueItem build() {
            return new QueueItem(this);
        }
    }
}
