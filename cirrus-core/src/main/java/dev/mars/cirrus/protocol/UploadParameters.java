package dev.mars.cirrus.protocol;

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


import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Upload parameters negotiated for one file: server ids, block layout, one presigned
 * destination per block, the base64 content key and an optional thumbnail destination.
 *
 * <p>Delivered on the {@code upload-urls} inbound address:</p>
 * <pre>{@code
 * {
 *   "transfer_id": "transfer-1718000000000-3fa2",
 *   "file_id": "f-1", "revision_id": "r-1",
 *   "total_blocks": 3, "block_size": 4194304,
 *   "upload_urls": [{"url": "...", "block_id": "b0", "index": 0, "expires_in": 3600}],
 *   "content_key": "base64...",
 *   "thumbnail": {"id": "t-1", "url": "...", "expires_in": 3600, "content_key": "base64..."}
 * }
 * }</pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 * @see PresignedBlockUrl
 * @see ThumbnailTarget
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class UploadParameters {

    private final String transferId;
    private final String fileId;
    private final String revisionId;
    private final int totalBlocks;
    private final long blockSize;
    private final List<PresignedBlockUrl> uploadUrls;
    private final String contentKey;
    private final ThumbnailTarget thumbnail;

    @JsonCreator
    public UploadParameters(
            @JsonProperty("transfer_id") String transferId,
            @JsonProperty("file_id") String fileId,
            @JsonProperty("revision_id") String revisionId,
            @JsonProperty("total_blocks") int totalBlocks,
            @JsonProperty("block_size") long blockSize,
            @JsonProperty("upload_urls") List<PresignedBlockUrl> uploadUrls,
            @JsonProperty("content_key") String contentKey,
            @JsonProperty("thumbnail") ThumbnailTarget thumbnail) {
        this.transferId = transferId;
        this.fileId = fileId;
        this.revisionId = revisionId;
        this.totalBlocks = totalBlocks;
        this.blockSize = blockSize;
        this.uploadUrls = uploadUrls != null
                ? uploadUrls.stream().sorted(Comparator.comparingInt(PresignedBlockUrl::getIndex)).toList()
                : List.of();
        this.contentKey = contentKey;
        this.thumbnail = thumbnail;
    }

    @JsonProperty("transfer_id")
    public String getTransferId() {
        return transferId;
    }

    @JsonProperty("file_id")
    public String getFileId() {
        return fileId;
    }

    @JsonProperty("revision_id")
    public String getRevisionId() {
        return revisionId;
    }

    @JsonProperty("total_blocks")
    public int getTotalBlocks() {
        return totalBlocks;
    }

    @JsonProperty("block_size")
    public long getBlockSize() {
        return blockSize;
    }

    /**
     * Block destinations ordered by index.
     */
    @JsonProperty("upload_urls")
    public List<PresignedBlockUrl> getUploadUrls() {
        return uploadUrls;
    }

    @JsonProperty("content_key")
    public String getContentKey() {
        return contentKey;
    }

    @JsonProperty("thumbnail")
    public ThumbnailTarget getThumbnail() {
        return thumbnail;
    }

    public Optional<ThumbnailTarget> thumbnailTarget() {
        return Optional.ofNullable(thumbnail);
    }

    @Override
    public String toString() {
        return "UploadParameters{" +
                "transferId='" + transferId + '\'' +
                ", fileId='" + fileId + '\'' +
                ", totalBlocks=" + totalBlocks +
                ", blockSize=" + blockSize +
                ", thumbnail=" + (thumbnail != null) +
                '}';
    }
}
