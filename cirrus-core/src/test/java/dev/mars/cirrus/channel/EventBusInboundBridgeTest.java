package dev.mars.cirrus.channel;

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

import dev.mars.cirrus.monitoring.CleanupReport;
import dev.mars.cirrus.monitoring.DetailedQueueStatus;
import dev.mars.cirrus.monitoring.QueueStatus;
import dev.mars.cirrus.monitoring.TransferEngineHealthCheck;
import dev.mars.cirrus.protocol.ErrorReply;
import dev.mars.cirrus.protocol.FinalizeResult;
import dev.mars.cirrus.protocol.FolderCreated;
import dev.mars.cirrus.protocol.OrchestrationEvents;
import dev.mars.cirrus.protocol.UploadParameters;
import dev.mars.cirrus.transfer.TransferEngine;
import io.vertx.core.Vertx;
import io.vertx.core.eventbus.Message;
import io.vertx.core.eventbus.ReplyException;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.junit5.VertxExtension;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@ExtendWith(VertxExtension.class)
class EventBusInboundBridgeTest {

    private static final String PREFIX = "cirrus-test";

    private final CapturingEngine engine = new CapturingEngine();
    private EventBusInboundBridge bridge;
    private Vertx vertx;

    @BeforeEach
    void setUp(Vertx vertx) {
        this.vertx = vertx;
        bridge = new EventBusInboundBridge(vertx.eventBus(), PREFIX, engine);
        bridge.start();
    }

    @AfterEach
    void tearDown() throws Exception {
        bridge.stop().toCompletionStage().toCompletableFuture().get(5, TimeUnit.SECONDS);
    }

    private JsonObject request(String event, Object body) throws Exception {
        Message<Object> reply = vertx.eventBus()
                .request(EventBusOrchestrationChannel.inboundAddress(PREFIX, event), body)
                .toCompletionStage().toCompletableFuture().get(5, TimeUnit.SECONDS);
        return (JsonObject) reply.body();
    }

    @Test
    void testUploadUrlsAccepted() throws Exception {
        JsonObject body = new JsonObject()
                .put("transfer_id", "t-1")
                .put("file_id", "file-9")
                .put("revision_id", "rev-2")
                .put("total_blocks", 2)
                .put("block_size", 4194304)
                .put("content_key", "a2V5")
                .put("upload_urls", new JsonArray()
                        .add(new JsonObject().put("url", "https://s/1").put("block_id", "b1").put("index", 1).put("expires_in", 60))
                        .add(new JsonObject().put("url", "https://s/0").put("block_id", "b0").put("index", 0).put("expires_in", 60)))
                .put("unexpected", "ignored");

        JsonObject reply = request(OrchestrationEvents.UPLOAD_URLS, body);

        assertEquals("accepted", reply.getString("status"));
        UploadParameters parameters = (UploadParameters) engine.replies.get(0);
        assertEquals("t-1", parameters.getTransferId());
        assertEquals("file-9", parameters.getFileId());
        assertEquals(4194304L, parameters.getBlockSize());
        assertEquals(0, parameters.getUploadUrls().get(0).getIndex());
        assertEquals("https://s/0", parameters.getUploadUrls().get(0).getUrl());
    }

    @Test
    void testUploadUrlsUnwrapsResponseField() throws Exception {
        JsonObject inner = new JsonObject().put("transfer_id", "t-2").put("file_id", "f").put("total_blocks", 0);

        request(OrchestrationEvents.UPLOAD_URLS, new JsonObject().put("response", inner));

        assertEquals("t-2", ((UploadParameters) engine.replies.get(0)).getTransferId());
    }

    @Test
    void testStringBodyIsDecoded() throws Exception {
        request(OrchestrationEvents.FOLDER_CREATED, "{\"transfer_id\":\"t-3\",\"folder_id\":\"srv-7\"}");

        assertEquals(new FolderCreated("t-3", "srv-7"), engine.replies.get(0));
    }

    @Test
    void testErrorAndFinalizeReplies() throws Exception {
        request(OrchestrationEvents.UPLOAD_ERROR, new JsonObject().put("transfer_id", "t-4").put("error", "Quota exceeded"));
        request(OrchestrationEvents.FOLDER_ERROR, new JsonObject().put("transfer_id", "t-5").put("error", "Exists"));
        request(OrchestrationEvents.FINALIZE_COMPLETE, new JsonObject()
                .put("transfer_id", "t-6").put("file_id", "f").put("success", false).put("error", "hash mismatch"));

        assertEquals(List.of(
                new ErrorReply("t-4", "Quota exceeded"),
                new ErrorReply("t-5", "Exists"),
                new FinalizeResult("t-6", "f", null, false, "hash mismatch")), engine.replies);
    }

    @Test
    void testMissingTransferIdIsRejected() {
        ExecutionException thrown = assertThrows(ExecutionException.class,
                () -> request(OrchestrationEvents.FOLDER_CREATED, new JsonObject().put("folder_id", "srv-1")));

        ReplyException failure = assertInstanceOf(ReplyException.class, thrown.getCause());
        assertEquals(EventBusInboundBridge.BAD_PAYLOAD, failure.failureCode());
        assertTrue(failure.getMessage().contains("missing transfer_id"));
        assertTrue(engine.replies.isEmpty());
    }

    @Test
    void testMalformedJsonIsRejected() {
        ExecutionException thrown = assertThrows(ExecutionException.class,
                () -> request(OrchestrationEvents.UPLOAD_ERROR, "{not json"));

        assertEquals(EventBusInboundBridge.BAD_PAYLOAD, ((ReplyException) thrown.getCause()).failureCode());
        assertTrue(engine.replies.isEmpty());
    }

    @Test
    void testStopUnregistersConsumers() throws Exception {
        bridge.stop().toCompletionStage().toCompletableFuture().get(5, TimeUnit.SECONDS);

        vertx.eventBus().send(EventBusOrchestrationChannel.inboundAddress(PREFIX, OrchestrationEvents.FOLDER_ERROR),
                new JsonObject().put("transfer_id", "t-9").put("error", "late"));

        Thread.sleep(100);
        assertTrue(engine.replies.isEmpty());
    }

    /**
     * Records inbound replies; commands are not used by the bridge.
     */
    private static final class CapturingEngine implements TransferEngine {

        final List<Object> replies = new CopyOnWriteArrayList<>();

        @Override
        public void onUploadParameters(UploadParameters parameters) {
            replies.add(parameters);
        }

        @Override
        public void onUploadError(ErrorReply error) {
            replies.add(error);
        }

        @Override
        public void onFolderCreated(FolderCreated created) {
            replies.add(created);
        }

        @Override
        public void onFolderError(ErrorReply error) {
            replies.add(error);
        }

        @Override
        public void onFinalizeComplete(FinalizeResult result) {
            replies.add(result);
        }

        @Override
        public List<String> selectFiles(List<String> paths, String shareId, String parentId) {
            throw new UnsupportedOperationException();
        }

        @Override
        public List<String> selectFolders(List<String> paths, String shareId, String parentId) {
            throw new UnsupportedOperationException();
        }

        @Override
        public boolean cancelTransfer(String id) {
            throw new UnsupportedOperationException();
        }

        @Override
        public int cancelAllTransfers() {
            throw new UnsupportedOperationException();
        }

        @Override
        public void pauseTransfers() {
            throw new UnsupportedOperationException();
        }

        @Override
        public void resumeTransfers(String shareId) {
            throw new UnsupportedOperationException();
        }

        @Override
        public QueueStatus getQueueStatus() {
            throw new UnsupportedOperationException();
        }

        @Override
        public DetailedQueueStatus getDetailedQueueStatus() {
            throw new UnsupportedOperationException();
        }

        @Override
        public TransferEngineHealthCheck checkHealth() {
            throw new UnsupportedOperationException();
        }

        @Override
        public CleanupReport cleanupStuckTransfers() {
            throw new UnsupportedOperationException();
        }

        @Override
        public int repairPendingFolders() {
            throw new UnsupportedOperationException();
        }

        @Override
        public boolean shutdown(long timeoutSeconds) {
            return true;
        }
    }
}
