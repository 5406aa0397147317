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


import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.mars.cirrus.protocol.ErrorReply;
import dev.mars.cirrus.protocol.FinalizeResult;
import dev.mars.cirrus.protocol.FolderCreated;
import dev.mars.cirrus.protocol.OrchestrationEvents;
import dev.mars.cirrus.protocol.UploadParameters;
import dev.mars.cirrus.transfer.TransferEngine;
import io.vertx.core.Future;
import io.vertx.core.eventbus.EventBus;
import io.vertx.core.eventbus.Message;
import io.vertx.core.eventbus.MessageConsumer;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Routes inbound orchestration replies from the event bus to the engine.
 *
 * <p>Consumes {@code <prefix>.inbound.<event>} for every inbound event. Bodies may be a
 * {@link JsonObject} or a JSON string; {@code upload-urls} also accepts its payload wrapped
 * in a {@code response} field. Messages sent with a reply address are acknowledged with
 * {@code {"status":"accepted"}}, or failed with code 400 when the payload cannot be decoded.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class EventBusInboundBridge {

    private static final Logger logger = LoggerFactory.getLogger(EventBusInboundBridge.class);

    public static final int BAD_PAYLOAD = 400;

    private final EventBus eventBus;
    private final String prefix;
    private final TransferEngine engine;
    private final ObjectMapper objectMapper;
    private final List<MessageConsumer<Object>> consumers = new ArrayList<>();

    public EventBusInboundBridge(EventBus eventBus, String prefix, TransferEngine engine) {
        this.eventBus = eventBus;
        this.prefix = prefix;
        this.engine = engine;
        this.objectMapper = new ObjectMapper();
        this.objectMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public void start() {
        register(OrchestrationEvents.UPLOAD_URLS, UploadParameters.class, engine::onUploadParameters);
        register(OrchestrationEvents.UPLOAD_ERROR, ErrorReply.class, engine::onUploadError);
        register(OrchestrationEvents.FOLDER_CREATED, FolderCreated.class, engine::onFolderCreated);
        register(OrchestrationEvents.FOLDER_ERROR, ErrorReply.class, engine::onFolderError);
        register(OrchestrationEvents.FINALIZE_COMPLETE, FinalizeResult.class, engine::onFinalizeComplete);
        logger.info("Inbound bridge listening on {}.inbound.*", prefix);
    }

    /**
     * Unregisters all consumers.
     */
    public Future<Void> stop() {
        List<Future<Void>> pending = new ArrayList<>();
        for (MessageConsumer<Object> consumer : consumers) {
            pending.add(consumer.unregister());
        }
        consumers.clear();
        return Future.all(pending).mapEmpty();
    }

    private <T> void register(String event, Class<T> type, Consumer<T> sink) {
        String address = EventBusOrchestrationChannel.inboundAddress(prefix, event);
        MessageConsumer<Object> consumer = eventBus.consumer(address, message -> handle(event, type, sink, message));
        consumers.add(consumer);
    }

    private <T> void handle(String event, Class<T> type, Consumer<T> sink, Message<Object> message) {
        T payload;
        try {
            payload = decode(event, type, message.body());
        } catch (DecodeException | JsonProcessingException | IllegalArgumentException | ClassCastException e) {
            logger.warn("Rejected {} payload: {}", event, e.getMessage());
            if (message.replyAddress() != null) {
                message.fail(BAD_PAYLOAD, "Invalid " + event + " payload: " + e.getMessage());
            }
            return;
        }

        sink.accept(payload);
        if (message.replyAddress() != null) {
            message.reply(new JsonObject().put("status", "accepted"));
        }
    }

    <T> T decode(String event, Class<T> type, Object body) throws JsonProcessingException {
        JsonObject json;
        if (body instanceof JsonObject) {
            json = (JsonObject) body;
        } else if (body instanceof String) {
            json = new JsonObject((String) body);
        } else {
            throw new IllegalArgumentException("Unsupported body type "
                    + (body == null ? "null" : body.getClass().getSimpleName()));
        }

        if (OrchestrationEvents.UPLOAD_URLS.equals(event) && json.getValue("response") instanceof JsonObject) {
            json = json.getJsonObject("response");
        }
        if (json.getString("transfer_id") == null) {
            throw new IllegalArgumentException("missing transfer_id");
        }
        return objectMapper.readValue(json.encode(), type);
    }
}
