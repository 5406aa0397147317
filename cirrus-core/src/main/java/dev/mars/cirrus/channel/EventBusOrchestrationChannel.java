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


import io.vertx.core.eventbus.EventBus;
import io.vertx.core.json.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Publishes outbound events on the Vert.x event bus at {@code <prefix>.outbound.<event>}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class EventBusOrchestrationChannel implements OrchestrationChannel {

    private static final Logger logger = LoggerFactory.getLogger(EventBusOrchestrationChannel.class);

    private final EventBus eventBus;
    private final String prefix;

    public EventBusOrchestrationChannel(EventBus eventBus, String prefix) {
        this.eventBus = Objects.requireNonNull(eventBus, "EventBus cannot be null");
        this.prefix = Objects.requireNonNull(prefix, "Address prefix cannot be null");
    }

    @Override
    public void emit(String event, JsonObject payload) throws ChannelException {
        String address = outboundAddress(prefix, event);
        try {
            eventBus.publish(address, payload);
            logger.debug("Published {} to {}", event, address);
        } catch (RuntimeException e) {
            throw new ChannelException(event, e.getMessage(), e);
        }
    }

    public static String outboundAddress(String prefix, String event) {
        return prefix + ".outbound." + event;
    }

    public static String inboundAddress(String prefix, String event) {
        return prefix + ".inbound." + event;
    }
}
