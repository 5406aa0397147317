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


import io.vertx.core.json.JsonObject;

/**
 * One-way outbound side of the orchestration channel.
 *
 * <p>Emission is fire-and-forget: replies, when there are any, arrive later as independent
 * inbound messages and are routed to the engine by item id.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 * @see dev.mars.cirrus.protocol.OrchestrationEvents
 */
public interface OrchestrationChannel {

    /**
     * Emit an event to the orchestration service.
     *
     * @param event event name, one of the outbound names in {@code OrchestrationEvents}
     * @param payload snake_case payload
     * @throws ChannelException if the channel cannot accept the event
     */
    void emit(String event, JsonObject payload) throws ChannelException;
}
