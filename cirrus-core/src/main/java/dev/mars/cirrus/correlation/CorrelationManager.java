package dev.mars.cirrus.correlation;

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


import dev.mars.cirrus.channel.ChannelException;
import dev.mars.cirrus.core.exceptions.NegotiationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Turns the one-way orchestration channel into awaitable request/reply calls.
 *
 * <p>Each call registers a single-use reply slot keyed by item id <em>before</em> the
 * request is emitted, so a reply arriving immediately can never be lost. The slot is
 * then resolved exactly once by one of:</p>
 * <ul>
 *   <li>a success reply ({@link #resolve})</li>
 *   <li>an error reply ({@link #reject})</li>
 *   <li>the staleness sweep ({@link #expire})</li>
 *   <li>cancellation of the item ({@link #cancel})</li>
 *   <li>the caller's own timeout</li>
 * </ul>
 *
 * <p>The slot stays registered until the waiting caller has consumed it. Resolution
 * attempts in that window are no-ops reported as {@link Delivery#RECEIVER_GONE}; replies
 * for ids with no slot are reported as {@link Delivery#ORPHANED} so the caller can clear
 * residual tracking state.</p>
 *
 * @param <T> reply payload type
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class CorrelationManager<T> {

    private static final Logger logger = LoggerFactory.getLogger(CorrelationManager.class);

    /**
     * Outcome of handing a reply to the manager.
     */
    public enum Delivery {
        /** A waiting caller received the reply */
        DELIVERED,
        /** A slot existed but had already been resolved */
        RECEIVER_GONE,
        /** No slot was registered for the id */
        ORPHANED
    }

    /**
     * Emits the outbound request once the reply slot is registered.
     */
    @FunctionalInterface
    public interface Emission {
        void emit() throws ChannelException;
    }

    private final String name;
    private final Map<String, CompletableFuture<T>> slots = new ConcurrentHashMap<>();

    /**
     * @param name label used in log output and timeout messages, e.g. "upload parameters"
     */
    public CorrelationManager(String name) {
        this.name = name;
    }

    /**
     * Register a reply slot for {@code id}, run {@code emission}, then wait for the reply.
     *
     * @return the reply payload
     * @throws NegotiationException if the reply is an error, the channel rejects the request,
     *                              the wait times out or the slot is cancelled
     */
    public T await(String id, Emission emission, Duration timeout) throws NegotiationException {
        CompletableFuture<T> slot = new CompletableFuture<>();
        CompletableFuture<T> previous = slots.put(id, slot);
        if (previous != null) {
            previous.completeExceptionally(new SlotRejection(NegotiationException.Reason.CANCELLED,
                    "Superseded by a newer " + name + " request"));
        }

        try {
            try {
                emission.emit();
            } catch (ChannelException e) {
                throw new NegotiationException(id, NegotiationException.Reason.CHANNEL_CLOSED, e.getMessage(), e);
            }

            try {
                return slot.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                String message = "Timed out waiting for " + name + " after " + timeout.toMillis() + "ms";
                if (slot.completeExceptionally(new SlotRejection(NegotiationException.Reason.TIMEOUT, message))) {
                    logger.warn("{} for {}", message, id);
                }
                return slot.getNow(null);
            }
        } catch (ExecutionException | CompletionException e) {
            throw toNegotiationException(id, e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new NegotiationException(id, NegotiationException.Reason.CANCELLED,
                    "Interrupted while waiting for " + name);
        } finally {
            slots.remove(id, slot);
        }
    }

    public Delivery resolve(String id, T reply) {
        CompletableFuture<T> slot = slots.get(id);
        if (slot == null) {
            logger.debug("No pending {} request for {}, reply dropped", name, id);
            return Delivery.ORPHANED;
        }
        return report(id, slot.complete(reply));
    }

    public Delivery reject(String id, String error) {
        return fail(id, NegotiationException.Reason.REJECTED, error);
    }

    /**
     * Resolve a slot with a timeout error. Used by the staleness sweep.
     */
    public Delivery expire(String id, String message) {
        return fail(id, NegotiationException.Reason.TIMEOUT, message);
    }

    public Delivery cancel(String id) {
        return fail(id, NegotiationException.Reason.CANCELLED, "Cancelled by user");
    }

    public boolean isPending(String id) {
        return slots.containsKey(id);
    }

    public int pendingCount() {
        return slots.size();
    }

    public String getName() {
        return name;
    }

    private Delivery fail(String id, NegotiationException.Reason reason, String message) {
        CompletableFuture<T> slot = slots.get(id);
        if (slot == null) {
            logger.debug("No pending {} request for {}, {} dropped", name, id, reason);
            return Delivery.ORPHANED;
        }
        return report(id, slot.completeExceptionally(new SlotRejection(reason, message)));
    }

    private Delivery report(String id, boolean delivered) {
        if (delivered) {
            return Delivery.DELIVERED;
        }
        logger.info("Reply for {} ({}) not delivered: receiver gone", id, name);
        return Delivery.RECEIVER_GONE;
    }

    private NegotiationException toNegotiationException(String id, Throwable cause) {
        if (cause instanceof SlotRejection rejection) {
            return new NegotiationException(id, rejection.reason, rejection.getMessage());
        }
        String message = cause != null ? cause.getMessage() : "unknown error";
        return new NegotiationException(id, NegotiationException.Reason.REJECTED, message, cause);
    }

    /**
     * Failure carried through a slot. No stack trace, it never escapes this class.
     */
    private static final class SlotRejection extends RuntimeException {
        private final NegotiationException.Reason reason;

        SlotRejection(NegotiationException.Reason reason, String message) {
            super(message, null, false, false);
            this.reason = reason;
        }
    }
}
