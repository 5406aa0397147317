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

package dev.mars.cirrus.service.http;

import dev.mars.cirrus.monitoring.TransferEngineHealthCheck;
import dev.mars.cirrus.transfer.TransferEngine;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.http.HttpServer;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.RoutingContext;
import io.vertx.ext.web.handler.BodyHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Administrative HTTP API for the transfer engine, built on Vert.x Web.
 *
 * <p>Routes:</p>
 * <ul>
 *   <li>{@code GET /health}</li>
 *   <li>{@code GET /api/v1/queue}, {@code GET /api/v1/queue/details}</li>
 *   <li>{@code POST /api/v1/transfers/files}, {@code POST /api/v1/transfers/folders}</li>
 *   <li>{@code POST /api/v1/transfers/pause}, {@code POST /api/v1/transfers/resume}</li>
 *   <li>{@code DELETE /api/v1/transfers/:id}, {@code DELETE /api/v1/transfers}</li>
 *   <li>{@code POST /api/v1/maintenance/cleanup}, {@code POST /api/v1/maintenance/repair}</li>
 * </ul>
 */
public class HttpApiServer {

    private static final Logger logger = LoggerFactory.getLogger(HttpApiServer.class);

    private final Vertx vertx;
    private final int port;
    private final TransferEngine engine;
    private HttpServer httpServer;

    public HttpApiServer(Vertx vertx, int port, TransferEngine engine) {
        this.vertx = vertx;
        this.port = port;
        this.engine = engine;
    }

    public Future<Void> start() {
        Router router = Router.router(vertx);

        router.route().handler(BodyHandler.create());
        router.route().failureHandler(new GlobalErrorHandler());

        router.get("/health").handler(this::health);

        router.get("/api/v1/queue").respond(ctx -> Future.succeededFuture(engine.getQueueStatus().toJson()));
        router.get("/api/v1/queue/details")
                .respond(ctx -> Future.succeededFuture(engine.getDetailedQueueStatus().toJson()));

        router.post("/api/v1/transfers/files").respond(ctx -> {
            JsonObject body = requireBody(ctx);
            List<String> ids = engine.selectFiles(paths(body), body.getString("share_id"), body.getString("parent_id"));
            return Future.succeededFuture(new JsonObject().put("transfer_ids", new JsonArray(ids)));
        });
        router.post("/api/v1/transfers/folders").respond(ctx -> {
            JsonObject body = requireBody(ctx);
            List<String> ids = engine.selectFolders(paths(body), body.getString("share_id"), body.getString("parent_id"));
            return Future.succeededFuture(new JsonObject().put("transfer_ids", new JsonArray(ids)));
        });

        router.post("/api/v1/transfers/pause").respond(ctx -> {
            engine.pauseTransfers();
            return Future.succeededFuture(new JsonObject().put("status", "paused"));
        });
        router.post("/api/v1/transfers/resume").respond(ctx -> {
            JsonObject body = ctx.body().asJsonObject();
            engine.resumeTransfers(body == null ? null : body.getString("share_id"));
            return Future.succeededFuture(new JsonObject().put("status", "resumed"));
        });

        router.delete("/api/v1/transfers/:id").respond(ctx -> {
            String id = ctx.pathParam("id");
            if (!engine.cancelTransfer(id)) {
                throw CirrusApiException.notFound(ErrorCode.TRANSFER_NOT_FOUND, id);
            }
            return Future.succeededFuture(new JsonObject().put("transfer_id", id).put("cancelled", true));
        });
        router.delete("/api/v1/transfers").respond(ctx ->
                Future.succeededFuture(new JsonObject().put("cancelled_count", engine.cancelAllTransfers())));

        // Maintenance actions touch the engine lock and may emit events; keep them off the event loop
        router.post("/api/v1/maintenance/cleanup").respond(ctx ->
                vertx.executeBlocking(() -> engine.cleanupStuckTransfers().toJson(), false));
        router.post("/api/v1/maintenance/repair").respond(ctx ->
                vertx.executeBlocking(() -> new JsonObject().put("repaired_count", engine.repairPendingFolders()), false));

        httpServer = vertx.createHttpServer()
                .requestHandler(router);

        return httpServer.listen(port)
                .onSuccess(server -> logger.info("HTTP API Server listening on port {}", server.actualPort()))
                .onFailure(err -> logger.error("Failed to start HTTP API Server", err))
                .mapEmpty();
    }

    public Future<Void> stop() {
        if (httpServer != null) {
            return httpServer.close()
                    .onSuccess(v -> logger.info("HTTP API Server stopped"));
        }
        return Future.succeededFuture();
    }

    /**
     * Port the server is bound to, useful when started on port 0.
     */
    public int actualPort() {
        return httpServer == null ? -1 : httpServer.actualPort();
    }

    private void health(RoutingContext ctx) {
        TransferEngineHealthCheck health = engine.checkHealth();
        int status = health.getStatus() == TransferEngineHealthCheck.Status.DOWN ? 503 : 200;
        ctx.response()
                .setStatusCode(status)
                .putHeader("Content-Type", "application/json")
                .end(health.toJson().encode());
    }

    private static JsonObject requireBody(RoutingContext ctx) {
        JsonObject body = ctx.body().asJsonObject();
        if (body == null) {
            throw CirrusApiException.badRequest(ErrorCode.BAD_REQUEST, "request body is required");
        }
        return body;
    }

    private static List<String> paths(JsonObject body) {
        JsonArray paths = body.getJsonArray("paths");
        if (paths == null) {
            throw CirrusApiException.badRequest(ErrorCode.MISSING_REQUIRED_FIELD, "paths");
        }
        List<String> result = new ArrayList<>(paths.size());
        for (int i = 0; i < paths.size(); i++) {
            result.add(paths.getString(i));
        }
        return result;
    }
}
