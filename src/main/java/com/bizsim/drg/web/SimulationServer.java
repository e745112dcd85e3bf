package com.bizsim.drg.web;

import com.bizsim.drg.engine.FormulaEvaluationException;
import com.bizsim.drg.engine.GroupDiagnostics;
import com.bizsim.drg.engine.RunOptions;
import com.bizsim.drg.engine.SimulationEngine;
import com.bizsim.drg.engine.SimulationResult;
import com.bizsim.drg.io.JsonModelLoader;
import com.bizsim.drg.model.ModelDefinitionException;
import com.bizsim.drg.util.ModelExplain;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.javalin.Javalin;
import io.javalin.http.Context;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * HTTP front end for one {@link SimulationEngine}.
 *
 * Endpoints:
 * - GET /api/scenarios: model name, version and stored scenario names.
 * - GET /api/run/{scenario}?maxIterations=&amp;threshold=: runs a stored
 * scenario and returns values, state and cyclic-group diagnostics.
 * - GET /api/plan: text dump of the evaluation plan.
 * - GET /api/cache: cache counters.
 *
 * Status codes: 404 unknown scenario, 400 invalid options, 422 formula failure.
 * Errors are logged and answered with a JSON body; the server keeps running.
 */
public class SimulationServer {
    private static final Logger log = LogManager.getLogger(SimulationServer.class);

    private final SimulationEngine engine;
    private final ObjectMapper mapper = JsonModelLoader.mapper();
    private Javalin app;

    public SimulationServer(SimulationEngine engine) {
        this.engine = engine;
    }

    /**
     * Starts the server.
     *
     * @param port Port to listen on; 0 picks a free one.
     * @return The port actually bound.
     */
    public int start(int port) {
        app = Javalin.create();

        app.get("/api/scenarios", ctx -> {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("model", engine.registry().modelName());
            body.put("version", engine.registry().version());
            body.put("scenarios", engine.scenarios().scenarioNames());
            json(ctx, 200, body);
        });

        app.get("/api/run/{scenario}", ctx -> {
            RunOptions options = parseOptions(ctx);
            SimulationResult result = engine.run(ctx.pathParam("scenario"), options);
            json(ctx, 200, toBody(result));
        });

        app.get("/api/plan", ctx -> ctx.contentType("text/plain").result(new ModelExplain(engine.plan()).dumpPlan()));

        app.get("/api/cache", ctx -> json(ctx, 200, engine.cache().stats()));

        app.exception(ModelDefinitionException.class, (e, ctx) -> {
            int status = e.kind() == ModelDefinitionException.ErrorKind.UNKNOWN_SCENARIO ? 404 : 400;
            log.warn("{} {} -> {}: {}", ctx.method(), ctx.path(), status, e.getMessage());
            error(ctx, status, e.getMessage());
        });
        app.exception(FormulaEvaluationException.class, (e, ctx) -> {
            log.error("{} {} -> 422: {}", ctx.method(), ctx.path(), e.getMessage());
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("error", e.getMessage());
            body.put("attribute", e.identity());
            body.put("iteration", e.iteration());
            json(ctx, 422, body);
        });
        app.exception(IllegalArgumentException.class, (e, ctx) -> {
            log.warn("{} {} -> 400: {}", ctx.method(), ctx.path(), e.getMessage());
            error(ctx, 400, e.getMessage());
        });

        app.start(port);
        log.info("Simulation server for {}@{} listening on port {}", engine.registry().modelName(),
                engine.registry().version(), app.port());
        return app.port();
    }

    private RunOptions parseOptions(Context ctx) {
        RunOptions options = engine.defaultOptions();
        String maxIterations = ctx.queryParam("maxIterations");
        if (maxIterations != null)
            options = options.withMaxIterations(Integer.parseInt(maxIterations.trim()));
        String threshold = ctx.queryParam("threshold");
        if (threshold != null)
            options = options.withThreshold(Double.parseDouble(threshold.trim()));
        return options;
    }

    static Map<String, Object> toBody(SimulationResult result) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("modelVersion", result.modelVersion());
        body.put("scenario", result.scenarioName());
        body.put("state", result.state().name());
        body.put("converged", result.allConverged());
        body.put("values", result.values());
        List<Map<String, Object>> groups = new ArrayList<>();
        for (GroupDiagnostics d : result.diagnostics()) {
            Map<String, Object> g = new LinkedHashMap<>();
            g.put("group", d.groupId());
            g.put("members", d.members());
            g.put("converged", d.converged());
            g.put("iterations", d.iterations());
            g.put("maxDelta", d.maxDelta());
            g.put("termination", d.termination().name());
            groups.add(g);
        }
        body.put("diagnostics", groups);
        return body;
    }

    private void error(Context ctx, int status, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", message);
        json(ctx, status, body);
    }

    private void json(Context ctx, int status, Object body) {
        try {
            ctx.status(status).contentType("application/json").result(mapper.writeValueAsString(body));
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize response for {}", ctx.path(), e);
            ctx.status(500).result("{\"error\":\"serialization failed\"}");
        }
    }

    public int port() {
        return app == null ? -1 : app.port();
    }

    public void stop() {
        if (app != null) {
            app.stop();
            app = null;
        }
    }
}
