package com.bizsim.drg;

import com.bizsim.drg.engine.RunOptions;
import com.bizsim.drg.engine.SimulationEngine;
import com.bizsim.drg.engine.SimulationResult;
import com.bizsim.drg.io.LoadedModel;
import com.bizsim.drg.util.LoggingEvaluationListener;
import com.bizsim.drg.util.ModelExplain;
import com.bizsim.drg.util.RunStatisticsListener;
import com.bizsim.drg.web.SimulationServer;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Runs the sustainability cost model from {@code models/stk_cost_model.json}.
 * <p>
 * Prints the evaluation plan, evaluates every stored scenario twice (the
 * second pass is served from the cache) and, with {@code --serve [port]},
 * keeps an HTTP API running.
 */
public class CostModelDemo {
    private static final Logger log = LogManager.getLogger(CostModelDemo.class);
    private static final String MODEL = "models/stk_cost_model.json";

    public static void main(String[] args) throws Exception {
        LoadedModel model = BizSim.load(MODEL);
        RunStatisticsListener stats = new RunStatisticsListener();

        try (SimulationEngine engine = model.newEngine()) {
            engine.addListener(new LoggingEvaluationListener());
            engine.addListener(stats);
            log.info("\n{}", new ModelExplain(engine.plan()).dumpPlan());

            RunOptions options = engine.defaultOptions();
            for (int pass = 1; pass <= 2; pass++) {
                for (String scenario : engine.scenarios().scenarioNames()) {
                    SimulationResult result = engine.run(scenario, options);
                    if (pass == 1)
                        log.info("\n{}", ModelExplain.explainResult(result));
                }
            }
            log.info("Cache: {}", engine.cache().stats());
            log.info("\n{}", stats.dump());

            if (args.length > 0 && "--serve".equals(args[0])) {
                int port = args.length > 1 ? Integer.parseInt(args[1]) : 7070;
                SimulationServer server = new SimulationServer(engine);
                server.start(port);
                Thread.currentThread().join();
            }
        }
    }
}
