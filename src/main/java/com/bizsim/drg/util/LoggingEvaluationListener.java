package com.bizsim.drg.util;

import com.bizsim.drg.api.EvaluationListener;
import com.bizsim.drg.engine.GroupDiagnostics;
import com.bizsim.drg.engine.RunState;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Writes run progress to Log4j.
 *
 * Run boundaries and group outcomes go to INFO (non-converged groups to WARN),
 * per-iteration deltas to DEBUG and per-attribute values to TRACE. Formula
 * errors are rate-limited.
 */
public class LoggingEvaluationListener implements EvaluationListener {
    private static final Logger log = LogManager.getLogger(LoggingEvaluationListener.class);

    private final ErrorRateLimiter errLimiter = new ErrorRateLimiter(log, 1000);

    @Override
    public void onRunStart(long runId, String scenario) {
        log.info("Run {} started for scenario '{}'", runId, scenario);
    }

    @Override
    public void onAttributeEvaluated(long runId, String identity, double value, long durationNanos) {
        if (log.isTraceEnabled())
            log.trace("Run {}: {} = {} ({} ns)", runId, identity, value, durationNanos);
    }

    @Override
    public void onIteration(long runId, int groupId, int iteration, double maxDelta) {
        log.debug("Run {}: group {} iteration {} maxDelta={}", runId, groupId, iteration, maxDelta);
    }

    @Override
    public void onGroupSolved(long runId, GroupDiagnostics d) {
        if (d.converged())
            log.info("Run {}: group {} converged in {} iterations", runId, d.members(), d.iterations());
        else
            log.warn("Run {}: group {} stopped ({}) after {} iterations, maxDelta={}", runId, d.members(),
                    d.termination(), d.iterations(), d.maxDelta());
    }

    @Override
    public void onAttributeError(long runId, String identity, Throwable error) {
        errLimiter.log(String.format("Run %d: formula of '%s' failed: %s", runId, identity, error.getMessage()),
                null);
    }

    @Override
    public void onRunEnd(long runId, RunState finalState) {
        log.info("Run {} finished: {}", runId, finalState);
    }
}
