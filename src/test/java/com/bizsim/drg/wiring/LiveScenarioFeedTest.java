package com.bizsim.drg.wiring;

import com.bizsim.drg.CostModels;
import com.bizsim.drg.engine.SimulationEngine;
import com.bizsim.drg.engine.SimulationResult;
import com.bizsim.drg.model.ModelRegistry;
import com.bizsim.drg.model.Scenario;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.Assert.*;

public class LiveScenarioFeedTest {

    private SimulationEngine engine;
    private LiveScenarioFeed feed;

    @Before
    public void setUp() {
        ModelRegistry registry = CostModels.registry();
        engine = new SimulationEngine(registry, CostModels.scenarios(registry), CostModels.config(1));
        feed = new LiveScenarioFeed(engine, Scenario.defaults("Live"), engine.defaultOptions(), 64);
    }

    @After
    public void tearDown() {
        feed.close();
        engine.close();
    }

    @Test
    public void testBatchOfUpdatesProducesUpdatedResult() throws Exception {
        CountDownLatch done = new CountDownLatch(1);
        AtomicReference<SimulationResult> seen = new AtomicReference<>();
        feed.setCallback((batch, result) -> {
            if (result.value("Logistics.transportCost") == 40.0 && result.value("Production.energyCost") == 90.0) {
                seen.set(result);
                done.countDown();
            }
        });

        feed.publish("Production.energyCost", 90);
        feed.publish("Logistics.transportCost", 40, true);

        assertTrue(done.await(5, TimeUnit.SECONDS));
        SimulationResult r = seen.get();
        assertEquals("Live", r.scenarioName());
        assertEquals(110.52631125, r.value("Production.disposalCost"), 1e-6);
        assertEquals(5.25145672, r.value("Logistics.ecoFees"), 1e-6);
        assertSame(r, feed.latest());
    }

    @Test
    public void testRejectsNonInputAndNonFiniteValues() {
        try {
            feed.publish("Production.co2Cost", 1);
            fail();
        } catch (IllegalArgumentException expected) {
            // calculated
        }
        try {
            feed.publish("Production.energyCost", Double.NaN);
            fail();
        } catch (IllegalArgumentException expected) {
            // non-finite
        }
        assertNull(feed.latest());
    }

    @Test
    public void testEventFlyweight() {
        InputUpdateEvent e = new InputUpdateEvent();
        e.set(3, 1.5, true, 7);
        assertEquals(3, e.inputIndex());
        assertEquals(1.5, e.value(), 0.0);
        assertTrue(e.isBatchEnd());
        assertEquals(7, e.sequenceId());
        e.clear();
        assertFalse(e.isBatchEnd());
    }
}
