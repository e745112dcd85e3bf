package com.bizsim.drg.engine;

import org.junit.Test;

import java.time.Duration;
import java.util.Properties;

import static org.junit.Assert.*;

public class EngineConfigTest {

    @Test
    public void testLoadsClasspathFile() {
        EngineConfig c = EngineConfig.load();
        assertEquals(4, c.parallelism());
        assertEquals(100, c.maxIterations());
        assertEquals(0.001, c.threshold(), 0.0);
        assertEquals(1024, c.cacheMaxEntries());
    }

    @Test
    public void testSystemPropertyOverridesFile() {
        System.setProperty(EngineConfig.MAX_ITERATIONS, "250");
        try {
            assertEquals(250, EngineConfig.load().maxIterations());
        } finally {
            System.clearProperty(EngineConfig.MAX_ITERATIONS);
        }
    }

    @Test
    public void testMissingKeysFallBackToDefaults() {
        Properties p = new Properties();
        p.setProperty(EngineConfig.THRESHOLD, "1e-6");
        EngineConfig c = EngineConfig.fromProperties(p);
        assertEquals(1e-6, c.threshold(), 0.0);
        assertEquals(RunOptions.DEFAULT_MAX_ITERATIONS, c.maxIterations());

        RunOptions o = c.defaultRunOptions();
        assertEquals(1e-6, o.threshold(), 0.0);
        assertNull(o.deadline());
        assertFalse(o.warmStart());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testMalformedNumber() {
        Properties p = new Properties();
        p.setProperty(EngineConfig.PARALLELISM, "many");
        EngineConfig.fromProperties(p);
    }

    @Test
    public void testValidation() {
        expectInvalid(() -> new EngineConfig(0, 100, 0.001, 10));
        expectInvalid(() -> new EngineConfig(1, 0, 0.001, 10));
        expectInvalid(() -> new EngineConfig(1, 100, 0.0, 10));
        expectInvalid(() -> new EngineConfig(1, 100, 0.001, 0));
        expectInvalid(() -> RunOptions.of(1, Double.NaN));
        expectInvalid(() -> RunOptions.defaults().withDeadline(Duration.ZERO));
    }

    @Test
    public void testWithers() {
        RunOptions o = RunOptions.defaults().withMaxIterations(7).withThreshold(0.5).withWarmStart(true)
                .withDeadline(Duration.ofSeconds(1));
        assertEquals(new RunOptions(7, 0.5, Duration.ofSeconds(1), true), o);
        assertEquals(2, EngineConfig.defaults().withParallelism(2).parallelism());
        assertEquals(5, EngineConfig.defaults().withCacheMaxEntries(5).cacheMaxEntries());
    }

    private static void expectInvalid(Runnable r) {
        try {
            r.run();
            fail();
        } catch (IllegalArgumentException expected) {
            // rejected
        }
    }
}
