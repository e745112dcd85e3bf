package com.bizsim.drg.cache;

import com.bizsim.drg.CostModels;
import com.bizsim.drg.engine.RunOptions;
import com.bizsim.drg.model.ModelRegistry;
import com.bizsim.drg.model.ResolvedInputs;
import com.bizsim.drg.model.Scenario;
import com.bizsim.drg.model.ScenarioStore;
import org.junit.Before;
import org.junit.Test;

import java.util.Map;

import static org.junit.Assert.*;

public class FingerprintTest {

    private ModelRegistry registry;

    @Before
    public void setUp() {
        registry = CostModels.registry();
    }

    private Fingerprint of(Scenario s, RunOptions o) {
        ResolvedInputs in = ScenarioStore.resolveInputs(s, registry);
        return Fingerprint.of(registry.version(), in, o);
    }

    @Test
    public void testStableForEqualInputs() {
        Fingerprint a = of(Scenario.defaults("Base"), RunOptions.defaults());
        Fingerprint b = of(new Scenario("Base", Map.of("Production.energyCost", 60.0)), RunOptions.defaults());
        assertEquals(a, b);
        assertEquals(64, a.digest().length());
        assertTrue(a.toString().startsWith("Base@1.0:"));
    }

    @Test
    public void testSensitiveToEveryComponent() {
        Fingerprint base = of(Scenario.defaults("Base"), RunOptions.defaults());
        assertNotEquals(base, of(Scenario.defaults("Other"), RunOptions.defaults()));
        assertNotEquals(base, of(new Scenario("Base", Map.of("Production.energyCost", 60.0000001)),
                RunOptions.defaults()));
        assertNotEquals(base, of(Scenario.defaults("Base"), RunOptions.of(99, 0.001)));
        assertNotEquals(base, of(Scenario.defaults("Base"), RunOptions.of(100, 0.0001)));

        ResolvedInputs in = ScenarioStore.resolveInputs(Scenario.defaults("Base"), registry);
        assertNotEquals(base.digest(), Fingerprint.of("2.0", in, RunOptions.defaults()).digest());
    }

    @Test
    public void testWarmStartAndDeadlineDoNotChangeTheKey() {
        Fingerprint base = of(Scenario.defaults("Base"), RunOptions.defaults());
        assertEquals(base, of(Scenario.defaults("Base"), RunOptions.defaults().withWarmStart(true)));
    }
}
