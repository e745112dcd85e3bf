package com.bizsim.drg.io;

import com.bizsim.drg.CostModels;
import com.bizsim.drg.engine.SimulationEngine;
import com.bizsim.drg.engine.SimulationResult;
import com.bizsim.drg.fn.Constant;
import com.bizsim.drg.model.ModelDefinitionException;
import com.bizsim.drg.model.ModelDefinitionException.ErrorKind;
import com.bizsim.drg.model.Scenario;
import org.junit.Test;

import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class JsonModelLoaderTest {

    private static final double EPS = 1e-6;

    private final JsonModelLoader loader = new JsonModelLoader();

    @Test
    public void testBundledCostModel() {
        LoadedModel m = loader.loadResource("models/stk_cost_model.json");
        assertEquals("stk-cost", m.registry().modelName());
        assertEquals(List.of("Base", "HighEnergyPrices"), m.scenarios().scenarioNames());

        try (SimulationEngine engine = m.newEngine(CostModels.config(2))) {
            SimulationResult base = engine.run("Base");
            assertEquals(107.3684175, base.value("Production.disposalCost"), EPS);
            assertEquals(11.368420875, base.value("Production.co2Cost"), EPS);
            assertEquals(39.52042262, base.value("Logistics.logisticsCost"), EPS);
            assertEquals(4.52046331, base.value("Logistics.ecoFees"), EPS);
            assertEquals(6, base.diagnosticsFor("Production.co2Cost").iterations());

            SimulationResult high = engine.run("HighEnergyPrices");
            assertEquals(110.52631125, high.value("Production.disposalCost"), EPS);
            assertEquals(5.25145672, high.value("Logistics.ecoFees"), EPS);
        }
    }

    @Test
    public void testAcyclicPricingModel() {
        LoadedModel m = loader.loadResource("models/pricing_model.json");
        try (SimulationEngine engine = m.newEngine(CostModels.config(1))) {
            SimulationResult base = engine.run("Base");
            assertTrue(base.diagnostics().isEmpty());
            assertEquals(80.0, base.value("Sales.sold"), 0.0);
            assertEquals(200.0, base.value("Sales.revenue"), 0.0);
            assertEquals(50.0, base.value("Finance.fixedCost"), 0.0);
            assertEquals(150.0, base.value("Finance.margin"), 0.0);
            assertEquals(0.75, base.value("Finance.marginRatio"), 0.0);
            assertEquals(200.0, base.value("Finance.peak"), 0.0);

            SimulationResult big = engine.run("BigOrder");
            assertEquals(60.0, big.value("Sales.sold"), 0.0);
            assertEquals(180.0, big.value("Sales.revenue"), 0.0);
            assertEquals(130.0, big.value("Finance.margin"), 0.0);
            assertEquals(130.0 / 180.0, big.value("Finance.marginRatio"), 1e-12);
            assertEquals(180.0, big.value("Finance.peak"), 0.0);
        }
    }

    @Test
    public void testUnknownDependencyIsRejected() {
        try {
            loader.loadResource("models/invalid_unknown_dependency.json");
            fail();
        } catch (ModelDefinitionException e) {
            assertEquals(ErrorKind.UNKNOWN_DEPENDENCY, e.kind());
            assertEquals("Sales.revenue", e.identity());
        }
    }

    private static String singleAttribute(String attributeJson) {
        return """
                {"model": {"name": "m", "version": "1", "blocks": [
                  {"name": "A", "attributes": [
                    {"name": "x", "kind": "input", "value": 1},
                    %s
                  ]}
                ]}}
                """.formatted(attributeJson);
    }

    private void expect(ErrorKind kind, String attributeJson) {
        try {
            loader.load(singleAttribute(attributeJson));
            fail("Expected " + kind);
        } catch (ModelDefinitionException e) {
            assertEquals(kind, e.kind());
            assertEquals("A.y", e.identity());
        }
    }

    @Test
    public void testAttributeErrors() {
        expect(ErrorKind.UNKNOWN_FORMULA,
                "{\"name\": \"y\", \"kind\": \"calculated\", \"formula\": \"sqrt\", \"dependencies\": [\"x\"]}");
        expect(ErrorKind.MISSING_FORMULA, "{\"name\": \"y\", \"kind\": \"calculated\", \"dependencies\": [\"x\"]}");
        expect(ErrorKind.MISSING_DEPENDENCIES, "{\"name\": \"y\", \"kind\": \"calculated\", \"formula\": \"sum\"}");
        expect(ErrorKind.UNEXPECTED_FORMULA, "{\"name\": \"y\", \"kind\": \"input\", \"value\": 1, \"formula\": \"sum\"}");
        expect(ErrorKind.INVALID_VALUE, "{\"name\": \"y\", \"kind\": \"input\"}");
        expect(ErrorKind.INVALID_VALUE, "{\"name\": \"y\", \"kind\": \"derived\"}");
        expect(ErrorKind.INVALID_VALUE, "{\"name\": \"y\", \"kind\": \"calculated\", \"formula\": \"ratio\", "
                + "\"dependencies\": [\"x\"]}");
        expect(ErrorKind.INVALID_VALUE, "{\"name\": \"y\", \"kind\": \"calculated\", \"formula\": \"linear\", "
                + "\"dependencies\": [\"x\"], \"properties\": {\"weights\": [1, 2]}}");
    }

    @Test
    public void testScenarioOverridingCalculatedAttribute() {
        String json = """
                {"model": {"name": "m", "version": "1",
                  "blocks": [{"name": "A", "attributes": [
                    {"name": "x", "kind": "input", "value": 1},
                    {"name": "y", "kind": "calculated", "formula": "sum", "dependencies": ["x"]}
                  ]}],
                  "scenarios": [{"name": "Bad", "overrides": {"A": {"y": 5}}}]}}
                """;
        try {
            loader.load(json);
            fail();
        } catch (ModelDefinitionException e) {
            assertEquals(ErrorKind.INVALID_OVERRIDE, e.kind());
            assertEquals("A.y", e.identity());
        }
    }

    @Test
    public void testCustomFormulaTypeAndDefaultWeights() {
        FormulaRegistry formulas = new FormulaRegistry()
                .registerFactory("Tariff", (id, props, n) -> new Constant(FormulaRegistry.getDouble(props, "rate", 0) * 2));
        assertTrue(formulas.contains("tariff"));
        assertTrue(formulas.types().containsAll(List.of("linear", "ratio", "tariff")));

        String json = """
                {"model": {"name": "m", "version": "1", "blocks": [{"name": "A", "attributes": [
                  {"name": "x", "kind": "input", "value": 2},
                  {"name": "t", "kind": "calculated", "formula": "TARIFF", "dependencies": [],
                   "properties": {"rate": 1.5}},
                  {"name": "total", "kind": "calculated", "formula": "linear", "dependencies": ["x", "t"],
                   "properties": {"constant": 1}}
                ]}]}}
                """;
        LoadedModel m = new JsonModelLoader(formulas).load(json);
        assertTrue(m.scenarios().scenarioNames().isEmpty());
        try (SimulationEngine engine = m.newEngine(CostModels.config(1))) {
            SimulationResult r = engine.run(Scenario.defaults("d"), engine.defaultOptions());
            assertEquals(3.0, r.value("A.t"), 0.0);
            assertEquals(6.0, r.value("A.total"), 0.0);
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testMalformedJson() {
        loader.load("{\"model\": ");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testMissingModelKey() {
        loader.load("{}");
    }

    @Test
    public void testParseKeepsDefinitionShape() {
        ModelDefinition def = JsonModelLoader.parseResource("models/pricing_model.json");
        assertEquals("2.0", def.getModel().getVersion());
        ModelDefinition.AttributeDef margin = def.getModel().getBlocks().get(1).getAttributes().get(1);
        assertEquals("margin", margin.getName());
        assertEquals(List.of("Sales.revenue", "fixedCost"), margin.getDependencies());
        assertEquals(Map.of("units", 60.0, "price", 3.0),
                def.getModel().getScenarios().get(1).getOverrides().get("Sales"));
    }
}
