package com.bizsim.drg.cache;

import com.bizsim.drg.engine.RunOptions;
import com.bizsim.drg.model.ResolvedInputs;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Map;

/**
 * Scenario-level cache key.
 *
 * The digest is SHA-256 over the model version, the scenario name, every
 * resolved input (identity and exact bit pattern, in declaration order) and the
 * options that change numeric results ({@code maxIterations},
 * {@code threshold}). It is a pure function of those values.
 *
 * @param modelVersion Model version, kept in clear for version-wide invalidation.
 * @param scenarioName Scenario name, kept in clear for diagnostics.
 * @param digest       Lower-case hex SHA-256.
 */
public record Fingerprint(String modelVersion, String scenarioName, String digest) {

    public static Fingerprint of(String modelVersion, ResolvedInputs inputs, RunOptions options) {
        MessageDigest md = sha256();
        update(md, modelVersion);
        update(md, inputs.scenarioName());
        for (Map.Entry<String, Double> e : inputs.asMap().entrySet()) {
            update(md, e.getKey());
            update(md, Long.toHexString(Double.doubleToLongBits(e.getValue())));
        }
        update(md, Integer.toString(options.maxIterations()));
        update(md, Long.toHexString(Double.doubleToLongBits(options.threshold())));
        return new Fingerprint(modelVersion, inputs.scenarioName(), HexFormat.of().formatHex(md.digest()));
    }

    private static void update(MessageDigest md, String s) {
        md.update(s.getBytes(StandardCharsets.UTF_8));
        md.update((byte) 0);
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            // Every JDK ships SHA-256.
            throw new IllegalStateException(e);
        }
    }

    @Override
    public String toString() {
        return scenarioName + "@" + modelVersion + ":" + digest.substring(0, 12);
    }
}
