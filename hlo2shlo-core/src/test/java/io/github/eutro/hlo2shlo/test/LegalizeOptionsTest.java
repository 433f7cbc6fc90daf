package io.github.eutro.hlo2shlo.test;

import io.github.eutro.hlo2shlo.core.conf.LegalizeOptions;
import org.junit.jupiter.api.Test;

import java.util.Collections;

import static io.github.eutro.hlo2shlo.core.conf.LegalizeOptions.ALLOW_EXPERIMENTAL_FEATURES_ENV;
import static org.junit.jupiter.api.Assertions.*;

public class LegalizeOptionsTest {
    private static boolean allowed(String value) {
        return LegalizeOptions.fromEnvironment(Collections.singletonMap(ALLOW_EXPERIMENTAL_FEATURES_ENV, value))
                .allowExperimentalFeatures();
    }

    @Test
    void experimentalFeaturesAreOffByDefault() {
        assertFalse(LegalizeOptions.DEFAULT.allowExperimentalFeatures());
        assertFalse(LegalizeOptions.fromEnvironment(Collections.emptyMap()).allowExperimentalFeatures());
        assertTrue(LegalizeOptions.DEFAULT.withAllowExperimentalFeatures(true).allowExperimentalFeatures());
    }

    @Test
    void environment() {
        assertTrue(allowed("1"));
        assertTrue(allowed("true"));
        assertTrue(allowed("yes"));
        assertFalse(allowed(""));
        assertFalse(allowed("0"));
        assertFalse(allowed("FALSE"));
    }
}
