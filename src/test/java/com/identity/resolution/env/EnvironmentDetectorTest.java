package com.identity.resolution.env;

import com.identity.resolution.metrics.NoOpMetricsService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.net.UnknownHostException;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("EnvironmentDetector Tests")
class EnvironmentDetectorTest {

    private static EnvironmentDetector detector(Map<String, String> env, String hostname) {
        return new EnvironmentDetector(EnvironmentSource.of(env), () -> hostname, new NoOpMetricsService());
    }

    @Test
    @DisplayName("LOCAL_ENV should take precedence")
    void localEnvWins() {
        EnvironmentDetector detector = detector(
                Map.of("LOCAL_ENV", "Test", "HTTP_HOST", "app-dev.example.edu"), "web-p01");

        assertEquals(DeploymentEnvironment.TEST, detector.detect());
    }

    @Test
    @DisplayName("Unrecognised LOCAL_ENV should be ignored")
    void unrecognisedLocalEnvIgnored() {
        EnvironmentDetector detector = detector(Map.of("LOCAL_ENV", "staging"), "web-d3");

        assertEquals(DeploymentEnvironment.DEV, detector.detect());
    }

    @Test
    @DisplayName("HTTP_HOST should identify test and dev virtual hosts")
    void httpHost() {
        assertEquals(DeploymentEnvironment.TEST, detector(Map.of("HTTP_HOST", "app-test.example.edu"), "web-p01").detect());
        assertEquals(DeploymentEnvironment.DEV, detector(Map.of("HTTP_HOST", "app-dev.example.edu"), "web-p01").detect());
    }

    @ParameterizedTest
    @CsvSource({
            "web-d1.example.edu, DEV",
            "web-t12, TEST",
            "web-p03.example.edu, PROD",
            "mailhost, PROD",
            "web-d1x, PROD"
    })
    @DisplayName("Host name suffix should identify the tier")
    void hostnameSuffix(String hostname, DeploymentEnvironment expected) {
        assertEquals(expected, detector(Map.of(), hostname).detect());
    }

    @Test
    @DisplayName("Should default to PROD when the host name is unavailable")
    void hostnameFailure() {
        EnvironmentDetector detector = new EnvironmentDetector(EnvironmentSource.of(Map.of()), () -> {
            throw new UnknownHostException("no dns");
        }, new NoOpMetricsService());

        assertEquals(DeploymentEnvironment.PROD, detector.detect());
    }

    @Test
    @DisplayName("Should cache the result until reset")
    void cachesUntilReset() {
        AtomicInteger lookups = new AtomicInteger();
        EnvironmentDetector detector = new EnvironmentDetector(EnvironmentSource.of(Map.of()), () -> {
            lookups.incrementAndGet();
            return "web-t1";
        }, new NoOpMetricsService());

        detector.detect();
        detector.detect();
        assertEquals(1, lookups.get());

        detector.reset();
        detector.detect();
        assertEquals(2, lookups.get());
    }

    @Test
    @DisplayName("Tier names should parse case-insensitively")
    void parseTierNames() {
        assertEquals(DeploymentEnvironment.DEV, DeploymentEnvironment.fromName(" dev ").orElseThrow());
        assertTrue(DeploymentEnvironment.fromName("qa").isEmpty());
        assertTrue(DeploymentEnvironment.fromName(null).isEmpty());
        assertEquals("prod", DeploymentEnvironment.PROD.label());
    }
}
