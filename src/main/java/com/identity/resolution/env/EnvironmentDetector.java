package com.identity.resolution.env;

import com.identity.resolution.logging.LogContext;
import com.identity.resolution.metrics.MetricsService;
import com.identity.resolution.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Detects whether the process runs in production, test or development.
 *
 * <p>Detection order:</p>
 * <ol>
 *   <li>{@code LOCAL_ENV} environment variable, if it names a tier</li>
 *   <li>{@code HTTP_HOST} containing {@code -test.} or {@code -dev.}</li>
 *   <li>short host name ending in {@code -d<n>}, {@code -t<n>} or {@code -p<n>}</li>
 *   <li>{@link DeploymentEnvironment#PROD}</li>
 * </ol>
 *
 * The result is cached until {@link #reset()}.
 */
public class EnvironmentDetector {
    private static final Logger log = LoggerFactory.getLogger(EnvironmentDetector.class);

    public static final String LOCAL_ENV_VARIABLE = "LOCAL_ENV";
    public static final String HTTP_HOST_VARIABLE = "HTTP_HOST";

    private static final Pattern DEV_HOST = Pattern.compile("-d\\d+$");
    private static final Pattern TEST_HOST = Pattern.compile("-t\\d+$");

    private final EnvironmentSource environment;
    private final HostnameSource hostnameSource;
    private final MetricsService metricsService;

    private volatile DeploymentEnvironment detected;

    public EnvironmentDetector() {
        this(EnvironmentSource.system(), HostnameSource.local(), new NoOpMetricsService());
    }

    public EnvironmentDetector(EnvironmentSource environment, HostnameSource hostnameSource,
                               MetricsService metricsService) {
        this.environment = Objects.requireNonNull(environment, "environment must not be null");
        this.hostnameSource = Objects.requireNonNull(hostnameSource, "hostnameSource must not be null");
        this.metricsService = Objects.requireNonNull(metricsService, "metricsService must not be null");
    }

    /**
     * Returns the detected deployment environment.
     */
    public DeploymentEnvironment detect() {
        metricsService.recordApiUsage("detectEnvironment");
        DeploymentEnvironment result = detected;
        if (result == null) {
            synchronized (this) {
                result = detected;
                if (result == null) {
                    try (LogContext ctx = LogContext.forEnvironmentDetection(LogContext.generateCorrelationId())) {
                        result = computeEnvironment();
                        log.debug("environment.detected environment={}", result);
                    }
                    detected = result;
                }
            }
        }
        return result;
    }

    /**
     * Clears the cached result so the next {@link #detect()} runs detection again.
     */
    public void reset() {
        detected = null;
    }

    private DeploymentEnvironment computeEnvironment() {
        String localEnv = environment.get(LOCAL_ENV_VARIABLE);
        if (localEnv != null && !localEnv.isBlank()) {
            Optional<DeploymentEnvironment> explicit = DeploymentEnvironment.fromName(localEnv);
            if (explicit.isPresent()) {
                return explicit.get();
            }
            log.warn("environment.unrecognized {}={} ignored", LOCAL_ENV_VARIABLE, localEnv);
        }

        String httpHost = environment.get(HTTP_HOST_VARIABLE);
        if (httpHost != null) {
            if (httpHost.contains("-test.")) {
                return DeploymentEnvironment.TEST;
            }
            if (httpHost.contains("-dev.")) {
                return DeploymentEnvironment.DEV;
            }
        }

        return fromHostname(shortHostname());
    }

    static DeploymentEnvironment fromHostname(String shortHostname) {
        if (shortHostname == null) {
            return DeploymentEnvironment.PROD;
        }
        if (DEV_HOST.matcher(shortHostname).find()) {
            return DeploymentEnvironment.DEV;
        }
        if (TEST_HOST.matcher(shortHostname).find()) {
            return DeploymentEnvironment.TEST;
        }
        // -p<n> hosts and unrecognised names are production
        return DeploymentEnvironment.PROD;
    }

    private String shortHostname() {
        try {
            String hostname = hostnameSource.hostname();
            if (hostname == null) {
                return null;
            }
            int dot = hostname.indexOf('.');
            return dot >= 0 ? hostname.substring(0, dot) : hostname;
        } catch (IOException e) {
            log.debug("environment.hostname unavailable: {}", e.getMessage());
            return null;
        }
    }
}
