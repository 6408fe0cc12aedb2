package de.htwsaar.assetserver.common.logging;

import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNotSame;

import org.junit.jupiter.api.Test;

/**
 * Tests für {@link LoggingConfig}.
 */
class LoggingConfigTest {

    @Test
    void shouldCreateTraceIdFilterBeanInstance() {
        LoggingConfig config = new LoggingConfig();

        assertNotNull(config.traceIdFilter());
    }

    @Test
    void shouldReturnNewFilterOnDirectFactoryCalls() {
        LoggingConfig config = new LoggingConfig();

        assertNotSame(config.traceIdFilter(), config.traceIdFilter());
    }
}
