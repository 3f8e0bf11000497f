package ai.tabular.translator.logging;

import static org.assertj.core.api.Assertions.assertThat;

import org.apache.logging.log4j.LogManager;
import org.junit.jupiter.api.Test;

class LoggingBridgeTest {

    @Test
    void log4jApiCallsFromPoiAreRoutedToSlf4j() {
        assertThat(LogManager.getFactory().getClass().getName())
                .isEqualTo("org.apache.logging.slf4j.SLF4JLoggerContextFactory");
        assertThat(LogManager.getLogger("org.apache.poi").getClass().getName())
                .isEqualTo("org.apache.logging.slf4j.SLF4JLogger");
    }
}
