package pfl.dal;

import org.joda.time.LocalTime;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import pfl.common.EProtocolKind;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for ConfigurationService
 * @author Martin Sustik <sustik@herman.cz>
 * @since 26/09/2025
 */
class ConfigurationServiceTest {

    private static final String[] KEYS = {
            "server.port", "server.startup.mode",
            "printers.1.id", "printers.1.name", "printers.1.protocol", "printers.1.host",
            "printers.1.serial", "printers.1.access-code",
            "printers.2.id", "printers.2.protocol", "printers.2.host",
            "alerts.quiet.enabled", "alerts.quiet.start", "alerts.quiet.end",
            "monitor.staleness.bambu.ms"
    };

    @AfterEach
    void clearSystemProperties() {
        for (String key : KEYS) {
            System.clearProperty(key);
        }
    }

    @Test
    @DisplayName("Should load valid server configuration")
    void shouldLoadValidServerConfiguration() throws ConfigurationException {
        // Given
        System.setProperty("server.port", "8181");
        System.setProperty("server.startup.mode", "strict");

        // When
        ServerConfig config = new ConfigurationService().getServerConfiguration();

        // Then
        assertThat(config.port()).isEqualTo(8181);
        assertThat(config.startupMode()).isEqualTo(StartupMode.STRICT);
    }

    @Test
    @DisplayName("Should fall back to LENIENT for unknown startup mode")
    void shouldFallBackToLenientForUnknownMode() throws ConfigurationException {
        // Given
        System.setProperty("server.startup.mode", "YOLO");

        // When
        ServerConfig config = new ConfigurationService().getServerConfiguration();

        // Then
        assertThat(config.startupMode()).isEqualTo(StartupMode.LENIENT);
    }

    @Test
    @DisplayName("Should throw exception for invalid server port")
    void shouldThrowExceptionForInvalidServerPort() {
        // Given
        System.setProperty("server.port", "99999");

        // When & Then
        assertThatThrownBy(ConfigurationService::new)
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("port must be between 1 and 65535");
    }

    @Test
    @DisplayName("Should load configured printers with protocol default ports")
    void shouldLoadConfiguredPrinters() throws ConfigurationException {
        // Given
        System.setProperty("printers.1.id", "x1c");
        System.setProperty("printers.1.name", "X1 Carbon");
        System.setProperty("printers.1.protocol", "bambu");
        System.setProperty("printers.1.host", "192.168.1.40");
        System.setProperty("printers.1.serial", "01S00C000000001");
        System.setProperty("printers.1.access-code", "12345678");
        System.setProperty("printers.2.id", "voron");
        System.setProperty("printers.2.protocol", "moonraker");
        System.setProperty("printers.2.host", "192.168.1.43");

        // When
        List<PrinterConfig> printers = new ConfigurationService().getPrinterConfigurations();

        // Then
        assertThat(printers).hasSize(2);
        assertThat(printers.get(0).protocol()).isEqualTo(EProtocolKind.BAMBU);
        assertThat(printers.get(0).port()).isEqualTo(8883);
        assertThat(printers.get(0).getDisplayName()).isEqualTo("X1 Carbon");
        assertThat(printers.get(1).protocol()).isEqualTo(EProtocolKind.MOONRAKER);
        assertThat(printers.get(1).port()).isEqualTo(7125);
        assertThat(printers.get(1).getDisplayName()).isEqualTo("voron");
    }

    @Test
    @DisplayName("Should reject Bambu printer without access code")
    void shouldRejectBambuWithoutAccessCode() {
        // Given
        System.setProperty("printers.1.protocol", "bambu");
        System.setProperty("printers.1.host", "192.168.1.40");
        System.setProperty("printers.1.serial", "01S00C000000001");

        // When & Then
        assertThatThrownBy(ConfigurationService::new)
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("Access code is required");
    }

    @Test
    @DisplayName("Should reject unsupported protocol")
    void shouldRejectUnsupportedProtocol() {
        // Given
        System.setProperty("printers.1.protocol", "octoprint");
        System.setProperty("printers.1.host", "192.168.1.40");

        // When & Then
        assertThatThrownBy(ConfigurationService::new)
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("Unsupported protocol 'octoprint'");
    }

    @Test
    @DisplayName("Should load quiet hours and staleness overrides")
    void shouldLoadAlertAndMonitorSettings() throws ConfigurationException {
        // Given
        System.setProperty("alerts.quiet.enabled", "true");
        System.setProperty("alerts.quiet.start", "23:00");
        System.setProperty("alerts.quiet.end", "06:30");
        System.setProperty("monitor.staleness.bambu.ms", "45000");

        // When
        ConfigurationService service = new ConfigurationService();

        // Then
        AlertConfig alerts = service.getAlertConfiguration();
        assertThat(alerts.quietHoursEnabled()).isTrue();
        assertThat(alerts.quietStart()).isEqualTo(new LocalTime(23, 0));
        assertThat(alerts.quietEnd()).isEqualTo(new LocalTime(6, 30));
        assertThat(service.getMonitorConfiguration().stalenessThresholdMs(EProtocolKind.BAMBU)).isEqualTo(45000);
        assertThat(service.getMonitorConfiguration().stalenessThresholdMs(EProtocolKind.ELEGOO)).isEqualTo(60000);
    }

    @Test
    @DisplayName("Should reject malformed quiet hours time")
    void shouldRejectMalformedQuietTime() {
        // Given
        System.setProperty("alerts.quiet.start", "late");

        // When & Then
        assertThatThrownBy(ConfigurationService::new)
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("alerts.quiet.start");
    }
}
