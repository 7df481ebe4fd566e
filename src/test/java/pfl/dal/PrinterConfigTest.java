package pfl.dal;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import pfl.common.EProtocolKind;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for PrinterConfig
 * @author Martin Sustik <sustik@herman.cz>
 * @since 09/10/2025
 */
class PrinterConfigTest {

    @Test
    @DisplayName("Should validate Bambu printer configuration successfully")
    void shouldValidateBambuConfigSuccessfully() {
        // Given
        PrinterConfig config = PrinterConfig.bambu("x1c", "X1C", "192.168.1.40", "01S00C000000001", "12345678");

        // When & Then
        assertThatCode(config::validate).doesNotThrowAnyException();
        assertThat(config.protocol()).isEqualTo(EProtocolKind.BAMBU);
        assertThat(config.port()).isEqualTo(8883);
    }

    @Test
    @DisplayName("Should accept Elegoo printer without mainboard id")
    void shouldAcceptElegooWithoutMainboardId() {
        // Given
        PrinterConfig config = PrinterConfig.elegoo("saturn", "Saturn", "192.168.1.41", null);

        // When & Then
        assertThatCode(config::validate).doesNotThrowAnyException();
        assertThat(config.port()).isEqualTo(3030);
    }

    @Test
    @DisplayName("Should reject Bambu printer without serial")
    void shouldRejectBambuWithoutSerial() {
        // Given
        PrinterConfig config = PrinterConfig.bambu("x1c", "X1C", "192.168.1.40", " ", "12345678");

        // When & Then
        assertThatThrownBy(config::validate)
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("Serial number is required");
    }

    @Test
    @DisplayName("Should reject empty host")
    void shouldRejectEmptyHost() {
        // Given
        PrinterConfig config = PrinterConfig.prusaLink("mk4", "MK4", "", "key");

        // When & Then
        assertThatThrownBy(config::validate)
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("Host cannot be empty");
    }

    @Test
    @DisplayName("Should reject out of range port")
    void shouldRejectInvalidPort() {
        // Given
        PrinterConfig config = PrinterConfig.moonraker("voron", "Voron", "192.168.1.43", 70000);

        // When & Then
        assertThatThrownBy(config::validate)
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("Port must be between 1 and 65535");
    }

    @Test
    @DisplayName("Should detect connection changes but ignore renames")
    void shouldDetectConnectionChanges() {
        // Given
        PrinterConfig original = PrinterConfig.moonraker("voron", "Voron", "192.168.1.43", 7125);
        PrinterConfig renamed = PrinterConfig.moonraker("voron", "Voron 2.4", "192.168.1.43", 7125);
        PrinterConfig moved = PrinterConfig.moonraker("voron", "Voron", "192.168.1.44", 7125);

        // When & Then
        assertThat(original.connectionDiffers(renamed)).isFalse();
        assertThat(original.connectionDiffers(moved)).isTrue();
        assertThat(original.connectionDiffers(null)).isTrue();
    }

    @Test
    @DisplayName("Should fall back to id as display name")
    void shouldFallBackToIdAsDisplayName() {
        // Given
        PrinterConfig config = PrinterConfig.elegoo("saturn", null, "192.168.1.41", null);

        // When & Then
        assertThat(config.getDisplayName()).isEqualTo("saturn");
    }
}
