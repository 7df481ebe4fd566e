package pfl.dal;

import pfl.common.EProtocolKind;

/**
 * Connection settings of one printer. Comes from {@code printers.<n>.*} properties or from a
 * {@code printers} table row.
 *
 * @author Martin Sustik <sustik@herman.cz>
 * @since 26/09/2025
 */
public record PrinterConfig(
        String id,
        String name,
        EProtocolKind protocol,
        String host,
        int port,
        String serial,
        String accessCode,
        String apiKey,
        boolean enabled) {

    /**
     * Bambu Lab printer on the LAN (MQTT over TLS, access code from the printer screen)
     */
    public static PrinterConfig bambu(String id, String name, String host, String serial, String accessCode) {
        return new PrinterConfig(id, name, EProtocolKind.BAMBU, host, EProtocolKind.BAMBU.getDefaultPort(), serial, accessCode, null, true);
    }

    /**
     * Elegoo SDCP printer. Mainboard id may be null, it is learned from the first status message.
     */
    public static PrinterConfig elegoo(String id, String name, String host, String mainboardId) {
        return new PrinterConfig(id, name, EProtocolKind.ELEGOO, host, EProtocolKind.ELEGOO.getDefaultPort(), mainboardId, null, null, true);
    }

    public static PrinterConfig prusaLink(String id, String name, String host, String apiKey) {
        return new PrinterConfig(id, name, EProtocolKind.PRUSALINK, host, EProtocolKind.PRUSALINK.getDefaultPort(), null, null, apiKey, true);
    }

    public static PrinterConfig moonraker(String id, String name, String host, int port) {
        return new PrinterConfig(id, name, EProtocolKind.MOONRAKER, host, port, null, null, null, true);
    }

    public String getDisplayName() {
        return name == null || name.isBlank() ? id : name;
    }

    /**
     * True when a supervisor must rebuild its adapter because the connection settings changed
     */
    public boolean connectionDiffers(PrinterConfig other) {
        return other == null
                || protocol != other.protocol
                || port != other.port
                || !equalsNullable(host, other.host)
                || !equalsNullable(serial, other.serial)
                || !equalsNullable(accessCode, other.accessCode)
                || !equalsNullable(apiKey, other.apiKey);
    }

    private static boolean equalsNullable(String a, String b) {
        return a == null ? b == null : a.equals(b);
    }

    @Override
    public String toString() {
        return String.format("PrinterConfiguration{id='%s', name='%s', protocol=%s, host='%s', port=%d, serial='%s', enabled=%s}",
                id, name, protocol, host, port, serial, enabled);
    }

    /**
     * Validate configuration based on protocol
     */
    public void validate() throws ConfigurationException {
        if (id == null || id.trim().isEmpty()) {
            throw new ConfigurationException("Printer id cannot be empty");
        }
        if (protocol == null) {
            throw new ConfigurationException("Protocol cannot be null for printer '" + id + "'");
        }
        if (host == null || host.trim().isEmpty()) {
            throw new ConfigurationException("Host cannot be empty for printer '" + id + "'");
        }
        if (port < 1 || port > 65535) {
            throw new ConfigurationException("Port must be between 1 and 65535 for printer '" + id + "'");
        }

        if (protocol == EProtocolKind.BAMBU) {
            if (serial == null || serial.trim().isEmpty()) {
                throw new ConfigurationException("Serial number is required for Bambu printer '" + id + "'");
            }
            if (accessCode == null || accessCode.trim().isEmpty()) {
                throw new ConfigurationException("Access code is required for Bambu printer '" + id + "'");
            }
        }
    }
}
