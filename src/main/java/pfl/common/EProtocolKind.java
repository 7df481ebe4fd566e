package pfl.common;

import java.util.Locale;

/**
 * Wire protocols supported by the adapters, with the transport shape and the default
 * staleness threshold the supervisor applies to each of them
 * @since 12/01/2026
 */
public enum EProtocolKind {
    BAMBU(ETransportShape.PUSH_DELTA, 8883, 120_000),
    ELEGOO(ETransportShape.PUSH_SNAPSHOT, 3030, 60_000),
    PRUSALINK(ETransportShape.PULL, 80, 90_000),
    MOONRAKER(ETransportShape.PULL, 7125, 90_000);

    public enum ETransportShape {
        PUSH_DELTA,
        PUSH_SNAPSHOT,
        PULL
    }

    private final ETransportShape transportShape;
    private final int defaultPort;
    private final long defaultStalenessMs;

    EProtocolKind(ETransportShape transportShape, int defaultPort, long defaultStalenessMs) {
        this.transportShape = transportShape;
        this.defaultPort = defaultPort;
        this.defaultStalenessMs = defaultStalenessMs;
    }

    public ETransportShape getTransportShape() {
        return transportShape;
    }

    public int getDefaultPort() {
        return defaultPort;
    }

    public long getDefaultStalenessMs() {
        return defaultStalenessMs;
    }

    /**
     * Lenient parse used by configuration and database rows ("bambu", "Bambu", "BAMBU")
     */
    public static EProtocolKind parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Protocol kind cannot be empty");
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        if (normalized.equals("KLIPPER")) {
            return MOONRAKER;
        }
        if (normalized.equals("PRUSA")) {
            return PRUSALINK;
        }
        return EProtocolKind.valueOf(normalized);
    }
}
