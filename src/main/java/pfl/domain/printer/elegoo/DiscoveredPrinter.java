package pfl.domain.printer.elegoo;

/**
 * One answer to the SDCP broadcast
 * @since 17/01/2026
 */
public record DiscoveredPrinter(
        String ip,
        String name,
        String machineName,
        String brand,
        String mainboardId,
        String firmware,
        String protocolVersion) {
}
