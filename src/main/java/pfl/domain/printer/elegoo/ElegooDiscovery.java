package pfl.domain.printer.elegoo;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.DatagramPacket;
import java.net.DatagramSocket;
import java.net.InetAddress;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static pfl.domain.printer.JsonFields.object;
import static pfl.domain.printer.JsonFields.string;

/**
 * SDCP LAN discovery: broadcast {@code M99999} to UDP port 3000 and collect the answers that
 * arrive within the window
 * @since 17/01/2026
 */
public class ElegooDiscovery {
    private static final Logger logger = LoggerFactory.getLogger(ElegooDiscovery.class);
    public static final int DISCOVERY_PORT = 3000;
    private static final byte[] PROBE = "M99999".getBytes(StandardCharsets.US_ASCII);

    private final String broadcastAddress;
    private final int port;

    public ElegooDiscovery() {
        this("255.255.255.255", DISCOVERY_PORT);
    }

    public ElegooDiscovery(String broadcastAddress, int port) {
        this.broadcastAddress = broadcastAddress;
        this.port = port;
    }

    /**
     * Blocks for up to {@code windowMs}. Socket failures are logged and give an empty list.
     */
    public List<DiscoveredPrinter> discover(long windowMs) {
        List<DiscoveredPrinter> found = new ArrayList<>();
        try (DatagramSocket socket = new DatagramSocket()) {
            socket.setBroadcast(true);
            socket.send(new DatagramPacket(PROBE, PROBE.length, InetAddress.getByName(broadcastAddress), port));

            long deadline = System.currentTimeMillis() + windowMs;
            byte[] buffer = new byte[4096];
            while (true) {
                long remaining = deadline - System.currentTimeMillis();
                if (remaining <= 0) {
                    break;
                }
                socket.setSoTimeout((int) remaining);
                DatagramPacket packet = new DatagramPacket(buffer, buffer.length);
                try {
                    socket.receive(packet);
                } catch (SocketTimeoutException e) {
                    break;
                }
                String text = new String(packet.getData(), packet.getOffset(), packet.getLength(), StandardCharsets.UTF_8);
                DiscoveredPrinter printer = parseReply(packet.getAddress().getHostAddress(), text);
                if (printer != null) {
                    found.add(printer);
                }
            }
        } catch (IOException e) {
            logger.warn("SDCP discovery failed: {}", e.getMessage());
            return Collections.emptyList();
        }
        logger.info("SDCP discovery found {} printer(s)", found.size());
        return found;
    }

    /**
     * Attributes come flat on some firmware and under {@code Data.Attributes} on others
     */
    static DiscoveredPrinter parseReply(String ip, String text) {
        JsonObject reply;
        try {
            JsonElement element = JsonParser.parseString(text);
            if (!element.isJsonObject()) {
                return null;
            }
            reply = element.getAsJsonObject();
        } catch (JsonParseException e) {
            logger.debug("Ignoring unreadable discovery reply from {}: {}", ip, e.getMessage());
            return null;
        }

        JsonObject attributes = reply;
        JsonObject data = object(reply, "Data");
        if (data != null) {
            JsonObject nested = object(data, "Attributes");
            attributes = nested != null ? nested : data;
        }
        return new DiscoveredPrinter(
                ip,
                string(attributes, "Name", "Unknown"),
                string(attributes, "MachineName", ""),
                string(attributes, "BrandName", "ELEGOO"),
                string(attributes, "MainboardID", ""),
                string(attributes, "FirmwareVersion", ""),
                string(attributes, "ProtocolVersion", ""));
    }
}
