package com.alterante.weave.command;

import com.alterante.weave.protocol.ControlMessage;
import com.alterante.weave.protocol.Packet;
import com.alterante.weave.transport.FramingError;
import com.alterante.weave.transport.WriteResult;

import java.util.HexFormat;

/**
 * Emits newline-delimited JSON events to stdout for machine-readable output.
 * Used by PacketizeCommand and LoopbackCommand when --json flag is set.
 */
final class JsonOutput {

    private static final HexFormat HEX = HexFormat.of();

    private JsonOutput() {}

    static void fragment(int index, Packet packet, byte[] encoded) {
        emit("{\"event\":\"fragment\",\"index\":%d,\"type\":\"%s\",\"counter\":%d,\"first\":%b,\"last\":%b,\"payload\":%d,\"hex\":\"%s\"}",
                index,
                packet.type().name().toLowerCase(),
                packet.counter(),
                packet.isFirstPacket(),
                packet.isLastPacket(),
                packet.payloadLength(),
                HEX.formatHex(encoded));
    }

    static void control(ControlMessage message) {
        emit("{\"event\":\"control\",\"command\":\"%s\",\"min_version\":%d,\"max_version\":%d,\"packet_size\":%d}",
                message.command().name().toLowerCase(),
                message.minVersion(),
                message.maxVersion(),
                message.packetSize());
    }

    static void writeResult(WriteResult result) {
        String cause = result.cause() != null ? result.cause().getMessage() : null;
        emit("{\"event\":\"write_result\",\"state\":\"%s\",\"packets_sent\":%d,\"packet_count\":%d,\"cause\":%s}",
                result.state().name().toLowerCase(),
                result.packetsSent(),
                result.packetCount(),
                cause != null ? "\"" + escapeJson(cause) + "\"" : "null");
    }

    static void message(int bytes, boolean matches) {
        emit("{\"event\":\"message\",\"bytes\":%d,\"matches\":%b}", bytes, matches);
    }

    static void framingError(FramingError error) {
        emit("{\"event\":\"framing_error\",\"kind\":\"%s\"}", error.name().toLowerCase());
    }

    static void error(String message) {
        emit("{\"event\":\"error\",\"message\":\"%s\"}", escapeJson(message));
    }

    private static void emit(String format, Object... args) {
        System.out.println(String.format(format, args));
        System.out.flush();
    }

    private static String escapeJson(String s) {
        if (s == null) return "";
        return s.replace("\\", "\\\\")
                .replace("\"", "\\\"")
                .replace("\n", "\\n")
                .replace("\r", "\\r")
                .replace("\t", "\\t");
    }
}
