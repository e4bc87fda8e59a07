package com.alterante.weave.command;

import com.alterante.weave.protocol.Packet;
import com.alterante.weave.protocol.PacketCodec;
import com.alterante.weave.protocol.PacketFormat;
import com.alterante.weave.protocol.PacketType;
import com.alterante.weave.transport.MessageTooLargeException;
import com.alterante.weave.transport.PacketSequenceNumberGenerator;
import com.alterante.weave.transport.Packetizer;
import com.alterante.weave.transport.WriteRequest;
import picocli.CommandLine;

import java.nio.charset.StandardCharsets;
import java.util.HexFormat;
import java.util.List;
import java.util.concurrent.Callable;

@CommandLine.Command(
        name = "packetize",
        description = "Show the packets a message is split into",
        mixinStandardHelpOptions = true
)
public class PacketizeCommand implements Callable<Integer> {

    @CommandLine.Option(names = {"--max-packet-size", "-m"}, description = "Maximum packet size in bytes (default: ${DEFAULT-VALUE})",
            defaultValue = "20")
    private int maxPacketSize;

    @CommandLine.Option(names = {"--counter-bits"}, description = "Width of the packet counter (default: ${DEFAULT-VALUE})",
            defaultValue = "3")
    private int counterBits;

    @CommandLine.ArgGroup(exclusive = true, multiplicity = "1")
    private Input input;

    static class Input {
        @CommandLine.Option(names = {"--text", "-t"}, description = "Message as UTF-8 text", required = true)
        String text;

        @CommandLine.Option(names = {"--hex"}, description = "Message as hex bytes", required = true)
        String hex;
    }

    @CommandLine.Option(names = {"--control"}, description = "Frame as a control payload (must fit in one packet)")
    private boolean control;

    @CommandLine.Option(names = {"--json"}, description = "Output newline-delimited JSON events instead of human-readable text")
    private boolean json;

    @Override
    public Integer call() {
        try {
            return doPacketize();
        } catch (IllegalArgumentException e) {
            if (json) {
                JsonOutput.error(e.getMessage());
            } else {
                System.err.println("Error: " + e.getMessage());
            }
            return 1;
        }
    }

    private Integer doPacketize() {
        PacketFormat format = new PacketFormat(counterBits);
        byte[] message = input.text != null
                ? input.text.getBytes(StandardCharsets.UTF_8)
                : HexFormat.of().parseHex(input.hex);
        PacketType type = control ? PacketType.CONTROL : PacketType.DATA;
        if (control) {
            int needed = Packetizer.packetCount(message.length, maxPacketSize, format);
            if (needed > WriteRequest.MAX_CONTROL_PACKETS) {
                throw new MessageTooLargeException(needed, WriteRequest.MAX_CONTROL_PACKETS);
            }
        }

        List<Packet> packets = Packetizer.packetize(type, message, maxPacketSize, format);
        PacketCodec codec = new PacketCodec(format);
        PacketSequenceNumberGenerator sequence = new PacketSequenceNumberGenerator(format);

        if (!json) {
            System.out.printf("%d bytes -> %d packets (%s, max packet size %d)%n",
                    message.length, packets.size(), format, maxPacketSize);
        }
        for (int i = 0; i < packets.size(); i++) {
            Packet packet = packets.get(i).withCounter(sequence.next());
            byte[] encoded = codec.encode(packet, maxPacketSize);
            if (json) {
                JsonOutput.fragment(i, packet, encoded);
            } else {
                System.out.printf("  #%-3d counter=%d first=%-5b last=%-5b payload=%-3d %s%n",
                        i, packet.counter(), packet.isFirstPacket(), packet.isLastPacket(),
                        packet.payloadLength(), HexFormat.of().formatHex(encoded));
            }
        }
        return 0;
    }
}
