package com.alterante.weave.command;

import com.alterante.weave.net.LoopbackTransport;
import com.alterante.weave.protocol.ControlMessage;
import com.alterante.weave.protocol.PacketException;
import com.alterante.weave.protocol.PacketFormat;
import com.alterante.weave.transport.FramingError;
import com.alterante.weave.transport.WeaveChannel;
import com.alterante.weave.transport.WriteHandle;
import com.alterante.weave.transport.WriteRequest;
import com.alterante.weave.transport.WriteResult;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.Executor;

/**
 * Sends one message between two channels over an in-memory link, optionally
 * dropping or failing individual packet submissions, and reports what the
 * receiving side reassembled.
 *
 * Both channels run on the calling thread, so the whole exchange is deterministic.
 */
@CommandLine.Command(
        name = "loopback",
        description = "Send a message across an in-memory link and reassemble it",
        mixinStandardHelpOptions = true
)
public class LoopbackCommand implements Callable<Integer> {

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

        @CommandLine.Option(names = {"--file", "-f"}, description = "Send the contents of a file", required = true)
        Path file;
    }

    @CommandLine.Option(names = {"--drop-packet"}, description = "0-based index of a data packet to lose in transit (repeatable)")
    private List<Integer> dropPackets = new ArrayList<>();

    @CommandLine.Option(names = {"--fail-packet"}, description = "0-based index of a data packet whose submission fails")
    private Integer failPacket;

    @CommandLine.Option(names = {"--json"}, description = "Output newline-delimited JSON events instead of human-readable text")
    private boolean json;

    @Override
    public Integer call() throws Exception {
        try {
            return doLoopback();
        } catch (IOException | IllegalArgumentException e) {
            if (json) {
                JsonOutput.error(e.getMessage());
            } else {
                System.err.println("Error: " + e.getMessage());
            }
            return 1;
        }
    }

    private Integer doLoopback() throws IOException {
        byte[] message = input.text != null
                ? input.text.getBytes(StandardCharsets.UTF_8)
                : readFile(input.file);
        PacketFormat format = new PacketFormat(counterBits);
        Executor sameThread = Runnable::run;

        LoopbackTransport.Pair link = LoopbackTransport.pair(maxPacketSize);
        WeaveChannel sender = new WeaveChannel(link.left(), format, WriteRequest.DEFAULT_MAX_PACKETS, sameThread);
        WeaveChannel receiver = new WeaveChannel(link.right(), format, WriteRequest.DEFAULT_MAX_PACKETS, sameThread);
        link.left().attach(sender);
        link.right().attach(receiver);

        List<byte[]> received = new ArrayList<>();
        List<FramingError> errors = new ArrayList<>();
        receiver.onMessageReceived(received::add);
        receiver.onFramingError(errors::add);
        receiver.onControlReceived(this::printControl);

        try {
            // Control request goes first, so data submissions are offset by one.
            ControlMessage request = ControlMessage.connectionRequest(
                    ControlMessage.PROTOCOL_VERSION, ControlMessage.PROTOCOL_VERSION, maxPacketSize, null);
            sender.sendControl(request);
            int base = link.left().submissionCount();
            for (int index : dropPackets) {
                link.left().dropSubmission(base + index);
            }
            if (failPacket != null) {
                link.left().failSubmission(base + failPacket, new IOException("injected failure at packet " + failPacket));
            }

            WriteHandle handle = sender.sendMessage(message);
            if (!json) {
                System.out.printf("Sending %d bytes as %d packets (%s, max packet size %d)%n",
                        message.length, handle.packetCount(), format, maxPacketSize);
            }
            WriteResult result = handle.result().toCompletableFuture().join();

            printResult(result);
            for (FramingError error : errors) {
                printFramingError(error);
            }
            boolean matches = false;
            for (byte[] m : received) {
                matches |= Arrays.equals(m, message);
                printMessage(m.length, Arrays.equals(m, message));
            }
            return result.isSuccess() && matches ? 0 : 1;
        } finally {
            sender.close();
            receiver.close();
        }
    }

    private void printControl(byte[] payload) {
        ControlMessage control;
        try {
            control = ControlMessage.decode(payload);
        } catch (PacketException e) {
            if (json) {
                JsonOutput.error("bad control payload: " + e.getMessage());
            } else {
                System.out.println("Bad control payload: " + e.getMessage());
            }
            return;
        }
        if (json) {
            JsonOutput.control(control);
        } else {
            System.out.println("Control received: " + control);
        }
    }

    private void printResult(WriteResult result) {
        if (json) {
            JsonOutput.writeResult(result);
        } else {
            System.out.println("Write " + result.state() + ": " + result.packetsSent() + "/" + result.packetCount()
                    + " packets" + (result.cause() != null ? " (" + result.cause().getMessage() + ")" : ""));
        }
    }

    private void printFramingError(FramingError error) {
        if (json) {
            JsonOutput.framingError(error);
        } else {
            System.out.println("Framing error: " + error);
        }
    }

    private void printMessage(int length, boolean matches) {
        if (json) {
            JsonOutput.message(length, matches);
        } else {
            System.out.println("Received " + length + " bytes" + (matches ? ", matches" : ", DIFFERS"));
        }
    }

    private static byte[] readFile(Path file) throws IOException {
        if (!Files.isRegularFile(file)) {
            throw new IOException("not a regular file: " + file);
        }
        return Files.readAllBytes(file);
    }
}
