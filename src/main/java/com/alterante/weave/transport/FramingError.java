package com.alterante.weave.transport;

/**
 * Violations detected on the inbound packet stream. None of them closes the connection;
 * partial reassembly state is discarded and the stream waits for the next first packet.
 */
public enum FramingError {
    MALFORMED_PACKET,           // undecodable bytes from the transport
    UNEXPECTED_FIRST_PACKET,    // a new message started before the previous one finished
    UNEXPECTED_CONTINUATION,    // a continuation arrived with no message in progress
    SEQUENCE_GAP,               // counter skipped (loss) or repeated (duplicate)
    MESSAGE_TOO_LARGE           // more packets than one inbound message may span
}
