package com.alterante.weave.protocol;

/**
 * Control commands carried in the first byte of a control packet payload.
 */
public enum ControlCommand {

    CONNECTION_REQUEST ((byte) 0x00),
    CONNECTION_CONFIRM ((byte) 0x01),
    ERROR              ((byte) 0x02);

    private final byte code;

    ControlCommand(byte code) {
        this.code = code;
    }

    public byte code() {
        return code;
    }

    /**
     * Look up a ControlCommand by its wire code.
     * @return the ControlCommand, or null if unknown
     */
    public static ControlCommand fromCode(byte code) {
        for (ControlCommand c : values()) {
            if (c.code == code) {
                return c;
            }
        }
        return null;
    }
}
