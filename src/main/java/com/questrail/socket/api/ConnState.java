package com.questrail.socket.api;

/**
 * Connection lifecycle notifications delivered to an {@link InfoCallback}.
 *
 * <p>Servers and clients use the same values, which gives callers one
 * transport-agnostic event stream for metrics and logging. A stream client that
 * connects successfully reports {@link #DIAL} then {@link #NEW}; closing reports
 * {@link #CLOSE}.</p>
 */
public enum ConnState
{
    DIAL("Dial Connection"),
    NEW("New Connection"),
    READ("Read Incoming Stream"),
    CLOSE_READ("Close Incoming Stream"),
    HANDLER("Run Handler"),
    WRITE("Write Outgoing Stream"),
    CLOSE_WRITE("Close Outgoing Stream"),
    CLOSE("Close Connection");

    private final String label;

    ConnState(String label) {
        this.label = label;
    }

    /**
     * @return human-readable description, suitable for log lines
     */
    public String label() {
        return label;
    }
}
