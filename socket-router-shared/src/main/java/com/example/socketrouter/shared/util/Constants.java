package com.example.socketrouter.shared.util;

public final class Constants {

    private Constants() {}

    /** Field injected into every outbound envelope, epoch milliseconds. */
    public static final String TIMESTAMP_KEY = "TIMESTAMP";

    /** Close code the transport reports when the server dropped the socket under load. */
    public static final int ABNORMAL_CLOSE_CODE = 1006;

    /**
     * Reserved action types exchanged over the wire.
     */
    public enum ActionType {
        /** server to client liveness probe */
        PING,
        /** client to server liveness reply */
        PING_RESPONSE,
        /** client to server handshake confirmation */
        HELLO,
        /** server to client handshake ack */
        GOT_HELLO,
        /** server to client, session lost, reconnect */
        RECONNECT,
        /** server to client routing or handler failure */
        ERROR
    }

    public static final class MdcKeys {
        private MdcKeys() {}
        public static final String CORRELATION_ID = "correlation_id";
        public static final String CONNECTION_ID = "connection_id";
        public static final String USER_ID = "user_id";
        public static final String SESSION_ID = "session_id";
        public static final String USER_IP = "user_ip";
        public static final String PATH = "path";
    }
}
