package com.example.socketrouter.shared.service.log;

import com.example.socketrouter.shared.dto.Envelope;
import com.example.socketrouter.shared.model.SocketConnection;
import com.example.socketrouter.shared.service.group.ConnectionGroup;
import com.example.socketrouter.shared.spi.IoMessageLogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class Slf4jIoMessageLogger implements IoMessageLogger {

    private static final Logger log = LoggerFactory.getLogger("socket.io");

    @Override
    public void logInbound(SocketConnection connection, Envelope envelope, String route, boolean unknown) {
        if (unknown) {
            log.debug("<<< [{}] UNKNOWN {}", describe(connection), envelope);
        } else if (log.isDebugEnabled()) {
            log.debug("<<< [{}] -> {} {}", describe(connection), route, envelope);
        }
    }

    @Override
    public void logOutbound(SocketConnection connection, Envelope envelope) {
        if (log.isDebugEnabled()) {
            log.debug(">>> [{}] {}", describe(connection), envelope);
        }
    }

    @Override
    public void logBroadcast(ConnectionGroup group, Envelope envelope) {
        if (log.isDebugEnabled()) {
            log.debug(">>> [group {} x{}] {}", group.getId(), group.size(), envelope);
        }
    }

    private static String describe(SocketConnection connection) {
        return connection != null ? connection.toString() : "<detached>";
    }
}
