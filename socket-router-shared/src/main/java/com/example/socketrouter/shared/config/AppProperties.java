package com.example.socketrouter.shared.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Data
@Validated
public class AppProperties {

    /**
     * Diagnostic mode sends handler stack traces back to the client and logs
     * abnormal disconnect details verbosely. Never enable in production.
     */
    private boolean diagnosticMode = false;

    private final Routing routing = new Routing();
    private final Sweep sweep = new Sweep();
    private final Connection connection = new Connection();

    @Data
    public static class Routing {
        @NotBlank
        private String routingKey = "type";
    }

    @Data
    public static class Sweep {
        private boolean enabled = true;
        @NotNull
        private Duration graceWindow = Duration.ofMinutes(5);
        @NotNull
        private Duration interval = Duration.ofSeconds(60);
    }

    @Data
    public static class Connection {
        @NotBlank
        private String realIpHeader = "x-real-ip";
        @NotBlank
        private String botHandlePrefix = "bot-";
        @NotBlank
        private String sessionCookie = "sessionid";
        // 0 means unlimited
        @PositiveOrZero
        private int maxConnectionsPerUser = 0;
    }
}
