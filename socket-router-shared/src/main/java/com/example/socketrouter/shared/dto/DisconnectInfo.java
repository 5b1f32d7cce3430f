package com.example.socketrouter.shared.dto;

import lombok.AllArgsConstructor;
import lombok.Value;

@Value
@AllArgsConstructor(staticName = "of")
public class DisconnectInfo {
    String handle;
    int code;
    String reason;
}
