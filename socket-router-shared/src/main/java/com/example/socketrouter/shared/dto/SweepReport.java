package com.example.socketrouter.shared.dto;

import lombok.Value;

@Value
public class SweepReport {
    int pinged;
    int purged;
}
