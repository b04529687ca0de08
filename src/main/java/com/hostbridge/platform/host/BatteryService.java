package com.hostbridge.platform.host;

import com.hostbridge.platform.model.BatteryStatus;

import java.util.concurrent.CompletableFuture;

public interface BatteryService {
    
    CompletableFuture<BatteryStatus> status();
}
