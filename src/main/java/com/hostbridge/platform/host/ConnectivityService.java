package com.hostbridge.platform.host;

import com.hostbridge.platform.model.ConnectionType;

import java.util.concurrent.CompletableFuture;

public interface ConnectivityService {
    
    CompletableFuture<ConnectionType> connectionType();
}
