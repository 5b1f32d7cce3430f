package com.example.socketrouter.shared.service.lifecycle;

@FunctionalInterface
public interface ConnectHook {

    void onConnect(SocketContext context) throws Exception;
}
