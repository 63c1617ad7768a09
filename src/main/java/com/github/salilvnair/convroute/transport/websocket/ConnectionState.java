package com.github.salilvnair.convroute.transport.websocket;

public enum ConnectionState {
    CONNECTING,
    OPEN,
    CLOSING,
    CLOSED
}
