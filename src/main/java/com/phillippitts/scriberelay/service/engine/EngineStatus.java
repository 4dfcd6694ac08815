package com.phillippitts.scriberelay.service.engine;

public enum EngineStatus {
    IDLE,
    CONNECTING,
    READY,
    ERROR,
    FALLBACK
}
