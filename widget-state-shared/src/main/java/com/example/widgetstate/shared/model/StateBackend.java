package com.example.widgetstate.shared.model;

public enum StateBackend {
    MEMORY,
    REDIS
}
