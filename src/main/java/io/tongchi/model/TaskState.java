package io.tongchi.model;

public enum TaskState {
    IDLE,
    RUNNING,
    DISABLED
}
