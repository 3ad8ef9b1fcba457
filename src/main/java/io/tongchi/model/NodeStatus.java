package io.tongchi.model;

public enum NodeStatus {
    NOT_LOADED,
    LOADING,
    LOADED,
    ERROR
}
