package com.swingtrading.model;

public enum PositionStatus {
    OPEN,
    CLOSED
}
