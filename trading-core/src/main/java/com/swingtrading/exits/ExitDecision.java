package com.swingtrading.exits;

import com.swingtrading.model.ExitReason;

/**
 * Exit chosen for a position on one bar and the price it fills at.
 */
public record ExitDecision(ExitReason reason, double price) {}
