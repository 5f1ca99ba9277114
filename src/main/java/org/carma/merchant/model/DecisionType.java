package org.carma.merchant.model;

public enum DecisionType {
    BUY,
    SELL,
    HOLD
}
