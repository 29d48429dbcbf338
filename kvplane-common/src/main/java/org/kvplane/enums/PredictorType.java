package org.kvplane.enums;

public enum PredictorType {
    CONSTANT,
    AUTOREGRESSIVE,
    SEASONAL
}
