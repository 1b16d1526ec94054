package com.apichain.model;

public enum Certainty {
    /** A value can be invented from the specification alone. */
    CERTAIN,
    /** A value must be harvested from another operation's response. */
    UNCERTAIN
}
