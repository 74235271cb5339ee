package com.nsmctl.commandline.flag;

public enum Multiplicity {
    /** Exactly one value (or none, for toggles). */
    SINGLE,
    /** One or more values. */
    MANY
}
