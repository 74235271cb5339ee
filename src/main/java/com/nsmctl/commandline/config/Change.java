package com.nsmctl.commandline.config;

import lombok.NonNull;
import lombok.Value;

/**
 * One field or item mutated during an execution pass.
 */
@Value
public class Change {

    /**
     * Field name, or the item id for analyzers.
     */
    @NonNull
    String key;

    Object oldValue;
    Object newValue;
}
