package com.nsmctl.commandline.config;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * One addressable sub-item of a config object, e.g. a Zeek script or a Suricata rule-set.
 */
@Data
@AllArgsConstructor
public class Analyzer {

    private final int id;
    private final String name;
    private boolean enabled;

    /**
     * Optional statement associated with the item (e.g. a redef); null when the item has none.
     */
    private String value;

    public Analyzer(int id, String name, boolean enabled) {
        this(id, name, enabled, null);
    }

    public Analyzer copy() {
        return new Analyzer(id, name, enabled, value);
    }
}
