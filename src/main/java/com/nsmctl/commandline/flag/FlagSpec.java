package com.nsmctl.commandline.flag;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Command-line projection of one parameter.
 */
@Value
@Builder(toBuilder = true)
public class FlagSpec {

    /**
     * Name of the parameter this flag fills; parsed values are keyed by it.
     */
    @NonNull
    String name;

    /**
     * Switches accepted for this flag, e.g. {@code --node-name}. The first one is the primary switch.
     */
    @Singular
    List<String> flags;

    boolean required;

    @NonNull
    ValueType valueType;

    @NonNull
    @Builder.Default
    Multiplicity multiplicity = Multiplicity.SINGLE;

    @NonNull
    @Builder.Default
    String helpText = "";

    Object defaultValue;

    public boolean isToggle() {
        return valueType == ValueType.NONE;
    }

    public boolean isMultiValued() {
        return multiplicity == Multiplicity.MANY;
    }

    public String getPrimaryFlag() {
        return flags.get(0);
    }
}
