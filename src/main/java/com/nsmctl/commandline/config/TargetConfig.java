package com.nsmctl.commandline.config;

/**
 * A downstream target a config points at (e.g. where events get sent). Only an enabled target is active.
 */
public interface TargetConfig {

    boolean isEnabled();

    void setEnabled(boolean enabled);
}
