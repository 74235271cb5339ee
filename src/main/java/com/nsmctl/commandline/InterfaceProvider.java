package com.nsmctl.commandline;

import com.nsmctl.commandline.iface.CommandSuite;

/**
 * Service contributing built interfaces to the top-level command suite.
 *
 * Implementations are discovered through {@link java.util.ServiceLoader} and listed in
 * {@code META-INF/services/com.nsmctl.commandline.InterfaceProvider}.
 */
public interface InterfaceProvider {

    /**
     * Registers this provider's interfaces under their sub-command names.
     */
    void contribute(CommandSuite suite);
}
