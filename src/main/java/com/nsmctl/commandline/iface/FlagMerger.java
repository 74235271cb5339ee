package com.nsmctl.commandline.iface;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.nsmctl.commandline.flag.FlagSpec;

/**
 * Accumulates flags for one grammar under the first-wins rule: a flag whose name or any of whose switches
 * is already taken is dropped, and the earlier flag stays.
 *
 * Base (constructor) flags are offered before operation flags, so a constructor parameter always
 * wins over an operation parameter of the same name.
 */
public class FlagMerger {

    private static final Logger log = LoggerFactory.getLogger(FlagMerger.class);

    private final List<FlagSpec> accepted = new ArrayList<>();
    private final List<FlagSpec> skipped = new ArrayList<>();
    private final Set<String> takenNames = new HashSet<>();
    private final Set<String> takenSwitches = new HashSet<>();

    /**
     * @return true when the flag was added, false when it collided and was skipped
     */
    public boolean offer(FlagSpec flag) {
        boolean collides = takenNames.contains(flag.getName())
                || flag.getFlags().stream().anyMatch(takenSwitches::contains);
        if (collides) {
            log.debug("Skipping {}: already defined earlier in the grammar", flag.getPrimaryFlag());
            skipped.add(flag);
            return false;
        }
        takenNames.add(flag.getName());
        takenSwitches.addAll(flag.getFlags());
        accepted.add(flag);
        return true;
    }

    public boolean isTaken(String name) {
        return takenNames.contains(name);
    }

    public List<FlagSpec> getAccepted() {
        return List.copyOf(accepted);
    }

    public List<FlagSpec> getSkipped() {
        return List.copyOf(skipped);
    }
}
