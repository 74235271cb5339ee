package com.nsmctl.commandline.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Changes recorded by one execution pass, in the order they were made.
 */
public class ChangeSet {

    private final List<Change> changes = new ArrayList<>();

    public void record(String key, Object oldValue, Object newValue) {
        changes.add(new Change(key, oldValue, newValue));
    }

    public boolean isEmpty() {
        return changes.isEmpty();
    }

    public int size() {
        return changes.size();
    }

    public List<Change> getChanges() {
        return Collections.unmodifiableList(changes);
    }

    public List<String> keys() {
        return changes.stream().map(Change::getKey).toList();
    }

    public Optional<Change> find(String key) {
        return changes.stream().filter(c -> c.getKey().equals(key)).findFirst();
    }

    public boolean contains(String key) {
        return find(key).isPresent();
    }

    @Override
    public String toString() {
        return changes.stream()
                .map(c -> c.getKey() + ": " + c.getOldValue() + " -> " + c.getNewValue())
                .collect(Collectors.joining(System.lineSeparator()));
    }
}
