package com.nsmctl.commandline.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

/**
 * Ordered list of analyzers owned by a parent config object. Items are toggled in place; the collection is never
 * reordered and nothing is added or removed after construction.
 *
 * Not thread-safe.
 */
public class AnalyzerCollection implements Iterable<Analyzer> {

    private final List<Analyzer> analyzers;

    public AnalyzerCollection(List<Analyzer> analyzers) {
        this.analyzers = Collections.unmodifiableList(new ArrayList<>(analyzers));
    }

    public static AnalyzerCollection of(Analyzer... analyzers) {
        return new AnalyzerCollection(List.of(analyzers));
    }

    public Optional<Analyzer> find(int id) {
        return analyzers.stream().filter(a -> a.getId() == id).findFirst();
    }

    public List<Analyzer> getAnalyzers() {
        return analyzers;
    }

    public int size() {
        return analyzers.size();
    }

    public boolean isEmpty() {
        return analyzers.isEmpty();
    }

    @Override
    public Iterator<Analyzer> iterator() {
        return analyzers.iterator();
    }
}
