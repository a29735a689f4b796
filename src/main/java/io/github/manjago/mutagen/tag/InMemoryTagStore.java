package io.github.manjago.mutagen.tag;

import io.github.manjago.mutagen.core.Program;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Tag store with inexact matching.
 * 
 * A read for tag N returns the binding with the smallest tag >= N, wrapping around to
 * the smallest tag overall. Any reference therefore resolves once a single tag exists.
 */
public class InMemoryTagStore implements TagStore {
    
    private final TreeMap<Integer, Program> bindings = new TreeMap<>();
    
    @Override
    public void write(int tag, Program code) {
        bindings.put(tag, Objects.requireNonNull(code, "code"));
    }
    
    @Override
    public Optional<Program> read(int tag) {
        if (bindings.isEmpty()) {
            return Optional.empty();
        }
        Map.Entry<Integer, Program> entry = bindings.ceilingEntry(tag);
        if (entry == null) {
            entry = bindings.firstEntry();
        }
        return Optional.of(entry.getValue());
    }
    
    public int size() {
        return bindings.size();
    }
}
