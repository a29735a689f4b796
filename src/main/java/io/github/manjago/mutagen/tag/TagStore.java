package io.github.manjago.mutagen.tag;

import io.github.manjago.mutagen.core.Program;

import java.util.Optional;

/**
 * Deferred binding between tag writes and tag references.
 * 
 * Owned by whatever executes programs: a {@code tag_exec_N} form writes its code
 * when reached, and a later {@code tagged_N} reads it back.
 */
public interface TagStore {
    
    /**
     * Bind {@code code} to {@code tag}, replacing any previous binding.
     */
    void write(int tag, Program code);
    
    /**
     * Code bound to the tag that best matches {@code tag}, or empty if nothing was written.
     */
    Optional<Program> read(int tag);
}
