package com.campaignkeeper.model;

import java.time.Instant;
import java.util.Objects;

/**
 * An unresolved plot hook. Threads are never removed; resolving only flips the flag.
 */
public record OpenThread(String text, Instant createdAt, boolean resolved) {

    public OpenThread {
        Objects.requireNonNull(createdAt, "createdAt");
        text = Texts.requireName(text, "Thread text");
    }

    public static OpenThread open(String text, Instant createdAt) {
        return new OpenThread(text, createdAt, false);
    }

    public OpenThread resolve() {
        return new OpenThread(text, createdAt, true);
    }
}
