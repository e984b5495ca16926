package com.phillippitts.voicejukebox.service.queue;

import java.util.Objects;

/**
 * Write permit issued by {@link PlaybackQueue#openLease(String)} to one background writer.
 *
 * <p>Once {@link PlaybackQueue#revokeLease(WriteLease) revoked}, every later append through the lease
 * is rejected. Revocation and appends are serialized by the queue lock, so no write from a revoked
 * lease can land after {@code revokeLease} returns.
 */
public final class WriteLease {

    private final String holder;
    private final PlaybackQueue issuer;
    private volatile boolean revoked;

    WriteLease(String holder, PlaybackQueue issuer) {
        this.holder = Objects.requireNonNull(holder, "holder");
        this.issuer = Objects.requireNonNull(issuer, "issuer");
    }

    /** Identifier of the writer holding this lease (the populator job id). */
    public String holder() {
        return holder;
    }

    public boolean isRevoked() {
        return revoked;
    }

    boolean issuedBy(PlaybackQueue queue) {
        return issuer == queue;
    }

    void revoke() {
        revoked = true;
    }

    @Override
    public String toString() {
        return "WriteLease[" + holder + (revoked ? ", revoked]" : "]");
    }
}
