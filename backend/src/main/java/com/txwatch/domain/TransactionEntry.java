package com.txwatch.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.txwatch.domain.metadata.TransactionMetadata;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * One tracked signature and its confirmation outcome.
 * Status leaves PENDING at most once; the transition methods return false when the entry is already terminal.
 * Mutators and {@link #copy()} synchronize on the entry so readers always see a consistent snapshot.
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
@Getter
public class TransactionEntry {

    @JsonProperty
    private String id;
    @JsonProperty
    private String signature;
    @JsonProperty
    private TransactionType type;
    @JsonProperty
    private TransactionStatus status;
    @JsonProperty
    private Instant createdAt;
    @JsonProperty
    private String from;
    @JsonProperty
    private String to;
    @JsonProperty
    private BigDecimal amount;
    @JsonProperty
    private String token;
    @JsonProperty
    private BigDecimal fee;
    @JsonProperty
    private Long slot;
    @JsonProperty
    private Integer confirmations;
    @JsonProperty
    private String error;
    @JsonProperty
    private TransactionMetadata metadata;
    @JsonProperty
    private List<String> logMessages;
    /** Milliseconds from creation to the CONFIRMED transition; null unless confirmed by polling. */
    @JsonProperty
    private Long confirmationTimeMs;

    public static TransactionEntry pending(String id, String signature, TransactionType type, String from,
                                           TransactionMetadata metadata, Instant createdAt) {
        TransactionEntry e = new TransactionEntry();
        e.id = id;
        e.signature = signature;
        e.type = type != null ? type : TransactionType.UNKNOWN;
        e.status = TransactionStatus.PENDING;
        e.createdAt = createdAt;
        e.from = from;
        e.metadata = metadata;
        return e;
    }

    /**
     * Sets the counterparty, token and amount known at submission time.
     */
    public synchronized void describe(String to, String token, BigDecimal amount) {
        this.to = to;
        this.token = token;
        this.amount = amount;
    }

    public synchronized boolean confirm(Long slot, int confirmations, long confirmationTimeMs) {
        if (status != TransactionStatus.PENDING) {
            return false;
        }
        this.status = TransactionStatus.CONFIRMED;
        this.slot = slot;
        this.confirmations = confirmations;
        this.confirmationTimeMs = confirmationTimeMs;
        return true;
    }

    public synchronized boolean fail(String error, int confirmations) {
        if (status != TransactionStatus.PENDING) {
            return false;
        }
        this.status = TransactionStatus.FAILED;
        this.error = error;
        this.confirmations = confirmations;
        return true;
    }

    public synchronized boolean expire(String error) {
        if (status != TransactionStatus.PENDING) {
            return false;
        }
        this.status = TransactionStatus.EXPIRED;
        this.error = error;
        return true;
    }

    /**
     * Post-confirmation details. Never changes status; a null argument leaves the field as it was.
     */
    public synchronized void enrich(BigDecimal fee, List<String> logMessages, BigDecimal amount) {
        if (fee != null) {
            this.fee = fee;
        }
        if (logMessages != null) {
            this.logMessages = List.copyOf(logMessages);
        }
        if (amount != null) {
            this.amount = amount;
        }
    }

    public synchronized TransactionEntry copy() {
        TransactionEntry c = new TransactionEntry();
        c.id = id;
        c.signature = signature;
        c.type = type;
        c.status = status;
        c.createdAt = createdAt;
        c.from = from;
        c.to = to;
        c.amount = amount;
        c.token = token;
        c.fee = fee;
        c.slot = slot;
        c.confirmations = confirmations;
        c.error = error;
        c.metadata = metadata;
        c.logMessages = logMessages;
        c.confirmationTimeMs = confirmationTimeMs;
        return c;
    }

    @JsonIgnore
    public synchronized boolean isPending() {
        return status == TransactionStatus.PENDING;
    }
}
