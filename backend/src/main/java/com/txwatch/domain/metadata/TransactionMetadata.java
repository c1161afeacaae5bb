package com.txwatch.domain.metadata;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.txwatch.domain.TransactionType;

/**
 * Caller-supplied details of a tracked transaction, one shape per transaction family.
 * Serialized with a {@code kind} discriminator.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = SwapMetadata.class, name = "swap"),
        @JsonSubTypes.Type(value = TransferMetadata.class, name = "transfer"),
        @JsonSubTypes.Type(value = StakeMetadata.class, name = "stake"),
        @JsonSubTypes.Type(value = LiquidityMetadata.class, name = "liquidity"),
        @JsonSubTypes.Type(value = GenericMetadata.class, name = "generic")
})
public interface TransactionMetadata {

    /** Whether this metadata shape may accompany a transaction of the given type. */
    boolean supports(TransactionType type);
}
