package com.loopPhones.ledger;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/** Opaque proof that the ledger accepted an entry. Only logged and stored, never interpreted. */
@Value
@Builder
public class LedgerReceipt {
    /** Set for mint receipts only */
    String mintAddress;
    String transactionSignature;
    String eventType;
    String network;
    Instant recordedAt;
    String explorerUrl;
}
