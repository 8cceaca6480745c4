package com.loopPhones.ledger;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class SimulatedPassportLedgerTest {

    private static final Instant NOW = Instant.parse("2024-06-01T00:00:00Z");

    private final SimulatedPassportLedger ledger = new SimulatedPassportLedger(
            "devnet", "https://explorer.solana.com/tx/", Clock.fixed(NOW, ZoneOffset.UTC));

    @Test
    void mintIsDeterministicPerDevice() {
        LedgerReceipt first = ledger.mint("IMEI-1", "wallet", Map.of());
        LedgerReceipt again = ledger.mint("IMEI-1", "wallet", Map.of());
        LedgerReceipt other = ledger.mint("IMEI-2", "wallet", Map.of());

        assertThat(first.getMintAddress()).startsWith("NFT").hasSize(27).isEqualTo(again.getMintAddress());
        assertThat(first.getMintAddress()).isNotEqualTo(other.getMintAddress());
        assertThat(first.getTransactionSignature()).startsWith("sig_");
        assertThat(first.getEventType()).isEqualTo("minted");
        assertThat(first.getRecordedAt()).isEqualTo(NOW);
    }

    @Test
    void recordSignatureDependsOnPayloadNotKeyOrder() {
        LedgerReceipt a = ledger.record("NFTx", "repair", Map.of("a", 1, "b", 2));
        LedgerReceipt b = ledger.record("NFTx", "repair", Map.of("b", 2, "a", 1));
        LedgerReceipt c = ledger.record("NFTx", "repair", Map.of("a", 1, "b", 3));

        assertThat(a.getTransactionSignature()).startsWith("sig_event_").isEqualTo(b.getTransactionSignature());
        assertThat(a.getTransactionSignature()).isNotEqualTo(c.getTransactionSignature());
        assertThat(a.getMintAddress()).isNull();
        assertThat(a.getExplorerUrl())
                .isEqualTo("https://explorer.solana.com/tx/" + a.getTransactionSignature() + "?cluster=devnet");
    }
}
