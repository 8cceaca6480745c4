package com.loopPhones.ledger;

import com.loopPhones.exception.ServiceException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.util.HexFormat;
import java.util.Map;
import java.util.TreeMap;

/**
 * Ledger stand-in that issues deterministic receipts without talking to a chain.
 * Signatures are SHA-256 digests of the entry, so retries of the same entry
 * produce the same signature.
 */
@Slf4j
@Component
public class SimulatedPassportLedger implements PassportLedger {

    private final String network;
    private final String explorerBaseUrl;
    private final Clock clock;

    public SimulatedPassportLedger(@Value("${ledger.network:devnet}") String network,
            @Value("${ledger.explorer-base-url:https://explorer.solana.com/tx/}") String explorerBaseUrl,
            Clock clock) {
        this.network = network;
        this.explorerBaseUrl = explorerBaseUrl;
        this.clock = clock;
    }

    @Override
    public LedgerReceipt mint(String deviceId, String ownerAddress, Map<String, Object> metadata) {
        String mintAddress = "NFT" + digest(deviceId).substring(0, 24);
        String signature = "sig_" + digest(deviceId + "|" + ownerAddress);
        log.info("[Ledger:{}] Minted passport {} for device {}", network, mintAddress, deviceId);
        return receipt(mintAddress, signature, "minted");
    }

    @Override
    public LedgerReceipt record(String mintAddress, String eventType, Map<String, Object> payload) {
        Map<String, Object> ordered = payload == null ? Map.of() : new TreeMap<>(payload);
        String signature = "sig_event_" + digest(mintAddress + "|" + eventType + "|" + ordered);
        log.info("[Ledger:{}] Recorded {} for {}", network, eventType, mintAddress);
        return receipt(null, signature, eventType);
    }

    private LedgerReceipt receipt(String mintAddress, String signature, String eventType) {
        return LedgerReceipt.builder()
                .mintAddress(mintAddress)
                .transactionSignature(signature)
                .eventType(eventType)
                .network(network)
                .recordedAt(clock.instant())
                .explorerUrl(explorerBaseUrl + signature + "?cluster=" + network)
                .build();
    }

    private static String digest(String value) {
        try {
            MessageDigest sha256 = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(sha256.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new ServiceException("SHA-256 not available", e);
        }
    }
}
