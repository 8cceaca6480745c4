package com.loopPhones.ledger;

import java.util.Map;

/** Provenance ledger for digital passports. Failures surface as ServiceException. */
public interface PassportLedger {

    LedgerReceipt mint(String deviceId, String ownerAddress, Map<String, Object> metadata);

    LedgerReceipt record(String mintAddress, String eventType, Map<String, Object> payload);
}
