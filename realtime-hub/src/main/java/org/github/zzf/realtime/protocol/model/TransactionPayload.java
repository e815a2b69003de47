package org.github.zzf.realtime.protocol.model;

import com.alibaba.fastjson.JSONObject;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * payload of {@link MessageKind#TRANSACTION_UPDATE}
 * <p>amount is kept as the producer formatted it ("0.5 SOL"), the Hub never does arithmetic on it.</p>
 */
@Value
@Builder
public class TransactionPayload {

    public static final String F_TX_ID = "tx_id";
    public static final String F_STATUS = "status";
    public static final String F_TIMESTAMP = "timestamp";
    public static final String F_AMOUNT = "amount";
    public static final String F_BLOCKCHAIN = "blockchain";
    public static final String F_FROM_ADDRESS = "from_address";
    public static final String F_TO_ADDRESS = "to_address";

    String txId;
    String status;
    Instant timestamp;
    String amount;
    String blockchain;
    String fromAddress;
    String toAddress;

    public JSONObject toJson() {
        JSONObject json = new JSONObject(true);
        json.put(F_TX_ID, txId);
        json.put(F_STATUS, status);
        json.put(F_TIMESTAMP, timestamp == null ? null : timestamp.toString());
        json.put(F_AMOUNT, amount);
        json.put(F_BLOCKCHAIN, blockchain);
        json.put(F_FROM_ADDRESS, fromAddress);
        json.put(F_TO_ADDRESS, toAddress);
        return json;
    }

    public static TransactionPayload fromJson(JSONObject json) {
        String txId = json.getString(F_TX_ID);
        if (txId == null) {
            throw new IllegalArgumentException(F_TX_ID + " is required");
        }
        String timestamp = json.getString(F_TIMESTAMP);
        return TransactionPayload.builder()
            .txId(txId)
            .status(json.getString(F_STATUS))
            .timestamp(timestamp == null ? null : Instant.parse(timestamp))
            .amount(json.getString(F_AMOUNT))
            .blockchain(json.getString(F_BLOCKCHAIN))
            .fromAddress(json.getString(F_FROM_ADDRESS))
            .toAddress(json.getString(F_TO_ADDRESS))
            .build();
    }

}
