package org.github.zzf.realtime.protocol.model;

import com.alibaba.fastjson.JSONObject;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * payload of {@link MessageKind#AGENT_STATUS}
 */
@Value
@Builder
public class AgentStatusPayload {

    public static final String F_AGENT_ID = "agent_id";
    public static final String F_STATUS = "status";
    public static final String F_LAST_UPDATED = "last_updated";
    public static final String F_DETAILS = "details";

    String agentId;
    String status;
    Instant lastUpdated;
    String details;

    public JSONObject toJson() {
        JSONObject json = new JSONObject(true);
        json.put(F_AGENT_ID, agentId);
        json.put(F_STATUS, status);
        json.put(F_LAST_UPDATED, lastUpdated == null ? null : lastUpdated.toString());
        json.put(F_DETAILS, details);
        return json;
    }

    public static AgentStatusPayload fromJson(JSONObject json) {
        String agentId = json.getString(F_AGENT_ID);
        if (agentId == null) {
            throw new IllegalArgumentException(F_AGENT_ID + " is required");
        }
        String lastUpdated = json.getString(F_LAST_UPDATED);
        return AgentStatusPayload.builder()
            .agentId(agentId)
            .status(json.getString(F_STATUS))
            .lastUpdated(lastUpdated == null ? null : Instant.parse(lastUpdated))
            .details(json.getString(F_DETAILS))
            .build();
    }

}
