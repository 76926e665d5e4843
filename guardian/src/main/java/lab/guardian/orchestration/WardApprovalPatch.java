package lab.guardian.orchestration;

import com.fasterxml.jackson.databind.JsonNode;
import lab.guardian.domain.wardapproval.WardApprovalStatus;

import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Validated body of {@code PATCH /ward-approvals/{id}}.
 * <p>
 * Keeps the difference between an absent field and an explicit {@code null}: only fields present in
 * the body end up in {@link #columns()}. Unknown fields are ignored; {@code event_version},
 * {@code responded_at} and the timestamps are never taken from the caller.
 */
public final class WardApprovalPatch {

    static final List<String> UPDATABLE_COLUMNS = List.of(
            "nonce",
            "resource_bounds_json",
            "tx_hash",
            "ward_sig_json",
            "ward_2fa_sig_json",
            "guardian_sig_json",
            "guardian_2fa_sig_json",
            "final_tx_hash",
            "error_message"
    );

    private static final List<String> HEX_COLUMNS = List.of("tx_hash", "final_tx_hash");

    private final WardApprovalStatus status;
    private final Map<String, Object> columns;

    private WardApprovalPatch(WardApprovalStatus status, Map<String, Object> columns) {
        this.status = status;
        this.columns = Collections.unmodifiableMap(columns);
    }

    public static WardApprovalPatch of(WardApprovalStatus status, Map<String, Object> columns) {
        return new WardApprovalPatch(status, new LinkedHashMap<>(columns));
    }

    public static WardApprovalPatch from(JsonNode body) {
        if (body == null || !body.isObject()) {
            throw new InvalidRequestException("Request body must be a JSON object");
        }

        WardApprovalStatus status = null;
        if (body.has("status")) {
            JsonNode node = body.get("status");
            if (!node.isTextual()) {
                throw new InvalidRequestException("status: Expected string");
            }
            try {
                status = WardApprovalStatus.fromWire(node.asText());
            } catch (IllegalArgumentException e) {
                throw new InvalidRequestException("status: Invalid enum value '" + node.asText() + "'");
            }
        }

        Map<String, Object> columns = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = body.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String name = field.getKey();
            if (!UPDATABLE_COLUMNS.contains(name)) {
                continue;
            }
            JsonNode value = field.getValue();
            if (value.isNull()) {
                columns.put(name, null);
            } else if (value.isTextual()) {
                if (HEX_COLUMNS.contains(name)) {
                    RequestChecks.requireHex(name, value.asText());
                }
                columns.put(name, value.asText());
            } else {
                throw new InvalidRequestException(name + ": Expected string or null");
            }
        }

        if (status == null && columns.isEmpty()) {
            throw new InvalidRequestException("Request body contains no updatable fields");
        }
        return new WardApprovalPatch(status, columns);
    }

    public WardApprovalStatus status() {
        return status;
    }

    public Map<String, Object> columns() {
        return columns;
    }
}
