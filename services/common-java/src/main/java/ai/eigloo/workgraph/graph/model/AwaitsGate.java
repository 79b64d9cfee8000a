package ai.eigloo.workgraph.graph.model;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Gate settings carried in the metadata of an {@code awaits} edge.
 *
 * <p>Only the fields relevant to {@link #gateType()} are populated. Use
 * {@link #fromMetadata(Map)} to read and validate edge metadata.</p>
 */
public record AwaitsGate(
        GateType gateType,
        Instant waitUntil,
        List<String> requiredApprovers,
        Integer approvalCount,
        List<String> currentApprovers,
        String externalSystem,
        String externalId,
        String webhookUrl,
        String callbackId,
        boolean satisfied) {

    public static final String GATE_TYPE = "gateType";
    public static final String WAIT_UNTIL = "waitUntil";
    public static final String REQUIRED_APPROVERS = "requiredApprovers";
    public static final String APPROVAL_COUNT = "approvalCount";
    public static final String CURRENT_APPROVERS = "currentApprovers";
    public static final String EXTERNAL_SYSTEM = "externalSystem";
    public static final String EXTERNAL_ID = "externalId";
    public static final String WEBHOOK_URL = "webhookUrl";
    public static final String CALLBACK_ID = "callbackId";
    public static final String SATISFIED = "satisfied";

    public AwaitsGate {
        if (gateType == null) {
            throw new IllegalArgumentException("Gate type cannot be null");
        }
        requiredApprovers = requiredApprovers == null ? List.of() : List.copyOf(requiredApprovers);
        currentApprovers = currentApprovers == null ? List.of() : List.copyOf(currentApprovers);
        switch (gateType) {
            case TIMER -> {
                if (waitUntil == null) {
                    throw new IllegalArgumentException("Timer gate requires waitUntil");
                }
            }
            case APPROVAL -> {
                if (requiredApprovers.isEmpty()) {
                    throw new IllegalArgumentException("Approval gate requires at least one required approver");
                }
                for (String approver : requiredApprovers) {
                    if (approver == null || approver.isEmpty()) {
                        throw new IllegalArgumentException("Required approvers must be non-empty ids");
                    }
                }
                if (approvalCount != null
                        && (approvalCount < 1 || approvalCount > requiredApprovers.size())) {
                    throw new IllegalArgumentException("approvalCount must be between 1 and "
                            + requiredApprovers.size() + ", got " + approvalCount);
                }
            }
            case EXTERNAL -> {
                if (externalSystem == null || externalSystem.isEmpty()) {
                    throw new IllegalArgumentException("External gate requires externalSystem");
                }
                if (externalId == null || externalId.isEmpty()) {
                    throw new IllegalArgumentException("External gate requires externalId");
                }
            }
            case WEBHOOK -> {
                // all webhook fields are optional
            }
        }
    }

    public static AwaitsGate timer(Instant waitUntil) {
        return new AwaitsGate(GateType.TIMER, waitUntil, null, null, null, null, null, null, null, false);
    }

    public static AwaitsGate approval(List<String> requiredApprovers, Integer approvalCount,
                                      List<String> currentApprovers) {
        return new AwaitsGate(GateType.APPROVAL, null, requiredApprovers, approvalCount, currentApprovers,
                null, null, null, null, false);
    }

    public static AwaitsGate external(String externalSystem, String externalId, boolean satisfied) {
        return new AwaitsGate(GateType.EXTERNAL, null, null, null, null, externalSystem, externalId,
                null, null, satisfied);
    }

    public static AwaitsGate webhook(String webhookUrl, String callbackId, boolean satisfied) {
        return new AwaitsGate(GateType.WEBHOOK, null, null, null, null, null, null,
                webhookUrl, callbackId, satisfied);
    }

    /**
     * Returns a copy marked satisfied. Only external and webhook gates are satisfied explicitly.
     */
    public AwaitsGate markSatisfied() {
        if (gateType != GateType.EXTERNAL && gateType != GateType.WEBHOOK) {
            throw new IllegalArgumentException("Only external and webhook gates can be marked satisfied, not "
                    + gateType.value());
        }
        return new AwaitsGate(gateType, waitUntil, requiredApprovers, approvalCount, currentApprovers,
                externalSystem, externalId, webhookUrl, callbackId, true);
    }

    /**
     * Returns a copy with {@code approverId} added to the current approvers. Approving twice
     * has no further effect.
     */
    public AwaitsGate withApproval(String approverId) {
        if (gateType != GateType.APPROVAL) {
            throw new IllegalArgumentException("Approvals apply only to approval gates, not " + gateType.value());
        }
        if (!requiredApprovers.contains(approverId)) {
            throw new IllegalArgumentException(approverId + " is not a required approver");
        }
        if (currentApprovers.contains(approverId)) {
            return this;
        }
        List<String> approvers = new ArrayList<>(currentApprovers);
        approvers.add(approverId);
        return new AwaitsGate(gateType, waitUntil, requiredApprovers, approvalCount, approvers,
                externalSystem, externalId, webhookUrl, callbackId, satisfied);
    }

    /**
     * Number of approvals needed; defaults to every required approver.
     */
    public int requiredApprovalCount() {
        return approvalCount != null ? approvalCount : requiredApprovers.size();
    }

    /**
     * Reads gate settings from edge metadata.
     *
     * @return empty when the metadata names no gate type
     * @throws IllegalArgumentException when a gate type is present but its settings are malformed
     */
    public static Optional<AwaitsGate> fromMetadata(Map<String, Object> metadata) {
        if (metadata == null || !metadata.containsKey(GATE_TYPE)) {
            return Optional.empty();
        }
        GateType gateType = GateType.fromValue(asString(metadata.get(GATE_TYPE), GATE_TYPE));
        return Optional.of(new AwaitsGate(
                gateType,
                asInstant(metadata.get(WAIT_UNTIL)),
                asStringList(metadata.get(REQUIRED_APPROVERS), REQUIRED_APPROVERS),
                asInteger(metadata.get(APPROVAL_COUNT)),
                asStringList(metadata.get(CURRENT_APPROVERS), CURRENT_APPROVERS),
                asString(metadata.get(EXTERNAL_SYSTEM), EXTERNAL_SYSTEM),
                asString(metadata.get(EXTERNAL_ID), EXTERNAL_ID),
                asString(metadata.get(WEBHOOK_URL), WEBHOOK_URL),
                asString(metadata.get(CALLBACK_ID), CALLBACK_ID),
                asBoolean(metadata.get(SATISFIED))));
    }

    /**
     * Returns the metadata form of this gate, omitting unset fields.
     */
    public Map<String, Object> toMetadata() {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(GATE_TYPE, gateType.value());
        if (waitUntil != null) {
            metadata.put(WAIT_UNTIL, waitUntil.toString());
        }
        if (!requiredApprovers.isEmpty()) {
            metadata.put(REQUIRED_APPROVERS, requiredApprovers);
        }
        if (approvalCount != null) {
            metadata.put(APPROVAL_COUNT, approvalCount);
        }
        if (!currentApprovers.isEmpty()) {
            metadata.put(CURRENT_APPROVERS, currentApprovers);
        }
        if (externalSystem != null) {
            metadata.put(EXTERNAL_SYSTEM, externalSystem);
        }
        if (externalId != null) {
            metadata.put(EXTERNAL_ID, externalId);
        }
        if (webhookUrl != null) {
            metadata.put(WEBHOOK_URL, webhookUrl);
        }
        if (callbackId != null) {
            metadata.put(CALLBACK_ID, callbackId);
        }
        if (gateType == GateType.EXTERNAL || gateType == GateType.WEBHOOK) {
            metadata.put(SATISFIED, satisfied);
        }
        return metadata;
    }

    private static String asString(Object value, String field) {
        if (value == null) {
            return null;
        }
        if (!(value instanceof String text)) {
            throw new IllegalArgumentException(field + " must be a string");
        }
        return text;
    }

    private static Instant asInstant(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Instant instant) {
            return instant;
        }
        try {
            return Instant.parse(value.toString());
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("waitUntil must be an ISO-8601 instant: " + value, e);
        }
    }

    private static Integer asInteger(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Number number && number.doubleValue() == Math.rint(number.doubleValue())) {
            return number.intValue();
        }
        throw new IllegalArgumentException("approvalCount must be an integer");
    }

    private static boolean asBoolean(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean flag) {
            return flag;
        }
        throw new IllegalArgumentException("satisfied must be a boolean");
    }

    private static List<String> asStringList(Object value, String field) {
        if (value == null) {
            return null;
        }
        if (!(value instanceof Collection<?> items)) {
            throw new IllegalArgumentException(field + " must be a list of ids");
        }
        List<String> result = new ArrayList<>(items.size());
        for (Object item : items) {
            if (!(item instanceof String id)) {
                throw new IllegalArgumentException(field + " must contain only string ids");
            }
            result.add(id);
        }
        return result;
    }
}
