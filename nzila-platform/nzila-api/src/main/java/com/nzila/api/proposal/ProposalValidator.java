package com.nzila.api.proposal;

import com.nzila.api.registry.ActionTypeDefinition;
import com.nzila.api.registry.ActionTypeRegistry;
import com.nzila.core.hash.CanonicalJson;
import com.nzila.core.hash.ContentHashing;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Validates a raw proposal against the envelope and its action type's schema.
 * Pure: nothing is persisted or audited here.
 */
@Component
public class ProposalValidator {

    public static final String ENTITY_ID = "entityId";
    public static final String APP_KEY = "appKey";
    public static final String PROFILE_KEY = "profileKey";
    public static final String REQUESTED_BY = "requestedBy";
    public static final String DATA_CLASS = "dataClass";
    public static final String EVIDENCE_PACK_ELIGIBLE = "evidencePackEligible";

    public static final Set<String> DATA_CLASSES =
            Set.of("public", "internal", "confidential", "sensitive", "regulated");

    private static final Set<String> ENVELOPE_FIELDS =
            Set.of(ENTITY_ID, APP_KEY, PROFILE_KEY, REQUESTED_BY, DATA_CLASS, EVIDENCE_PACK_ELIGIBLE);

    private final ActionTypeRegistry registry;

    public ProposalValidator(ActionTypeRegistry registry) {
        this.registry = registry;
    }

    /**
     * @throws com.nzila.api.registry.UnknownActionTypeException if no type is registered under the key
     * @throws ProposalValidationException listing every offending field
     */
    public ValidatedProposal validate(String actionType, Map<String, Object> payload) {
        ActionTypeDefinition definition = registry.require(actionType);
        ProposalSchema schema = definition.schema();
        Map<String, Object> raw = payload == null ? Map.of() : payload;

        List<FieldViolation> violations = new ArrayList<>();
        FieldReader reader = new FieldReader(raw, violations);

        Set<String> known = new HashSet<>(ENVELOPE_FIELDS);
        known.addAll(schema.fieldNames());
        raw.keySet().stream()
                .filter(key -> !known.contains(key))
                .sorted()
                .forEach(key -> reader.addViolation(key, FieldViolation.UNKNOWN_FIELD, key + " is not a recognised field"));

        UUID entityId = reader.requiredUuid(ENTITY_ID);
        String appKey = reader.requiredString(APP_KEY, 120);
        String profileKey = reader.requiredString(PROFILE_KEY, 120);
        String requestedBy = reader.requiredString(REQUESTED_BY, 200);
        String dataClass = schema.requiresDataClass()
                ? reader.requiredOneOf(DATA_CLASS, DATA_CLASSES)
                : reader.optionalOneOf(DATA_CLASS, DATA_CLASSES, null);
        Boolean evidencePackEligible = reader.optionalBoolean(EVIDENCE_PACK_ELIGIBLE, true);

        Map<String, Object> fields = schema.normalize(reader);

        if (!violations.isEmpty()) {
            throw new ProposalValidationException(actionType, violations);
        }

        Map<String, Object> canonical = new TreeMap<>(fields);
        canonical.put(ENTITY_ID, entityId.toString());
        canonical.put(APP_KEY, appKey);
        canonical.put(PROFILE_KEY, profileKey);
        canonical.put(REQUESTED_BY, requestedBy);
        if (dataClass != null) {
            canonical.put(DATA_CLASS, dataClass);
        }
        canonical.put(EVIDENCE_PACK_ELIGIBLE, evidencePackEligible);
        canonical.put("actionType", actionType);
        String canonicalJson = CanonicalJson.write(canonical);

        return new ValidatedProposal(
                actionType,
                entityId,
                appKey,
                profileKey,
                requestedBy,
                dataClass,
                evidencePackEligible,
                Map.copyOf(fields),
                schema.periodLabel(fields).orElse(null),
                canonicalJson,
                ContentHashing.sha256(canonicalJson)
        );
    }
}
