package com.nzila.api.actiontype.report;

import com.nzila.api.proposal.FieldReader;
import com.nzila.api.proposal.ProposalSchema;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Payload of {@code finance.generate_report}.
 */
public class ReportProposalSchema implements ProposalSchema {

    public static final String PERIOD = "period";
    public static final String REPORT_KIND = "reportKind";
    public static final String CURRENCY = "currency";
    public static final String FORMAT = "format";

    static final Set<String> REPORT_KINDS = Set.of("billing_summary", "usage_summary", "dues_remittance");
    static final Set<String> FORMATS = Set.of("json", "csv");
    static final Pattern PERIOD_PATTERN = Pattern.compile("\\d{4}-(0[1-9]|1[0-2])");
    static final Pattern CURRENCY_PATTERN = Pattern.compile("[A-Z]{3}");

    @Override
    public Set<String> fieldNames() {
        return Set.of(PERIOD, REPORT_KIND, CURRENCY, FORMAT);
    }

    @Override
    public Map<String, Object> normalize(FieldReader reader) {
        Map<String, Object> fields = new LinkedHashMap<>();
        putIfValid(fields, PERIOD, reader.requiredMatching(PERIOD, PERIOD_PATTERN, "a month in YYYY-MM form"));
        putIfValid(fields, REPORT_KIND, reader.requiredOneOf(REPORT_KIND, REPORT_KINDS));
        putIfValid(fields, CURRENCY, reader.optionalMatching(CURRENCY, CURRENCY_PATTERN, "three upper-case letters", "CAD"));
        putIfValid(fields, FORMAT, reader.optionalOneOf(FORMAT, FORMATS, "json"));
        return fields;
    }

    @Override
    public Optional<String> periodLabel(Map<String, Object> normalized) {
        return Optional.ofNullable((String) normalized.get(PERIOD));
    }

    private static void putIfValid(Map<String, Object> fields, String name, Object value) {
        if (value != null) {
            fields.put(name, value);
        }
    }
}
