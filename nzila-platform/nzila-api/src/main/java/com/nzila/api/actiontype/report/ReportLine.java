package com.nzila.api.actiontype.report;

import java.math.BigDecimal;

public record ReportLine(String label, long count, BigDecimal amount) {}
