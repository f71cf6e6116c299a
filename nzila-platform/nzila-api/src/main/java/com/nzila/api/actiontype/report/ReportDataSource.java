package com.nzila.api.actiontype.report;

import java.util.List;
import java.util.UUID;

/**
 * Supplies the rows of a generated report.
 */
public interface ReportDataSource {

    List<ReportLine> lines(UUID entityId, String period, String reportKind);
}
