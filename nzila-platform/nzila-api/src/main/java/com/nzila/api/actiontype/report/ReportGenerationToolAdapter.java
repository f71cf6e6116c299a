package com.nzila.api.actiontype.report;

import com.nzila.api.execution.ArtifactRef;
import com.nzila.api.execution.ToolAdapter;
import com.nzila.api.execution.ToolCall;
import com.nzila.api.execution.ToolExecutionException;
import com.nzila.api.execution.ToolInvocation;
import com.nzila.api.execution.ToolResult;
import com.nzila.api.storage.BlobStoreException;
import com.nzila.api.storage.DocumentStorageService;
import com.nzila.core.domain.StoredDocument;
import com.nzila.core.hash.CanonicalJson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Renders a period report for an entity and stores it at
 * {@code {entityId}/reports/{period}/{reportKind}.{format}}.
 * A report already stored at that path is returned instead of being rendered again.
 */
@Component
public class ReportGenerationToolAdapter implements ToolAdapter {

    private static final Logger log = LoggerFactory.getLogger(ReportGenerationToolAdapter.class);

    private final DocumentStorageService documentStorage;
    private final ReportDataSource dataSource;
    private final BigDecimal unitCost;

    public ReportGenerationToolAdapter(DocumentStorageService documentStorage,
                                       ReportDataSource dataSource,
                                       @Value("${nzila.tools.report.unit-cost:0.05}") BigDecimal unitCost) {
        this.documentStorage = documentStorage;
        this.dataSource = dataSource;
        this.unitCost = unitCost;
    }

    @Override
    public ToolResult invoke(ToolInvocation invocation) {
        String period = invocation.string(ReportProposalSchema.PERIOD);
        String kind = invocation.string(ReportProposalSchema.REPORT_KIND);
        String currency = invocation.string(ReportProposalSchema.CURRENCY);
        String format = invocation.string(ReportProposalSchema.FORMAT);
        String path = reportPath(invocation.entityId(), period, kind, format);

        List<ToolCall> calls = new ArrayList<>();
        long started = System.nanoTime();
        Optional<StoredDocument> existing = documentStorage.findIntact(path);
        calls.add(new ToolCall("report.lookup", Map.of("path", path),
                Map.of("found", existing.isPresent()), elapsedMillis(started)));
        if (existing.isPresent()) {
            log.info("Report {} already generated, reusing document {}", path, existing.get().getId());
            return new ToolResult(List.of(ArtifactRef.of(existing.get())), calls, BigDecimal.ZERO);
        }

        started = System.nanoTime();
        List<ReportLine> lines = dataSource.lines(invocation.entityId(), period, kind);
        byte[] content = "csv".equals(format)
                ? renderCsv(lines, currency)
                : renderJson(invocation.entityId(), period, kind, currency, lines);

        StoredDocument document;
        try {
            document = documentStorage.store(invocation.entityId(), StoredDocument.CATEGORY_REPORT, path, content,
                    "csv".equals(format) ? "text/csv" : "application/json", invocation.actionId(), invocation.runId());
        } catch (BlobStoreException e) {
            throw new ToolExecutionException("Could not store report " + path + ": " + e.getMessage(), e);
        }

        Map<String, Object> input = new LinkedHashMap<>();
        input.put("reportKind", kind);
        input.put("period", period);
        input.put("currency", currency);
        input.put("format", format);
        calls.add(new ToolCall("report.render", input,
                Map.of("lineCount", lines.size(), "bytes", content.length, "documentId", document.getId().toString()),
                elapsedMillis(started)));
        return new ToolResult(List.of(ArtifactRef.of(document)), calls, unitCost);
    }

    static String reportPath(UUID entityId, String period, String kind, String format) {
        return entityId + "/reports/" + period + "/" + kind + "." + format;
    }

    private static byte[] renderJson(UUID entityId, String period, String kind, String currency, List<ReportLine> lines) {
        List<Map<String, Object>> rows = new ArrayList<>();
        BigDecimal total = BigDecimal.ZERO;
        for (ReportLine line : lines) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("label", line.label());
            row.put("count", line.count());
            row.put("amount", line.amount().toPlainString());
            rows.add(row);
            total = total.add(line.amount());
        }
        Map<String, Object> report = new LinkedHashMap<>();
        report.put("entityId", entityId.toString());
        report.put("period", period);
        report.put("reportKind", kind);
        report.put("currency", currency);
        report.put("lines", rows);
        report.put("total", total.toPlainString());
        return CanonicalJson.writeBytes(report);
    }

    private static byte[] renderCsv(List<ReportLine> lines, String currency) {
        StringBuilder csv = new StringBuilder("label,count,amount,currency\n");
        for (ReportLine line : lines) {
            csv.append(escape(line.label())).append(',')
                    .append(line.count()).append(',')
                    .append(line.amount().toPlainString()).append(',')
                    .append(currency).append('\n');
        }
        return csv.toString().getBytes(StandardCharsets.UTF_8);
    }

    private static String escape(String value) {
        if (value.contains(",") || value.contains("\"") || value.contains("\n")) {
            return '"' + value.replace("\"", "\"\"") + '"';
        }
        return value;
    }

    private static long elapsedMillis(long startedNanos) {
        return (System.nanoTime() - startedNanos) / 1_000_000;
    }
}
