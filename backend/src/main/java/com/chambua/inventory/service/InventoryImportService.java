package com.chambua.inventory.service;

import com.chambua.inventory.auth.CallerContext;
import com.chambua.inventory.auth.Permission;
import com.chambua.inventory.config.ImportSettings;
import com.chambua.inventory.dto.ImportReportDTO;
import com.chambua.inventory.importing.*;
import com.chambua.inventory.model.ImportRun;
import com.chambua.inventory.repository.InventoryStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;

/**
 * Runs one CSV submission through the import pipeline: decode, header check, per-row
 * normalization and reference resolution, reconciliation against the stored SKUs, and a
 * single atomic commit. Row problems are collected into the report; problems with the file
 * as a whole abort the submission and are reported as a failure.
 */
@Service
public class InventoryImportService {

    private static final Logger log = LoggerFactory.getLogger(InventoryImportService.class);

    private final CsvDecoder decoder;
    private final RowNormalizer normalizer;
    private final ReferenceResolver resolver;
    private final ReconciliationEngine reconciliationEngine;
    private final ImportCommitter committer;
    private final InventoryStore store;
    private final ImportRunRecorder recorder;
    private final ImportSettings settings;

    public InventoryImportService(CsvDecoder decoder,
                                  RowNormalizer normalizer,
                                  ReferenceResolver resolver,
                                  ReconciliationEngine reconciliationEngine,
                                  ImportCommitter committer,
                                  InventoryStore store,
                                  ImportRunRecorder recorder,
                                  ImportSettings settings) {
        this.decoder = decoder;
        this.normalizer = normalizer;
        this.resolver = resolver;
        this.reconciliationEngine = reconciliationEngine;
        this.committer = committer;
        this.store = store;
        this.recorder = recorder;
        this.settings = settings;
    }

    /**
     * @throws com.chambua.inventory.auth.PermissionDeniedException when the caller may not
     *         manage inventory; nothing is read or recorded in that case
     */
    public ImportReportDTO importFile(byte[] content, String filename, CallerContext caller) {
        caller.require(Permission.MANAGE_INVENTORY);

        ImportRun run = new ImportRun();
        run.setFileHash(sha256Hex(content));
        run.setFilename(filename);
        run.setCreatedBy(caller.username());
        run.setStartedAt(Instant.now());

        List<RowError> errors = new ArrayList<>();
        String encoding = null;
        ImportReportDTO report;
        try {
            if (content.length > settings.getMaxFileBytes()) {
                throw new SubmissionLimitException("File exceeds the maximum size of " + settings.getMaxFileBytes() + " bytes");
            }
            DecodedTable table = decoder.decode(content);
            encoding = table.encoding();
            ColumnLayout layout = ColumnLayout.fromHeader(table.header());
            List<List<String>> dataRows = table.dataRows();
            if (dataRows.size() > settings.getMaxRows()) {
                throw new SubmissionLimitException("File has " + dataRows.size() + " data rows; the maximum is " + settings.getMaxRows());
            }

            ReferenceSnapshot references = store.loadReferenceSnapshot();
            Set<String> existingSkus = store.loadExistingSkus();

            List<ResolvedRow> accepted = new ArrayList<>();
            for (int i = 0; i < dataRows.size(); i++) {
                List<String> cells = dataRows.get(i);
                int rowNumber = i + 1;
                if (RowNormalizer.isBlank(cells)) continue;
                RowResult<NormalizedRow> normalized = normalizer.normalize(rowNumber, cells, layout);
                if (!normalized.isOk()) {
                    errors.add(normalized.error());
                    continue;
                }
                RowResult<ResolvedRow> resolved = resolver.resolve(normalized.value(), references, caller.defaultLocationId());
                if (!resolved.isOk()) {
                    errors.add(resolved.error());
                    continue;
                }
                accepted.add(resolved.value());
            }

            ReconciliationPlan plan = reconciliationEngine.reconcile(accepted, existingSkus, caller.defaultLocationId());
            errors.addAll(plan.rejections());
            errors.sort(Comparator.comparingInt(RowError::row));

            CommitResult result = committer.commit(plan, caller.username());
            String message = summary(result, errors.size(), plan.superseded());
            report = ImportReportDTO.ok(result.created(), result.updated(), errors, encoding, message);
            log.info("Import of '{}' by {} ({}): {}", filename, caller.username(), encoding, message);
        } catch (ImportAbortedException e) {
            log.warn("Import of '{}' by {} aborted ({}): {}", filename, caller.username(), e.kind(), e.getMessage());
            report = ImportReportDTO.fail(e.kind(), e.getMessage(), errors, encoding);
        }

        recordRun(run, report, errors);
        return report;
    }

    private void recordRun(ImportRun run, ImportReportDTO report, List<RowError> errors) {
        run.setEncodingUsed(report.getEncodingUsed());
        run.setRowsProcessed(report.getTotalProcessed());
        run.setRowsCreated(report.getImportedCount());
        run.setRowsUpdated(report.getUpdatedCount());
        run.setRowsFailed(errors.size());
        run.setFailureKind(report.getFailure() != null ? report.getFailure().name() : null);
        run.setMessage(truncate(report.getMessage(), 1000));
        run.setStatus(report.isSuccess() ? ImportRun.STATUS_COMPLETED : ImportRun.STATUS_FAILED);
        run.setFinishedAt(Instant.now());
        try {
            recorder.record(run, errors);
        } catch (DataAccessException e) {
            // the import outcome stands even when its audit record cannot be written
            log.warn("Could not record import run for '{}': {}", run.getFilename(), e.getMessage());
        }
    }

    private static String summary(CommitResult result, int errorCount, int superseded) {
        StringBuilder sb = new StringBuilder("Imported ")
                .append(result.created()).append(" new items, updated ")
                .append(result.updated()).append(" items");
        if (errorCount > 0) sb.append(", ").append(errorCount).append(" rows had errors");
        if (superseded > 0) sb.append(", ").append(superseded).append(" duplicate SKU rows superseded by later rows");
        return sb.toString();
    }

    private static String truncate(String s, int max) {
        if (s == null || s.length() <= max) return s;
        return s.substring(0, max);
    }

    private static String sha256Hex(byte[] bytes) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] digest = md.digest(bytes);
            StringBuilder sb = new StringBuilder();
            for (byte b : digest) sb.append(String.format("%02x", b));
            return sb.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(e);
        }
    }
}
