package com.chambua.inventory.service;

import com.chambua.inventory.importing.RowError;
import com.chambua.inventory.model.ImportError;
import com.chambua.inventory.model.ImportRun;
import com.chambua.inventory.repository.ImportErrorRepository;
import com.chambua.inventory.repository.ImportRunRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/** Persists the audit trail of a submission in a transaction of its own. */
@Service
public class ImportRunRecorder {

    private final ImportRunRepository importRunRepository;
    private final ImportErrorRepository importErrorRepository;

    public ImportRunRecorder(ImportRunRepository importRunRepository, ImportErrorRepository importErrorRepository) {
        this.importRunRepository = importRunRepository;
        this.importErrorRepository = importErrorRepository;
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public ImportRun record(ImportRun run, List<RowError> rowErrors) {
        ImportRun saved = importRunRepository.save(run);
        if (!rowErrors.isEmpty()) {
            Instant now = Instant.now();
            List<ImportError> errors = new ArrayList<>(rowErrors.size());
            for (RowError e : rowErrors) {
                ImportError err = new ImportError();
                err.setImportRun(saved);
                err.setRowNumber(e.row());
                err.setColumnName(e.column());
                err.setErrorType(e.type().name());
                err.setReason(e.message());
                err.setCreatedAt(now);
                errors.add(err);
            }
            importErrorRepository.saveAll(errors);
        }
        return saved;
    }
}
