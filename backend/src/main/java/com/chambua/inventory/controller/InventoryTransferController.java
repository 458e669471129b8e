package com.chambua.inventory.controller;

import com.chambua.inventory.auth.CallerContext;
import com.chambua.inventory.auth.CallerResolver;
import com.chambua.inventory.auth.Permission;
import com.chambua.inventory.auth.PermissionDeniedException;
import com.chambua.inventory.dto.ImportErrorDTO;
import com.chambua.inventory.dto.ImportReportDTO;
import com.chambua.inventory.dto.ImportRunSummaryDTO;
import com.chambua.inventory.importing.ImportFailureKind;
import com.chambua.inventory.model.ImportRun;
import com.chambua.inventory.repository.ImportErrorRepository;
import com.chambua.inventory.repository.ImportRunRepository;
import com.chambua.inventory.service.InventoryExportService;
import com.chambua.inventory.service.InventoryExportService.ExportFile;
import com.chambua.inventory.service.InventoryImportService;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.server.ResponseStatusException;

import java.io.IOException;
import java.util.List;

@RestController
@RequestMapping("/api/inventory")
public class InventoryTransferController {

    static final MediaType TEXT_CSV = MediaType.parseMediaType("text/csv;charset=UTF-8");

    private final InventoryImportService importService;
    private final InventoryExportService exportService;
    private final CallerResolver callerResolver;
    private final ImportRunRepository importRunRepository;
    private final ImportErrorRepository importErrorRepository;

    public InventoryTransferController(InventoryImportService importService,
                                       InventoryExportService exportService,
                                       CallerResolver callerResolver,
                                       ImportRunRepository importRunRepository,
                                       ImportErrorRepository importErrorRepository) {
        this.importService = importService;
        this.exportService = exportService;
        this.callerResolver = callerResolver;
        this.importRunRepository = importRunRepository;
        this.importErrorRepository = importErrorRepository;
    }

    @PostMapping(value = "/import", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<ImportReportDTO> importCsv(@RequestHeader(value = CallerResolver.CALLER_HEADER, required = false) String user,
                                                     @RequestParam("file") MultipartFile file) throws IOException {
        CallerContext caller = caller(user);
        ImportReportDTO report;
        try {
            report = importService.importFile(file.getBytes(), file.getOriginalFilename(), caller);
        } catch (PermissionDeniedException e) {
            throw new ResponseStatusException(HttpStatus.FORBIDDEN, e.getMessage());
        }
        return ResponseEntity.status(statusOf(report)).body(report);
    }

    @GetMapping("/export")
    public ResponseEntity<byte[]> export(@RequestHeader(value = CallerResolver.CALLER_HEADER, required = false) String user,
                                         @RequestParam(value = "locationId", required = false) Long locationId,
                                         @RequestParam(value = "categoryId", required = false) Long categoryId) {
        CallerContext caller = caller(user);
        try {
            return csv(exportService.export(caller, locationId, categoryId));
        } catch (PermissionDeniedException e) {
            throw new ResponseStatusException(HttpStatus.FORBIDDEN, e.getMessage());
        }
    }

    @GetMapping("/import-template")
    public ResponseEntity<byte[]> template(@RequestHeader(value = CallerResolver.CALLER_HEADER, required = false) String user) {
        caller(user);
        return csv(exportService.template());
    }

    @GetMapping("/import/runs")
    public List<ImportRunSummaryDTO> listRuns(@RequestHeader(value = CallerResolver.CALLER_HEADER, required = false) String user,
                                              @RequestParam(value = "page", defaultValue = "0") int page,
                                              @RequestParam(value = "size", defaultValue = "20") int size) {
        requireInventoryManager(user);
        Page<ImportRun> p = importRunRepository.findAllByOrderByStartedAtDesc(PageRequest.of(page, size));
        return p.map(this::toDto).getContent();
    }

    @GetMapping("/import/runs/{id}/errors")
    public List<ImportErrorDTO> listErrors(@RequestHeader(value = CallerResolver.CALLER_HEADER, required = false) String user,
                                           @PathVariable("id") Long id) {
        requireInventoryManager(user);
        if (!importRunRepository.existsById(id)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Import run " + id + " not found");
        }
        return importErrorRepository.findByImportRunIdOrderByRowNumberAsc(id).stream().map(e -> new ImportErrorDTO(
                e.getId(),
                e.getRowNumber(),
                e.getColumnName(),
                e.getErrorType(),
                e.getReason()
        )).toList();
    }

    private CallerContext caller(String user) {
        return callerResolver.resolve(user)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.UNAUTHORIZED, "Unknown or missing user"));
    }

    private void requireInventoryManager(String user) {
        CallerContext caller = caller(user);
        if (!caller.hasPermission(Permission.MANAGE_INVENTORY)) {
            throw new ResponseStatusException(HttpStatus.FORBIDDEN,
                    "Access denied. Required permission: " + Permission.MANAGE_INVENTORY.code());
        }
    }

    static HttpStatus statusOf(ImportReportDTO report) {
        if (report.isSuccess()) return HttpStatus.OK;
        return report.getFailure() == ImportFailureKind.COMMIT ? HttpStatus.INTERNAL_SERVER_ERROR : HttpStatus.BAD_REQUEST;
    }

    private static ResponseEntity<byte[]> csv(ExportFile file) {
        return ResponseEntity.ok()
                .contentType(TEXT_CSV)
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"" + file.filename() + "\"")
                .body(file.content());
    }

    private ImportRunSummaryDTO toDto(ImportRun run) {
        return new ImportRunSummaryDTO(
                run.getId(),
                run.getStatus(),
                run.getFilename(),
                run.getEncodingUsed(),
                run.getRowsProcessed(),
                run.getRowsCreated(),
                run.getRowsUpdated(),
                run.getRowsFailed(),
                run.getFailureKind(),
                run.getMessage(),
                run.getCreatedBy(),
                run.getStartedAt(),
                run.getFinishedAt()
        );
    }
}
