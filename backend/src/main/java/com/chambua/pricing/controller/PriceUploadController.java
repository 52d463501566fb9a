package com.chambua.pricing.controller;

import com.chambua.pricing.dto.PriceListRow;
import com.chambua.pricing.dto.RowFailureDTO;
import com.chambua.pricing.dto.StartUploadRequest;
import com.chambua.pricing.dto.UploadJobStatusDTO;
import com.chambua.pricing.model.UploadJob;
import com.chambua.pricing.service.PriceListCsvReader;
import com.chambua.pricing.service.PriceUploadCoordinator;
import com.chambua.pricing.service.UploadJobService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.server.ResponseStatusException;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.List;
import java.util.NoSuchElementException;

@RestController
@RequestMapping("/api/price")
public class PriceUploadController {
    private static final Logger log = LoggerFactory.getLogger(PriceUploadController.class);

    private final PriceUploadCoordinator coordinator;
    private final UploadJobService uploadJobService;
    private final PriceListCsvReader csvReader;

    public PriceUploadController(PriceUploadCoordinator coordinator,
                                 UploadJobService uploadJobService,
                                 PriceListCsvReader csvReader) {
        this.coordinator = coordinator;
        this.uploadJobService = uploadJobService;
        this.csvReader = csvReader;
    }

    @PostMapping(value = "/uploads", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<UploadJobStatusDTO> upload(@RequestBody StartUploadRequest request,
                                                     @RequestHeader(value = "X-User-Id", required = false) String userId) {
        log.info("[PriceUploadController][START] file={} rows={} user={}", request.getFilename(),
                request.getRows() == null ? 0 : request.getRows().size(), userId);
        return accepted(submit(request, userId));
    }

    @PostMapping(value = "/uploads/csv", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<UploadJobStatusDTO> uploadCsv(@RequestParam("file") MultipartFile file,
                                                        @RequestParam(value = "observedDate", required = false)
                                                        @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate observedDate,
                                                        @RequestHeader(value = "X-User-Id", required = false) String userId) {
        LocalDate date = observedDate != null ? observedDate : LocalDate.now();
        List<PriceListRow> rows;
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(file.getInputStream(), StandardCharsets.UTF_8))) {
            rows = csvReader.read(reader, date);
        } catch (IllegalArgumentException | IllegalStateException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Malformed price list: " + e.getMessage());
        } catch (IOException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Unreadable price list: " + e.getMessage());
        }
        log.info("[PriceUploadController][CSV] file={} rows={} user={}", file.getOriginalFilename(), rows.size(), userId);
        return accepted(submit(new StartUploadRequest(file.getOriginalFilename(), date, rows), userId));
    }

    @GetMapping("/uploads")
    public List<UploadJobStatusDTO> list(@RequestParam(value = "page", defaultValue = "0") int page,
                                         @RequestParam(value = "size", defaultValue = "20") int size) {
        return uploadJobService.list(page, size);
    }

    @GetMapping("/uploads/{id}")
    public UploadJobStatusDTO status(@PathVariable("id") Long id) {
        return uploadJobService.get(id)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Upload not found"));
    }

    @GetMapping("/uploads/{id}/failures")
    public List<RowFailureDTO> failures(@PathVariable("id") Long id) {
        try {
            return uploadJobService.failures(id);
        } catch (NoSuchElementException e) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, e.getMessage());
        }
    }

    @PostMapping("/uploads/{id}/cancel")
    public UploadJobStatusDTO cancel(@PathVariable("id") Long id,
                                     @RequestHeader(value = "X-User-Id", required = false) String userId) {
        log.info("[PriceUploadController][CANCEL] jobId={} user={}", id, userId);
        try {
            return uploadJobService.cancel(id);
        } catch (NoSuchElementException e) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, e.getMessage());
        } catch (IllegalStateException e) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, e.getMessage());
        }
    }

    private UploadJob submit(StartUploadRequest request, String userId) {
        try {
            return coordinator.submit(request, userId);
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage());
        } catch (TaskRejectedException e) {
            throw new ResponseStatusException(HttpStatus.SERVICE_UNAVAILABLE, "Too many uploads queued, retry later");
        }
    }

    private static ResponseEntity<UploadJobStatusDTO> accepted(UploadJob job) {
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(UploadJobStatusDTO.from(job));
    }
}
