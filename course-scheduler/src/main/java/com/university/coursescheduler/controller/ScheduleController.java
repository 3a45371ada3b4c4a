package com.university.coursescheduler.controller;

import com.university.coursescheduler.exception.MalformedInputException;
import com.university.coursescheduler.exception.OptimizationFailedException;
import com.university.coursescheduler.exception.SchedulingException;
import com.university.coursescheduler.io.ScheduleExporter;
import com.university.coursescheduler.io.TableReader;
import com.university.coursescheduler.model.ScheduleResult;
import com.university.coursescheduler.model.SchedulingRequest;
import com.university.coursescheduler.model.TimeSlot;
import com.university.coursescheduler.service.SchedulingService;
import com.university.coursescheduler.service.SlotCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/schedule")
public class ScheduleController {

    private static final Logger logger = LoggerFactory.getLogger(ScheduleController.class);

    private static final MediaType XLSX =
            MediaType.parseMediaType("application/vnd.openxmlformats-officedocument.spreadsheetml.sheet");

    private final SchedulingService schedulingService;
    private final TableReader tableReader;
    private final ScheduleExporter exporter;
    private final SlotCatalog catalog;

    public ScheduleController(SchedulingService schedulingService, TableReader tableReader,
            ScheduleExporter exporter, SlotCatalog catalog) {
        this.schedulingService = schedulingService;
        this.tableReader = tableReader;
        this.exporter = exporter;
        this.catalog = catalog;
    }

    /**
     * Lists the schedulable slots in catalog order.
     */
    @GetMapping("/slots")
    public List<Map<String, Object>> getSlots() {
        List<Map<String, Object>> slots = new ArrayList<>();
        for (TimeSlot slot : catalog.getSlots()) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("slot", slot.getCode());
            row.put("time", slot.getLabel());
            row.put("days", slot.getDayPattern().getDays());
            row.put("start", slot.getStartTime());
            row.put("end", slot.getEndTime());
            row.put("meetingSlot", slot == catalog.getExclusionSlot());
            slots.add(row);
        }
        return slots;
    }

    /**
     * Optimizes a schedule from tables given as JSON.
     */
    @PostMapping("/optimize")
    public ResponseEntity<?> optimize(@RequestBody SchedulingRequest request) {
        try {
            return ResponseEntity.ok(schedulingService.optimize(request));
        } catch (SchedulingException e) {
            return errorResponse(e);
        }
    }

    /**
     * Optimizes a schedule from uploaded faculty, course and selection files.
     */
    @PostMapping(value = "/optimize/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<?> optimizeUpload(@RequestParam("faculty") MultipartFile faculty,
            @RequestParam("courses") MultipartFile courses,
            @RequestParam("selection") MultipartFile selection,
            @RequestParam(required = false) Long seed) {
        try {
            return ResponseEntity.ok(optimizeUploaded(faculty, courses, selection, seed));
        } catch (SchedulingException e) {
            return errorResponse(e);
        }
    }

    /**
     * Optimizes from uploaded files and returns the schedule as CSV.
     */
    @PostMapping(value = "/export/csv", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<?> exportCsv(@RequestParam("faculty") MultipartFile faculty,
            @RequestParam("courses") MultipartFile courses,
            @RequestParam("selection") MultipartFile selection,
            @RequestParam(required = false) Long seed) throws IOException {
        ScheduleResult result;
        try {
            result = optimizeUploaded(faculty, courses, selection, seed);
        } catch (SchedulingException e) {
            return errorResponse(e);
        }
        ByteArrayOutputStream body = new ByteArrayOutputStream();
        try (Writer writer = new OutputStreamWriter(body, StandardCharsets.UTF_8)) {
            exporter.writeCsv(result, writer);
        }
        return attachment(body.toByteArray(), "schedule.csv", MediaType.parseMediaType("text/csv"));
    }

    /**
     * Optimizes from uploaded files and returns the schedule as an Excel workbook.
     */
    @PostMapping(value = "/export/excel", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<?> exportExcel(@RequestParam("faculty") MultipartFile faculty,
            @RequestParam("courses") MultipartFile courses,
            @RequestParam("selection") MultipartFile selection,
            @RequestParam(required = false) Long seed) throws IOException {
        ScheduleResult result;
        try {
            result = optimizeUploaded(faculty, courses, selection, seed);
        } catch (SchedulingException e) {
            return errorResponse(e);
        }
        ByteArrayOutputStream body = new ByteArrayOutputStream();
        exporter.writeWorkbook(result, body);
        return attachment(body.toByteArray(), "schedule.xlsx", XLSX);
    }

    private ScheduleResult optimizeUploaded(MultipartFile faculty, MultipartFile courses,
            MultipartFile selection, Long seed) {
        SchedulingRequest request = new SchedulingRequest();
        try (InputStream in = faculty.getInputStream()) {
            request.setFaculty(tableReader.readFaculty(in, faculty.getOriginalFilename()));
        } catch (IOException e) {
            throw new MalformedInputException("Could not read faculty upload", e);
        }
        try (InputStream in = courses.getInputStream()) {
            request.setCourses(tableReader.readCourses(in, courses.getOriginalFilename()));
        } catch (IOException e) {
            throw new MalformedInputException("Could not read course upload", e);
        }
        try (InputStream in = selection.getInputStream()) {
            request.setSelection(tableReader.readSelection(in, selection.getOriginalFilename(), catalog.size()));
        } catch (IOException e) {
            throw new MalformedInputException("Could not read selection upload", e);
        }
        request.setSeed(seed);
        return schedulingService.optimize(request);
    }

    private static ResponseEntity<byte[]> attachment(byte[] body, String filename, MediaType type) {
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=" + filename)
                .contentType(type)
                .body(body);
    }

    private static ResponseEntity<Map<String, String>> errorResponse(SchedulingException e) {
        HttpStatus status;
        if (e instanceof MalformedInputException) {
            status = HttpStatus.BAD_REQUEST;
        } else if (e instanceof OptimizationFailedException) {
            status = HttpStatus.UNPROCESSABLE_ENTITY;
        } else {
            status = HttpStatus.INTERNAL_SERVER_ERROR;
        }
        logger.warn("Schedule request failed ({}): {}", e.getReason(), e.getMessage());
        return ResponseEntity.status(status).body(Map.of(
                "status", "error",
                "reason", e.getReason(),
                "message", e.getMessage()
        ));
    }
}
