package com.university.coursescheduler.io;

import com.university.coursescheduler.model.ScheduleEntry;
import com.university.coursescheduler.model.ScheduleResult;
import com.university.coursescheduler.model.ScheduleStats;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.StringWriter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ScheduleExporterTest {

    private final ScheduleExporter exporter = new ScheduleExporter();

    @Test
    void writesCsvRows() {
        StringWriter out = new StringWriter();

        exporter.writeCsv(sampleResult(), out);

        assertThat(out.toString().split("\\R")).containsExactly(
                "Course,Slot,Time,Satisfaction",
                "HIST 101,s1,MWF 9:00-10:15,3.75",
                "\"Seminar, Senior\",s4,TT 10:30-11:45,0.00");
    }

    @Test
    void writesScheduleAndSummarySheets() throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();

        exporter.writeWorkbook(sampleResult(), out);

        try (Workbook workbook = WorkbookFactory.create(new ByteArrayInputStream(out.toByteArray()))) {
            Sheet schedule = workbook.getSheet("Schedule");
            assertThat(schedule.getRow(0).getCell(0).getStringCellValue()).isEqualTo("Course");
            assertThat(schedule.getRow(1).getCell(1).getStringCellValue()).isEqualTo("s1");
            assertThat(schedule.getRow(2).getCell(0).getStringCellValue()).isEqualTo("Seminar, Senior");
            assertThat(schedule.getRow(1).getCell(3).getNumericCellValue()).isEqualTo(3.75);

            Sheet summary = workbook.getSheet("Summary");
            assertThat(summary.getRow(0).getCell(0).getStringCellValue()).isEqualTo("Total Satisfaction");
            assertThat(summary.getRow(0).getCell(1).getNumericCellValue()).isEqualTo(3.75);
        }
    }

    private static ScheduleResult sampleResult() {
        Map<String, Integer> patterns = new LinkedHashMap<>();
        patterns.put("MWF", 1);
        patterns.put("TT", 1);
        Map<String, Integer> starts = new LinkedHashMap<>();
        starts.put("9:00", 1);
        starts.put("10:30", 1);
        Map<String, Integer> slots = new LinkedHashMap<>();
        slots.put("s1", 1);
        slots.put("s4", 1);
        Map<String, Double> popularity = new LinkedHashMap<>();
        popularity.put("s1", 1.0);
        popularity.put("s4", 0.0);
        ScheduleStats stats = new ScheduleStats(patterns, starts, slots, 0, 0, true, true);
        return new ScheduleResult(List.of(
                new ScheduleEntry("HIST 101", "s1", "MWF 9:00-10:15", 3.75),
                new ScheduleEntry("Seminar, Senior", "s4", "TT 10:30-11:45", 0.0)),
                3.75, 1.0, popularity, 12, stats);
    }
}
