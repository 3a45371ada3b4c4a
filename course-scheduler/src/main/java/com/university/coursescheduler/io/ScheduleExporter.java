package com.university.coursescheduler.io;

import com.university.coursescheduler.model.ScheduleEntry;
import com.university.coursescheduler.model.ScheduleResult;
import com.university.coursescheduler.model.ScheduleStats;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintWriter;
import java.io.Writer;
import java.util.Locale;
import java.util.Map;

/**
 * Writes a schedule as CSV or as an Excel workbook with a results sheet and a
 * summary sheet.
 */
@Component
public class ScheduleExporter {

    private static final String[] HEADERS = {"Course", "Slot", "Time", "Satisfaction"};
    private static final int COLUMN_WIDTH = 24 * 256;

    public void writeCsv(ScheduleResult result, Writer out) {
        PrintWriter writer = new PrintWriter(out);
        writer.println(String.join(",", HEADERS));
        for (ScheduleEntry entry : result.getEntries()) {
            writer.println(csvCell(entry.getCourse()) + "," + entry.getSlot() + ","
                    + csvCell(entry.getTime()) + "," + String.format(Locale.ROOT, "%.2f", entry.getSatisfaction()));
        }
        writer.flush();
    }

    public void writeWorkbook(ScheduleResult result, OutputStream out) throws IOException {
        try (Workbook workbook = new XSSFWorkbook()) {
            Sheet sheet = workbook.createSheet("Schedule");
            Row headerRow = sheet.createRow(0);
            for (int i = 0; i < HEADERS.length; i++) {
                Cell cell = headerRow.createCell(i);
                cell.setCellValue(HEADERS[i]);
            }
            int rowIndex = 1;
            for (ScheduleEntry entry : result.getEntries()) {
                Row row = sheet.createRow(rowIndex++);
                row.createCell(0).setCellValue(entry.getCourse());
                row.createCell(1).setCellValue(entry.getSlot());
                row.createCell(2).setCellValue(entry.getTime());
                row.createCell(3).setCellValue(entry.getSatisfaction());
            }
            sheet.setColumnWidth(0, COLUMN_WIDTH);
            sheet.setColumnWidth(2, COLUMN_WIDTH);

            writeSummary(workbook.createSheet("Summary"), result);
            workbook.write(out);
        }
    }

    private void writeSummary(Sheet sheet, ScheduleResult result) {
        ScheduleStats stats = result.getStats();
        int rowIndex = 0;
        rowIndex = summaryRow(sheet, rowIndex, "Total Satisfaction", result.getSatisfactionTotal());
        rowIndex = summaryRow(sheet, rowIndex, "Kemeny Score", result.getKemenyScore());
        rowIndex = summaryRow(sheet, rowIndex, "Solve Time (ms)", result.getSolveTimeMillis());
        for (Map.Entry<String, Integer> count : stats.getDayPatternCounts().entrySet()) {
            rowIndex = summaryRow(sheet, rowIndex, count.getKey() + " Courses", count.getValue());
        }
        rowIndex = summaryRow(sheet, rowIndex, "Day Balance Difference", stats.getBalanceDiff());
        rowIndex = summaryRow(sheet, rowIndex, "Time Balance Difference", stats.getTimeDiff());
        for (Map.Entry<String, Integer> count : stats.getStartTimeCounts().entrySet()) {
            rowIndex = summaryRow(sheet, rowIndex, "Start " + count.getKey(), count.getValue());
        }
        for (Map.Entry<String, Double> popularity : result.getSlotPopularity().entrySet()) {
            rowIndex = summaryRow(sheet, rowIndex, "Popularity " + popularity.getKey(), popularity.getValue());
        }
        sheet.setColumnWidth(0, COLUMN_WIDTH);
    }

    private static int summaryRow(Sheet sheet, int rowIndex, String label, double value) {
        Row row = sheet.createRow(rowIndex);
        row.createCell(0).setCellValue(label);
        row.createCell(1).setCellValue(value);
        return rowIndex + 1;
    }

    private static String csvCell(String value) {
        if (value.contains(",") || value.contains("\"")) {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }
        return value;
    }
}
