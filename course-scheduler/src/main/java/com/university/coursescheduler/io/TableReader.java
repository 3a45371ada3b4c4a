package com.university.coursescheduler.io;

import com.university.coursescheduler.exception.MalformedInputException;
import com.university.coursescheduler.model.CourseFaculty;
import com.university.coursescheduler.model.CoursePreference;
import com.university.coursescheduler.model.FacultyMember;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Reads the three uploaded tables from CSV or Excel files. Columns are
 * positional:
 * <ul>
 *   <li>faculty: Name, Adjustment, Voting</li>
 *   <li>courses: Course, Faculty</li>
 *   <li>selection: Course, then one rank per slot</li>
 * </ul>
 * A leading header row is skipped when its first cell is the first column name.
 */
@Component
public class TableReader {

    private static final Logger logger = LoggerFactory.getLogger(TableReader.class);

    public List<FacultyMember> readFaculty(InputStream in, String filename) {
        List<FacultyMember> faculty = new ArrayList<>();
        for (List<String> row : readRows(in, filename, "Name")) {
            requireWidth(row, 3, "Faculty", filename);
            faculty.add(new FacultyMember(row.get(0), parseNumber(row.get(1), "Adjustment", filename),
                    parseVoting(row.get(2), filename)));
        }
        logger.info("Loaded {} faculty members from {}", faculty.size(), filename);
        return faculty;
    }

    public List<CourseFaculty> readCourses(InputStream in, String filename) {
        List<CourseFaculty> courses = new ArrayList<>();
        for (List<String> row : readRows(in, filename, "Course")) {
            requireWidth(row, 2, "Course", filename);
            courses.add(new CourseFaculty(row.get(0), row.get(1)));
        }
        logger.info("Loaded {} course assignments from {}", courses.size(), filename);
        return courses;
    }

    public List<CoursePreference> readSelection(InputStream in, String filename, int slotCount) {
        List<CoursePreference> selection = new ArrayList<>();
        for (List<String> row : readRows(in, filename, "Course")) {
            requireWidth(row, slotCount + 1, "Selection", filename);
            List<Integer> ranks = new ArrayList<>();
            for (int s = 1; s <= slotCount; s++) {
                ranks.add(parseRank(row.get(s), row.get(0), filename));
            }
            selection.add(new CoursePreference(row.get(0), ranks));
        }
        logger.info("Loaded {} course selections from {}", selection.size(), filename);
        return selection;
    }

    List<List<String>> readRows(InputStream in, String filename, String firstColumn) {
        String name = filename == null ? "" : filename.toLowerCase(Locale.ROOT);
        List<List<String>> rows;
        try {
            if (name.endsWith(".csv")) {
                rows = readCsv(in);
            } else if (name.endsWith(".xls") || name.endsWith(".xlsx")) {
                rows = readWorkbook(in);
            } else {
                throw new MalformedInputException("Unsupported file format: " + filename);
            }
        } catch (IOException e) {
            throw new MalformedInputException("Error processing file " + filename + ": " + e.getMessage(), e);
        }
        if (!rows.isEmpty() && rows.get(0).get(0).equalsIgnoreCase(firstColumn)) {
            rows.remove(0);
        }
        return rows;
    }

    private List<List<String>> readCsv(InputStream in) throws IOException {
        List<List<String>> rows = new ArrayList<>();
        BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        String line;
        while ((line = reader.readLine()) != null) {
            // Excel's "CSV UTF-8" starts with a byte order mark
            if (rows.isEmpty() && line.startsWith("\uFEFF")) {
                line = line.substring(1);
            }
            if (line.isBlank()) {
                continue;
            }
            rows.add(splitCsvLine(line));
        }
        return rows;
    }

    // Handles quoted fields and doubled quotes inside them.
    static List<String> splitCsvLine(String line) {
        List<String> cells = new ArrayList<>();
        StringBuilder cell = new StringBuilder();
        boolean quoted = false;
        for (int i = 0; i < line.length(); i++) {
            char ch = line.charAt(i);
            if (quoted) {
                if (ch == '"' && i + 1 < line.length() && line.charAt(i + 1) == '"') {
                    cell.append('"');
                    i++;
                } else if (ch == '"') {
                    quoted = false;
                } else {
                    cell.append(ch);
                }
            } else if (ch == '"') {
                quoted = true;
            } else if (ch == ',') {
                cells.add(cell.toString().trim());
                cell.setLength(0);
            } else {
                cell.append(ch);
            }
        }
        cells.add(cell.toString().trim());
        return cells;
    }

    private List<List<String>> readWorkbook(InputStream in) throws IOException {
        List<List<String>> rows = new ArrayList<>();
        DataFormatter formatter = new DataFormatter();
        try (Workbook workbook = WorkbookFactory.create(in)) {
            Sheet sheet = workbook.getSheetAt(0);
            for (Row row : sheet) {
                List<String> cells = new ArrayList<>();
                boolean blank = true;
                for (int i = 0; i < row.getLastCellNum(); i++) {
                    Cell cell = row.getCell(i);
                    String value = cell == null ? "" : formatter.formatCellValue(cell).trim();
                    blank &= value.isEmpty();
                    cells.add(value);
                }
                if (!blank) {
                    rows.add(cells);
                }
            }
        }
        return rows;
    }

    private static void requireWidth(List<String> row, int width, String table, String filename) {
        if (row.size() < width || row.get(0).isEmpty()) {
            throw new MalformedInputException(table + " data in " + filename + " needs " + width
                    + " columns per row, got: " + row);
        }
    }

    private static double parseNumber(String value, String column, String filename) {
        if (value.isEmpty()) {
            return 0;
        }
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new MalformedInputException(column + " value '" + value + "' in " + filename
                    + " is not a number", e);
        }
    }

    private static boolean parseVoting(String value, String filename) {
        if (value.equalsIgnoreCase("true") || value.equalsIgnoreCase("yes")) {
            return true;
        }
        if (value.equalsIgnoreCase("false") || value.equalsIgnoreCase("no")) {
            return false;
        }
        return parseNumber(value, "Voting", filename) > 0;
    }

    // Blank cells count as unranked.
    private static int parseRank(String value, String course, String filename) {
        double rank = parseNumber(value, "Rank for " + course, filename);
        if (rank < 0 || rank != Math.rint(rank)) {
            throw new MalformedInputException("Rank '" + value + "' for " + course + " in " + filename
                    + " must be a non-negative integer");
        }
        return (int) rank;
    }
}
