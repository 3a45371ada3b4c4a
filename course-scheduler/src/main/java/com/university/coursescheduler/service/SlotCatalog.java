package com.university.coursescheduler.service;

import com.university.coursescheduler.model.DayPattern;
import com.university.coursescheduler.model.TimeSlot;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The fixed weekly slot grid: five start times, each offered once on M/W/F and
 * once on T/TH. The last T/TH slot is kept free for faculty meetings.
 *
 * <p>Consensus ranking adds one transitivity row per slot triple, so the
 * catalog is expected to stay in the tens of slots.
 */
@Component
public class SlotCatalog {

    private static final String MEETING_SLOT = "s10";

    private final List<TimeSlot> slots;
    private final TimeSlot exclusionSlot;

    public SlotCatalog() {
        this(standardSlots(), MEETING_SLOT);
    }

    public SlotCatalog(List<TimeSlot> slots, String exclusionCode) {
        this.slots = Collections.unmodifiableList(new ArrayList<>(slots));
        this.exclusionSlot = slot(exclusionCode);
    }

    private static List<TimeSlot> standardSlots() {
        String[][] times = {
                {"9:00", "10:15"},
                {"10:30", "11:45"},
                {"12:00", "1:15"},
                {"1:30", "2:45"},
                {"3:00", "4:15"},
        };
        List<TimeSlot> slots = new ArrayList<>();
        int ordinal = 1;
        for (String[] time : times) {
            for (DayPattern pattern : DayPattern.values()) {
                slots.add(new TimeSlot(ordinal, "s" + ordinal, pattern, time[0], time[1]));
                ordinal++;
            }
        }
        return slots;
    }

    public List<TimeSlot> getSlots() {
        return slots;
    }

    public int size() {
        return slots.size();
    }

    public TimeSlot get(int index) {
        return slots.get(index);
    }

    public TimeSlot slot(String code) {
        for (TimeSlot slot : slots) {
            if (slot.getCode().equals(code)) {
                return slot;
            }
        }
        throw new IllegalArgumentException("Unknown slot code: " + code);
    }

    public int indexOf(TimeSlot slot) {
        return slots.indexOf(slot);
    }

    public TimeSlot getExclusionSlot() {
        return exclusionSlot;
    }

    public Map<DayPattern, List<TimeSlot>> slotsByDayPattern() {
        Map<DayPattern, List<TimeSlot>> groups = new EnumMap<>(DayPattern.class);
        for (TimeSlot slot : slots) {
            groups.computeIfAbsent(slot.getDayPattern(), k -> new ArrayList<>()).add(slot);
        }
        return groups;
    }

    // Keyed by start time in catalog order.
    public Map<String, List<TimeSlot>> slotsByStartTime() {
        Map<String, List<TimeSlot>> groups = new LinkedHashMap<>();
        for (TimeSlot slot : slots) {
            groups.computeIfAbsent(slot.getStartTime(), k -> new ArrayList<>()).add(slot);
        }
        return groups;
    }

    public List<String> getCodes() {
        List<String> codes = new ArrayList<>();
        for (TimeSlot slot : slots) {
            codes.add(slot.getCode());
        }
        return codes;
    }
}
