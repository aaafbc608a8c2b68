package com.example.seer.incident;

import com.example.seer.repository.IncidentRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Allocates sequential {@code INC-####} identifiers.
 *
 * <p>The next id is one above the highest well-formed id in the store, or
 * above the last id this allocator handed out if that is higher, so two
 * registrations racing before either row is committed still get distinct ids.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class IncidentIdAllocator {

    public static final String PREFIX = "INC-";
    public static final int FIRST_ID = 1001;
    private static final int MAX_ID = 9999;
    private static final Pattern WELL_FORMED = Pattern.compile("INC-\\d{4}");

    private final IncidentRecordRepository incidentRepository;

    private int lastAllocated = FIRST_ID - 1;

    public synchronized String allocate() {
        int next = Math.max(maxStoredId(incidentRepository.findAllIncidentIds()), lastAllocated) + 1;
        if (next > MAX_ID) {
            throw new IllegalStateException("Incident id space exhausted at " + PREFIX + MAX_ID);
        }
        lastAllocated = next;
        String id = format(next);
        log.debug("Allocated incident id {}", id);
        return id;
    }

    /**
     * Highest numeric suffix among well-formed ids; malformed or differently
     * shaped ids are ignored. Returns {@code FIRST_ID - 1} when none qualify.
     */
    static int maxStoredId(List<String> ids) {
        int max = FIRST_ID - 1;
        for (String id : ids) {
            if (id != null && WELL_FORMED.matcher(id).matches()) {
                max = Math.max(max, Integer.parseInt(id.substring(PREFIX.length())));
            }
        }
        return max;
    }

    static String format(int number) {
        return String.format("%s%04d", PREFIX, number);
    }
}
