package com.example.healthintake.store;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Read access to the doctor and workshop directory, plus the append-only intake audit log.
 *
 * <p>Filter maps use the extraction field names. Blank and {@code "any"} values are ignored.
 */
public interface DirectoryClient {
    List<Map<String, Object>> findDoctors(Map<String, Object> criteria, int limit);
    List<Map<String, Object>> findSchedules(Collection<String> doctorIds, Map<String, Object> criteria, int limit);
    List<Map<String, Object>> findWorkshops(Map<String, Object> filters, int limit);
    void appendEvent(String userId, Map<String, Object> event);
    boolean ping();
}
