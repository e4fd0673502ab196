package com.circuitinsight.core.metrics;

import com.circuitinsight.core.model.CostDomain;
import com.circuitinsight.core.model.CostRecord;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Parsed cost records grouped by cost domain.
 *
 * <p>Each domain is optional. A missing domain contributes zero to every line; it is not an
 * error.
 *
 * @param records records per present domain, read-only
 */
public record DomainRecords(Map<CostDomain, List<CostRecord>> records) {

    public DomainRecords {
        EnumMap<CostDomain, List<CostRecord>> copy = new EnumMap<>(CostDomain.class);
        if (records != null) {
            records.forEach((domain, list) -> {
                if (domain != null && list != null) {
                    copy.put(domain, List.copyOf(list));
                }
            });
        }
        records = Collections.unmodifiableMap(copy);
    }

    /**
     * Creates domain records from up to three record lists; null lists are treated as absent.
     *
     * @param constrained constrained opcode records
     * @param unconstrained unconstrained opcode records
     * @param gates gate records
     * @return domain records
     */
    public static DomainRecords of(
        List<CostRecord> constrained,
        List<CostRecord> unconstrained,
        List<CostRecord> gates
    ) {
        Map<CostDomain, List<CostRecord>> map = new EnumMap<>(CostDomain.class);
        if (constrained != null) {
            map.put(CostDomain.CONSTRAINED, constrained);
        }
        if (unconstrained != null) {
            map.put(CostDomain.UNCONSTRAINED, unconstrained);
        }
        if (gates != null) {
            map.put(CostDomain.GATES, gates);
        }
        return new DomainRecords(map);
    }

    public static DomainRecords empty() {
        return new DomainRecords(Map.of());
    }

    /**
     * Records of one domain.
     *
     * @param domain cost domain
     * @return records, empty if the domain is absent
     */
    public List<CostRecord> get(CostDomain domain) {
        return records.getOrDefault(domain, List.of());
    }

    /**
     * Domains with a record list, in declaration order; the returned set is read-only.
     *
     * @return present domains
     */
    public Set<CostDomain> presentDomains() {
        return Collections.unmodifiableSet(records.keySet());
    }

    public boolean isEmpty() {
        return records.values().stream().allMatch(List::isEmpty);
    }
}
