package sp.sistemaspalacios.api_payroll.domain.payroll;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Acumulador de horas de un solo empleado durante una corrida.
 * Se crea por empleado y se descarta al consolidar sus líneas.
 */
public class HourBuckets {

    private final Map<String, BigDecimal> regular = new LinkedHashMap<>();
    private final Map<String, BigDecimal> overtime = new LinkedHashMap<>();
    private final Map<String, BigDecimal> statutory = new LinkedHashMap<>();
    private final Map<String, BigDecimal> passthrough = new LinkedHashMap<>();
    private final Map<String, Classification> passthroughClassification = new LinkedHashMap<>();

    private BigDecimal cumulativeRegularHours = BigDecimal.ZERO;

    public void addRegular(String code, BigDecimal hours) {
        regular.merge(code, hours, BigDecimal::add);
    }

    public void addOvertime(String code, BigDecimal hours) {
        overtime.merge(code, hours, BigDecimal::add);
    }

    public void addStatutory(String code, BigDecimal hours) {
        statutory.merge(code, hours, BigDecimal::add);
    }

    public void addPassthrough(String code, Classification classification, BigDecimal hours) {
        passthrough.merge(code, hours, BigDecimal::add);
        passthroughClassification.putIfAbsent(code, classification);
    }

    public void accumulate(BigDecimal hours) {
        cumulativeRegularHours = cumulativeRegularHours.add(hours);
    }

    public BigDecimal getCumulativeRegularHours() {
        return cumulativeRegularHours;
    }

    public Map<String, BigDecimal> getRegular() {
        return Collections.unmodifiableMap(regular);
    }

    public Map<String, BigDecimal> getOvertime() {
        return Collections.unmodifiableMap(overtime);
    }

    public Map<String, BigDecimal> getStatutory() {
        return Collections.unmodifiableMap(statutory);
    }

    public Map<String, BigDecimal> getPassthrough() {
        return Collections.unmodifiableMap(passthrough);
    }

    public Classification passthroughClassificationOf(String code) {
        return passthroughClassification.getOrDefault(code, Classification.UNCLASSIFIED);
    }

    public boolean hasPassthrough(Classification classification) {
        return passthroughClassification.containsValue(classification);
    }

    public BigDecimal totalRegular() {
        return sum(regular);
    }

    public BigDecimal totalOvertime() {
        return sum(overtime).add(sumPassthrough(Classification.OVERTIME));
    }

    public BigDecimal totalStatutory() {
        return sum(statutory).add(sumPassthrough(Classification.STATUTORY));
    }

    public BigDecimal totalPassthroughEntitlement() {
        return sumPassthrough(Classification.ENTITLEMENT);
    }

    private BigDecimal sumPassthrough(Classification classification) {
        return passthrough.entrySet().stream()
                .filter(e -> passthroughClassification.get(e.getKey()) == classification)
                .map(Map.Entry::getValue)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    private static BigDecimal sum(Map<String, BigDecimal> bucket) {
        return bucket.values().stream().reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}
