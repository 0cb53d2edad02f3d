package sp.sistemaspalacios.api_payroll.service.payroll.overtime;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import sp.sistemaspalacios.api_payroll.domain.payroll.HourBuckets;
import sp.sistemaspalacios.api_payroll.domain.payroll.ShiftRecord;
import sp.sistemaspalacios.api_payroll.domain.payroll.ShiftSegment;
import sp.sistemaspalacios.api_payroll.service.payroll.rate.RateCodeService;

import java.math.BigDecimal;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Reparte las horas de un empleado entre regulares y extra contra el umbral quincenal de 88 h.
 * Las horas de festivo van siempre a su propio acumulador y no suman al umbral.
 */
@Service
@RequiredArgsConstructor
public class OvertimeAllocationService {

    public static final BigDecimal OVERTIME_THRESHOLD = new BigDecimal("88");

    static final Comparator<ShiftSegment> CHRONOLOGICAL = Comparator
            .comparing(ShiftSegment::date)
            .thenComparingInt(s -> s.record().sequence())
            .thenComparingInt(ShiftSegment::order);

    private final RateCodeService rateCodeService;

    /**
     * @param segments segmentos de UN solo empleado, en cualquier orden
     */
    public HourBuckets allocate(List<ShiftSegment> segments) {
        HourBuckets buckets = new HourBuckets();

        List<ShiftSegment> ordered = segments.stream()
                .sorted(CHRONOLOGICAL)
                .collect(Collectors.toList());

        for (ShiftSegment segment : ordered) {
            ShiftRecord record = segment.record();
            BigDecimal hours = segment.hours();
            String code = record.payrollItem();

            // Líneas ya terminadas (OT / STAT / PHP) pasan sin reprocesar
            if (record.classification().isFinished()) {
                buckets.addPassthrough(code, record.classification(), hours);
                continue;
            }

            if (segment.statutory()) {
                buckets.addStatutory(rateCodeService.overtimeVariant(code), hours);
                continue;
            }

            BigDecimal cumulative = buckets.getCumulativeRegularHours();
            if (cumulative.add(hours).compareTo(OVERTIME_THRESHOLD) <= 0) {
                buckets.addRegular(code, hours);
            } else if (cumulative.compareTo(OVERTIME_THRESHOLD) >= 0) {
                buckets.addOvertime(rateCodeService.overtimeVariant(code), hours);
            } else {
                BigDecimal regularPortion = OVERTIME_THRESHOLD.subtract(cumulative);
                buckets.addRegular(code, regularPortion);
                buckets.addOvertime(rateCodeService.overtimeVariant(code), hours.subtract(regularPortion));
            }
            buckets.accumulate(hours);
        }
        return buckets;
    }
}
