package sp.sistemaspalacios.api_payroll.service.payroll.union;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import sp.sistemaspalacios.api_payroll.domain.payroll.ShiftRecord;
import sp.sistemaspalacios.api_payroll.dto.payroll.UnionBenefitLineDTO;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Aporte sindical: dos semanas de 7 días desde la fecha más temprana de TODA la entrada,
 * cada una con tope de 44 h, a 0.80 por hora pagable.
 */
@Slf4j
@Service
public class UnionBenefitService {

    public static final BigDecimal WEEKLY_CAP = new BigDecimal("44");
    public static final BigDecimal HOURLY_CONTRIBUTION = new BigDecimal("0.80");

    /** Último día de la semana 1, común para todos los empleados. */
    public Optional<LocalDate> week1End(List<ShiftRecord> records) {
        return records.stream()
                .map(ShiftRecord::transactionDate)
                .min(Comparator.naturalOrder())
                .map(earliest -> earliest.plusDays(6));
    }

    public List<UnionBenefitLineDTO> calculate(List<ShiftRecord> records) {
        Optional<LocalDate> boundary = week1End(records);
        if (boundary.isEmpty()) {
            return new ArrayList<>();
        }
        LocalDate week1End = boundary.get();

        Map<String, BigDecimal[]> weeksByEmployee = new TreeMap<>();
        for (ShiftRecord record : records) {
            if (!record.hasHours()) continue;
            BigDecimal[] weeks = weeksByEmployee.computeIfAbsent(
                    record.employee(), k -> new BigDecimal[]{BigDecimal.ZERO, BigDecimal.ZERO});
            int index = record.transactionDate().isAfter(week1End) ? 1 : 0;
            weeks[index] = weeks[index].add(record.duration());
        }

        List<UnionBenefitLineDTO> lines = new ArrayList<>();
        weeksByEmployee.forEach((employee, weeks) -> lines.add(toLine(employee, weeks[0], weeks[1])));

        log.info("🧾 Aporte sindical: {} empleados, semana 1 hasta {}", lines.size(), week1End);
        return lines;
    }

    private UnionBenefitLineDTO toLine(String employee, BigDecimal week1, BigDecimal week2) {
        BigDecimal week1Payable = week1.min(WEEKLY_CAP);
        BigDecimal week2Payable = week2.min(WEEKLY_CAP);
        BigDecimal totalPayable = week1Payable.add(week2Payable);
        BigDecimal totalCost = totalPayable.multiply(HOURLY_CONTRIBUTION);

        return UnionBenefitLineDTO.builder()
                .employee(employee)
                .week1Hours(round(week1))
                .week1Payable(round(week1Payable))
                .week2Hours(round(week2))
                .week2Payable(round(week2Payable))
                .totalPayable(round(totalPayable))
                .totalCost(round(totalCost))
                .build();
    }

    private static BigDecimal round(BigDecimal value) {
        return value.setScale(2, RoundingMode.HALF_UP);
    }
}
