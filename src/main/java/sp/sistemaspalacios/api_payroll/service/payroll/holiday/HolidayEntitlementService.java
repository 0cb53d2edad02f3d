package sp.sistemaspalacios.api_payroll.service.payroll.holiday;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import sp.sistemaspalacios.api_payroll.domain.payroll.HolidayWindow;
import sp.sistemaspalacios.api_payroll.domain.payroll.PayPeriod;
import sp.sistemaspalacios.api_payroll.domain.payroll.ShiftRecord;
import sp.sistemaspalacios.api_payroll.service.payroll.rate.RateCodeService;
import sp.sistemaspalacios.api_payroll.service.payroll.vacation.VacationPercentService;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Public Holiday Pay (PHP): derecho calculado sobre los salarios de la ventana de referencia
 * de cada festivo, no sobre las horas trabajadas el propio festivo.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class HolidayEntitlementService {

    public static final String PHP_LABEL = "PHP (Holiday)";

    // Dos quincenas completas de 88 h
    public static final BigDecimal ENTITLEMENT_HOURS_CAP = new BigDecimal("176");
    public static final BigDecimal PAY_PERIOD_DIVISOR = new BigDecimal("20");
    public static final BigDecimal PHP_HOURLY_RATE = new BigDecimal("30");

    private final RateCodeService rateCodeService;
    private final VacationPercentService vacationPercentService;

    /**
     * Horas de PHP de un empleado sumadas sobre todos los festivos configurados.
     *
     * @param employeeRecords todos los registros del empleado, sin filtrar por período
     */
    public BigDecimal entitlementHours(List<ShiftRecord> employeeRecords, List<HolidayWindow> holidays) {
        return holidays.stream()
                .map(holiday -> holidayEntitlementHours(employeeRecords, holiday))
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public BigDecimal holidayEntitlementHours(List<ShiftRecord> employeeRecords, HolidayWindow holiday) {
        List<ShiftRecord> qualifying = employeeRecords.stream()
                .filter(ShiftRecord::hasHours)
                .filter(r -> !r.classification().isFinished())
                .filter(r -> holiday.inLookback(r.transactionDate()))
                .sorted(Comparator.comparingInt(ShiftRecord::sequence))
                .collect(Collectors.toList());

        if (qualifying.isEmpty()) {
            return BigDecimal.ZERO;
        }

        BigDecimal workedHours = qualifying.stream()
                .map(ShiftRecord::duration)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal cappedHours = workedHours.min(ENTITLEMENT_HOURS_CAP);

        BigDecimal rate = rateCodeService.rateFor(mostFrequentCode(qualifying));
        BigDecimal wages = cappedHours.multiply(rate);
        BigDecimal vacation = vacationPercentService.maxFound(
                qualifying.stream().map(ShiftRecord::notes).collect(Collectors.toList()));

        BigDecimal entitlementDollars = wages.multiply(BigDecimal.ONE.add(vacation))
                .divide(PAY_PERIOD_DIVISOR, MathContext.DECIMAL64);
        BigDecimal hours = entitlementDollars.divide(PHP_HOURLY_RATE, MathContext.DECIMAL64);

        log.debug("PHP {} festivo {}: {} h (tope {}), tarifa {}, vacaciones {} -> {} h",
                qualifying.get(0).employee(), holiday.holidayDate(), workedHours, cappedHours, rate, vacation, hours);
        return hours;
    }

    /** Fecha de la línea PHP: el primer festivo configurado que cae dentro del período. */
    public Optional<LocalDate> phpDate(List<HolidayWindow> holidays, PayPeriod period) {
        return holidays.stream()
                .map(HolidayWindow::holidayDate)
                .filter(period::contains)
                .min(Comparator.naturalOrder());
    }

    // Moda; en empate gana la que apareció primero
    private String mostFrequentCode(List<ShiftRecord> qualifying) {
        Map<String, Long> counts = new LinkedHashMap<>();
        for (ShiftRecord record : qualifying) {
            counts.merge(record.payrollItem(), 1L, Long::sum);
        }

        String best = null;
        long bestCount = 0;
        for (Map.Entry<String, Long> entry : counts.entrySet()) {
            if (entry.getValue() > bestCount) {
                best = entry.getKey();
                bestCount = entry.getValue();
            }
        }
        return best;
    }
}
