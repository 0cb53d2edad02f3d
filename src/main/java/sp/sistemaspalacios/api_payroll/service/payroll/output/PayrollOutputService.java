package sp.sistemaspalacios.api_payroll.service.payroll.output;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import sp.sistemaspalacios.api_payroll.domain.payroll.Classification;
import sp.sistemaspalacios.api_payroll.domain.payroll.HourBuckets;
import sp.sistemaspalacios.api_payroll.dto.payroll.OutputLineDTO;
import sp.sistemaspalacios.api_payroll.service.boundaries.generalConfiguration.GeneralConfigurationService;
import sp.sistemaspalacios.api_payroll.service.payroll.holiday.HolidayEntitlementService;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Consolida los acumuladores de un empleado en una línea por etiqueta de tarifa.
 * El redondeo a 2 decimales se hace aquí y en ningún otro punto.
 */
@Service
@RequiredArgsConstructor
public class PayrollOutputService {

    public static final String NOT_BILLABLE = "N";

    public static final Comparator<OutputLineDTO> LINE_ORDER = Comparator
            .comparing(OutputLineDTO::getEmployee)
            .thenComparing(OutputLineDTO::getPayrollItem);

    private final GeneralConfigurationService configService;

    public record OutputMarkers(String customer, String serviceItem) {}

    private record PendingLine(LocalDate date, Classification classification, BigDecimal hours) {
        PendingLine plus(BigDecimal more) {
            return new PendingLine(date, classification, hours.add(more));
        }
    }

    /** Marcadores fijos de cliente / servicio, leídos una vez por corrida. */
    public OutputMarkers resolveMarkers() {
        return new OutputMarkers(
                configService.getValueOrDefault(GeneralConfigurationService.OUTPUT_CUSTOMER),
                configService.getValueOrDefault(GeneralConfigurationService.OUTPUT_SERVICE_ITEM));
    }

    /**
     * @param representativeDate fecha más temprana del empleado dentro del período
     * @param passthroughDates   fecha más temprana de cada etiqueta ya terminada (para las PHP de entrada)
     * @param entitlementHours   PHP calculado; cero u omitido si no aplica
     * @param phpDate            fecha de la línea PHP calculada
     */
    public List<OutputLineDTO> buildLines(String employee,
                                          LocalDate representativeDate,
                                          HourBuckets buckets,
                                          Map<String, LocalDate> passthroughDates,
                                          BigDecimal entitlementHours,
                                          LocalDate phpDate,
                                          OutputMarkers markers) {
        Map<String, PendingLine> pending = new LinkedHashMap<>();

        buckets.getRegular().forEach((code, hours) ->
                merge(pending, code, representativeDate, Classification.REGULAR, hours));
        buckets.getOvertime().forEach((code, hours) ->
                merge(pending, code, representativeDate, Classification.OVERTIME, hours));
        buckets.getStatutory().forEach((code, hours) ->
                merge(pending, code, representativeDate, Classification.STATUTORY, hours));
        buckets.getPassthrough().forEach((code, hours) -> {
            Classification classification = buckets.passthroughClassificationOf(code);
            LocalDate date = classification == Classification.ENTITLEMENT
                    ? passthroughDates.getOrDefault(code, representativeDate)
                    : representativeDate;
            merge(pending, code, date, classification, hours);
        });

        if (entitlementHours != null && entitlementHours.signum() > 0 && phpDate != null) {
            merge(pending, HolidayEntitlementService.PHP_LABEL, phpDate, Classification.ENTITLEMENT, entitlementHours);
        }

        List<OutputLineDTO> lines = new ArrayList<>();
        pending.forEach((code, line) -> lines.add(OutputLineDTO.builder()
                .employee(employee)
                .transactionDate(line.date())
                .customer(markers.customer())
                .serviceItem(markers.serviceItem())
                .payrollItem(code)
                .duration(round(line.hours()))
                .lineClass("")
                .billable(NOT_BILLABLE)
                .notes("")
                .classification(line.classification())
                .build()));
        lines.sort(LINE_ORDER);
        return lines;
    }

    public static BigDecimal round(BigDecimal value) {
        return value.setScale(2, RoundingMode.HALF_UP);
    }

    private void merge(Map<String, PendingLine> pending, String code, LocalDate date,
                       Classification classification, BigDecimal hours) {
        pending.merge(code, new PendingLine(date, classification, hours),
                (existing, added) -> existing.plus(added.hours()));
    }
}
