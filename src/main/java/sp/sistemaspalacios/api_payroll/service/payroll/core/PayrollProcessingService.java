package sp.sistemaspalacios.api_payroll.service.payroll.core;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import sp.sistemaspalacios.api_payroll.domain.payroll.Classification;
import sp.sistemaspalacios.api_payroll.domain.payroll.HolidayWindow;
import sp.sistemaspalacios.api_payroll.domain.payroll.HourBuckets;
import sp.sistemaspalacios.api_payroll.domain.payroll.PayPeriod;
import sp.sistemaspalacios.api_payroll.domain.payroll.ShiftRecord;
import sp.sistemaspalacios.api_payroll.domain.payroll.ShiftSegment;
import sp.sistemaspalacios.api_payroll.dto.payroll.*;
import sp.sistemaspalacios.api_payroll.exception.InvalidPayrollConfigurationException;
import sp.sistemaspalacios.api_payroll.exception.InvalidShiftRecordException;
import sp.sistemaspalacios.api_payroll.service.boundaries.holiday.StatutoryHolidayService;
import sp.sistemaspalacios.api_payroll.service.payroll.holiday.HolidayEntitlementService;
import sp.sistemaspalacios.api_payroll.service.payroll.output.PayrollOutputService;
import sp.sistemaspalacios.api_payroll.service.payroll.overtime.OvertimeAllocationService;
import sp.sistemaspalacios.api_payroll.service.payroll.rate.RateCodeService;
import sp.sistemaspalacios.api_payroll.service.payroll.time.ShiftSegmentationService;
import sp.sistemaspalacios.api_payroll.service.payroll.union.UnionBenefitService;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Orquesta una corrida: normaliza, segmenta, reparte OT por empleado, agrega el PHP y consolida.
 * No modifica los registros recibidos; trabaja sobre copias normalizadas.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PayrollProcessingService {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final RateCodeService rateCodeService;
    private final ShiftSegmentationService segmentationService;
    private final OvertimeAllocationService overtimeAllocationService;
    private final HolidayEntitlementService entitlementService;
    private final UnionBenefitService unionBenefitService;
    private final PayrollOutputService outputService;
    private final StatutoryHolidayService statutoryHolidayService;

    private record TimeKey(String employee, LocalDate date) {}

    public PayrollRunResponse process(PayrollRunRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("La solicitud de nómina es obligatoria");
        }
        PayPeriod period = toPayPeriod(request.getPayPeriod());
        List<ShiftRecord> records = normalize(request.getRecords());
        List<HolidayWindow> holidays = resolveHolidays(request.getHolidays(), period);

        Set<LocalDate> statutoryDates = holidays.stream()
                .map(HolidayWindow::holidayDate)
                .collect(Collectors.toSet());
        LocalDate phpDate = entitlementService.phpDate(holidays, period).orElse(null);
        Map<TimeKey, TimeDetailDTO> timeDetails = indexTimeDetails(request.getTimeDetails());

        // Todos los registros con horas, agrupados por empleado (la ventana de PHP puede salir del período)
        Map<String, List<ShiftRecord>> allByEmployee = records.stream()
                .filter(ShiftRecord::hasHours)
                .collect(Collectors.groupingBy(ShiftRecord::employee, TreeMap::new, Collectors.toList()));

        Map<String, List<ShiftRecord>> inPeriodByEmployee = records.stream()
                .filter(ShiftRecord::hasHours)
                .filter(r -> period.contains(r.transactionDate()))
                .collect(Collectors.groupingBy(ShiftRecord::employee, TreeMap::new, Collectors.toList()));

        PayrollOutputService.OutputMarkers markers = outputService.resolveMarkers();
        List<OutputLineDTO> lines = new ArrayList<>();
        BigDecimal totalRegular = BigDecimal.ZERO;
        BigDecimal totalOvertime = BigDecimal.ZERO;
        BigDecimal totalStatutory = BigDecimal.ZERO;
        BigDecimal totalEntitlement = BigDecimal.ZERO;
        int participatingRows = 0;

        Map<TimeKey, Long> recordsNeedingTimes = countRecordsNeedingTimes(inPeriodByEmployee);
        int employeesProcessed = 0;

        // El PHP se calcula para todo empleado con horas, tenga o no filas dentro del período
        for (Map.Entry<String, List<ShiftRecord>> entry : allByEmployee.entrySet()) {
            String employee = entry.getKey();
            List<ShiftRecord> employeeRecords = inPeriodByEmployee.getOrDefault(employee, List.of());

            if (employeeRecords.isEmpty()) {
                BigDecimal entitlement = entitlementService.entitlementHours(entry.getValue(), holidays);
                if (entitlement.signum() <= 0 || phpDate == null) continue;

                log.debug("Empleado {} sin turnos en el período; solo se emite su línea PHP", employee);
                lines.addAll(outputService.buildLines(employee, phpDate, new HourBuckets(),
                        Map.of(), entitlement, phpDate, markers));
                totalEntitlement = totalEntitlement.add(entitlement);
                employeesProcessed++;
                continue;
            }
            participatingRows += employeeRecords.size();
            employeesProcessed++;

            List<ShiftSegment> segments = new ArrayList<>();
            for (ShiftRecord record : employeeRecords) {
                segments.addAll(segmentsOf(record, timeDetails, recordsNeedingTimes, statutoryDates));
            }
            HourBuckets buckets = overtimeAllocationService.allocate(segments);

            // Si la entrada ya trae su línea PHP, no se vuelve a calcular
            BigDecimal entitlement = buckets.hasPassthrough(Classification.ENTITLEMENT)
                    ? BigDecimal.ZERO
                    : entitlementService.entitlementHours(entry.getValue(), holidays);

            LocalDate representativeDate = employeeRecords.stream()
                    .map(ShiftRecord::transactionDate)
                    .min(Comparator.naturalOrder())
                    .orElseThrow();

            lines.addAll(outputService.buildLines(employee, representativeDate, buckets,
                    passthroughDates(employeeRecords), entitlement, phpDate, markers));

            totalRegular = totalRegular.add(buckets.totalRegular());
            totalOvertime = totalOvertime.add(buckets.totalOvertime());
            totalStatutory = totalStatutory.add(buckets.totalStatutory());
            totalEntitlement = totalEntitlement.add(buckets.totalPassthroughEntitlement()).add(entitlement);
        }

        lines.sort(PayrollOutputService.LINE_ORDER);

        PayrollStatsDTO stats = PayrollStatsDTO.builder()
                .employeesProcessed(employeesProcessed)
                .inputRows(records.size())
                .participatingRows(participatingRows)
                .outputLines(lines.size())
                .reductionPercent(reductionPercent(records.size(), lines.size()))
                .totalRegularHours(PayrollOutputService.round(totalRegular))
                .totalOvertimeHours(PayrollOutputService.round(totalOvertime))
                .totalStatutoryHours(PayrollOutputService.round(totalStatutory))
                .totalEntitlementHours(PayrollOutputService.round(totalEntitlement))
                .build();

        log.info("✅ Nómina {} a {}: {} empleados, {} registros -> {} líneas (OT {} h, STAT {} h, PHP {} h)",
                period.startDate(), period.endDate(), stats.getEmployeesProcessed(), stats.getInputRows(),
                stats.getOutputLines(), stats.getTotalOvertimeHours(), stats.getTotalStatutoryHours(),
                stats.getTotalEntitlementHours());
        return new PayrollRunResponse(lines, stats);
    }

    public UnionBenefitResponse calculateUnionBenefits(UnionBenefitRequest request) {
        List<ShiftRecord> records = normalize(request == null ? null : request.getRecords());
        List<UnionBenefitLineDTO> lines = unionBenefitService.calculate(records);

        BigDecimal totalPayable = lines.stream()
                .map(UnionBenefitLineDTO::getTotalPayable)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal totalCost = lines.stream()
                .map(UnionBenefitLineDTO::getTotalCost)
                .reduce(BigDecimal.ZERO, BigDecimal::add);

        return new UnionBenefitResponse(unionBenefitService.week1End(records).orElse(null),
                lines, PayrollOutputService.round(totalPayable), PayrollOutputService.round(totalCost));
    }

    // ===== NORMALIZACIÓN =====

    List<ShiftRecord> normalize(List<ShiftRecordDTO> input) {
        if (input == null) {
            return new ArrayList<>();
        }
        List<ShiftRecord> records = new ArrayList<>(input.size());
        for (int i = 0; i < input.size(); i++) {
            ShiftRecordDTO dto = input.get(i);
            if (dto == null) {
                throw new InvalidShiftRecordException(i, "registro vacío");
            }
            if (dto.getEmployee() == null || dto.getEmployee().isBlank()) {
                throw new InvalidShiftRecordException(i, "falta el empleado");
            }
            if (dto.getTransactionDate() == null) {
                throw new InvalidShiftRecordException(i, "falta la fecha de transacción (" + dto.getEmployee() + ")");
            }

            String payrollItem = dto.getPayrollItem() == null ? "" : dto.getPayrollItem().trim();
            Classification classification = dto.getClassification() != null
                    ? dto.getClassification()
                    : rateCodeService.classify(payrollItem);

            records.add(new ShiftRecord(i, dto.getEmployee().trim(), dto.getTransactionDate(),
                    dto.getStartTime(), dto.getEndTime(), dto.getDuration(), payrollItem,
                    dto.getNotes(), classification));
        }
        return records;
    }

    private PayPeriod toPayPeriod(PayPeriodDTO dto) {
        if (dto == null || dto.getStartDate() == null || dto.getEndDate() == null) {
            throw new InvalidPayrollConfigurationException("El período de pago requiere fecha de inicio y fin");
        }
        if (dto.getStartDate().isAfter(dto.getEndDate())) {
            throw new InvalidPayrollConfigurationException("El período de pago inicia después de terminar");
        }
        return new PayPeriod(dto.getStartDate(), dto.getEndDate());
    }

    /**
     * Festivos de la corrida: los que vienen en la solicitud, o los guardados dentro del período.
     * Si se configuran festivos, al menos uno debe caer dentro del período (fecha de la línea PHP).
     */
    private List<HolidayWindow> resolveHolidays(List<StatutoryHolidayConfigDTO> requested, PayPeriod period) {
        List<HolidayWindow> holidays;
        if (requested == null || requested.isEmpty()) {
            holidays = statutoryHolidayService.findWindowsWithin(period.startDate(), period.endDate());
        } else {
            holidays = new ArrayList<>();
            for (StatutoryHolidayConfigDTO dto : requested) {
                try {
                    StatutoryHolidayService.validate(dto);
                } catch (IllegalArgumentException e) {
                    throw new InvalidPayrollConfigurationException(e.getMessage());
                }
                holidays.add(new HolidayWindow(dto.getHolidayDate(), dto.getLookbackStart(), dto.getLookbackEnd()));
            }
        }

        if (!holidays.isEmpty() && entitlementService.phpDate(holidays, period).isEmpty()) {
            throw new InvalidPayrollConfigurationException("Ningún festivo configurado cae dentro del período "
                    + period.startDate() + " a " + period.endDate());
        }
        return holidays;
    }

    private Map<TimeKey, TimeDetailDTO> indexTimeDetails(List<TimeDetailDTO> details) {
        Map<TimeKey, TimeDetailDTO> index = new HashMap<>();
        if (details == null) return index;
        for (TimeDetailDTO detail : details) {
            if (detail == null || detail.getEmployee() == null || detail.getDate() == null) continue;
            index.putIfAbsent(new TimeKey(detail.getEmployee().trim(), detail.getDate()), detail);
        }
        return index;
    }

    private List<ShiftSegment> segmentsOf(ShiftRecord record,
                                          Map<TimeKey, TimeDetailDTO> timeDetails,
                                          Map<TimeKey, Long> recordsNeedingTimes,
                                          Set<LocalDate> statutoryDates) {
        if (record.classification().isFinished()) {
            return List.of(ShiftSegment.whole(record, false));
        }

        String start = record.startTime();
        String end = record.endTime();
        if (needsTimes(record)) {
            TimeKey key = new TimeKey(record.employee(), record.transactionDate());
            TimeDetailDTO detail = timeDetails.get(key);
            // Un solo par de horas no se puede repartir entre varios registros del mismo día
            if (detail != null && recordsNeedingTimes.getOrDefault(key, 0L) == 1L) {
                start = detail.getStartTime();
                end = detail.getEndTime();
            } else if (detail != null) {
                log.debug("Horario de {} el {} compartido por {} registros; se usa la fecha nominal",
                        record.employee(), record.transactionDate(), recordsNeedingTimes.get(key));
            }
        }
        return segmentationService.segment(record, start, end, statutoryDates);
    }

    private Map<TimeKey, Long> countRecordsNeedingTimes(Map<String, List<ShiftRecord>> byEmployee) {
        return byEmployee.values().stream()
                .flatMap(List::stream)
                .filter(record -> !record.classification().isFinished())
                .filter(PayrollProcessingService::needsTimes)
                .collect(Collectors.groupingBy(
                        record -> new TimeKey(record.employee(), record.transactionDate()),
                        Collectors.counting()));
    }

    private static boolean needsTimes(ShiftRecord record) {
        return isBlank(record.startTime()) || isBlank(record.endTime());
    }

    // Fecha más temprana de cada etiqueta ya terminada
    private Map<String, LocalDate> passthroughDates(List<ShiftRecord> records) {
        Map<String, LocalDate> dates = new HashMap<>();
        for (ShiftRecord record : records) {
            if (record.classification().isFinished()) {
                dates.merge(record.payrollItem(), record.transactionDate(),
                        (a, b) -> a.isBefore(b) ? a : b);
            }
        }
        return dates;
    }

    private BigDecimal reductionPercent(int inputRows, int outputLines) {
        if (inputRows == 0) return BigDecimal.ZERO.setScale(2);
        BigDecimal ratio = BigDecimal.valueOf(outputLines)
                .multiply(HUNDRED)
                .divide(BigDecimal.valueOf(inputRows), 10, RoundingMode.HALF_UP);
        return PayrollOutputService.round(HUNDRED.subtract(ratio));
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
