package sp.sistemaspalacios.api_payroll.service.payroll.time;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import sp.sistemaspalacios.api_payroll.domain.payroll.ShiftRecord;
import sp.sistemaspalacios.api_payroll.domain.payroll.ShiftSegment;
import sp.sistemaspalacios.api_payroll.service.common.TimeService;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Parte un turno en segmentos por día calendario usando la hora real de entrada y salida.
 * Sin horas legibles, todo el turno se atribuye a su fecha nominal.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ShiftSegmentationService {

    private final TimeService timeService;

    public List<ShiftSegment> segment(ShiftRecord record,
                                      String startTime,
                                      String endTime,
                                      Set<LocalDate> statutoryDates) {
        Optional<LocalTime> start = timeService.tryParse(startTime);
        Optional<LocalTime> end = timeService.tryParse(endTime);

        // Modo degradado: sin horario detallado (o entrada == salida) se usa la fecha del turno
        if (start.isEmpty() || end.isEmpty() || start.get().equals(end.get())) {
            return List.of(ShiftSegment.whole(record, statutoryDates.contains(record.transactionDate())));
        }

        LocalDate shiftDate = record.transactionDate();
        LocalDateTime from = shiftDate.atTime(start.get());
        LocalDateTime to = end.get().isBefore(start.get())
                ? shiftDate.plusDays(1).atTime(end.get())
                : shiftDate.atTime(end.get());

        List<ShiftSegment> segments = new ArrayList<>();
        LocalDateTime cursor = from;
        int order = 0;
        while (cursor.isBefore(to)) {
            LocalDateTime nextMidnight = cursor.toLocalDate().plusDays(1).atStartOfDay();
            LocalDateTime segmentEnd = nextMidnight.isBefore(to) ? nextMidnight : to;
            BigDecimal hours = timeService.hoursBetween(cursor, segmentEnd);

            if (hours.signum() > 0) {
                LocalDate day = cursor.toLocalDate();
                segments.add(new ShiftSegment(record, day, hours, statutoryDates.contains(day), order++));
            }
            cursor = segmentEnd;
        }

        if (segments.size() > 1) {
            log.debug("Turno de {} del {} partido en {} segmentos", record.employee(), shiftDate, segments.size());
        }
        return segments;
    }
}
