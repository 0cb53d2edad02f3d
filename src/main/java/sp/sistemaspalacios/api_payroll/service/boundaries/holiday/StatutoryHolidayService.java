package sp.sistemaspalacios.api_payroll.service.boundaries.holiday;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import sp.sistemaspalacios.api_payroll.domain.payroll.HolidayWindow;
import sp.sistemaspalacios.api_payroll.dto.payroll.StatutoryHolidayConfigDTO;
import sp.sistemaspalacios.api_payroll.entity.boundaries.holiday.StatutoryHoliday;
import sp.sistemaspalacios.api_payroll.exception.ResourceNotFoundException;
import sp.sistemaspalacios.api_payroll.repository.boundaries.holiday.StatutoryHolidayRepository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

@Service
public class StatutoryHolidayService {

    private final StatutoryHolidayRepository holidayRepository;

    public StatutoryHolidayService(StatutoryHolidayRepository holidayRepository) {
        this.holidayRepository = holidayRepository;
    }

    @Transactional(readOnly = true)
    public List<StatutoryHoliday> getAllHolidays() {
        return holidayRepository.findAll();
    }

    @Transactional(readOnly = true)
    public Optional<StatutoryHoliday> getHolidayById(Long id) {
        return holidayRepository.findById(id);
    }

    /** Festivos guardados cuya fecha cae dentro del período (inclusivo), ordenados por fecha. */
    @Transactional(readOnly = true)
    public List<HolidayWindow> findWindowsWithin(LocalDate start, LocalDate end) {
        return holidayRepository.findByHolidayDateBetweenOrderByHolidayDateAsc(start, end).stream()
                .map(h -> new HolidayWindow(h.getHolidayDate(), h.getLookbackStart(), h.getLookbackEnd()))
                .collect(Collectors.toList());
    }

    @Transactional
    public StatutoryHoliday createHoliday(StatutoryHolidayConfigDTO dto) {
        validate(dto);
        if (holidayRepository.existsByHolidayDate(dto.getHolidayDate())) {
            throw new IllegalArgumentException("Ya existe un festivo para la fecha " + dto.getHolidayDate());
        }
        StatutoryHoliday holiday = StatutoryHoliday.builder()
                .holidayDate(dto.getHolidayDate())
                .lookbackStart(dto.getLookbackStart())
                .lookbackEnd(dto.getLookbackEnd())
                .description(dto.getDescription())
                .build();
        return holidayRepository.save(holiday);
    }

    @Transactional
    public StatutoryHoliday updateHoliday(Long id, StatutoryHolidayConfigDTO dto) {
        StatutoryHoliday holiday = holidayRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Holiday not found with id " + id));
        validate(dto);
        holidayRepository.findByHolidayDate(dto.getHolidayDate())
                .filter(other -> !other.getId().equals(id))
                .ifPresent(other -> {
                    throw new IllegalArgumentException("Ya existe un festivo para la fecha " + dto.getHolidayDate());
                });

        holiday.setHolidayDate(dto.getHolidayDate());
        holiday.setLookbackStart(dto.getLookbackStart());
        holiday.setLookbackEnd(dto.getLookbackEnd());
        holiday.setDescription(dto.getDescription());
        return holidayRepository.save(holiday);
    }

    @Transactional
    public void deleteHoliday(Long id) {
        StatutoryHoliday holiday = holidayRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Holiday not found with id " + id));
        holidayRepository.delete(holiday);
    }

    public static StatutoryHolidayConfigDTO toDto(StatutoryHoliday holiday) {
        return StatutoryHolidayConfigDTO.builder()
                .id(holiday.getId())
                .holidayDate(holiday.getHolidayDate())
                .lookbackStart(holiday.getLookbackStart())
                .lookbackEnd(holiday.getLookbackEnd())
                .description(holiday.getDescription())
                .build();
    }

    /** Misma validación para festivos guardados y para los que llegan en la corrida. */
    public static void validate(StatutoryHolidayConfigDTO dto) {
        if (dto == null || dto.getHolidayDate() == null) {
            throw new IllegalArgumentException("La fecha del festivo es obligatoria");
        }
        if (dto.getLookbackStart() == null || dto.getLookbackEnd() == null) {
            throw new IllegalArgumentException("La ventana de referencia del festivo " + dto.getHolidayDate()
                    + " requiere inicio y fin");
        }
        if (dto.getLookbackStart().isAfter(dto.getLookbackEnd())) {
            throw new IllegalArgumentException("La ventana de referencia del festivo " + dto.getHolidayDate()
                    + " inicia después de terminar");
        }
    }
}
