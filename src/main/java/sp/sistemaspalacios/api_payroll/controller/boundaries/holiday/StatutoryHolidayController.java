package sp.sistemaspalacios.api_payroll.controller.boundaries.holiday;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import sp.sistemaspalacios.api_payroll.dto.payroll.StatutoryHolidayConfigDTO;
import sp.sistemaspalacios.api_payroll.entity.boundaries.holiday.StatutoryHoliday;
import sp.sistemaspalacios.api_payroll.service.boundaries.holiday.StatutoryHolidayService;

import java.util.List;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/statutory-holidays")
public class StatutoryHolidayController {

    private final StatutoryHolidayService holidayService;

    public StatutoryHolidayController(StatutoryHolidayService holidayService) {
        this.holidayService = holidayService;
    }

    // Obtener todos los festivos con su ventana de referencia
    @GetMapping
    public List<StatutoryHolidayConfigDTO> getAllHolidays() {
        return holidayService.getAllHolidays().stream()
                .map(StatutoryHolidayService::toDto)
                .collect(Collectors.toList());
    }

    // Obtener un festivo por su ID
    @GetMapping("/{id}")
    public ResponseEntity<StatutoryHolidayConfigDTO> getHolidayById(@PathVariable("id") Long id) {
        return holidayService.getHolidayById(id)
                .map(StatutoryHolidayService::toDto)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND).build());
    }

    // Crear un nuevo festivo
    @PostMapping
    public ResponseEntity<StatutoryHolidayConfigDTO> createHoliday(@RequestBody StatutoryHolidayConfigDTO holiday) {
        StatutoryHoliday created = holidayService.createHoliday(holiday);
        return ResponseEntity.status(HttpStatus.CREATED).body(StatutoryHolidayService.toDto(created));
    }

    // Actualizar un festivo
    @PutMapping("/{id}")
    public ResponseEntity<StatutoryHolidayConfigDTO> updateHoliday(@PathVariable("id") Long id,
                                                                   @RequestBody StatutoryHolidayConfigDTO holiday) {
        StatutoryHoliday updated = holidayService.updateHoliday(id, holiday);
        return ResponseEntity.ok(StatutoryHolidayService.toDto(updated));
    }

    // Eliminar un festivo
    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteHoliday(@PathVariable("id") Long id) {
        holidayService.deleteHoliday(id);
        return ResponseEntity.noContent().build();
    }
}
