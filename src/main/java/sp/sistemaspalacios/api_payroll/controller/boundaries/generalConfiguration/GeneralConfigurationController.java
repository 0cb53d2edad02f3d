package sp.sistemaspalacios.api_payroll.controller.boundaries.generalConfiguration;

import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import sp.sistemaspalacios.api_payroll.dto.configuration.GeneralConfigurationDTO;
import sp.sistemaspalacios.api_payroll.entity.boundaries.generalConfiguration.GeneralConfiguration;
import sp.sistemaspalacios.api_payroll.service.boundaries.generalConfiguration.GeneralConfigurationService;

import java.util.Map;

@RestController
@RequestMapping("/api/config")
@RequiredArgsConstructor
public class GeneralConfigurationController {

    private final GeneralConfigurationService service;

    /**
     * 🔸 Guarda el texto de un marcador de salida (OUTPUT_CUSTOMER, OUTPUT_SERVICE_ITEM)
     */
    @PostMapping("/{type}")
    public ResponseEntity<Map<String, String>> setConfig(@PathVariable("type") String type,
                                                         @RequestBody GeneralConfigurationDTO dto) {
        GeneralConfiguration config = service.saveOrUpdate(type, dto.getValue());
        return ResponseEntity.ok(Map.of(
                "message", "Guardado exitosamente",
                "type", config.getType(),
                "value", config.getValue()
        ));
    }

    /**
     * 🔸 Consulta el valor vigente (guardado o por defecto)
     */
    @GetMapping("/{type}")
    public ResponseEntity<Map<String, String>> getConfig(@PathVariable("type") String type) {
        String value = service.getValueOrDefault(type);
        return ResponseEntity.ok(Map.of(
                "type", type.trim().toUpperCase(java.util.Locale.ROOT),
                "value", value
        ));
    }
}
