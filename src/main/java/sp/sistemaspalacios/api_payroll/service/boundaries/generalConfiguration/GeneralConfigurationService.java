package sp.sistemaspalacios.api_payroll.service.boundaries.generalConfiguration;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import sp.sistemaspalacios.api_payroll.entity.boundaries.generalConfiguration.GeneralConfiguration;
import sp.sistemaspalacios.api_payroll.repository.boundaries.generalConfiguration.GeneralConfigurationRepository;

import java.util.Locale;
import java.util.Map;

@Service
@RequiredArgsConstructor
public class GeneralConfigurationService {

    public static final String OUTPUT_CUSTOMER = "OUTPUT_CUSTOMER";
    public static final String OUTPUT_SERVICE_ITEM = "OUTPUT_SERVICE_ITEM";

    // Valores por defecto cuando no hay fila en BD
    private static final Map<String, String> DEFAULTS = Map.of(
            OUTPUT_CUSTOMER, "STAR TOTAL",
            OUTPUT_SERVICE_ITEM, "Labor"
    );

    private final GeneralConfigurationRepository repository;

    /**
     * Valor guardado o, si no existe, el valor por defecto del tipo.
     */
    @Transactional(readOnly = true)
    public String getValueOrDefault(String type) {
        String key = normalizeType(type);
        return repository.findByType(key)
                .map(GeneralConfiguration::getValue)
                .orElse(DEFAULTS.get(key));
    }

    /**
     * 🔹 Guardar o actualizar una configuración
     */
    @Transactional
    public GeneralConfiguration saveOrUpdate(String type, String rawValue) {
        String key = normalizeType(type);
        if (rawValue == null || rawValue.isBlank()) {
            throw new IllegalArgumentException("El valor para " + key + " no puede estar vacío.");
        }

        GeneralConfiguration existing = repository.findByType(key).orElse(null);
        if (existing == null) {
            existing = new GeneralConfiguration();
            existing.setType(key);
        }

        existing.setValue(rawValue.trim());
        return repository.save(existing);
    }

    private String normalizeType(String type) {
        String key = type == null ? "" : type.trim().toUpperCase(Locale.ROOT);
        if (!DEFAULTS.containsKey(key)) {
            throw new IllegalArgumentException("Tipo de configuración desconocido: " + type);
        }
        return key;
    }
}
