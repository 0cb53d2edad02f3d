package sp.sistemaspalacios.api_payroll.service.common;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Optional;

@Slf4j
@Service
public class TimeService {

    // Acepta 24h: "H:mm" y "H:mm:ss"
    private static final DateTimeFormatter H_MM = DateTimeFormatter.ofPattern("H:mm");
    private static final DateTimeFormatter H_MM_SS = DateTimeFormatter.ofPattern("H:mm:ss");

    // Acepta 12h: "h:mm a" (AM/PM con o sin espacio, mayúsc/minúsc)
    private static final DateTimeFormatter F12 = DateTimeFormatter.ofPattern("h:mm a", Locale.US);

    private static final BigDecimal SECONDS_PER_HOUR = BigDecimal.valueOf(3600);

    public LocalTime parseAny(String raw) {
        if (raw == null) throw new IllegalArgumentException("Hora nula");

        String s = raw.trim().toUpperCase(Locale.US);

        // Aceptar también sin espacio entre hora y AM/PM (p.ej. "07:00AM")
        if (s.matches("^\\d{1,2}:\\d{2}(AM|PM)$")) {
            s = s.replaceAll("(AM|PM)$", " $1");
        }

        if (s.endsWith("AM") || s.endsWith("PM")) {
            return LocalTime.parse(s, F12);
        }
        if (s.length() > 5) {
            return LocalTime.parse(s, H_MM_SS);
        }
        return LocalTime.parse(s, H_MM);
    }

    /** Igual que {@link #parseAny(String)} pero sin fallar: vacío si falta o no se puede leer. */
    public Optional<LocalTime> tryParse(String raw) {
        if (raw == null || raw.isBlank()) return Optional.empty();
        try {
            return Optional.of(parseAny(raw));
        } catch (DateTimeParseException e) {
            log.debug("Hora ilegible '{}': {}", raw, e.getMessage());
            return Optional.empty();
        }
    }

    /** Horas fraccionarias entre dos instantes, sin redondear a 2 decimales. */
    public BigDecimal hoursBetween(LocalDateTime start, LocalDateTime end) {
        long seconds = Duration.between(start, end).getSeconds();
        if (seconds <= 0) return BigDecimal.ZERO;
        return BigDecimal.valueOf(seconds).divide(SECONDS_PER_HOUR, MathContext.DECIMAL64);
    }
}
