package sp.sistemaspalacios.api_payroll.service.payroll.vacation;

import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Service
public class VacationPercentService {

    public static final BigDecimal DEFAULT_VACATION = new BigDecimal("0.04");

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    // "6%", "6 %", "6.5 percent", "Vacation: 4 Percent"
    private static final Pattern PERCENT_PATTERN =
            Pattern.compile("(\\d+(?:\\.\\d+)?)\\s*(?:%|percent\\b)", Pattern.CASE_INSENSITIVE);

    /** Porcentaje de vacaciones de una nota, o 4% si no trae ninguno. */
    public BigDecimal extract(String note) {
        return find(note).orElse(DEFAULT_VACATION);
    }

    /** Solo coincidencias explícitas. */
    public Optional<BigDecimal> find(String note) {
        if (note == null || note.isBlank()) return Optional.empty();
        Matcher matcher = PERCENT_PATTERN.matcher(note);
        if (!matcher.find()) return Optional.empty();
        return Optional.of(new BigDecimal(matcher.group(1)).divide(HUNDRED));
    }

    /** Máximo porcentaje explícito entre varias notas; 4% si ninguna trae porcentaje. */
    public BigDecimal maxFound(Collection<String> notes) {
        return notes.stream()
                .filter(Objects::nonNull)
                .map(this::find)
                .flatMap(Optional::stream)
                .max(BigDecimal::compareTo)
                .orElse(DEFAULT_VACATION);
    }
}
