package sp.sistemaspalacios.api_payroll.service.payroll.rate;

import org.springframework.stereotype.Service;
import sp.sistemaspalacios.api_payroll.domain.payroll.Classification;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Interpreta las etiquetas de tarifa ("Payroll Item").
 * Las etiquetas de salida se comparan por igualdad exacta en el sistema contable,
 * por eso las variantes OT/STAT se mantienen literales, espacios incluidos.
 */
@Service
public class RateCodeService {

    public static final String REGULAR_CODE = "Regular";
    public static final BigDecimal REGULAR_RATE = new BigDecimal("17.60");

    public static final String REGULAR_OVERTIME_CODE = "Hourly Overtime /STAT";
    public static final String RATE_2175_OVERTIME_CODE = "21.75 Rate OT/STAT";
    public static final String OVERTIME_SUFFIX = " OT/ STAT";

    // Sufijos previos que se quitan antes de volver a etiquetar
    private static final List<String> EXISTING_SUFFIXES = List.of(" OT/  STAT", " OT/ STAT", " OT/STAT");

    private static final Pattern RATE_PATTERN =
            Pattern.compile("^\\s*(\\d+(?:\\.\\d+)?)[\\s_-]+rate\\b", Pattern.CASE_INSENSITIVE);

    // 21.75 como número propio: "121.75 Rate" o "21.750 Rate" no son esta tarifa
    private static final Pattern RATE_2175 = Pattern.compile("(?<![\\d.])21\\.75(?![\\d])");

    private static final Pattern TOKEN_SEPARATOR = Pattern.compile("[\\s/()]+");

    private record Rule(Predicate<String> applies, UnaryOperator<String> variant) {}

    // El orden importa: gana la primera regla que aplica
    private final List<Rule> overtimeRules = List.of(
            new Rule(code -> REGULAR_CODE.equalsIgnoreCase(code.trim()), code -> REGULAR_OVERTIME_CODE),
            new Rule(code -> RATE_2175.matcher(code).find() && !tokens(code).contains("OT"), code -> RATE_2175_OVERTIME_CODE),
            new Rule(code -> true, code -> stripExistingSuffix(code) + OVERTIME_SUFFIX)
    );

    /**
     * Tarifa por hora de una etiqueta. "Regular" vale 17.60, "21.75 Rate" vale 21.75;
     * cualquier otra cosa vale 0 (sin tarifa).
     */
    public BigDecimal rateFor(String code) {
        if (code == null || code.isBlank()) return BigDecimal.ZERO;
        if (REGULAR_CODE.equalsIgnoreCase(code.trim())) return REGULAR_RATE;

        Matcher matcher = RATE_PATTERN.matcher(code);
        if (matcher.find()) {
            return new BigDecimal(matcher.group(1));
        }
        return BigDecimal.ZERO;
    }

    /** Etiqueta de horas extra / festivo para una tarifa base. */
    public String overtimeVariant(String code) {
        String safe = code == null ? "" : code;
        return overtimeRules.stream()
                .filter(rule -> rule.applies().test(safe))
                .findFirst()
                .map(rule -> rule.variant().apply(safe))
                .orElseThrow();
    }

    /**
     * Clasificación de una etiqueta tal como llega en la entrada.
     * Se evalúa por palabras completas: "BOTTLE Rate" no es una etiqueta OT.
     */
    public Classification classify(String label) {
        if (label == null || label.isBlank()) return Classification.UNCLASSIFIED;
        if (REGULAR_OVERTIME_CODE.equalsIgnoreCase(label.trim())) return Classification.OVERTIME;

        Set<String> tokens = tokens(label);
        if (tokens.contains("PHP")) return Classification.ENTITLEMENT;
        if (tokens.contains("OT")) return Classification.OVERTIME;
        if (tokens.contains("STAT")) return Classification.STATUTORY;
        return Classification.UNCLASSIFIED;
    }

    private static Set<String> tokens(String label) {
        return Arrays.stream(TOKEN_SEPARATOR.split(label.toUpperCase(Locale.ROOT)))
                .filter(token -> !token.isEmpty())
                .collect(Collectors.toSet());
    }

    private static String stripExistingSuffix(String code) {
        for (String suffix : EXISTING_SUFFIXES) {
            if (code.endsWith(suffix)) {
                return code.substring(0, code.length() - suffix.length());
            }
        }
        return code;
    }
}
