package sp.sistemaspalacios.api_payroll.entity.boundaries.holiday;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDate;
import java.time.LocalDateTime;

@Entity
@Table(name = "statutory_holidays")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StatutoryHoliday {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "holiday_date", nullable = false, unique = true)
    private LocalDate holidayDate;

    // Ventana de referencia para el cálculo de PHP (inclusiva)
    @Column(name = "lookback_start", nullable = false)
    private LocalDate lookbackStart;

    @Column(name = "lookback_end", nullable = false)
    private LocalDate lookbackEnd;

    private String description;

    @Column(name = "record_date", nullable = false)
    private LocalDateTime recordDate;

    @PrePersist
    public void prePersist() {
        if (this.recordDate == null) {
            this.recordDate = LocalDateTime.now();
        }
    }
}
