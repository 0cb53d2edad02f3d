package sp.sistemaspalacios.api_payroll.entity.boundaries.generalConfiguration;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;

/**
 * Texto configurable que se estampa en cada línea de salida (cliente, ítem de servicio).
 */
@Entity
@Table(name = "payroll_output_settings")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GeneralConfiguration {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    // OUTPUT_CUSTOMER | OUTPUT_SERVICE_ITEM
    @Column(name = "setting_type", nullable = false, unique = true, length = 40)
    private String type;

    @Column(name = "setting_value", nullable = false, length = 120)
    private String value;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;
}
