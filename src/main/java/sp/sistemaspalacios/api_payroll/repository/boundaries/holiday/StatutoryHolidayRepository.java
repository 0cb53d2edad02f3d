package sp.sistemaspalacios.api_payroll.repository.boundaries.holiday;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import sp.sistemaspalacios.api_payroll.entity.boundaries.holiday.StatutoryHoliday;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

@Repository
public interface StatutoryHolidayRepository extends JpaRepository<StatutoryHoliday, Long> {

    boolean existsByHolidayDate(LocalDate holidayDate);

    Optional<StatutoryHoliday> findByHolidayDate(LocalDate holidayDate);

    List<StatutoryHoliday> findByHolidayDateBetweenOrderByHolidayDateAsc(LocalDate start, LocalDate end);
}
