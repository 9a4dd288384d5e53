package com.markethours.repository.jpa;

import com.markethours.entity.HolidayEntity;
import java.time.LocalDate;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the holidays table.
 * Range deletes back the full-replace commit of a refresh cycle.
 */
@Repository
public interface HolidayJpaRepository extends JpaRepository<HolidayEntity, LocalDate> {

    List<HolidayEntity> findAllByOrderByDateAsc();

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM HolidayEntity h WHERE h.date BETWEEN :start AND :end")
    int deleteByDateRange(@Param("start") LocalDate start, @Param("end") LocalDate end);
}
