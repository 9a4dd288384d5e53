package com.markethours.repository.jpa;

import com.markethours.entity.EarlyCloseOverrideEntity;
import java.time.LocalDate;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface EarlyCloseOverrideJpaRepository extends JpaRepository<EarlyCloseOverrideEntity, LocalDate> {

    List<EarlyCloseOverrideEntity> findAllByOrderByDateAsc();

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM EarlyCloseOverrideEntity e WHERE e.date BETWEEN :start AND :end")
    int deleteByDateRange(@Param("start") LocalDate start, @Param("end") LocalDate end);
}
