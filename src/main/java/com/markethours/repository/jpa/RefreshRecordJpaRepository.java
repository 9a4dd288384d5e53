package com.markethours.repository.jpa;

import com.markethours.domain.enums.RefreshStatus;
import com.markethours.entity.RefreshRecordEntity;
import java.util.List;
import java.util.Optional;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the refresh_records table.
 * The latest SUCCESS row is the current calendar version.
 */
@Repository
public interface RefreshRecordJpaRepository extends JpaRepository<RefreshRecordEntity, Long> {

    Optional<RefreshRecordEntity> findFirstByOrderByRunAtDescIdDesc();

    Optional<RefreshRecordEntity> findFirstByStatusOrderByRunAtDescIdDesc(RefreshStatus status);

    List<RefreshRecordEntity> findAllByOrderByRunAtDescIdDesc(Pageable pageable);
}
