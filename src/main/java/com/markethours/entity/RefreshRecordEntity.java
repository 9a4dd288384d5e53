package com.markethours.entity;

import com.markethours.domain.enums.RefreshStatus;
import com.markethours.domain.enums.RefreshTrigger;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the refresh_records table.
 * Append-only audit trail of refresh cycle attempts; never updated or deleted by the service.
 */
@Entity
@Table(name = "refresh_records")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RefreshRecordEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "run_at", nullable = false)
    private Instant runAt;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    private RefreshStatus status;

    @Column(name = "records_ingested")
    private int recordsIngested;

    @Column(length = 2000)
    private String error;

    @Enumerated(EnumType.STRING)
    @Column(name = "refresh_trigger", length = 20)
    private RefreshTrigger trigger;

    @Column(name = "source_name", length = 100)
    private String source;
}
