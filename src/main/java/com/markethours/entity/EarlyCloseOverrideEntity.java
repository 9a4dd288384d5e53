package com.markethours.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.LocalDate;
import java.time.LocalTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** JPA entity for the early_close_overrides table (exchange-local close time per half day). */
@Entity
@Table(name = "early_close_overrides")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class EarlyCloseOverrideEntity {

    @Id
    @Column(name = "override_date")
    private LocalDate date;

    @Column(name = "close_time", nullable = false)
    private LocalTime closeTime;
}
