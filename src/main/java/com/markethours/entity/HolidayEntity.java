package com.markethours.entity;

import com.markethours.domain.enums.ClosureKind;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.LocalDate;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the holidays table. The date is the primary key, which enforces one
 * holiday per date at the database level. Rows are replaced in bulk by refresh cycles only.
 */
@Entity
@Table(name = "holidays")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class HolidayEntity {

    public static final int NAME_MAX_LENGTH = 100;

    @Id
    @Column(name = "holiday_date")
    private LocalDate date;

    @Column(nullable = false, length = NAME_MAX_LENGTH)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(name = "closure_kind", nullable = false, length = 20)
    private ClosureKind closureKind;
}
