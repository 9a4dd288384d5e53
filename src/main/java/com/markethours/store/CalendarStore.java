package com.markethours.store;

import com.markethours.calendar.CalendarSnapshot;
import com.markethours.calendar.ExchangeHours;
import com.markethours.calendar.MarketCalendarProperties;
import com.markethours.domain.enums.ClosureKind;
import com.markethours.domain.enums.RefreshStatus;
import com.markethours.domain.enums.SnapshotOrigin;
import com.markethours.domain.model.EarlyCloseOverride;
import com.markethours.domain.model.Holiday;
import com.markethours.domain.model.RefreshRecord;
import com.markethours.domain.model.YearRange;
import com.markethours.entity.RefreshRecordEntity;
import com.markethours.mapper.CalendarMapper;
import com.markethours.mapper.RefreshRecordMapper;
import com.markethours.repository.jpa.EarlyCloseOverrideJpaRepository;
import com.markethours.repository.jpa.HolidayJpaRepository;
import com.markethours.repository.jpa.RefreshRecordJpaRepository;
import jakarta.annotation.PostConstruct;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import org.mapstruct.factory.Mappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Single source of truth for the market calendar: holidays, early-close overrides and the
 * refresh audit log.
 *
 * <p>Durable state lives in H2 (via JPA). What queries read is the in-memory
 * {@link CalendarSnapshot} held in an {@link AtomicReference}. A commit first replaces the
 * covered date range inside one database transaction and only then publishes the new
 * snapshot with a single reference swap, so readers see either the complete old calendar
 * or the complete new one. If the transaction fails nothing is published.
 *
 * <p>The refresh orchestrator is the only writer.
 */
@Service
public class CalendarStore {

    private static final Logger log = LoggerFactory.getLogger(CalendarStore.class);

    private final HolidayJpaRepository holidayJpaRepository;
    private final EarlyCloseOverrideJpaRepository earlyCloseOverrideJpaRepository;
    private final RefreshRecordJpaRepository refreshRecordJpaRepository;
    private final TransactionTemplate transactionTemplate;
    private final MarketCalendarProperties marketCalendarProperties;

    private final CalendarMapper calendarMapper = Mappers.getMapper(CalendarMapper.class);
    private final RefreshRecordMapper refreshRecordMapper = Mappers.getMapper(RefreshRecordMapper.class);

    private final AtomicReference<CalendarSnapshot> published = new AtomicReference<>(CalendarSnapshot.empty());

    public CalendarStore(
            HolidayJpaRepository holidayJpaRepository,
            EarlyCloseOverrideJpaRepository earlyCloseOverrideJpaRepository,
            RefreshRecordJpaRepository refreshRecordJpaRepository,
            TransactionTemplate transactionTemplate,
            MarketCalendarProperties marketCalendarProperties) {
        this.holidayJpaRepository = holidayJpaRepository;
        this.earlyCloseOverrideJpaRepository = earlyCloseOverrideJpaRepository;
        this.refreshRecordJpaRepository = refreshRecordJpaRepository;
        this.transactionTemplate = transactionTemplate;
        this.marketCalendarProperties = marketCalendarProperties;
    }

    /**
     * Publishes the persisted calendar on startup. Falls back to the configured bootstrap
     * holidays (or an empty calendar) when no refresh has ever been committed.
     */
    @PostConstruct
    public void loadPublishedCalendar() {
        List<Holiday> holidays = calendarMapper.toHolidays(holidayJpaRepository.findAllByOrderByDateAsc());
        List<EarlyCloseOverride> overrides =
                calendarMapper.toOverrides(earlyCloseOverrideJpaRepository.findAllByOrderByDateAsc());
        Optional<RefreshRecordEntity> lastSuccess =
                refreshRecordJpaRepository.findFirstByStatusOrderByRunAtDescIdDesc(RefreshStatus.SUCCESS);

        CalendarSnapshot snapshot;
        if (lastSuccess.isPresent() || !holidays.isEmpty()) {
            Instant refreshedAt = lastSuccess.map(RefreshRecordEntity::getRunAt).orElse(null);
            snapshot = CalendarSnapshot.of(holidays, overrides, refreshedAt, SnapshotOrigin.STORE);
        } else {
            snapshot = bootstrapSnapshot();
        }
        published.set(snapshot);
        log.info("{} calendar loaded: {}", marketCalendarProperties.getExchange(), snapshot);
    }

    /** The currently published snapshot. Never null. */
    public CalendarSnapshot snapshot() {
        return published.get();
    }

    /**
     * Replaces every holiday and early-close override inside {@code range} with the given rows,
     * then publishes the resulting snapshot. All-or-nothing: on a database failure the
     * exception propagates and the previous snapshot stays published.
     */
    public CalendarSnapshot commit(
            YearRange range, List<Holiday> holidays, List<EarlyCloseOverride> overrides, Instant committedAt) {
        LocalDate start = range.startDate();
        LocalDate end = range.endDate();

        transactionTemplate.executeWithoutResult(status -> {
            int removedOverrides = earlyCloseOverrideJpaRepository.deleteByDateRange(start, end);
            int removedHolidays = holidayJpaRepository.deleteByDateRange(start, end);
            holidayJpaRepository.saveAll(calendarMapper.toHolidayEntities(holidays));
            earlyCloseOverrideJpaRepository.saveAll(calendarMapper.toOverrideEntities(overrides));
            log.debug(
                    "Replaced calendar {}: removed {} holidays/{} overrides, wrote {}/{}",
                    range,
                    removedHolidays,
                    removedOverrides,
                    holidays.size(),
                    overrides.size());
        });

        CalendarSnapshot base = published.get();
        if (base.getOrigin() == SnapshotOrigin.EMPTY || base.getOrigin() == SnapshotOrigin.BOOTSTRAP) {
            // Bootstrap rows were never persisted, so they must not survive into a committed calendar
            base = CalendarSnapshot.empty();
        }
        CalendarSnapshot next = base.replacingRange(range, holidays, overrides, committedAt);
        published.set(next);
        log.info("Published calendar {} for {}", next, range);
        return next;
    }

    public RefreshRecord appendRefreshRecord(RefreshRecord refreshRecord) {
        RefreshRecordEntity saved = refreshRecordJpaRepository.save(refreshRecordMapper.toEntity(refreshRecord));
        return refreshRecordMapper.toDomain(saved);
    }

    public Optional<RefreshRecord> lastRefresh() {
        return refreshRecordJpaRepository.findFirstByOrderByRunAtDescIdDesc().map(refreshRecordMapper::toDomain);
    }

    public Optional<RefreshRecord> lastSuccessfulRefresh() {
        return refreshRecordJpaRepository
                .findFirstByStatusOrderByRunAtDescIdDesc(RefreshStatus.SUCCESS)
                .map(refreshRecordMapper::toDomain);
    }

    /** Most recent refresh records first. */
    public List<RefreshRecord> refreshHistory(int limit) {
        return refreshRecordMapper.toDomainList(
                refreshRecordJpaRepository.findAllByOrderByRunAtDescIdDesc(PageRequest.of(0, limit)));
    }

    private CalendarSnapshot bootstrapSnapshot() {
        List<MarketCalendarProperties.BootstrapHoliday> entries = marketCalendarProperties.getBootstrap();
        if (entries.isEmpty()) {
            log.warn("No committed calendar and no bootstrap holidays; serving regular weekday rules only");
            return CalendarSnapshot.empty();
        }

        List<Holiday> holidays = new ArrayList<>();
        List<EarlyCloseOverride> overrides = new ArrayList<>();
        Set<LocalDate> seen = new HashSet<>();
        for (MarketCalendarProperties.BootstrapHoliday entry : entries) {
            if (entry.getName() == null || entry.getName().isBlank()) {
                log.warn("Skipping bootstrap holiday with missing name: {}", entry);
                continue;
            }
            if (entry.getDate() == null || !seen.add(entry.getDate())) {
                log.warn("Skipping bootstrap holiday with missing or duplicate date: {}", entry);
                continue;
            }
            if (entry.getType() == ClosureKind.EARLY_CLOSE) {
                if (entry.getCloseTime() == null
                        || !ExchangeHours.isStrictlyWithinRegularSession(entry.getCloseTime())) {
                    log.warn("Skipping bootstrap early close without a valid close time: {}", entry);
                    continue;
                }
                overrides.add(EarlyCloseOverride.builder()
                        .date(entry.getDate())
                        .closeTime(entry.getCloseTime())
                        .build());
            }
            holidays.add(Holiday.builder()
                    .date(entry.getDate())
                    .name(entry.getName())
                    .closureKind(entry.getType())
                    .build());
        }
        return CalendarSnapshot.of(holidays, overrides, null, SnapshotOrigin.BOOTSTRAP);
    }
}
