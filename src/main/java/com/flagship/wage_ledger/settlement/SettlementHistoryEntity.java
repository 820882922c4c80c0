package com.flagship.wage_ledger.settlement;

import com.flagship.wage_ledger.common.Period;
import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.OrderColumn;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * JPA entity for a settlement snapshot. Written once and never updated; there are no
 * mutators besides {@link #fromDomain}.
 */
@Entity
@Table(name = "settlement_history")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class SettlementHistoryEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20, updatable = false)
    private SettlementKind kind;

    @Column(name = "period_start", nullable = false, updatable = false)
    private LocalDate periodStart;

    @Column(name = "period_end", nullable = false, updatable = false)
    private LocalDate periodEnd;

    @Column(name = "saved_at", nullable = false, updatable = false)
    private Instant savedAt;

    @Column(length = 1000, updatable = false)
    private String notes;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "settlement_lines", joinColumns = @JoinColumn(name = "settlement_id"))
    @OrderColumn(name = "line_no")
    private List<SettlementLineEmbeddable> lines = new ArrayList<>();

    @Column(name = "worker_count", nullable = false, updatable = false)
    private int workerCount;

    @Column(name = "total_base", nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal totalBase;

    @Column(name = "total_hours", nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal totalHours;

    @Column(name = "total_penalty", nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal totalPenalty;

    @Column(name = "total_extra_bonus", nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal totalExtraBonus;

    @Column(name = "total_deposit", nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal totalDeposit;

    @Column(name = "total_new_advance", nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal totalNewAdvance;

    @Column(name = "total_final_amount", nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal totalFinalAmount;

    @Column(name = "total_advance_due", nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal totalAdvanceDue;

    public static SettlementHistoryEntity fromDomain(SettlementHistory history) {
        SettlementHistoryEntity entity = new SettlementHistoryEntity();
        entity.id = history.getId();
        entity.kind = history.getKind();
        entity.periodStart = history.getPeriod().getStart();
        entity.periodEnd = history.getPeriod().getEnd();
        entity.savedAt = history.getSavedAt();
        entity.notes = history.getNotes();
        entity.lines = new ArrayList<>(history.getLines().stream().map(SettlementLineEmbeddable::fromDomain).toList());
        entity.workerCount = history.getWorkerCount();
        entity.totalBase = history.getTotalBase();
        entity.totalHours = history.getTotalHours();
        entity.totalPenalty = history.getTotalPenalty();
        entity.totalExtraBonus = history.getTotalExtraBonus();
        entity.totalDeposit = history.getTotalDeposit();
        entity.totalNewAdvance = history.getTotalNewAdvance();
        entity.totalFinalAmount = history.getTotalFinalAmount();
        entity.totalAdvanceDue = history.getTotalAdvanceDue();
        return entity;
    }

    public SettlementHistory toDomain() {
        return SettlementHistory.builder()
            .id(id)
            .kind(kind)
            .period(Period.of(periodStart, periodEnd))
            .savedAt(savedAt)
            .notes(notes)
            .lines(lines.stream().map(SettlementLineEmbeddable::toDomain).toList())
            .workerCount(workerCount)
            .totalBase(totalBase)
            .totalHours(totalHours)
            .totalPenalty(totalPenalty)
            .totalExtraBonus(totalExtraBonus)
            .totalDeposit(totalDeposit)
            .totalNewAdvance(totalNewAdvance)
            .totalFinalAmount(totalFinalAmount)
            .totalAdvanceDue(totalAdvanceDue)
            .build();
    }
}
