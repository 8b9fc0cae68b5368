package com.vcc.admission.entity;

import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Usage of one resource by one organization in one calendar month. The limit is not
 * stored here; it is joined from the plan table at read time.
 */
@Table("quota_usage")
public class QuotaUsageEntity {

    @Id
    @Column("id")
    private Long id;

    @Column("organization_id")
    private String organizationId;

    @Column("resource_type")
    private String resourceType;

    @Column("period_start")
    private LocalDate periodStart;

    @Column("used")
    private long used;

    @Column("reset_count")
    private int resetCount;

    @Column("last_reset_at")
    private Instant lastResetAt;

    @Column("last_reset_by")
    private String lastResetBy;

    @Column("created_at")
    private Instant createdAt;

    @Column("updated_at")
    private Instant updatedAt;

    public QuotaUsageEntity() {
    }

    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public String getOrganizationId() {
        return organizationId;
    }

    public void setOrganizationId(String organizationId) {
        this.organizationId = organizationId;
    }

    public String getResourceType() {
        return resourceType;
    }

    public void setResourceType(String resourceType) {
        this.resourceType = resourceType;
    }

    public LocalDate getPeriodStart() {
        return periodStart;
    }

    public void setPeriodStart(LocalDate periodStart) {
        this.periodStart = periodStart;
    }

    public long getUsed() {
        return used;
    }

    public void setUsed(long used) {
        this.used = used;
    }

    public int getResetCount() {
        return resetCount;
    }

    public void setResetCount(int resetCount) {
        this.resetCount = resetCount;
    }

    public Instant getLastResetAt() {
        return lastResetAt;
    }

    public void setLastResetAt(Instant lastResetAt) {
        this.lastResetAt = lastResetAt;
    }

    public String getLastResetBy() {
        return lastResetBy;
    }

    public void setLastResetBy(String lastResetBy) {
        this.lastResetBy = lastResetBy;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }
}
