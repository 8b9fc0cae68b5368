package com.vcc.admission.entity;

import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.Instant;

/**
 * Organization record owned by billing. Only the denormalized plan is read here.
 */
@Table("organization")
public class OrganizationEntity {

    @Id
    @Column("organization_id")
    private String organizationId;

    @Column("name")
    private String name;

    @Column("plan")
    private String plan;

    @Column("status")
    private String status;

    @Column("updated_at")
    private Instant updatedAt;

    public OrganizationEntity() {
    }

    public OrganizationEntity(String organizationId, String name, String plan, String status) {
        this.organizationId = organizationId;
        this.name = name;
        this.plan = plan;
        this.status = status;
        this.updatedAt = Instant.now();
    }

    public String getOrganizationId() {
        return organizationId;
    }

    public void setOrganizationId(String organizationId) {
        this.organizationId = organizationId;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getPlan() {
        return plan;
    }

    public void setPlan(String plan) {
        this.plan = plan;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }
}
