package com.vcc.admission.entity;

import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.Instant;

/**
 * Append-only record of a rejected attempt.
 */
@Table("rate_limit_violation")
public class ViolationEntity {

    @Id
    @Column("id")
    private Long id;

    @Column("subject")
    private String subject;

    @Column("scope")
    private String scope;

    @Column("violation_type")
    private String violationType;

    @Column("limit_value")
    private long limitValue;

    @Column("observed_count")
    private long observedCount;

    @Column("endpoint")
    private String endpoint;

    @Column("user_agent")
    private String userAgent;

    @Column("created_at")
    private Instant createdAt;

    public ViolationEntity() {
    }

    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public String getSubject() {
        return subject;
    }

    public void setSubject(String subject) {
        this.subject = subject;
    }

    public String getScope() {
        return scope;
    }

    public void setScope(String scope) {
        this.scope = scope;
    }

    public String getViolationType() {
        return violationType;
    }

    public void setViolationType(String violationType) {
        this.violationType = violationType;
    }

    public long getLimitValue() {
        return limitValue;
    }

    public void setLimitValue(long limitValue) {
        this.limitValue = limitValue;
    }

    public long getObservedCount() {
        return observedCount;
    }

    public void setObservedCount(long observedCount) {
        this.observedCount = observedCount;
    }

    public String getEndpoint() {
        return endpoint;
    }

    public void setEndpoint(String endpoint) {
        this.endpoint = endpoint;
    }

    public String getUserAgent() {
        return userAgent;
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = userAgent;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }
}
