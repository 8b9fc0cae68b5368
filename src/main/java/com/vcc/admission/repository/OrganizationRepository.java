package com.vcc.admission.repository;

import com.vcc.admission.entity.OrganizationEntity;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface OrganizationRepository extends ReactiveCrudRepository<OrganizationEntity, String> {
}
