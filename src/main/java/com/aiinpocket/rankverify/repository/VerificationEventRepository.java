package com.aiinpocket.rankverify.repository;

import com.aiinpocket.rankverify.model.entity.VerificationEvent;
import com.aiinpocket.rankverify.model.enums.VerificationStatus;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface VerificationEventRepository extends JpaRepository<VerificationEvent, Long> {

    List<VerificationEvent> findByOwnerIdentityOrderByCreatedAtDesc(String ownerIdentity);

    long countByOwnerIdentityAndStatus(String ownerIdentity, VerificationStatus status);
}
