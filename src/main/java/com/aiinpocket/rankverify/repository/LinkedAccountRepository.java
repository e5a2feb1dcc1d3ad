package com.aiinpocket.rankverify.repository;

import com.aiinpocket.rankverify.model.entity.LinkedAccount;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

/**
 * 綁定帳號 Repository。
 */
public interface LinkedAccountRepository extends JpaRepository<LinkedAccount, Long> {

    Optional<LinkedAccount> findByOwnerIdentityAndUniqueId(String ownerIdentity, String uniqueId);

    /** 主要帳號優先，其次依等級由高到低 */
    List<LinkedAccount> findByOwnerIdentityOrderByPrimaryAccountDescLevelDesc(String ownerIdentity);

    Optional<LinkedAccount> findByIdAndOwnerIdentity(Long id, String ownerIdentity);

    boolean existsByOwnerIdentity(String ownerIdentity);

    Optional<LinkedAccount> findFirstByOwnerIdentityAndPrimaryAccountTrue(String ownerIdentity);

    /** 身分組校正批次用：依 id 順序分頁讀取主要帳號 */
    List<LinkedAccount> findByPrimaryAccountTrueAndIdGreaterThanOrderByIdAsc(Long id, Pageable pageable);

    @Modifying
    @Query("UPDATE LinkedAccount a SET a.primaryAccount = false, a.primaryOwner = null WHERE a.ownerIdentity = :ownerIdentity AND a.primaryAccount = true")
    int clearPrimary(@Param("ownerIdentity") String ownerIdentity);
}
