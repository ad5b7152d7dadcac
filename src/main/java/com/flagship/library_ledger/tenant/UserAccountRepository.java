package com.flagship.library_ledger.tenant;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface UserAccountRepository extends JpaRepository<UserAccountEntity, Long> {

    Optional<UserAccountEntity> findBySchoolIdAndUsername(long schoolId, String username);

    boolean existsBySchoolIdAndUsername(long schoolId, String username);

    boolean existsBySchoolId(long schoolId);

    List<UserAccountEntity> findBySchoolIdOrderByUsernameAsc(long schoolId);

    long deleteBySchoolIdAndUsername(long schoolId, String username);
}
