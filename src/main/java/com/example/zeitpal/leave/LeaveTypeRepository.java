package com.example.zeitpal.leave;

import com.example.zeitpal.organization.Organization;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface LeaveTypeRepository extends JpaRepository<LeaveType, Long> {

    Optional<LeaveType> findByOrganizationAndCode(Organization organization, String code);

    Optional<LeaveType> findByOrganizationIsNullAndCode(String code);

    /**
     * 組織から見える種別 (システム既定 + 組織独自) を表示順で返す。
     */
    @Query("SELECT t FROM LeaveType t WHERE t.organization IS NULL OR t.organization = :organization " +
           "ORDER BY t.sortOrder ASC, t.id ASC")
    List<LeaveType> findVisibleTo(@Param("organization") Organization organization);
}
