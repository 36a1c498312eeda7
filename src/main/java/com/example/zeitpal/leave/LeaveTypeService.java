package com.example.zeitpal.leave;

import com.example.zeitpal.exception.BusinessException;
import com.example.zeitpal.organization.Organization;
import com.example.zeitpal.organization.OrganizationRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 組織ごとの休暇種別の解決。組織独自の種別が同じコードのシステム既定より優先する。
 */
@Service
@Transactional
public class LeaveTypeService {

    private static final Logger logger = LoggerFactory.getLogger(LeaveTypeService.class);

    private final LeaveTypeRepository leaveTypeRepository;
    private final OrganizationRepository organizationRepository;

    public LeaveTypeService(LeaveTypeRepository leaveTypeRepository, OrganizationRepository organizationRepository) {
        this.leaveTypeRepository = leaveTypeRepository;
        this.organizationRepository = organizationRepository;
    }

    /**
     * 申請に使う種別を解決する。無効化された種別は申請できない。
     */
    @Transactional(readOnly = true)
    public LeaveType resolve(Organization organization, String code) {
        String normalized = LeaveType.normalizeCode(code == null ? LeaveType.VACATION : code);
        LeaveType type = leaveTypeRepository.findByOrganizationAndCode(organization, normalized)
                .or(() -> leaveTypeRepository.findByOrganizationIsNullAndCode(normalized))
                .orElseThrow(() -> BusinessException.notFound("休暇種別が見つかりません: " + normalized));
        if (!type.isActive()) {
            throw new BusinessException(BusinessException.INVALID_STATE, "休暇種別 " + normalized + " は無効化されています");
        }
        return type;
    }

    /**
     * 組織から見える種別。同じコードは組織独自のものだけを残す。
     */
    @Transactional(readOnly = true)
    public List<LeaveType> effectiveTypes(Organization organization) {
        Map<String, LeaveType> byCode = new LinkedHashMap<>();
        for (LeaveType type : leaveTypeRepository.findVisibleTo(organization)) {
            LeaveType current = byCode.get(type.getCode());
            if (current == null || current.isSystemDefault()) {
                byCode.put(type.getCode(), type);
            }
        }
        return new ArrayList<>(byCode.values());
    }

    /** 年間付与があり、有効な種別。入社時・年度切替時に残高を作る対象。 */
    @Transactional(readOnly = true)
    public List<LeaveType> allowanceTypes(Organization organization) {
        return effectiveTypes(organization).stream()
                .filter(LeaveType::isActive)
                .filter(LeaveType::hasAllowance)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<LeaveType> listFor(Long organizationId) {
        return effectiveTypes(findOrganization(organizationId));
    }

    public LeaveType create(Long organizationId, LeaveType draft) {
        Organization organization = findOrganization(organizationId);
        if (leaveTypeRepository.findByOrganizationAndCode(organization, draft.getCode()).isPresent()) {
            throw new BusinessException(BusinessException.CONFLICT,
                    "休暇種別 " + draft.getCode() + " は既に登録されています", organizationId, draft.getCode());
        }
        LeaveType type = new LeaveType(organization, draft.getCode(), draft.getName());
        copySettings(draft, type);
        LeaveType saved = leaveTypeRepository.save(type);
        logger.info("休暇種別を登録しました: 組織={}, コード={}", organization.getName(), saved.getCode());
        return saved;
    }

    /**
     * 組織独自の種別の有効・無効を切り替える。システム既定は変更できない
     * (同じコードの組織独自種別を登録して上書きする)。
     */
    public LeaveType setActive(Long leaveTypeId, boolean active) {
        LeaveType type = leaveTypeRepository.findById(leaveTypeId)
                .orElseThrow(() -> BusinessException.notFound("休暇種別が見つかりません (ID=" + leaveTypeId + ")"));
        if (type.isSystemDefault()) {
            throw new BusinessException(BusinessException.INVALID_STATE, "システム既定の休暇種別は変更できません");
        }
        type.setActive(active);
        logger.info("休暇種別 {} を{}にしました", type.getCode(), active ? "有効" : "無効");
        return leaveTypeRepository.save(type);
    }

    private static void copySettings(LeaveType source, LeaveType target) {
        target.setPaid(source.getPaid());
        target.setHasAllowance(source.hasAllowance());
        target.setDefaultDaysPerYear(source.getDefaultDaysPerYear());
        target.setAllowNegative(source.allowsNegative());
        target.setAllowHalfDays(source.allowsHalfDays());
        target.setRequiresDocument(source.requiresDocument());
        target.setDocumentRequiredAfterDays(source.getDocumentRequiredAfterDays());
        target.setAllowCarryover(source.allowsCarryover());
        target.setMaxCarryoverDays(source.getMaxCarryoverDays());
        target.setSortOrder(source.getSortOrder());
    }

    private Organization findOrganization(Long organizationId) {
        return organizationRepository.findById(organizationId)
                .orElseThrow(() -> BusinessException.notFound("組織が見つかりません: " + organizationId));
    }
}
