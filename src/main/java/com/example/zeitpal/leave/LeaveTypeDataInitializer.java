package com.example.zeitpal.leave;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

import java.util.function.Consumer;

/**
 * システム既定の休暇種別を登録する。既に登録済みのコードはそのまま残す。
 */
@Component
public class LeaveTypeDataInitializer implements CommandLineRunner {
    private static final Logger logger = LoggerFactory.getLogger(LeaveTypeDataInitializer.class);

    private final LeaveTypeRepository leaveTypeRepository;

    public LeaveTypeDataInitializer(LeaveTypeRepository leaveTypeRepository) {
        this.leaveTypeRepository = leaveTypeRepository;
    }

    @Override
    public void run(String... args) {
        seed(LeaveType.VACATION, "Urlaub", 1, t -> {
            t.setHasAllowance(true);
            t.setAllowCarryover(true);
        });
        // 診断書要否の日数は所在国の設定に従う
        seed(LeaveType.SICK, "Krankheit", 2, t -> t.setRequiresDocument(true));
        seed("CHILD_SICK", "Kinderkrankentage", 3, t -> {
            t.setRequiresDocument(true);
            t.setDocumentRequiredAfterDays(1);
        });
        seed("SPECIAL", "Sonderurlaub", 4, t -> {
        });
        seed("UNPAID", "Unbezahlter Urlaub", 5, t -> t.setPaid(false));
    }

    private void seed(String code, String name, int sortOrder, Consumer<LeaveType> settings) {
        leaveTypeRepository.findByOrganizationIsNullAndCode(code).orElseGet(() -> {
            LeaveType type = new LeaveType(null, code, name);
            type.setSortOrder(sortOrder);
            settings.accept(type);
            LeaveType saved = leaveTypeRepository.save(type);
            logger.info("休暇種別初期化: {}", code);
            return saved;
        });
    }
}
