package com.safar.bot.repository;

import com.safar.bot.entity.BusinessSetting;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface BusinessSettingRepository extends JpaRepository<BusinessSetting, String> {
}
