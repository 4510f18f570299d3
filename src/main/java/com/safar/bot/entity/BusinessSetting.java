package com.safar.bot.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(name = "business_settings")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BusinessSetting {

    @Id
    @Column(name = "setting_key", length = 40)
    private String settingKey;

    @Column(name = "value_json", nullable = false, length = 4000)
    private String valueJson;

    @Column(name = "updated_by", length = 40)
    private String updatedBy;

    private Instant updatedAt;

    @PrePersist
    @PreUpdate
    protected void onWrite() {
        updatedAt = Instant.now();
    }
}
