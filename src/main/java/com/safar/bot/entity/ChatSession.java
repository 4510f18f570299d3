package com.safar.bot.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * Persisted conversation session. State is kept as its name so an unknown value can be
 * detected on load instead of failing inside Hibernate.
 */
@Entity
@Table(name = "chat_session")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ChatSession {

    @Id
    @Column(name = "user_id", length = 32)
    private String userId;

    @Column(nullable = false, length = 40)
    private String state;

    @Column(name = "context_json", length = 4000)
    private String contextJson;

    private Instant createdAt;

    private Instant updatedAt;

    @Version
    private Long version;

    @PrePersist
    protected void onCreate() {
        Instant now = Instant.now();
        if (createdAt == null) createdAt = now;
        if (updatedAt == null) updatedAt = now;
    }
}
