package com.safar.bot.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * Free-text FAQ row. Keywords are comma separated; when blank the question text is used.
 */
@Entity
@Table(name = "faq_entry")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class FaqEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 300)
    private String question;

    @Column(nullable = false, length = 2000)
    private String answer;

    @Column(length = 500)
    private String keywords;

    @Column(length = 20)
    private String category;

    @Builder.Default
    private boolean active = true;

    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) createdAt = Instant.now();
    }
}
