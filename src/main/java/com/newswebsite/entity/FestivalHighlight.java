package com.newswebsite.entity;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.AllArgsConstructor;
import java.time.LocalDateTime;

/**
 * A tile on the festival landing page. The colour fields hold CSS utility classes.
 */
@Entity
@Table(name = "festival_highlights")
@Data
@NoArgsConstructor
@AllArgsConstructor
public class FestivalHighlight {

    public static final String DEFAULT_BG_COLOR = "bg-blue-500";
    public static final String DEFAULT_HOVER_BG = "hover:bg-blue-600";
    public static final String DEFAULT_BORDER_COLOR = "border-blue-500";
    public static final String DEFAULT_TEXT_COLOR = "text-blue-600";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String title;

    @Column(columnDefinition = "TEXT", nullable = false)
    private String content;

    @Column(nullable = false)
    private String icon;

    private String bgColor;
    private String hoverBg;
    private String borderColor;
    private String textColor;

    @JsonProperty("order")
    @Column(name = "display_order")
    private Integer displayOrder;

    private Boolean isActive;

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        updatedAt = LocalDateTime.now();
        if (bgColor == null) {
            bgColor = DEFAULT_BG_COLOR;
        }
        if (hoverBg == null) {
            hoverBg = DEFAULT_HOVER_BG;
        }
        if (borderColor == null) {
            borderColor = DEFAULT_BORDER_COLOR;
        }
        if (textColor == null) {
            textColor = DEFAULT_TEXT_COLOR;
        }
        if (displayOrder == null) {
            displayOrder = 0;
        }
        if (isActive == null) {
            isActive = true;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }
}
