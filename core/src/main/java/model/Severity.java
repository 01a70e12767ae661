package model;

import java.util.Locale;

/**
 * Уровни критичности находок.
 * Порядок объявления задает полный порядок: INFO &lt; LOW &lt; MEDIUM &lt; HIGH &lt; CRITICAL.
 */
public enum Severity {
    INFO("Info", 0),
    LOW("Low", 1),
    MEDIUM("Medium", 2),
    HIGH("High", 3),
    CRITICAL("Critical", 4);

    private final String displayName;
    private final int score;

    Severity(String displayName, int score) {
        this.displayName = displayName;
        this.score = score;
    }

    public String getDisplayName() {
        return displayName;
    }

    public int getScore() {
        return score;
    }

    public boolean isCriticalOrHigh() {
        return this == CRITICAL || this == HIGH;
    }

    /**
     * Разбирает название уровня без учета регистра.
     *
     * @param name название уровня ("critical", "High" и т.д.)
     * @return уровень критичности
     * @throws IllegalArgumentException если название неизвестно
     */
    public static Severity fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Severity name cannot be empty");
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT);
        if (normalized.equals("INFORMATIONAL")) {
            return INFO;
        }
        try {
            return valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown severity: " + name, e);
        }
    }

    @Override
    public String toString() {
        return name().toLowerCase(Locale.ROOT);
    }
}
