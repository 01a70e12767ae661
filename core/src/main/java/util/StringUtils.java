package util;

/**
 * Общие утилиты для работы со строками.
 *
 * @since 1.0
 */
public final class StringUtils {

    private StringUtils() {
        // Утилитный класс - запретить создание экземпляров
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Обрезает строку до указанной максимальной длины, добавляя многоточие.
     *
     * @param str исходная строка
     * @param maxLength максимальная длина (включая многоточие)
     * @return обрезанная строка с "..." или исходная, если она короче maxLength
     */
    public static String truncate(String str, int maxLength) {
        if (str == null || str.length() <= maxLength) {
            return str;
        }

        if (maxLength <= 3) {
            return "...";
        }

        return str.substring(0, maxLength - 3) + "...";
    }

    /**
     * Раскрывает экранированные последовательности в сетевых payload-ах шаблонов:
     * {@code \r\n}, {@code \n}, {@code \r}, {@code \t}.
     */
    public static String unescapePayload(String payload) {
        if (payload == null) {
            return "";
        }
        return payload
            .replace("\\r\\n", "\r\n")
            .replace("\\n", "\n")
            .replace("\\r", "\r")
            .replace("\\t", "\t");
    }

    /**
     * Маскирует секреты для логов: оставляет первые и последние 4 символа.
     */
    public static String maskSensitive(String value) {
        if (value == null) {
            return null;
        }
        if (value.length() <= 8) {
            return "*".repeat(value.length());
        }
        return value.substring(0, 4) + "*".repeat(value.length() - 8) + value.substring(value.length() - 4);
    }
}
