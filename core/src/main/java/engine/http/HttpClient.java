package engine.http;

import engine.model.ProbeRequest;
import engine.model.ProbeResponse;

import java.io.IOException;

/**
 * Транспорт для HTTP запросов шаблонов.
 *
 * <p>Основная реализация: {@link StandardHttpClient} на базе {@code java.net.http}.
 * Повторы, ограничение частоты и сессии реализуются уровнем выше в {@link NetworkClient}.
 */
public interface HttpClient extends AutoCloseable {

    /**
     * Выполняет HTTP запрос и возвращает полный ответ.
     *
     * @param request запрос для выполнения
     * @return ответ с телом в исходных байтах
     * @throws IOException при ошибке соединения, TLS или таймауте
     */
    ProbeResponse execute(ProbeRequest request) throws IOException;

    /**
     * Проверяет, поддерживает ли этот клиент указанную схему URL.
     *
     * @param url URL для проверки
     * @return true, если поддерживается, иначе false
     */
    boolean supports(String url);

    /**
     * Закрывает клиент и освобождает удерживаемые ресурсы.
     */
    @Override
    void close();
}
