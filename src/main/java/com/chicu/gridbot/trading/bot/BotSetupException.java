package com.chicu.gridbot.trading.bot;

/**
 * Пару нельзя запустить: неподдерживаемая биржа/режим, нет или отклонены ключи.
 */
public class BotSetupException extends RuntimeException {

    public BotSetupException(String message) {
        super(message);
    }

    public BotSetupException(String message, Throwable cause) {
        super(message, cause);
    }
}
