package dev.flyzex.bot.adapter.inbound.telegram;

import org.telegram.telegrambots.meta.api.objects.CallbackQuery;
import org.telegram.telegrambots.meta.api.objects.Update;
import org.telegram.telegrambots.meta.api.objects.User;
import org.telegram.telegrambots.meta.api.objects.message.Message;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Mocked Telegram update objects.
 */
final class TelegramFixtures {

    private TelegramFixtures() {
    }

    static User user(long id, String firstName, String languageCode) {
        User user = mock(User.class);
        when(user.getId()).thenReturn(id);
        when(user.getFirstName()).thenReturn(firstName);
        when(user.getLanguageCode()).thenReturn(languageCode);
        return user;
    }

    static Message privateMessage(User from, String text) {
        Message message = textMessage(from.getId(), from, text);
        when(message.isUserMessage()).thenReturn(true);
        return message;
    }

    static Message groupMessage(long chatId, User from, String text) {
        Message message = textMessage(chatId, from, text);
        when(message.isSuperGroupMessage()).thenReturn(true);
        return message;
    }

    static CallbackQuery callback(User from, long chatId, int messageId, String data) {
        Message message = mock(Message.class);
        when(message.getChatId()).thenReturn(chatId);
        when(message.getMessageId()).thenReturn(messageId);

        CallbackQuery callback = mock(CallbackQuery.class);
        when(callback.getId()).thenReturn("cb-" + messageId);
        when(callback.getFrom()).thenReturn(from);
        when(callback.getMessage()).thenReturn(message);
        when(callback.getData()).thenReturn(data);
        return callback;
    }

    static Update update(Message message) {
        Update update = mock(Update.class);
        when(update.hasMessage()).thenReturn(true);
        when(update.getMessage()).thenReturn(message);
        return update;
    }

    static Update update(CallbackQuery callback) {
        Update update = mock(Update.class);
        when(update.hasCallbackQuery()).thenReturn(true);
        when(update.getCallbackQuery()).thenReturn(callback);
        return update;
    }

    private static Message textMessage(long chatId, User from, String text) {
        Message message = mock(Message.class);
        when(message.getChatId()).thenReturn(chatId);
        when(message.getFrom()).thenReturn(from);
        when(message.hasText()).thenReturn(true);
        when(message.getText()).thenReturn(text);
        return message;
    }
}
