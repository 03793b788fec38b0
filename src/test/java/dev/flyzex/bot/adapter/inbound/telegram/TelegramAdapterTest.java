package dev.flyzex.bot.adapter.inbound.telegram;

import dev.flyzex.bot.domain.model.Application;
import dev.flyzex.bot.domain.model.ApplicationStatus;
import dev.flyzex.bot.domain.model.RateLimitResult;
import dev.flyzex.bot.infrastructure.config.BotProperties;
import dev.flyzex.bot.infrastructure.i18n.MessageService;
import dev.flyzex.bot.ratelimit.RateLimiter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.mock.env.MockEnvironment;
import org.telegram.telegrambots.longpolling.TelegramBotsLongPollingApplication;
import org.telegram.telegrambots.longpolling.util.LongPollingSingleThreadUpdateConsumer;
import org.telegram.telegrambots.meta.api.methods.commands.SetMyCommands;
import org.telegram.telegrambots.meta.api.objects.CallbackQuery;
import org.telegram.telegrambots.meta.api.objects.User;
import org.telegram.telegrambots.meta.api.objects.commands.BotCommand;
import org.telegram.telegrambots.meta.api.objects.message.Message;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;
import org.telegram.telegrambots.meta.generics.TelegramClient;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class TelegramAdapterTest {

    private static final long USER_ID = 1001L;
    private static final long GROUP_ID = -1001234L;

    private BotProperties properties;
    private MockEnvironment environment;
    private TelegramBotsLongPollingApplication botsApplication;
    private TelegramMessenger messenger;
    private TelegramConversations conversations;
    private DirectMessageHandler directMessageHandler;
    private GroupChatHandler groupChatHandler;
    private ApplicationReviewHandler reviewHandler;
    private RateLimiter rateLimiter;
    private MessageService messageService;
    private TelegramAdapter adapter;
    private User user;

    @BeforeEach
    void setUp() {
        properties = new BotProperties();
        environment = new MockEnvironment();
        botsApplication = mock(TelegramBotsLongPollingApplication.class);
        messenger = mock(TelegramMessenger.class);
        conversations = new TelegramConversations();
        directMessageHandler = mock(DirectMessageHandler.class);
        groupChatHandler = mock(GroupChatHandler.class);
        reviewHandler = mock(ApplicationReviewHandler.class);
        rateLimiter = mock(RateLimiter.class);
        when(rateLimiter.tryConsume(anyString())).thenReturn(RateLimitResult.allowed(4));
        messageService = new MessageService(properties);

        adapter = new TelegramAdapter(properties, environment, botsApplication, messenger, conversations,
                directMessageHandler, groupChatHandler, reviewHandler, rateLimiter, messageService);
        user = TelegramFixtures.user(USER_ID, "Sara", "en");
    }

    @Test
    void shouldRoutePrivateMessagesToDirectHandler() {
        Message message = TelegramFixtures.privateMessage(user, "/start");

        adapter.consume(TelegramFixtures.update(message));

        verify(directMessageHandler).handleMessage(message);
        verify(groupChatHandler, never()).handleMessage(any());
        verify(rateLimiter).tryConsume("telegram:" + USER_ID);
    }

    @Test
    void shouldRouteGroupMessagesToGroupHandler() {
        Message message = TelegramFixtures.groupMessage(GROUP_ID, user, "hello");

        adapter.consume(TelegramFixtures.update(message));

        verify(groupChatHandler).handleMessage(message);
        verify(directMessageHandler, never()).handleMessage(any());
    }

    @Test
    void shouldDropRateLimitedUpdates() {
        when(rateLimiter.tryConsume("telegram:" + USER_ID))
                .thenReturn(RateLimitResult.denied(Duration.ofSeconds(3), "Rate limit exceeded"));

        adapter.consume(TelegramFixtures.update(TelegramFixtures.privateMessage(user, "/start")));
        adapter.consume(TelegramFixtures.update(TelegramFixtures.callback(user, USER_ID, 5,
                DirectMessageHandler.CALLBACK_APPLY)));

        verify(directMessageHandler, never()).handleMessage(any());
        verify(directMessageHandler, never()).handleApplyCallback(any());
        verify(messenger).answerCallback("cb-5");
    }

    @Test
    void shouldRouteCallbacksByData() {
        CallbackQuery apply = TelegramFixtures.callback(user, USER_ID, 5, DirectMessageHandler.CALLBACK_APPLY);
        CallbackQuery review = TelegramFixtures.callback(user, -500L, 6, "application:42:approve");
        CallbackQuery unknown = TelegramFixtures.callback(user, USER_ID, 7, "something:else");

        adapter.consume(TelegramFixtures.update(apply));
        adapter.consume(TelegramFixtures.update(review));
        adapter.consume(TelegramFixtures.update(unknown));

        verify(directMessageHandler).handleApplyCallback(apply);
        verify(reviewHandler).handleCallback(review);
        verify(messenger).answerCallback("cb-5");
        verify(messenger).answerCallback("cb-6");
        verify(messenger).answerCallback("cb-7");
    }

    @Test
    void shouldCompletePendingNoteWithPlainText() {
        conversations.promptForNote(USER_ID, new TelegramConversations.NotePrompt("-500",
                Application.builder().userId(42L).build(), ApplicationStatus.DENIED));
        when(reviewHandler.completeDecision(user, "Please reapply later")).thenReturn(true);
        Message message = TelegramFixtures.groupMessage(-500L, user, " Please reapply later ");

        adapter.consume(TelegramFixtures.update(message));

        verify(reviewHandler).completeDecision(user, "Please reapply later");
        verify(groupChatHandler, never()).handleMessage(any());
    }

    @Test
    void shouldCompletePendingNoteWithoutTextOnSkip() {
        conversations.promptForNote(USER_ID, new TelegramConversations.NotePrompt(String.valueOf(USER_ID),
                Application.builder().userId(42L).build(), ApplicationStatus.APPROVED));
        when(reviewHandler.completeDecision(user, null)).thenReturn(true);

        adapter.consume(TelegramFixtures.update(TelegramFixtures.privateMessage(user, "/skip")));

        verify(reviewHandler).completeDecision(user, null);
        verify(directMessageHandler, never()).handleMessage(any());
    }

    @Test
    void shouldIgnoreNotePromptFromOtherChat() {
        conversations.promptForNote(USER_ID, new TelegramConversations.NotePrompt("-500",
                Application.builder().userId(42L).build(), ApplicationStatus.APPROVED));
        Message message = TelegramFixtures.privateMessage(user, "hello");

        adapter.consume(TelegramFixtures.update(message));

        verify(reviewHandler, never()).completeDecision(any(), any());
        verify(directMessageHandler).handleMessage(message);
    }

    @Test
    void shouldApologizeWhenHandlerFails() {
        Message message = TelegramFixtures.privateMessage(user, "/status");
        doThrow(new IllegalStateException("boom")).when(directMessageHandler).handleMessage(message);

        adapter.consume(TelegramFixtures.update(message));

        verify(messenger).send(String.valueOf(USER_ID), messageService.getMessage("error.generic", "en"));
    }

    @Test
    void shouldNotStartWithoutToken() throws Exception {
        adapter.start();

        assertFalse(adapter.isRunning());
        verify(botsApplication, never()).registerBot(anyString(), any(LongPollingSingleThreadUpdateConsumer.class));
    }

    @Test
    void shouldRegisterBotWhenTokenIsPresent() throws Exception {
        environment.setProperty("BOT_TOKEN", "123:abc");
        when(messenger.getTelegramClient()).thenReturn(mock(TelegramClient.class));

        adapter.start();

        assertTrue(adapter.isRunning());
        verify(botsApplication).registerBot(eq("123:abc"), any(LongPollingSingleThreadUpdateConsumer.class));
        assertEquals("telegram", adapter.getChannelType());

        adapter.stop();

        assertFalse(adapter.isRunning());
        verify(botsApplication).close();
    }

    @Test
    void shouldRegisterLocalizedCommandMenuOnStart() throws Exception {
        environment.setProperty("BOT_TOKEN", "123:abc");
        TelegramClient client = mock(TelegramClient.class);
        when(messenger.getTelegramClient()).thenReturn(client);

        adapter.start();

        ArgumentCaptor<SetMyCommands> captor = ArgumentCaptor.forClass(SetMyCommands.class);
        verify(client).execute(captor.capture());
        List<BotCommand> commands = captor.getValue().getCommands();
        assertEquals(List.of("start", "pending", "admins", "xp", "cups"),
                commands.stream().map(BotCommand::getCommand).toList());
        assertEquals(messageService.getMessage("command.menu.xp", messageService.getDefaultLanguage()),
                commands.get(3).getDescription());
    }

    @Test
    void shouldKeepRunningWhenCommandMenuFails() throws Exception {
        environment.setProperty("BOT_TOKEN", "123:abc");
        TelegramClient client = mock(TelegramClient.class);
        when(client.execute(any(SetMyCommands.class))).thenThrow(new TelegramApiException("menu rejected"));
        when(messenger.getTelegramClient()).thenReturn(client);

        adapter.start();

        assertTrue(adapter.isRunning());
    }

    @Test
    void shouldStayStoppedWhenDisabled() throws Exception {
        properties.getTelegram().setEnabled(false);
        environment.setProperty("BOT_TOKEN", "123:abc");

        adapter.start();

        assertFalse(adapter.isEnabled());
        assertFalse(adapter.isRunning());
        verify(botsApplication, never()).registerBot(anyString(), any(LongPollingSingleThreadUpdateConsumer.class));
    }
}
