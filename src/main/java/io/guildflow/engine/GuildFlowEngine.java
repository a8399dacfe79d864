package io.guildflow.engine;

import io.guildflow.config.BotSettings;
import io.guildflow.config.GuildFlowConfig;
import io.guildflow.counter.CounterService;
import io.guildflow.counter.FireReminder;
import io.guildflow.gate.AccessGate;
import io.guildflow.gate.ContentDecision;
import io.guildflow.observability.AuditLogger;
import io.guildflow.platform.Channel;
import io.guildflow.platform.ChatMessage;
import io.guildflow.platform.ChatPlatform;
import io.guildflow.platform.Member;
import io.guildflow.platform.OutboundMessage;
import io.guildflow.platform.PlatformEvent;
import io.guildflow.review.MembershipReview;
import io.guildflow.storage.RecordStore;
import io.guildflow.strike.StrikeLedger;
import io.guildflow.suggestion.SuggestionWorkflow;
import io.guildflow.ticket.TicketWorkflow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Entry point for platform events. Each event is passed through the access gate and then handled
 * by exactly one component; the resulting effects are executed after state is persisted.
 *
 * <p>Events are processed on a fixed worker pool. Operations on the same record are serialized by
 * the record sets' key locks, operations on different keys run in parallel.
 */
public final class GuildFlowEngine implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(GuildFlowEngine.class);

    private final BotSettings settings;
    private final ChatPlatform platform;
    private final AuditLogger audit;
    private final CounterService counters;
    private final StrikeLedger strikes;
    private final SuggestionWorkflow suggestions;
    private final TicketWorkflow tickets;
    private final AccessGate gate;
    private final DelayedActions delayed;
    private final SideEffectExecutor effects;
    private final CommandRouter commands;
    private final ExecutorService workers;

    public GuildFlowEngine(GuildFlowConfig config, BotSettings settings, ChatPlatform platform, Clock clock) {
        this.settings = settings;
        this.platform = platform;
        RecordStore store = new RecordStore(config.storeDir());
        this.audit = new AuditLogger(config.auditFile(), clock);
        this.counters = new CounterService(
                store, settings.messageThreshold(), settings.helpThreshold(), settings.suggestionReminderThreshold()
        );
        this.strikes = new StrikeLedger(store, clock);
        this.suggestions = new SuggestionWorkflow(
                store, counters, platform, settings.resultsChannelId(),
                settings.upvoteEmoji(), settings.downvoteEmoji(), clock
        );
        this.tickets = new TicketWorkflow(
                store, platform, settings.privilegedRoles(), settings.ticketChannelPrefix(),
                settings.transcriptChannelName(), settings.ticketDeleteDelay(), clock
        );
        this.gate = new AccessGate(settings, tickets);
        this.delayed = new DelayedActions();
        this.effects = new SideEffectExecutor(platform, delayed);
        this.commands = new CommandRouter(
                settings, platform, gate, counters, strikes, suggestions, tickets,
                new MembershipReview(platform), effects, audit
        );
        AtomicInteger threadIndex = new AtomicInteger();
        this.workers = Executors.newFixedThreadPool(settings.workerThreads(), r -> {
            Thread t = new Thread(r, "guildflow-worker-" + threadIndex.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        log.info("Engine ready: store={}, workers={}", config.storeDir(), settings.workerThreads());
    }

    public Future<?> submit(PlatformEvent event) {
        return workers.submit(() -> dispatch(event));
    }

    // Never throws: a failing event is logged and dropped.
    public void dispatch(PlatformEvent event) {
        try {
            if (event instanceof PlatformEvent.MessagePosted posted) {
                onMessage(posted.channel(), posted.message());
            } else if (event instanceof PlatformEvent.CommandInvoked invoked) {
                commands.route(invoked.invocation());
            } else if (event instanceof PlatformEvent.MemberJoined joined) {
                greet(joined.member(), "👋 Welcome, " + joined.member().mention() + "! Thanks for joining our server.");
            } else if (event instanceof PlatformEvent.MemberLeft left) {
                greet(left.member(), "👋 " + left.member().displayName() + " has left the server. See you soon!");
            } else if (event instanceof PlatformEvent.ReactionAdded reaction) {
                log.debug("Reaction {} by {} on message {}", reaction.emoji(), reaction.actor().id(), reaction.messageId());
            } else {
                log.warn("Unsupported event type: {}", event.getClass().getSimpleName());
            }
        } catch (RuntimeException e) {
            Member actor = event.actor();
            log.error("Event {} from {} in channel {} failed: {}",
                    event.getClass().getSimpleName(), actor == null ? "-" : actor.id(), event.channelId(), e.getMessage(), e);
        }
    }

    private void onMessage(Channel channel, ChatMessage message) {
        if (message.author().bot()) {
            return;
        }
        ContentDecision decision = gate.contentAllowed(channel, message);
        if (!decision.allowed()) {
            reject(channel, message, decision);
            return;
        }
        if (settings.isMonitored(channel.id())) {
            counters.recordMessage(channel.id())
                    .ifPresent(fired -> remind(channel, fired, settings.reminderMessage()));
            return;
        }
        if (!gate.isCommand(message.content())) {
            counters.recordHelpCandidate()
                    .ifPresent(fired -> remind(channel, fired, settings.helpMessage()));
        }
    }

    private void reject(Channel channel, ChatMessage message, ContentDecision decision) {
        String notice = decision == ContentDecision.COMMANDS_ONLY ? Replies.COMMANDS_ONLY : Replies.TICKET_STAFF_ONLY;
        List<SideEffect> remedial = new ArrayList<>();
        remedial.add(new SideEffect.DeleteMessage(channel.id(), message.id()));
        remedial.add(new SideEffect.SendTransient(channel.id(), OutboundMessage.embed(new OutboundMessage.Embed(
                "⚠️ Message not allowed",
                message.author().mention() + " " + notice,
                0xff9900,
                null,
                null
        )), settings.warningTtl()));
        effects.executeAll(remedial);
        log.info("Removed message {} from {} in {}: {}", message.id(), message.author().name(), channel.name(), decision);
        audit.log(new AuditLogger.AuditEvent(
                "message.reject",
                message.author().name() + "#" + message.author().id(),
                "channel:" + channel.id(),
                decision.name(),
                Map.of("message_id", message.id())
        ));
    }

    private void remind(Channel channel, FireReminder fired, String text) {
        log.info("Counter {} reached {}, reminding in {}", fired.counter(), fired.threshold(), channel.name());
        effects.execute(new SideEffect.SendMessage(channel.id(), OutboundMessage.text(text)));
    }

    private void greet(Member member, String text) {
        if (member.bot()) {
            return;
        }
        Optional<Channel> welcome = settings.welcomeChannelId() > 0L
                ? platform.findChannel(settings.welcomeChannelId())
                : Optional.empty();
        if (welcome.isEmpty()) {
            log.error("Welcome channel {} not found, greeting for {} skipped", settings.welcomeChannelId(), member.id());
            return;
        }
        effects.execute(new SideEffect.SendMessage(welcome.get().id(), OutboundMessage.text(text)));
    }

    public BotSettings settings() {
        return settings;
    }

    public CounterService counters() {
        return counters;
    }

    public StrikeLedger strikes() {
        return strikes;
    }

    public SuggestionWorkflow suggestions() {
        return suggestions;
    }

    public TicketWorkflow tickets() {
        return tickets;
    }

    public AccessGate gate() {
        return gate;
    }

    public CommandRouter commands() {
        return commands;
    }

    public AuditLogger audit() {
        return audit;
    }

    @Override
    public void close() {
        workers.shutdown();
        try {
            if (!workers.awaitTermination(10, TimeUnit.SECONDS)) {
                log.warn("Workers did not finish within 10s, forcing shutdown");
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
        delayed.close();
    }
}
